/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.jspy.pyast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PyIR}. */
@RunWith(JUnit4.class)
public final class PyIRTest {

  @Test
  public void testIntegralNumbersAreInts() {
    assertThat(PyIR.number(3).value()).isEqualTo(3L);
    assertThat(PyIR.number(-2).value()).isEqualTo(-2L);
  }

  @Test
  public void testOtherNumbersAreFloats() {
    assertThat(PyIR.number(0.5).value()).isEqualTo(0.5);
    assertThat(PyIR.number(-0.0).value()).isEqualTo(-0.0);
    assertThat(PyIR.number(1e300).value()).isEqualTo(1e300);
    assertThat(PyIR.number(Double.NaN).value()).isEqualTo(Double.NaN);
  }

  @Test
  public void testConstantsOnlyHoldLiterals() {
    assertThrows(IllegalArgumentException.class, () -> new PyExpr.Constant(1));
    assertThat(PyIR.none().isNone()).isTrue();
  }

  @Test
  public void testStructuralEquality() {
    assertThat(PyIR.call(PyIR.name("f"), PyIR.constant(1)))
        .isEqualTo(PyIR.call(PyIR.name("f"), ImmutableList.of(PyIR.constant(1))));
    assertThat(PyIR.name("x")).isNotEqualTo(PyIR.storeName(new Identifier("x")));
  }

  @Test
  public void testBlocksMustNotBeEmpty() {
    assertThrows(
        IllegalArgumentException.class,
        () -> PyIR.functionDef(new Identifier("f"), Arguments.empty(), ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> PyIR.ifNode(PyIR.name("x"), ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> PyIR.tryNode(ImmutableList.of(PyIR.pass()), ImmutableList.of(), ImmutableList.of()));
  }

  @Test
  public void testAliasLocalName() {
    assertThat(PyIR.alias("numpy", "np").localName()).isEqualTo(new Identifier("np"));
    assertThat(PyIR.alias("math", null).localName()).isEqualTo(new Identifier("math"));
  }
}
