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
package com.google.jspy.pycomp;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyStmt;
import java.util.List;

/**
 * A translated expression together with the statements that must run before it is evaluated.
 *
 * @param expression the value
 * @param prelude statements to run first, in order
 */
public record ExprWithPrelude(PyExpr expression, ImmutableList<PyStmt> prelude) {

  public static ExprWithPrelude of(PyExpr expression) {
    return new ExprWithPrelude(expression, ImmutableList.of());
  }

  public static ExprWithPrelude of(PyExpr expression, List<? extends PyStmt> prelude) {
    return new ExprWithPrelude(expression, ImmutableList.copyOf(prelude));
  }

  public boolean hasPrelude() {
    return !prelude.isEmpty();
  }

  /**
   * Appends the prelude to {@code statements} and returns the expression. Draining the operands of
   * a node left to right keeps the preludes in source evaluation order.
   */
  @CanIgnoreReturnValue
  public PyExpr drainInto(ImmutableList.Builder<PyStmt> statements) {
    statements.addAll(prelude);
    return expression;
  }

  /** Returns the prelude followed by {@code last}. */
  public ImmutableList<PyStmt> thenStatement(PyStmt last) {
    return ImmutableList.<PyStmt>builder().addAll(prelude).add(last).build();
  }
}
