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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.jspy.pyast.BoolOperator;
import com.google.jspy.pyast.ComparisonOperator;
import com.google.jspy.pyast.Operator;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.UnaryOperator;
import org.jspecify.annotations.Nullable;

/** Maps source operator tokens to target operators. */
final class OperatorTable {

  private OperatorTable() {}

  static final ImmutableMap<String, Operator> BINARY_OPERATORS =
      ImmutableMap.<String, Operator>builder()
          .put("+", Operator.ADD)
          .put("-", Operator.SUB)
          .put("*", Operator.MULT)
          .put("/", Operator.DIV)
          .put("%", Operator.MOD)
          .put("**", Operator.POW)
          .put("<<", Operator.LSHIFT)
          .put(">>", Operator.RSHIFT)
          .put("|", Operator.BIT_OR)
          .put("^", Operator.BIT_XOR)
          .put("&", Operator.BIT_AND)
          .buildOrThrow();

  static final ImmutableMap<String, ComparisonOperator> COMPARISON_OPERATORS =
      ImmutableMap.<String, ComparisonOperator>builder()
          .put("==", ComparisonOperator.EQ)
          .put("===", ComparisonOperator.EQ)
          .put("!=", ComparisonOperator.NOT_EQ)
          .put("!==", ComparisonOperator.NOT_EQ)
          .put(">", ComparisonOperator.GT)
          .put(">=", ComparisonOperator.GT_E)
          .put("<", ComparisonOperator.LT)
          .put("<=", ComparisonOperator.LT_E)
          .put("in", ComparisonOperator.IN)
          .buildOrThrow();

  /** Operators lowered to a call of the {@code isinstance} builtin. */
  static final ImmutableSet<String> TYPE_TESTS = ImmutableSet.of("instanceof", "isinstance");

  static final ImmutableMap<String, UnaryOperator> UNARY_OPERATORS =
      ImmutableMap.of(
          "-", UnaryOperator.USUB,
          "+", UnaryOperator.UADD,
          "~", UnaryOperator.INVERT,
          "!", UnaryOperator.NOT);

  static final ImmutableMap<String, BoolOperator> LOGICAL_OPERATORS =
      ImmutableMap.of("&&", BoolOperator.AND, "||", BoolOperator.OR);

  /** Returns the translation of {@code left op right}, or null if {@code op} is unknown. */
  static @Nullable PyExpr binary(String op, PyExpr left, PyExpr right) {
    Operator operator = BINARY_OPERATORS.get(op);
    if (operator != null) {
      return PyIR.binOp(left, operator, right);
    }
    ComparisonOperator comparison = COMPARISON_OPERATORS.get(op);
    if (comparison != null) {
      return PyIR.compare(left, comparison, right);
    }
    if (TYPE_TESTS.contains(op)) {
      return PyIR.call("isinstance", left, right);
    }
    return null;
  }

  /**
   * Returns the arithmetic operator of a compound assignment such as {@code +=}, or null if {@code
   * op} is not one.
   */
  static @Nullable Operator compoundAssignment(String op) {
    if (op.length() < 2 || !op.endsWith("=")) {
      return null;
    }
    return BINARY_OPERATORS.get(op.substring(0, op.length() - 1));
  }
}
