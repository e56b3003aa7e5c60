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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An expression of the target tree.
 *
 * <p>There is deliberately no expression that contains statements: anything that needs statements
 * must be placed in front of the expression that uses its result.
 */
public interface PyExpr {

  /**
   * A literal. The value is a {@link String}, {@link Boolean}, {@link Long}, {@link Double}, or
   * null for {@code None}.
   */
  record Constant(@Nullable Object value) implements PyExpr {
    public Constant {
      checkArgument(
          value == null
              || value instanceof String
              || value instanceof Boolean
              || value instanceof Long
              || value instanceof Double,
          "Unexpected constant value: %s",
          value);
    }

    public boolean isNone() {
      return value == null;
    }
  }

  record Name(Identifier id, ExprContext ctx) implements PyExpr {}

  record Attribute(PyExpr value, Identifier attr, ExprContext ctx) implements PyExpr {}

  record Subscript(PyExpr value, PyExpr slice, ExprContext ctx) implements PyExpr {}

  record Call(PyExpr func, ImmutableList<PyExpr> args) implements PyExpr {}

  record BinOp(PyExpr left, Operator op, PyExpr right) implements PyExpr {}

  record UnaryOp(UnaryOperator op, PyExpr operand) implements PyExpr {}

  record BoolOp(BoolOperator op, ImmutableList<PyExpr> values) implements PyExpr {
    public BoolOp {
      checkArgument(values.size() >= 2, "BoolOp needs two or more values");
    }
  }

  /** {@code left op1 c1 op2 c2 ...} */
  record Compare(
      PyExpr left, ImmutableList<ComparisonOperator> ops, ImmutableList<PyExpr> comparators)
      implements PyExpr {
    public Compare {
      checkState(ops.size() == comparators.size(), "ops and comparators differ in length");
    }
  }

  record Tuple(ImmutableList<PyExpr> elts) implements PyExpr {}

  record Dict(ImmutableList<PyExpr> keys, ImmutableList<PyExpr> values) implements PyExpr {
    public Dict {
      checkState(keys.size() == values.size(), "keys and values differ in length");
    }
  }

  record Lambda(Arguments args, PyExpr body) implements PyExpr {}

  /** {@code body if test else orelse} */
  record IfExp(PyExpr test, PyExpr body, PyExpr orelse) implements PyExpr {}

  /** Raw target code; {@code $0}, {@code $1}, ... refer to {@code args}. */
  record Emit(String value, ImmutableList<PyExpr> args) implements PyExpr {}
}
