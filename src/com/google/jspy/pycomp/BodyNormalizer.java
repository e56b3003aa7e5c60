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
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import java.util.List;

/**
 * Completes a translated statement list for the slot it is installed in. Expression statements
 * without effects are dropped first; the block is then made non-empty as its {@link
 * ReturnStrategy} requires.
 */
final class BodyNormalizer {

  private BodyNormalizer() {}

  static ImmutableList<PyStmt> normalize(ReturnStrategy strategy, List<? extends PyStmt> body) {
    ImmutableList.Builder<PyStmt> productive = ImmutableList.builder();
    for (PyStmt stmt : body) {
      if (strategy == ReturnStrategy.NO_BREAK && stmt instanceof PyStmt.Break) {
        break;
      }
      if (isProductive(stmt)) {
        productive.add(stmt);
      }
    }
    ImmutableList<PyStmt> result = productive.build();
    switch (strategy) {
      case RETURN:
        if (result.stream().allMatch(s -> s instanceof PyStmt.Pass)) {
          return ImmutableList.of(PyIR.returnNode());
        }
        return result;
      case NO_RETURN:
      case NO_BREAK:
        return result.isEmpty() ? ImmutableList.of(PyIR.pass()) : result;
    }
    throw new AssertionError(strategy);
  }

  /**
   * Whether {@code stmt} has an effect. Expression statements of constants, names and empty dicts
   * are left over from source constructs that have no target counterpart, such as {@code void 0}.
   */
  static boolean isProductive(PyStmt stmt) {
    if (!(stmt instanceof PyStmt.Expr expr)) {
      return true;
    }
    PyExpr value = expr.value();
    if (value instanceof PyExpr.Constant || value instanceof PyExpr.Name) {
      return false;
    }
    return !(value instanceof PyExpr.Dict dict) || !dict.keys().isEmpty();
  }

  /** Whether control never continues past {@code body}. */
  static boolean endsInJump(List<? extends PyStmt> body) {
    if (body.isEmpty()) {
      return false;
    }
    PyStmt last = body.get(body.size() - 1);
    return last instanceof PyStmt.Return
        || last instanceof PyStmt.Raise
        || last instanceof PyStmt.Break
        || last instanceof PyStmt.Continue;
  }
}
