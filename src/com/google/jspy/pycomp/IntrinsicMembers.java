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
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites of non-computed member accesses whose source meaning is a builtin of the target, for
 * example {@code xs.length} to {@code len(xs)}.
 */
final class IntrinsicMembers {

  private IntrinsicMembers() {}

  private static final ImmutableMap<String, UnaryOperator<PyExpr>> REWRITES =
      ImmutableMap.of(
          "length", object -> PyIR.call("len", object),
          "indexOf", object -> PyIR.attribute(object, "index"),
          "message", object -> PyIR.call("str", object));

  /** Returns the rewritten access of {@code member} on {@code object}, or null if there is none. */
  static @Nullable PyExpr rewrite(PyExpr object, String member) {
    UnaryOperator<PyExpr> rewrite = REWRITES.get(member);
    return rewrite == null ? null : rewrite.apply(object);
  }
}
