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
import com.google.jspy.ast.Expression;

/**
 * A function whose self-recursive tail calls can be rewritten into a loop: the parameters are
 * re-assigned and control continues at the top of the loop wrapping the body.
 */
public interface TailCallOpportunity {

  /** The name of the function. */
  String getLabel();

  /** The target names of the parameters, in order. */
  ImmutableList<String> getArgs();

  /** Whether {@code callee} refers to the function itself. */
  boolean isRecursiveRef(Expression callee);

  /** Records that a tail call was rewritten, so the function body must be wrapped in a loop. */
  void optimizeTailCall();
}
