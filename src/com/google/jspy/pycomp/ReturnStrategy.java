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

/**
 * Where a translated statement list ends up, which decides how it is completed.
 *
 * <ul>
 *   <li>{@link #RETURN}: the tail of a function body. An empty body becomes a bare {@code return}.
 *   <li>{@link #NO_RETURN}: a nested block, or a body that must not produce a value. An empty
 *       block becomes {@code pass}.
 *   <li>{@link #NO_BREAK}: the body of a switch case flattened into an if/else chain. Everything
 *       from the first {@code break} on is dropped; otherwise as {@link #NO_RETURN}.
 * </ul>
 */
public enum ReturnStrategy {
  RETURN,
  NO_RETURN,
  NO_BREAK
}
