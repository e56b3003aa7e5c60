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
package com.google.jspy.ast;

import org.jspecify.annotations.Nullable;

/**
 * Common supertype of every node of the source tree.
 *
 * <p>Source trees are produced by the front end after desugaring and are immutable. Each node
 * family ({@link Expression}, {@link Statement}, {@link ModuleDeclaration}, ...) exposes a closed
 * {@code Kind} enumeration that translators switch over.
 */
public interface Node {

  /** Returns where this node came from, or null for synthesized nodes. */
  @Nullable SourceLocation location();
}
