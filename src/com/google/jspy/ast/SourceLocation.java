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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * Position of a node in the original source.
 *
 * @param sourceName Name of the source file
 * @param line One-indexed line number
 * @param column Zero-indexed column number
 * @param identifierName The original identifier name, for source maps
 */
public record SourceLocation(
    String sourceName, int line, int column, @Nullable String identifierName) {
  public SourceLocation {
    requireNonNull(sourceName, "sourceName");
  }

  public static SourceLocation of(String sourceName, int line, int column) {
    return new SourceLocation(sourceName, line, column, null);
  }

  @Override
  public String toString() {
    return sourceName + ":" + line + ":" + column;
  }
}
