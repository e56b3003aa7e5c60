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

import static java.util.Objects.requireNonNull;

import com.google.jspy.ast.SourceLocation;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Translation error or warning description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, if known
 * @param lineno One-indexed line number of the error location, or -1.
 * @param charno Zero-indexed character number of the error location, or -1.
 * @param defaultLevel The level of the diagnostic type.
 */
public record TranslationError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    CheckLevel defaultLevel) {
  public TranslationError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a TranslationError at the given location.
   *
   * @param type The DiagnosticType
   * @param location Where the problem is, or null if unknown
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranslationError make(
      DiagnosticType type, @Nullable SourceLocation location, String... arguments) {
    String description = type.format(arguments);
    if (location == null) {
      return new TranslationError(type, description, null, -1, -1, type.level);
    }
    return new TranslationError(
        type, description, location.sourceName(), location.line(), location.column(), type.level);
  }

  /** Formats the error as {@code source:line:column: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName);
      if (lineno > 0) {
        b.append(':').append(lineno);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
    b.append(level.name().toUpperCase(Locale.ROOT))
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}
