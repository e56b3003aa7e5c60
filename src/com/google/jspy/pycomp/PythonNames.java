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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;

/** Rewrites source identifiers into valid target identifiers. */
public final class PythonNames {

  private PythonNames() {}

  /** Source names with a fixed target spelling. */
  private static final ImmutableMap<String, String> RENAMES =
      ImmutableMap.of(
          "this", "self",
          "async", "asyncio");

  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "await", "break", "class", "continue",
          "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if",
          "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
          "while", "with", "yield");

  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .precomputed();

  private static final Pattern VALID_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Returns the target spelling of {@code name}: reserved names are mapped, keywords get a
   * trailing underscore and characters that cannot appear in an identifier, such as {@code $} and
   * {@code .}, become underscores.
   */
  public static String clean(String name) {
    String renamed = RENAMES.get(name);
    if (renamed != null) {
      return renamed;
    }
    if (KEYWORDS.contains(name)) {
      return name + "_";
    }
    String cleaned = IDENTIFIER_CHARS.negate().replaceFrom(name, '_');
    if (!cleaned.isEmpty() && CharMatcher.inRange('0', '9').matches(cleaned.charAt(0))) {
      cleaned = "_" + cleaned;
    }
    return cleaned;
  }

  public static boolean isValidIdentifier(String name) {
    return VALID_IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
  }
}
