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

/** Diagnostics reported while translating a program. */
public final class TranslatorErrors {

  private TranslatorErrors() {}

  public static final DiagnosticType UNKNOWN_OPERATOR =
      DiagnosticType.error("JSPY_UNKNOWN_OPERATOR", "Unknown {0} operator: {1}");

  public static final DiagnosticType UNSUPPORTED_EXPRESSION =
      DiagnosticType.error("JSPY_UNSUPPORTED_EXPRESSION", "Unsupported expression: {0}");

  public static final DiagnosticType UNSUPPORTED_STATEMENT =
      DiagnosticType.error("JSPY_UNSUPPORTED_STATEMENT", "Unsupported statement: {0}");

  public static final DiagnosticType UNSUPPORTED_CLASS_MEMBER =
      DiagnosticType.error(
          "JSPY_UNSUPPORTED_CLASS_MEMBER",
          "Unsupported class member {0}. Only instance methods and constructors are supported.");

  public static final DiagnosticType NON_CANONICAL_FOR_LOOP =
      DiagnosticType.error(
          "JSPY_NON_CANONICAL_FOR_LOOP",
          "Unsupported for-loop. Only loops of the form"
              + " for (let i = start; i <= stop; i++) can be translated.");

  public static final DiagnosticType INVALID_ASSIGNMENT_TARGET =
      DiagnosticType.error("JSPY_INVALID_ASSIGNMENT_TARGET", "Cannot assign to {0}");

  public static final DiagnosticType UNKNOWN_LITERAL_KIND =
      DiagnosticType.error(
          "JSPY_UNKNOWN_LITERAL_KIND", "Unknown literal kind {0} used as a computed member key");

  public static final DiagnosticType UNSUPPORTED_SWITCH =
      DiagnosticType.error(
          "JSPY_UNSUPPORTED_SWITCH",
          "A default clause that is not the last clause of a switch must end in a jump");

  public static final DiagnosticType IMPORT_MEMBER_PLACEHOLDER =
      DiagnosticType.error(
          "JSPY_IMPORT_MEMBER_PLACEHOLDER",
          "`importMember` must be assigned to a variable (module {0})");

  public static final DiagnosticType EXTRA_REST_PARAMETER =
      DiagnosticType.warning(
          "JSPY_EXTRA_REST_PARAMETER", "Only one rest parameter is supported, dropping ...{0}");

  public static final DiagnosticType LABELED_JUMP =
      DiagnosticType.warning(
          "JSPY_LABELED_JUMP", "Labels are not supported, treating {0} {1} as unlabeled");

  public static final DiagnosticType SWITCH_FALLTHROUGH =
      DiagnosticType.warning(
          "JSPY_SWITCH_FALLTHROUGH",
          "Switch case falls through into the next case; the next case will not run");

  public static final DiagnosticType CATCH_TYPE_ERASED =
      DiagnosticType.warning(
          "JSPY_CATCH_TYPE_ERASED",
          "catch clauses are translated to except Exception, exception types are not checked");
}
