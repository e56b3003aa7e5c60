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
 * Thrown when the translator meets a source tree shape it has no lowering rule for. The error has
 * already been reported to the {@link ErrorManager} when this is thrown; translation of the
 * current file stops.
 */
public final class InternalTranslatorError extends RuntimeException {
  private final TranslationError error;

  InternalTranslatorError(TranslationError error) {
    super("INTERNAL TRANSLATOR ERROR.\nPlease report this problem.\n\n" + error);
    this.error = error;
  }

  public TranslationError getError() {
    return error;
  }
}
