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
package com.google.jspy.pyast;

import org.jspecify.annotations.Nullable;

/** An imported name with its optional local alias, {@code name as asname}. */
public record Alias(Identifier name, @Nullable Identifier asname) {

  /** The name under which the import is visible locally. */
  public Identifier localName() {
    return asname != null ? asname : name;
  }
}
