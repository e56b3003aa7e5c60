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

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Expression.StringLiteral;
import org.jspecify.annotations.Nullable;

/** A top-level item of a module. */
public interface ModuleDeclaration extends Node {

  Kind getKind();

  enum Kind {
    IMPORT,
    EXPORT_NAMED,
    PRIVATE
  }

  record Import(
      ImmutableList<ImportSpecifier> specifiers,
      StringLiteral source,
      @Nullable SourceLocation location)
      implements ModuleDeclaration {
    @Override
    public Kind getKind() {
      return Kind.IMPORT;
    }
  }

  /**
   * {@code export <declaration>}. The declaration is a variable, function or class declaration.
   */
  record ExportNamed(Statement declaration, @Nullable SourceLocation location)
      implements ModuleDeclaration {
    @Override
    public Kind getKind() {
      return Kind.EXPORT_NAMED;
    }
  }

  /** Any other top-level statement. */
  record Private(Statement statement, @Nullable SourceLocation location)
      implements ModuleDeclaration {
    @Override
    public Kind getKind() {
      return Kind.PRIVATE;
    }
  }
}
