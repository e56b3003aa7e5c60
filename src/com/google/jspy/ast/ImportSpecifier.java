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

import com.google.jspy.ast.Expression.Identifier;
import org.jspecify.annotations.Nullable;

/** One binding introduced by an import declaration. */
public interface ImportSpecifier extends Node {

  Kind getKind();

  /** The local name the import is bound to. */
  Identifier local();

  enum Kind {
    MEMBER,
    DEFAULT,
    NAMESPACE
  }

  /** {@code import { imported as local } from "..."} */
  record Member(Identifier local, Identifier imported, @Nullable SourceLocation location)
      implements ImportSpecifier {
    @Override
    public Kind getKind() {
      return Kind.MEMBER;
    }
  }

  /** {@code import local from "..."} */
  record Default(Identifier local, @Nullable SourceLocation location) implements ImportSpecifier {
    @Override
    public Kind getKind() {
      return Kind.DEFAULT;
    }
  }

  /** {@code import * as local from "..."} */
  record Namespace(Identifier local, @Nullable SourceLocation location)
      implements ImportSpecifier {
    @Override
    public Kind getKind() {
      return Kind.NAMESPACE;
    }
  }
}
