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
import com.google.jspy.ast.Statement.Block;
import org.jspecify.annotations.Nullable;

/** A member of a class body. */
public interface ClassMember extends Node {

  Kind getKind();

  enum Kind {
    METHOD,
    PROPERTY
  }

  enum MethodKind {
    CONSTRUCTOR,
    METHOD,
    GET,
    SET
  }

  record ClassMethod(
      MethodKind methodKind,
      Expression key,
      ImmutableList<Pattern> params,
      Block body,
      boolean computed,
      boolean isStatic,
      @Nullable SourceLocation location)
      implements ClassMember {
    @Override
    public Kind getKind() {
      return Kind.METHOD;
    }
  }

  /** A class field, {@code x = 1;}. */
  record ClassProperty(
      Expression key,
      @Nullable Expression value,
      boolean isStatic,
      @Nullable SourceLocation location)
      implements ClassMember {
    @Override
    public Kind getKind() {
      return Kind.PROPERTY;
    }
  }
}
