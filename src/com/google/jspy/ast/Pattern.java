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

/**
 * A binding pattern in a parameter list. Destructuring patterns are desugared by the front end, so
 * every pattern binds exactly one name.
 */
public interface Pattern extends Node {

  Kind getPatternKind();

  /** The name this pattern binds. */
  Identifier binding();

  /** The closed set of pattern shapes. */
  enum Kind {
    IDENTIFIER,
    REST_ELEMENT,
    ASSIGNMENT
  }

  /** {@code ...args} */
  record RestElement(Identifier argument, @Nullable SourceLocation location) implements Pattern {
    @Override
    public Kind getPatternKind() {
      return Kind.REST_ELEMENT;
    }

    @Override
    public Identifier binding() {
      return argument;
    }
  }

  /** A parameter with a default value, {@code a = 1}. */
  record AssignmentPattern(Identifier left, Expression right, @Nullable SourceLocation location)
      implements Pattern {
    @Override
    public Kind getPatternKind() {
      return Kind.ASSIGNMENT;
    }

    @Override
    public Identifier binding() {
      return left;
    }
  }
}
