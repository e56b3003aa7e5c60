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

/** A member of an object literal. */
public interface ObjectMember extends Node {

  Kind getKind();

  Expression key();

  boolean computed();

  enum Kind {
    PROPERTY,
    METHOD
  }

  /** {@code key: value} */
  record ObjectProperty(
      Expression key, Expression value, boolean computed, @Nullable SourceLocation location)
      implements ObjectMember {
    @Override
    public Kind getKind() {
      return Kind.PROPERTY;
    }
  }

  /** {@code key(params) { body }} */
  record ObjectMethod(
      Expression key,
      ImmutableList<Pattern> params,
      Block body,
      boolean computed,
      @Nullable SourceLocation location)
      implements ObjectMember {
    @Override
    public Kind getKind() {
      return Kind.METHOD;
    }
  }
}
