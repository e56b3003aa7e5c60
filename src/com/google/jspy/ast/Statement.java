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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Expression.Identifier;
import org.jspecify.annotations.Nullable;

/** A statement of the source tree. */
public interface Statement extends Node {

  Kind getKind();

  /** The closed set of statement shapes. */
  enum Kind {
    BLOCK,
    RETURN,
    VARIABLE_DECLARATION,
    EXPRESSION,
    IF,
    WHILE,
    FOR,
    TRY,
    SWITCH,
    BREAK,
    CONTINUE,
    LABELED,
    THROW,
    FUNCTION_DECLARATION,
    CLASS_DECLARATION
  }

  /** Declaration keyword of a {@link VariableDeclaration}. */
  enum VariableKind {
    VAR,
    LET,
    CONST
  }

  record Block(ImmutableList<Statement> body, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.BLOCK;
    }
  }

  /** {@code return;} has a null argument. */
  record Return(@Nullable Expression argument, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.RETURN;
    }
  }

  record VariableDeclarator(Identifier id, @Nullable Expression init) {
    public VariableDeclarator {
      requireNonNull(id, "id");
    }
  }

  record VariableDeclaration(
      VariableKind variableKind,
      ImmutableList<VariableDeclarator> declarations,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.VARIABLE_DECLARATION;
    }
  }

  record ExpressionStatement(Expression expression, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.EXPRESSION;
    }
  }

  record If(
      Expression test,
      Statement consequent,
      @Nullable Statement alternate,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.IF;
    }
  }

  record While(Expression test, Statement body, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.WHILE;
    }
  }

  record For(
      @Nullable VariableDeclaration init,
      @Nullable Expression test,
      @Nullable Expression update,
      Statement body,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.FOR;
    }
  }

  /** {@code catch {}} without a binding has a null param. */
  record CatchClause(@Nullable Identifier param, Block body) {}

  record Try(
      Block block,
      @Nullable CatchClause handler,
      @Nullable Block finalizer,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.TRY;
    }
  }

  /** A {@code case} clause; {@code default} has a null test. */
  record SwitchCase(@Nullable Expression test, ImmutableList<Statement> consequent) {
    public boolean isDefault() {
      return test == null;
    }
  }

  record Switch(
      Expression discriminant, ImmutableList<SwitchCase> cases, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.SWITCH;
    }
  }

  record Break(@Nullable Identifier label, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.BREAK;
    }
  }

  record Continue(@Nullable Identifier label, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.CONTINUE;
    }
  }

  record Labeled(Identifier label, Statement body, @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.LABELED;
    }
  }

  record Throw(Expression argument, @Nullable SourceLocation location) implements Statement {
    @Override
    public Kind getKind() {
      return Kind.THROW;
    }
  }

  record FunctionDeclaration(
      Identifier id,
      ImmutableList<Pattern> params,
      Block body,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.FUNCTION_DECLARATION;
    }
  }

  record ClassDeclaration(
      @Nullable Identifier id,
      @Nullable Expression superClass,
      ImmutableList<ClassMember> body,
      @Nullable SourceLocation location)
      implements Statement {
    @Override
    public Kind getKind() {
      return Kind.CLASS_DECLARATION;
    }
  }
}
