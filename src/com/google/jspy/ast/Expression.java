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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Statement.Block;
import org.jspecify.annotations.Nullable;

/** An expression of the source tree. */
public interface Expression extends Node {

  Kind getKind();

  /** The closed set of expression shapes. */
  enum Kind {
    IDENTIFIER,
    NUMERIC_LITERAL,
    STRING_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,
    BINARY,
    UNARY,
    LOGICAL,
    ASSIGNMENT,
    UPDATE,
    CALL,
    NEW,
    MEMBER,
    ARRAY,
    OBJECT,
    ARROW_FUNCTION,
    FUNCTION,
    CONDITIONAL,
    SEQUENCE,
    THIS,
    SUPER,
    EMIT
  }

  /** A reference to a binding. Identifiers are also the simplest binding pattern. */
  record Identifier(String name, @Nullable SourceLocation location)
      implements Expression, Pattern {
    public Identifier {
      requireNonNull(name, "name");
    }

    @Override
    public Expression.Kind getKind() {
      return Expression.Kind.IDENTIFIER;
    }

    @Override
    public Pattern.Kind getPatternKind() {
      return Pattern.Kind.IDENTIFIER;
    }

    @Override
    public Identifier binding() {
      return this;
    }
  }

  record NumericLiteral(double value, @Nullable SourceLocation location) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.NUMERIC_LITERAL;
    }
  }

  record StringLiteral(String value, @Nullable SourceLocation location) implements Expression {
    public StringLiteral {
      requireNonNull(value, "value");
    }

    @Override
    public Kind getKind() {
      return Kind.STRING_LITERAL;
    }
  }

  record BooleanLiteral(boolean value, @Nullable SourceLocation location) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.BOOLEAN_LITERAL;
    }
  }

  record NullLiteral(@Nullable SourceLocation location) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.NULL_LITERAL;
    }
  }

  /** Arithmetic, bitwise, equality, ordering and relational operators. */
  record Binary(
      String operator, Expression left, Expression right, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.BINARY;
    }
  }

  record Unary(String operator, Expression argument, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.UNARY;
    }
  }

  /** {@code &&} and {@code ||}. */
  record Logical(
      String operator, Expression left, Expression right, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.LOGICAL;
    }
  }

  /** {@code =} and the compound assignment operators. */
  record Assignment(
      String operator, Expression left, Expression right, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.ASSIGNMENT;
    }
  }

  /** {@code ++} and {@code --}, prefix or postfix. */
  record Update(
      String operator, boolean prefix, Expression argument, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.UPDATE;
    }
  }

  record Call(
      Expression callee, ImmutableList<Expression> arguments, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.CALL;
    }
  }

  record New(
      Expression callee, ImmutableList<Expression> arguments, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.NEW;
    }
  }

  /**
   * Property access. When {@code computed} is false the property is always an {@link Identifier}
   * naming the member ({@code obj.prop}); otherwise it is an arbitrary key expression ({@code
   * obj[key]}).
   */
  record Member(
      Expression object, Expression property, boolean computed, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.MEMBER;
    }
  }

  record ArrayLiteral(ImmutableList<Expression> elements, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.ARRAY;
    }
  }

  record ObjectLiteral(ImmutableList<ObjectMember> properties, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.OBJECT;
    }
  }

  /** An arrow function. The desugared tree always wraps the body in a block. */
  record ArrowFunction(
      ImmutableList<Pattern> params, Block body, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.ARROW_FUNCTION;
    }
  }

  record FunctionExpression(
      @Nullable Identifier id,
      ImmutableList<Pattern> params,
      Block body,
      @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.FUNCTION;
    }
  }

  record Conditional(
      Expression test,
      Expression consequent,
      Expression alternate,
      @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.CONDITIONAL;
    }
  }

  /** The comma operator. */
  record Sequence(ImmutableList<Expression> expressions, @Nullable SourceLocation location)
      implements Expression {
    public Sequence {
      checkArgument(expressions.size() > 1, "a sequence needs at least two expressions");
    }

    @Override
    public Kind getKind() {
      return Kind.SEQUENCE;
    }
  }

  record This(@Nullable SourceLocation location) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.THIS;
    }
  }

  record Super(@Nullable SourceLocation location) implements Expression {
    @Override
    public Kind getKind() {
      return Kind.SUPER;
    }
  }

  /**
   * An escape hatch to the target language: {@code macro} is a code template in which {@code $0},
   * {@code $1}, ... refer to the translated {@code args}.
   */
  record Emit(String macro, ImmutableList<Expression> args, @Nullable SourceLocation location)
      implements Expression {
    @Override
    public Kind getKind() {
      return Kind.EMIT;
    }
  }
}
