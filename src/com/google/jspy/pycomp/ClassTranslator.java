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

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.ClassMember;
import com.google.jspy.ast.ClassMember.ClassMethod;
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.SourceLocation;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds target class definitions. Only constructors and instance methods are supported; the
 * constructor becomes {@code __init__}.
 */
final class ClassTranslator {

  static final String INITIALIZER = "__init__";

  private final PythonTranslator translator;

  ClassTranslator(PythonTranslator translator) {
    this.translator = translator;
  }

  ImmutableList<PyStmt> translateClass(
      TranslationContext ctx,
      List<ClassMember> members,
      Expression.@Nullable Identifier id,
      @Nullable Expression superClass,
      @Nullable SourceLocation location) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    ImmutableList<PyExpr> bases = ImmutableList.of();
    if (superClass != null) {
      bases =
          ImmutableList.of(
              translator.getExpressionTranslator().translate(ctx, superClass).drainInto(result));
    }

    ImmutableList.Builder<PyStmt> body = ImmutableList.builder();
    for (ClassMember member : members) {
      switch (member.getKind()) {
        case METHOD:
          body.add(translateMethod(ctx, (ClassMethod) member));
          break;
        case PROPERTY:
          throw translator.internalError(
              TranslatorErrors.UNSUPPORTED_CLASS_MEMBER,
              member.location(),
              "field " + describeKey(((ClassMember.ClassProperty) member).key()));
      }
    }
    ImmutableList<PyStmt> classBody = body.build();
    if (classBody.isEmpty()) {
      classBody = ImmutableList.of(PyIR.pass());
    }

    Identifier name =
        id == null
            ? translator.createSyntheticName(translator.getLiftedFunctionPrefix())
            : new Identifier(PythonNames.clean(id.name()));
    result.add(PyIR.classDef(name, bases, classBody));
    return result.build();
  }

  private PyStmt translateMethod(TranslationContext ctx, ClassMethod method) {
    if (method.isStatic()) {
      throw unsupported(method, "static method");
    }
    FunctionTranslator functions = translator.getFunctionTranslator();
    return switch (method.methodKind()) {
      case CONSTRUCTOR ->
          functions.translateMethod(
              ctx,
              new Identifier(INITIALIZER),
              method.params(),
              method.body(),
              ReturnStrategy.NO_RETURN);
      case METHOD ->
          functions.translateMethod(
              ctx, methodName(method), method.params(), method.body(), ReturnStrategy.RETURN);
      case GET -> throw unsupported(method, "getter");
      case SET -> throw unsupported(method, "setter");
    };
  }

  private Identifier methodName(ClassMethod method) {
    Expression key = method.key();
    if (key instanceof Expression.Identifier id && !method.computed()) {
      return new Identifier(PythonNames.clean(id.name()));
    }
    if (key instanceof Expression.StringLiteral literal) {
      return new Identifier(PythonNames.clean(literal.value()));
    }
    throw unsupported(method, "method with a " + key.getKind() + " key");
  }

  private InternalTranslatorError unsupported(ClassMethod method, String what) {
    return translator.internalError(
        TranslatorErrors.UNSUPPORTED_CLASS_MEMBER,
        method.location(),
        what + " " + describeKey(method.key()));
  }

  private static String describeKey(Expression key) {
    if (key instanceof Expression.Identifier id) {
      return id.name();
    }
    if (key instanceof Expression.StringLiteral literal) {
      return literal.value();
    }
    return key.getKind().toString();
  }
}
