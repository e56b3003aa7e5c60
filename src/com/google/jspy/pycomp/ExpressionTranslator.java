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
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.ObjectMember;
import com.google.jspy.ast.Pattern;
import com.google.jspy.ast.Statement;
import com.google.jspy.pyast.Arguments;
import com.google.jspy.pyast.BoolOperator;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import com.google.jspy.pyast.UnaryOperator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates source expressions into target expressions.
 *
 * <p>The target has no statement-shaped expressions, so every operand is translated into a {@code
 * prelude} of statements that run first and the expression that yields the value. Operands are
 * visited left to right, which keeps the preludes in source evaluation order. Constructs whose body
 * needs statements, such as multi-statement closures and sequences, are lifted into a function
 * definition in the prelude and replaced by a reference to it.
 */
final class ExpressionTranslator {
  private static final Logger logger = Logger.getLogger(ExpressionTranslator.class.getName());

  static final String TEMP_PREFIX = "tmp";

  private final PythonTranslator translator;

  ExpressionTranslator(PythonTranslator translator) {
    this.translator = translator;
  }

  ExprWithPrelude translate(TranslationContext ctx, Expression expr) {
    ImmutableList.Builder<PyStmt> prelude = ImmutableList.builder();
    PyExpr result = visit(ctx, expr, prelude);
    return ExprWithPrelude.of(result, prelude.build());
  }

  PyExpr visit(TranslationContext ctx, Expression expr, ImmutableList.Builder<PyStmt> prelude) {
    return switch (expr.getKind()) {
      case IDENTIFIER -> PyIR.name(PythonNames.clean(((Expression.Identifier) expr).name()));
      case NUMERIC_LITERAL -> PyIR.number(((Expression.NumericLiteral) expr).value());
      case STRING_LITERAL -> PyIR.constant(((Expression.StringLiteral) expr).value());
      case BOOLEAN_LITERAL -> PyIR.constant(((Expression.BooleanLiteral) expr).value());
      case NULL_LITERAL -> PyIR.none();
      case BINARY -> visitBinary(ctx, (Expression.Binary) expr, prelude);
      case UNARY -> visitUnary(ctx, (Expression.Unary) expr, prelude);
      case LOGICAL -> visitLogical(ctx, (Expression.Logical) expr, prelude);
      case ASSIGNMENT -> visitAssignment(ctx, (Expression.Assignment) expr, prelude);
      case UPDATE -> visitUpdate(ctx, (Expression.Update) expr, prelude);
      case CALL -> {
        Expression.Call call = (Expression.Call) expr;
        yield visitCall(ctx, call.callee(), call.arguments(), prelude);
      }
      case NEW -> {
        Expression.New newExpr = (Expression.New) expr;
        yield visitCall(ctx, newExpr.callee(), newExpr.arguments(), prelude);
      }
      case MEMBER -> visitMember(ctx, (Expression.Member) expr, prelude);
      case ARRAY ->
          new PyExpr.Tuple(visitAll(ctx, ((Expression.ArrayLiteral) expr).elements(), prelude));
      case OBJECT -> visitObjectLiteral(ctx, (Expression.ObjectLiteral) expr, prelude);
      case ARROW_FUNCTION -> visitArrowFunction(ctx, (Expression.ArrowFunction) expr, prelude);
      case FUNCTION -> visitFunctionExpression(ctx, (Expression.FunctionExpression) expr, prelude);
      case CONDITIONAL -> {
        Expression.Conditional conditional = (Expression.Conditional) expr;
        PyExpr test = visit(ctx, conditional.test(), prelude);
        PyExpr body = visit(ctx, conditional.consequent(), prelude);
        PyExpr orelse = visit(ctx, conditional.alternate(), prelude);
        yield PyIR.ifExp(test, body, orelse);
      }
      case SEQUENCE -> visitSequence(ctx, (Expression.Sequence) expr, prelude);
      case THIS -> PyIR.name("self");
      case SUPER ->
          throw translator.internalError(
              TranslatorErrors.UNSUPPORTED_EXPRESSION,
              expr.location(),
              "super outside of a call or member access");
      case EMIT -> visitEmit(ctx, (Expression.Emit) expr, prelude);
    };
  }

  private ImmutableList<PyExpr> visitAll(
      TranslationContext ctx,
      List<? extends Expression> exprs,
      ImmutableList.Builder<PyStmt> prelude) {
    ImmutableList.Builder<PyExpr> result = ImmutableList.builder();
    for (Expression expr : exprs) {
      result.add(visit(ctx, expr, prelude));
    }
    return result.build();
  }

  private PyExpr visitBinary(
      TranslationContext ctx, Expression.Binary binary, ImmutableList.Builder<PyStmt> prelude) {
    PyExpr left = visit(ctx, binary.left(), prelude);
    PyExpr right = visit(ctx, binary.right(), prelude);
    PyExpr result = OperatorTable.binary(binary.operator(), left, right);
    if (result == null) {
      throw translator.internalError(
          TranslatorErrors.UNKNOWN_OPERATOR, binary.location(), "binary", binary.operator());
    }
    return result;
  }

  private PyExpr visitUnary(
      TranslationContext ctx, Expression.Unary unary, ImmutableList.Builder<PyStmt> prelude) {
    PyExpr operand = visit(ctx, unary.argument(), prelude);
    if (unary.operator().equals("void")) {
      PyStmt effect = PyIR.exprStmt(operand);
      if (BodyNormalizer.isProductive(effect)) {
        prelude.add(effect);
      }
      return PyIR.none();
    }
    UnaryOperator op = OperatorTable.UNARY_OPERATORS.get(unary.operator());
    if (op == null) {
      throw translator.internalError(
          TranslatorErrors.UNKNOWN_OPERATOR, unary.location(), "unary", unary.operator());
    }
    return PyIR.unaryOp(op, operand);
  }

  /**
   * The right operand is only evaluated when the left one does not decide the result. If the right
   * operand needs a prelude, it is lifted into a function that is called in its place.
   */
  private PyExpr visitLogical(
      TranslationContext ctx, Expression.Logical logical, ImmutableList.Builder<PyStmt> prelude) {
    BoolOperator op = OperatorTable.LOGICAL_OPERATORS.get(logical.operator());
    if (op == null) {
      throw translator.internalError(
          TranslatorErrors.UNKNOWN_OPERATOR, logical.location(), "logical", logical.operator());
    }
    PyExpr left = visit(ctx, logical.left(), prelude);
    ExprWithPrelude right = translate(ctx, logical.right());
    PyExpr rightValue = right.expression();
    if (right.hasPrelude()) {
      Identifier name = translator.createSyntheticName(translator.getLiftedFunctionPrefix());
      logger.fine("Lifting right operand of " + logical.operator() + " into " + name);
      prelude.add(
          PyIR.functionDef(
              name,
              PyIR.arguments(),
              right.thenStatement(PyIR.returnNode(right.expression()))));
      rightValue = PyIR.call(PyIR.name(name));
    }
    return PyIR.boolOp(op, left, rightValue);
  }

  /** Hoists the assignment into the prelude. */
  private PyExpr visitAssignment(
      TranslationContext ctx,
      Expression.Assignment assignment,
      ImmutableList.Builder<PyStmt> prelude) {
    return translator.getStatementTranslator().translateAssignmentValue(ctx, assignment, prelude);
  }

  /**
   * A prefix update is hoisted and yields the updated target; a postfix update first saves the
   * old value into a temporary, which is the result.
   */
  private PyExpr visitUpdate(
      TranslationContext ctx, Expression.Update update, ImmutableList.Builder<PyStmt> prelude) {
    StatementTranslator statements = translator.getStatementTranslator();
    if (update.prefix()) {
      return visitAssignment(ctx, statements.toAssignment(update), prelude);
    }
    return statements.translatePostfixUpdate(ctx, update, prelude);
  }

  private PyExpr visitCall(
      TranslationContext ctx,
      Expression callee,
      List<Expression> arguments,
      ImmutableList.Builder<PyStmt> prelude) {
    PyExpr func;
    if (callee.getKind() == Expression.Kind.SUPER) {
      func = PyIR.attribute(PyIR.call("super"), "__init__");
    } else {
      func = visit(ctx, callee, prelude);
    }
    return PyIR.call(func, visitAll(ctx, arguments, prelude));
  }

  private PyExpr visitMember(
      TranslationContext ctx, Expression.Member member, ImmutableList.Builder<PyStmt> prelude) {
    PyExpr object = visitMemberObject(ctx, member, prelude);
    if (member.computed()) {
      Expression property = member.property();
      return switch (property.getKind()) {
        case NUMERIC_LITERAL ->
            PyIR.subscript(object, PyIR.number(((Expression.NumericLiteral) property).value()));
        case STRING_LITERAL ->
            PyIR.call(
                "getattr", object, PyIR.constant(((Expression.StringLiteral) property).value()));
        case BOOLEAN_LITERAL, NULL_LITERAL ->
            throw translator.internalError(
                TranslatorErrors.UNKNOWN_LITERAL_KIND,
                property.location(),
                property.getKind().toString());
        default -> PyIR.subscript(object, visit(ctx, property, prelude));
      };
    }
    String name = memberName(member);
    PyExpr intrinsic = IntrinsicMembers.rewrite(object, name);
    if (intrinsic != null) {
      return intrinsic;
    }
    return PyIR.attribute(object, PythonNames.clean(name));
  }

  /** Translates the receiver of a member access, resolving {@code super} and {@code Math}. */
  private PyExpr visitMemberObject(
      TranslationContext ctx, Expression.Member member, ImmutableList.Builder<PyStmt> prelude) {
    Expression object = member.object();
    if (object.getKind() == Expression.Kind.SUPER) {
      return PyIR.call("super");
    }
    if (object instanceof Expression.Identifier id && id.name().equals("Math")) {
      Optional<Identifier> math =
          translator.getImportReference(ctx, "*", "math", member.location());
      if (math.isPresent()) {
        return PyIR.name(math.get());
      }
    }
    return visit(ctx, object, prelude);
  }

  private String memberName(Expression.Member member) {
    if (!(member.property() instanceof Expression.Identifier property)) {
      throw translator.internalError(
          TranslatorErrors.UNSUPPORTED_EXPRESSION,
          member.location(),
          "member access with a " + member.property().getKind() + " property");
    }
    return property.name();
  }

  private PyExpr visitObjectLiteral(
      TranslationContext ctx,
      Expression.ObjectLiteral literal,
      ImmutableList.Builder<PyStmt> prelude) {
    ImmutableList.Builder<PyExpr> keys = ImmutableList.builder();
    ImmutableList.Builder<PyExpr> values = ImmutableList.builder();
    for (ObjectMember member : literal.properties()) {
      keys.add(visitPropertyKey(ctx, member, prelude));
      switch (member.getKind()) {
        case PROPERTY:
          values.add(visit(ctx, ((ObjectMember.ObjectProperty) member).value(), prelude));
          break;
        case METHOD:
          ObjectMember.ObjectMethod method = (ObjectMember.ObjectMethod) member;
          PyStmt.FunctionDef def =
              translator
                  .getFunctionTranslator()
                  .lift(ctx, method.params(), method.body(), /* placeholder= */ false);
          prelude.add(def);
          values.add(PyIR.name(def.name()));
          break;
      }
    }
    return PyIR.dict(keys.build(), values.build());
  }

  private PyExpr visitPropertyKey(
      TranslationContext ctx, ObjectMember member, ImmutableList.Builder<PyStmt> prelude) {
    Expression key = member.key();
    if (!member.computed() && key instanceof Expression.Identifier id) {
      return PyIR.constant(id.name());
    }
    return visit(ctx, key, prelude);
  }

  /**
   * An arrow function whose body is a single return becomes a lambda; any other body is lifted
   * into a function definition.
   */
  private PyExpr visitArrowFunction(
      TranslationContext ctx,
      Expression.ArrowFunction arrow,
      ImmutableList.Builder<PyStmt> prelude) {
    ImmutableList<Statement> body = arrow.body().body();
    if (body.size() == 1 && body.get(0) instanceof Statement.Return ret) {
      return visitClosure(ctx, arrow.params(), ret.argument(), prelude);
    }
    return liftInto(ctx, arrow.params(), arrow.body(), prelude);
  }

  /**
   * Anonymous function expressions with a single return or expression statement become lambdas.
   * Named ones are always lifted under their own name so that they can refer to themselves.
   */
  private PyExpr visitFunctionExpression(
      TranslationContext ctx,
      Expression.FunctionExpression function,
      ImmutableList.Builder<PyStmt> prelude) {
    if (function.id() != null) {
      PyStmt.FunctionDef def =
          translator
              .getFunctionTranslator()
              .translateFunction(ctx, function.id(), function.params(), function.body());
      prelude.add(def);
      return PyIR.name(def.name());
    }
    ImmutableList<Statement> body = function.body().body();
    if (body.size() == 1 && body.get(0) instanceof Statement.Return ret) {
      return visitClosure(ctx, function.params(), ret.argument(), prelude);
    }
    if (body.size() == 1 && body.get(0) instanceof Statement.ExpressionStatement stmt) {
      return visitClosure(ctx, function.params(), stmt.expression(), prelude);
    }
    return liftInto(ctx, function.params(), function.body(), prelude);
  }

  /**
   * Translates a closure returning {@code value} into a lambda. If the value needs a prelude, which
   * must run on each call rather than once when the closure is created, the closure is lifted into
   * a function definition running the prelude and returning the value.
   */
  private PyExpr visitClosure(
      TranslationContext ctx,
      List<Pattern> params,
      @Nullable Expression value,
      ImmutableList.Builder<PyStmt> prelude) {
    FunctionTranslator functions = translator.getFunctionTranslator();
    TranslationContext closureCtx = ctx.withTailCallOpportunity(null);
    if (!FunctionTranslator.hasConstantDefaults(params)) {
      Statement body =
          value == null
              ? new Statement.Return(null, null)
              : new Statement.Return(value, value.location());
      return liftInto(ctx, params, new Statement.Block(ImmutableList.of(body), null), prelude);
    }
    Arguments args =
        functions.translateParams(closureCtx, params, /* placeholder= */ true, /* self= */ false);
    ExprWithPrelude body =
        value == null ? ExprWithPrelude.of(PyIR.none()) : translate(closureCtx, value);
    if (!body.hasPrelude()) {
      return PyIR.lambda(args, body.expression());
    }
    Identifier name = translator.createSyntheticName(translator.getLiftedFunctionPrefix());
    logger.fine("Lifting closure with a prelude into " + name);
    prelude.add(
        PyIR.functionDef(name, args, body.thenStatement(PyIR.returnNode(body.expression()))));
    return PyIR.name(name);
  }

  private PyExpr liftInto(
      TranslationContext ctx,
      List<Pattern> params,
      Statement.Block body,
      ImmutableList.Builder<PyStmt> prelude) {
    PyStmt.FunctionDef def =
        translator.getFunctionTranslator().lift(ctx, params, body, /* placeholder= */ true);
    prelude.add(def);
    return PyIR.name(def.name());
  }

  /**
   * Lifts the sequence into a function without parameters that evaluates every element but the
   * last for its effects and returns the last, and calls it.
   */
  private PyExpr visitSequence(
      TranslationContext ctx, Expression.Sequence sequence, ImmutableList.Builder<PyStmt> prelude) {
    TranslationContext bodyCtx = ctx.withTailCallOpportunity(null);
    StatementTranslator statements = translator.getStatementTranslator();
    ImmutableList<Expression> exprs = sequence.expressions();
    ImmutableList.Builder<PyStmt> body = ImmutableList.builder();
    for (Expression expr : exprs.subList(0, exprs.size() - 1)) {
      body.addAll(statements.translateExpressionStatement(bodyCtx, expr));
    }
    ExprWithPrelude last = translate(bodyCtx, exprs.get(exprs.size() - 1));
    body.addAll(last.thenStatement(PyIR.returnNode(last.expression())));

    Identifier name = translator.createSyntheticName(translator.getLiftedFunctionPrefix());
    logger.fine("Lifting sequence expression into " + name);
    prelude.add(
        PyIR.functionDef(
            name, PyIR.arguments(), BodyNormalizer.normalize(ReturnStrategy.RETURN, body.build())));
    return PyIR.call(PyIR.name(name));
  }

  private PyExpr visitEmit(
      TranslationContext ctx, Expression.Emit emit, ImmutableList.Builder<PyStmt> prelude) {
    ImmutableList<PyExpr> args = visitAll(ctx, emit.args(), prelude);
    if (emit.macro().equals("void $0") && args.size() == 1) {
      return args.get(0);
    }
    return new PyExpr.Emit(emit.macro(), args);
  }
}
