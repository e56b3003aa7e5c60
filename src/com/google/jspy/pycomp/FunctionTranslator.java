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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.Pattern;
import com.google.jspy.ast.Statement;
import com.google.jspy.ast.Statement.Block;
import com.google.jspy.pyast.Arg;
import com.google.jspy.pyast.Arguments;
import com.google.jspy.pyast.ComparisonOperator;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import java.util.List;
import java.util.logging.Logger;

/** Builds target function definitions from source functions, closures and methods. */
final class FunctionTranslator {
  private static final Logger logger = Logger.getLogger(FunctionTranslator.class.getName());

  /** The parameter given to closures without parameters, so they can be called uniformly. */
  static final String PLACEHOLDER_PARAM = "_";

  private final PythonTranslator translator;

  FunctionTranslator(PythonTranslator translator) {
    this.translator = translator;
  }

  /**
   * The translated parameter list, plus the statements that evaluate non-constant parameter
   * defaults on entry.
   */
  record Signature(Arguments arguments, ImmutableList<PyStmt> prologue) {}

  /**
   * Translates a named function. When enabled, a function that returns calls of itself with all of
   * its parameters is rewritten so that those calls re-assign the parameters and loop.
   */
  PyStmt.FunctionDef translateFunction(
      TranslationContext ctx, Expression.Identifier id, List<Pattern> params, Block body) {
    Identifier name = new Identifier(PythonNames.clean(id.name()));
    Signature signature =
        translateSignature(ctx, params, /* placeholder= */ false, /* self= */ false);
    SelfTailCall opportunity = null;
    if (translator.getOptions().isTailCallOptimization()
        && !hasRestParam(params)
        && !isShadowed(name.name(), signature.arguments(), body)) {
      opportunity = new SelfTailCall(id.name(), argNames(signature.arguments()));
    }
    TranslationContext bodyCtx = ctx.withTailCallOpportunity(opportunity);
    ImmutableList<PyStmt> stmts =
        BodyNormalizer.normalize(
            ReturnStrategy.RETURN,
            translator
                .getStatementTranslator()
                .translateStatements(bodyCtx, ReturnStrategy.RETURN, body.body()));
    if (opportunity != null && opportunity.optimized) {
      logger.fine("Function " + name + " is tail call optimized");
      stmts = wrapInLoop(stmts);
    }
    return PyIR.functionDef(
        name,
        signature.arguments(),
        ImmutableList.<PyStmt>builder().addAll(signature.prologue()).addAll(stmts).build());
  }

  /**
   * Loops over the body until it returns. Falling off the end of the body returns instead of
   * looping again.
   */
  private static ImmutableList<PyStmt> wrapInLoop(ImmutableList<PyStmt> body) {
    ImmutableList<PyStmt> loopBody = body;
    if (!BodyNormalizer.endsInJump(body)) {
      loopBody = ImmutableList.<PyStmt>builder().addAll(body).add(PyIR.returnNode()).build();
    }
    return ImmutableList.of(PyIR.whileNode(PyIR.constant(true), loopBody));
  }

  /** Lifts a closure into a function definition with a fresh name. */
  PyStmt.FunctionDef lift(
      TranslationContext ctx, List<Pattern> params, Block body, boolean placeholder) {
    Identifier name = translator.createSyntheticName(translator.getLiftedFunctionPrefix());
    logger.fine("Lifting closure into " + name);
    return translateBody(
        ctx.withTailCallOpportunity(null),
        name,
        params,
        body,
        placeholder,
        /* self= */ false,
        ReturnStrategy.RETURN);
  }

  /** Translates a method; the instance parameter {@code self} comes first. */
  PyStmt.FunctionDef translateMethod(
      TranslationContext ctx,
      Identifier name,
      List<Pattern> params,
      Block body,
      ReturnStrategy strategy) {
    return translateBody(
        ctx.withTailCallOpportunity(null),
        name,
        params,
        body,
        /* placeholder= */ false,
        /* self= */ true,
        strategy);
  }

  private PyStmt.FunctionDef translateBody(
      TranslationContext ctx,
      Identifier name,
      List<Pattern> params,
      Block body,
      boolean placeholder,
      boolean self,
      ReturnStrategy strategy) {
    Signature signature = translateSignature(ctx, params, placeholder, self);
    ImmutableList<PyStmt> stmts =
        translator.getStatementTranslator().translateStatements(ctx, strategy, body.body());
    return PyIR.functionDef(
        name,
        signature.arguments(),
        BodyNormalizer.normalize(
            strategy,
            ImmutableList.<PyStmt>builder().addAll(signature.prologue()).addAll(stmts).build()));
  }

  /** Translates parameters that are known to have only constant defaults. */
  Arguments translateParams(
      TranslationContext ctx, List<Pattern> params, boolean placeholder, boolean self) {
    Signature signature = translateSignature(ctx, params, placeholder, self);
    checkState(signature.prologue().isEmpty(), "parameter defaults need a prologue");
    return signature.arguments();
  }

  /** Whether all parameter defaults can be evaluated once, when the function is defined. */
  static boolean hasConstantDefaults(List<Pattern> params) {
    for (Pattern param : params) {
      if (param instanceof Pattern.AssignmentPattern assignment
          && !isConstant(assignment.right())) {
        return false;
      }
    }
    return true;
  }

  private static boolean isConstant(Expression expr) {
    return switch (expr.getKind()) {
      case NUMERIC_LITERAL, STRING_LITERAL, BOOLEAN_LITERAL, NULL_LITERAL -> true;
      default -> false;
    };
  }

  /**
   * Translates a parameter list.
   *
   * <p>The first rest parameter becomes the variadic parameter; any further ones are dropped. A
   * constant default becomes a target default. Other defaults are evaluated on each call, like in
   * the source: the parameter defaults to {@code None} and the prologue assigns the default when it
   * is {@code None}. Parameters following one with a default default to {@code None}, since
   * defaults must be trailing in the target.
   */
  Signature translateSignature(
      TranslationContext ctx, List<Pattern> params, boolean placeholder, boolean self) {
    ImmutableList.Builder<Arg> args = ImmutableList.builder();
    ImmutableList.Builder<PyExpr> defaults = ImmutableList.builder();
    ImmutableList.Builder<PyStmt> prologue = ImmutableList.builder();
    Arg vararg = null;
    boolean inDefaults = false;
    if (self) {
      args.add(PyIR.arg("self"));
    }
    for (Pattern param : params) {
      String name = PythonNames.clean(param.binding().name());
      switch (param.getPatternKind()) {
        case IDENTIFIER:
          args.add(PyIR.arg(name));
          if (inDefaults) {
            defaults.add(PyIR.none());
          }
          break;
        case ASSIGNMENT:
          args.add(PyIR.arg(name));
          inDefaults = true;
          Expression value = ((Pattern.AssignmentPattern) param).right();
          if (isConstant(value)) {
            defaults.add(translator.getExpressionTranslator().translate(ctx, value).expression());
          } else {
            defaults.add(PyIR.none());
            ExprWithPrelude init = translator.getExpressionTranslator().translate(ctx, value);
            prologue.add(
                PyIR.ifNode(
                    PyIR.compare(PyIR.name(name), ComparisonOperator.IS, PyIR.none()),
                    init.thenStatement(
                        PyIR.assign(PyIR.storeName(new Identifier(name)), init.expression()))));
          }
          break;
        case REST_ELEMENT:
          if (vararg == null) {
            vararg = PyIR.arg(name);
          } else {
            translator.warnOnlyOnce(
                TranslatorErrors.EXTRA_REST_PARAMETER, param.location(), param.binding().name());
          }
          break;
      }
    }
    ImmutableList<Arg> argList = args.build();
    ImmutableList<PyExpr> defaultList = defaults.build();
    if (placeholder && argList.isEmpty() && vararg == null) {
      argList = ImmutableList.of(PyIR.arg(PLACEHOLDER_PARAM));
      defaultList = ImmutableList.of(PyIR.none());
    }
    return new Signature(new Arguments(argList, vararg, defaultList), prologue.build());
  }

  private static boolean hasRestParam(List<Pattern> params) {
    return params.stream().anyMatch(p -> p.getPatternKind() == Pattern.Kind.REST_ELEMENT);
  }

  /** Whether a parameter or a top-level declaration of the body rebinds the function's name. */
  private static boolean isShadowed(String name, Arguments arguments, Block body) {
    if (argNames(arguments).contains(name)) {
      return true;
    }
    for (Statement stmt : body.body()) {
      if (stmt instanceof Statement.VariableDeclaration declaration) {
        for (Statement.VariableDeclarator declarator : declaration.declarations()) {
          if (PythonNames.clean(declarator.id().name()).equals(name)) {
            return true;
          }
        }
      } else if (stmt instanceof Statement.FunctionDeclaration function) {
        if (PythonNames.clean(function.id().name()).equals(name)) {
          return true;
        }
      } else if (stmt instanceof Statement.ClassDeclaration classDecl
          && classDecl.id() != null
          && PythonNames.clean(classDecl.id().name()).equals(name)) {
        return true;
      }
    }
    return false;
  }

  private static ImmutableList<String> argNames(Arguments arguments) {
    return arguments.args().stream()
        .map(arg -> arg.arg().name())
        .collect(ImmutableList.toImmutableList());
  }

  /** The tail call opportunity of a named function: calls of its own name. */
  private static final class SelfTailCall implements TailCallOpportunity {
    private final String label;
    private final ImmutableList<String> args;
    private boolean optimized = false;

    SelfTailCall(String label, ImmutableList<String> args) {
      this.label = label;
      this.args = args;
    }

    @Override
    public String getLabel() {
      return label;
    }

    @Override
    public ImmutableList<String> getArgs() {
      return args;
    }

    @Override
    public boolean isRecursiveRef(Expression callee) {
      return callee instanceof Expression.Identifier id && id.name().equals(label);
    }

    @Override
    public void optimizeTailCall() {
      optimized = true;
    }
  }
}
