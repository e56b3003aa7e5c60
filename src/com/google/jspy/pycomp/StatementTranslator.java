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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.SourceLocation;
import com.google.jspy.ast.Statement;
import com.google.jspy.ast.Statement.SwitchCase;
import com.google.jspy.pyast.BoolOperator;
import com.google.jspy.pyast.ComparisonOperator;
import com.google.jspy.pyast.ExceptHandler;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.Operator;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import com.google.jspy.pyast.UnaryOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates source statements into target statements. Owns the reconstruction of control flow
 * the target lacks: switch statements become if/else chains, counting for-loops become loops over
 * a range, and assignments are split by the shape of their target.
 */
final class StatementTranslator {
  private static final Logger logger = Logger.getLogger(StatementTranslator.class.getName());

  private final PythonTranslator translator;

  StatementTranslator(PythonTranslator translator) {
    this.translator = translator;
  }

  private ExpressionTranslator expressions() {
    return translator.getExpressionTranslator();
  }

  ImmutableList<PyStmt> translateStatements(
      TranslationContext ctx, ReturnStrategy strategy, List<Statement> stmts) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    for (Statement stmt : stmts) {
      result.addAll(translate(ctx, strategy, stmt));
    }
    return result.build();
  }

  ImmutableList<PyStmt> translate(
      TranslationContext ctx, ReturnStrategy strategy, Statement stmt) {
    return switch (stmt.getKind()) {
      case BLOCK -> {
        // Only function bodies end in an implicit return; a nested block never does.
        ReturnStrategy blockStrategy =
            strategy == ReturnStrategy.RETURN ? ReturnStrategy.NO_RETURN : strategy;
        yield BodyNormalizer.normalize(
            blockStrategy, translateStatements(ctx, strategy, ((Statement.Block) stmt).body()));
      }
      case RETURN -> translateReturn(ctx, strategy, (Statement.Return) stmt);
      case VARIABLE_DECLARATION ->
          translateVariableDeclaration(ctx, (Statement.VariableDeclaration) stmt);
      case EXPRESSION ->
          translateExpressionStatement(ctx, ((Statement.ExpressionStatement) stmt).expression());
      case IF -> translateIf(ctx, strategy, (Statement.If) stmt);
      case WHILE -> translateWhile(ctx, strategy, (Statement.While) stmt);
      case FOR -> translateFor(ctx, strategy, (Statement.For) stmt);
      case TRY -> translateTry(ctx, strategy, (Statement.Try) stmt);
      case SWITCH -> translateSwitch(ctx, (Statement.Switch) stmt);
      case BREAK -> {
        Statement.Break breakStmt = (Statement.Break) stmt;
        warnIfLabeled("break", breakStmt.label(), breakStmt.location());
        yield ImmutableList.of(PyIR.breakNode());
      }
      case CONTINUE -> {
        Statement.Continue continueStmt = (Statement.Continue) stmt;
        warnIfLabeled("continue", continueStmt.label(), continueStmt.location());
        yield ImmutableList.of(PyIR.continueNode());
      }
      case LABELED -> translate(ctx, strategy, ((Statement.Labeled) stmt).body());
      case THROW -> {
        ExprWithPrelude exc = expressions().translate(ctx, ((Statement.Throw) stmt).argument());
        yield exc.thenStatement(PyIR.raise(exc.expression()));
      }
      case FUNCTION_DECLARATION -> {
        Statement.FunctionDeclaration function = (Statement.FunctionDeclaration) stmt;
        yield ImmutableList.<PyStmt>of(
            translator
                .getFunctionTranslator()
                .translateFunction(ctx, function.id(), function.params(), function.body()));
      }
      case CLASS_DECLARATION -> {
        Statement.ClassDeclaration classDecl = (Statement.ClassDeclaration) stmt;
        yield translator
            .getClassTranslator()
            .translateClass(
                ctx,
                classDecl.body(),
                classDecl.id(),
                classDecl.superClass(),
                classDecl.location());
      }
    };
  }

  private void warnIfLabeled(
      String keyword, Expression.@Nullable Identifier label, @Nullable SourceLocation location) {
    if (label != null) {
      translator.warnOnlyOnce(TranslatorErrors.LABELED_JUMP, location, keyword, label.name());
    }
  }

  /**
   * Translates a return. Where no value may be produced, the value is evaluated for its effects
   * instead. A return of a self-recursive tail call becomes a re-assignment of the parameters and
   * a {@code continue} of the loop wrapping the function body.
   */
  private ImmutableList<PyStmt> translateReturn(
      TranslationContext ctx, ReturnStrategy strategy, Statement.Return ret) {
    Expression argument = ret.argument();
    if (argument == null) {
      return ImmutableList.of(PyIR.returnNode());
    }
    TailCallOpportunity opportunity = ctx.tailCallOpportunity();
    if (opportunity != null
        && strategy != ReturnStrategy.NO_RETURN
        && argument instanceof Expression.Call call
        && opportunity.isRecursiveRef(call.callee())
        && call.arguments().size() == opportunity.getArgs().size()) {
      return translateTailCall(ctx, opportunity, call);
    }
    ExprWithPrelude value = expressions().translate(ctx, argument);
    if (strategy == ReturnStrategy.NO_RETURN) {
      return value.thenStatement(PyIR.exprStmt(value.expression()));
    }
    return value.thenStatement(PyIR.returnNode(value.expression()));
  }

  private ImmutableList<PyStmt> translateTailCall(
      TranslationContext ctx, TailCallOpportunity opportunity, Expression.Call call) {
    logger.fine("Rewriting tail call of " + opportunity.getLabel() + " into a loop iteration");
    opportunity.optimizeTailCall();
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    ImmutableList.Builder<PyExpr> targets = ImmutableList.builder();
    ImmutableList.Builder<PyExpr> values = ImmutableList.builder();
    for (int i = 0; i < call.arguments().size(); i++) {
      targets.add(PyIR.storeName(new Identifier(opportunity.getArgs().get(i))));
      values.add(expressions().translate(ctx, call.arguments().get(i)).drainInto(result));
    }
    ImmutableList<PyExpr> targetList = targets.build();
    ImmutableList<PyExpr> valueList = values.build();
    if (targetList.size() == 1) {
      result.add(PyIR.assign(targetList.get(0), valueList.get(0)));
    } else if (!targetList.isEmpty()) {
      result.add(PyIR.assign(new PyExpr.Tuple(targetList), new PyExpr.Tuple(valueList)));
    }
    result.add(PyIR.continueNode());
    return result.build();
  }

  private ImmutableList<PyStmt> translateVariableDeclaration(
      TranslationContext ctx, Statement.VariableDeclaration declaration) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    for (Statement.VariableDeclarator declarator : declaration.declarations()) {
      String name = declarator.id().name();
      PyExpr target = PyIR.storeName(new Identifier(PythonNames.clean(name)));
      if (declarator.init() != null) {
        PyExpr value = expressions().translate(ctx, declarator.init()).drainInto(result);
        result.add(PyIR.assign(target, value));
      } else if (ctx.hoistVars().test(name)) {
        result.add(PyIR.assign(target, PyIR.none()));
      }
    }
    return result.build();
  }

  /**
   * Translates an expression evaluated for its effects. Assignments and updates go through {@link
   * #translateAssignment}, since the target has assignment statements but no assignment
   * expressions.
   */
  ImmutableList<PyStmt> translateExpressionStatement(TranslationContext ctx, Expression expr) {
    if (expr instanceof Expression.Assignment assignment) {
      return translateAssignment(ctx, assignment);
    }
    if (expr instanceof Expression.Update update) {
      return translateAssignment(ctx, toAssignment(update));
    }
    ExprWithPrelude value = expressions().translate(ctx, expr);
    return value.thenStatement(PyIR.exprStmt(value.expression()));
  }

  /** Rewrites {@code x++} and {@code --x} into {@code x += 1} and {@code x -= 1}. */
  Expression.Assignment toAssignment(Expression.Update update) {
    String operator =
        switch (update.operator()) {
          case "++" -> "+=";
          case "--" -> "-=";
          default ->
              throw translator.internalError(
                  TranslatorErrors.UNKNOWN_OPERATOR,
                  update.location(),
                  "update",
                  update.operator());
        };
    return new Expression.Assignment(
        operator,
        update.argument(),
        new Expression.NumericLiteral(1, update.location()),
        update.location());
  }

  /**
   * Translates an assignment by the shape of its target:
   *
   * <ul>
   *   <li>{@code obj["key"] = v} becomes {@code setattr(obj, "key", v)}
   *   <li>{@code x = v} becomes {@code x = v}
   *   <li>{@code obj.x = v} becomes {@code obj.x = v}
   * </ul>
   *
   * A compound assignment {@code t op= v} is translated as {@code t = t op v}. The receiver is
   * evaluated once, before the value.
   */
  ImmutableList<PyStmt> translateAssignment(
      TranslationContext ctx, Expression.Assignment assignment) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    lowerAssignment(ctx, assignment, result, /* needsValue= */ false);
    return result.build();
  }

  /**
   * Translates an assignment in expression position into {@code prelude} and returns its value. A
   * name target is read back; for any other target the assigned value is returned, bound to a
   * temporary unless it is a name or a constant.
   */
  PyExpr translateAssignmentValue(
      TranslationContext ctx,
      Expression.Assignment assignment,
      ImmutableList.Builder<PyStmt> prelude) {
    return requireNonNull(lowerAssignment(ctx, assignment, prelude, /* needsValue= */ true));
  }

  /**
   * Translates {@code t++} or {@code t--} in expression position into {@code prelude}. The old
   * value is saved into a temporary, which is the result.
   */
  PyExpr translatePostfixUpdate(
      TranslationContext ctx, Expression.Update update, ImmutableList.Builder<PyStmt> prelude) {
    Expression.Assignment assignment = toAssignment(update);
    Operator op = compoundOperator(assignment);
    AssignmentTarget target = bindReceiver(resolveTarget(ctx, update.argument(), prelude), prelude);
    Identifier oldValue = translator.createSyntheticName(ExpressionTranslator.TEMP_PREFIX);
    prelude.add(PyIR.assign(PyIR.storeName(oldValue), target.load()));
    prelude.add(target.store(PyIR.binOp(target.load(), op, PyIR.constant(1))));
    return PyIR.name(oldValue);
  }

  private @Nullable PyExpr lowerAssignment(
      TranslationContext ctx,
      Expression.Assignment assignment,
      ImmutableList.Builder<PyStmt> result,
      boolean needsValue) {
    Operator compound =
        assignment.operator().equals("=") ? null : compoundOperator(assignment);
    AssignmentTarget target = resolveTarget(ctx, assignment.left(), result);
    ExprWithPrelude right = expressions().translate(ctx, assignment.right());
    // The target evaluates its receiver after the value, so a receiver that could observe the
    // value's effects, or is read again, is bound first.
    if (compound != null || right.hasPrelude() || !isSimple(right.expression())) {
      target = bindReceiver(target, result);
    }
    PyExpr value = right.drainInto(result);
    if (compound != null) {
      value = PyIR.binOp(target.load(), compound, value);
    }
    if (needsValue && target.shape() != TargetShape.NAME) {
      value = bindToTemp(value, result);
    }
    result.add(target.store(value));
    if (!needsValue) {
      return null;
    }
    return target.shape() == TargetShape.NAME ? target.load() : value;
  }

  private Operator compoundOperator(Expression.Assignment assignment) {
    Operator compound = OperatorTable.compoundAssignment(assignment.operator());
    if (compound == null) {
      throw translator.internalError(
          TranslatorErrors.UNKNOWN_OPERATOR,
          assignment.location(),
          "assignment",
          assignment.operator());
    }
    return compound;
  }

  private AssignmentTarget resolveTarget(
      TranslationContext ctx, Expression left, ImmutableList.Builder<PyStmt> result) {
    if (left instanceof Expression.Identifier id) {
      return new AssignmentTarget(TargetShape.NAME, null, PythonNames.clean(id.name()));
    }
    if (left instanceof Expression.Member member) {
      if (member.computed() && member.property() instanceof Expression.StringLiteral key) {
        PyExpr object = expressions().translate(ctx, member.object()).drainInto(result);
        return new AssignmentTarget(TargetShape.STRING_KEY, object, key.value());
      }
      if (!member.computed() && member.property() instanceof Expression.Identifier property) {
        PyExpr object = expressions().translate(ctx, member.object()).drainInto(result);
        return new AssignmentTarget(
            TargetShape.ATTRIBUTE, object, PythonNames.clean(property.name()));
      }
    }
    throw translator.internalError(
        TranslatorErrors.INVALID_ASSIGNMENT_TARGET, left.location(), describe(left));
  }

  private AssignmentTarget bindReceiver(
      AssignmentTarget target, ImmutableList.Builder<PyStmt> result) {
    if (target.object() == null) {
      return target;
    }
    return new AssignmentTarget(
        target.shape(), bindToTemp(target.object(), result), target.name());
  }

  /** Evaluates {@code value} into a temporary unless it is a name or a constant. */
  private PyExpr bindToTemp(PyExpr value, ImmutableList.Builder<PyStmt> result) {
    if (isSimple(value)) {
      return value;
    }
    Identifier temp = translator.createSyntheticName(ExpressionTranslator.TEMP_PREFIX);
    result.add(PyIR.assign(PyIR.storeName(temp), value));
    return PyIR.name(temp);
  }

  private static boolean isSimple(PyExpr expr) {
    return expr instanceof PyExpr.Name || expr instanceof PyExpr.Constant;
  }

  private enum TargetShape {
    NAME,
    ATTRIBUTE,
    STRING_KEY
  }

  /** An assignment target. {@code object} is the translated receiver, absent for names. */
  private record AssignmentTarget(TargetShape shape, @Nullable PyExpr object, String name) {
    PyExpr load() {
      switch (shape) {
        case NAME:
          return PyIR.name(name);
        case ATTRIBUTE:
          return PyIR.attribute(requireNonNull(object), name);
        case STRING_KEY:
          return PyIR.call("getattr", requireNonNull(object), PyIR.constant(name));
      }
      throw new AssertionError(shape);
    }

    PyStmt store(PyExpr value) {
      switch (shape) {
        case NAME:
          return PyIR.assign(PyIR.storeName(new Identifier(name)), value);
        case ATTRIBUTE:
          return PyIR.assign(
              PyIR.storeAttribute(requireNonNull(object), new Identifier(name)), value);
        case STRING_KEY:
          return PyIR.exprStmt(
              PyIR.call("setattr", requireNonNull(object), PyIR.constant(name), value));
      }
      throw new AssertionError(shape);
    }
  }

  private static String describe(Expression expr) {
    if (expr instanceof Expression.Member member) {
      return (member.computed() ? "computed " : "")
          + "member access with a "
          + member.property().getKind()
          + " key";
    }
    return expr.getKind().toString();
  }

  /**
   * Translates the body of a branch or loop. Return statements keep the enclosing strategy, while
   * the block itself is completed as a nested block.
   */
  private ImmutableList<PyStmt> translateNested(
      TranslationContext ctx, ReturnStrategy strategy, Statement body) {
    return BodyNormalizer.normalize(ReturnStrategy.NO_RETURN, translate(ctx, strategy, body));
  }

  /** Loop bodies own their {@code break} statements, so they are never stripped there. */
  private static ReturnStrategy loopStrategy(ReturnStrategy strategy) {
    return strategy == ReturnStrategy.NO_BREAK ? ReturnStrategy.RETURN : strategy;
  }

  private ImmutableList<PyStmt> translateIf(
      TranslationContext ctx, ReturnStrategy strategy, Statement.If ifStmt) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    PyExpr test = expressions().translate(ctx, ifStmt.test()).drainInto(result);
    ImmutableList<PyStmt> body = translateNested(ctx, strategy, ifStmt.consequent());
    ImmutableList<PyStmt> orelse =
        ifStmt.alternate() == null
            ? ImmutableList.of()
            : translateNested(ctx, strategy, ifStmt.alternate());
    result.add(PyIR.ifNode(test, body, orelse));
    return result.build();
  }

  /**
   * Translates a while loop. A test that needs a prelude is re-evaluated on every iteration by
   * moving it into the loop: {@code while True: <prelude>; if not <test>: break; <body>}.
   */
  private ImmutableList<PyStmt> translateWhile(
      TranslationContext ctx, ReturnStrategy strategy, Statement.While whileStmt) {
    TranslationContext loopCtx = ctx.withTailCallOpportunity(null);
    ExprWithPrelude test = expressions().translate(ctx, whileStmt.test());
    ImmutableList<PyStmt> body =
        translateNested(loopCtx, loopStrategy(strategy), whileStmt.body());
    if (!test.hasPrelude()) {
      return ImmutableList.of(PyIR.whileNode(test.expression(), body));
    }
    ImmutableList.Builder<PyStmt> loopBody = ImmutableList.builder();
    loopBody.addAll(test.prelude());
    loopBody.add(
        PyIR.ifNode(
            PyIR.unaryOp(UnaryOperator.NOT, test.expression()),
            ImmutableList.of(PyIR.breakNode())));
    body.stream().filter(s -> !(s instanceof PyStmt.Pass)).forEach(loopBody::add);
    return ImmutableList.of(PyIR.whileNode(PyIR.constant(true), loopBody.build()));
  }

  /**
   * Translates a counting loop {@code for (let i = start; i <= stop; i++)} into {@code for i in
   * range(start, stop + 1)}. A {@code <} test and the updates {@code ++i} and {@code i += 1} are
   * accepted as well; any other shape is an error.
   */
  private ImmutableList<PyStmt> translateFor(
      TranslationContext ctx, ReturnStrategy strategy, Statement.For forStmt) {
    Statement.VariableDeclaration init = forStmt.init();
    if (init == null
        || init.declarations().size() != 1
        || init.declarations().get(0).init() == null) {
      throw nonCanonicalFor(forStmt);
    }
    Statement.VariableDeclarator counter = init.declarations().get(0);
    String name = counter.id().name();
    if (!(forStmt.test() instanceof Expression.Binary test)
        || !(test.operator().equals("<=") || test.operator().equals("<"))
        || !isName(test.left(), name)
        || !isUnitIncrement(forStmt.update(), name)) {
      throw nonCanonicalFor(forStmt);
    }

    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    PyExpr start = expressions().translate(ctx, counter.init()).drainInto(result);
    PyExpr stop = expressions().translate(ctx, test.right()).drainInto(result);
    if (test.operator().equals("<=")) {
      // range() excludes its end.
      stop = PyIR.binOp(stop, Operator.ADD, PyIR.constant(1));
    }
    ImmutableList<PyStmt> body =
        translateNested(
            ctx.withTailCallOpportunity(null), loopStrategy(strategy), forStmt.body());
    result.add(
        PyIR.forNode(
            PyIR.storeName(new Identifier(PythonNames.clean(name))),
            PyIR.call("range", start, stop),
            body));
    return result.build();
  }

  private InternalTranslatorError nonCanonicalFor(Statement.For forStmt) {
    return translator.internalError(TranslatorErrors.NON_CANONICAL_FOR_LOOP, forStmt.location());
  }

  private static boolean isName(@Nullable Expression expr, String name) {
    return expr instanceof Expression.Identifier id && id.name().equals(name);
  }

  private static boolean isUnitIncrement(@Nullable Expression update, String name) {
    if (update instanceof Expression.Update increment) {
      return increment.operator().equals("++") && isName(increment.argument(), name);
    }
    if (update instanceof Expression.Assignment assignment) {
      return assignment.operator().equals("+=")
          && isName(assignment.left(), name)
          && assignment.right() instanceof Expression.NumericLiteral step
          && step.value() == 1;
    }
    return false;
  }

  /**
   * Translates try/catch/finally. The catch clause catches every {@code Exception}; the source has
   * no exception types to discriminate on.
   */
  private ImmutableList<PyStmt> translateTry(
      TranslationContext ctx, ReturnStrategy strategy, Statement.Try tryStmt) {
    ImmutableList<PyStmt> body = translateNested(ctx, strategy, tryStmt.block());
    ImmutableList.Builder<ExceptHandler> handlers = ImmutableList.builder();
    Statement.CatchClause handler = tryStmt.handler();
    if (handler != null) {
      translator.warnOnlyOnce(TranslatorErrors.CATCH_TYPE_ERASED, tryStmt.location());
      Identifier name =
          handler.param() == null
              ? null
              : new Identifier(PythonNames.clean(handler.param().name()));
      handlers.add(
          new ExceptHandler(
              PyIR.name("Exception"), name, translateNested(ctx, strategy, handler.body())));
    }
    ImmutableList<PyStmt> finalbody =
        tryStmt.finalizer() == null
            ? ImmutableList.of()
            : translateNested(ctx, strategy, tryStmt.finalizer());
    if (handler == null && finalbody.isEmpty()) {
      throw translator.internalError(
          TranslatorErrors.UNSUPPORTED_STATEMENT, tryStmt.location(), "try without catch");
    }
    return ImmutableList.of(PyIR.tryNode(body, handlers.build(), finalbody));
  }

  /**
   * Translates a switch into an if/else chain, folding the cases from the last one. An empty case
   * falls through, so its test is or-ed into the test of the next non-empty case:
   *
   * <pre>
   * switch (x) { case A: case B: foo(); break; default: bar(); }
   * </pre>
   *
   * becomes
   *
   * <pre>
   * if x == A or x == B:
   *     foo()
   * else:
   *     bar()
   * </pre>
   *
   * The trailing {@code break} of each case is dropped. The default clause becomes the final else.
   */
  private ImmutableList<PyStmt> translateSwitch(
      TranslationContext ctx, Statement.Switch switchStmt) {
    ImmutableList.Builder<PyStmt> result = ImmutableList.builder();
    PyExpr discriminant =
        expressions().translate(ctx, switchStmt.discriminant()).drainInto(result);
    if (translator.getOptions().isBindSwitchDiscriminant()) {
      discriminant = bindToTemp(discriminant, result);
    }

    List<SwitchCase> cases = moveDefaultLast(switchStmt);
    for (int i = 0; i < cases.size() - 1; i++) {
      List<Statement> consequent = cases.get(i).consequent();
      if (!consequent.isEmpty() && !endsInJump(consequent)) {
        translator.warnOnlyOnce(TranslatorErrors.SWITCH_FALLTHROUGH, switchStmt.location());
      }
    }

    // Case tests are evaluated up front, in source order.
    List<PyExpr> tests = new ArrayList<>();
    for (SwitchCase switchCase : cases) {
      tests.add(
          switchCase.isDefault()
              ? null
              : expressions().translate(ctx, switchCase.test()).drainInto(result));
    }

    ImmutableList<PyStmt> chain = ImmutableList.of();
    int i = cases.size() - 1;
    if (i >= 0 && cases.get(i).isDefault()) {
      SwitchCase defaultCase = cases.get(i);
      if (!defaultCase.consequent().isEmpty()) {
        chain = translateCaseBody(ctx, defaultCase);
      }
      i--;
    }
    // Empty cases at the end fall into the default clause or out of the switch.
    while (i >= 0 && cases.get(i).consequent().isEmpty()) {
      i--;
    }
    while (i >= 0) {
      int first = i;
      while (first > 0 && cases.get(first - 1).consequent().isEmpty()) {
        first--;
      }
      ImmutableList.Builder<PyExpr> caseTests = ImmutableList.builder();
      for (int k = first; k <= i; k++) {
        caseTests.add(PyIR.compare(discriminant, ComparisonOperator.EQ, tests.get(k)));
      }
      ImmutableList<PyExpr> testList = caseTests.build();
      PyExpr test =
          testList.size() == 1 ? testList.get(0) : new PyExpr.BoolOp(BoolOperator.OR, testList);
      chain = ImmutableList.of(PyIR.ifNode(test, translateCaseBody(ctx, cases.get(i)), chain));
      i = first - 1;
    }
    result.addAll(chain);
    return result.build();
  }

  private ImmutableList<PyStmt> translateCaseBody(TranslationContext ctx, SwitchCase switchCase) {
    return BodyNormalizer.normalize(
        ReturnStrategy.NO_BREAK,
        translateStatements(ctx, ReturnStrategy.NO_BREAK, switchCase.consequent()));
  }

  /**
   * Returns the cases with the default clause last. A default clause that is not last is moved to
   * the end together with the empty cases falling into it, which requires that it does not fall
   * through itself.
   */
  private List<SwitchCase> moveDefaultLast(Statement.Switch switchStmt) {
    List<SwitchCase> cases = new ArrayList<>(switchStmt.cases());
    int defaultIndex = -1;
    for (int i = 0; i < cases.size(); i++) {
      if (cases.get(i).isDefault()) {
        defaultIndex = i;
      }
    }
    if (defaultIndex < 0 || defaultIndex == cases.size() - 1) {
      return cases;
    }
    SwitchCase defaultCase = cases.get(defaultIndex);
    if (!endsInJump(defaultCase.consequent())) {
      throw translator.internalError(TranslatorErrors.UNSUPPORTED_SWITCH, switchStmt.location());
    }
    int first = defaultIndex;
    while (first > 0 && cases.get(first - 1).consequent().isEmpty()) {
      first--;
    }
    cases.subList(first, defaultIndex + 1).clear();
    cases.add(defaultCase);
    return cases;
  }

  private static boolean endsInJump(List<Statement> stmts) {
    if (stmts.isEmpty()) {
      return false;
    }
    Statement last = stmts.get(stmts.size() - 1);
    if (last instanceof Statement.Block block) {
      return endsInJump(block.body());
    }
    return switch (last.getKind()) {
      case BREAK, CONTINUE, RETURN, THROW -> true;
      default -> false;
    };
  }
}
