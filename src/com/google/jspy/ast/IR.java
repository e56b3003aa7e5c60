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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.ClassMember.ClassMethod;
import com.google.jspy.ast.ClassMember.ClassProperty;
import com.google.jspy.ast.ClassMember.MethodKind;
import com.google.jspy.ast.Expression.Identifier;
import com.google.jspy.ast.Expression.StringLiteral;
import com.google.jspy.ast.ObjectMember.ObjectMethod;
import com.google.jspy.ast.ObjectMember.ObjectProperty;
import com.google.jspy.ast.Pattern.AssignmentPattern;
import com.google.jspy.ast.Pattern.RestElement;
import com.google.jspy.ast.Statement.Block;
import com.google.jspy.ast.Statement.CatchClause;
import com.google.jspy.ast.Statement.SwitchCase;
import com.google.jspy.ast.Statement.VariableDeclaration;
import com.google.jspy.ast.Statement.VariableDeclarator;
import com.google.jspy.ast.Statement.VariableKind;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A source tree construction helper class. Nodes built here carry no source location.
 */
public final class IR {

  private IR() {}

  // Expressions

  public static Identifier name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return new Identifier(name, null);
  }

  public static Expression number(double value) {
    return new Expression.NumericLiteral(value, null);
  }

  public static StringLiteral string(String value) {
    return new StringLiteral(value, null);
  }

  public static Expression trueNode() {
    return new Expression.BooleanLiteral(true, null);
  }

  public static Expression falseNode() {
    return new Expression.BooleanLiteral(false, null);
  }

  public static Expression nullNode() {
    return new Expression.NullLiteral(null);
  }

  public static Expression thisNode() {
    return new Expression.This(null);
  }

  public static Expression superNode() {
    return new Expression.Super(null);
  }

  public static Expression binary(String operator, Expression left, Expression right) {
    return new Expression.Binary(operator, left, right, null);
  }

  public static Expression eq(Expression left, Expression right) {
    return binary("===", left, right);
  }

  public static Expression add(Expression left, Expression right) {
    return binary("+", left, right);
  }

  public static Expression unary(String operator, Expression argument) {
    return new Expression.Unary(operator, argument, null);
  }

  public static Expression not(Expression argument) {
    return unary("!", argument);
  }

  public static Expression voidNode(Expression argument) {
    return unary("void", argument);
  }

  public static Expression and(Expression left, Expression right) {
    return new Expression.Logical("&&", left, right, null);
  }

  public static Expression or(Expression left, Expression right) {
    return new Expression.Logical("||", left, right, null);
  }

  public static Expression assign(Expression target, Expression value) {
    return assign("=", target, value);
  }

  public static Expression assign(String operator, Expression target, Expression value) {
    return new Expression.Assignment(operator, target, value, null);
  }

  public static Expression inc(Expression argument, boolean prefix) {
    return new Expression.Update("++", prefix, argument, null);
  }

  public static Expression dec(Expression argument, boolean prefix) {
    return new Expression.Update("--", prefix, argument, null);
  }

  public static Expression call(Expression callee, Expression... args) {
    return new Expression.Call(callee, ImmutableList.copyOf(args), null);
  }

  public static Expression newNode(Expression callee, Expression... args) {
    return new Expression.New(callee, ImmutableList.copyOf(args), null);
  }

  /** {@code target.name} */
  public static Expression getprop(Expression target, String name) {
    return new Expression.Member(target, name(name), false, null);
  }

  /** {@code target[key]} */
  public static Expression getelem(Expression target, Expression key) {
    return new Expression.Member(target, key, true, null);
  }

  public static Expression arraylit(Expression... elements) {
    return new Expression.ArrayLiteral(ImmutableList.copyOf(elements), null);
  }

  public static Expression objectlit(ObjectMember... members) {
    return new Expression.ObjectLiteral(ImmutableList.copyOf(members), null);
  }

  /** A non-computed {@code key: value} property. */
  public static ObjectMember propdef(String key, Expression value) {
    return new ObjectProperty(name(key), value, false, null);
  }

  public static ObjectMember computedProp(Expression key, Expression value) {
    return new ObjectProperty(key, value, true, null);
  }

  public static ObjectMember objectMethod(String key, List<? extends Pattern> params, Block body) {
    return new ObjectMethod(name(key), ImmutableList.copyOf(params), body, false, null);
  }

  public static Expression arrowFunction(List<? extends Pattern> params, Block body) {
    return new Expression.ArrowFunction(ImmutableList.copyOf(params), body, null);
  }

  public static Expression function(
      @Nullable Identifier name, List<? extends Pattern> params, Block body) {
    return new Expression.FunctionExpression(name, ImmutableList.copyOf(params), body, null);
  }

  public static Expression hook(Expression test, Expression consequent, Expression alternate) {
    return new Expression.Conditional(test, consequent, alternate, null);
  }

  public static Expression comma(Expression... expressions) {
    return new Expression.Sequence(ImmutableList.copyOf(expressions), null);
  }

  public static Expression emit(String macro, Expression... args) {
    return new Expression.Emit(macro, ImmutableList.copyOf(args), null);
  }

  // Patterns

  public static ImmutableList<Pattern> paramList(String... names) {
    ImmutableList.Builder<Pattern> params = ImmutableList.builder();
    for (String name : names) {
      params.add(name(name));
    }
    return params.build();
  }

  public static Pattern rest(String name) {
    return new RestElement(name(name), null);
  }

  public static Pattern defaultValue(String name, Expression value) {
    return new AssignmentPattern(name(name), value, null);
  }

  // Statements

  public static Block block(Statement... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Block block(List<? extends Statement> stmts) {
    return new Block(ImmutableList.copyOf(stmts), null);
  }

  public static Statement returnNode() {
    return new Statement.Return(null, null);
  }

  public static Statement returnNode(Expression expr) {
    return new Statement.Return(expr, null);
  }

  public static Statement exprResult(Expression expr) {
    return new Statement.ExpressionStatement(expr, null);
  }

  public static VariableDeclaration var(String name, @Nullable Expression value) {
    return declaration(VariableKind.VAR, name, value);
  }

  public static VariableDeclaration let(String name, @Nullable Expression value) {
    return declaration(VariableKind.LET, name, value);
  }

  public static VariableDeclaration constNode(String name, Expression value) {
    return declaration(VariableKind.CONST, name, value);
  }

  public static VariableDeclaration declaration(
      VariableKind kind, String name, @Nullable Expression value) {
    return declaration(kind, new VariableDeclarator(name(name), value));
  }

  public static VariableDeclaration declaration(
      VariableKind kind, VariableDeclarator... declarators) {
    checkArgument(declarators.length > 0, "a declaration needs at least one declarator");
    return new VariableDeclaration(kind, ImmutableList.copyOf(declarators), null);
  }

  public static VariableDeclarator declarator(String name, @Nullable Expression value) {
    return new VariableDeclarator(name(name), value);
  }

  public static Statement ifNode(Expression cond, Statement then) {
    return new Statement.If(cond, then, null, null);
  }

  public static Statement ifNode(Expression cond, Statement then, Statement elseNode) {
    return new Statement.If(cond, then, elseNode, null);
  }

  public static Statement whileNode(Expression cond, Statement body) {
    return new Statement.While(cond, body, null);
  }

  public static Statement forNode(
      @Nullable VariableDeclaration init,
      @Nullable Expression cond,
      @Nullable Expression incr,
      Statement body) {
    return new Statement.For(init, cond, incr, body, null);
  }

  public static Statement switchNode(Expression cond, SwitchCase... cases) {
    return new Statement.Switch(cond, ImmutableList.copyOf(cases), null);
  }

  public static SwitchCase caseNode(Expression expr, Statement... body) {
    return new SwitchCase(expr, ImmutableList.copyOf(body));
  }

  public static SwitchCase defaultCase(Statement... body) {
    return new SwitchCase(null, ImmutableList.copyOf(body));
  }

  public static Statement label(String name, Statement stmt) {
    return new Statement.Labeled(name(name), stmt, null);
  }

  public static Statement breakNode() {
    return new Statement.Break(null, null);
  }

  public static Statement breakNode(String label) {
    return new Statement.Break(name(label), null);
  }

  public static Statement continueNode() {
    return new Statement.Continue(null, null);
  }

  public static Statement continueNode(String label) {
    return new Statement.Continue(name(label), null);
  }

  public static Statement throwNode(Expression expr) {
    return new Statement.Throw(expr, null);
  }

  public static Statement tryCatch(Block tryBody, @Nullable String catchName, Block catchBody) {
    return new Statement.Try(
        tryBody,
        new CatchClause(catchName == null ? null : name(catchName), catchBody),
        null,
        null);
  }

  public static Statement tryFinally(Block tryBody, Block finallyBody) {
    return new Statement.Try(tryBody, null, finallyBody, null);
  }

  public static Statement tryCatchFinally(
      Block tryBody, String catchName, Block catchBody, Block finallyBody) {
    return new Statement.Try(
        tryBody, new CatchClause(name(catchName), catchBody), finallyBody, null);
  }

  public static Statement functionDeclaration(
      String name, List<? extends Pattern> params, Block body) {
    return new Statement.FunctionDeclaration(
        name(name), ImmutableList.copyOf(params), body, null);
  }

  public static Statement classDeclaration(
      @Nullable String name, @Nullable Expression superClass, ClassMember... members) {
    return new Statement.ClassDeclaration(
        name == null ? null : name(name), superClass, ImmutableList.copyOf(members), null);
  }

  public static ClassMember method(String name, List<? extends Pattern> params, Block body) {
    return new ClassMethod(
        MethodKind.METHOD, name(name), ImmutableList.copyOf(params), body, false, false, null);
  }

  public static ClassMember constructor(List<? extends Pattern> params, Block body) {
    return new ClassMethod(
        MethodKind.CONSTRUCTOR,
        name("constructor"),
        ImmutableList.copyOf(params),
        body,
        false,
        false,
        null);
  }

  public static ClassMember field(String name, @Nullable Expression value) {
    return new ClassProperty(name(name), value, false, null);
  }

  // Modules

  public static ModuleDeclaration importDeclaration(
      String source, ImportSpecifier... specifiers) {
    checkState(!source.isEmpty(), "empty module specifier");
    return new ModuleDeclaration.Import(ImmutableList.copyOf(specifiers), string(source), null);
  }

  public static ImportSpecifier importMember(String imported, String local) {
    return new ImportSpecifier.Member(name(local), name(imported), null);
  }

  public static ImportSpecifier importDefault(String local) {
    return new ImportSpecifier.Default(name(local), null);
  }

  public static ImportSpecifier importStar(String local) {
    return new ImportSpecifier.Namespace(name(local), null);
  }

  public static ModuleDeclaration export(Statement declaration) {
    checkState(
        declaration.getKind() == Statement.Kind.VARIABLE_DECLARATION
            || declaration.getKind() == Statement.Kind.FUNCTION_DECLARATION
            || declaration.getKind() == Statement.Kind.CLASS_DECLARATION,
        "Cannot export %s",
        declaration.getKind());
    return new ModuleDeclaration.ExportNamed(declaration, null);
  }

  public static ModuleDeclaration privateDeclaration(Statement stmt) {
    return new ModuleDeclaration.Private(stmt, null);
  }

  public static Program script(String sourceName, ModuleDeclaration... declarations) {
    return new Program(sourceName, ImmutableList.copyOf(declarations));
  }
}
