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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.IR;
import com.google.jspy.pyast.Arguments;
import com.google.jspy.pyast.BoolOperator;
import com.google.jspy.pyast.ComparisonOperator;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.Operator;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import com.google.jspy.pyast.UnaryOperator;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ExpressionTranslator}. */
@RunWith(JUnit4.class)
public final class ExpressionTranslatorTest extends TranslatorTestBase {

  private static final PyExpr A = PyIR.name("a");
  private static final PyExpr B = PyIR.name("b");

  private void assertTranslation(Expression source, PyExpr expected) {
    ExprWithPrelude result = translate(source);
    assertThat(result.prelude()).isEmpty();
    assertThat(result.expression()).isEqualTo(expected);
  }

  @Test
  public void testIdentifiersAreCleaned() {
    assertTranslation(IR.name("x"), PyIR.name("x"));
    assertTranslation(IR.name("class"), PyIR.name("class_"));
    assertTranslation(IR.name("$init"), PyIR.name("_init"));
    assertTranslation(IR.name("this"), PyIR.name("self"));
  }

  @Test
  public void testLiterals() {
    assertTranslation(IR.number(1), PyIR.constant(1));
    assertTranslation(IR.number(1.5), new PyExpr.Constant(1.5));
    assertTranslation(IR.string("s"), PyIR.constant("s"));
    assertTranslation(IR.trueNode(), PyIR.constant(true));
    assertTranslation(IR.nullNode(), PyIR.none());
    assertTranslation(IR.thisNode(), PyIR.name("self"));
  }

  @Test
  public void testEveryArithmeticOperator() {
    for (Map.Entry<String, Operator> op : OperatorTable.BINARY_OPERATORS.entrySet()) {
      assertTranslation(
          IR.binary(op.getKey(), IR.name("a"), IR.name("b")), PyIR.binOp(A, op.getValue(), B));
    }
  }

  @Test
  public void testEveryComparisonOperator() {
    for (Map.Entry<String, ComparisonOperator> op :
        OperatorTable.COMPARISON_OPERATORS.entrySet()) {
      assertTranslation(
          IR.binary(op.getKey(), IR.name("a"), IR.name("b")), PyIR.compare(A, op.getValue(), B));
    }
  }

  @Test
  public void testInstanceofIsIsinstanceCall() {
    assertTranslation(
        IR.binary("instanceof", IR.name("a"), IR.name("B")),
        PyIR.call("isinstance", A, PyIR.name("B")));
  }

  @Test
  public void testUnknownBinaryOperator() {
    TranslationError error =
        assertInternalError(
            TranslatorErrors.UNKNOWN_OPERATOR,
            () -> translate(IR.binary(">>>", IR.name("a"), IR.name("b"))));
    assertThat(error.description()).isEqualTo("Unknown binary operator: >>>");
  }

  @Test
  public void testEveryUnaryOperator() {
    for (Map.Entry<String, UnaryOperator> op : OperatorTable.UNARY_OPERATORS.entrySet()) {
      assertTranslation(IR.unary(op.getKey(), IR.name("a")), PyIR.unaryOp(op.getValue(), A));
    }
  }

  @Test
  public void testUnknownUnaryOperator() {
    assertInternalError(
        TranslatorErrors.UNKNOWN_OPERATOR, () -> translate(IR.unary("typeof", IR.name("a"))));
  }

  @Test
  public void testVoid() {
    assertTranslation(IR.voidNode(IR.number(0)), PyIR.none());

    ExprWithPrelude result = translate(IR.voidNode(IR.call(IR.name("f"))));
    assertThat(result.prelude()).containsExactly(PyIR.exprStmt(PyIR.call(PyIR.name("f"))));
    assertThat(result.expression()).isEqualTo(PyIR.none());
  }

  @Test
  public void testLogicalOperators() {
    assertTranslation(
        IR.and(IR.name("a"), IR.name("b")), PyIR.boolOp(BoolOperator.AND, A, B));
    assertTranslation(IR.or(IR.name("a"), IR.name("b")), PyIR.boolOp(BoolOperator.OR, A, B));
  }

  @Test
  public void testLogicalRightOperandWithPreludeIsLifted() {
    ExprWithPrelude result =
        translate(IR.or(IR.name("a"), IR.assign(IR.name("x"), IR.number(1))));

    Identifier lifted = new Identifier("lifted_0");
    Identifier x = new Identifier("x");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments(),
                ImmutableList.of(
                    PyIR.assign(PyIR.storeName(x), PyIR.constant(1)),
                    PyIR.returnNode(PyIR.name(x)))));
    assertThat(result.expression())
        .isEqualTo(PyIR.boolOp(BoolOperator.OR, A, PyIR.call(PyIR.name(lifted))));
  }

  @Test
  public void testIntrinsicMembers() {
    PyExpr xs = PyIR.name("xs");
    assertTranslation(IR.getprop(IR.name("xs"), "length"), PyIR.call("len", xs));
    assertTranslation(IR.getprop(IR.name("xs"), "indexOf"), PyIR.attribute(xs, "index"));
    assertTranslation(IR.getprop(IR.name("e"), "message"), PyIR.call("str", PyIR.name("e")));
  }

  @Test
  public void testMemberAccess() {
    assertTranslation(IR.getprop(IR.name("a"), "b"), PyIR.attribute(A, "b"));
    assertTranslation(IR.getprop(IR.name("a"), "from"), PyIR.attribute(A, "from_"));
  }

  @Test
  public void testComputedMemberAccess() {
    assertTranslation(
        IR.getelem(IR.name("a"), IR.number(0)), PyIR.subscript(A, PyIR.constant(0)));
    assertTranslation(
        IR.getelem(IR.name("a"), IR.string("key")),
        PyIR.call("getattr", A, PyIR.constant("key")));
    assertTranslation(IR.getelem(IR.name("a"), IR.name("b")), PyIR.subscript(A, B));
  }

  @Test
  public void testComputedMemberWithBooleanKey() {
    assertInternalError(
        TranslatorErrors.UNKNOWN_LITERAL_KIND,
        () -> translate(IR.getelem(IR.name("a"), IR.trueNode())));
  }

  @Test
  public void testCallPreludesInEvaluationOrder() {
    ExprWithPrelude result =
        translate(
            IR.call(
                IR.name("f"),
                IR.assign(IR.name("a"), IR.number(1)),
                IR.assign(IR.name("b"), IR.number(2))));

    assertThat(result.prelude())
        .containsExactly(
            PyIR.assign(PyIR.storeName(new Identifier("a")), PyIR.constant(1)),
            PyIR.assign(PyIR.storeName(new Identifier("b")), PyIR.constant(2)))
        .inOrder();
    assertThat(result.expression()).isEqualTo(PyIR.call(PyIR.name("f"), A, B));
  }

  @Test
  public void testNewIsPlainCall() {
    assertTranslation(
        IR.newNode(IR.name("Foo"), IR.number(1)),
        PyIR.call(PyIR.name("Foo"), PyIR.constant(1)));
  }

  @Test
  public void testSuper() {
    assertTranslation(
        IR.call(IR.superNode(), IR.name("a")),
        PyIR.call(PyIR.attribute(PyIR.call("super"), "__init__"), A));
    assertTranslation(
        IR.getprop(IR.superNode(), "m"), PyIR.attribute(PyIR.call("super"), "m"));
  }

  @Test
  public void testBareSuper() {
    assertInternalError(TranslatorErrors.UNSUPPORTED_EXPRESSION, () -> translate(IR.superNode()));
  }

  @Test
  public void testMathIsImported() {
    assertTranslation(
        IR.call(IR.getprop(IR.name("Math"), "floor"), IR.name("a")),
        PyIR.call(PyIR.attribute(PyIR.name("math"), "floor"), A));
    assertThat(translator.getAllImports())
        .containsExactly(PyIR.importNode(PyIR.alias("math", null)));
  }

  @Test
  public void testArrayIsTuple() {
    assertTranslation(
        IR.arraylit(IR.number(1), IR.name("a")), PyIR.tuple(PyIR.constant(1), A));
  }

  @Test
  public void testObjectLiteral() {
    assertTranslation(
        IR.objectlit(
            IR.propdef("a", IR.number(1)), IR.computedProp(IR.string("b c"), IR.number(2))),
        PyIR.dict(
            ImmutableList.of(PyIR.constant("a"), PyIR.constant("b c")),
            ImmutableList.of(PyIR.constant(1), PyIR.constant(2))));
  }

  @Test
  public void testObjectMethodIsAlwaysLifted() {
    ExprWithPrelude result =
        translate(
            IR.objectlit(
                IR.objectMethod(
                    "m", IR.paramList("x"), IR.block(IR.returnNode(IR.name("x"))))));

    Identifier lifted = new Identifier("lifted_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments("x"),
                ImmutableList.of(PyIR.returnNode(PyIR.name("x")))));
    assertThat(result.expression())
        .isEqualTo(
            PyIR.dict(ImmutableList.of(PyIR.constant("m")), ImmutableList.of(PyIR.name(lifted))));
  }

  @Test
  public void testArrowWithSingleReturnIsLambda() {
    assertTranslation(
        IR.arrowFunction(
            IR.paramList("x"), IR.block(IR.returnNode(IR.add(IR.name("x"), IR.number(1))))),
        PyIR.lambda(
            PyIR.arguments("x"), PyIR.binOp(PyIR.name("x"), Operator.ADD, PyIR.constant(1))));
  }

  @Test
  public void testArrowWithoutParametersGetsPlaceholder() {
    assertTranslation(
        IR.arrowFunction(ImmutableList.of(), IR.block(IR.returnNode(IR.number(1)))),
        PyIR.lambda(
            new Arguments(
                ImmutableList.of(PyIR.arg("_")), null, ImmutableList.of(PyIR.none())),
            PyIR.constant(1)));
  }

  @Test
  public void testArrowWithStatementsIsLifted() {
    ExprWithPrelude result =
        translate(
            IR.arrowFunction(
                IR.paramList("x"),
                IR.block(
                    IR.exprResult(IR.call(IR.name("f"), IR.name("x"))),
                    IR.returnNode(IR.name("x")))));

    Identifier lifted = new Identifier("lifted_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments("x"),
                ImmutableList.of(
                    PyIR.exprStmt(PyIR.call(PyIR.name("f"), PyIR.name("x"))),
                    PyIR.returnNode(PyIR.name("x")))));
    assertThat(result.expression()).isEqualTo(PyIR.name(lifted));
  }

  @Test
  public void testArrowReturningValueWithPreludeIsLifted() {
    ExprWithPrelude result =
        translate(
            IR.arrowFunction(
                IR.paramList("x"),
                IR.block(IR.returnNode(IR.assign(IR.name("y"), IR.name("x"))))));

    Identifier lifted = new Identifier("lifted_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments("x"),
                ImmutableList.of(
                    PyIR.assign(PyIR.storeName(new Identifier("y")), PyIR.name("x")),
                    PyIR.returnNode(PyIR.name("y")))));
    assertThat(result.expression()).isEqualTo(PyIR.name(lifted));
  }

  @Test
  public void testFunctionExpressionWithExpressionStatement() {
    assertTranslation(
        IR.function(
            null,
            IR.paramList("x"),
            IR.block(IR.exprResult(IR.call(IR.name("f"), IR.name("x"))))),
        PyIR.lambda(PyIR.arguments("x"), PyIR.call(PyIR.name("f"), PyIR.name("x"))));
  }

  @Test
  public void testNamedFunctionExpressionKeepsItsName() {
    ExprWithPrelude result =
        translate(
            IR.function(
                IR.name("id"), IR.paramList("n"), IR.block(IR.returnNode(IR.name("n")))));

    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                new Identifier("id"),
                PyIR.arguments("n"),
                ImmutableList.of(PyIR.returnNode(PyIR.name("n")))));
    assertThat(result.expression()).isEqualTo(PyIR.name("id"));
  }

  @Test
  public void testConditional() {
    assertTranslation(
        IR.hook(IR.name("a"), IR.name("b"), IR.number(0)),
        PyIR.ifExp(A, B, PyIR.constant(0)));
  }

  @Test
  public void testSequenceReturnsItsLastElement() {
    ExprWithPrelude result = translate(IR.comma(IR.call(IR.name("f")), IR.name("a")));

    Identifier lifted = new Identifier("lifted_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments(),
                ImmutableList.of(PyIR.exprStmt(PyIR.call(PyIR.name("f"))), PyIR.returnNode(A))));
    assertThat(result.expression()).isEqualTo(PyIR.call(PyIR.name(lifted)));
  }

  @Test
  public void testPrefixUpdate() {
    ExprWithPrelude result = translate(IR.inc(IR.name("i"), true));

    assertThat(result.prelude())
        .containsExactly(
            PyIR.assign(
                PyIR.storeName(new Identifier("i")),
                PyIR.binOp(PyIR.name("i"), Operator.ADD, PyIR.constant(1))));
    assertThat(result.expression()).isEqualTo(PyIR.name("i"));
  }

  @Test
  public void testPostfixUpdateSavesOldValue() {
    ExprWithPrelude result = translate(IR.dec(IR.name("i"), false));

    Identifier temp = new Identifier("tmp_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.assign(PyIR.storeName(temp), PyIR.name("i")),
            PyIR.assign(
                PyIR.storeName(new Identifier("i")),
                PyIR.binOp(PyIR.name("i"), Operator.SUB, PyIR.constant(1))))
        .inOrder();
    assertThat(result.expression()).isEqualTo(PyIR.name(temp));
  }

  @Test
  public void testPostfixUpdateOnCallReceiver() {
    ExprWithPrelude result = translate(IR.inc(IR.getprop(IR.call(IR.name("f")), "x"), false));

    PyExpr receiver = PyIR.name("tmp_0");
    Identifier oldValue = new Identifier("tmp_1");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.assign(PyIR.storeName(new Identifier("tmp_0")), PyIR.call(PyIR.name("f"))),
            PyIR.assign(PyIR.storeName(oldValue), PyIR.attribute(receiver, "x")),
            PyIR.assign(
                PyIR.storeAttribute(receiver, new Identifier("x")),
                PyIR.binOp(PyIR.attribute(receiver, "x"), Operator.ADD, PyIR.constant(1))))
        .inOrder();
    assertThat(result.expression()).isEqualTo(PyIR.name(oldValue));
  }

  @Test
  public void testAssignmentToMemberYieldsAssignedValue() {
    ExprWithPrelude result =
        translate(IR.assign(IR.getprop(IR.name("o"), "x"), IR.call(IR.name("g"))));

    Identifier temp = new Identifier("tmp_0");
    assertThat(result.prelude())
        .containsExactly(
            PyIR.assign(PyIR.storeName(temp), PyIR.call(PyIR.name("g"))),
            PyIR.assign(
                PyIR.storeAttribute(PyIR.name("o"), new Identifier("x")), PyIR.name(temp)))
        .inOrder();
    assertThat(result.expression()).isEqualTo(PyIR.name(temp));
  }

  @Test
  public void testEmit() {
    assertTranslation(IR.emit("void $0", IR.name("a")), A);
    assertTranslation(
        IR.emit("$0 @ $1", IR.name("a"), IR.name("b")),
        new PyExpr.Emit("$0 @ $1", ImmutableList.of(A, B)));
  }

  @Test
  public void testSyntheticNamesAreUniquePerFile() {
    ExprWithPrelude first = translate(IR.comma(IR.call(IR.name("f")), IR.name("a")));
    ExprWithPrelude second = translate(IR.comma(IR.call(IR.name("g")), IR.name("b")));

    assertThat(((PyStmt.FunctionDef) first.prelude().get(0)).name().name())
        .isEqualTo("lifted_0");
    assertThat(((PyStmt.FunctionDef) second.prelude().get(0)).name().name())
        .isEqualTo("lifted_1");
    assertNoDiagnostics();
  }
}
