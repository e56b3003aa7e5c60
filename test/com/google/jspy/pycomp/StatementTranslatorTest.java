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
import com.google.jspy.ast.Statement;
import com.google.jspy.pyast.BoolOperator;
import com.google.jspy.pyast.ComparisonOperator;
import com.google.jspy.pyast.ExceptHandler;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.Operator;
import com.google.jspy.pyast.PyExpr;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import com.google.jspy.pyast.UnaryOperator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StatementTranslator}. */
@RunWith(JUnit4.class)
public final class StatementTranslatorTest extends TranslatorTestBase {

  private static final PyExpr X = PyIR.name("x");

  private static Statement call(String name, Expression... args) {
    return IR.exprResult(IR.call(IR.name(name), args));
  }

  private static PyStmt pyCall(String name, PyExpr... args) {
    return PyIR.exprStmt(PyIR.call(PyIR.name(name), args));
  }

  private static PyExpr store(String name) {
    return PyIR.storeName(new Identifier(name));
  }

  @Test
  public void testVariableDeclaration() {
    assertThat(translate(IR.let("x", IR.number(1))))
        .containsExactly(PyIR.assign(store("x"), PyIR.constant(1)));
    assertThat(translate(IR.let("x", null))).isEmpty();
  }

  @Test
  public void testVariableDeclarationWithPrelude() {
    assertThat(translate(IR.constNode("y", IR.assign(IR.name("x"), IR.number(1)))))
        .containsExactly(
            PyIR.assign(store("x"), PyIR.constant(1)), PyIR.assign(store("y"), X))
        .inOrder();
  }

  @Test
  public void testAssignmentToName() {
    assertThat(translate(IR.exprResult(IR.assign(IR.name("x"), IR.number(1)))))
        .containsExactly(PyIR.assign(store("x"), PyIR.constant(1)));
  }

  @Test
  public void testAssignmentToMember() {
    assertThat(
            translate(IR.exprResult(IR.assign(IR.getprop(IR.thisNode(), "x"), IR.name("x")))))
        .containsExactly(
            PyIR.assign(PyIR.storeAttribute(PyIR.name("self"), new Identifier("x")), X));
  }

  @Test
  public void testAssignmentToStringKey() {
    assertThat(
            translate(
                IR.exprResult(
                    IR.assign(IR.getelem(IR.name("o"), IR.string("k")), IR.number(1)))))
        .containsExactly(
            PyIR.exprStmt(
                PyIR.call("setattr", PyIR.name("o"), PyIR.constant("k"), PyIR.constant(1))));
  }

  @Test
  public void testCompoundAssignment() {
    assertThat(translate(IR.exprResult(IR.assign("*=", IR.name("x"), IR.number(2)))))
        .containsExactly(
            PyIR.assign(store("x"), PyIR.binOp(X, Operator.MULT, PyIR.constant(2))));

    PyExpr o = PyIR.name("o");
    PyExpr k = PyIR.constant("k");
    assertThat(
            translate(
                IR.exprResult(
                    IR.assign("+=", IR.getelem(IR.name("o"), IR.string("k")), IR.number(1)))))
        .containsExactly(
            PyIR.exprStmt(
                PyIR.call(
                    "setattr",
                    o,
                    k,
                    PyIR.binOp(PyIR.call("getattr", o, k), Operator.ADD, PyIR.constant(1)))));
  }

  @Test
  public void testAssignedValueDoesNotReevaluateReceiver() {
    assertThat(
            translate(
                IR.constNode("y", IR.assign(IR.getprop(IR.call(IR.name("f")), "x"), IR.number(1)))))
        .containsExactly(
            PyIR.assign(
                PyIR.storeAttribute(PyIR.call(PyIR.name("f")), new Identifier("x")),
                PyIR.constant(1)),
            PyIR.assign(store("y"), PyIR.constant(1)))
        .inOrder();
  }

  @Test
  public void testAssignedValueKeepsLiftedReceiver() {
    Identifier lifted = new Identifier("lifted_0");
    assertThat(
            translate(
                IR.constNode(
                    "y",
                    IR.assign(
                        IR.getprop(IR.comma(IR.call(IR.name("g")), IR.name("b")), "x"),
                        IR.number(1)))))
        .containsExactly(
            PyIR.functionDef(
                lifted,
                PyIR.arguments(),
                ImmutableList.of(
                    PyIR.exprStmt(PyIR.call(PyIR.name("g"))),
                    PyIR.returnNode(PyIR.name("b")))),
            PyIR.assign(
                PyIR.storeAttribute(PyIR.call(PyIR.name(lifted)), new Identifier("x")),
                PyIR.constant(1)),
            PyIR.assign(store("y"), PyIR.constant(1)))
        .inOrder();
  }

  @Test
  public void testReceiverIsEvaluatedBeforeValue() {
    PyExpr temp = PyIR.name("tmp_0");
    assertThat(
            translate(
                IR.exprResult(
                    IR.assign(IR.getprop(IR.call(IR.name("f")), "x"), IR.call(IR.name("g"))))))
        .containsExactly(
            PyIR.assign(store("tmp_0"), PyIR.call(PyIR.name("f"))),
            PyIR.assign(
                PyIR.storeAttribute(temp, new Identifier("x")), PyIR.call(PyIR.name("g"))))
        .inOrder();
  }

  @Test
  public void testCompoundAssignmentEvaluatesReceiverOnce() {
    PyExpr temp = PyIR.name("tmp_0");
    assertThat(
            translate(
                IR.exprResult(
                    IR.assign("+=", IR.getprop(IR.call(IR.name("f")), "x"), IR.number(1)))))
        .containsExactly(
            PyIR.assign(store("tmp_0"), PyIR.call(PyIR.name("f"))),
            PyIR.assign(
                PyIR.storeAttribute(temp, new Identifier("x")),
                PyIR.binOp(PyIR.attribute(temp, "x"), Operator.ADD, PyIR.constant(1))))
        .inOrder();

    resetTranslator();
    PyExpr k = PyIR.constant("k");
    assertThat(
            translate(
                IR.exprResult(
                    IR.assign(
                        "-=", IR.getelem(IR.call(IR.name("f")), IR.string("k")), IR.number(1)))))
        .containsExactly(
            PyIR.assign(store("tmp_0"), PyIR.call(PyIR.name("f"))),
            PyIR.exprStmt(
                PyIR.call(
                    "setattr",
                    temp,
                    k,
                    PyIR.binOp(PyIR.call("getattr", temp, k), Operator.SUB, PyIR.constant(1)))))
        .inOrder();
  }

  @Test
  public void testUnknownCompoundAssignment() {
    assertInternalError(
        TranslatorErrors.UNKNOWN_OPERATOR,
        () -> translate(IR.exprResult(IR.assign("??=", IR.name("x"), IR.number(2)))));
  }

  @Test
  public void testAssignmentToOtherTargets() {
    assertInternalError(
        TranslatorErrors.INVALID_ASSIGNMENT_TARGET,
        () ->
            translate(
                IR.exprResult(IR.assign(IR.getelem(IR.name("o"), IR.name("k")), IR.number(1)))));
  }

  @Test
  public void testAssignmentToCall() {
    TranslationError error =
        assertInternalError(
            TranslatorErrors.INVALID_ASSIGNMENT_TARGET,
            () -> translate(IR.exprResult(IR.assign(IR.call(IR.name("f")), IR.number(1)))));
    assertThat(error.description()).isEqualTo("Cannot assign to CALL");
  }

  @Test
  public void testUpdateStatement() {
    assertThat(translate(IR.exprResult(IR.inc(IR.name("x"), false))))
        .containsExactly(
            PyIR.assign(store("x"), PyIR.binOp(X, Operator.ADD, PyIR.constant(1))));
  }

  @Test
  public void testExpressionStatementWithoutEffectIsKept() {
    // Dropping is left to the normalization of the enclosing body.
    assertThat(translate(IR.exprResult(IR.name("x")))).containsExactly(PyIR.exprStmt(X));
    assertThat(translate(IR.block(IR.exprResult(IR.name("x"))))).containsExactly(PyIR.pass());
  }

  @Test
  public void testReturn() {
    Statement ret = IR.returnNode(IR.call(IR.name("f")));
    assertThat(translate(ReturnStrategy.RETURN, ret))
        .containsExactly(PyIR.returnNode(PyIR.call(PyIR.name("f"))));
    assertThat(translate(ReturnStrategy.NO_RETURN, ret)).containsExactly(pyCall("f"));
    assertThat(translate(ReturnStrategy.NO_RETURN, IR.returnNode()))
        .containsExactly(PyIR.returnNode());
  }

  @Test
  public void testIf() {
    assertThat(translate(IR.ifNode(IR.name("x"), IR.block(call("f")), IR.block(call("g")))))
        .containsExactly(
            PyIR.ifNode(X, ImmutableList.of(pyCall("f")), ImmutableList.of(pyCall("g"))));
  }

  @Test
  public void testIfWithEmptyBranch() {
    assertThat(translate(IR.ifNode(IR.name("x"), IR.block())))
        .containsExactly(PyIR.ifNode(X, ImmutableList.of(PyIR.pass())));
  }

  @Test
  public void testReturnInsideIfKeepsReturning() {
    assertThat(
            translate(
                ReturnStrategy.RETURN,
                IR.ifNode(IR.name("x"), IR.block(IR.returnNode(IR.number(1))))))
        .containsExactly(
            PyIR.ifNode(X, ImmutableList.of(PyIR.returnNode(PyIR.constant(1)))));
  }

  @Test
  public void testIfTestPreludeIsHoisted() {
    assertThat(
            translate(
                IR.ifNode(IR.assign(IR.name("x"), IR.call(IR.name("f"))), IR.block(call("g")))))
        .containsExactly(
            PyIR.assign(store("x"), PyIR.call(PyIR.name("f"))),
            PyIR.ifNode(X, ImmutableList.of(pyCall("g"))))
        .inOrder();
  }

  @Test
  public void testWhile() {
    assertThat(translate(IR.whileNode(IR.name("x"), IR.block(call("f")))))
        .containsExactly(PyIR.whileNode(X, ImmutableList.of(pyCall("f"))));
  }

  @Test
  public void testWhileTestWithPreludeIsEvaluatedEachIteration() {
    assertThat(
            translate(
                IR.whileNode(
                    IR.assign(IR.name("x"), IR.call(IR.name("next"))),
                    IR.block(call("f", IR.name("x"))))))
        .containsExactly(
            PyIR.whileNode(
                PyIR.constant(true),
                ImmutableList.of(
                    PyIR.assign(store("x"), PyIR.call(PyIR.name("next"))),
                    PyIR.ifNode(
                        PyIR.unaryOp(UnaryOperator.NOT, X), ImmutableList.of(PyIR.breakNode())),
                    pyCall("f", X))));
  }

  @Test
  public void testSwitchWithFallthrough() {
    Statement stmt =
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(IR.name("A")),
            IR.caseNode(IR.name("B"), call("foo"), IR.breakNode()),
            IR.defaultCase(call("bar")));

    assertThat(translate(stmt))
        .containsExactly(
            PyIR.ifNode(
                PyIR.boolOp(
                    BoolOperator.OR,
                    PyIR.compare(X, ComparisonOperator.EQ, PyIR.name("A")),
                    PyIR.compare(X, ComparisonOperator.EQ, PyIR.name("B"))),
                ImmutableList.of(pyCall("foo")),
                ImmutableList.of(pyCall("bar"))));
    assertNoDiagnostics();
  }

  @Test
  public void testSwitchChain() {
    Statement stmt =
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(IR.number(1), call("one"), IR.breakNode()),
            IR.caseNode(IR.number(2), call("two"), IR.breakNode()));

    assertThat(translate(stmt))
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(X, ComparisonOperator.EQ, PyIR.constant(1)),
                ImmutableList.of(pyCall("one")),
                ImmutableList.of(
                    PyIR.ifNode(
                        PyIR.compare(X, ComparisonOperator.EQ, PyIR.constant(2)),
                        ImmutableList.of(pyCall("two"))))));
  }

  @Test
  public void testSwitchWithEmptyCaseBody() {
    assertThat(
            translate(
                IR.switchNode(
                    IR.name("x"),
                    IR.caseNode(IR.number(1), IR.breakNode()),
                    IR.defaultCase(call("f")))))
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(X, ComparisonOperator.EQ, PyIR.constant(1)),
                ImmutableList.of(PyIR.pass()),
                ImmutableList.of(pyCall("f"))));
  }

  @Test
  public void testSwitchDefaultIsMovedLast() {
    Statement stmt =
        IR.switchNode(
            IR.name("x"),
            IR.defaultCase(call("bar"), IR.breakNode()),
            IR.caseNode(IR.name("A"), call("foo"), IR.breakNode()));

    assertThat(translate(stmt))
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(X, ComparisonOperator.EQ, PyIR.name("A")),
                ImmutableList.of(pyCall("foo")),
                ImmutableList.of(pyCall("bar"))));
  }

  @Test
  public void testSwitchDefaultFallingThroughIsError() {
    assertInternalError(
        TranslatorErrors.UNSUPPORTED_SWITCH,
        () ->
            translate(
                IR.switchNode(
                    IR.name("x"),
                    IR.defaultCase(call("bar")),
                    IR.caseNode(IR.name("A"), call("foo"), IR.breakNode()))));
  }

  @Test
  public void testSwitchDiscriminantIsEvaluatedOnce() {
    Statement stmt =
        IR.switchNode(
            IR.call(IR.name("f")),
            IR.caseNode(IR.number(1), call("one"), IR.breakNode()),
            IR.caseNode(IR.number(2), call("two"), IR.breakNode()));

    ImmutableList<PyStmt> result = translate(stmt);

    PyExpr temp = PyIR.name("tmp_0");
    assertThat(result.get(0))
        .isEqualTo(PyIR.assign(store("tmp_0"), PyIR.call(PyIR.name("f"))));
    PyStmt.If chain = (PyStmt.If) result.get(1);
    assertThat(chain.test())
        .isEqualTo(PyIR.compare(temp, ComparisonOperator.EQ, PyIR.constant(1)));
  }

  @Test
  public void testSwitchDiscriminantBindingDisabled() {
    options.setBindSwitchDiscriminant(false);
    resetTranslator();

    ImmutableList<PyStmt> result =
        translate(
            IR.switchNode(
                IR.call(IR.name("f")), IR.caseNode(IR.number(1), call("one"), IR.breakNode())));

    assertThat(result)
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(
                    PyIR.call(PyIR.name("f")), ComparisonOperator.EQ, PyIR.constant(1)),
                ImmutableList.of(pyCall("one"))));
  }

  @Test
  public void testSwitchCaseFallingThroughWarns() {
    translate(
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(IR.number(1), call("one")),
            IR.caseNode(IR.number(2), call("two"), IR.breakNode())));

    assertWarning(TranslatorErrors.SWITCH_FALLTHROUGH);
  }

  @Test
  public void testReturnInsideSwitchCase() {
    assertThat(
            translate(
                ReturnStrategy.RETURN,
                IR.switchNode(
                    IR.name("x"),
                    IR.caseNode(IR.number(1), IR.returnNode(IR.string("one"))),
                    IR.defaultCase(IR.returnNode(IR.string("other"))))))
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(X, ComparisonOperator.EQ, PyIR.constant(1)),
                ImmutableList.of(PyIR.returnNode(PyIR.constant("one"))),
                ImmutableList.of(PyIR.returnNode(PyIR.constant("other")))));
  }

  @Test
  public void testCanonicalForLoop() {
    Statement stmt =
        IR.forNode(
            IR.let("i", IR.number(0)),
            IR.binary("<=", IR.name("i"), IR.name("n")),
            IR.inc(IR.name("i"), false),
            IR.block(call("f", IR.name("i"))));

    assertThat(translate(stmt))
        .containsExactly(
            PyIR.forNode(
                store("i"),
                PyIR.call(
                    "range",
                    PyIR.constant(0),
                    PyIR.binOp(PyIR.name("n"), Operator.ADD, PyIR.constant(1))),
                ImmutableList.of(pyCall("f", PyIR.name("i")))));
  }

  @Test
  public void testForLoopWithExclusiveBound() {
    Statement stmt =
        IR.forNode(
            IR.let("i", IR.number(1)),
            IR.binary("<", IR.name("i"), IR.name("n")),
            IR.assign("+=", IR.name("i"), IR.number(1)),
            IR.block(call("f", IR.name("i"))));

    assertThat(translate(stmt))
        .containsExactly(
            PyIR.forNode(
                store("i"),
                PyIR.call("range", PyIR.constant(1), PyIR.name("n")),
                ImmutableList.of(pyCall("f", PyIR.name("i")))));
  }

  @Test
  public void testForLoopCountingDown() {
    assertInternalError(
        TranslatorErrors.NON_CANONICAL_FOR_LOOP,
        () ->
            translate(
                IR.forNode(
                    IR.let("i", IR.name("n")),
                    IR.binary(">=", IR.name("i"), IR.number(0)),
                    IR.dec(IR.name("i"), false),
                    IR.block(call("f")))));
  }

  @Test
  public void testForLoopWithoutInitializer() {
    assertInternalError(
        TranslatorErrors.NON_CANONICAL_FOR_LOOP,
        () ->
            translate(
                IR.forNode(
                    null,
                    IR.binary("<", IR.name("i"), IR.name("n")),
                    IR.inc(IR.name("i"), false),
                    IR.block(call("f")))));
  }

  @Test
  public void testForLoopStepOfTwo() {
    assertInternalError(
        TranslatorErrors.NON_CANONICAL_FOR_LOOP,
        () ->
            translate(
                IR.forNode(
                    IR.let("i", IR.number(0)),
                    IR.binary("<", IR.name("i"), IR.name("n")),
                    IR.assign("+=", IR.name("i"), IR.number(2)),
                    IR.block(call("f")))));
  }

  @Test
  public void testBreakInsideLoopInsideSwitchIsKept() {
    Statement loop = IR.whileNode(IR.trueNode(), IR.block(IR.breakNode()));
    ImmutableList<PyStmt> result =
        translate(IR.switchNode(IR.name("x"), IR.caseNode(IR.number(1), loop, IR.breakNode())));

    assertThat(result)
        .containsExactly(
            PyIR.ifNode(
                PyIR.compare(X, ComparisonOperator.EQ, PyIR.constant(1)),
                ImmutableList.of(
                    PyIR.whileNode(PyIR.constant(true), ImmutableList.of(PyIR.breakNode())))));
  }

  @Test
  public void testTryCatch() {
    ImmutableList<PyStmt> result =
        translate(IR.tryCatch(IR.block(call("f")), "e", IR.block(call("g", IR.name("e")))));

    assertThat(result)
        .containsExactly(
            PyIR.tryNode(
                ImmutableList.of(pyCall("f")),
                ImmutableList.of(
                    new ExceptHandler(
                        PyIR.name("Exception"),
                        new Identifier("e"),
                        ImmutableList.of(pyCall("g", PyIR.name("e"))))),
                ImmutableList.of()));
    assertWarning(TranslatorErrors.CATCH_TYPE_ERASED);
  }

  @Test
  public void testCatchTypeWarningIsReportedOnce() {
    translate(IR.tryCatch(IR.block(call("f")), "e", IR.block(call("g"))));
    translate(IR.tryCatch(IR.block(call("f")), null, IR.block(call("g"))));

    assertWarning(TranslatorErrors.CATCH_TYPE_ERASED);
  }

  @Test
  public void testTryFinally() {
    assertThat(translate(IR.tryFinally(IR.block(call("f")), IR.block(call("g")))))
        .containsExactly(
            PyIR.tryNode(
                ImmutableList.of(pyCall("f")), ImmutableList.of(), ImmutableList.of(pyCall("g"))));
    assertNoDiagnostics();
  }

  @Test
  public void testThrow() {
    assertThat(translate(IR.throwNode(IR.newNode(IR.name("Error"), IR.string("boom")))))
        .containsExactly(
            PyIR.raise(PyIR.call(PyIR.name("Error"), PyIR.constant("boom"))));
  }

  @Test
  public void testLabeledJumps() {
    Statement loop =
        IR.label(
            "outer",
            IR.whileNode(
                IR.name("x"), IR.block(IR.continueNode("outer"), IR.breakNode("outer"))));

    assertThat(translate(loop))
        .containsExactly(
            PyIR.whileNode(X, ImmutableList.of(PyIR.continueNode(), PyIR.breakNode())));
    assertThat(errorManager.getWarnings()).hasSize(2);
    assertThat(errorManager.getWarnings().get(0).type()).isEqualTo(TranslatorErrors.LABELED_JUMP);
  }

  @Test
  public void testWarningsAsErrors() {
    options.setWarningsAsErrors(true);
    resetTranslator();

    translate(IR.whileNode(IR.name("x"), IR.block(IR.breakNode("outer"))));

    assertThat(errorManager.getWarnings()).isEmpty();
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    assertThat(errorManager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testFunctionDeclaration() {
    assertThat(
            translate(
                IR.functionDeclaration(
                    "f", IR.paramList("a"), IR.block(IR.returnNode(IR.name("a"))))))
        .containsExactly(
            PyIR.functionDef(
                new Identifier("f"),
                PyIR.arguments("a"),
                ImmutableList.of(PyIR.returnNode(PyIR.name("a")))));
  }
}
