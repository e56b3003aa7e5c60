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
package com.google.jspy.pyast;

import com.google.common.collect.ImmutableList;
import com.google.jspy.pyast.PyExpr.Attribute;
import com.google.jspy.pyast.PyExpr.Constant;
import com.google.jspy.pyast.PyExpr.Name;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A target tree construction helper class. */
public final class PyIR {

  private static final PyStmt PASS = new PyStmt.Pass();
  private static final PyStmt BREAK = new PyStmt.Break();
  private static final PyStmt CONTINUE = new PyStmt.Continue();
  private static final Constant NONE = new Constant(null);

  private PyIR() {}

  // Expressions

  public static Name name(String id) {
    return name(new Identifier(id));
  }

  public static Name name(Identifier id) {
    return new Name(id, ExprContext.LOAD);
  }

  public static Name storeName(Identifier id) {
    return new Name(id, ExprContext.STORE);
  }

  public static Constant none() {
    return NONE;
  }

  public static Constant constant(String value) {
    return new Constant(value);
  }

  public static Constant constant(long value) {
    return new Constant(value);
  }

  public static Constant constant(boolean value) {
    return new Constant(value);
  }

  /** Integral values become {@code int} constants, everything else {@code float}. */
  public static Constant number(double value) {
    if (value == Math.rint(value)
        && !Double.isInfinite(value)
        && Math.abs(value) < 0x1p53
        && !(value == 0 && 1 / value < 0)) {
      return new Constant((long) value);
    }
    return new Constant(value);
  }

  public static Attribute attribute(PyExpr value, String attr) {
    return new Attribute(value, new Identifier(attr), ExprContext.LOAD);
  }

  public static Attribute storeAttribute(PyExpr value, Identifier attr) {
    return new Attribute(value, attr, ExprContext.STORE);
  }

  public static PyExpr subscript(PyExpr value, PyExpr slice) {
    return new PyExpr.Subscript(value, slice, ExprContext.LOAD);
  }

  public static PyExpr call(PyExpr func, PyExpr... args) {
    return new PyExpr.Call(func, ImmutableList.copyOf(args));
  }

  public static PyExpr call(PyExpr func, List<? extends PyExpr> args) {
    return new PyExpr.Call(func, ImmutableList.copyOf(args));
  }

  /** A call of a builtin function by name. */
  public static PyExpr call(String builtin, PyExpr... args) {
    return call(name(builtin), args);
  }

  public static PyExpr binOp(PyExpr left, Operator op, PyExpr right) {
    return new PyExpr.BinOp(left, op, right);
  }

  public static PyExpr unaryOp(UnaryOperator op, PyExpr operand) {
    return new PyExpr.UnaryOp(op, operand);
  }

  public static PyExpr boolOp(BoolOperator op, PyExpr... values) {
    return new PyExpr.BoolOp(op, ImmutableList.copyOf(values));
  }

  public static PyExpr compare(PyExpr left, ComparisonOperator op, PyExpr right) {
    return new PyExpr.Compare(left, ImmutableList.of(op), ImmutableList.of(right));
  }

  public static PyExpr tuple(PyExpr... elts) {
    return new PyExpr.Tuple(ImmutableList.copyOf(elts));
  }

  public static PyExpr dict(List<? extends PyExpr> keys, List<? extends PyExpr> values) {
    return new PyExpr.Dict(ImmutableList.copyOf(keys), ImmutableList.copyOf(values));
  }

  public static PyExpr lambda(Arguments args, PyExpr body) {
    return new PyExpr.Lambda(args, body);
  }

  public static PyExpr ifExp(PyExpr test, PyExpr body, PyExpr orelse) {
    return new PyExpr.IfExp(test, body, orelse);
  }

  // Parameters

  public static Arg arg(String name) {
    return new Arg(new Identifier(name));
  }

  /** Positional parameters without defaults. */
  public static Arguments arguments(String... names) {
    ImmutableList.Builder<Arg> args = ImmutableList.builder();
    for (String name : names) {
      args.add(arg(name));
    }
    return new Arguments(args.build(), null, ImmutableList.of());
  }

  // Statements

  public static PyStmt assign(PyExpr target, PyExpr value) {
    return new PyStmt.Assign(ImmutableList.of(target), value);
  }

  public static PyStmt exprStmt(PyExpr value) {
    return new PyStmt.Expr(value);
  }

  public static PyStmt returnNode(@Nullable PyExpr value) {
    return new PyStmt.Return(value);
  }

  public static PyStmt returnNode() {
    return new PyStmt.Return(null);
  }

  public static PyStmt pass() {
    return PASS;
  }

  public static PyStmt breakNode() {
    return BREAK;
  }

  public static PyStmt continueNode() {
    return CONTINUE;
  }

  public static PyStmt raise(PyExpr exc) {
    return new PyStmt.Raise(exc);
  }

  public static PyStmt ifNode(PyExpr test, List<? extends PyStmt> body) {
    return ifNode(test, body, ImmutableList.of());
  }

  public static PyStmt ifNode(
      PyExpr test, List<? extends PyStmt> body, List<? extends PyStmt> orelse) {
    return new PyStmt.If(test, ImmutableList.copyOf(body), ImmutableList.copyOf(orelse));
  }

  public static PyStmt whileNode(PyExpr test, List<? extends PyStmt> body) {
    return new PyStmt.While(test, ImmutableList.copyOf(body), ImmutableList.of());
  }

  public static PyStmt forNode(PyExpr target, PyExpr iter, List<? extends PyStmt> body) {
    return new PyStmt.For(target, iter, ImmutableList.copyOf(body), ImmutableList.of());
  }

  public static PyStmt tryNode(
      List<? extends PyStmt> body,
      List<ExceptHandler> handlers,
      List<? extends PyStmt> finalbody) {
    return new PyStmt.Try(
        ImmutableList.copyOf(body),
        ImmutableList.copyOf(handlers),
        ImmutableList.of(),
        ImmutableList.copyOf(finalbody));
  }

  public static PyStmt.FunctionDef functionDef(
      Identifier name, Arguments args, List<? extends PyStmt> body) {
    return new PyStmt.FunctionDef(name, args, ImmutableList.copyOf(body));
  }

  public static PyStmt classDef(
      Identifier name, List<? extends PyExpr> bases, List<? extends PyStmt> body) {
    return new PyStmt.ClassDef(name, ImmutableList.copyOf(bases), ImmutableList.copyOf(body));
  }

  public static PyStmt importNode(Alias... names) {
    return new PyStmt.Import(ImmutableList.copyOf(names));
  }

  public static PyStmt importFrom(Identifier module, List<Alias> names) {
    return new PyStmt.ImportFrom(module, ImmutableList.copyOf(names));
  }

  public static Alias alias(String name, @Nullable String asname) {
    return new Alias(new Identifier(name), asname == null ? null : new Identifier(asname));
  }
}
