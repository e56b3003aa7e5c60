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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A statement of the target tree. */
public interface PyStmt {

  record Assign(ImmutableList<PyExpr> targets, PyExpr value) implements PyStmt {
    public Assign {
      checkArgument(!targets.isEmpty(), "Assign needs a target");
    }
  }

  /** An expression evaluated for its side effects. */
  record Expr(PyExpr value) implements PyStmt {}

  /** {@code return} with a null value is a bare return. */
  record Return(@Nullable PyExpr value) implements PyStmt {}

  record Pass() implements PyStmt {}

  record Break() implements PyStmt {}

  record Continue() implements PyStmt {}

  record Raise(@Nullable PyExpr exc) implements PyStmt {}

  record If(PyExpr test, ImmutableList<PyStmt> body, ImmutableList<PyStmt> orelse)
      implements PyStmt {
    public If {
      checkArgument(!body.isEmpty(), "empty if body");
    }
  }

  record While(PyExpr test, ImmutableList<PyStmt> body, ImmutableList<PyStmt> orelse)
      implements PyStmt {
    public While {
      checkArgument(!body.isEmpty(), "empty while body");
    }
  }

  record For(
      PyExpr target, PyExpr iter, ImmutableList<PyStmt> body, ImmutableList<PyStmt> orelse)
      implements PyStmt {
    public For {
      checkArgument(!body.isEmpty(), "empty for body");
    }
  }

  record Try(
      ImmutableList<PyStmt> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<PyStmt> orelse,
      ImmutableList<PyStmt> finalbody)
      implements PyStmt {
    public Try {
      checkArgument(!body.isEmpty(), "empty try body");
      checkArgument(
          !handlers.isEmpty() || !finalbody.isEmpty(), "try needs a handler or a finally body");
    }
  }

  record FunctionDef(Identifier name, Arguments args, ImmutableList<PyStmt> body)
      implements PyStmt {
    public FunctionDef {
      checkArgument(!body.isEmpty(), "empty function body");
    }
  }

  record ClassDef(Identifier name, ImmutableList<PyExpr> bases, ImmutableList<PyStmt> body)
      implements PyStmt {
    public ClassDef {
      checkArgument(!body.isEmpty(), "empty class body");
    }
  }

  /** {@code import a as b, c} */
  record Import(ImmutableList<Alias> names) implements PyStmt {}

  /** {@code from module import a as b, c} */
  record ImportFrom(Identifier module, ImmutableList<Alias> names) implements PyStmt {}
}
