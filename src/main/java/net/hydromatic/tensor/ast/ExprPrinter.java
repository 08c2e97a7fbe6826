/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tensor.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts an index expression to a string.
 *
 * <p>Each node is printed in a context that has a left and a right binding
 * strength; the node is enclosed in parentheses if its operator binds less
 * tightly than its context. For example, {@code (a + b) * c} needs
 * parentheses but {@code a * b + c} does not.
 */
public class ExprPrinter extends StrictVisitor {
  /** String that represents the undefined expression. */
  public static final String UNDEFINED = "IndexExpr()";

  private final StringBuilder buf = new StringBuilder();
  private int left;
  private int right;

  private ExprPrinter() {}

  /** Converts an expression to a string. */
  public static String print(@Nullable IndexExpr e) {
    if (e == null) {
      return UNDEFINED;
    }
    final ExprPrinter printer = new ExprPrinter();
    printer.append(e, 0, 0);
    return printer.buf.toString();
  }

  private ExprPrinter append(IndexExpr e, int left, int right) {
    final int saveLeft = this.left;
    final int saveRight = this.right;
    this.left = left;
    this.right = right;
    try {
      e.accept(this);
    } finally {
      this.left = saveLeft;
      this.right = saveRight;
    }
    return this;
  }

  private ExprPrinter append(String s) {
    buf.append(s);
    return this;
  }

  private void infix(Expr.Binary binary) {
    final Op op = binary.op;
    if (left > op.left || op.right < right) {
      append("(").append(binary.a, 0, op.left)
          .append(op.padded)
          .append(binary.b, op.right, 0).append(")");
    } else {
      append(binary.a, left, op.left)
          .append(op.padded)
          .append(binary.b, op.right, right);
    }
  }

  @Override protected void visit(Expr.Access access) {
    append(access.tensorVar.getName());
    if (!access.indexVars.isEmpty()) {
      append("(");
      for (int i = 0; i < access.indexVars.size(); i++) {
        if (i > 0) {
          append(",");
        }
        append(access.indexVars.get(i).getName());
      }
      append(")");
    }
  }

  @Override protected void visit(Expr.Neg neg) {
    final Op op = neg.op;
    final boolean paren = left > op.left || op.right < right;
    if (paren) {
      append("(");
    }
    append(op.padded);
    if (print(neg.a).startsWith(op.padded)) {
      // "-(-1)", never "--1"
      append("(").append(neg.a, 0, 0).append(")");
    } else {
      append(neg.a, op.right, paren ? 0 : right);
    }
    if (paren) {
      append(")");
    }
  }

  @Override protected void visit(Expr.Sqrt sqrt) {
    append("sqrt(").append(sqrt.a, 0, 0).append(")");
  }

  @Override protected void visit(Expr.Add add) {
    infix(add);
  }

  @Override protected void visit(Expr.Sub sub) {
    infix(sub);
  }

  @Override protected void visit(Expr.Mul mul) {
    infix(mul);
  }

  @Override protected void visit(Expr.Div div) {
    infix(div);
  }

  @Override protected void visit(Expr.Reduction reduction) {
    append(reduction.combiner.reductionName())
        .append("(").append(reduction.var.getName()).append(")")
        .append("(").append(reduction.a, 0, 0).append(")");
  }

  @Override protected void visit(Expr.IntImm intImm) {
    append(Long.toString(intImm.value));
  }

  @Override protected void visit(Expr.UIntImm uintImm) {
    append(Long.toUnsignedString(uintImm.value));
  }

  @Override protected void visit(Expr.FloatImm floatImm) {
    append(Double.toString(floatImm.value));
  }

  @Override protected void visit(Expr.ComplexImm complexImm) {
    append(complexImm.value.toString());
  }
}

// End ExprPrinter.java
