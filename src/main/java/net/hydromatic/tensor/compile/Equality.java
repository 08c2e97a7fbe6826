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
package net.hydromatic.tensor.compile;

import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.StrictVisitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structural equality of index expressions.
 *
 * <p>Two expressions are equal if they have the same kind of node at each
 * position, accesses read the same tensor at the same index variables, and
 * literals have the same value. There is no algebraic normalization; for
 * instance, {@code a + b} is not equal to {@code b + a}.
 */
public class Equality extends StrictVisitor {
  /** The expression that the visited expression is compared to. */
  private final IndexExpr other;
  private boolean eq;

  private Equality(IndexExpr other) {
    this.other = other;
  }

  /** Returns whether two expressions are structurally equal. Two undefined
   * expressions are equal; an undefined expression is not equal to a
   * defined one. */
  public static boolean equals(@Nullable IndexExpr a, @Nullable IndexExpr b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    final Equality equality = new Equality(b);
    a.accept(equality);
    return equality.eq;
  }

  @Override protected void visit(Expr.Access access) {
    if (other instanceof Expr.Access) {
      final Expr.Access access2 = (Expr.Access) other;
      if (access.tensorVar != access2.tensorVar
          || access.indexVars.size() != access2.indexVars.size()) {
        return;
      }
      for (int i = 0; i < access.indexVars.size(); i++) {
        if (access.indexVars.get(i) != access2.indexVars.get(i)) {
          return;
        }
      }
      eq = true;
    }
  }

  @Override protected void visit(Expr.Neg neg) {
    if (other instanceof Expr.Neg) {
      eq = equals(neg.a, ((Expr.Neg) other).a);
    }
  }

  @Override protected void visit(Expr.Sqrt sqrt) {
    if (other instanceof Expr.Sqrt) {
      eq = equals(sqrt.a, ((Expr.Sqrt) other).a);
    }
  }

  private void visitBinary(Expr.Binary binary) {
    // Op identifies the kind of binary node
    if (other instanceof Expr.Binary && other.op == binary.op) {
      final Expr.Binary binary2 = (Expr.Binary) other;
      eq = equals(binary.a, binary2.a) && equals(binary.b, binary2.b);
    }
  }

  @Override protected void visit(Expr.Add add) {
    visitBinary(add);
  }

  @Override protected void visit(Expr.Sub sub) {
    visitBinary(sub);
  }

  @Override protected void visit(Expr.Mul mul) {
    visitBinary(mul);
  }

  @Override protected void visit(Expr.Div div) {
    visitBinary(div);
  }

  @Override protected void visit(Expr.Reduction reduction) {
    if (other instanceof Expr.Reduction) {
      final Expr.Reduction reduction2 = (Expr.Reduction) other;
      eq = reduction.combiner == reduction2.combiner
          && equals(reduction.a, reduction2.a);
    }
  }

  @Override protected void visit(Expr.IntImm intImm) {
    if (other instanceof Expr.IntImm) {
      eq = intImm.value == ((Expr.IntImm) other).value;
    }
  }

  @Override protected void visit(Expr.UIntImm uintImm) {
    if (other instanceof Expr.UIntImm) {
      eq = uintImm.value == ((Expr.UIntImm) other).value;
    }
  }

  @Override protected void visit(Expr.FloatImm floatImm) {
    if (other instanceof Expr.FloatImm) {
      eq = Double.compare(floatImm.value, ((Expr.FloatImm) other).value) == 0;
    }
  }

  @Override protected void visit(Expr.ComplexImm complexImm) {
    if (other instanceof Expr.ComplexImm) {
      eq = complexImm.value.equals(((Expr.ComplexImm) other).value);
    }
  }
}

// End Equality.java
