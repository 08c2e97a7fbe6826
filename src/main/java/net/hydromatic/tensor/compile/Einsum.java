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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.List;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.Shuttle;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the reductions in an expression that uses Einstein summation
 * notation.
 *
 * <p>In Einstein notation, an index variable that is not free is summed over.
 * For example, given free variables {@code i} and {@code j},
 * {@code B(i,k) * C(k,j)} means {@code sum(k)(B(i,k) * C(k,j))}.
 *
 * <p>Each term of a sum or difference is summed separately; given free
 * variables {@code i} and {@code j},
 * {@code B(i,k) * C(k,j) + D(i,j)} means
 * {@code sum(k)(B(i,k) * C(k,j)) + D(i,j)}.
 */
public class Einsum extends Shuttle {
  private final ImmutableSet<IndexVar> freeVars;
  /** Whether the expression has no additions or subtractions. */
  private boolean onlyOneTerm = true;

  private Einsum(List<IndexVar> freeVars) {
    this.freeVars = ImmutableSet.copyOf(freeVars);
  }

  /** Returns whether an expression is in Einstein notation; that is, it is a
   * sum or difference of products of accesses, and has no explicit
   * reductions.
   *
   * <p>Returns false for the undefined expression. */
  public static boolean doesEinsumApply(@Nullable IndexExpr e) {
    if (e == null) {
      return false;
    }
    final EinsumChecker checker = new EinsumChecker();
    e.accept(checker);
    return checker.einsum;
  }

  /** Converts an expression in Einstein notation to one with explicit
   * reductions; returns null if the expression is not in Einstein
   * notation.
   *
   * @param e Expression
   * @param freeVars Variables that are not to be summed over
   */
  public static @Nullable IndexExpr einsum(@Nullable IndexExpr e,
      List<IndexVar> freeVars) {
    if (!doesEinsumApply(e)) {
      return null;
    }
    final Einsum einsum = new Einsum(freeVars);
    IndexExpr e2 = requireNonNull(einsum.rewrite(e));
    if (einsum.onlyOneTerm) {
      e2 = einsum.addReductions(e2);
    }
    return e2;
  }

  /** Converts the definition of a tensor to one with explicit reductions,
   * using the tensor's free variables. */
  public static @Nullable IndexExpr einsum(TensorVar tensor) {
    return einsum(tensor.getIndexExpr(), tensor.getFreeVars());
  }

  /** Wraps an expression in a summation over each variable that it uses
   * but is not free. The first variable used becomes the outermost
   * summation. */
  private IndexExpr addReductions(IndexExpr e) {
    for (IndexVar var : Lists.reverse(IndexVarFinder.getIndexVars(e))) {
      if (!freeVars.contains(var)) {
        e = expr.sum(var).apply(e);
      }
    }
    return e;
  }

  /** Sums over a term of an addition or subtraction. If the term itself
   * contains an addition or subtraction, such as {@code -(X + Y)}, sums
   * over each of its terms instead. */
  private IndexExpr term(IndexExpr e) {
    if (containsSum(e)) {
      return requireNonNull(rewrite(e));
    }
    return addReductions(e);
  }

  /** Returns whether an expression contains an addition or subtraction. */
  private static boolean containsSum(IndexExpr e) {
    final boolean[] found = {false};
    e.accept(
        new Visitor() {
          @Override protected void visit(Expr.Add add) {
            found[0] = true;
          }

          @Override protected void visit(Expr.Sub sub) {
            found[0] = true;
          }
        });
    return found[0];
  }

  @Override protected IndexExpr visit(Expr.Add add) {
    onlyOneTerm = false;
    return add.copy(term(add.a), term(add.b));
  }

  @Override protected IndexExpr visit(Expr.Sub sub) {
    onlyOneTerm = false;
    return sub.copy(term(sub.a), term(sub.b));
  }

  /** Visitor that decides whether an expression is in Einstein notation.
   * Additions are not allowed below a multiplication. */
  private static class EinsumChecker extends Visitor {
    boolean einsum = true;
    boolean underMul = false;

    @Override protected void visit(Expr.Add add) {
      if (underMul) {
        einsum = false;
        return;
      }
      super.visit(add);
    }

    @Override protected void visit(Expr.Sub sub) {
      if (underMul) {
        einsum = false;
        return;
      }
      super.visit(sub);
    }

    @Override protected void visit(Expr.Mul mul) {
      final boolean topMul = !underMul;
      underMul = true;
      super.visit(mul);
      if (topMul) {
        underMul = false;
      }
    }

    @Override protected void visit(Expr.Div div) {
      einsum = false;
    }

    @Override protected void visit(Expr.Reduction reduction) {
      einsum = false;
    }
  }
}

// End Einsum.java
