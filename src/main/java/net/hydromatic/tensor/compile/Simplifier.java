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

import java.util.Set;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.StrictShuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifies an index expression, given a set of accesses that are known to
 * be zero.
 *
 * <p>Zero is represented by the undefined expression, {@code null}. It
 * propagates as follows:
 *
 * <ul>
 * <li>A zeroed access is zero.
 * <li>{@code -0} and {@code sqrt(0)} are zero.
 * <li>{@code 0 + b} is {@code b}, {@code a - 0} is {@code a}, and so forth;
 *   if both operands are zero, so is the sum or difference.
 * <li>If either operand of a product or quotient is zero, so is the result.
 *   This includes a zero denominator.
 * <li>A reduction over zero is zero.
 * </ul>
 *
 * <p>Literals are not folded. Sub-trees that do not change are returned as
 * is, not copied.
 */
public class Simplifier extends StrictShuttle {
  private final Set<Expr.Access> zeroed;

  private Simplifier(Set<Expr.Access> zeroed) {
    this.zeroed = requireNonNull(zeroed);
  }

  /** Simplifies an expression.
   *
   * <p>Accesses are compared by identity; an access that is structurally
   * equal to, but not the same node as, a member of {@code zeroed} is not
   * zero.
   *
   * @param e Expression
   * @param zeroed Accesses that are zero
   * @return Simplified expression; null if the expression is zero
   */
  public static @Nullable IndexExpr simplify(@Nullable IndexExpr e,
      Set<Expr.Access> zeroed) {
    return new Simplifier(zeroed).rewrite(e);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Access access) {
    return zeroed.contains(access) ? null : access;
  }

  @Override protected @Nullable IndexExpr visit(Expr.Neg neg) {
    final IndexExpr a = rewrite(neg.a);
    return a == null ? null : neg.copy(a);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Sqrt sqrt) {
    final IndexExpr a = rewrite(sqrt.a);
    return a == null ? null : sqrt.copy(a);
  }

  /** Simplifies an addition or subtraction; zero is the identity. */
  private @Nullable IndexExpr visitDisjunction(Expr.Binary binary) {
    final IndexExpr a = rewrite(binary.a);
    final IndexExpr b = rewrite(binary.b);
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return binary.copy(a, b);
  }

  /** Simplifies a multiplication or division; zero is absorbing. */
  private @Nullable IndexExpr visitConjunction(Expr.Binary binary) {
    final IndexExpr a = rewrite(binary.a);
    final IndexExpr b = rewrite(binary.b);
    if (a == null || b == null) {
      return null;
    }
    return binary.copy(a, b);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Add add) {
    return visitDisjunction(add);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Sub sub) {
    return visitDisjunction(sub);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Mul mul) {
    return visitConjunction(mul);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Div div) {
    return visitConjunction(div);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Reduction reduction) {
    final IndexExpr a = rewrite(reduction.a);
    return a == null ? null : reduction.copy(a);
  }

  @Override protected @Nullable IndexExpr visit(Expr.IntImm intImm) {
    return intImm;
  }

  @Override protected @Nullable IndexExpr visit(Expr.UIntImm uintImm) {
    return uintImm;
  }

  @Override protected @Nullable IndexExpr visit(Expr.FloatImm floatImm) {
    return floatImm;
  }

  @Override protected @Nullable IndexExpr visit(Expr.ComplexImm complexImm) {
    return complexImm;
  }
}

// End Simplifier.java
