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
 * Visits and transforms index expressions, and must handle every kind of
 * node.
 *
 * <p>Each method returns the replacement for its node; {@code null} means
 * that the node is replaced by the undefined expression. A method that makes
 * no change must return its argument, not a copy; callers rely on identity to
 * detect that a subtree is unchanged.
 *
 * @see Shuttle
 */
public abstract class StrictShuttle {
  /** Rewrites an expression. Returns null if the expression is null. */
  public @Nullable IndexExpr rewrite(@Nullable IndexExpr e) {
    return e == null ? null : e.accept(this);
  }

  protected abstract @Nullable IndexExpr visit(Expr.Access access);

  protected abstract @Nullable IndexExpr visit(Expr.Neg neg);

  protected abstract @Nullable IndexExpr visit(Expr.Sqrt sqrt);

  protected abstract @Nullable IndexExpr visit(Expr.Add add);

  protected abstract @Nullable IndexExpr visit(Expr.Sub sub);

  protected abstract @Nullable IndexExpr visit(Expr.Mul mul);

  protected abstract @Nullable IndexExpr visit(Expr.Div div);

  protected abstract @Nullable IndexExpr visit(Expr.Reduction reduction);

  protected abstract @Nullable IndexExpr visit(Expr.IntImm intImm);

  protected abstract @Nullable IndexExpr visit(Expr.UIntImm uintImm);

  protected abstract @Nullable IndexExpr visit(Expr.FloatImm floatImm);

  protected abstract @Nullable IndexExpr visit(Expr.ComplexImm complexImm);
}

// End StrictShuttle.java
