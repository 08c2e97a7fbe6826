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

/** Visits and transforms index expressions.
 *
 * <p>Each method rewrites the children of its node, and returns the node
 * itself if every child is unchanged. If a child becomes undefined, so does
 * the node; sub-classes that want a different rule (for instance, that
 * {@code a + undefined} is {@code a}) override the method. */
public class Shuttle extends StrictShuttle {
  @Override protected @Nullable IndexExpr visit(Expr.Access access) {
    return access; // leaf
  }

  @Override protected @Nullable IndexExpr visit(Expr.Neg neg) {
    final IndexExpr a = rewrite(neg.a);
    return a == null ? null : neg.copy(a);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Sqrt sqrt) {
    final IndexExpr a = rewrite(sqrt.a);
    return a == null ? null : sqrt.copy(a);
  }

  /** Rewrites both operands of a binary node. */
  protected @Nullable IndexExpr visitBinary(Expr.Binary binary) {
    final IndexExpr a = rewrite(binary.a);
    final IndexExpr b = rewrite(binary.b);
    return a == null || b == null ? null : binary.copy(a, b);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Add add) {
    return visitBinary(add);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Sub sub) {
    return visitBinary(sub);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Mul mul) {
    return visitBinary(mul);
  }

  @Override protected @Nullable IndexExpr visit(Expr.Div div) {
    return visitBinary(div);
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

// End Shuttle.java
