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

/**
 * Visits index expressions, and must handle every kind of node.
 *
 * <p>Use this class rather than {@link Visitor} when a forgotten case would be
 * a bug; the compiler will not let a sub-class omit a method.
 */
public abstract class StrictVisitor {
  /** For use as a method reference. */
  protected void accept(IndexExpr e) {
    e.accept(this);
  }

  protected abstract void visit(Expr.Access access);

  protected abstract void visit(Expr.Neg neg);

  protected abstract void visit(Expr.Sqrt sqrt);

  protected abstract void visit(Expr.Add add);

  protected abstract void visit(Expr.Sub sub);

  protected abstract void visit(Expr.Mul mul);

  protected abstract void visit(Expr.Div div);

  protected abstract void visit(Expr.Reduction reduction);

  protected abstract void visit(Expr.IntImm intImm);

  protected abstract void visit(Expr.UIntImm uintImm);

  protected abstract void visit(Expr.FloatImm floatImm);

  protected abstract void visit(Expr.ComplexImm complexImm);
}

// End StrictVisitor.java
