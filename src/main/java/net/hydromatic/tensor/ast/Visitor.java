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

/** Visits index expressions.
 *
 * <p>Each method visits the children of its node; override the methods for
 * the kinds of node you care about. */
public class Visitor extends StrictVisitor {
  @Override protected void visit(Expr.Access access) {}

  @Override protected void visit(Expr.Neg neg) {
    neg.a.accept(this);
  }

  @Override protected void visit(Expr.Sqrt sqrt) {
    sqrt.a.accept(this);
  }

  @Override protected void visit(Expr.Add add) {
    add.a.accept(this);
    add.b.accept(this);
  }

  @Override protected void visit(Expr.Sub sub) {
    sub.a.accept(this);
    sub.b.accept(this);
  }

  @Override protected void visit(Expr.Mul mul) {
    mul.a.accept(this);
    mul.b.accept(this);
  }

  @Override protected void visit(Expr.Div div) {
    div.a.accept(this);
    div.b.accept(this);
  }

  @Override protected void visit(Expr.Reduction reduction) {
    reduction.a.accept(this);
  }

  // literals

  @Override protected void visit(Expr.IntImm intImm) {}

  @Override protected void visit(Expr.UIntImm uintImm) {}

  @Override protected void visit(Expr.FloatImm floatImm) {}

  @Override protected void visit(Expr.ComplexImm complexImm) {}
}

// End Visitor.java
