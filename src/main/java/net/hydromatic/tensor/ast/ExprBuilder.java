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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensor.compile.NotationException;
import net.hydromatic.tensor.util.Complex;

/** Builds index expression nodes. */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates an access to a tensor, "{@code A(i,j)}".
   *
   * @throws NotationException.ArityMismatch if the number of index variables
   * is not the order of the tensor */
  public Expr.Access access(TensorVar tensorVar, List<IndexVar> indexVars) {
    final int order = tensorVar.getOrder();
    if (indexVars.size() != order) {
      throw new NotationException.ArityMismatch("A tensor of order " + order
          + " must be indexed with " + order
          + " variables, but " + tensorVar.getName()
          + " is indexed with: (" + Joiner.on(",").join(indexVars) + ")");
    }
    return new Expr.Access(tensorVar, ImmutableList.copyOf(indexVars));
  }

  /** Creates a negation, "{@code -a}". */
  public Expr.Neg neg(IndexExpr a) {
    return new Expr.Neg(a);
  }

  /** Creates a square root, "{@code sqrt(a)}". */
  public Expr.Sqrt sqrt(IndexExpr a) {
    return new Expr.Sqrt(a);
  }

  /** Creates an addition, "{@code a + b}". */
  public Expr.Add add(IndexExpr a, IndexExpr b) {
    return new Expr.Add(a, b);
  }

  /** Creates a subtraction, "{@code a - b}". */
  public Expr.Sub sub(IndexExpr a, IndexExpr b) {
    return new Expr.Sub(a, b);
  }

  /** Creates a multiplication, "{@code a * b}". */
  public Expr.Mul mul(IndexExpr a, IndexExpr b) {
    return new Expr.Mul(a, b);
  }

  /** Creates a division, "{@code a / b}". */
  public Expr.Div div(IndexExpr a, IndexExpr b) {
    return new Expr.Div(a, b);
  }

  /** Creates a binary expression whose operator is given. */
  public Expr.Binary binary(Op op, IndexExpr a, IndexExpr b) {
    switch (op) {
    case PLUS:
      return add(a, b);
    case MINUS:
      return sub(a, b);
    case TIMES:
      return mul(a, b);
    case DIVIDE:
      return div(a, b);
    default:
      throw new AssertionError("not a binary operator: " + op);
    }
  }

  /** Creates a reduction that combines values of {@code a} over every value
   * of {@code var} using the binary operator {@code combiner}. */
  public Expr.Reduction reduction(Op combiner, IndexVar var, IndexExpr a) {
    return new Expr.Reduction(combiner, var, a);
  }

  /** Creates a proxy for a summation over an index variable; for example,
   * {@code expr.sum(k).apply(b.times(c))} is "{@code sum(k)(b * c)}". */
  public Expr.ReductionProxy sum(IndexVar var) {
    return new Expr.ReductionProxy(Op.PLUS, var);
  }

  /** Creates a signed 64-bit integer literal. */
  public Expr.IntImm literal(long value) {
    return new Expr.IntImm(value);
  }

  /** Creates an unsigned 64-bit integer literal. */
  public Expr.UIntImm unsignedLiteral(long value) {
    return new Expr.UIntImm(value);
  }

  /** Creates a double-precision floating-point literal. */
  public Expr.FloatImm literal(double value) {
    return new Expr.FloatImm(value);
  }

  /** Creates a complex literal. */
  public Expr.ComplexImm literal(Complex value) {
    return new Expr.ComplexImm(value);
  }

  /** Creates a complex literal from its real and imaginary parts. */
  public Expr.ComplexImm complexLiteral(double re, double im) {
    return literal(Complex.of(re, im));
  }
}

// End ExprBuilder.java
