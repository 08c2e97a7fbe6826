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

import static net.hydromatic.tensor.Matchers.equalsExpr;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.type.DataType;
import net.hydromatic.tensor.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Einsum}. */
public class EinsumTest {
  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");
  private final IndexVar l = new IndexVar("l");
  private final List<IndexVar> ij = ImmutableList.of(i, j);
  private final Type matrix = Type.of(DataType.FLOAT64, 3, 3);
  private final Type vector = Type.of(DataType.FLOAT64, 3);
  private final TensorVar a = new TensorVar("A", matrix);
  private final TensorVar b = new TensorVar("B", matrix);
  private final TensorVar c = new TensorVar("C", matrix);
  private final TensorVar d = new TensorVar("D", matrix);
  private final TensorVar e = new TensorVar("E", matrix);

  @Test void testMatrixMultiply() {
    final Expr.Mul product = a.access(i, k).times(b.access(k, j));
    final IndexExpr result = Einsum.einsum(product, ij);
    assertThat(result,
        equalsExpr(expr.sum(k).apply(a.access(i, k).times(b.access(k, j)))));
    assertThat(result, hasToString("sum(k)(A(i,k) * B(k,j))"));
    assertThat(((Expr.Reduction) result).a, sameInstance(product));
    assertThat(((Expr.Reduction) result).var, sameInstance(k));
  }

  @Test void testDistributivity() {
    final Expr.Access cij = c.access(i, j);
    final IndexExpr x = a.access(i, k).times(b.access(k, j)).plus(cij);
    final IndexExpr result = Einsum.einsum(x, ij);
    assertThat(result, hasToString("sum(k)(A(i,k) * B(k,j)) + C(i,j)"));
    assertThat(result, instanceOf(Expr.Add.class));
    assertThat(((Expr.Add) result).b, sameInstance(cij));

    // Not a single reduction around the whole sum
    assertThat(result, not(equalsExpr(expr.sum(k).apply(x))));
  }

  @Test void testEachTermIsSummedSeparately() {
    final IndexExpr x = a.access(i, k).times(b.access(k, j))
        .plus(c.access(i, j))
        .minus(d.access(i, l).times(e.access(l, j)));
    assertThat(Einsum.einsum(x, ij),
        hasToString("sum(k)(A(i,k) * B(k,j)) + C(i,j)"
            + " - sum(l)(D(i,l) * E(l,j))"));
  }

  @Test void testSumInsideNegatedTerm() {
    // "D(i,j)" must not be summed over "k"
    final IndexExpr inner = a.access(i, k).times(b.access(k, j))
        .plus(d.access(i, j));
    assertThat(Einsum.einsum(inner.negate(), ij),
        hasToString("-(sum(k)(A(i,k) * B(k,j)) + D(i,j))"));
    final IndexExpr x = c.access(i, j).plus(inner.negate());
    assertThat(Einsum.einsum(x, ij),
        hasToString("C(i,j) + -(sum(k)(A(i,k) * B(k,j)) + D(i,j))"));
    final IndexExpr y = c.access(i, j).minus(expr.sqrt(inner));
    assertThat(Einsum.einsum(y, ij),
        hasToString("C(i,j) - sqrt(sum(k)(A(i,k) * B(k,j)) + D(i,j))"));
  }

  @Test void testNestedReductionOrder() {
    // The first variable found becomes the outermost reduction
    final IndexExpr x =
        a.access(i, k).times(b.access(k, l)).times(c.access(l, j));
    assertThat(Einsum.einsum(x, ij),
        hasToString("sum(k)(sum(l)(A(i,k) * B(k,l) * C(l,j)))"));
  }

  @Test void testNoReductionNeeded() {
    final IndexExpr x = a.access(i, j).plus(b.access(i, j));
    assertThat(Einsum.einsum(x, ij), sameInstance(x));
    final IndexExpr y = a.access(i, j).times(b.access(i, j));
    assertThat(Einsum.einsum(y, ij), sameInstance(y));
  }

  @Test void testScalarResult() {
    final TensorVar v = new TensorVar("v", vector);
    final TensorVar w = new TensorVar("w", vector);
    final IndexExpr x = v.access(i).times(w.access(i));
    assertThat(Einsum.einsum(x, ImmutableList.of()),
        hasToString("sum(i)(v(i) * w(i))"));
  }

  @Test void testNegation() {
    final TensorVar v = new TensorVar("v", vector);
    final IndexExpr x = a.access(i, k).times(v.access(k)).negate();
    assertThat(Einsum.doesEinsumApply(x), is(true));
    assertThat(Einsum.einsum(x, ImmutableList.of(i)),
        hasToString("sum(k)(-(A(i,k) * v(k)))"));
  }

  @Test void testDoesEinsumApply() {
    final IndexExpr aik = a.access(i, k);
    final IndexExpr bkj = b.access(k, j);
    final IndexExpr cij = c.access(i, j);
    assertThat(Einsum.doesEinsumApply(aik.times(bkj)), is(true));
    assertThat(Einsum.doesEinsumApply(aik.times(bkj).plus(cij)), is(true));
    assertThat(Einsum.doesEinsumApply(cij.minus(aik.times(bkj))), is(true));
    assertThat(Einsum.doesEinsumApply(aik.times(bkj).times(cij)), is(true));
    assertThat(Einsum.doesEinsumApply(cij), is(true));

    // Explicit reduction
    assertThat(Einsum.doesEinsumApply(expr.sum(k).apply(aik.times(bkj))),
        is(false));
    assertThat(
        Einsum.doesEinsumApply(cij.plus(expr.sum(k).apply(aik.times(bkj)))),
        is(false));
    // Addition below a multiplication
    assertThat(Einsum.doesEinsumApply(aik.plus(cij).times(bkj)), is(false));
    assertThat(Einsum.doesEinsumApply(aik.times(bkj.times(cij.minus(aik)))),
        is(false));
    // Division
    assertThat(Einsum.doesEinsumApply(aik.divide(bkj)), is(false));
    // Undefined
    assertThat(Einsum.doesEinsumApply(null), is(false));
  }

  @Test void testNotApplicable() {
    final IndexExpr aik = a.access(i, k);
    final IndexExpr bkj = b.access(k, j);
    final IndexExpr x = expr.sum(k).apply(aik.times(bkj));
    assertThat(Einsum.einsum(x, ij), nullValue());
    assertThat(Einsum.einsum(aik.plus(c.access(i, k)).times(bkj), ij),
        nullValue());
    assertThat(Einsum.einsum(null, ij), nullValue());
  }

  @Test void testTensor() {
    final TensorVar r = new TensorVar("R", matrix);
    final IndexExpr x = a.access(i, k).times(b.access(k, j));
    r.access(i, j).assign(x);
    assertThat(Verifier.verify(r), is(false));
    final IndexExpr y = Einsum.einsum(r);
    assertThat(y, hasToString("sum(k)(A(i,k) * B(k,j))"));
    assertThat(Verifier.verify(y, r.getFreeVars()), is(true));

    final TensorVar input = new TensorVar("I", matrix);
    assertThat(Einsum.einsum(input), nullValue());
  }
}

// End EinsumTest.java
