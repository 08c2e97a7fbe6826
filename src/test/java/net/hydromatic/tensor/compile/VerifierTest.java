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

import static net.hydromatic.tensor.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.eval.Prop;
import net.hydromatic.tensor.eval.Session;
import net.hydromatic.tensor.type.DataType;
import net.hydromatic.tensor.type.Dimension;
import net.hydromatic.tensor.type.Format;
import net.hydromatic.tensor.type.Shape;
import net.hydromatic.tensor.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Verifier}. */
public class VerifierTest {
  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");
  private final List<IndexVar> ij = ImmutableList.of(i, j);
  private final Type matrix = Type.of(DataType.FLOAT64, 3, 3);
  private final Type vector = Type.of(DataType.FLOAT64, 3);

  @Test void testVerify() {
    final TensorVar b = new TensorVar("B", matrix);
    final TensorVar c = new TensorVar("C", matrix);
    final IndexExpr product = b.access(i, k).times(c.access(k, j));
    assertThat(Verifier.verify(product, ij), is(false));
    assertThat(Verifier.verify(product, ImmutableList.of(i, j, k)), is(true));

    final IndexExpr sum = expr.sum(k).apply(product);
    assertThat(Verifier.verify(sum, ij), is(true));
    assertThat(Verifier.verify(sum, ImmutableList.of(i)), is(false));
    assertThat(Verifier.verify(null, ImmutableList.of()), is(true));
  }

  @Test void testEinsumIsAccepted() {
    // Not well-formed, but reductions can be inferred
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    final TensorVar c = new TensorVar("C", matrix);
    final IndexExpr product = b.access(i, k).times(c.access(k, j));
    a.access(i, j).assign(product);
    assertThat(a.getIndexExpr(), sameInstance(product));
  }

  @Test void testEinsumMalformed() {
    final TensorVar a = new TensorVar("A", vector);
    final TensorVar b = new TensorVar("B", matrix);
    final TensorVar c = new TensorVar("C", vector);
    final IndexExpr e = expr.sum(k).apply(b.access(i, k)).times(c.access(j));
    final NotationException.EinsumMalformed x =
        assertThrows(NotationException.EinsumMalformed.class,
            () -> a.access(i).assign(e));
    assertThat(x.getMessage(),
        is("Summations/reductions are not specified and the index "
            + "expression is not a valid einsum expression: "
            + "A(i) = sum(k)(B(i,k)) * C(j)"));
    assertThrows(NotationException.EinsumMalformed.class,
        () -> a.access(i).plusAssign(e));
    assertThat(a.getIndexExpr(), nullValue());
  }

  @Test void testDimensionMismatch() {
    final TensorVar a = new TensorVar("A", Type.of(DataType.FLOAT64, 3, 4));
    final TensorVar b = new TensorVar("B", Type.of(DataType.FLOAT64, 3, 5));
    final TensorVar c = new TensorVar("C", Type.of(DataType.FLOAT64, 6, 4));
    final IndexExpr e = b.access(i, k).times(c.access(k, j));
    assertThat(Verifier.dimensionsTypecheck(ij, e, a.getType().getShape()),
        is(false));
    final NotationException.DimensionMismatch x =
        assertThrows(NotationException.DimensionMismatch.class,
            () -> a.access(i, j).assign(e));
    assertThat(x.getMessage(),
        is("Dimension size mismatch: Index variable k is used to index "
            + "modes of different dimensions: B(i,k) (5), C(k,j) (6)"));

    // No partial definition; a valid definition succeeds afterwards
    assertThat(a.getIndexExpr(), nullValue());
    final TensorVar d = new TensorVar("D", Type.of(DataType.FLOAT64, 5, 4));
    final IndexExpr e2 = b.access(i, k).times(d.access(k, j));
    a.access(i, j).assign(e2);
    assertThat(a.getIndexExpr(), sameInstance(e2));
  }

  @Test void testDimensionMismatchWithResult() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", Type.of(DataType.FLOAT64, 4, 3));
    final NotationException.DimensionMismatch x =
        assertThrows(NotationException.DimensionMismatch.class,
            () -> a.access(i, j).assign(b.access(i, j)));
    assertThat(x.getMessage(),
        is("Dimension size mismatch: Index variable i is used to index "
            + "modes of different dimensions: the result (3), B(i,j) (4)"));
  }

  @Test void testVariableDimension() {
    final Type type =
        new Type(DataType.FLOAT64,
            Shape.of(
                ImmutableList.of(Dimension.variable(), Dimension.of(3))));
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", type);
    final IndexExpr e = b.access(i, j);
    assertThat(Verifier.dimensionsTypecheck(ij, e, matrix.getShape()),
        is(true));
    assertThat(Verifier.dimensionTypecheckErrors(ij, e, matrix.getShape()),
        is(""));
    a.access(i, j).assign(e);
    assertThat(a.getIndexExpr(), sameInstance(e));
  }

  @Test void testTranspose() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    final IndexExpr e = b.access(j, i);
    assertThat(Verifier.containsTranspose(a.getFormat(), ij, e), is(true));
    final NotationException.UnsupportedTranspose x =
        assertThrows(NotationException.UnsupportedTranspose.class,
            () -> a.access(i, j).assign(e));
    assertThat(x.getMessage(),
        is("Computations with transpositions are not supported, but are "
            + "planned for the future: A(i,j) = B(j,i)"));

    final NotationException.UnsupportedTranspose x2 =
        assertThrows(NotationException.UnsupportedTranspose.class,
            () -> a.access(i, j).plusAssign(e));
    assertThat(x2.getMessage(),
        is("Computations with transpositions are not supported, but are "
            + "planned for the future: A(i,j) += B(j,i)"));

    // B is stored column-major, so reading B(j,i) follows its storage order
    final Format columnMajor =
        Format.of(ImmutableList.of(Format.ModeFormat.DENSE,
            Format.ModeFormat.SPARSE), ImmutableList.of(1, 0));
    final TensorVar bt = new TensorVar("Bt", matrix, columnMajor);
    final IndexExpr e2 = bt.access(j, i);
    assertThat(Verifier.containsTranspose(a.getFormat(), ij, e2), is(false));
    a.access(i, j).assign(e2);
    assertThat(a.getIndexExpr(), sameInstance(e2));
  }

  @Test void testTransposeThroughSeveralAccesses() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    final TensorVar c = new TensorVar("C", matrix);
    // i before k (B), k before j (C), j before i (A's own free variables
    // reversed)
    final IndexExpr e = b.access(i, k).times(c.access(k, j));
    assertThat(Verifier.containsTranspose(a.getFormat(), ij, e), is(false));
    assertThat(
        Verifier.containsTranspose(a.getFormat(), ImmutableList.of(j, i), e),
        is(true));
  }

  @Test void testTransposeCheckDisabled() {
    final Session session =
        new Session(ImmutableMap.of(), Tracers.empty())
            .withProp(Prop.CHECK_TRANSPOSE, false);
    final TensorVar a = session.tensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    final IndexExpr e = b.access(j, i);
    a.access(i, j).assign(e);
    assertThat(a.getIndexExpr(), sameInstance(e));
  }

  @Test void testDistribution() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", vector);
    final IndexExpr e = b.access(i);
    assertThat(Verifier.containsDistribution(ij, e), is(true));
    assertThat(Verifier.containsDistribution(ImmutableList.of(i), e),
        is(false));
    final NotationException.UnsupportedDistribution x =
        assertThrows(NotationException.UnsupportedDistribution.class,
            () -> a.access(i, j).assign(e));
    assertThat(x.getMessage(),
        is("Expressions with free variables that do not appear on the right "
            + "hand side of the expression are not supported, but are "
            + "planned for the future: A(i,j) = B(i)"));

    final NotationException.UnsupportedDistribution x2 =
        assertThrows(NotationException.UnsupportedDistribution.class,
            () -> a.access(i, j).plusAssign(e));
    assertThat(x2.getMessage(),
        is("Expressions with free variables that do not appear on the right "
            + "hand side of the expression are not supported, but are "
            + "planned for the future: A(i,j) += B(i)"));

    final Session session =
        new Session(ImmutableMap.of(Prop.CHECK_DISTRIBUTION, false),
            Tracers.empty());
    final TensorVar a2 = session.tensorVar("A2", matrix);
    a2.access(i, j).assign(e);
    assertThat(a2.getIndexExpr(), sameInstance(e));
  }

  @Test void testFreeVarArity() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    assertThrows(NotationException.ArityMismatch.class,
        () -> a.setIndexExpression(ImmutableList.of(i), b.access(i, j),
            false));
  }

  @Test void testReassignmentIsCheckedFirst() {
    final TensorVar a = new TensorVar("A", matrix);
    final TensorVar b = new TensorVar("B", matrix);
    a.access(i, j).assign(b.access(i, j));
    // This definition has a transposition too, but reassignment wins
    assertThrows(NotationException.Reassignment.class,
        () -> a.access(i, j).assign(b.access(j, i)));
  }
}

// End VerifierTest.java
