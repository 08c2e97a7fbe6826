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

import static net.hydromatic.tensor.Matchers.equalsOrdered;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.type.DataType;
import net.hydromatic.tensor.type.Dimension;
import net.hydromatic.tensor.type.Shape;
import net.hydromatic.tensor.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link IndexVarFinder}. */
public class IndexVarFinderTest {
  private final IndexVar i = new IndexVar("i");
  private final IndexVar j = new IndexVar("j");
  private final IndexVar k = new IndexVar("k");
  private final Type matrix = Type.of(DataType.FLOAT64, 3, 3);
  private final TensorVar b = new TensorVar("B", matrix);
  private final TensorVar c = new TensorVar("C", matrix);
  private final TensorVar d = new TensorVar("D", matrix);

  @Test void testForEachAccess() {
    final IndexExpr e =
        expr.sqrt(b.access(i, k)).times(c.access(k, j)).plus(d.access(i, j));
    final List<Expr.Access> accesses = new ArrayList<>();
    IndexVarFinder.forEachAccess(e, accesses::add);
    assertThat(accesses, hasToString("[B(i,k), C(k,j), D(i,j)]"));

    IndexVarFinder.forEachAccess(null, accesses::add);
    assertThat(accesses.size(), is(3));
  }

  @Test void testGetIndexVars() {
    final IndexExpr e =
        b.access(i, k).times(c.access(k, j)).plus(d.access(i, j));
    assertThat(IndexVarFinder.getIndexVars(e), equalsOrdered(i, k, j));
    assertThat(IndexVarFinder.getIndexVars(expr.sum(k).apply(e)),
        equalsOrdered(i, k, j));
    assertThat(IndexVarFinder.getIndexVars(expr.literal(1)), empty());
    assertThat(IndexVarFinder.getIndexVars((IndexExpr) null), empty());
  }

  @Test void testGetIndexVarsOfTensor() {
    final TensorVar a = new TensorVar("A", matrix);
    assertThat(IndexVarFinder.getIndexVars(a), empty());

    // Sorted in order of creation, not in order of occurrence
    a.access(i, j).assign(b.access(i, k).times(c.access(k, j)));
    assertThat(IndexVarFinder.getIndexVars(a), equalsOrdered(i, j, k));
  }

  @Test void testGetIndexVarRanges() {
    final Type type =
        new Type(DataType.FLOAT64,
            Shape.of(
                ImmutableList.of(Dimension.of(3), Dimension.variable())));
    final TensorVar a = new TensorVar("A", Type.of(DataType.FLOAT64, 3, 4));
    final TensorVar b2 = new TensorVar("B", type);
    final TensorVar c2 = new TensorVar("C", Type.of(DataType.FLOAT64, 6, 4));
    a.access(i, j).assign(b2.access(i, k).times(c2.access(k, j)));

    // "k" first indexes a variable dimension of B; C's dimension 6 is not
    // used
    final Map<IndexVar, Dimension> ranges =
        IndexVarFinder.getIndexVarRanges(a);
    assertThat(ranges.keySet(), equalsOrdered(i, j, k));
    assertThat(ranges.get(i), is(Dimension.of(3)));
    assertThat(ranges.get(j), is(Dimension.of(4)));
    assertThat(ranges.get(k), is(Dimension.variable()));
  }

  @Test void testGetVarsWithoutReduction() {
    final IndexExpr bik = b.access(i, k);
    assertThat(IndexVarFinder.getVarsWithoutReduction(bik),
        equalsOrdered(i, k));
    assertThat(IndexVarFinder.getVarsWithoutReduction(expr.sum(k).apply(bik)),
        equalsOrdered(i));
    assertThat(
        IndexVarFinder.getVarsWithoutReduction(
            expr.sum(i).apply(expr.sum(k).apply(bik))),
        empty());
    assertThat(IndexVarFinder.getVarsWithoutReduction(null), empty());

    // "k" is bound inside the reduction, but is free in "C(i,k)"
    final IndexExpr e = c.access(i, k).plus(expr.sum(k).apply(bik));
    assertThat(IndexVarFinder.getVarsWithoutReduction(e),
        equalsOrdered(i, k));
    final IndexExpr e2 = expr.sum(k).apply(bik).plus(c.access(i, k));
    assertThat(IndexVarFinder.getVarsWithoutReduction(e2),
        equalsOrdered(i, k));
    assertThat(Verifier.verify(e2, ImmutableList.of(i)), is(false));
  }
}

// End IndexVarFinderTest.java
