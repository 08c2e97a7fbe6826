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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.ast.Visitor;
import net.hydromatic.tensor.type.Dimension;
import net.hydromatic.tensor.type.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Finds the index variables used in an expression. */
public abstract class IndexVarFinder {
  private IndexVarFinder() {}

  /** Calls an action for each access in an expression, in pre-order. */
  public static void forEachAccess(@Nullable IndexExpr e,
      Consumer<Expr.Access> action) {
    if (e == null) {
      return;
    }
    e.accept(
        new Visitor() {
          @Override protected void visit(Expr.Access access) {
            action.accept(access);
          }
        });
  }

  /** Returns the index variables used by accesses in an expression, in order
   * of first occurrence, without duplicates.
   *
   * <p>Includes variables that are bound by reductions. */
  public static List<IndexVar> getIndexVars(@Nullable IndexExpr e) {
    final Set<IndexVar> vars = new LinkedHashSet<>();
    forEachAccess(e, access -> vars.addAll(access.indexVars));
    return ImmutableList.copyOf(vars);
  }

  /** Returns the index variables of a tensor's definition: its free
   * variables and the variables used in its expression, sorted in order of
   * creation. */
  public static ImmutableSortedSet<IndexVar> getIndexVars(TensorVar tensor) {
    return ImmutableSortedSet.<IndexVar>naturalOrder()
        .addAll(tensor.getFreeVars())
        .addAll(getIndexVars(tensor.getIndexExpr()))
        .build();
  }

  /** Returns the dimension over which each index variable in a tensor's
   * definition ranges.
   *
   * <p>A variable's range is the dimension of the first mode it indexes;
   * first the tensor's own modes, then the modes of each access in the
   * expression. If the definition is valid, every other mode the variable
   * indexes has a compatible dimension. */
  public static Map<IndexVar, Dimension> getIndexVarRanges(TensorVar tensor) {
    final Map<IndexVar, Dimension> ranges = new LinkedHashMap<>();
    addRanges(ranges, tensor.getFreeVars(), tensor.getType().getShape());
    forEachAccess(tensor.getIndexExpr(), access ->
        addRanges(ranges, access.indexVars,
            access.tensorVar.getType().getShape()));
    return ranges;
  }

  private static void addRanges(Map<IndexVar, Dimension> ranges,
      List<IndexVar> vars, Shape shape) {
    for (int i = 0; i < vars.size(); i++) {
      ranges.putIfAbsent(vars.get(i), shape.getDimension(i));
    }
  }

  /** Returns the index variables used by accesses in an expression, except
   * those bound by a reduction. A variable that is also used outside the
   * reduction that binds it is included. */
  public static Set<IndexVar> getVarsWithoutReduction(@Nullable IndexExpr e) {
    final Set<IndexVar> vars = new LinkedHashSet<>();
    if (e != null) {
      e.accept(
          new Visitor() {
            @Override protected void visit(Expr.Access access) {
              vars.addAll(access.indexVars);
            }

            @Override protected void visit(Expr.Reduction reduction) {
              final Set<IndexVar> bodyVars =
                  getVarsWithoutReduction(reduction.a);
              bodyVars.remove(reduction.var);
              vars.addAll(bodyVars);
            }
          });
    }
    return vars;
  }
}

// End IndexVarFinder.java
