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

import com.google.common.base.Joiner;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.eval.Prop;
import net.hydromatic.tensor.type.Dimension;
import net.hydromatic.tensor.type.Format;
import net.hydromatic.tensor.type.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that index expressions are well-formed, and that tensor definitions
 * are valid.
 *
 * @see #checkDefinition
 */
public abstract class Verifier {
  private Verifier() {}

  /** Returns whether every index variable in an expression is either free
   * or bound by a reduction. */
  public static boolean verify(@Nullable IndexExpr e,
      List<IndexVar> freeVars) {
    for (IndexVar var : IndexVarFinder.getVarsWithoutReduction(e)) {
      if (!freeVars.contains(var)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether the definition of a tensor is well-formed. */
  public static boolean verify(TensorVar tensor) {
    return verify(tensor.getIndexExpr(), tensor.getFreeVars());
  }

  /** Checks a proposed definition of a tensor.
   *
   * <p>The checks are, in order:
   *
   * <ol>
   * <li>the tensor is not already defined;
   * <li>there is one free variable for each mode of the tensor;
   * <li>each index variable indexes modes of the same dimension;
   * <li>the expression is well-formed (see {@link #verify(IndexExpr, List)}),
   *   or is in Einstein notation (see {@link Einsum#doesEinsumApply});
   * <li>the definition does not transpose any tensor
   *   (if {@link Prop#CHECK_TRANSPOSE} is set);
   * <li>each free variable occurs on the right-hand side
   *   (if {@link Prop#CHECK_DISTRIBUTION} is set).
   * </ol>
   *
   * @throws NotationException if the definition is invalid
   */
  public static void checkDefinition(TensorVar tensor,
      List<IndexVar> freeVars, IndexExpr e, boolean accumulate,
      Map<Prop, Object> props) {
    if (tensor.getIndexExpr() != null) {
      throw new NotationException.Reassignment("Cannot reassign " + tensor);
    }
    if (freeVars.size() != tensor.getOrder()) {
      throw new NotationException.ArityMismatch("A tensor of order "
          + tensor.getOrder() + " must be indexed with " + tensor.getOrder()
          + " variables, but " + tensor.getName() + " is indexed with: ("
          + Joiner.on(",").join(freeVars) + ")");
    }
    final Shape shape = tensor.getType().getShape();
    if (!dimensionsTypecheck(freeVars, e, shape)) {
      throw new NotationException.DimensionMismatch(
          "Dimension size mismatch: "
              + dimensionTypecheckErrors(freeVars, e, shape));
    }
    if (!verify(e, freeVars) && !Einsum.doesEinsumApply(e)) {
      throw new NotationException.EinsumMalformed("Summations/reductions are "
          + "not specified and the index expression is not a valid einsum "
          + "expression: " + describe(tensor.getName(), freeVars)
          + (accumulate ? " += " : " = ") + e);
    }
    if (Prop.CHECK_TRANSPOSE.booleanValue(props)
        && containsTranspose(tensor.getFormat(), freeVars, e)) {
      throw new NotationException.UnsupportedTranspose("Computations with "
          + "transpositions are not supported, but are planned for the "
          + "future: " + describe(tensor.getName(), freeVars)
          + (accumulate ? " += " : " = ") + e);
    }
    if (Prop.CHECK_DISTRIBUTION.booleanValue(props)
        && containsDistribution(freeVars, e)) {
      throw new NotationException.UnsupportedDistribution("Expressions with "
          + "free variables that do not appear on the right hand side of the "
          + "expression are not supported, but are planned for the future: "
          + describe(tensor.getName(), freeVars)
          + (accumulate ? " += " : " = ") + e);
    }
  }

  /** Describes an access, such as "A(i,j)", or "a" for a scalar. */
  private static String describe(String name, List<IndexVar> vars) {
    return vars.isEmpty()
        ? name
        : name + "(" + Joiner.on(",").join(vars) + ")";
  }

  /** Returns, for each index variable, the modes that it indexes: first the
   * modes of the result, then the modes of each access. */
  private static ListMultimap<IndexVar, Mode> modes(List<IndexVar> freeVars,
      IndexExpr e, Shape shape) {
    final ListMultimap<IndexVar, Mode> modes =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (int i = 0; i < freeVars.size(); i++) {
      modes.put(freeVars.get(i), new Mode(null, shape.getDimension(i)));
    }
    IndexVarFinder.forEachAccess(e, access -> {
      final Shape accessShape = access.tensorVar.getType().getShape();
      for (int i = 0; i < access.indexVars.size(); i++) {
        modes.put(access.indexVars.get(i),
            new Mode(access.toString(), accessShape.getDimension(i)));
      }
    });
    return modes;
  }

  /** Returns whether the modes indexed by an index variable have compatible
   * dimensions. */
  private static boolean compatible(List<Mode> modes) {
    for (int i = 0; i < modes.size(); i++) {
      for (int j = i + 1; j < modes.size(); j++) {
        if (!modes.get(i).dimension.isCompatible(modes.get(j).dimension)) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns whether every index variable indexes modes of the same
   * dimension, in the result and in the accesses of an expression. A
   * variable dimension is compatible with any dimension. */
  public static boolean dimensionsTypecheck(List<IndexVar> freeVars,
      IndexExpr e, Shape shape) {
    final ListMultimap<IndexVar, Mode> modes = modes(freeVars, e, shape);
    for (IndexVar var : modes.keySet()) {
      if (!compatible(modes.get(var))) {
        return false;
      }
    }
    return true;
  }

  /** Describes the index variables that index modes of different
   * dimensions; the empty string if there are none. */
  public static String dimensionTypecheckErrors(List<IndexVar> freeVars,
      IndexExpr e, Shape shape) {
    final ListMultimap<IndexVar, Mode> modes = modes(freeVars, e, shape);
    final List<String> errors = new ArrayList<>();
    for (IndexVar var : modes.keySet()) {
      final List<Mode> varModes = modes.get(var);
      if (!compatible(varModes)) {
        final List<String> descriptions = new ArrayList<>();
        for (Mode mode : varModes) {
          descriptions.add(
              (mode.access == null ? "the result" : mode.access)
                  + " (" + mode.dimension + ")");
        }
        errors.add("Index variable " + var
            + " is used to index modes of different dimensions: "
            + Joiner.on(", ").join(descriptions));
      }
    }
    return Joiner.on("; ").join(errors);
  }

  /** Returns whether a definition transposes a tensor.
   *
   * <p>Each access (and the result) requires that its index variables be
   * iterated in the order in which its tensor stores its modes. If these
   * requirements form a cycle, no loop order satisfies them all, and the
   * definition needs a transposition. */
  public static boolean containsTranspose(Format resultFormat,
      List<IndexVar> freeVars, IndexExpr e) {
    final Map<IndexVar, Set<IndexVar>> successors = new LinkedHashMap<>();
    addEdges(successors, freeVars, resultFormat.getModeOrdering());
    IndexVarFinder.forEachAccess(e, access ->
        addEdges(successors, access.indexVars,
            access.tensorVar.getFormat().getModeOrdering()));

    final Set<IndexVar> visited = Sets.newIdentityHashSet();
    final Set<IndexVar> onPath = Sets.newIdentityHashSet();
    for (IndexVar var : successors.keySet()) {
      if (hasCycle(var, successors, visited, onPath)) {
        return true;
      }
    }
    return false;
  }

  /** Adds an edge from each index variable to the variable of the next mode
   * in storage order. */
  private static void addEdges(Map<IndexVar, Set<IndexVar>> successors,
      List<IndexVar> vars, List<Integer> modeOrdering) {
    if (vars.isEmpty()) {
      return;
    }
    for (int i = 0; i + 1 < modeOrdering.size(); i++) {
      final IndexVar from = vars.get(modeOrdering.get(i));
      final IndexVar to = vars.get(modeOrdering.get(i + 1));
      successors.computeIfAbsent(from, v -> new LinkedHashSet<>()).add(to);
    }
    successors.computeIfAbsent(vars.get(modeOrdering.get(vars.size() - 1)),
        v -> new LinkedHashSet<>());
  }

  private static boolean hasCycle(IndexVar var,
      Map<IndexVar, Set<IndexVar>> successors, Set<IndexVar> visited,
      Set<IndexVar> onPath) {
    if (onPath.contains(var)) {
      return true;
    }
    if (!visited.add(var)) {
      return false;
    }
    onPath.add(var);
    for (IndexVar successor
        : successors.getOrDefault(var, Collections.emptySet())) {
      if (hasCycle(successor, successors, visited, onPath)) {
        return true;
      }
    }
    onPath.remove(var);
    return false;
  }

  /** Returns whether a definition distributes values over a free variable;
   * that is, some free variable is not used by any access on the right-hand
   * side. */
  public static boolean containsDistribution(List<IndexVar> freeVars,
      IndexExpr e) {
    final List<IndexVar> rhsVars = IndexVarFinder.getIndexVars(e);
    for (IndexVar freeVar : freeVars) {
      if (!rhsVars.contains(freeVar)) {
        return true;
      }
    }
    return false;
  }

  /** Mode of a tensor that an index variable indexes. */
  private static class Mode {
    /** The access, such as "B(i,k)", or null for the result. */
    final @Nullable String access;
    final Dimension dimension;

    Mode(@Nullable String access, Dimension dimension) {
      this.access = access;
      this.dimension = dimension;
    }
  }
}

// End Verifier.java
