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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.tensor.compile.NotationException;
import net.hydromatic.tensor.compile.Verifier;
import net.hydromatic.tensor.eval.Session;
import net.hydromatic.tensor.type.Format;
import net.hydromatic.tensor.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tensor variable.
 *
 * <p>A tensor is either an input, or is computed from other tensors by an
 * index expression. A computed tensor's definition (its free variables, index
 * expression and whether it accumulates) is set once, by
 * {@link Expr.Access#assign} or {@link Expr.Access#plusAssign}, and is
 * validated when it is set.
 *
 * <p>Two tensor variables are equal only if they are the same object.
 */
public class TensorVar implements Comparable<TensorVar> {
  private static final AtomicInteger NEXT_ID = new AtomicInteger();

  /** Unique identifier; increases with each tensor created. */
  public final int id;
  private final Session session;
  private final Type type;
  private final Format format;
  private String name;

  private ImmutableList<IndexVar> freeVars = ImmutableList.of();
  private @Nullable IndexExpr indexExpr;
  private boolean accumulate;

  /** Creates a dense tensor with a generated name. */
  public TensorVar(Type type) {
    this(Session.DEFAULT, null, type, Format.dense(type.getOrder()));
  }

  /** Creates a tensor with a generated name. */
  public TensorVar(Type type, Format format) {
    this(Session.DEFAULT, null, type, format);
  }

  /** Creates a dense tensor. */
  public TensorVar(String name, Type type) {
    this(Session.DEFAULT, name, type, Format.dense(type.getOrder()));
  }

  /** Creates a tensor. */
  public TensorVar(String name, Type type, Format format) {
    this(Session.DEFAULT, name, type, format);
  }

  /** Creates a tensor in a given session. If {@code name} is null, generates
   * a name using the session's prefix. */
  public TensorVar(Session session, @Nullable String name, Type type,
      Format format) {
    this.id = NEXT_ID.getAndIncrement();
    this.session = requireNonNull(session, "session");
    this.type = requireNonNull(type, "type");
    this.format = requireNonNull(format, "format");
    this.name = name != null ? name : session.newTensorName();
    checkArgument(format.getOrder() == type.getOrder(),
        "format %s has order %s but type %s has order %s",
        format, format.getOrder(), type, type.getOrder());
  }

  public String getName() {
    return name;
  }

  /** Renames this tensor. */
  public void setName(String name) {
    this.name = requireNonNull(name, "name");
  }

  /** Returns the number of modes. */
  public int getOrder() {
    return type.getOrder();
  }

  public Type getType() {
    return type;
  }

  public Format getFormat() {
    return format;
  }

  public Session getSession() {
    return session;
  }

  /** Returns the variables that index this tensor in its definition; empty if
   * this tensor is not defined. */
  public List<IndexVar> getFreeVars() {
    return freeVars;
  }

  /** Returns the expression that defines this tensor, or null if this tensor
   * is an input. */
  public @Nullable IndexExpr getIndexExpr() {
    return indexExpr;
  }

  /** Returns whether the definition adds to the tensor's existing values
   * ({@code +=}) rather than replacing them. */
  public boolean isAccumulating() {
    return accumulate;
  }

  /** Returns the schedule of this tensor's computation.
   *
   * <p>The schedule is computed on each call, because operator splits may
   * have been added to the nodes of the definition since the last call. */
  public Schedule getSchedule() {
    return Schedule.of(indexExpr);
  }

  /** Creates an access to this tensor, "{@code A(i,j)}". */
  public Expr.Access access(IndexVar... indexVars) {
    return expr.access(this, ImmutableList.copyOf(indexVars));
  }

  /** Creates an access to this tensor. */
  public Expr.Access access(List<IndexVar> indexVars) {
    return expr.access(this, indexVars);
  }

  /** Defines this scalar tensor, "{@code a = expr}".
   *
   * @throws NotationException.ArityMismatch if this tensor is not a scalar */
  public void assign(IndexExpr e) {
    scalarAccess().assign(e);
  }

  /** Defines this scalar tensor by accumulation, "{@code a += expr}". */
  public void plusAssign(IndexExpr e) {
    scalarAccess().plusAssign(e);
  }

  private Expr.Access scalarAccess() {
    if (getOrder() != 0) {
      throw new NotationException.ArityMismatch("Can only assign to tensor "
          + name + " without index variables if it is a scalar, but its "
          + "order is " + getOrder());
    }
    return access();
  }

  /** Sets the definition of this tensor.
   *
   * <p>Validates the definition; if it is invalid, or if this tensor is
   * already defined, throws and leaves this tensor unchanged.
   *
   * @param freeVars Variables that index this tensor
   * @param e Expression that computes each element
   * @param accumulate Whether to add to existing values
   *
   * @throws NotationException if the definition is invalid
   */
  public void setIndexExpression(List<IndexVar> freeVars, IndexExpr e,
      boolean accumulate) {
    requireNonNull(e, "e");
    try {
      Verifier.checkDefinition(this, freeVars, e, accumulate, session.map);
    } catch (NotationException ex) {
      session.tracer.onException(ex);
      throw ex;
    }
    this.freeVars = ImmutableList.copyOf(freeVars);
    this.indexExpr = e;
    this.accumulate = accumulate;
    session.tracer.onDefinition(this);
  }

  @Override public int compareTo(TensorVar o) {
    return Integer.compare(id, o.id);
  }

  @Override public String toString() {
    return name + " : " + type;
  }
}

// End TensorVar.java
