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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.tensor.type.DataType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Index expression; the abstract base class of all expression nodes.
 *
 * <p>Nodes are immutable and may be shared between any number of expressions
 * and tensor definitions. Rewrites create new nodes and leave existing nodes
 * unchanged, so a reference to a node is a stable handle on a value. The
 * undefined expression (which, after simplification, means zero) is
 * represented by {@code null}.
 *
 * <p>Two references are <em>identical</em> if they refer to the same node;
 * they are <em>equal</em> if the trees are structurally equal (see
 * {@link net.hydromatic.tensor.compile.Equality}). This class does not
 * override {@link Object#equals(Object)}, so nodes in hash-based collections
 * are compared by identity.
 *
 * <p>The one mutation allowed after construction is to append an
 * {@link OperatorSplit}. It is visible to every expression that shares the
 * node.
 */
public abstract class IndexExpr {
  public final Op op;
  public final DataType dataType;
  private final List<OperatorSplit> operatorSplits = new ArrayList<>();

  IndexExpr(Op op, DataType dataType) {
    this.op = requireNonNull(op, "op");
    this.dataType = requireNonNull(dataType, "dataType");
  }

  /** Returns the data type of the value of this expression. */
  public DataType getDataType() {
    return dataType;
  }

  /** Returns the operator splits requested at this node, in the order they
   * were requested. */
  public List<OperatorSplit> getOperatorSplits() {
    return Collections.unmodifiableList(operatorSplits);
  }

  /** Requests that, when this node is lowered, loop variable {@code old} be
   * split into {@code left} and {@code right}. */
  public void splitOperator(IndexVar old, IndexVar left, IndexVar right) {
    operatorSplits.add(new OperatorSplit(this, old, left, right));
  }

  /** Calls an action for each direct child of this node. */
  public void forEachArg(Consumer<IndexExpr> action) {
    // no args
  }

  /**
   * Accepts a visitor, calling the {@link StrictVisitor#visit} method
   * appropriate to the type of this node.
   */
  public abstract void accept(StrictVisitor visitor);

  /**
   * Accepts a shuttle, calling the {@link StrictShuttle#visit} method
   * appropriate to the type of this node, and returning the result.
   */
  public abstract @Nullable IndexExpr accept(StrictShuttle shuttle);

  /** Creates an expression that adds another expression to this. */
  public Expr.Add plus(IndexExpr b) {
    return expr.add(this, b);
  }

  /** Creates an expression that subtracts another expression from this. */
  public Expr.Sub minus(IndexExpr b) {
    return expr.sub(this, b);
  }

  /** Creates an expression that multiplies this by another expression. */
  public Expr.Mul times(IndexExpr b) {
    return expr.mul(this, b);
  }

  /** Creates an expression that divides this by another expression. */
  public Expr.Div divide(IndexExpr b) {
    return expr.div(this, b);
  }

  /** Creates an expression that negates this. */
  public Expr.Neg negate() {
    return expr.neg(this);
  }

  /**
   * Converts this expression into a string, inserting parentheses only where
   * precedence requires them.
   */
  @Override
  public final String toString() {
    return ExprPrinter.print(this);
  }
}

// End IndexExpr.java
