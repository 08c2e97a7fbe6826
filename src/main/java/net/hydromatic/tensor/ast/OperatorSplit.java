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

/**
 * Request to split the loop over an index variable into two nested loops,
 * at a particular expression node.
 *
 * <p>The lowering stage, when it reaches {@link #node}, replaces the loop
 * over {@link #old} with an outer loop over {@link #left} and an inner loop
 * over {@link #right}.
 *
 * @see IndexExpr#splitOperator(IndexVar, IndexVar, IndexVar)
 * @see Schedule
 */
public class OperatorSplit {
  public final IndexExpr node;
  public final IndexVar old;
  public final IndexVar left;
  public final IndexVar right;

  OperatorSplit(IndexExpr node, IndexVar old, IndexVar left,
      IndexVar right) {
    this.node = requireNonNull(node, "node");
    this.old = requireNonNull(old, "old");
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  public IndexExpr getNode() {
    return node;
  }

  public IndexVar getOld() {
    return old;
  }

  public IndexVar getLeft() {
    return left;
  }

  public IndexVar getRight() {
    return right;
  }

  @Override public String toString() {
    return "split " + old + " -> (" + left + ", " + right + ") at " + node;
  }
}

// End OperatorSplit.java
