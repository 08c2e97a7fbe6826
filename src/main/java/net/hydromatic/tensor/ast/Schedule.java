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

import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Scheduling directives for the computation of a tensor.
 *
 * <p>Currently the only directive is {@link OperatorSplit}.
 *
 * @see TensorVar#getSchedule()
 */
public class Schedule {
  private final List<OperatorSplit> operatorSplits = new ArrayList<>();

  /** Creates an empty schedule. */
  public Schedule() {
  }

  /** Creates a schedule that contains the operator splits of every node
   * reachable from an expression. A node that is reachable by several paths
   * contributes its splits once. */
  public static Schedule of(@Nullable IndexExpr e) {
    final Schedule schedule = new Schedule();
    if (e != null) {
      schedule.collect(e, Sets.newIdentityHashSet());
    }
    return schedule;
  }

  private void collect(IndexExpr e, Set<IndexExpr> seen) {
    if (!seen.add(e)) {
      return;
    }
    operatorSplits.addAll(e.getOperatorSplits());
    e.forEachArg(arg -> collect(arg, seen));
  }

  /** Adds an operator split. */
  public void addOperatorSplit(OperatorSplit split) {
    operatorSplits.add(split);
  }

  /** Returns the operator splits, in the order they were added. */
  public List<OperatorSplit> getOperatorSplits() {
    return Collections.unmodifiableList(operatorSplits);
  }

  /** Removes all operator splits. */
  public void clearOperatorSplits() {
    operatorSplits.clear();
  }

  @Override public String toString() {
    return "Schedule" + operatorSplits;
  }
}

// End Schedule.java
