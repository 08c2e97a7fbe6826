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

import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.tensor.eval.Session;

/**
 * Index variable.
 *
 * <p>An index variable names a mode (axis) of a tensor within an expression.
 * It is free if it appears on the left-hand side of a definition, and
 * reduction-bound if it is summed out by a {@link Expr.Reduction}.
 *
 * <p>Two index variables are equal only if they are the same object; two
 * distinct variables may have the same name. Variables are ordered by the
 * order in which they were created.
 */
public class IndexVar implements Comparable<IndexVar> {
  private static final AtomicInteger NEXT_ID = new AtomicInteger();

  /** Unique identifier; increases with each variable created. */
  public final int id;
  private final String name;

  /** Creates an index variable with a generated name. */
  public IndexVar() {
    this(Session.DEFAULT.newIndexVarName());
  }

  /** Creates an index variable with a given name. */
  public IndexVar(String name) {
    this.id = NEXT_ID.getAndIncrement();
    this.name = requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  @Override public int compareTo(IndexVar o) {
    return Integer.compare(id, o.id);
  }

  @Override public String toString() {
    return name;
  }
}

// End IndexVar.java
