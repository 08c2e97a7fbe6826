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
package net.hydromatic.tensor.type;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Size of one mode of a tensor.
 *
 * <p>A dimension is either fixed (known size) or variable (size not known
 * until the tensor is packed).
 */
public final class Dimension {
  private static final Dimension VARIABLE = new Dimension(-1);

  private final int size;

  private Dimension(int size) {
    this.size = size;
  }

  /** Creates a fixed dimension. */
  public static Dimension of(int size) {
    checkArgument(size >= 0, "negative size %s", size);
    return new Dimension(size);
  }

  /** Returns the variable dimension. */
  public static Dimension variable() {
    return VARIABLE;
  }

  public boolean isVariable() {
    return size < 0;
  }

  public boolean isFixed() {
    return size >= 0;
  }

  /** Returns the size of a fixed dimension. */
  public int getSize() {
    checkState(isFixed(), "variable dimension has no size");
    return size;
  }

  /**
   * Returns whether this dimension can index the same mode as another.
   * A variable dimension is compatible with every dimension; fixed dimensions
   * are compatible if they have the same size.
   */
  public boolean isCompatible(Dimension other) {
    return isVariable() || other.isVariable() || size == other.size;
  }

  @Override
  public int hashCode() {
    return size;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Dimension && size == ((Dimension) o).size;
  }

  @Override
  public String toString() {
    return isVariable() ? "?" : Integer.toString(size);
  }
}

// End Dimension.java
