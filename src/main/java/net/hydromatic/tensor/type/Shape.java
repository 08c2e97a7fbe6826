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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ordered list of the dimensions of the modes of a tensor. */
public final class Shape {
  public static final Shape SCALAR = new Shape(ImmutableList.of());

  private final ImmutableList<Dimension> dimensions;

  private Shape(ImmutableList<Dimension> dimensions) {
    this.dimensions = dimensions;
  }

  /** Creates a shape from a list of dimensions. */
  public static Shape of(List<Dimension> dimensions) {
    return dimensions.isEmpty()
        ? SCALAR
        : new Shape(ImmutableList.copyOf(dimensions));
  }

  /** Creates a shape whose dimensions all have fixed sizes. */
  public static Shape of(int... sizes) {
    final ImmutableList.Builder<Dimension> b = ImmutableList.builder();
    for (int size : sizes) {
      b.add(Dimension.of(size));
    }
    return of(b.build());
  }

  /** Returns the number of modes. */
  public int getOrder() {
    return dimensions.size();
  }

  /** Returns the dimension of the {@code i}th mode. */
  public Dimension getDimension(int i) {
    return dimensions.get(i);
  }

  public List<Dimension> getDimensions() {
    return dimensions;
  }

  @Override
  public int hashCode() {
    return dimensions.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Shape && dimensions.equals(((Shape) o).dimensions);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    for (int i = 0; i < dimensions.size(); i++) {
      b.append(i == 0 ? "" : ",").append(dimensions.get(i));
    }
    return b.append("]").toString();
  }
}

// End Shape.java
