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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Type of a tensor: the data type of its components and its shape. */
public final class Type {
  private final DataType dataType;
  private final Shape shape;

  /** Creates a Type. */
  public Type(DataType dataType, Shape shape) {
    this.dataType = requireNonNull(dataType, "dataType");
    this.shape = requireNonNull(shape, "shape");
  }

  /** Creates the type of a scalar (a tensor of order 0). */
  public static Type scalar(DataType dataType) {
    return new Type(dataType, Shape.SCALAR);
  }

  /** Creates a type whose dimensions all have fixed sizes. */
  public static Type of(DataType dataType, int... sizes) {
    return new Type(dataType, Shape.of(sizes));
  }

  public DataType getDataType() {
    return dataType;
  }

  public Shape getShape() {
    return shape;
  }

  /** Returns the number of modes; 0 for a scalar. */
  public int getOrder() {
    return shape.getOrder();
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataType, shape);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Type
            && dataType == ((Type) o).dataType
            && shape.equals(((Type) o).shape);
  }

  /** Returns a string such as "float64[3,4]", or "int32" for a scalar. */
  @Override
  public String toString() {
    return shape.getOrder() == 0
        ? dataType.toString()
        : dataType.toString() + shape;
  }
}

// End Type.java
