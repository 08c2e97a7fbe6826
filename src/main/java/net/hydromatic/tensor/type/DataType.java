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

import com.google.common.collect.Ordering;
import java.util.Locale;

/** Type of the components of a tensor, and of scalar expressions. */
public enum DataType {
  BOOL(Kind.BOOL, 8),
  UINT8(Kind.UINT, 8),
  UINT16(Kind.UINT, 16),
  UINT32(Kind.UINT, 32),
  UINT64(Kind.UINT, 64),
  INT8(Kind.INT, 8),
  INT16(Kind.INT, 16),
  INT32(Kind.INT, 32),
  INT64(Kind.INT, 64),
  FLOAT32(Kind.FLOAT, 32),
  FLOAT64(Kind.FLOAT, 64),
  COMPLEX64(Kind.COMPLEX, 64),
  COMPLEX128(Kind.COMPLEX, 128);

  /** The name in printed types, e.g. {@code float64}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  public final Kind kind;

  /** Number of bits in a value of this type. */
  public final int bits;

  DataType(Kind kind, int bits) {
    this.kind = kind;
    this.bits = bits;
  }

  @Override
  public String toString() {
    return moniker;
  }

  /** Number of bits in each component. A complex number has two components;
   * other types have one. */
  int componentBits() {
    return kind == Kind.COMPLEX ? bits / 2 : bits;
  }

  /**
   * Returns the smallest type that can hold values of both types.
   *
   * <p>The kind of the result is the larger of the two kinds (in the order
   * bool, unsigned int, int, float, complex), and each component of the
   * result is at least as wide as the widest component of the arguments.
   */
  public static DataType max(DataType a, DataType b) {
    if (a == b) {
      return a;
    }
    final Kind kind = Ordering.natural().max(a.kind, b.kind);
    final int componentBits = Math.max(a.componentBits(), b.componentBits());
    DataType widest = a.kind == kind ? a : b;
    for (DataType dataType : values()) {
      if (dataType.kind == kind) {
        if (dataType.componentBits() >= componentBits) {
          return dataType;
        }
        widest = dataType;
      }
    }
    return widest;
  }

  /** Kind of data type. */
  public enum Kind {
    BOOL,
    UINT,
    INT,
    FLOAT,
    COMPLEX
  }
}

// End DataType.java
