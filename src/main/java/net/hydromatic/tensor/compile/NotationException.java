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

/** An error in the construction or definition of an index expression.
 *
 * <p>Each kind of error has its own sub-class. */
public class NotationException extends RuntimeException {
  public NotationException(String message) {
    super(message);
  }

  /** A tensor is indexed with the wrong number of index variables. */
  public static class ArityMismatch extends NotationException {
    public ArityMismatch(String message) {
      super(message);
    }
  }

  /** A tensor that is already defined is assigned again. */
  public static class Reassignment extends NotationException {
    public Reassignment(String message) {
      super(message);
    }
  }

  /** An index variable indexes modes of different sizes. */
  public static class DimensionMismatch extends NotationException {
    public DimensionMismatch(String message) {
      super(message);
    }
  }

  /** An index variable is neither free nor bound by a reduction, and
   * reductions cannot be inferred. */
  public static class EinsumMalformed extends NotationException {
    public EinsumMalformed(String message) {
      super(message);
    }
  }

  /** A definition would require transposing a tensor. */
  public static class UnsupportedTranspose extends NotationException {
    public UnsupportedTranspose(String message) {
      super(message);
    }
  }

  /** A definition would require distributing values over a free variable
   * that no operand uses. */
  public static class UnsupportedDistribution extends NotationException {
    public UnsupportedDistribution(String message) {
      super(message);
    }
  }
}

// End NotationException.java
