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

/** Sub-types of {@link IndexExpr}. */
public enum Op {
  // access
  ACCESS(true),

  // literals
  INT_IMM(true),
  UINT_IMM(true),
  FLOAT_IMM(true),
  COMPLEX_IMM(true),

  // function-like; printed as atoms
  SQRT(true),
  REDUCTION(true),

  NEGATE("-", 8),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary arithmetic operator. */
  public boolean isBinary() {
    return isDisjunctive() || isConjunctive();
  }

  /** Returns whether this operator's identity element is zero, as for
   * addition and subtraction. */
  public boolean isDisjunctive() {
    return this == PLUS || this == MINUS;
  }

  /** Returns whether zero is an absorbing element of this operator, as for
   * multiplication and division. */
  public boolean isConjunctive() {
    return this == TIMES || this == DIVIDE;
  }

  /** Returns whether this is a literal. */
  public boolean isImmediate() {
    return this == INT_IMM
        || this == UINT_IMM
        || this == FLOAT_IMM
        || this == COMPLEX_IMM;
  }

  /** Returns the name of a reduction that combines values using this
   * operator; for example "sum" for {@link #PLUS}. */
  public String reductionName() {
    switch (this) {
    case PLUS:
      return "sum";
    case MINUS:
      return "difference";
    case TIMES:
      return "product";
    case DIVIDE:
      return "quotient";
    default:
      throw new AssertionError("not a combining operator: " + this);
    }
  }
}

// End Op.java
