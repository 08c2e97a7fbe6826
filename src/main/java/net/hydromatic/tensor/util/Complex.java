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
package net.hydromatic.tensor.util;

import java.util.Objects;

/** Complex number with double-precision real and imaginary parts. */
public final class Complex {
  public final double re;
  public final double im;

  private Complex(double re, double im) {
    this.re = re;
    this.im = im;
  }

  /** Creates a complex number. */
  public static Complex of(double re, double im) {
    return new Complex(re, im);
  }

  @Override
  public int hashCode() {
    return Objects.hash(re, im);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Complex
            && Double.compare(re, ((Complex) o).re) == 0
            && Double.compare(im, ((Complex) o).im) == 0;
  }

  /** Returns a string such as "(1.0,-2.5)". */
  @Override
  public String toString() {
    return "(" + re + "," + im + ")";
  }
}

// End Complex.java
