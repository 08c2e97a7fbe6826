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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Storage format of a tensor.
 *
 * <p>A format has a mode format (dense or sparse) for each mode of the
 * tensor, and a mode ordering, the order in which the modes are stored. Mode
 * ordering {@code [1, 0]} for a matrix means column-major storage.
 *
 * <p>The index notation does not interpret formats, except that the
 * transposition check follows mode orderings.
 */
public final class Format {
  private final ImmutableList<ModeFormat> modeFormats;
  private final ImmutableList<Integer> modeOrdering;

  private Format(ImmutableList<ModeFormat> modeFormats,
      ImmutableList<Integer> modeOrdering) {
    this.modeFormats = modeFormats;
    this.modeOrdering = modeOrdering;
  }

  /** Creates a format with given mode formats and mode ordering. The mode
   * ordering must be a permutation of {@code 0 .. n - 1}. */
  public static Format of(List<ModeFormat> modeFormats,
      List<Integer> modeOrdering) {
    checkArgument(modeFormats.size() == modeOrdering.size(),
        "%s mode formats but %s entries in mode ordering",
        modeFormats.size(), modeOrdering.size());
    final ImmutableSet<Integer> set = ImmutableSet.copyOf(modeOrdering);
    for (int i = 0; i < modeOrdering.size(); i++) {
      checkArgument(set.contains(i), "mode ordering %s is not a permutation",
          modeOrdering);
    }
    return new Format(ImmutableList.copyOf(modeFormats),
        ImmutableList.copyOf(modeOrdering));
  }

  /** Creates a format with given mode formats, stored in mode order. */
  public static Format of(ModeFormat... modeFormats) {
    return of(Arrays.asList(modeFormats), identity(modeFormats.length));
  }

  /** Creates an all-dense format of a given order, stored in mode order. */
  public static Format dense(int order) {
    final ModeFormat[] modeFormats = new ModeFormat[order];
    Arrays.fill(modeFormats, ModeFormat.DENSE);
    return of(modeFormats);
  }

  private static List<Integer> identity(int n) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(i);
    }
    return b.build();
  }

  /** Returns the number of modes. */
  public int getOrder() {
    return modeFormats.size();
  }

  public List<ModeFormat> getModeFormats() {
    return modeFormats;
  }

  public List<Integer> getModeOrdering() {
    return modeOrdering;
  }

  /** Returns whether every mode is dense. */
  public boolean isDense() {
    return !modeFormats.contains(ModeFormat.SPARSE);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modeFormats, modeOrdering);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Format
            && modeFormats.equals(((Format) o).modeFormats)
            && modeOrdering.equals(((Format) o).modeOrdering);
  }

  /** Returns a string such as "(ds;1,0)". */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(");
    modeFormats.forEach(modeFormat -> b.append(modeFormat.abbrev));
    b.append(';');
    for (int i = 0; i < modeOrdering.size(); i++) {
      b.append(i == 0 ? "" : ",").append(modeOrdering.get(i));
    }
    return b.append(')').toString();
  }

  /** Format of one mode of a tensor. */
  public enum ModeFormat {
    DENSE('d'),
    SPARSE('s');

    public final char abbrev;

    ModeFormat(char abbrev) {
      this.abbrev = abbrev;
    }
  }
}

// End Format.java
