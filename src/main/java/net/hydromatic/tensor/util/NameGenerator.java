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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names.
 *
 * <p>Names consist of a prefix followed by an ordinal. The ordinal is shared
 * between all prefixes, so "i0" and "A1" may be generated, but never "i0" and
 * "A0".
 */
public class NameGenerator {
  private final AtomicInteger id = new AtomicInteger();

  /** Generates a name that is unique among names created by this generator. */
  public String get(String prefix) {
    checkArgument(!prefix.isEmpty(), "empty prefix");
    return prefix + id.getAndIncrement();
  }
}

// End NameGenerator.java
