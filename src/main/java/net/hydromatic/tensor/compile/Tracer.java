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

import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.TensorVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while index expressions are defined and
 * transformed.
 *
 * @see Tracers */
public interface Tracer {
  /** Called when a tensor's definition has been validated and set. */
  void onDefinition(TensorVar tensorVar);

  /** Called when an expression has been rewritten.
   *
   * @param name Name of the rewrite, for example "einsum"
   * @param before Expression before the rewrite
   * @param after Expression after the rewrite; null if undefined
   */
  void onRewrite(String name, IndexExpr before, @Nullable IndexExpr after);

  /** Called with an exception that is about to be thrown because a
   * definition is invalid. */
  void onException(NotationException e);
}

// End Tracer.java
