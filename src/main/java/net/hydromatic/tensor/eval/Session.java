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
package net.hydromatic.tensor.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.tensor.ast.Expr;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.IndexVar;
import net.hydromatic.tensor.ast.TensorVar;
import net.hydromatic.tensor.compile.Einsum;
import net.hydromatic.tensor.compile.Simplifier;
import net.hydromatic.tensor.compile.Tracer;
import net.hydromatic.tensor.compile.Tracers;
import net.hydromatic.tensor.type.Format;
import net.hydromatic.tensor.type.Type;
import net.hydromatic.tensor.util.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Session.
 *
 * <p>Holds the properties that control how definitions are checked, and a
 * tracer that is told about definitions, rewrites and errors. Index variables
 * and tensors created by a session use its name prefixes, and tensors
 * created by a session are checked using its properties.
 *
 * <p>A session is immutable; {@link #withProp} and {@link #withTracer} create
 * a new session that generates names from the same sequence.
 */
public class Session {
  /** Session used by index variables and tensors that are created without
   * one. */
  public static final Session DEFAULT =
      new Session(ImmutableMap.of(), Tracers.empty());

  /** Property values. Properties that are not present have their default
   * value. */
  public final ImmutableMap<Prop, Object> map;
  public final Tracer tracer;
  private final NameGenerator nameGenerator;

  /** Creates a Session. */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this(map, tracer, new NameGenerator());
  }

  private Session(Map<Prop, Object> map, Tracer tracer,
      NameGenerator nameGenerator) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>();
    map.forEach((prop, value) -> prop.set(map2, value));
    this.map = ImmutableMap.copyOf(map2);
    this.tracer = requireNonNull(tracer, "tracer");
    this.nameGenerator = requireNonNull(nameGenerator, "nameGenerator");
  }

  /** Returns a session that is the same as this but with one property
   * value changed. */
  public Session withProp(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.set(map2, value);
    return new Session(map2, tracer, nameGenerator);
  }

  /** Returns a session that is the same as this but with a different
   * tracer. */
  public Session withTracer(Tracer tracer) {
    return new Session(map, tracer, nameGenerator);
  }

  /** Generates a name for an index variable. */
  public String newIndexVarName() {
    return nameGenerator.get(Prop.INDEX_VAR_PREFIX.stringValue(map));
  }

  /** Generates a name for a tensor. */
  public String newTensorName() {
    return nameGenerator.get(Prop.TENSOR_VAR_PREFIX.stringValue(map));
  }

  /** Creates an index variable with a generated name. */
  public IndexVar indexVar() {
    return new IndexVar(newIndexVarName());
  }

  /** Creates an index variable. */
  public IndexVar indexVar(String name) {
    return new IndexVar(name);
  }

  /** Creates a dense tensor with a generated name. */
  public TensorVar tensorVar(Type type) {
    return new TensorVar(this, null, type, Format.dense(type.getOrder()));
  }

  /** Creates a dense tensor. */
  public TensorVar tensorVar(String name, Type type) {
    return new TensorVar(this, name, type, Format.dense(type.getOrder()));
  }

  /** Creates a tensor. */
  public TensorVar tensorVar(String name, Type type, Format format) {
    return new TensorVar(this, name, type, format);
  }

  /** Converts the definition of a tensor to one with explicit reductions,
   * and reports the rewrite to the tracer.
   *
   * @see Einsum#einsum(TensorVar) */
  public @Nullable IndexExpr einsum(TensorVar tensor) {
    final IndexExpr e = tensor.getIndexExpr();
    final IndexExpr e2 = Einsum.einsum(tensor);
    if (e != null) {
      tracer.onRewrite("einsum", e, e2);
    }
    return e2;
  }

  /** Simplifies an expression, and reports the rewrite to the tracer.
   *
   * @see Simplifier#simplify */
  public @Nullable IndexExpr simplify(IndexExpr e, Set<Expr.Access> zeroed) {
    final IndexExpr e2 = Simplifier.simplify(e, zeroed);
    tracer.onRewrite("simplify", e, e2);
    return e2;
  }
}

// End Session.java
