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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensor.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.tensor.type.DataType;
import net.hydromatic.tensor.util.Complex;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Index expression nodes.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Create nodes using {@link ExprBuilder}, or the arithmetic methods of
 * {@link IndexExpr}.
 */
public class Expr {
  private Expr() {}

  /** Read of a tensor at a tuple of index variables, such as
   * "{@code A(i,j)}".
   *
   * <p>An access to a tensor is also the left-hand side of an assignment; see
   * {@link #assign} and {@link #plusAssign}. */
  public static class Access extends IndexExpr {
    public final TensorVar tensorVar;
    public final ImmutableList<IndexVar> indexVars;

    Access(TensorVar tensorVar, ImmutableList<IndexVar> indexVars) {
      super(Op.ACCESS, tensorVar.getType().getDataType());
      this.tensorVar = tensorVar;
      this.indexVars = requireNonNull(indexVars);
    }

    public TensorVar getTensorVar() {
      return tensorVar;
    }

    public List<IndexVar> getIndexVars() {
      return indexVars;
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Defines the accessed tensor, "{@code A(i,j) = expr}".
     *
     * @throws net.hydromatic.tensor.compile.NotationException if the
     * tensor is already defined, or if the definition is invalid */
    public void assign(IndexExpr e) {
      tensorVar.setIndexExpression(indexVars, e, false);
    }

    /** Defines the accessed tensor by accumulation,
     * "{@code A(i,j) += expr}". */
    public void plusAssign(IndexExpr e) {
      tensorVar.setIndexExpression(indexVars, e, true);
    }
  }

  /** Base class for expressions with one operand. */
  public abstract static class Unary extends IndexExpr {
    public final IndexExpr a;

    Unary(Op op, IndexExpr a) {
      super(op, requireNonNull(a, "a").dataType);
      this.a = a;
    }

    @Override public void forEachArg(Consumer<IndexExpr> action) {
      action.accept(a);
    }

    /** Creates a copy of this node with a given operand,
     * or {@code this} if the operand is the same. */
    public abstract Unary copy(IndexExpr a);
  }

  /** Negation, "{@code -a}". */
  public static class Neg extends Unary {
    Neg(IndexExpr a) {
      super(Op.NEGATE, a);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Neg copy(IndexExpr a) {
      return a == this.a ? this : expr.neg(a);
    }
  }

  /** Square root, "{@code sqrt(a)}". */
  public static class Sqrt extends Unary {
    Sqrt(IndexExpr a) {
      super(Op.SQRT, a);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Sqrt copy(IndexExpr a) {
      return a == this.a ? this : expr.sqrt(a);
    }
  }

  /** Base class for expressions with two operands.
   *
   * <p>The data type is the smallest type that can hold the values of both
   * operands. */
  public abstract static class Binary extends IndexExpr {
    public final IndexExpr a;
    public final IndexExpr b;

    Binary(Op op, IndexExpr a, IndexExpr b) {
      super(op,
          DataType.max(requireNonNull(a, "a").dataType,
              requireNonNull(b, "b").dataType));
      this.a = a;
      this.b = b;
    }

    @Override public void forEachArg(Consumer<IndexExpr> action) {
      action.accept(a);
      action.accept(b);
    }

    /** Creates a copy of this node with given operands,
     * or {@code this} if the operands are the same. */
    public abstract Binary copy(IndexExpr a, IndexExpr b);
  }

  /** Addition, "{@code a + b}". */
  public static class Add extends Binary {
    Add(IndexExpr a, IndexExpr b) {
      super(Op.PLUS, a, b);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Add copy(IndexExpr a, IndexExpr b) {
      return a == this.a && b == this.b ? this : expr.add(a, b);
    }
  }

  /** Subtraction, "{@code a - b}". */
  public static class Sub extends Binary {
    Sub(IndexExpr a, IndexExpr b) {
      super(Op.MINUS, a, b);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Sub copy(IndexExpr a, IndexExpr b) {
      return a == this.a && b == this.b ? this : expr.sub(a, b);
    }
  }

  /** Multiplication, "{@code a * b}". */
  public static class Mul extends Binary {
    Mul(IndexExpr a, IndexExpr b) {
      super(Op.TIMES, a, b);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Mul copy(IndexExpr a, IndexExpr b) {
      return a == this.a && b == this.b ? this : expr.mul(a, b);
    }
  }

  /** Division, "{@code a / b}". */
  public static class Div extends Binary {
    Div(IndexExpr a, IndexExpr b) {
      super(Op.DIVIDE, a, b);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public Div copy(IndexExpr a, IndexExpr b) {
      return a == this.a && b == this.b ? this : expr.div(a, b);
    }
  }

  /** Reduction over an index variable, such as
   * "{@code sum(k)(B(i,k) * C(k,j))}".
   *
   * <p>Binds {@link #var} within the body {@link #a}; the values of the body
   * for each value of the variable are combined using the binary operator
   * {@link #combiner}. */
  public static class Reduction extends IndexExpr {
    public final Op combiner;
    public final IndexVar var;
    public final IndexExpr a;

    Reduction(Op combiner, IndexVar var, IndexExpr a) {
      super(Op.REDUCTION, requireNonNull(a, "a").dataType);
      checkArgument(combiner.isBinary(), "not a combining operator: %s",
          combiner);
      this.combiner = combiner;
      this.var = requireNonNull(var, "var");
      this.a = a;
    }

    @Override public void forEachArg(Consumer<IndexExpr> action) {
      action.accept(a);
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this reduction with a given body,
     * or {@code this} if the body is the same. */
    public Reduction copy(IndexExpr a) {
      return a == this.a ? this : expr.reduction(combiner, var, a);
    }
  }

  /** Partially-built reduction; apply it to a body to create a
   * {@link Reduction}.
   *
   * @see ExprBuilder#sum(IndexVar) */
  public static class ReductionProxy {
    public final Op combiner;
    public final IndexVar var;

    ReductionProxy(Op combiner, IndexVar var) {
      this.combiner = combiner;
      this.var = var;
    }

    /** Creates a reduction with a given body. */
    public Reduction apply(IndexExpr a) {
      return expr.reduction(combiner, var, a);
    }
  }

  /** Base class for literals. */
  public abstract static class Immediate extends IndexExpr {
    Immediate(Op op, DataType dataType) {
      super(op, dataType);
    }

    /** Returns the value, boxed. */
    public abstract Object value();
  }

  /** Signed 64-bit integer literal. */
  public static class IntImm extends Immediate {
    public final long value;

    IntImm(long value) {
      super(Op.INT_IMM, DataType.INT64);
      this.value = value;
    }

    @Override public Long value() {
      return value;
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Unsigned 64-bit integer literal.
   *
   * <p>The value is held in a {@code long} and interpreted as unsigned; for
   * example, {@code -1L} represents 2<sup>64</sup> - 1. */
  public static class UIntImm extends Immediate {
    public final long value;

    UIntImm(long value) {
      super(Op.UINT_IMM, DataType.UINT64);
      this.value = value;
    }

    @Override public Long value() {
      return value;
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Double-precision floating-point literal. */
  public static class FloatImm extends Immediate {
    public final double value;

    FloatImm(double value) {
      super(Op.FLOAT_IMM, DataType.FLOAT64);
      this.value = value;
    }

    @Override public Double value() {
      return value;
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Double-precision complex literal. */
  public static class ComplexImm extends Immediate {
    public final Complex value;

    ComplexImm(Complex value) {
      super(Op.COMPLEX_IMM, DataType.COMPLEX128);
      this.value = requireNonNull(value);
    }

    @Override public Complex value() {
      return value;
    }

    @Override public void accept(StrictVisitor visitor) {
      visitor.visit(this);
    }

    @Override public @Nullable IndexExpr accept(StrictShuttle shuttle) {
      return shuttle.visit(this);
    }
  }
}

// End Expr.java
