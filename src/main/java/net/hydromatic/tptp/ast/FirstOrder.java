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
package net.hydromatic.tptp.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import net.hydromatic.tptp.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Formula in sorted or unsorted first-order logic.
 *
 * <p>The only syntactic difference between sorted and unsorted formulas is
 * that quantified variables in sorted formulas may be annotated with a sort.
 * The type parameter is the annotation:
 *
 * <ul>
 *   <li>{@link net.hydromatic.tptp.type.Unsorted} for unsorted logic (FOF);
 *   <li>{@code Sorted<Name<Sort>>} for sorted monomorphic logic (TFF0);
 *   <li>{@code Sorted<Either<QuantifiedSort, TFF1Sort>>} for sorted
 *       polymorphic logic (TFF1).
 * </ul>
 *
 * <p>{@link FirstOrders} converts between these.
 *
 * @param <S> Sort annotation
 */
public abstract class FirstOrder<S> extends AstNode {
  private FirstOrder(Op op) {
    super(op);
  }

  /** Creates an atomic formula. */
  public static <S> FirstOrder<S> atomic(Literal literal) {
    return new Atomic<>(literal);
  }

  /** Creates a negation. */
  public static <S> FirstOrder<S> negated(FirstOrder<S> formula) {
    return new Negated<>(formula);
  }

  /** Creates an application of a binary connective. */
  public static <S> FirstOrder<S> connected(FirstOrder<S> left,
      Connective connective, FirstOrder<S> right) {
    return new Connected<>(left, connective, right);
  }

  /**
   * Creates a quantified formula, or returns the formula itself if the list
   * of variables is empty.
   */
  public static <S> FirstOrder<S> quantified(Quantifier quantifier,
      List<Binding<S>> bindings, FirstOrder<S> formula) {
    if (bindings.isEmpty()) {
      return formula;
    }
    return new Quantified<>(quantifier, ImmutableList.copyOf(bindings),
        formula);
  }

  /**
   * Converts each sort annotation with a function that may fail. Returns
   * null if the function returns null for any annotation.
   */
  public abstract <R> @Nullable FirstOrder<R> traverse(
      Function<S, @Nullable R> fn);

  /** Converts each sort annotation with a function. */
  public <R> FirstOrder<R> map(Function<S, R> fn) {
    return requireNonNull(traverse(fn::apply));
  }

  /** Atomic formula. */
  public static final class Atomic<S> extends FirstOrder<S> {
    public final Literal literal;

    Atomic(Literal literal) {
      super(Op.ATOMIC);
      this.literal = requireNonNull(literal);
    }

    @Override
    public <R> FirstOrder<R> traverse(Function<S, @Nullable R> fn) {
      return new Atomic<>(literal);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return literal.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return literal.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Atomic && literal.equals(((Atomic<?>) obj).literal);
    }
  }

  /** Negated formula. */
  public static final class Negated<S> extends FirstOrder<S> {
    public final FirstOrder<S> formula;

    Negated(FirstOrder<S> formula) {
      super(Op.NEGATED);
      this.formula = requireNonNull(formula);
    }

    @Override
    public <R> @Nullable FirstOrder<R> traverse(Function<S, @Nullable R> fn) {
      final FirstOrder<R> f = formula.traverse(fn);
      return f == null ? null : new Negated<>(f);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf.append("~("))
          .append(')');
    }

    @Override
    public int hashCode() {
      return formula.hashCode() * 37;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Negated
              && formula.equals(((Negated<?>) obj).formula);
    }
  }

  /** Application of a binary connective. */
  public static final class Connected<S> extends FirstOrder<S> {
    public final FirstOrder<S> left;
    public final Connective connective;
    public final FirstOrder<S> right;

    Connected(FirstOrder<S> left, Connective connective,
        FirstOrder<S> right) {
      super(Op.CONNECTED);
      this.left = requireNonNull(left);
      this.connective = requireNonNull(connective);
      this.right = requireNonNull(right);
    }

    @Override
    public <R> @Nullable FirstOrder<R> traverse(Function<S, @Nullable R> fn) {
      final FirstOrder<R> l = left.traverse(fn);
      if (l == null) {
        return null;
      }
      final FirstOrder<R> r = right.traverse(fn);
      return r == null ? null : new Connected<>(l, connective, r);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      left.describeTo(buf.append('('))
          .append(' ').append(connective.moniker()).append(' ');
      return right.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, connective, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Connected
              && left.equals(((Connected<?>) obj).left)
              && connective == ((Connected<?>) obj).connective
              && right.equals(((Connected<?>) obj).right);
    }
  }

  /** Quantified formula; binds one or more variables. */
  public static final class Quantified<S> extends FirstOrder<S> {
    public final Quantifier quantifier;
    public final ImmutableList<Binding<S>> bindings;
    public final FirstOrder<S> formula;

    Quantified(Quantifier quantifier, ImmutableList<Binding<S>> bindings,
        FirstOrder<S> formula) {
      super(Op.QUANTIFIED);
      checkArgument(!bindings.isEmpty(), "no variables under quantifier");
      this.quantifier = requireNonNull(quantifier);
      this.bindings = bindings;
      this.formula = requireNonNull(formula);
    }

    @Override
    public <R> @Nullable FirstOrder<R> traverse(Function<S, @Nullable R> fn) {
      final ImmutableList<Binding<R>> bindings2 =
          Static.traverse(bindings, b -> b.traverse(fn));
      if (bindings2 == null) {
        return null;
      }
      final FirstOrder<R> f = formula.traverse(fn);
      return f == null ? null : new Quantified<>(quantifier, bindings2, f);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(quantifier.moniker()).append(' ');
      Static.appendList(buf, bindings).append(" : ");
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return Objects.hash(quantifier, bindings, formula);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Quantified
              && quantifier == ((Quantified<?>) obj).quantifier
              && bindings.equals(((Quantified<?>) obj).bindings)
              && formula.equals(((Quantified<?>) obj).formula);
    }
  }

  /**
   * Variable bound by a quantifier, with its sort annotation.
   *
   * @param <S> Sort annotation
   */
  public static final class Binding<S> {
    public final Var var;
    public final S sort;

    private Binding(Var var, S sort) {
      this.var = requireNonNull(var);
      this.sort = requireNonNull(sort);
    }

    /** Creates a Binding. */
    public static <S> Binding<S> of(Var var, S sort) {
      return new Binding<>(var, sort);
    }

    /** Converts the sort annotation with a function that may fail. */
    public <R> @Nullable Binding<R> traverse(Function<S, @Nullable R> fn) {
      final R r = fn.apply(sort);
      return r == null ? null : new Binding<>(var, r);
    }

    @Override
    public int hashCode() {
      return var.hashCode() * 31 + sort.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Binding
              && var.equals(((Binding<?>) obj).var)
              && sort.equals(((Binding<?>) obj).sort);
    }

    @Override
    public String toString() {
      return var + ": " + sort;
    }
  }
}

// End FirstOrder.java
