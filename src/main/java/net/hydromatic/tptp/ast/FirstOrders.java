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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.tptp.type.QuantifiedSort;
import net.hydromatic.tptp.type.Sort;
import net.hydromatic.tptp.type.Sorted;
import net.hydromatic.tptp.type.TFF1Sort;
import net.hydromatic.tptp.type.Unsorted;
import net.hydromatic.tptp.util.Either;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Conversions between the flavors of {@link FirstOrder}. */
public final class FirstOrders {
  private FirstOrders() {}

  /** Converts an unsorted formula to a sorted formula whose quantified
   * variables all omit their sort. Always succeeds. */
  public static <S> FirstOrder<Sorted<S>> sortFirstOrder(
      FirstOrder<Unsorted> formula) {
    return formula.map(u -> Sorted.omitted());
  }

  /** Erases the sort annotations of a sorted formula. Returns null unless
   * every quantified variable omits its sort. */
  public static <S> @Nullable FirstOrder<Unsorted> unsortFirstOrder(
      FirstOrder<Sorted<S>> formula) {
    return formula.traverse(s -> s.isOmitted() ? Unsorted.INSTANCE : null);
  }

  /** Converts a monomorphic formula to a polymorphic one. Always
   * succeeds. */
  public static FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>>
      polymorphizeFirstOrder(FirstOrder<Sorted<Name<Sort>>> formula) {
    return formula.map(s ->
        s.isOmitted()
            ? Sorted.omitted()
            : Sorted.of(Either.right(TFF1Sort.of(s.sort))));
  }

  /**
   * Converts a polymorphic formula to a monomorphic one. Returns null if
   * any quantified variable is annotated with {@code $tType} or with a sort
   * that is not a constructor of zero arity.
   */
  public static @Nullable FirstOrder<Sorted<Name<Sort>>>
      monomorphizeFirstOrder(
          FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> formula) {
    return formula.traverse(s ->
        s.traverse(e -> e.isLeft() ? null : e.right().monomorphize()));
  }

  /**
   * Makes applications of associative connectives left-associative.
   *
   * <p>{@code f & (g & h)} becomes {@code (f & g) & h}; {@code f => (g => h)}
   * is unchanged.
   *
   * <p>The formula is walked with explicit stacks rather than by recursion,
   * so that long chains of connectives do not exhaust the Java stack.
   */
  public static <S> FirstOrder<S> reassociate(FirstOrder<S> formula) {
    final Deque<Task<S>> tasks = new ArrayDeque<>();
    final Deque<FirstOrder<S>> results = new ArrayDeque<>();
    tasks.push(new Task<>(formula, -1));
    while (!tasks.isEmpty()) {
      final Task<S> task = tasks.pop();
      if (task.arity >= 0) {
        // Operands are on top of the results stack, the last on top
        final List<FirstOrder<S>> operands = new ArrayList<>();
        for (int i = 0; i < task.arity; i++) {
          operands.add(results.pop());
        }
        results.push(rebuild(task.formula, Lists.reverse(operands)));
      } else {
        final List<FirstOrder<S>> operands = operands(task.formula);
        tasks.push(new Task<>(task.formula, operands.size()));
        for (int i = operands.size() - 1; i >= 0; i--) {
          tasks.push(new Task<>(operands.get(i), -1));
        }
      }
    }
    return results.pop();
  }

  /** Returns the sub-formulas that {@link #reassociate} rewrites before it
   * rebuilds a formula. For an associative connective, these are the
   * operands of the whole cluster of applications of that connective, in
   * order. */
  private static <S> List<FirstOrder<S>> operands(FirstOrder<S> formula) {
    switch (formula.op) {
    case ATOMIC:
      return ImmutableList.of();
    case NEGATED:
      return ImmutableList.of(((FirstOrder.Negated<S>) formula).formula);
    case QUANTIFIED:
      return ImmutableList.of(((FirstOrder.Quantified<S>) formula).formula);
    case CONNECTED:
      final FirstOrder.Connected<S> connected =
          (FirstOrder.Connected<S>) formula;
      final Connective c = connected.connective;
      if (!c.isAssociative()) {
        return ImmutableList.of(connected.left, connected.right);
      }
      final List<FirstOrder<S>> operands = new ArrayList<>();
      final Deque<FirstOrder<S>> stack = new ArrayDeque<>();
      stack.push(connected);
      while (!stack.isEmpty()) {
        final FirstOrder<S> f = stack.pop();
        if (f.op == Op.CONNECTED
            && ((FirstOrder.Connected<S>) f).connective == c) {
          stack.push(((FirstOrder.Connected<S>) f).right);
          stack.push(((FirstOrder.Connected<S>) f).left);
        } else {
          operands.add(f);
        }
      }
      return operands;
    default:
      throw new AssertionError("unexpected " + formula.op);
    }
  }

  /** Rebuilds a formula from its rewritten operands. */
  private static <S> FirstOrder<S> rebuild(FirstOrder<S> formula,
      List<FirstOrder<S>> operands) {
    switch (formula.op) {
    case ATOMIC:
      return formula;
    case NEGATED:
      return FirstOrder.negated(operands.get(0));
    case QUANTIFIED:
      final FirstOrder.Quantified<S> quantified =
          (FirstOrder.Quantified<S>) formula;
      return FirstOrder.quantified(quantified.quantifier, quantified.bindings,
          operands.get(0));
    case CONNECTED:
      final Connective c = ((FirstOrder.Connected<S>) formula).connective;
      FirstOrder<S> f = operands.get(0);
      for (FirstOrder<S> operand : operands.subList(1, operands.size())) {
        f = FirstOrder.connected(f, c, operand);
      }
      return f;
    default:
      throw new AssertionError("unexpected " + formula.op);
    }
  }

  /** Step of {@link #reassociate}: a formula to expand (arity -1), or to
   * rebuild from the given number of rewritten operands. */
  private static final class Task<S> {
    final FirstOrder<S> formula;
    final int arity;

    Task(FirstOrder<S> formula, int arity) {
      this.formula = formula;
      this.arity = arity;
    }
  }
}

// End FirstOrders.java
