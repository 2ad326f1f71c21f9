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
package net.hydromatic.tptp.parse;

import com.google.common.collect.ImmutableList;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of values of type {@code T}.
 *
 * <p>A parser is a function from the input and an offset to a
 * {@link Result}. Parsers hold no state, so one parser may be applied any
 * number of times, from any number of threads.
 *
 * <p>Alternatives are ordered: {@link #or} returns the first alternative
 * that succeeds, and after a failed alternative, retries from the same
 * offset. There is no memoization.
 *
 * @param <T> Value type
 */
@FunctionalInterface
public interface Parser<T> {
  /** Applies this parser at an offset of the input. */
  Result<T> parse(String input, int offset);

  /** Returns a parser that converts this parser's value. */
  default <R> Parser<R> map(Function<? super T, ? extends R> fn) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (!r.isSuccess()) {
        return ((Result.Failure<T>) r).cast();
      }
      return Result.success(fn.apply(r.value()), r.end(), r.furthest());
    };
  }

  /**
   * Returns a parser that converts this parser's value with a function that
   * may reject it. If the function returns null, the parser fails at the
   * offset where this parser started, with the given label.
   */
  default <R> Parser<R> mapOrFail(Function<? super T, ? extends @Nullable R> fn,
      String label) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (!r.isSuccess()) {
        return ((Result.Failure<T>) r).cast();
      }
      final R value = fn.apply(r.value());
      if (value == null) {
        return Result.failure(offset, label);
      }
      return Result.success(value, r.end(), r.furthest());
    };
  }

  /** Returns a parser that applies this parser and then another, combining
   * their values. */
  default <U, R> Parser<R> then(Parser<U> next,
      BiFunction<? super T, ? super U, ? extends R> fn) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (!r.isSuccess()) {
        return ((Result.Failure<T>) r).cast();
      }
      final Result<U> r2 = next.parse(input, r.end());
      final Result.Failure<?> furthest =
          Result.furthest(r.furthest(), r2.furthest());
      if (!r2.isSuccess()) {
        return requireFailure(furthest).cast();
      }
      return Result.success(fn.apply(r.value(), r2.value()), r2.end(),
          furthest);
    };
  }

  /** Returns a parser that applies this parser and then another, keeping
   * the value of the other. */
  default <U> Parser<U> andThen(Parser<U> next) {
    return then(next, (t, u) -> u);
  }

  /** Returns a parser that applies this parser and then another, keeping
   * the value of this. */
  default Parser<T> skip(Parser<?> next) {
    return then(next, (t, u) -> t);
  }

  /**
   * Returns a parser that applies this parser and then a parser that
   * depends on this parser's value.
   */
  default <R> Parser<R> flatMap(Function<? super T, Parser<R>> fn) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (!r.isSuccess()) {
        return ((Result.Failure<T>) r).cast();
      }
      final Result<R> r2 = fn.apply(r.value()).parse(input, r.end());
      final Result.Failure<?> furthest =
          Result.furthest(r.furthest(), r2.furthest());
      if (!r2.isSuccess()) {
        return requireFailure(furthest).cast();
      }
      return Result.success(r2.value(), r2.end(), furthest);
    };
  }

  /**
   * Returns a parser that tries this parser and, if it fails, another parser
   * at the same offset.
   *
   * <p>If both fail, reports the failure that got further into the input.
   */
  default Parser<T> or(Parser<? extends T> other) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (r.isSuccess()) {
        return r;
      }
      @SuppressWarnings("unchecked")
      final Result<T> r2 = (Result<T>) other.parse(input, offset);
      final Result.Failure<?> furthest =
          Result.furthest(r.furthest(), r2.furthest());
      if (!r2.isSuccess()) {
        return requireFailure(furthest).cast();
      }
      return Result.success(r2.value(), r2.end(), furthest);
    };
  }

  /** Returns a parser that succeeds with null, consuming nothing, if this
   * parser fails. */
  default Parser<@Nullable T> optional() {
    return orElse(null);
  }

  /** Returns a parser that succeeds with a default value, consuming
   * nothing, if this parser fails. */
  default Parser<T> orElse(T defaultValue) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (r.isSuccess()) {
        return r;
      }
      return Result.success(defaultValue, offset, r.furthest());
    };
  }

  /** Returns a parser that applies this parser zero or more times. */
  default Parser<ImmutableList<T>> many() {
    return (input, offset) -> {
      final ImmutableList.Builder<T> b = ImmutableList.builder();
      Result.Failure<?> furthest = null;
      int i = offset;
      for (;;) {
        final Result<T> r = parse(input, i);
        furthest = Result.furthest(furthest, r.furthest());
        if (!r.isSuccess() || r.end() == i) {
          // stop at a failure, or at a success that consumes nothing
          return Result.success(b.build(), i, furthest);
        }
        b.add(r.value());
        i = r.end();
      }
    };
  }

  /** Returns a parser that applies this parser one or more times,
   * separated by a separator. */
  default Parser<ImmutableList<T>> sepBy1(Parser<?> separator) {
    return then(separator.andThen(this).many(),
        (first, rest) -> ImmutableList.<T>builder()
            .add(first).addAll(rest).build());
  }

  /** Returns a parser that applies this parser zero or more times,
   * separated by a separator. */
  default Parser<ImmutableList<T>> sepBy(Parser<?> separator) {
    return sepBy1(separator).orElse(ImmutableList.of());
  }

  /**
   * Returns a parser that, if it fails, adds a label to the stack of
   * productions in its failure.
   */
  default Parser<T> label(String label) {
    return (input, offset) -> {
      final Result<T> r = parse(input, offset);
      if (!r.isSuccess()) {
        return ((Result.Failure<T>) r).within(label);
      }
      final Result.Failure<?> furthest = r.furthest();
      if (furthest == null || furthest.offset < r.end()) {
        return r;
      }
      // the furthest failure happened inside this production
      return Result.success(r.value(), r.end(), furthest.within(label));
    };
  }

  /** Casts a furthest failure that cannot be null, because the result it
   * came from failed. */
  static Result.Failure<?> requireFailure(Result.@Nullable Failure<?> f) {
    if (f == null) {
      throw new AssertionError("failed result has no failure");
    }
    return f;
  }
}

// End Parser.java
