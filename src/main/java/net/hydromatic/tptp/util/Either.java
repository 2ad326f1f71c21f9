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
package net.hydromatic.tptp.util;

import static java.util.Objects.requireNonNull;


/**
 * Value that is one of two alternatives.
 *
 * <p>By convention the left alternative is tried first when parsing, and
 * in {@code Either<NoSuccess, Success>} holds the negative outcome.
 *
 * @param <L> Left type
 * @param <R> Right type
 */
public abstract class Either<L, R> {
  private Either() {}

  /** Creates a left value. */
  public static <L, R> Either<L, R> left(L value) {
    return new Left<>(value);
  }

  /** Creates a right value. */
  public static <L, R> Either<L, R> right(R value) {
    return new Right<>(value);
  }

  /** Whether this is a left value. */
  public abstract boolean isLeft();

  /** Returns the left value; throws if this is a right value. */
  public abstract L left();

  /** Returns the right value; throws if this is a left value. */
  public abstract R right();

  /** Left alternative. */
  private static final class Left<L, R> extends Either<L, R> {
    private final L value;

    Left(L value) {
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isLeft() {
      return true;
    }

    @Override
    public L left() {
      return value;
    }

    @Override
    public R right() {
      throw new IllegalStateException("left value " + value);
    }

    @Override
    public int hashCode() {
      return value.hashCode() * 31;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Left && value.equals(((Left<?, ?>) obj).value);
    }

    @Override
    public String toString() {
      return "Left(" + value + ")";
    }
  }

  /** Right alternative. */
  private static final class Right<L, R> extends Either<L, R> {
    private final R value;

    Right(R value) {
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isLeft() {
      return false;
    }

    @Override
    public L left() {
      throw new IllegalStateException("right value " + value);
    }

    @Override
    public R right() {
      return value;
    }

    @Override
    public int hashCode() {
      return value.hashCode() * 37 + 1;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Right && value.equals(((Right<?, ?>) obj).value);
    }

    @Override
    public String toString() {
      return "Right(" + value + ")";
    }
  }
}

// End Either.java
