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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of applying a {@link Parser} at an offset of the input.
 *
 * <p>A {@link Success} holds a value and the offset just after the consumed
 * input. A {@link Failure} holds the offset where parsing failed and the
 * labels of the productions being attempted, innermost first.
 *
 * <p>A success also remembers the furthest failure seen while producing it.
 * If a later step fails, the error reports whichever of the two got further.
 *
 * @param <T> Value type
 */
public abstract class Result<T> {
  private Result() {}

  /** Creates a success. */
  public static <T> Result<T> success(T value, int end,
      @Nullable Failure<?> furthest) {
    return new Success<>(value, end, furthest);
  }

  /** Creates a failure with a single label. */
  public static <T> Failure<T> failure(int offset, String label) {
    return new Failure<>(offset, ImmutableList.of(label));
  }

  /** Returns whichever of two failures got further into the input; on a
   * tie, the later one. */
  static @Nullable Failure<?> furthest(@Nullable Failure<?> earlier,
      @Nullable Failure<?> later) {
    if (earlier == null) {
      return later;
    }
    if (later == null) {
      return earlier;
    }
    return later.offset >= earlier.offset ? later : earlier;
  }

  /** Whether this is a success. */
  public abstract boolean isSuccess();

  /** Returns the value; throws if this is a failure. */
  public abstract T value();

  /** Returns the offset after the consumed input; throws if this is a
   * failure. */
  public abstract int end();

  /** Returns the furthest failure; for a failure, itself. */
  public abstract @Nullable Failure<?> furthest();

  /** Successful result. */
  public static final class Success<T> extends Result<T> {
    private final T value;
    private final int end;
    private final @Nullable Failure<?> furthest;

    Success(T value, int end, @Nullable Failure<?> furthest) {
      this.value = value;
      this.end = end;
      this.furthest = furthest;
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T value() {
      return value;
    }

    @Override
    public int end() {
      return end;
    }

    @Override
    public @Nullable Failure<?> furthest() {
      return furthest;
    }

    @Override
    public String toString() {
      return "Success(" + value + ", " + end + ")";
    }
  }

  /** Failed result. */
  public static final class Failure<T> extends Result<T> {
    public final int offset;
    /** Labels of productions, innermost first. */
    public final ImmutableList<String> labels;

    Failure(int offset, ImmutableList<String> labels) {
      this.offset = offset;
      this.labels = requireNonNull(labels);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("failed at " + offset + ": " + labels);
    }

    @Override
    public int end() {
      throw new IllegalStateException("failed at " + offset + ": " + labels);
    }

    @Override
    public Failure<T> furthest() {
      return this;
    }

    /** Returns this failure with an outer label added. */
    Failure<T> within(String label) {
      return new Failure<>(offset,
          ImmutableList.<String>builder().addAll(labels).add(label).build());
    }

    /** Returns this failure, typed for another value type. */
    @SuppressWarnings("unchecked")
    <U> Failure<U> cast() {
      return (Failure<U>) this;
    }

    @Override
    public String toString() {
      return "Failure(" + offset + ", " + labels + ")";
    }
  }
}

// End Result.java
