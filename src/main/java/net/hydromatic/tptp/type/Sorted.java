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
package net.hydromatic.tptp.type;

import java.util.Objects;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sort annotation of a variable in sorted first-order logic.
 *
 * <p>The annotation may be omitted, in which case the variable has the sort
 * of individuals, {@code $i}.
 *
 * @param <S> Sort representation
 */
public final class Sorted<S> {
  @SuppressWarnings("rawtypes")
  private static final Sorted OMITTED = new Sorted<>(null);

  public final @Nullable S sort;

  private Sorted(@Nullable S sort) {
    this.sort = sort;
  }

  /** Creates an annotation with an explicit sort. */
  public static <S> Sorted<S> of(S sort) {
    return new Sorted<>(Objects.requireNonNull(sort));
  }

  /** Returns an annotation that omits the sort. */
  @SuppressWarnings("unchecked")
  public static <S> Sorted<S> omitted() {
    return (Sorted<S>) OMITTED;
  }

  /** Whether the sort is omitted. */
  public boolean isOmitted() {
    return sort == null;
  }

  /**
   * Converts the sort with a function that may fail. An omitted sort stays
   * omitted; returns null if the function returns null.
   */
  public <T> @Nullable Sorted<T> traverse(Function<S, @Nullable T> fn) {
    if (sort == null) {
      return omitted();
    }
    final T t = fn.apply(sort);
    return t == null ? null : of(t);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sort);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Sorted && Objects.equals(sort, ((Sorted<?>) obj).sort);
  }

  @Override
  public String toString() {
    return sort == null ? "Sorted()" : "Sorted(" + sort + ")";
  }
}

// End Sorted.java
