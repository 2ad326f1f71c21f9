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

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.tptp.parse.Lexer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bidirectional table between the members of an enumeration and their
 * names.
 *
 * <p>The reverse table is ordered by descending name length, so that when
 * one name is a prefix of another (say {@code <=} and {@code <=>}) the
 * longer name is tried first.
 *
 * @param <T> Enumeration type
 */
public final class Vocabulary<T extends Enum<T>> {
  @SuppressWarnings("rawtypes")
  private static final LoadingCache<Class, Vocabulary> CACHE =
      CacheBuilder.newBuilder()
          .build(CacheLoader.from(Vocabulary::create));

  private final Class<T> enumClass;
  private final Map<T, String> names;
  private final ImmutableMap<String, T> byName;
  private final ImmutableList<T> longestFirst;

  private Vocabulary(Class<T> enumClass, Function<T, String> naming) {
    this.enumClass = requireNonNull(enumClass);
    this.names = new EnumMap<>(enumClass);
    final ImmutableMap.Builder<String, T> b = ImmutableMap.builder();
    for (T t : enumClass.getEnumConstants()) {
      final String name = naming.apply(t);
      checkArgument(!name.isEmpty(), "empty name for %s", t);
      names.put(t, name);
      b.put(name, t);
    }
    // buildOrThrow fails if two members share a name
    this.byName = b.buildOrThrow();
    this.longestFirst =
        ImmutableList.sortedCopyOf(
            Comparator.comparing((T t) -> -names.get(t).length())
                .thenComparing(names::get),
            names.keySet());
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static Vocabulary create(Class c) {
    return new Vocabulary(c, (Function<Named, String>) Named::moniker);
  }

  /**
   * Returns the vocabulary of an enumeration whose members are named by
   * {@link Named#moniker()}.
   */
  @SuppressWarnings("unchecked")
  public static <T extends Enum<T> & Named> Vocabulary<T> of(
      Class<T> enumClass) {
    return CACHE.getUnchecked(enumClass);
  }

  /**
   * Creates a vocabulary with a custom naming function; used when an
   * enumeration has more than one set of names, as the SZS ontologies do.
   */
  public static <T extends Enum<T>> Vocabulary<T> of(
      Class<T> enumClass, Function<T, String> naming) {
    return new Vocabulary<>(enumClass, naming);
  }

  /** Returns the name of a member. */
  public String name(T t) {
    return requireNonNull(names.get(t));
  }

  /** Returns the member with the given name, or null. */
  public @Nullable T lookup(String name) {
    return byName.get(name);
  }

  /** Returns the members in the order in which the parser tries them. */
  public List<T> longestFirst() {
    return longestFirst;
  }

  /**
   * Returns the member whose name occurs at a given offset of the input, or
   * null if there is none.
   *
   * <p>A name that ends in a word character only matches if it is not
   * followed by another word character; thus {@code int} does not match the
   * start of {@code integer}.
   */
  public @Nullable T match(String input, int offset) {
    for (T t : longestFirst) {
      final String name = names.get(t);
      if (input.startsWith(name, offset)) {
        final int end = offset + name.length();
        if (Lexer.isAlphaNumeric(name.charAt(name.length() - 1))
            && end < input.length()
            && Lexer.isAlphaNumeric(input.charAt(end))) {
          continue;
        }
        return t;
      }
    }
    return null;
  }

  /**
   * Converts text to a reserved identifier, returning a standard member if
   * the text is the name of one and an extended identifier otherwise.
   */
  public Reserved<T> extended(String text) {
    final T t = byName.get(text);
    return t != null
        ? new Reserved.Standard<>(t)
        : new Reserved.Extended<>(text);
  }

  @Override
  public String toString() {
    return "Vocabulary(" + enumClass.getSimpleName() + ")";
  }
}

// End Vocabulary.java
