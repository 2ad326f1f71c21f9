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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Name of a function symbol, predicate symbol or sort.
 *
 * <p>A name is either reserved, written with a leading {@code $} (for
 * example {@code $int} or {@code $array}), or defined by the user (an
 * {@link Atom}).
 *
 * @param <T> Vocabulary of the reserved names
 */
public abstract class Name<T extends Enum<T>> {
  private Name() {}

  /** Creates a reserved name. */
  public static <T extends Enum<T>> Name<T> reserved(Reserved<T> reserved) {
    return new ReservedName<>(reserved);
  }

  /** Creates a reserved name from a standard member. */
  public static <T extends Enum<T>> Name<T> standard(T value) {
    return new ReservedName<>(Reserved.standard(value));
  }

  /** Creates a name defined by the user. */
  public static <T extends Enum<T>> Name<T> defined(Atom atom) {
    return new DefinedName<>(atom);
  }

  /** Creates a name defined by the user. */
  public static <T extends Enum<T>> Name<T> defined(String atom) {
    return new DefinedName<>(Atom.of(atom));
  }

  /** Returns the reserved identifier, or null if this is a defined name. */
  public abstract @Nullable Reserved<T> reserved();

  /** Returns the atom, or null if this is a reserved name. */
  public abstract @Nullable Atom atom();

  /** Returns the standard member if this is a standard reserved name. */
  public @Nullable T standardValue() {
    final Reserved<T> reserved = reserved();
    return reserved == null ? null : reserved.standardValue();
  }

  /** Name reserved in the TPTP language. */
  public static final class ReservedName<T extends Enum<T>> extends Name<T> {
    public final Reserved<T> reserved;

    ReservedName(Reserved<T> reserved) {
      this.reserved = requireNonNull(reserved);
    }

    @Override
    public Reserved<T> reserved() {
      return reserved;
    }

    @Override
    public @Nullable Atom atom() {
      return null;
    }

    @Override
    public int hashCode() {
      return reserved.hashCode() * 31;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof ReservedName
              && reserved.equals(((ReservedName<?>) obj).reserved);
    }

    @Override
    public String toString() {
      final T value = reserved.standardValue();
      if (value instanceof Named) {
        return "$" + ((Named) value).moniker();
      }
      return value != null
          ? "$" + value
          : "$" + ((Reserved.Extended<T>) reserved).text;
    }
  }

  /** Name defined by the user. */
  public static final class DefinedName<T extends Enum<T>> extends Name<T> {
    public final Atom atom;

    DefinedName(Atom atom) {
      this.atom = requireNonNull(atom);
    }

    @Override
    public @Nullable Reserved<T> reserved() {
      return null;
    }

    @Override
    public Atom atom() {
      return atom;
    }

    @Override
    public int hashCode() {
      return atom.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof DefinedName
              && atom.equals(((DefinedName<?>) obj).atom);
    }

    @Override
    public String toString() {
      return atom.toString();
    }
  }
}

// End Name.java
