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

import net.hydromatic.tptp.parse.Lexer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identifier reserved by the TPTP language or by a theorem prover that
 * implements it.
 *
 * <p>A reserved identifier is either a {@link Standard} member of a closed
 * vocabulary, or an {@link Extended} identifier that is not part of standard
 * TPTP. For example, Vampire implements the sort constructor {@code $array}.
 *
 * <p>An {@code Extended} value is never created for text that is the name of
 * a standard member; use {@link #extended(Class, String)} or
 * {@link Vocabulary#extended(String)}.
 *
 * @param <T> Vocabulary type
 */
public abstract class Reserved<T extends Enum<T>> {
  private Reserved() {}

  /** Creates a standard identifier. */
  public static <T extends Enum<T>> Reserved<T> standard(T value) {
    return new Standard<>(value);
  }

  /**
   * Converts text to a reserved identifier. Returns a {@link Standard} value
   * if the text is the name of a member of the vocabulary, otherwise an
   * {@link Extended} value.
   */
  public static <T extends Enum<T> & Named> Reserved<T> extended(
      Class<T> vocabularyClass, String text) {
    return Vocabulary.of(vocabularyClass).extended(text);
  }

  /**
   * Returns whether a string is a valid reserved identifier, that is,
   * matches {@code [a-z][a-zA-Z0-9_]*}.
   */
  public static boolean isValidReserved(String s) {
    if (s.isEmpty() || !Lexer.isAsciiLower(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      if (!Lexer.isAlphaNumeric(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the standard member, or null if this is extended. */
  public abstract @Nullable T standardValue();

  /** Returns the text of this identifier, given the vocabulary. */
  public abstract String text(Vocabulary<T> vocabulary);

  /** Identifier defined by the TPTP language. */
  public static final class Standard<T extends Enum<T>> extends Reserved<T> {
    public final T value;

    Standard(T value) {
      this.value = requireNonNull(value);
    }

    @Override
    public T standardValue() {
      return value;
    }

    @Override
    public String text(Vocabulary<T> vocabulary) {
      return vocabulary.name(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Standard && value == ((Standard<?>) obj).value;
    }

    @Override
    public String toString() {
      return "Standard(" + value + ")";
    }
  }

  /** Identifier not contained in standard TPTP. */
  public static final class Extended<T extends Enum<T>> extends Reserved<T> {
    public final String text;

    Extended(String text) {
      this.text = requireNonNull(text);
    }

    @Override
    public @Nullable T standardValue() {
      return null;
    }

    @Override
    public String text(Vocabulary<T> vocabulary) {
      return text;
    }

    @Override
    public int hashCode() {
      return text.hashCode() + 17;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Extended && text.equals(((Extended<?>) obj).text);
    }

    @Override
    public String toString() {
      return "Extended(" + text + ")";
    }
  }
}

// End Reserved.java
