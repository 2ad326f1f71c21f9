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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for building parsers. */
public final class Parsers {
  private Parsers() {}

  /** Returns a parser that succeeds with a value, consuming nothing. */
  public static <T> Parser<T> success(T value) {
    return (input, offset) -> Result.success(value, offset, null);
  }

  /** Returns a parser that succeeds, consuming nothing, only at the end of
   * the input. */
  public static Parser<Boolean> endOfInput() {
    return (input, offset) ->
        offset == input.length()
            ? Result.success(true, offset, null)
            : Result.failure(offset, "end of input");
  }

  /**
   * Returns a parser that tries each of a list of parsers in order, and
   * returns the result of the first that succeeds.
   */
  @SafeVarargs
  public static <T> Parser<T> choice(Parser<? extends T>... parsers) {
    return choice(Arrays.asList(parsers));
  }

  /** As {@link #choice(Parser[])}, for a list. */
  @SuppressWarnings("unchecked")
  public static <T> Parser<T> choice(List<? extends Parser<? extends T>> parsers) {
    checkArgument(!parsers.isEmpty(), "no alternatives");
    Parser<T> p = (Parser<T>) parsers.get(0);
    for (Parser<? extends T> parser : parsers.subList(1, parsers.size())) {
      p = p.or(parser);
    }
    return p;
  }

  /** Creates a reference to a parser that is not yet defined; used to build
   * recursive grammars. */
  public static <T> Ref<T> ref() {
    return new Ref<>();
  }

  /**
   * Parser that delegates to a parser that is defined later.
   *
   * @param <T> Value type
   */
  public static final class Ref<T> implements Parser<T> {
    private @Nullable Parser<T> parser;

    private Ref() {}

    /** Defines the parser and returns this reference. */
    public Parser<T> set(Parser<T> parser) {
      checkState(this.parser == null, "already set");
      this.parser = parser;
      return this;
    }

    @Override
    public Result<T> parse(String input, int offset) {
      final Parser<T> p = this.parser;
      checkState(p != null, "parser not set");
      return p.parse(input, offset);
    }
  }
}

// End Parsers.java
