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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.function.BiFunction;
import net.hydromatic.tptp.ast.Atom;
import net.hydromatic.tptp.ast.DistinctObject;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Reserved;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.ast.Vocabulary;

/**
 * Lexical layer of the TPTP language.
 *
 * <p>Between any two tokens there may be insignificant material: whitespace,
 * line comments that start with {@code %}, and block comments between
 * {@code /*} and <code>*&#47;</code>. A token parser wrapped in
 * {@link #lexeme} consumes the insignificant material that follows it, so
 * that the next parser starts at a token.
 */
public final class Lexer {
  private Lexer() {}

  // Character classes

  /** Whether a character is in {@code [a-z]}. */
  public static boolean isAsciiLower(char c) {
    return c >= 'a' && c <= 'z';
  }

  /** Whether a character is in {@code [A-Z]}. */
  public static boolean isAsciiUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }

  /** Whether a character is in {@code [0-9]}. */
  public static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Whether a character is in {@code [a-zA-Z0-9_]}. */
  public static boolean isAlphaNumeric(char c) {
    return isAsciiLower(c) || isAsciiUpper(c) || isDigit(c) || c == '_';
  }

  /** Whether a character is printable ASCII, 0x20 to 0x7E. */
  public static boolean isAsciiPrint(char c) {
    return c >= ' ' && c <= '~';
  }

  /** Whether every character of a string is printable ASCII. */
  public static boolean isAsciiPrint(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (!isAsciiPrint(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  // Insignificant material

  /**
   * Returns the offset of the first significant character at or after a
   * given offset, skipping whitespace, line comments and block comments.
   *
   * <p>An unterminated block comment is not skipped; whatever parser comes
   * next will fail on it.
   */
  public static int skipInsignificant(String input, int offset) {
    int i = offset;
    final int n = input.length();
    for (;;) {
      while (i < n && Character.isWhitespace(input.charAt(i))) {
        ++i;
      }
      if (i < n && input.charAt(i) == '%') {
        i = endOfLine(input, i);
      } else if (input.startsWith("/*", i)) {
        final int end = input.indexOf("*/", i + 2);
        if (end < 0) {
          return i;
        }
        i = end + 2;
      } else {
        return i;
      }
    }
  }

  /** Returns the offset of the line break that ends the line containing a
   * given offset, or the length of the input. */
  static int endOfLine(String input, int offset) {
    int i = offset;
    while (i < input.length()
        && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
      ++i;
    }
    return i;
  }

  /** Returns the offset after any spaces and tabs at a given offset. */
  static int skipHorizontal(String input, int offset) {
    int i = offset;
    while (i < input.length()
        && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
      ++i;
    }
    return i;
  }

  /** Returns a parser that also consumes the insignificant material after
   * what it parses. */
  public static <T> Parser<T> lexeme(Parser<T> p) {
    return (input, offset) -> {
      final Result<T> r = p.parse(input, offset);
      if (!r.isSuccess()) {
        return r;
      }
      return Result.success(r.value(), skipInsignificant(input, r.end()),
          r.furthest());
    };
  }

  /**
   * Returns a parser that skips leading insignificant material, applies a
   * parser, and succeeds only if the parser consumes the whole input.
   */
  public static <T> Parser<T> consumeAll(Parser<T> p) {
    final Parser<T> p2 = p.skip(Parsers.endOfInput());
    return (input, offset) ->
        p2.parse(input, skipInsignificant(input, offset));
  }

  // Raw tokens; these do not consume trailing insignificant material

  /** Parses a single character. */
  static Parser<Character> character(char c) {
    final String label = "'" + c + "'";
    return (input, offset) ->
        offset < input.length() && input.charAt(offset) == c
            ? Result.success(c, offset + 1, null)
            : Result.failure(offset, label);
  }

  /**
   * Parses a fixed string. If the string ends in a word character, it must
   * not be followed by another word character; thus {@code type} does not
   * match the start of {@code types}.
   */
  static Parser<String> string(String s) {
    final String label = "'" + s + "'";
    final boolean word = isAlphaNumeric(s.charAt(s.length() - 1));
    return (input, offset) -> {
      final int end = offset + s.length();
      if (!input.startsWith(s, offset)
          || word && end < input.length()
              && isAlphaNumeric(input.charAt(end))) {
        return Result.failure(offset, label);
      }
      return Result.success(s, end, null);
    };
  }

  /** Parses a word: a character of the given case followed by zero or more
   * characters in {@code [a-zA-Z0-9_]}. */
  private static Parser<String> word(boolean upper, String label) {
    return (input, offset) -> {
      if (offset >= input.length()
          || !(upper
              ? isAsciiUpper(input.charAt(offset))
              : isAsciiLower(input.charAt(offset)))) {
        return Result.failure(offset, label);
      }
      int i = offset + 1;
      while (i < input.length() && isAlphaNumeric(input.charAt(i))) {
        ++i;
      }
      return Result.success(input.substring(offset, i), i, null);
    };
  }

  /** Parses a word that starts with a lower-case letter. */
  public static final Parser<String> LOWER_WORD =
      word(false, "lower word");

  /** Parses a word that starts with an upper-case letter. */
  public static final Parser<String> UPPER_WORD =
      word(true, "upper word");

  /**
   * Parses text between quote characters and returns it without the
   * quotes.
   *
   * <p>Inside the quotes, {@code \q} (where {@code q} is the quote
   * character) stands for {@code q} and {@code \\} for {@code \}. Any other
   * printable ASCII character, including a backslash that starts no such
   * pair, stands for itself.
   */
  public static Parser<String> quoted(char q) {
    final String open = q == '"' ? "double quote" : "quote";
    final String label = "closing " + open;
    return (input, offset) -> {
      if (offset >= input.length() || input.charAt(offset) != q) {
        return Result.failure(offset, open);
      }
      final StringBuilder b = new StringBuilder();
      int i = offset + 1;
      for (;;) {
        if (i >= input.length()) {
          return Result.failure(i, label);
        }
        final char c = input.charAt(i);
        if (c == q) {
          return Result.success(b.toString(), i + 1, null);
        }
        if (c == '\\' && i + 1 < input.length()
            && (input.charAt(i + 1) == q || input.charAt(i + 1) == '\\')) {
          b.append(input.charAt(i + 1));
          i += 2;
        } else if (isAsciiPrint(c)) {
          b.append(c);
          ++i;
        } else {
          return Result.failure(i, label);
        }
      }
    };
  }

  /** Parses an unsigned decimal integer. */
  static final Parser<BigInteger> UNSIGNED_DIGITS = (input, offset) -> {
    int i = offset;
    while (i < input.length() && isDigit(input.charAt(i))) {
      ++i;
    }
    return i == offset
        ? Result.failure(offset, "digit")
        : Result.success(new BigInteger(input.substring(offset, i)), i, null);
  };

  /** Parses a decimal integer with an optional sign. */
  static final Parser<BigInteger> SIGNED_DIGITS = (input, offset) -> {
    final int start =
        offset < input.length()
            && (input.charAt(offset) == '+' || input.charAt(offset) == '-')
            ? offset + 1
            : offset;
    final Result<BigInteger> r = UNSIGNED_DIGITS.parse(input, start);
    if (!r.isSuccess() || start == offset) {
      return r;
    }
    final BigInteger i = r.value();
    return Result.success(input.charAt(offset) == '-' ? i.negate() : i,
        r.end(), null);
  };

  /**
   * Parses a decimal number with an optional sign, an optional fraction and
   * an optional exponent, such as {@code -1.5e3}.
   *
   * <p>A {@code .} or exponent marker that is not followed by digits is not
   * part of the number.
   */
  static final Parser<BigDecimal> SCIENTIFIC = (input, offset) -> {
    final int n = input.length();
    int i = offset;
    if (i < n && (input.charAt(i) == '+' || input.charAt(i) == '-')) {
      ++i;
    }
    final int digits = i;
    while (i < n && isDigit(input.charAt(i))) {
      ++i;
    }
    if (i == digits) {
      return Result.failure(offset, "number");
    }
    if (i + 1 < n && input.charAt(i) == '.' && isDigit(input.charAt(i + 1))) {
      i += 2;
      while (i < n && isDigit(input.charAt(i))) {
        ++i;
      }
    }
    if (i < n && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
      int j = i + 1;
      if (j < n && (input.charAt(j) == '+' || input.charAt(j) == '-')) {
        ++j;
      }
      if (j < n && isDigit(input.charAt(j))) {
        while (j < n && isDigit(input.charAt(j))) {
          ++j;
        }
        i = j;
      }
    }
    return Result.success(new BigDecimal(input.substring(offset, i)), i,
        null);
  };

  // Tokens

  /** Parses an operator character. */
  public static Parser<Character> op(char c) {
    return lexeme(character(c));
  }

  /** Parses a keyword or other fixed token. */
  public static Parser<String> token(String s) {
    return lexeme(string(s));
  }

  /** Parses an atom: a single-quoted string or a lower word. */
  public static final Parser<Atom> ATOM =
      lexeme(quoted('\'').or(LOWER_WORD))
          .mapOrFail(s -> Atom.isValid(s) ? Atom.of(s) : null,
              "non-empty atom")
          .label("atom");

  /** Parses a variable. */
  public static final Parser<Var> VAR =
      lexeme(UPPER_WORD).map(Var::of).label("variable");

  /** Parses a distinct object, a double-quoted string. */
  public static final Parser<DistinctObject> DISTINCT_OBJECT =
      lexeme(quoted('"')).map(DistinctObject::of).label("distinct object");

  /** Parses an integer with an optional sign. */
  public static final Parser<BigInteger> SIGNED_INTEGER =
      lexeme(SIGNED_DIGITS).label("integer");

  /**
   * Parses a reserved identifier in a vocabulary. Any lower word is
   * accepted; words that are not the name of a member of the vocabulary
   * become {@link Reserved.Extended extended} identifiers.
   */
  public static <T extends Enum<T>> Parser<Reserved<T>> reserved(
      Vocabulary<T> vocabulary) {
    return lexeme(LOWER_WORD).map(vocabulary::extended).label("reserved");
  }

  /** Parses a name: {@code $} followed by a reserved identifier, or an
   * atom. */
  public static <T extends Enum<T>> Parser<Name<T>> name(
      Vocabulary<T> vocabulary) {
    final Parser<Name<T>> reservedName =
        character('$').andThen(reserved(vocabulary))
            .map(r -> Name.<T>reserved(r));
    return reservedName.or(ATOM.map(a -> Name.<T>defined(a))).label("name");
  }

  /**
   * Parses one of the members of a vocabulary by its name, trying longer
   * names before shorter.
   */
  public static <T extends Enum<T>> Parser<T> enumeration(
      Vocabulary<T> vocabulary, String label) {
    return lexeme((input, offset) -> {
      final T t = vocabulary.match(input, offset);
      return t == null
          ? Result.failure(offset, label)
          : Result.success(t, offset + vocabulary.name(t).length(), null);
    });
  }

  // Combinators

  /** Parses something in parentheses. */
  public static <T> Parser<T> parens(Parser<T> p) {
    return op('(').andThen(p).skip(op(')'));
  }

  /** Parses something in brackets. */
  public static <T> Parser<T> brackets(Parser<T> p) {
    return op('[').andThen(p).skip(op(']'));
  }

  /** Parses something in zero or more pairs of parentheses. */
  public static <T> Parser<T> optionalParens(Parser<T> p) {
    final Parsers.Ref<T> ref = Parsers.ref();
    return ref.set(p.or(parens(ref)));
  }

  /** Parses a comma-separated list, possibly empty, in brackets. */
  public static <T> Parser<ImmutableList<T>> bracketList(Parser<T> p) {
    return brackets(p.sepBy(op(',')));
  }

  /** Parses a non-empty comma-separated list in brackets. */
  public static <T> Parser<ImmutableList<T>> bracketList1(Parser<T> p) {
    return brackets(p.sepBy1(op(',')));
  }

  /** Parses a comma followed by something. */
  public static <T> Parser<T> comma(Parser<T> p) {
    return op(',').andThen(p);
  }

  /** Parses a keyword followed by something in parentheses, such as
   * {@code file('f.p')}. */
  public static <T> Parser<T> labeled(String keyword, Parser<T> p) {
    return token(keyword).andThen(parens(p));
  }

  /**
   * Parses an application: a head, optionally followed by a
   * comma-separated list of one or more arguments in parentheses. Each
   * argument may be in redundant parentheses.
   */
  public static <F, A, R> Parser<R> application(Parser<F> head,
      Parser<A> arg, BiFunction<F, List<A>, R> fn) {
    final Parser<ImmutableList<A>> args =
        parens(optionalParens(arg).sepBy1(op(',')))
            .orElse(ImmutableList.of());
    return head.then(args, fn);
  }
}

// End Lexer.java
