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

import net.hydromatic.tptp.ast.Clause;
import net.hydromatic.tptp.ast.Formula;
import net.hydromatic.tptp.ast.Language;
import net.hydromatic.tptp.ast.Pos;
import net.hydromatic.tptp.ast.Term;
import net.hydromatic.tptp.ast.Tptp;
import net.hydromatic.tptp.ast.Tstp;
import net.hydromatic.tptp.ast.Unit;
import net.hydromatic.tptp.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for parsing TPTP and TSTP text.
 *
 * <p>Every method requires the whole input to be consumed, apart from
 * leading and trailing whitespace and comments, and throws
 * {@link TptpParseException} if it is not. The optional {@code file}
 * argument labels positions in error messages.
 *
 * <p>Parsers hold no state; the methods are safe to call from several
 * threads at once.
 */
public final class TptpParser {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TptpParser.class);

  private TptpParser() {}

  /** Parses a TPTP problem. */
  public static Tptp parseTptp(String text) {
    return parseTptp(text, "");
  }

  /** Parses a TPTP problem, labeling positions with a file name. */
  public static Tptp parseTptp(String text, String file) {
    final Tptp tptp =
        parse(Lexer.consumeAll(UnitGrammar.TPTP), "tptp", text, file);
    LOGGER.debug("parsed tptp {}: {} chars, {} units", file, text.length(),
        tptp.units.size());
    return tptp;
  }

  /** Parses the output of a theorem prover, including the SZS status and
   * dataform in its leading comments. */
  public static Tstp parseTstp(String text) {
    return parseTstp(text, "");
  }

  /** Parses the output of a theorem prover, labeling positions with a
   * file name. */
  public static Tstp parseTstp(String text, String file) {
    final Tstp tstp = parse(UnitGrammar.TSTP, "tstp", text, file);
    LOGGER.debug("parsed tstp {}: {} chars, {} units, {}", file,
        text.length(), tstp.units.size(), tstp.szs);
    return tstp;
  }

  /** Parses a single unit, such as {@code cnf(c, axiom, p).} */
  public static Unit parseUnit(String text) {
    return parseUnit(text, "");
  }

  public static Unit parseUnit(String text, String file) {
    return parse(Lexer.consumeAll(UnitGrammar.UNIT), "unit", text, file);
  }

  /** Parses a formula of a given language, such as {@code p & q} in
   * {@link Language#FOF}. */
  public static Formula parseFormula(Language language, String text) {
    return parseFormula(language, text, "");
  }

  public static Formula parseFormula(Language language, String text,
      String file) {
    return parse(Lexer.consumeAll(FormulaGrammar.formula(language)),
        language.moniker(), text, file);
  }

  /** Parses a term, such as {@code f(X, 'a b', 1/2)}. */
  public static Term parseTerm(String text) {
    return parseTerm(text, "");
  }

  public static Term parseTerm(String text, String file) {
    return parse(Lexer.consumeAll(FormulaGrammar.TERM), "term", text, file);
  }

  /** Parses a type, such as {@code ($int * $int) > $o}. */
  public static Type parseType(String text) {
    return parseType(text, "");
  }

  public static Type parseType(String text, String file) {
    return parse(Lexer.consumeAll(FormulaGrammar.TYPE), "type", text, file);
  }

  /** Parses a clause, such as {@code p(X) | ~q(X)}. */
  public static Clause parseClause(String text) {
    return parseClause(text, "");
  }

  public static Clause parseClause(String text, String file) {
    return parse(Lexer.consumeAll(FormulaGrammar.CLAUSE), "clause", text,
        file);
  }

  private static <T> T parse(Parser<T> parser, String kind, String text,
      String file) {
    requireNonNull(text, "text");
    requireNonNull(file, "file");
    final Result<T> r = parser.parse(text, 0);
    if (r.isSuccess()) {
      return r.value();
    }
    final Result.@Nullable Failure<?> f = r.furthest();
    final Result.Failure<?> failure = Parser.requireFailure(f);
    final TptpParseException e =
        new TptpParseException(failure.offset,
            Pos.at(text, file, failure.offset), failure.labels);
    LOGGER.debug("failed to parse {}: {}", kind, e.getMessage());
    throw e;
  }
}

// End TptpParser.java
