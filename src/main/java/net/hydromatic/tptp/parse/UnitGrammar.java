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
import static net.hydromatic.tptp.parse.FormulaGrammar.NUMBER;
import static net.hydromatic.tptp.parse.FormulaGrammar.QUANTIFIED_SORT;
import static net.hydromatic.tptp.parse.FormulaGrammar.TERM;
import static net.hydromatic.tptp.parse.FormulaGrammar.TYPE;
import static net.hydromatic.tptp.parse.FormulaGrammar.formula;
import static net.hydromatic.tptp.parse.FormulaGrammar.mapping;
import static net.hydromatic.tptp.parse.Lexer.ATOM;
import static net.hydromatic.tptp.parse.Lexer.SIGNED_INTEGER;
import static net.hydromatic.tptp.parse.Lexer.VAR;
import static net.hydromatic.tptp.parse.Lexer.application;
import static net.hydromatic.tptp.parse.Lexer.bracketList;
import static net.hydromatic.tptp.parse.Lexer.bracketList1;
import static net.hydromatic.tptp.parse.Lexer.character;
import static net.hydromatic.tptp.parse.Lexer.comma;
import static net.hydromatic.tptp.parse.Lexer.endOfLine;
import static net.hydromatic.tptp.parse.Lexer.enumeration;
import static net.hydromatic.tptp.parse.Lexer.labeled;
import static net.hydromatic.tptp.parse.Lexer.op;
import static net.hydromatic.tptp.parse.Lexer.optionalParens;
import static net.hydromatic.tptp.parse.Lexer.parens;
import static net.hydromatic.tptp.parse.Lexer.reserved;
import static net.hydromatic.tptp.parse.Lexer.skipHorizontal;
import static net.hydromatic.tptp.parse.Lexer.skipInsignificant;
import static net.hydromatic.tptp.parse.Lexer.token;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.tptp.ast.Annotation;
import net.hydromatic.tptp.ast.Atom;
import net.hydromatic.tptp.ast.Declaration;
import net.hydromatic.tptp.ast.Expression;
import net.hydromatic.tptp.ast.Info;
import net.hydromatic.tptp.ast.Intro;
import net.hydromatic.tptp.ast.Language;
import net.hydromatic.tptp.ast.Op;
import net.hydromatic.tptp.ast.Parent;
import net.hydromatic.tptp.ast.Reserved;
import net.hydromatic.tptp.ast.Role;
import net.hydromatic.tptp.ast.Source;
import net.hydromatic.tptp.ast.Tptp;
import net.hydromatic.tptp.ast.Tstp;
import net.hydromatic.tptp.ast.Unit;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.ast.Vocabulary;
import net.hydromatic.tptp.szs.Dataform;
import net.hydromatic.tptp.szs.NoSuccess;
import net.hydromatic.tptp.szs.Success;
import net.hydromatic.tptp.szs.Szs;
import net.hydromatic.tptp.util.Either;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Grammar of units and documents, and of the annotations of units.
 *
 * <p>Fields are declared in dependency order; recursive productions go
 * through a {@link Parsers.Ref}.
 */
public final class UnitGrammar {
  private UnitGrammar() {}

  /** Parses the name of a language, such as {@code fof}. */
  public static final Parser<Language> LANGUAGE =
      enumeration(Vocabulary.of(Language.class), "language");

  static final Parser<Reserved<Role>> ROLE =
      reserved(Vocabulary.of(Role.class)).label("role");

  /** Parses the name of a unit: an atom or a signed integer. */
  public static final Parser<Either<Atom, BigInteger>> UNIT_NAME =
      ATOM.<Either<Atom, BigInteger>>map(a -> Either.left(a))
          .or(SIGNED_INTEGER.<Either<Atom, BigInteger>>map(i ->
              Either.right(i)))
          .label("unit name");

  static final Parser<ImmutableList<Either<Atom, BigInteger>>> UNIT_NAMES =
      bracketList1(UNIT_NAME);

  /** Parses {@code name: $tType}, or the declaration of a sort
   * constructor such as {@code list: $tType > $tType}. */
  static final Parser<Declaration> SORT_DECLARATION =
      ATOM.skip(op(':'))
          .then(optionalParens(mapping(optionalParens(QUANTIFIED_SORT))),
              (atom, m) -> Declaration.sort(atom, m.getKey().size()));

  static final Parser<Declaration> TYPING =
      ATOM.skip(op(':'))
          .then(optionalParens(TYPE), (atom, type) ->
              Declaration.typing(atom, type));

  static final Parser<Declaration> TYPE_DECLARATION =
      token(Op.TYPING_DECL.keyword())
          .andThen(comma(optionalParens(SORT_DECLARATION.or(TYPING))));

  // Expression and info are mutually recursive with source.

  private static final Parsers.Ref<Info> INFO_REF = Parsers.ref();
  private static final Parsers.Ref<Source> SOURCE_REF = Parsers.ref();

  /** Parses a list of infos, such as {@code [status(thm), 'x']}. */
  public static final Parser<ImmutableList<Info>> INFOS =
      bracketList(INFO_REF).label("infos");

  /** Parses {@code $fot(term)} or {@code $fof(formula)} and the like. */
  public static final Parser<Expression> EXPRESSION =
      character('$')
          .andThen(
              labeled(Op.TERM_EXPRESSION.keyword(), optionalParens(TERM))
                  .map(t -> Expression.term(t))
                  .or(LANGUAGE.flatMap(l ->
                      parens(optionalParens(formula(l)))
                          .map(f -> Expression.logical(f)))))
          .label("expression");

  private static final Parser<Either<Var, Atom>> SYMBOL =
      VAR.<Either<Var, Atom>>map(v -> Either.left(v))
          .or(ATOM.<Either<Var, Atom>>map(a -> Either.right(a)));

  /** Parses an info. */
  public static final Parser<Info> INFO =
      INFO_REF.set(
          Parsers.<Info>choice(
              labeled(Op.DESCRIPTION.keyword(), ATOM)
                  .map(a -> Info.description(a)),
              labeled(Op.IQUOTE.keyword(), ATOM)
                  .map(a -> Info.iquote(a)),
              labeled(Op.STATUS.keyword(),
                  reserved(Vocabulary.of(Success.class)))
                  .map(s -> Info.status(s)),
              labeled(Op.ASSUMPTIONS.keyword(), UNIT_NAMES)
                  .map(ns -> Info.assumptions(ns)),
              labeled(Op.REFUTATION.keyword(), ATOM)
                  .map(a -> Info.refutation(a)),
              labeled(Op.NEW_SYMBOLS.keyword(),
                  ATOM.then(comma(bracketList(SYMBOL)),
                      (a, ss) -> Info.newSymbols(a, ss))),
              labeled(Op.BIND.keyword(),
                  VAR.then(comma(EXPRESSION), (v, e) -> Info.bind(v, e))),
              EXPRESSION.map(e -> Info.expression(e)),
              application(ATOM, INFO_REF,
                  (Atom a, List<Info> args) -> Info.application(a, args)),
              NUMBER.map(n -> Info.number(n)),
              INFOS.map(is -> Info.infos(is)))
              .label("info"));

  /** Parses a parent of an inference: a source optionally followed by
   * {@code :} and a list of infos. */
  public static final Parser<Parent> PARENT =
      SOURCE_REF.then(
          op(':').andThen(INFOS).orElse(ImmutableList.of()),
          (s, is) -> Parent.of(s, is));

  /** Parses a source. */
  public static final Parser<Source> SOURCE =
      SOURCE_REF.set(
          Parsers.<Source>choice(
              token(Op.UNKNOWN_SOURCE.keyword()).map(t -> Source.UNKNOWN),
              labeled(Op.FILE_SOURCE.keyword(),
                  ATOM.then(maybe(UNIT_NAME), (a, n) -> Source.file(a, n))),
              labeled(Op.THEORY_SOURCE.keyword(),
                  ATOM.then(maybe(INFOS), (a, is) -> Source.theory(a, is))),
              labeled(Op.CREATOR_SOURCE.keyword(),
                  ATOM.then(maybe(INFOS), (a, is) -> Source.creator(a, is))),
              labeled(Op.INTRODUCED_SOURCE.keyword(),
                  reserved(Vocabulary.of(Intro.class))
                      .then(maybe(INFOS), (i, is) ->
                          Source.introduced(i, is))),
              labeled(Op.INFERENCE_SOURCE.keyword(),
                  ATOM.then(comma(INFOS), UnitGrammar::pair)
                      .then(comma(bracketList(PARENT)), (e, ps) ->
                          Source.inference(e.getKey(), e.getValue(), ps))),
              UNIT_NAME.map(n -> Source.unit(n)))
              .label("source"));

  /** Parses the annotation of a unit: a source optionally followed by
   * infos. */
  public static final Parser<Annotation> ANNOTATION =
      SOURCE.then(maybe(INFOS), (s, is) -> Annotation.of(s, is));

  /** Parses {@code include('file')} or
   * {@code include('file', [name, ...])}, and the terminating period. */
  public static final Parser<Unit> INCLUDE =
      labeled(Op.INCLUDE.keyword(),
          ATOM.then(maybe(UNIT_NAMES), (a, ns) -> Unit.include(a, ns)))
          .skip(op('.'));

  private static final ImmutableMap<Language, Parser<Unit>> UNIT_BODIES =
      Maps.toMap(EnumSet.allOf(Language.class), UnitGrammar::unitBody);

  /** Parses a unit such as {@code fof(name, role, formula, source).} */
  public static final Parser<Unit> ANNOTATED_UNIT =
      LANGUAGE.flatMap(l -> requireNonNull(UNIT_BODIES.get(l)));

  /** Parses a unit: an include directive or an annotated unit. */
  public static final Parser<Unit> UNIT =
      INCLUDE.or(ANNOTATED_UNIT).label("unit");

  /** Parses a TPTP document, a sequence of units, not including leading
   * insignificant material or the end of input. */
  public static final Parser<Tptp> TPTP = UNIT.many().map(Tptp::of);

  /** Scans leading comments for SZS status and dataform annotations. */
  static final Parser<Szs> SZS = (input, offset) -> {
    Szs szs = Szs.EMPTY;
    int i = offset;
    while (i < input.length() && input.charAt(i) == '%') {
      int j = skipHorizontal(input, i + 1);
      if (j < input.length() && input.charAt(j) == '%') {
        j = skipHorizontal(input, j + 1);
      }
      final Szs line = szsLine(input, j);
      if (line != null) {
        szs = szs.plus(line);
      }
      i = skipWhitespace(input, endOfLine(input, j));
    }
    return Result.success(szs, i, null);
  };

  /** Parses a TSTP document, from the very start of the input to the end
   * of input. */
  public static final Parser<Tstp> TSTP =
      ((Parser<Szs>) (input, offset) ->
          SZS.parse(input, skipWhitespace(input, offset)))
          .then(
              ((Parser<Integer>) (input, offset) ->
                  Result.success(offset, skipInsignificant(input, offset),
                      null))
                  .andThen(UNIT.many()),
              (szs, units) -> Tstp.of(szs, units))
          .skip(Parsers.endOfInput());

  /** Returns the parser of the body of a unit in a given language, the
   * part after the language name. */
  private static Parser<Unit> unitBody(Language language) {
    final Parser<Declaration> declaration =
        TYPE_DECLARATION.or(
            ROLE.then(comma(formula(language)), (r, f) ->
                Declaration.formula(r, f)));
    return parens(
        UNIT_NAME.then(comma(declaration), UnitGrammar::pair)
            .then(maybe(ANNOTATION), (e, a) ->
                Unit.annotated(e.getKey(), e.getValue(), a)))
        .skip(op('.'))
        .label("annotated unit");
  }

  /** Parses an optional comma followed by something; null if absent. */
  private static <T> Parser<@Nullable T> maybe(Parser<T> p) {
    return comma(p).optional();
  }

  /** Returns the SZS annotation of a comment line that starts at a given
   * offset, or null if the line is not an SZS annotation. */
  private static @Nullable Szs szsLine(String input, int offset) {
    if (!input.startsWith("SZS", offset)) {
      return null;
    }
    int i = skipHorizontal(input, offset + 3);
    if (input.startsWith("status", i)) {
      i = skipHorizontal(input, i + 6);
      final NoSuccess noSuccess = NoSuccess.ONTOLOGY.match(input, i);
      if (noSuccess != null) {
        return Szs.noSuccess(noSuccess);
      }
      final Success success = Success.ONTOLOGY.match(input, i);
      return success == null ? null : Szs.success(success);
    }
    if (input.startsWith("output", i)) {
      i = skipHorizontal(input, i + 6);
      if (!input.startsWith("start", i)) {
        return null;
      }
      i = skipHorizontal(input, i + 5);
      final Dataform dataform = Dataform.ONTOLOGY.match(input, i);
      return dataform == null ? null : Szs.dataform(dataform);
    }
    return null;
  }

  private static int skipWhitespace(String input, int offset) {
    int i = offset;
    while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
      ++i;
    }
    return i;
  }

  private static <K, V> Map.Entry<K, V> pair(K k, V v) {
    return Maps.immutableEntry(k, v);
  }
}

// End UnitGrammar.java
