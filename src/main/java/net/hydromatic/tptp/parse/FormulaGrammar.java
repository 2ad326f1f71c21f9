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

import static net.hydromatic.tptp.parse.Lexer.DISTINCT_OBJECT;
import static net.hydromatic.tptp.parse.Lexer.SCIENTIFIC;
import static net.hydromatic.tptp.parse.Lexer.SIGNED_DIGITS;
import static net.hydromatic.tptp.parse.Lexer.UNSIGNED_DIGITS;
import static net.hydromatic.tptp.parse.Lexer.VAR;
import static net.hydromatic.tptp.parse.Lexer.application;
import static net.hydromatic.tptp.parse.Lexer.bracketList1;
import static net.hydromatic.tptp.parse.Lexer.character;
import static net.hydromatic.tptp.parse.Lexer.enumeration;
import static net.hydromatic.tptp.parse.Lexer.lexeme;
import static net.hydromatic.tptp.parse.Lexer.op;
import static net.hydromatic.tptp.parse.Lexer.optionalParens;
import static net.hydromatic.tptp.parse.Lexer.parens;
import static net.hydromatic.tptp.parse.Lexer.token;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import net.hydromatic.tptp.ast.Clause;
import net.hydromatic.tptp.ast.Connective;
import net.hydromatic.tptp.ast.FirstOrder;
import net.hydromatic.tptp.ast.Formula;
import net.hydromatic.tptp.ast.FunctionSymbol;
import net.hydromatic.tptp.ast.Language;
import net.hydromatic.tptp.ast.Literal;
import net.hydromatic.tptp.ast.Modality;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Numeral;
import net.hydromatic.tptp.ast.PredicateSymbol;
import net.hydromatic.tptp.ast.Quantifier;
import net.hydromatic.tptp.ast.QuantifiedModal;
import net.hydromatic.tptp.ast.Sign;
import net.hydromatic.tptp.ast.Term;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.ast.Vocabulary;
import net.hydromatic.tptp.type.QuantifiedSort;
import net.hydromatic.tptp.type.Sort;
import net.hydromatic.tptp.type.Sorted;
import net.hydromatic.tptp.type.TFF1Sort;
import net.hydromatic.tptp.type.Type;
import net.hydromatic.tptp.type.Unsorted;
import net.hydromatic.tptp.util.Either;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Grammar of sorts, types, terms, literals, clauses and formulas.
 *
 * <p>The grammar accepts redundant parentheses in several places where the
 * TPTP syntax does not allow them: around sorts, arguments of function and
 * predicate applications, terms on either side of an equation, and negated
 * literals.
 */
public final class FormulaGrammar {
  private FormulaGrammar() {}

  // Names

  /** Parses the name of a function symbol. */
  public static final Parser<Name<FunctionSymbol>> FUNCTION =
      Lexer.name(Vocabulary.of(FunctionSymbol.class)).label("function");

  /** Parses the name of a predicate symbol. */
  public static final Parser<Name<PredicateSymbol>> PREDICATE =
      Lexer.name(Vocabulary.of(PredicateSymbol.class)).label("predicate");

  // Sorts and types

  /** Parses the name of a sort. */
  public static final Parser<Name<Sort>> SORT =
      Lexer.name(Vocabulary.of(Sort.class)).label("sort");

  /** Parses a sort of polymorphic logic: a sort variable, or a sort
   * constructor applied to zero or more sorts. */
  public static final Parser<TFF1Sort> TFF1_SORT = tff1Sort();

  private static Parser<TFF1Sort> tff1Sort() {
    final Parsers.Ref<TFF1Sort> sort = Parsers.ref();
    return sort.set(
        VAR.map(TFF1Sort::variable)
            .or(application(SORT, sort, TFF1Sort::apply))
            .label("tff1 sort"));
  }

  /** Parses the sort-of-sorts marker {@code $tType}. */
  static final Parser<QuantifiedSort> QUANTIFIED_SORT =
      token("$tType").map(t -> QuantifiedSort.INSTANCE);

  /**
   * Parses a mapping {@code args > result}, where {@code args} is a single
   * sort or a {@code *}-separated list in parentheses. If there is no
   * {@code >}, the mapping has no arguments.
   */
  static <S> Parser<Map.Entry<ImmutableList<S>, S>> mapping(Parser<S> sort) {
    final Parser<ImmutableList<S>> args =
        sort.map(s -> ImmutableList.of(s))
            .or(parens(sort.sepBy1(op('*'))));
    return args.skip(op('>'))
        .orElse(ImmutableList.of())
        .then(sort, FormulaGrammar::pair);
  }

  /** Parses a type, such as {@code $int > $o} or
   * {@code !>[A: $tType]: (list(A) * A) > list(A)}. */
  public static final Parser<Type> TYPE = type();

  private static Parser<Type> type() {
    final Parser<Var> sortVariable =
        VAR.skip(op(':')).skip(optionalParens(QUANTIFIED_SORT));
    final Parser<ImmutableList<Var>> prefix =
        token("!>").andThen(bracketList1(sortVariable)).skip(op(':'));
    final Parser<Map.Entry<ImmutableList<TFF1Sort>, TFF1Sort>> matrix =
        optionalParens(mapping(optionalParens(TFF1_SORT)));
    return prefix.orElse(ImmutableList.of())
        .then(matrix, (vars, m) ->
            Type.tff1Type(vars, m.getKey(), m.getValue()))
        .label("type");
  }

  // Terms

  /** Parses a rational number, a single token such as {@code -3/4}; fails
   * if the denominator is zero. */
  private static final Parser<Numeral> RATIONAL =
      lexeme(
          SIGNED_DIGITS.skip(character('/'))
              .then(UNSIGNED_DIGITS, FormulaGrammar::pair))
          .mapOrFail(FormulaGrammar::rational, "positive denominator");

  /** Parses a number: a rational such as {@code -1/2}, or an integer or real
   * such as {@code 3} or {@code 1.5e-3}. */
  public static final Parser<Numeral> NUMBER =
      RATIONAL.or(lexeme(SCIENTIFIC).map(Numeral::ofDecimal))
          .label("number");

  /** Parses a term. */
  public static final Parser<Term> TERM = term();

  private static Parser<Term> term() {
    final Parsers.Ref<Term> term = Parsers.ref();
    return term.set(
        Parsers.<Term>choice(
                application(FUNCTION, term, Term::function),
                VAR.map(v -> Term.variable(v)),
                NUMBER.map(Term::number),
                DISTINCT_OBJECT.map(Term::distinct))
            .label("term"));
  }

  // Literals and clauses

  /** Parses {@code =} or {@code !=}. */
  static final Parser<Sign> SIGN =
      enumeration(Vocabulary.of(Sign.class), "'=' or '!='");

  /** Parses a literal: an equation, or an application of a predicate. */
  public static final Parser<Literal> LITERAL = literal();

  private static Parser<Literal> literal() {
    final Parser<Term> side = optionalParens(TERM);
    final Parser<Literal> equality =
        side.then(SIGN, FormulaGrammar::pair)
            .then(side, (e, right) ->
                Literal.equality(e.getKey(), e.getValue(), right));
    final Parser<Literal> predicate =
        application(PREDICATE, TERM,
            (name, args) -> Literal.predicate(name, args));
    return equality.or(predicate).label("literal");
  }

  /** Parses a literal, possibly negated by {@code ~}. */
  static final Parser<Clause.SignedLiteral> SIGNED_LITERAL =
      op('~').andThen(optionalParens(LITERAL))
          .map(l -> Clause.SignedLiteral.of(Sign.NEGATIVE, l))
          .or(LITERAL.map(l -> Clause.SignedLiteral.of(Sign.POSITIVE, l)))
          .label("signed literal");

  /** Parses a clause: one or more {@code |}-separated subclauses, each a
   * signed literal or a clause in parentheses. */
  public static final Parser<Clause> CLAUSE = clause();

  private static Parser<Clause> clause() {
    final Parsers.Ref<Clause> clause = Parsers.ref();
    final Parser<Clause> subclause =
        SIGNED_LITERAL.map(l -> Clause.unit(l))
            .or(parens(clause))
            .label("subclause");
    return clause.set(
        subclause.sepBy1(op('|'))
            .map(clauses -> Clause.concat(clauses))
            .label("clause"));
  }

  // First-order logic

  static final Parser<Quantifier> QUANTIFIER =
      enumeration(Vocabulary.of(Quantifier.class), "quantifier");

  static final Parser<Connective> CONNECTIVE =
      enumeration(Vocabulary.of(Connective.class), "connective");

  static final Parser<Modality> MODALITY =
      enumeration(Vocabulary.of(Modality.class), "modality");

  /**
   * Returns a parser of first-order formulas whose quantified variables
   * have annotations parsed by a given parser.
   *
   * <p>Binary connectives associate to the right, and all have the same
   * precedence: {@code p & q | r} is {@code p & (q | r)}. A chain of
   * connectives is parsed as a list and folded, so its length is not
   * limited by the depth of the Java stack.
   */
  public static <S> Parser<FirstOrder<S>> firstOrder(Parser<S> annotation) {
    final Parsers.Ref<FirstOrder<S>> formula = Parsers.ref();
    final Parsers.Ref<FirstOrder<S>> unitary = Parsers.ref();
    final Parser<ImmutableList<FirstOrder.Binding<S>>> bindings =
        bracketList1(VAR.then(annotation, FirstOrder.Binding::of));
    unitary.set(
        Parsers.<FirstOrder<S>>choice(
                LITERAL.map(l -> FirstOrder.<S>atomic(l)),
                op('~').andThen(unitary).map(FirstOrder::negated),
                QUANTIFIER.then(bindings, FormulaGrammar::pair)
                    .skip(op(':'))
                    .then(unitary, (e, f) ->
                        FirstOrder.quantified(e.getKey(), e.getValue(), f)),
                parens(formula))
            .label("unitary formula"));
    final Parser<ImmutableList<Map.Entry<Connective, FirstOrder<S>>>> rest =
        CONNECTIVE.then(unitary, FormulaGrammar::pair).many();
    return formula.set(
        unitary.then(rest, (f, cs) ->
            connectRight(f, cs, FirstOrder::connected)));
  }

  /** Returns a parser of sort annotations: a colon followed by a sort, or
   * nothing. */
  static <S> Parser<Sorted<S>> sorted(Parser<S> sort) {
    return op(':').andThen(optionalParens(sort))
        .map(s -> Sorted.of(s))
        .orElse(Sorted.omitted());
  }

  /** Parses a formula of unsorted first-order logic. */
  public static final Parser<FirstOrder<Unsorted>> UNSORTED_FIRST_ORDER =
      firstOrder(Parsers.success(Unsorted.INSTANCE)).label("fof");

  /** Parses a formula of sorted monomorphic first-order logic. */
  public static final Parser<FirstOrder<Sorted<Name<Sort>>>>
      MONOMORPHIC_FIRST_ORDER = firstOrder(sorted(SORT)).label("tff0");

  /** Parses a formula of sorted polymorphic first-order logic. */
  public static final Parser<
          FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>>>
      POLYMORPHIC_FIRST_ORDER =
          firstOrder(sorted(polymorphicSort())).label("tff1");

  /** Parses {@code $tType} or a sort of polymorphic logic. */
  private static Parser<Either<QuantifiedSort, TFF1Sort>> polymorphicSort() {
    final Parser<Either<QuantifiedSort, TFF1Sort>> quantifiedSort =
        QUANTIFIED_SORT.map(q -> Either.left(q));
    final Parser<Either<QuantifiedSort, TFF1Sort>> sort =
        TFF1_SORT.map(s -> Either.right(s));
    return quantifiedSort.or(sort);
  }

  /** Parses a formula of quantified modal logic. */
  public static final Parser<QuantifiedModal> QUANTIFIED_MODAL =
      quantifiedModal();

  private static Parser<QuantifiedModal> quantifiedModal() {
    final Parsers.Ref<QuantifiedModal> formula = Parsers.ref();
    final Parsers.Ref<QuantifiedModal> unitary = Parsers.ref();
    unitary.set(
        Parsers.<QuantifiedModal>choice(
                LITERAL.map(QuantifiedModal::atomic),
                op('~').andThen(unitary).map(QuantifiedModal::negated),
                QUANTIFIER.then(bracketList1(VAR), FormulaGrammar::pair)
                    .skip(op(':'))
                    .then(unitary, (e, f) ->
                        QuantifiedModal.quantified(e.getKey(), e.getValue(),
                            f)),
                MODALITY.skip(op(':'))
                    .then(unitary, QuantifiedModal::modaled),
                parens(formula))
            .label("unitary modal formula"));
    final Parser<ImmutableList<Map.Entry<Connective, QuantifiedModal>>> rest =
        CONNECTIVE.then(unitary, FormulaGrammar::pair).many();
    return formula.set(
        unitary.then(rest, (f, cs) ->
            connectRight(f, cs, QuantifiedModal::connected)));
  }

  // Formulas

  private static final Parser<Formula> CNF_FORMULA =
      CLAUSE.map(Formula::cnf).label("cnf");

  private static final Parser<Formula> FOF_FORMULA =
      UNSORTED_FIRST_ORDER.map(Formula::fof);

  /** Parses a sorted formula with the polymorphic grammar, then
   * monomorphizes it if possible. */
  private static final Parser<Formula> TFF_FORMULA =
      POLYMORPHIC_FIRST_ORDER.map(Formula::tff).label("tff");

  private static final Parser<Formula> QMF_FORMULA =
      QUANTIFIED_MODAL.map(Formula::qmf).label("qmf");

  /** Returns a parser of formulas in a given language. */
  public static Parser<Formula> formula(Language language) {
    switch (language) {
    case CNF:
      return CNF_FORMULA;
    case FOF:
      return FOF_FORMULA;
    case TFF:
      return TFF_FORMULA;
    case QMF:
      return QMF_FORMULA;
    default:
      throw new AssertionError("unknown language " + language);
    }
  }

  /** Builds a formula from {@code first c0 f1 c1 f2 ...}, nesting to the
   * right: {@code first c0 (f1 c1 (f2 ...))}. */
  private static <F> F connectRight(F first,
      List<Map.Entry<Connective, F>> rest, Connector<F> connector) {
    if (rest.isEmpty()) {
      return first;
    }
    F f = rest.get(rest.size() - 1).getValue();
    for (int i = rest.size() - 1; i > 0; i--) {
      f = connector.connect(rest.get(i - 1).getValue(), rest.get(i).getKey(),
          f);
    }
    return connector.connect(first, rest.get(0).getKey(), f);
  }

  /** Creates an application of a binary connective. */
  private interface Connector<F> {
    F connect(F left, Connective connective, F right);
  }

  private static @Nullable Numeral rational(Map.Entry<BigInteger, BigInteger> e) {
    return e.getValue().signum() > 0
        ? Numeral.rational(e.getKey(), e.getValue())
        : null;
  }

  private static <K, V> Map.Entry<K, V> pair(K k, V v) {
    return Maps.immutableEntry(k, v);
  }
}

// End FormulaGrammar.java
