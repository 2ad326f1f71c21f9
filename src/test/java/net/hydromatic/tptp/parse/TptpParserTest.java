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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import net.hydromatic.tptp.ast.Annotation;
import net.hydromatic.tptp.ast.Atom;
import net.hydromatic.tptp.ast.Clause;
import net.hydromatic.tptp.ast.Connective;
import net.hydromatic.tptp.ast.Declaration;
import net.hydromatic.tptp.ast.DistinctObject;
import net.hydromatic.tptp.ast.Expression;
import net.hydromatic.tptp.ast.FirstOrder;
import net.hydromatic.tptp.ast.Formula;
import net.hydromatic.tptp.ast.FunctionSymbol;
import net.hydromatic.tptp.ast.Info;
import net.hydromatic.tptp.ast.Intro;
import net.hydromatic.tptp.ast.Language;
import net.hydromatic.tptp.ast.Literal;
import net.hydromatic.tptp.ast.Modality;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Numeral;
import net.hydromatic.tptp.ast.Parent;
import net.hydromatic.tptp.ast.Pos;
import net.hydromatic.tptp.ast.PredicateSymbol;
import net.hydromatic.tptp.ast.QuantifiedModal;
import net.hydromatic.tptp.ast.Quantifier;
import net.hydromatic.tptp.ast.Reserved;
import net.hydromatic.tptp.ast.Role;
import net.hydromatic.tptp.ast.Sign;
import net.hydromatic.tptp.ast.Source;
import net.hydromatic.tptp.ast.Term;
import net.hydromatic.tptp.ast.Tptp;
import net.hydromatic.tptp.ast.Unit;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.szs.Success;
import net.hydromatic.tptp.type.QuantifiedSort;
import net.hydromatic.tptp.type.Sort;
import net.hydromatic.tptp.type.Sorted;
import net.hydromatic.tptp.type.TFF1Sort;
import net.hydromatic.tptp.type.Type;
import net.hydromatic.tptp.type.Unsorted;
import net.hydromatic.tptp.util.Either;
import org.junit.jupiter.api.Test;

/** Tests for {@link TptpParser}. */
public class TptpParserTest {
  private static final Term X = Term.variable("X");
  private static final Name<Sort> INT = Name.standard(Sort.INT);

  private static <S> FirstOrder<S> atom(String name, Term... args) {
    return FirstOrder.atomic(Literal.predicate(name, args));
  }

  private static FirstOrder<Unsorted> forAll(String var,
      FirstOrder<Unsorted> formula) {
    return FirstOrder.quantified(Quantifier.FORALL,
        ImmutableList.of(
            FirstOrder.Binding.of(Var.of(var), Unsorted.INSTANCE)),
        formula);
  }

  private static Clause.SignedLiteral positive(Literal literal) {
    return Clause.SignedLiteral.of(Sign.POSITIVE, literal);
  }

  private static Clause.SignedLiteral negative(Literal literal) {
    return Clause.SignedLiteral.of(Sign.NEGATIVE, literal);
  }

  @Test void testCnf() {
    final Unit unit = TptpParser.parseUnit("cnf(c1, axiom, p(X) | ~q(X)).");
    final Clause clause =
        Clause.of(
            ImmutableList.of(positive(Literal.predicate("p", X)),
                negative(Literal.predicate("q", X))));
    assertThat(unit,
        is(
            Unit.annotated(Unit.name("c1"),
                Declaration.formula(Role.AXIOM, Formula.cnf(clause)),
                null)));
  }

  @Test void testFofWithSource() {
    final Unit unit =
        TptpParser.parseUnit("fof(ax1, axiom, ![X]: (p(X) => q(X)),\n"
            + "    file('a.p', ax1)).");
    final FirstOrder<Unsorted> formula =
        forAll("X",
            FirstOrder.connected(atom("p", X), Connective.IMPLICATION,
                atom("q", X)));
    assertThat(unit,
        is(
            Unit.annotated(Unit.name("ax1"),
                Declaration.formula(Role.AXIOM, Formula.fof(formula)),
                Annotation.of(
                    Source.file(Atom.of("a.p"), Unit.name("ax1"))))));
  }

  @Test void testTypeDeclaration() {
    final Unit unit =
        TptpParser.parseUnit("tff(f_type, type, f: $int > $int).");
    final Declaration declaration =
        ((Unit.AnnotatedUnit) unit).declaration;
    assertThat(declaration,
        is(
            Declaration.typing(Atom.of("f"),
                Type.mapping(ImmutableList.of(INT), INT))));
    assertThat(declaration.language(), is(Language.TFF));
  }

  @Test void testPolymorphicTypeDeclaration() {
    final Unit unit =
        TptpParser.parseUnit("tff(cons_type, type,\n"
            + "  cons: !>[A: $tType]: (A * list(A)) > list(A)).");
    final TFF1Sort a = TFF1Sort.variable(Var.of("A"));
    final TFF1Sort listOfA =
        TFF1Sort.apply(Name.defined("list"), ImmutableList.of(a));
    assertThat(((Unit.AnnotatedUnit) unit).declaration,
        is(
            Declaration.typing(Atom.of("cons"),
                Type.tff1Type(ImmutableList.of(Var.of("A")),
                    ImmutableList.of(a, listOfA), listOfA))));
  }

  @Test void testSortDeclaration() {
    final Tptp tptp =
        TptpParser.parseTptp("tff(list_type, type, list: $tType > $tType).\n"
            + "tff(nat_type, type, (nat: $tType)).\n"
            + "tff(pair_type, type, pair: ($tType * $tType) > $tType).\n");
    assertThat(tptp.units, hasSize(3));
    assertThat(((Unit.AnnotatedUnit) tptp.units.get(0)).declaration,
        is(Declaration.sort(Atom.of("list"), 1)));
    assertThat(((Unit.AnnotatedUnit) tptp.units.get(1)).declaration,
        is(Declaration.sort(Atom.of("nat"), 0)));
    assertThat(((Unit.AnnotatedUnit) tptp.units.get(2)).declaration,
        is(Declaration.sort(Atom.of("pair"), 2)));
  }

  /** A sorted formula whose annotations are all nullary sorts is
   * monomorphic. */
  @Test void testMonomorphicFormula() {
    final Formula formula =
        TptpParser.parseFormula(Language.TFF, "![X: $int]: $greater(X, 0)");
    final FirstOrder<Sorted<Name<Sort>>> expected =
        FirstOrder.quantified(Quantifier.FORALL,
            ImmutableList.of(
                FirstOrder.Binding.of(Var.of("X"), Sorted.of(INT))),
            FirstOrder.atomic(
                Literal.predicate(Name.standard(PredicateSymbol.GREATER),
                    ImmutableList.of(X,
                        Term.number(Numeral.integer(0))))));
    assertThat(formula, is(Formula.tff0(expected)));
    assertThat(formula.language(), is(Language.TFF));
  }

  /** A formula with a type variable cannot be monomorphized. */
  @Test void testPolymorphicFormula() {
    final Formula formula =
        TptpParser.parseFormula(Language.TFF,
            "![A: $tType, X: list(A)]: p(X)");
    assertThat(formula, instanceOf(Formula.Tff1.class));
    final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> expected =
        FirstOrder.quantified(Quantifier.FORALL,
            ImmutableList.of(
                FirstOrder.Binding.of(Var.of("A"),
                    Sorted.of(
                        Either.<QuantifiedSort, TFF1Sort>left(
                            QuantifiedSort.INSTANCE))),
                FirstOrder.Binding.of(Var.of("X"),
                    Sorted.of(
                        Either.<QuantifiedSort, TFF1Sort>right(
                            TFF1Sort.apply(Name.defined("list"),
                                ImmutableList.of(
                                    TFF1Sort.variable(Var.of("A")))))))),
            atom("p", X));
    assertThat(formula, is(Formula.tff1(expected)));
  }

  /** Binary connectives associate to the right; normalization makes
   * associative ones associate to the left. */
  @Test void testAssociativity() {
    final Formula formula =
        TptpParser.parseFormula(Language.FOF, "p & q & r");
    final FirstOrder<Unsorted> p = atom("p");
    final FirstOrder<Unsorted> q = atom("q");
    final FirstOrder<Unsorted> r = atom("r");
    assertThat(formula,
        is(
            Formula.fof(
                FirstOrder.connected(p, Connective.CONJUNCTION,
                    FirstOrder.connected(q, Connective.CONJUNCTION, r)))));
    assertThat(formula.normalize(),
        is(
            Formula.fof(
                FirstOrder.connected(
                    FirstOrder.connected(p, Connective.CONJUNCTION, q),
                    Connective.CONJUNCTION, r))));

    // All connectives have the same precedence
    assertThat(TptpParser.parseFormula(Language.FOF, "p & q => r"),
        is(
            Formula.fof(
                FirstOrder.connected(p, Connective.CONJUNCTION,
                    FirstOrder.connected(q, Connective.IMPLICATION, r)))));
  }

  @Test void testFirstOrder() {
    final FirstOrder<Unsorted> p = atom("p");
    assertThat(TptpParser.parseFormula(Language.FOF, "~ ~p"),
        is(Formula.fof(FirstOrder.negated(FirstOrder.negated(p)))));
    assertThat(TptpParser.parseFormula(Language.FOF, "((p))"),
        is(Formula.fof(p)));
    assertThat(TptpParser.parseFormula(Language.FOF, "$true <~> p"),
        is(
            Formula.fof(
                FirstOrder.connected(FirstOrder.atomic(Literal.TAUTOLOGY),
                    Connective.EXCLUSIVE_OR, p))));

    final FirstOrder<Unsorted> expected =
        FirstOrder.quantified(Quantifier.FORALL,
            ImmutableList.of(
                FirstOrder.Binding.of(Var.of("X"), Unsorted.INSTANCE),
                FirstOrder.Binding.of(Var.of("Y"), Unsorted.INSTANCE)),
            FirstOrder.quantified(Quantifier.EXISTS,
                ImmutableList.of(
                    FirstOrder.Binding.of(Var.of("Z"), Unsorted.INSTANCE)),
                FirstOrder.atomic(
                    Literal.equality(X, Sign.NEGATIVE,
                        Term.variable("Z")))));
    assertThat(
        TptpParser.parseFormula(Language.FOF, "![X, Y]: ?[Z]: X != Z"),
        is(Formula.fof(expected)));
  }

  @Test void testQuantifiedModal() {
    final Formula formula =
        TptpParser.parseFormula(Language.QMF, "![X]: #box: (p(X) => #dia: q)");
    final QuantifiedModal expected =
        QuantifiedModal.quantified(Quantifier.FORALL,
            ImmutableList.of(Var.of("X")),
            QuantifiedModal.modaled(Modality.NECESSARY,
                QuantifiedModal.connected(
                    QuantifiedModal.atomic(Literal.predicate("p", X)),
                    Connective.IMPLICATION,
                    QuantifiedModal.modaled(Modality.POSSIBLE,
                        QuantifiedModal.atomic(Literal.predicate("q"))))));
    assertThat(formula, is(Formula.qmf(expected)));
    assertThat(formula.language(), is(Language.QMF));
  }

  /** A long chain of connectives is parsed without exhausting the Java
   * stack, and can be reassociated. */
  @Test void testLongChain() {
    final int n = 5000;
    final StringBuilder b = new StringBuilder("p0");
    for (int i = 1; i < n; i++) {
      b.append(" & p").append(i);
    }
    final Tptp tptp = TptpParser.parseTptp("fof(a, axiom, " + b + ").");
    assertThat(tptp.units, hasSize(1));
    final Unit.AnnotatedUnit unit = (Unit.AnnotatedUnit) tptp.units.get(0);
    final Formula.Fof fof =
        (Formula.Fof) ((Declaration.FormulaDeclaration) unit.declaration)
            .formula;

    // Nested to the right: p0 & (p1 & (p2 & ...))
    FirstOrder<Unsorted> f = fof.formula;
    for (int i = 0; i < n - 1; i++) {
      final FirstOrder.Connected<Unsorted> connected =
          (FirstOrder.Connected<Unsorted>) f;
      assertThat(connected.connective, is(Connective.CONJUNCTION));
      assertThat(connected.left,
          is(FirstOrder.<Unsorted>atomic(Literal.predicate("p" + i))));
      f = connected.right;
    }
    assertThat(f,
        is(FirstOrder.<Unsorted>atomic(Literal.predicate("p" + (n - 1)))));

    // Reassociated to the left: ((p0 & p1) & p2) & ...
    f = ((Formula.Fof) fof.normalize()).formula;
    for (int i = n - 1; i > 0; i--) {
      final FirstOrder.Connected<Unsorted> connected =
          (FirstOrder.Connected<Unsorted>) f;
      assertThat(connected.connective, is(Connective.CONJUNCTION));
      assertThat(connected.right,
          is(FirstOrder.<Unsorted>atomic(Literal.predicate("p" + i))));
      f = connected.left;
    }
    assertThat(f, is(FirstOrder.<Unsorted>atomic(Literal.predicate("p0"))));

    // Quantified modal logic has its own grammar
    final Formula.Qmf qmf =
        (Formula.Qmf) TptpParser.parseFormula(Language.QMF,
            b.toString().replace('&', '|'));
    QuantifiedModal g = qmf.formula;
    for (int i = 0; i < n - 1; i++) {
      final QuantifiedModal.Connected connected =
          (QuantifiedModal.Connected) g;
      assertThat(connected.connective, is(Connective.DISJUNCTION));
      g = connected.right;
    }
    assertThat(g,
        is(QuantifiedModal.atomic(Literal.predicate("p" + (n - 1)))));
  }

  @Test void testTerms() {
    assertThat(TptpParser.parseTerm("f(X, (g(a)), \"Hello\")"),
        is(
            Term.function(Name.defined("f"),
                ImmutableList.of(X,
                    Term.function(Name.defined("g"),
                        ImmutableList.of(Term.constant("a"))),
                    Term.distinct(DistinctObject.of("Hello"))))));
    assertThat(TptpParser.parseTerm("$sum(1, 'a b')"),
        is(
            Term.function(Name.standard(FunctionSymbol.SUM),
                ImmutableList.of(Term.number(Numeral.integer(1)),
                    Term.constant("a b")))));
  }

  @Test void testNumbers() {
    assertThat(TptpParser.parseTerm("-7"),
        is(Term.number(Numeral.integer(-7))));
    assertThat(TptpParser.parseTerm("1/2"),
        is(
            Term.number(
                Numeral.rational(BigInteger.ONE, BigInteger.valueOf(2)))));
    assertThat(TptpParser.parseTerm("-3/4"),
        is(
            Term.number(
                Numeral.rational(BigInteger.valueOf(-3),
                    BigInteger.valueOf(4)))));
    assertThat(TptpParser.parseTerm("2.5"),
        is(Term.number(Numeral.real(new BigDecimal("2.5")))));
    assertThat(TptpParser.parseTerm("1e3"),
        is(Term.number(Numeral.real(new BigDecimal("1e3")))));
    final Numeral.RealConstant real =
        (Numeral.RealConstant) Numeral.real(new BigDecimal("1.5"));
    assertThat(real.coefficient(), is(BigInteger.valueOf(15)));
    assertThat(real.exponent(), is(-1));

    // A rational must have a positive denominator
    final TptpParseException e =
        assertThrows(TptpParseException.class,
            () -> TptpParser.parseTerm("1/0"));
    assertThat(e.offset(), is(1));

    // A rational is a single token
    assertThrows(TptpParseException.class,
        () -> TptpParser.parseTerm("1 /2"));
  }

  @Test void testTypes() {
    assertThat(TptpParser.parseType("($int * $int) > $o"),
        is(
            Type.mapping(ImmutableList.of(INT, INT),
                Name.standard(Sort.O))));
    assertThat(TptpParser.parseType("$i"),
        is(Type.mapping(ImmutableList.of(), Name.standard(Sort.I))));
    assertThat(TptpParser.parseType("(($real))").isPolymorphic(), is(false));
  }

  @Test void testClauses() {
    assertThat(TptpParser.parseClause("p | (q | ~ r)"),
        is(
            Clause.of(
                ImmutableList.of(positive(Literal.predicate("p")),
                    positive(Literal.predicate("q")),
                    negative(Literal.predicate("r"))))));
    assertThat(TptpParser.parseClause("X = Y | ~(X != a)"),
        is(
            Clause.of(
                ImmutableList.of(
                    positive(
                        Literal.equality(X, Sign.POSITIVE,
                            Term.variable("Y"))),
                    negative(
                        Literal.equality(X, Sign.NEGATIVE,
                            Term.constant("a")))))));
  }

  @Test void testRoles() {
    final Unit unit = TptpParser.parseUnit("fof(a, lemmata, p).");
    assertThat(((Unit.AnnotatedUnit) unit).declaration,
        is(
            Declaration.formula(Reserved.extended(Role.class, "lemmata"),
                Formula.fof(atom("p")))));
  }

  @Test void testIncludes() {
    assertThat(TptpParser.parseUnit("include('Axioms/SET001-0.ax')."),
        is(Unit.include(Atom.of("Axioms/SET001-0.ax"), null)));
    assertThat(TptpParser.parseUnit("include('a.ax', [ax1, 2])."),
        is(
            Unit.include(Atom.of("a.ax"),
                ImmutableList.of(Unit.name("ax1"), Unit.name(2)))));
    assertThrows(TptpParseException.class,
        () -> TptpParser.parseUnit("include('a.ax', [])."));
  }

  @Test void testInference() {
    final Unit unit =
        TptpParser.parseUnit("cnf(c3, plain, $false,\n"
            + "    inference(resolution, [status(thm)],\n"
            + "              [c1, c2:[bind(X, $fot(a))]])).");
    final Source source =
        Source.inference(Atom.of("resolution"),
            ImmutableList.of(Info.status(Reserved.standard(Success.THM))),
            ImmutableList.of(Parent.of(Source.unit(Unit.name("c1"))),
                Parent.of(Source.unit(Unit.name("c2")),
                    ImmutableList.of(
                        Info.bind(Var.of("X"),
                            Expression.term(Term.constant("a")))))));
    assertThat(unit,
        is(
            Unit.annotated(Unit.name("c3"),
                Declaration.formula(Role.PLAIN,
                    Formula.cnf(Clause.unit(Sign.POSITIVE, Literal.FALSUM))),
                Annotation.of(source))));
  }

  @Test void testAnnotationInfos() {
    final Unit unit =
        TptpParser.parseUnit("fof(f, plain, p,\n"
            + "    introduced(definition, [new_symbols(naming, [sP0, X])]),\n"
            + "    ['a comment', 42, status(foo), [],\n"
            + "     bind(Y, $fof(p & q))]).");
    final Source source =
        Source.introduced(Reserved.standard(Intro.BY_DEFINITION),
            ImmutableList.of(
                Info.newSymbols(Atom.of("naming"),
                    ImmutableList.<Either<Var, Atom>>of(
                        Either.right(Atom.of("sP0")),
                        Either.left(Var.of("X"))))));
    final FirstOrder<Unsorted> pAndQ =
        FirstOrder.connected(atom("p"), Connective.CONJUNCTION, atom("q"));
    final ImmutableList<Info> infos =
        ImmutableList.of(
            Info.application(Atom.of("a comment"), ImmutableList.of()),
            Info.number(Numeral.integer(42)),
            Info.status(Reserved.extended(Success.class, "foo")),
            Info.infos(ImmutableList.of()),
            Info.bind(Var.of("Y"),
                Expression.logical(Formula.fof(pAndQ))));
    assertThat(((Unit.AnnotatedUnit) unit).annotation,
        is(Annotation.of(source, infos)));
  }

  @Test void testSources() {
    assertThat(annotation("unknown"), is(Annotation.of(Source.UNKNOWN)));
    assertThat(annotation("file('x.p')"),
        is(Annotation.of(Source.file(Atom.of("x.p"), null))));
    assertThat(annotation("theory(equality, [])"),
        is(
            Annotation.of(
                Source.theory(Atom.of("equality"), ImmutableList.of()))));
    assertThat(annotation("creator(vampire)"),
        is(Annotation.of(Source.creator(Atom.of("vampire"), null))));
    assertThat(annotation("7, [description('seven')]"),
        is(
            Annotation.of(Source.unit(Unit.name(7)),
                ImmutableList.of(Info.description(Atom.of("seven"))))));
  }

  private static Annotation annotation(String text) {
    final Unit unit =
        TptpParser.parseUnit("fof(a, axiom, p, " + text + ").");
    final Annotation annotation = ((Unit.AnnotatedUnit) unit).annotation;
    assertThat(annotation, notNullValue());
    return annotation;
  }

  @Test void testCommentsBetweenTokens() {
    final Tptp tptp =
        TptpParser.parseTptp("% header\n"
            + "fof( a , axiom , /* inline */ p % to end of line\n"
            + "   ).\n"
            + "/* trailing */\n");
    assertThat(tptp.units, hasSize(1));
    assertThat(TptpParser.parseTptp("  % nothing here\n").units, hasSize(0));
  }

  @Test void testNormalize() {
    final Tptp tptp =
        TptpParser.parseTptp("fof(a, axiom, p | (q | r), "
            + "inference(i, [bind(X, $fof(p & (q & r)))], [b])).");
    final Tptp expected =
        TptpParser.parseTptp("fof(a, axiom, (p | q) | r, "
            + "inference(i, [bind(X, $fof((p & q) & r))], [b])).");
    assertThat(tptp.normalize(), is(expected));
    assertThat(tptp.normalize(), is(expected.normalize()));
  }

  @Test void testErrorPosition() {
    final Map.Entry<String, Pos> split =
        Pos.split("fof(a, axiom, p & $)$.", '$', "");
    final TptpParseException e =
        assertThrows(TptpParseException.class,
            () -> TptpParser.parseTptp(split.getKey()));
    assertThat(e.pos(), is(split.getValue()));
    assertThat(e.offset(), is(18));
    assertThat(e.labels().get(0), is("'('"));
    assertThat(e.labels(), hasItem("unitary formula"));
    assertThat(e.getMessage(),
        is("1.19: expected '(' (in unitary formula, fof, annotated unit, "
            + "unit)"));
  }

  @Test void testErrorOnLaterLine() {
    final TptpParseException e =
        assertThrows(TptpParseException.class,
            () -> TptpParser.parseTptp("fof(a, axiom, p).\n"
                + "fof(b, axiom, q)\n", "x.p"));
    assertThat(e.pos().startLine, is(3));
    assertThat(e.pos().startColumn, is(1));
    assertThat(e.getMessage(),
        is("x.p:3.1: expected '.' (in annotated unit, unit)"));
  }
}

// End TptpParserTest.java
