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
import static org.hamcrest.core.Is.is;

import java.math.BigDecimal;
import java.math.BigInteger;
import net.hydromatic.tptp.ast.Atom;
import net.hydromatic.tptp.ast.Connective;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.ast.Vocabulary;
import net.hydromatic.tptp.type.Sort;
import org.junit.jupiter.api.Test;

/** Tests for {@link Lexer}. */
public class LexerTest {
  /** Parses a prefix of the input and checks the value and where parsing
   * stopped. */
  private static <T> void check(Parser<T> parser, String input, T value,
      int end) {
    final Result<T> r = parser.parse(input, 0);
    assertThat(r.isSuccess(), is(true));
    assertThat(r.value(), is(value));
    assertThat(r.end(), is(end));
  }

  private static Result.Failure<?> fail(Parser<?> parser, String input) {
    final Result<?> r = parser.parse(input, 0);
    assertThat(r.isSuccess(), is(false));
    return Parser.requireFailure(r.furthest());
  }

  @Test void testSkipInsignificant() {
    final String s = "  % a comment\n\t/* a\n block */ % more\n  p";
    assertThat(Lexer.skipInsignificant(s, 0), is(s.indexOf('p')));
    assertThat(Lexer.skipInsignificant("p", 0), is(0));
    assertThat(Lexer.skipInsignificant("", 0), is(0));
    assertThat(Lexer.skipInsignificant("% trailing", 0), is(10));

    // A block comment ends at the first "*/"
    assertThat(Lexer.skipInsignificant("/* a */ b */", 0), is(8));

    // An unterminated block comment is left in place
    assertThat(Lexer.skipInsignificant("  /* open", 0), is(2));
  }

  @Test void testQuoted() {
    check(Lexer.quoted('\''), "'a b'c", "a b", 5);
    check(Lexer.quoted('\''), "'it\\'s'", "it's", 7);
    check(Lexer.quoted('\''), "'a\\\\b'", "a\\b", 6);
    // A backslash before any other character stands for itself
    check(Lexer.quoted('\''), "'a\\nb'", "a\\nb", 6);
    check(Lexer.quoted('"'), "\"\"", "", 2);

    final Result.Failure<?> f = fail(Lexer.quoted('\''), "'abc");
    assertThat(f.offset, is(4));
    assertThat(f.labels.get(0), is("closing quote"));
    assertThat(fail(Lexer.quoted('\''), "'a\tb'").offset, is(2));
  }

  @Test void testWords() {
    check(Lexer.ATOM, "abc_1 (", Atom.of("abc_1"), 6);
    check(Lexer.ATOM, "'A b' ,", Atom.of("A b"), 6);
    check(Lexer.VAR, "X1,", Var.of("X1"), 2);
    assertThat(fail(Lexer.ATOM, "''").labels, hasItem("non-empty atom"));
    assertThat(fail(Lexer.ATOM, "Abc").labels, hasItem("atom"));
    assertThat(fail(Lexer.VAR, "abc").labels, hasItem("variable"));
  }

  @Test void testNames() {
    final Parser<Name<Sort>> sort = Lexer.name(Vocabulary.of(Sort.class));
    check(sort, "$int)", Name.standard(Sort.INT), 4);
    check(sort, "$o ", Name.standard(Sort.O), 3);
    check(sort, "$integer",
        Name.reserved(Vocabulary.of(Sort.class).extended("integer")), 8);
    check(sort, "nat ", Name.<Sort>defined("nat"), 4);
  }

  @Test void testTokens() {
    check(Lexer.token("type"), "type ,", "type", 5);
    fail(Lexer.token("type"), "types");
    check(Lexer.token("!>"), "!>[", "!>", 2);
    check(Lexer.op('('), "( /* c */ x", '(', 10);
    check(Lexer.enumeration(Vocabulary.of(Connective.class), "connective"),
        "<=> q", Connective.EQUIVALENCE, 4);
    check(Lexer.enumeration(Vocabulary.of(Connective.class), "connective"),
        "<= q", Connective.REVERSED_IMPLICATION, 3);
    assertThat(
        fail(Lexer.enumeration(Vocabulary.of(Connective.class), "connective"),
            "+").labels.get(0),
        is("connective"));
  }

  @Test void testNumbers() {
    check(Lexer.SCIENTIFIC, "12", new BigDecimal("12"), 2);
    check(Lexer.SCIENTIFIC, "-2.50e3)", new BigDecimal("-2.50e3"), 7);
    check(Lexer.SCIENTIFIC, "1E-2", new BigDecimal("1E-2"), 4);
    // A dot or exponent marker without digits is not part of the number
    check(Lexer.SCIENTIFIC, "1.", new BigDecimal("1"), 1);
    check(Lexer.SCIENTIFIC, "1.e", new BigDecimal("1"), 1);
    check(Lexer.SCIENTIFIC, "7e+", new BigDecimal("7"), 1);
    fail(Lexer.SCIENTIFIC, "-x");

    check(Lexer.SIGNED_INTEGER, "-17 ", BigInteger.valueOf(-17), 4);
    check(Lexer.SIGNED_INTEGER, "+3", BigInteger.valueOf(3), 2);
    check(Lexer.UNSIGNED_DIGITS, "0042", BigInteger.valueOf(42), 4);
    fail(Lexer.UNSIGNED_DIGITS, "-1");
  }

  @Test void testConsumeAll() {
    final Parser<Atom> atom = Lexer.consumeAll(Lexer.ATOM);
    check(atom, " % leading\n a % trailing", Atom.of("a"), 24);
    final Result.Failure<?> f = fail(atom, "a b");
    assertThat(f.offset, is(2));
    assertThat(f.labels.get(0), is("end of input"));
  }
}

// End LexerTest.java
