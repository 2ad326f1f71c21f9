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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.tptp.ast.Tstp;
import net.hydromatic.tptp.szs.Dataform;
import net.hydromatic.tptp.szs.NoSuccess;
import net.hydromatic.tptp.szs.Success;
import net.hydromatic.tptp.szs.Szs;
import net.hydromatic.tptp.util.Either;
import org.junit.jupiter.api.Test;

/** Tests for parsing the output of theorem provers, in particular the SZS
 * annotations in leading comments. */
public class TstpTest {
  private static final String REFUTATION = "% SZS status Theorem for SET001+1\n"
      + "% SZS output start CNFRefutation for SET001+1\n"
      + "cnf(c1, axiom, p).\n"
      + "cnf(c2, negated_conjecture, ~p).\n"
      + "cnf(c3, plain, $false, "
      + "inference(resolution, [status(thm)], [c1, c2])).\n"
      + "% SZS output end CNFRefutation for SET001+1\n";

  @Test void testRefutation() {
    final Tstp tstp = TptpParser.parseTstp(REFUTATION);
    assertThat(tstp.szs,
        is(Szs.of(Either.right(Success.THM), Dataform.CRF)));
    assertThat(tstp.units, hasSize(3));
    assertThat(tstp.units, is(TptpParser.parseTptp(REFUTATION).units));
  }

  @Test void testNoAnnotations() {
    final Tstp tstp = TptpParser.parseTstp("fof(a, axiom, p).");
    assertThat(tstp.szs, sameInstance(Szs.EMPTY));
    assertThat(tstp.units, hasSize(1));
    assertThat(TptpParser.parseTstp("").units, hasSize(0));
  }

  @Test void testNoSuccess() {
    assertThat(TptpParser.parseTstp("%% SZS status GaveUp for foo\n").szs,
        is(Szs.noSuccess(NoSuccess.GUP)));
    assertThat(TptpParser.parseTstp("% SZS status Unknown\n").szs,
        is(Szs.noSuccess(NoSuccess.UNK)));
  }

  /** Comments that are not SZS annotations are skipped, as are blank lines
   * and block comments before the first unit. */
  @Test void testOtherComments() {
    final Tstp tstp =
        TptpParser.parseTstp("\n"
            + "% Problem : SYN001\n"
            + "%\n"
            + "% SZS status   Unsatisfiable\n"
            + "% SZS output start FiniteModel\n"
            + "\n"
            + "/* a block\n comment */\n"
            + "cnf(a, axiom, p).\n");
    assertThat(tstp.szs,
        is(Szs.of(Either.right(Success.UNS), Dataform.FMO)));
    assertThat(tstp.units, hasSize(1));
  }

  @Test void testFirstStatusWins() {
    final Tstp tstp =
        TptpParser.parseTstp("% SZS status Theorem\n"
            + "% SZS status CounterSatisfiable\n"
            + "% SZS output start Proof\n"
            + "% SZS output start Model\n");
    assertThat(tstp.szs,
        is(Szs.of(Either.right(Success.THM), Dataform.PRF)));
  }

  /** Only comments before the first unit are scanned. */
  @Test void testLateAnnotationIgnored() {
    final Tstp tstp =
        TptpParser.parseTstp("fof(a, axiom, p).\n"
            + "% SZS status Theorem\n");
    assertThat(tstp.szs, sameInstance(Szs.EMPTY));
  }

  /** A misspelled status is an ordinary comment. */
  @Test void testUnknownStatus() {
    final Tstp tstp =
        TptpParser.parseTstp("% SZS status Theorems\n"
            + "% SZS status Satisfiable\n");
    assertThat(tstp.szs, is(Szs.success(Success.SAT)));
  }

  @Test void testError() {
    final TptpParseException e =
        assertThrows(TptpParseException.class,
            () -> TptpParser.parseTstp("% SZS status Theorem\n"
                + "fof(a, axiom, p)", "out.s"));
    assertThat(e.pos().startLine, is(2));
    assertThat(e.getMessage(),
        is("out.s:2.17: expected '.' (in annotated unit, unit)"));
  }
}

// End TstpTest.java
