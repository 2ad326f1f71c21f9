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
package net.hydromatic.tptp.szs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import net.hydromatic.tptp.ast.Vocabulary;
import net.hydromatic.tptp.util.Either;
import org.junit.jupiter.api.Test;

/** Tests for {@link Szs} and the SZS ontologies. */
public class SzsTest {
  @Test void testNames() {
    assertThat(Vocabulary.of(Success.class).lookup("thm"), is(Success.THM));
    assertThat(Success.ONTOLOGY.lookup("Theorem"), is(Success.THM));
    assertThat(Success.ONTOLOGY.lookup("thm"), nullValue());
    assertThat(NoSuccess.ONTOLOGY.lookup("GaveUp"), is(NoSuccess.GUP));
    assertThat(Dataform.ONTOLOGY.lookup("CNFRefutation"), is(Dataform.CRF));
  }

  /** Names that are prefixes of other names do not hide them. */
  @Test void testLongestMatch() {
    assertThat(
        Success.ONTOLOGY.match("SatisfiableConclusionContradictoryAxioms", 0),
        is(Success.SCA));
    assertThat(Success.ONTOLOGY.match("Satisfiable for SYN001", 0),
        is(Success.SAT));
    assertThat(Success.ONTOLOGY.match("Theorems", 0), nullValue());
    assertThat(Dataform.ONTOLOGY.match("FiniteModel\n", 0),
        is(Dataform.FMO));
    assertThat(NoSuccess.ONTOLOGY.match("NotTriedYet", 0),
        is(NoSuccess.NTY));
  }

  @Test void testPlus() {
    final Szs theorem = Szs.success(Success.THM);
    final Szs timeout = Szs.noSuccess(NoSuccess.TMO);
    final Szs proof = Szs.dataform(Dataform.PRF);
    assertThat(Szs.of(null, null), sameInstance(Szs.EMPTY));
    assertThat(Szs.EMPTY.plus(theorem), is(theorem));
    assertThat(theorem.plus(Szs.EMPTY), is(theorem));

    // The first status wins
    assertThat(theorem.plus(timeout), is(theorem));
    assertThat(timeout.plus(theorem), is(timeout));

    // Status and dataform combine
    final Szs both = theorem.plus(proof);
    assertThat(both,
        is(Szs.of(Either.right(Success.THM), Dataform.PRF)));
    assertThat(proof.plus(theorem), is(both));
    assertThat(both.plus(Szs.dataform(Dataform.MOD)).dataform,
        is(Dataform.PRF));
  }
}

// End SzsTest.java
