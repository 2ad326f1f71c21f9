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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import net.hydromatic.tptp.szs.Dataform;
import net.hydromatic.tptp.szs.NoSuccess;
import net.hydromatic.tptp.szs.Success;
import net.hydromatic.tptp.type.Sort;
import org.junit.jupiter.api.Test;

/** Tests for {@link Reserved} and {@link Vocabulary}. */
public class ReservedTest {
  /** Every standard member is recovered from its own name. */
  @Test void testStandardRoundTrip() {
    checkRoundTrip(Role.class);
    checkRoundTrip(Intro.class);
    checkRoundTrip(FunctionSymbol.class);
    checkRoundTrip(PredicateSymbol.class);
    checkRoundTrip(Sort.class);
    checkRoundTrip(Success.class);
  }

  private static <T extends Enum<T> & Named> void checkRoundTrip(
      Class<T> enumClass) {
    final Vocabulary<T> vocabulary = Vocabulary.of(enumClass);
    for (T t : enumClass.getEnumConstants()) {
      final Reserved<T> reserved = vocabulary.extended(vocabulary.name(t));
      assertThat(reserved, is(Reserved.standard(t)));
      assertThat(reserved.standardValue(), is(t));
      assertThat(reserved.text(vocabulary), is(t.moniker()));
    }
  }

  /** Every member of every vocabulary is found by its own name, both by
   * lookup and by matching in the input. */
  @Test void testLookupRoundTrip() {
    checkLookup(Vocabulary.of(Role.class), Role.class);
    checkLookup(Vocabulary.of(Intro.class), Intro.class);
    checkLookup(Vocabulary.of(FunctionSymbol.class), FunctionSymbol.class);
    checkLookup(Vocabulary.of(PredicateSymbol.class), PredicateSymbol.class);
    checkLookup(Vocabulary.of(Sort.class), Sort.class);
    checkLookup(Vocabulary.of(Connective.class), Connective.class);
    checkLookup(Vocabulary.of(Quantifier.class), Quantifier.class);
    checkLookup(Vocabulary.of(Sign.class), Sign.class);
    checkLookup(Vocabulary.of(Modality.class), Modality.class);
    checkLookup(Vocabulary.of(Language.class), Language.class);
    checkLookup(Vocabulary.of(Success.class), Success.class);
    checkLookup(Success.ONTOLOGY, Success.class);
    checkLookup(NoSuccess.ONTOLOGY, NoSuccess.class);
    checkLookup(Dataform.ONTOLOGY, Dataform.class);
  }

  private static <T extends Enum<T>> void checkLookup(
      Vocabulary<T> vocabulary, Class<T> enumClass) {
    for (T t : enumClass.getEnumConstants()) {
      final String name = vocabulary.name(t);
      assertThat(vocabulary.lookup(name), is(t));
      assertThat(vocabulary.match(name, 0), is(t));
      assertThat(vocabulary.match("(" + name + " x", 1), is(t));
    }
  }

  @Test void testExtended() {
    final Reserved<Role> reserved = Reserved.extended(Role.class, "lemmata");
    assertThat(reserved, instanceOf(Reserved.Extended.class));
    assertThat(reserved.standardValue(), nullValue());
    assertThat(reserved.text(Vocabulary.of(Role.class)), is("lemmata"));
    assertThat(Reserved.extended(Role.class, "negated_conjecture"),
        is(Reserved.standard(Role.NEGATED_CONJECTURE)));
  }

  @Test void testIsValidReserved() {
    assertThat(Reserved.isValidReserved("axiom"), is(true));
    assertThat(Reserved.isValidReserved("fi_domain"), is(true));
    assertThat(Reserved.isValidReserved("a1B_"), is(true));
    assertThat(Reserved.isValidReserved("Axiom"), is(false));
    assertThat(Reserved.isValidReserved("_axiom"), is(false));
    assertThat(Reserved.isValidReserved("a-b"), is(false));
    assertThat(Reserved.isValidReserved(""), is(false));
  }

  @Test void testNames() {
    assertThat(Atom.isValid("a b"), is(true));
    assertThat(Atom.isValid(""), is(false));
    assertThat(Atom.isValid("café"), is(false));
    assertThat(Var.isValid("X1_y"), is(true));
    assertThat(Var.isValid("x"), is(false));
    assertThat(Var.isValid("_X"), is(false));
    assertThat(DistinctObject.isValid(""), is(true));
    assertThat(DistinctObject.isValid("tab\t"), is(false));
  }

  /** Longer names are tried first, and a name that ends in a word
   * character must end the word. */
  @Test void testMatch() {
    final Vocabulary<Sort> sorts = Vocabulary.of(Sort.class);
    assertThat(sorts.match("int)", 0), is(Sort.INT));
    assertThat(sorts.match("i, o", 0), is(Sort.I));
    assertThat(sorts.match("integer", 0), nullValue());
    assertThat(sorts.lookup("real"), is(Sort.REAL));
    assertThat(sorts.lookup("$real"), nullValue());

    final Vocabulary<Connective> connectives =
        Vocabulary.of(Connective.class);
    assertThat(connectives.match("<=> q", 0), is(Connective.EQUIVALENCE));
    assertThat(connectives.match("<= q", 0),
        is(Connective.REVERSED_IMPLICATION));
    assertThat(connectives.match("p ~| q", 2),
        is(Connective.NEGATED_DISJUNCTION));
    assertThat(connectives.longestFirst().get(0).moniker().length(), is(3));
    assertThat(connectives.longestFirst().indexOf(Connective.EQUIVALENCE)
            < connectives.longestFirst()
                .indexOf(Connective.REVERSED_IMPLICATION),
        is(true));
  }
}

// End ReservedTest.java
