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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link Clause}. */
public class ClauseTest {
  private static final Clause P =
      Clause.unit(Sign.POSITIVE, Literal.predicate("p"));
  private static final Clause NOT_Q =
      Clause.unit(Sign.NEGATIVE, Literal.predicate("q"));
  private static final Clause R =
      Clause.unit(Sign.POSITIVE,
          Literal.equality(Term.variable("X"), Sign.NEGATIVE,
              Term.constant("a")));

  @Test void testEmptyClauseIsFalsum() {
    final Clause clause = Clause.of(ImmutableList.of());
    assertThat(clause,
        is(Clause.unit(Sign.POSITIVE, Literal.FALSUM)));
  }

  @Test void testConcatIsAssociative() {
    assertThat(P.concat(NOT_Q).concat(R), is(P.concat(NOT_Q.concat(R))));
    assertThat(Clause.concat(ImmutableList.of(P, NOT_Q, R)),
        is(P.concat(NOT_Q).concat(R)));
    assertThat(Clause.concat(ImmutableList.of(P, NOT_Q, R)).literals,
        hasSize(3));
    assertThat(Clause.concat(ImmutableList.of(P)), sameInstance(P));
    assertThrows(IllegalArgumentException.class,
        () -> Clause.concat(ImmutableList.of()));
  }
}

// End ClauseTest.java
