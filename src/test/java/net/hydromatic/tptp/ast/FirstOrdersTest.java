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
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tptp.type.QuantifiedSort;
import net.hydromatic.tptp.type.Sort;
import net.hydromatic.tptp.type.Sorted;
import net.hydromatic.tptp.type.TFF1Sort;
import net.hydromatic.tptp.type.Unsorted;
import net.hydromatic.tptp.util.Either;
import org.junit.jupiter.api.Test;

/** Tests for {@link FirstOrder} and the conversions in
 * {@link FirstOrders}. */
public class FirstOrdersTest {
  private static <S> FirstOrder<S> atom(String name) {
    return FirstOrder.atomic(Literal.predicate(name));
  }

  private static <S> FirstOrder<S> and(FirstOrder<S> left,
      FirstOrder<S> right) {
    return FirstOrder.connected(left, Connective.CONJUNCTION, right);
  }

  private static <S> FirstOrder<S> forAll(Var var, S sort,
      FirstOrder<S> formula) {
    return FirstOrder.quantified(Quantifier.FORALL,
        ImmutableList.of(FirstOrder.Binding.of(var, sort)), formula);
  }

  private static final Var X = Var.of("X");

  @Test void testQuantifiedWithNoVariables() {
    final FirstOrder<Unsorted> p = atom("p");
    assertThat(FirstOrder.quantified(Quantifier.EXISTS, ImmutableList.of(), p),
        sameInstance(p));

    final QuantifiedModal q = QuantifiedModal.atomic(Literal.predicate("q"));
    assertThat(
        QuantifiedModal.quantified(Quantifier.FORALL, ImmutableList.of(), q),
        sameInstance(q));
  }

  @Test void testReassociate() {
    final FirstOrder<Unsorted> p = atom("p");
    final FirstOrder<Unsorted> q = atom("q");
    final FirstOrder<Unsorted> r = atom("r");
    final FirstOrder<Unsorted> s = atom("s");
    assertThat(FirstOrders.reassociate(and(p, and(q, r))),
        is(and(and(p, q), r)));
    assertThat(FirstOrders.reassociate(and(p, and(q, and(r, s)))),
        is(and(and(and(p, q), r), s)));
    assertThat(FirstOrders.reassociate(and(and(p, q), and(r, s))),
        is(and(and(and(p, q), r), s)));
    final FirstOrder<Unsorted> leftNested = and(and(and(p, q), r), s);
    assertThat(FirstOrders.reassociate(leftNested), is(leftNested));

    // Under negation and quantifiers
    assertThat(
        FirstOrders.reassociate(
            FirstOrder.negated(forAll(X, Unsorted.INSTANCE,
                and(p, and(q, r))))),
        is(FirstOrder.negated(forAll(X, Unsorted.INSTANCE,
            and(and(p, q), r)))));

    // Implication is not associative; a different connective on the right
    // is left alone
    final FirstOrder<Unsorted> implies =
        FirstOrder.connected(p, Connective.IMPLICATION,
            FirstOrder.connected(q, Connective.IMPLICATION, r));
    assertThat(FirstOrders.reassociate(implies), is(implies));
    final FirstOrder<Unsorted> mixed =
        and(p, FirstOrder.connected(q, Connective.DISJUNCTION, r));
    assertThat(FirstOrders.reassociate(mixed), is(mixed));
  }

  @Test void testSortUnsort() {
    final FirstOrder<Unsorted> f =
        forAll(X, Unsorted.INSTANCE, FirstOrder.negated(atom("p")));
    final FirstOrder<Sorted<Name<Sort>>> sorted =
        FirstOrders.sortFirstOrder(f);
    assertThat(sorted,
        is(forAll(X, Sorted.<Name<Sort>>omitted(),
            FirstOrder.negated(atom("p")))));
    assertThat(FirstOrders.unsortFirstOrder(sorted), is(f));

    final FirstOrder<Sorted<Name<Sort>>> annotated =
        forAll(X, Sorted.of(Name.standard(Sort.INT)), atom("p"));
    assertThat(FirstOrders.unsortFirstOrder(annotated), nullValue());
  }

  @Test void testPolymorphizeMonomorphize() {
    final FirstOrder<Sorted<Name<Sort>>> f =
        forAll(X, Sorted.of(Name.standard(Sort.INT)),
            forAll(Var.of("Y"), Sorted.<Name<Sort>>omitted(), atom("p")));
    final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> poly =
        FirstOrders.polymorphizeFirstOrder(f);
    assertThat(poly, notNullValue());
    assertThat(FirstOrders.monomorphizeFirstOrder(poly), is(f));
  }

  @Test void testMonomorphizeFails() {
    final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> typeVariable =
        forAll(Var.of("A"),
            Sorted.of(Either.<QuantifiedSort, TFF1Sort>left(
                QuantifiedSort.INSTANCE)),
            atom("p"));
    assertThat(FirstOrders.monomorphizeFirstOrder(typeVariable), nullValue());

    final TFF1Sort listOfA =
        TFF1Sort.apply(Name.defined("list"),
            ImmutableList.of(TFF1Sort.variable(Var.of("A"))));
    final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> list =
        forAll(X, Sorted.of(Either.<QuantifiedSort, TFF1Sort>right(listOfA)),
            atom("p"));
    assertThat(FirstOrders.monomorphizeFirstOrder(list), nullValue());
    assertThat(Formula.tff(list), instanceOf(Formula.Tff1.class));
    assertThat(Formula.tff(list).language(), is(Language.TFF));
  }

  @Test void testNormalizeFormula() {
    final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> poly =
        and(atom("p"), and(atom("q"), atom("r")));
    final Formula formula = Formula.tff1(poly);
    final Formula normalized = formula.normalize();
    assertThat(normalized, instanceOf(Formula.Tff0.class));
    final FirstOrder<Sorted<Name<Sort>>> expected =
        and(and(atom("p"), atom("q")), atom("r"));
    assertThat(((Formula.Tff0) normalized).formula, is(expected));
  }
}

// End FirstOrdersTest.java
