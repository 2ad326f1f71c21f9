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
package net.hydromatic.tptp.type;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Var;
import org.junit.jupiter.api.Test;

/** Tests for {@link Type} and {@link TFF1Sort}. */
public class TypeTest {
  private static final Name<Sort> INT = Name.standard(Sort.INT);
  private static final Name<Sort> LIST = Name.defined("list");
  private static final Var A = Var.of("A");

  @Test void testMonomorphize() {
    assertThat(TFF1Sort.of(INT).monomorphize(), is(INT));
    assertThat(TFF1Sort.variable(A).monomorphize(), nullValue());
    assertThat(
        TFF1Sort.apply(LIST, ImmutableList.of(TFF1Sort.of(INT)))
            .monomorphize(),
        nullValue());
  }

  /** A polymorphic type with no variables and only nullary sort
   * constructors is built as a monomorphic type. */
  @Test void testTff1TypeIsCanonical() {
    final Type type =
        Type.tff1Type(ImmutableList.of(),
            ImmutableList.of(TFF1Sort.of(INT), TFF1Sort.of(INT)),
            TFF1Sort.of(Name.standard(Sort.O)));
    assertThat(type, instanceOf(Type.Tff0Type.class));
    assertThat(type,
        is(Type.mapping(ImmutableList.of(INT, INT),
            Name.standard(Sort.O))));
    assertThat(type.isPolymorphic(), is(false));
  }

  @Test void testPolymorphicType() {
    final TFF1Sort listOfA =
        TFF1Sort.apply(LIST, ImmutableList.of(TFF1Sort.variable(A)));
    final Type type =
        Type.tff1Type(ImmutableList.of(A),
            ImmutableList.of(listOfA, TFF1Sort.variable(A)), listOfA);
    assertThat(type, instanceOf(Type.Tff1Type.class));
    assertThat(type.isPolymorphic(), is(true));

    // No variables, but a sort constructor with arguments
    final Type type2 =
        Type.tff1Type(ImmutableList.of(),
            ImmutableList.of(),
            TFF1Sort.apply(LIST, ImmutableList.of(TFF1Sort.of(INT))));
    assertThat(type2, instanceOf(Type.Tff1Type.class));
  }

  @Test void testSorted() {
    final Sorted<Name<Sort>> omitted = Sorted.omitted();
    assertThat(omitted.isOmitted(), is(true));
    assertThat(Sorted.of(INT).isOmitted(), is(false));
    assertThat(Sorted.of(INT).traverse(TFF1Sort::of),
        is(Sorted.of(TFF1Sort.of(INT))));
    assertThat(Sorted.of(TFF1Sort.variable(A))
            .traverse(TFF1Sort::monomorphize),
        nullValue());
    assertThat(omitted.traverse(TFF1Sort::of), is(Sorted.<TFF1Sort>omitted()));
  }
}

// End TypeTest.java
