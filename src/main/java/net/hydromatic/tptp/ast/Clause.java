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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.util.Static;

/**
 * Clause in first-order logic: an implicitly universally quantified
 * disjunction of one or more signed literals.
 *
 * <p>A clause is never empty. The TPTP syntax has no empty clause; the unit
 * clause {@code $false} stands for it, and {@link #of(List)} produces it.
 */
public final class Clause {
  public final ImmutableList<SignedLiteral> literals;

  private Clause(ImmutableList<SignedLiteral> literals) {
    checkArgument(!literals.isEmpty(), "clause must not be empty");
    this.literals = literals;
  }

  /**
   * Creates a clause from a possibly empty list of signed literals. If the
   * list is empty, returns the unit clause {@code $false}.
   */
  public static Clause of(List<SignedLiteral> literals) {
    if (literals.isEmpty()) {
      return unit(SignedLiteral.of(Sign.POSITIVE, Literal.FALSUM));
    }
    return new Clause(ImmutableList.copyOf(literals));
  }

  /** Creates a unit clause. */
  public static Clause unit(SignedLiteral literal) {
    return new Clause(ImmutableList.of(literal));
  }

  /** Creates a unit clause. */
  public static Clause unit(Sign sign, Literal literal) {
    return unit(SignedLiteral.of(sign, literal));
  }

  /** Returns the disjunction of this clause's literals followed by another
   * clause's. */
  public Clause concat(Clause clause) {
    return new Clause(ImmutableList.<SignedLiteral>builder()
        .addAll(literals)
        .addAll(clause.literals)
        .build());
  }

  /** Concatenates a non-empty list of clauses. */
  public static Clause concat(List<Clause> clauses) {
    checkArgument(!clauses.isEmpty());
    if (clauses.size() == 1) {
      return clauses.get(0);
    }
    final ImmutableList.Builder<SignedLiteral> b = ImmutableList.builder();
    clauses.forEach(c -> b.addAll(c.literals));
    return new Clause(b.build());
  }

  @Override
  public int hashCode() {
    return literals.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Clause && literals.equals(((Clause) obj).literals);
  }

  @Override
  public String toString() {
    return Static.appendList(new StringBuilder("Clause"), literals)
        .toString();
  }

  /** Literal with a sign; a negative literal is written {@code ~ p}. */
  public static final class SignedLiteral {
    public final Sign sign;
    public final Literal literal;

    private SignedLiteral(Sign sign, Literal literal) {
      this.sign = requireNonNull(sign);
      this.literal = requireNonNull(literal);
    }

    /** Creates a SignedLiteral. */
    public static SignedLiteral of(Sign sign, Literal literal) {
      return new SignedLiteral(sign, literal);
    }

    @Override
    public int hashCode() {
      return sign.hashCode() * 31 + literal.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof SignedLiteral
              && sign == ((SignedLiteral) obj).sign
              && literal.equals(((SignedLiteral) obj).literal);
    }

    @Override
    public String toString() {
      return "(" + sign + ", " + literal + ")";
    }
  }
}

// End Clause.java
