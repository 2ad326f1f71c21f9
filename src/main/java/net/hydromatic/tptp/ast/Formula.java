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

import static java.util.Objects.requireNonNull;

import net.hydromatic.tptp.type.QuantifiedSort;
import net.hydromatic.tptp.type.Sort;
import net.hydromatic.tptp.type.Sorted;
import net.hydromatic.tptp.type.TFF1Sort;
import net.hydromatic.tptp.type.Unsorted;
import net.hydromatic.tptp.util.Either;

/** Formula in one of the supported TPTP languages. */
public abstract class Formula extends AstNode {
  private Formula(Op op) {
    super(op);
  }

  /** Creates a formula in clausal normal form. */
  public static Formula cnf(Clause clause) {
    return new Cnf(clause);
  }

  /** Creates a formula in unsorted first-order logic. */
  public static Formula fof(FirstOrder<Unsorted> formula) {
    return new Fof(formula);
  }

  /** Creates a formula in sorted monomorphic first-order logic. */
  public static Formula tff0(FirstOrder<Sorted<Name<Sort>>> formula) {
    return new Tff0(formula);
  }

  /** Creates a formula in sorted polymorphic first-order logic. */
  public static Formula tff1(
      FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> formula) {
    return new Tff1(formula);
  }

  /** Creates a formula in quantified modal logic. */
  public static Formula qmf(QuantifiedModal formula) {
    return new Qmf(formula);
  }

  /**
   * Creates a sorted formula. Returns a {@link Tff0} if the formula can be
   * monomorphized, otherwise a {@link Tff1}.
   */
  public static Formula tff(
      FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> formula) {
    final FirstOrder<Sorted<Name<Sort>>> monomorphic =
        FirstOrders.monomorphizeFirstOrder(formula);
    return monomorphic != null ? tff0(monomorphic) : tff1(formula);
  }

  /** Returns the language of this formula. Both {@link Tff0} and
   * {@link Tff1} are {@link Language#TFF}. */
  public abstract Language language();

  /**
   * Returns an equivalent formula in which applications of associative
   * connectives are left-associative, and polymorphic formulas that need no
   * polymorphism are monomorphic.
   */
  public abstract Formula normalize();

  /** Formula in clausal normal form. */
  public static final class Cnf extends Formula {
    public final Clause clause;

    Cnf(Clause clause) {
      super(Op.CNF);
      this.clause = requireNonNull(clause);
    }

    @Override
    public Language language() {
      return Language.CNF;
    }

    @Override
    public Formula normalize() {
      return this;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(clause);
    }

    @Override
    public int hashCode() {
      return clause.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Cnf && clause.equals(((Cnf) obj).clause);
    }
  }

  /** Formula in unsorted first-order logic. */
  public static final class Fof extends Formula {
    public final FirstOrder<Unsorted> formula;

    Fof(FirstOrder<Unsorted> formula) {
      super(Op.FOF);
      this.formula = requireNonNull(formula);
    }

    @Override
    public Language language() {
      return Language.FOF;
    }

    @Override
    public Formula normalize() {
      return fof(FirstOrders.reassociate(formula));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Fof && formula.equals(((Fof) obj).formula);
    }
  }

  /** Formula in sorted monomorphic first-order logic. */
  public static final class Tff0 extends Formula {
    public final FirstOrder<Sorted<Name<Sort>>> formula;

    Tff0(FirstOrder<Sorted<Name<Sort>>> formula) {
      super(Op.TFF0);
      this.formula = requireNonNull(formula);
    }

    @Override
    public Language language() {
      return Language.TFF;
    }

    @Override
    public Formula normalize() {
      return tff0(FirstOrders.reassociate(formula));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Tff0 && formula.equals(((Tff0) obj).formula);
    }
  }

  /** Formula in sorted polymorphic first-order logic. */
  public static final class Tff1 extends Formula {
    public final FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> formula;

    Tff1(FirstOrder<Sorted<Either<QuantifiedSort, TFF1Sort>>> formula) {
      super(Op.TFF1);
      this.formula = requireNonNull(formula);
    }

    @Override
    public Language language() {
      return Language.TFF;
    }

    @Override
    public Formula normalize() {
      return tff(FirstOrders.reassociate(formula));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Tff1 && formula.equals(((Tff1) obj).formula);
    }
  }

  /** Formula in quantified modal logic. */
  public static final class Qmf extends Formula {
    public final QuantifiedModal formula;

    Qmf(QuantifiedModal formula) {
      super(Op.QMF);
      this.formula = requireNonNull(formula);
    }

    @Override
    public Language language() {
      return Language.QMF;
    }

    @Override
    public Formula normalize() {
      return this;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Qmf && formula.equals(((Qmf) obj).formula);
    }
  }
}

// End Formula.java
