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
import java.util.Objects;
import net.hydromatic.tptp.util.Static;

/**
 * Formula in quantified modal logic (QMF).
 *
 * <p>Like an unsorted {@link FirstOrder} formula, with the additional
 * modal operators {@code #box} and {@code #dia}.
 */
public abstract class QuantifiedModal extends AstNode {
  private QuantifiedModal(Op op) {
    super(op);
  }

  /** Creates an atomic formula. */
  public static QuantifiedModal atomic(Literal literal) {
    return new Atomic(literal);
  }

  /** Creates a negation. */
  public static QuantifiedModal negated(QuantifiedModal formula) {
    return new Negated(formula);
  }

  /** Creates an application of a binary connective. */
  public static QuantifiedModal connected(QuantifiedModal left,
      Connective connective, QuantifiedModal right) {
    return new Connected(left, connective, right);
  }

  /**
   * Creates a quantified formula, or returns the formula itself if the list
   * of variables is empty.
   */
  public static QuantifiedModal quantified(Quantifier quantifier,
      List<Var> vars, QuantifiedModal formula) {
    if (vars.isEmpty()) {
      return formula;
    }
    return new Quantified(quantifier, ImmutableList.copyOf(vars), formula);
  }

  /** Creates an application of a modal operator. */
  public static QuantifiedModal modaled(Modality modality,
      QuantifiedModal formula) {
    return new Modaled(modality, formula);
  }

  /** Atomic formula. */
  public static final class Atomic extends QuantifiedModal {
    public final Literal literal;

    Atomic(Literal literal) {
      super(Op.ATOMIC);
      this.literal = requireNonNull(literal);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return literal.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return literal.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Atomic && literal.equals(((Atomic) obj).literal);
    }
  }

  /** Negated formula. */
  public static final class Negated extends QuantifiedModal {
    public final QuantifiedModal formula;

    Negated(QuantifiedModal formula) {
      super(Op.NEGATED);
      this.formula = requireNonNull(formula);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return formula.describeTo(buf.append("~(")).append(')');
    }

    @Override
    public int hashCode() {
      return formula.hashCode() * 37;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Negated
              && formula.equals(((Negated) obj).formula);
    }
  }

  /** Application of a binary connective. */
  public static final class Connected extends QuantifiedModal {
    public final QuantifiedModal left;
    public final Connective connective;
    public final QuantifiedModal right;

    Connected(QuantifiedModal left, Connective connective,
        QuantifiedModal right) {
      super(Op.CONNECTED);
      this.left = requireNonNull(left);
      this.connective = requireNonNull(connective);
      this.right = requireNonNull(right);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      left.describeTo(buf.append('('))
          .append(' ').append(connective.moniker()).append(' ');
      return right.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, connective, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Connected
              && left.equals(((Connected) obj).left)
              && connective == ((Connected) obj).connective
              && right.equals(((Connected) obj).right);
    }
  }

  /** Quantified formula. Variables carry no sort annotation. */
  public static final class Quantified extends QuantifiedModal {
    public final Quantifier quantifier;
    public final ImmutableList<Var> vars;
    public final QuantifiedModal formula;

    Quantified(Quantifier quantifier, ImmutableList<Var> vars,
        QuantifiedModal formula) {
      super(Op.QUANTIFIED);
      checkArgument(!vars.isEmpty(), "no variables under quantifier");
      this.quantifier = requireNonNull(quantifier);
      this.vars = vars;
      this.formula = requireNonNull(formula);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(quantifier.moniker()).append(' ');
      Static.appendList(buf, vars).append(" : ");
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return Objects.hash(quantifier, vars, formula);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Quantified
              && quantifier == ((Quantified) obj).quantifier
              && vars.equals(((Quantified) obj).vars)
              && formula.equals(((Quantified) obj).formula);
    }
  }

  /** Application of a modal operator. */
  public static final class Modaled extends QuantifiedModal {
    public final Modality modality;
    public final QuantifiedModal formula;

    Modaled(Modality modality, QuantifiedModal formula) {
      super(Op.MODALED);
      this.modality = requireNonNull(modality);
      this.formula = requireNonNull(formula);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(modality.moniker()).append(" : ");
      return formula.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return modality.hashCode() * 31 + formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Modaled
              && modality == ((Modaled) obj).modality
              && formula.equals(((Modaled) obj).formula);
    }
  }
}

// End QuantifiedModal.java
