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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.util.Static;

/**
 * Literal in first-order logic: the application of a predicate symbol, or an
 * equality or inequality between two terms.
 *
 * <p>The logical tautology is the predicate {@code $true} with no arguments
 * and the falsum is {@code $false}.
 */
public abstract class Literal extends AstNode {
  /** The literal {@code $true}. */
  public static final Literal TAUTOLOGY =
      predicate(Name.standard(PredicateSymbol.TAUTOLOGY), ImmutableList.of());

  /** The literal {@code $false}. */
  public static final Literal FALSUM =
      predicate(Name.standard(PredicateSymbol.FALSUM), ImmutableList.of());

  private Literal(Op op) {
    super(op);
  }

  /** Creates an application of a predicate symbol. */
  public static Literal predicate(Name<PredicateSymbol> name,
      List<Term> args) {
    return new PredicateLiteral(name, ImmutableList.copyOf(args));
  }

  /** Creates an application of a user-defined predicate symbol. */
  public static Literal predicate(String name, Term... args) {
    return predicate(Name.defined(name), ImmutableList.copyOf(args));
  }

  /** Creates an equality ({@link Sign#POSITIVE}) or inequality. */
  public static Literal equality(Term left, Sign sign, Term right) {
    return new EqualityLiteral(left, sign, right);
  }

  /** Application of a predicate symbol. */
  public static final class PredicateLiteral extends Literal {
    public final Name<PredicateSymbol> name;
    public final ImmutableList<Term> args;

    PredicateLiteral(Name<PredicateSymbol> name, ImmutableList<Term> args) {
      super(Op.PREDICATE);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(name);
      return args.isEmpty() ? buf : Static.appendList(buf, args);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + args.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof PredicateLiteral
              && name.equals(((PredicateLiteral) obj).name)
              && args.equals(((PredicateLiteral) obj).args);
    }
  }

  /** Equality or inequality. */
  public static final class EqualityLiteral extends Literal {
    public final Term left;
    public final Sign sign;
    public final Term right;

    EqualityLiteral(Term left, Sign sign, Term right) {
      super(Op.EQUALITY);
      this.left = requireNonNull(left);
      this.sign = requireNonNull(sign);
      this.right = requireNonNull(right);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      left.describeTo(buf).append(' ').append(sign.moniker()).append(' ');
      return right.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return (left.hashCode() * 31 + sign.hashCode()) * 31 + right.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof EqualityLiteral
              && left.equals(((EqualityLiteral) obj).left)
              && sign == ((EqualityLiteral) obj).sign
              && right.equals(((EqualityLiteral) obj).right);
    }
  }
}

// End Literal.java
