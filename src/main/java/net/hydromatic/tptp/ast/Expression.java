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

/** Expression in a TSTP annotation; either a formula or a term. */
public abstract class Expression extends AstNode {
  private Expression(Op op) {
    super(op);
  }

  /** Creates an expression that is a formula. */
  public static Expression logical(Formula formula) {
    return new Logical(formula);
  }

  /** Creates an expression that is a term. */
  public static Expression term(Term term) {
    return new TermExpression(term);
  }

  abstract Expression normalize();

  /** Formula, written {@code $fof(...)}, {@code $cnf(...)} etc. */
  public static final class Logical extends Expression {
    public final Formula formula;

    Logical(Formula formula) {
      super(Op.LOGICAL_EXPRESSION);
      this.formula = requireNonNull(formula);
    }

    @Override
    Expression normalize() {
      return new Logical(formula.normalize());
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append('$').append(formula.language().moniker()).append('(');
      return formula.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Logical && formula.equals(((Logical) obj).formula);
    }
  }

  /** Term, written {@code $fot(...)}. */
  public static final class TermExpression extends Expression {
    public final Term term;

    TermExpression(Term term) {
      super(Op.TERM_EXPRESSION);
      this.term = requireNonNull(term);
    }

    @Override
    Expression normalize() {
      return this;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append('$').append(op.keyword()).append('(');
      return term.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return term.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof TermExpression
              && term.equals(((TermExpression) obj).term);
    }
  }
}

// End Expression.java
