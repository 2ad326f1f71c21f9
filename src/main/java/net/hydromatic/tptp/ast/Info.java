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
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tptp.szs.Success;
import net.hydromatic.tptp.util.Either;
import net.hydromatic.tptp.util.Static;

/**
 * Useful information about a unit, found in its annotation.
 *
 * <p>Information is a tree. The labeled forms ({@code description},
 * {@code status}, {@code bind} and so forth) have fixed shapes; any other
 * atom applied to a list of information is an {@link Application}.
 */
public abstract class Info extends AstNode {
  private Info(Op op) {
    super(op);
  }

  /** Creates {@code description(atom)}. */
  public static Info description(Atom atom) {
    return new AtomInfo(Op.DESCRIPTION, atom);
  }

  /** Creates {@code iquote(atom)}. */
  public static Info iquote(Atom atom) {
    return new AtomInfo(Op.IQUOTE, atom);
  }

  /** Creates {@code refutation(atom)}. */
  public static Info refutation(Atom atom) {
    return new AtomInfo(Op.REFUTATION, atom);
  }

  /** Creates {@code status(code)}. */
  public static Info status(Reserved<Success> status) {
    return new Status(status);
  }

  /** Creates {@code assumptions([names])}; the list must not be empty. */
  public static Info assumptions(List<Either<Atom, BigInteger>> names) {
    return new Assumptions(ImmutableList.copyOf(names));
  }

  /** Creates {@code new_symbols(atom, [symbols])}. */
  public static Info newSymbols(Atom atom, List<Either<Var, Atom>> symbols) {
    return new NewSymbols(atom, ImmutableList.copyOf(symbols));
  }

  /** Creates an expression. */
  public static Info expression(Expression expression) {
    return new ExpressionInfo(expression);
  }

  /** Creates {@code bind(Var, expression)}. */
  public static Info bind(Var var, Expression expression) {
    return new Bind(var, expression);
  }

  /** Creates an application of an atom to zero or more infos. */
  public static Info application(Atom atom, List<Info> args) {
    return new Application(atom, ImmutableList.copyOf(args));
  }

  /** Creates a number. */
  public static Info number(Numeral numeral) {
    return new NumberInfo(numeral);
  }

  /** Creates a list of infos. */
  public static Info infos(List<Info> infos) {
    return new Infos(ImmutableList.copyOf(infos));
  }

  /** Returns an equivalent info whose embedded formulas are normalized. */
  public Info normalize() {
    return this;
  }

  /** Information that is an atom: {@code description}, {@code iquote} or
   * {@code refutation}. */
  public static final class AtomInfo extends Info {
    public final Atom atom;

    AtomInfo(Op op, Atom atom) {
      super(op);
      checkArgument(op == Op.DESCRIPTION || op == Op.IQUOTE
          || op == Op.REFUTATION);
      this.atom = requireNonNull(atom);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(op.keyword()).append('(').append(atom).append(')');
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + atom.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof AtomInfo
              && op == ((AtomInfo) obj).op
              && atom.equals(((AtomInfo) obj).atom);
    }
  }

  /** SZS status of an inference, e.g. {@code status(thm)}. */
  public static final class Status extends Info {
    public final Reserved<Success> status;

    Status(Reserved<Success> status) {
      super(Op.STATUS);
      this.status = requireNonNull(status);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(op.keyword()).append('(').append(status).append(')');
    }

    @Override
    public int hashCode() {
      return status.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Status && status.equals(((Status) obj).status);
    }
  }

  /** Names of the units that an inference assumes. */
  public static final class Assumptions extends Info {
    public final ImmutableList<Either<Atom, BigInteger>> names;

    Assumptions(ImmutableList<Either<Atom, BigInteger>> names) {
      super(Op.ASSUMPTIONS);
      checkArgument(!names.isEmpty(), "empty list of assumptions");
      this.names = names;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(');
      return Static.appendList(buf, names).append(')');
    }

    @Override
    public int hashCode() {
      return names.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Assumptions
              && names.equals(((Assumptions) obj).names);
    }
  }

  /** Symbols introduced by an inference, e.g.
   * {@code new_symbols(skolem, [sK0, X])}. */
  public static final class NewSymbols extends Info {
    public final Atom atom;
    public final ImmutableList<Either<Var, Atom>> symbols;

    NewSymbols(Atom atom, ImmutableList<Either<Var, Atom>> symbols) {
      super(Op.NEW_SYMBOLS);
      this.atom = requireNonNull(atom);
      this.symbols = requireNonNull(symbols);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(atom).append(", ");
      return Static.appendList(buf, symbols).append(')');
    }

    @Override
    public int hashCode() {
      return atom.hashCode() * 31 + symbols.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NewSymbols
              && atom.equals(((NewSymbols) obj).atom)
              && symbols.equals(((NewSymbols) obj).symbols);
    }
  }

  /** Embedded formula or term. */
  public static final class ExpressionInfo extends Info {
    public final Expression expression;

    ExpressionInfo(Expression expression) {
      super(Op.EXPRESSION_INFO);
      this.expression = requireNonNull(expression);
    }

    @Override
    public Info normalize() {
      return new ExpressionInfo(expression.normalize());
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return expression.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return expression.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof ExpressionInfo
              && expression.equals(((ExpressionInfo) obj).expression);
    }
  }

  /** Binding of a variable to an expression. */
  public static final class Bind extends Info {
    public final Var var;
    public final Expression expression;

    Bind(Var var, Expression expression) {
      super(Op.BIND);
      this.var = requireNonNull(var);
      this.expression = requireNonNull(expression);
    }

    @Override
    public Info normalize() {
      return new Bind(var, expression.normalize());
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(var).append(", ");
      return expression.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return var.hashCode() * 31 + expression.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Bind
              && var.equals(((Bind) obj).var)
              && expression.equals(((Bind) obj).expression);
    }
  }

  /** Application of an atom to zero or more infos, e.g.
   * {@code splitting([a, b])} or the bare {@code proof}. */
  public static final class Application extends Info {
    public final Atom atom;
    public final ImmutableList<Info> args;

    Application(Atom atom, ImmutableList<Info> args) {
      super(Op.APPLICATION);
      this.atom = requireNonNull(atom);
      this.args = requireNonNull(args);
    }

    @Override
    public Info normalize() {
      return new Application(atom,
          Static.transformEager(args, Info::normalize));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(atom);
      if (args.isEmpty()) {
        return buf;
      }
      buf.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        args.get(i).describeTo(buf);
      }
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(atom, args);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Application
              && atom.equals(((Application) obj).atom)
              && args.equals(((Application) obj).args);
    }
  }

  /** Number. */
  public static final class NumberInfo extends Info {
    public final Numeral numeral;

    NumberInfo(Numeral numeral) {
      super(Op.NUMBER_INFO);
      this.numeral = requireNonNull(numeral);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return numeral.describeTo(buf);
    }

    @Override
    public int hashCode() {
      return numeral.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NumberInfo
              && numeral.equals(((NumberInfo) obj).numeral);
    }
  }

  /** List of infos in brackets. */
  public static final class Infos extends Info {
    public final ImmutableList<Info> infos;

    Infos(ImmutableList<Info> infos) {
      super(Op.INFOS);
      this.infos = requireNonNull(infos);
    }

    @Override
    public Info normalize() {
      return new Infos(Static.transformEager(infos, Info::normalize));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return Static.appendList(buf, infos);
    }

    @Override
    public int hashCode() {
      return infos.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Infos && infos.equals(((Infos) obj).infos);
    }
  }
}

// End Info.java
