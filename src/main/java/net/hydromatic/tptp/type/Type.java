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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.ast.Name;
import net.hydromatic.tptp.ast.Var;
import net.hydromatic.tptp.util.Static;

/**
 * Type of a function or predicate symbol in sorted first-order logic.
 *
 * <p>A {@link Tff0Type} maps zero or more sorts to a sort; an empty list of
 * argument sorts is the type of a constant. A {@link Tff1Type} is a
 * possibly quantified mapping of TFF1 sorts to a TFF1 sort.
 *
 * <p>A {@code Tff1Type} only exists if the type cannot be represented as a
 * {@code Tff0Type}: it has quantified sort variables, or at least one of its
 * sorts is a variable or an application with arguments. The factory method
 * {@link #tff1Type} enforces this.
 */
public abstract class Type {
  private Type() {}

  /** Creates a monomorphic type. */
  public static Type mapping(List<Name<Sort>> args, Name<Sort> result) {
    return new Tff0Type(ImmutableList.copyOf(args), result);
  }

  /**
   * Creates a type from a quantified mapping of TFF1 sorts. Returns a
   * {@link Tff0Type} if there are no quantified variables and every sort is
   * a constructor with no arguments, otherwise a {@link Tff1Type}.
   */
  public static Type tff1Type(List<Var> vars, List<TFF1Sort> args,
      TFF1Sort result) {
    if (vars.isEmpty()) {
      final List<Name<Sort>> args0 =
          Static.traverse(args, TFF1Sort::monomorphize);
      final Name<Sort> result0 = result.monomorphize();
      if (args0 != null && result0 != null) {
        return mapping(args0, result0);
      }
    }
    return new Tff1Type(ImmutableList.copyOf(vars),
        ImmutableList.copyOf(args), result);
  }

  /** Whether this type requires polymorphism or sort constructors. */
  public abstract boolean isPolymorphic();

  /** Type in sorted monomorphic first-order logic (TFF0). */
  public static final class Tff0Type extends Type {
    public final ImmutableList<Name<Sort>> args;
    public final Name<Sort> result;

    Tff0Type(ImmutableList<Name<Sort>> args, Name<Sort> result) {
      this.args = requireNonNull(args);
      this.result = requireNonNull(result);
    }

    @Override
    public boolean isPolymorphic() {
      return false;
    }

    @Override
    public int hashCode() {
      return args.hashCode() * 31 + result.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Tff0Type
              && args.equals(((Tff0Type) obj).args)
              && result.equals(((Tff0Type) obj).result);
    }

    @Override
    public String toString() {
      return Static.appendList(new StringBuilder("Type("), args)
          .append(", ").append(result).append(')').toString();
    }
  }

  /** Type in sorted rank-1 polymorphic first-order logic (TFF1). */
  public static final class Tff1Type extends Type {
    /** Quantified sort variables; empty for a monomorphic TFF1 type. */
    public final ImmutableList<Var> vars;
    public final ImmutableList<TFF1Sort> args;
    public final TFF1Sort result;

    Tff1Type(ImmutableList<Var> vars, ImmutableList<TFF1Sort> args,
        TFF1Sort result) {
      this.vars = requireNonNull(vars);
      this.args = requireNonNull(args);
      this.result = requireNonNull(result);
    }

    @Override
    public boolean isPolymorphic() {
      return true;
    }

    @Override
    public int hashCode() {
      return (vars.hashCode() * 31 + args.hashCode()) * 31
          + result.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Tff1Type
              && vars.equals(((Tff1Type) obj).vars)
              && args.equals(((Tff1Type) obj).args)
              && result.equals(((Tff1Type) obj).result);
    }

    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder("TFF1Type(");
      Static.appendList(buf, vars).append(", ");
      return Static.appendList(buf, args)
          .append(", ").append(result).append(')').toString();
    }
  }
}

// End Type.java
