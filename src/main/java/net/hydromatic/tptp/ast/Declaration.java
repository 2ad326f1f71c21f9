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

import net.hydromatic.tptp.type.Type;

/**
 * Declaration in a unit: introduction of a sort constructor, the type of a
 * symbol, or a logical formula with a role.
 */
public abstract class Declaration extends AstNode {
  private Declaration(Op op) {
    super(op);
  }

  /** Creates a declaration of a sort constructor with a given arity. */
  public static Declaration sort(Atom atom, int arity) {
    return new SortDeclaration(atom, arity);
  }

  /** Creates a declaration of the type of a symbol. */
  public static Declaration typing(Atom atom, Type type) {
    return new Typing(atom, type);
  }

  /** Creates a logical formula with a role. */
  public static Declaration formula(Reserved<Role> role, Formula formula) {
    return new FormulaDeclaration(role, formula);
  }

  /** Creates a logical formula with a standard role. */
  public static Declaration formula(Role role, Formula formula) {
    return formula(Reserved.standard(role), formula);
  }

  /** Returns the language of this declaration. Sort and type
   * declarations belong to {@link Language#TFF}. */
  public abstract Language language();

  /** Returns an equivalent declaration whose formula, if any, is
   * normalized. */
  public Declaration normalize() {
    return this;
  }

  /** Declaration of a sort constructor, e.g. {@code list: $tType > $tType}
   * has arity 1. */
  public static final class SortDeclaration extends Declaration {
    public final Atom atom;
    public final int arity;

    SortDeclaration(Atom atom, int arity) {
      super(Op.SORT_DECL);
      checkArgument(arity >= 0, "negative arity %s", arity);
      this.atom = requireNonNull(atom);
      this.arity = arity;
    }

    @Override
    public Language language() {
      return Language.TFF;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append("Sort(").append(atom).append(", ").append(arity)
          .append(')');
    }

    @Override
    public int hashCode() {
      return atom.hashCode() * 31 + arity;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof SortDeclaration
              && atom.equals(((SortDeclaration) obj).atom)
              && arity == ((SortDeclaration) obj).arity;
    }
  }

  /** Declaration of the type of a function or predicate symbol. */
  public static final class Typing extends Declaration {
    public final Atom atom;
    public final Type type;

    Typing(Atom atom, Type type) {
      super(Op.TYPING_DECL);
      this.atom = requireNonNull(atom);
      this.type = requireNonNull(type);
    }

    @Override
    public Language language() {
      return Language.TFF;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append("Typing(").append(atom).append(", ").append(type)
          .append(')');
    }

    @Override
    public int hashCode() {
      return atom.hashCode() * 31 + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Typing
              && atom.equals(((Typing) obj).atom)
              && type.equals(((Typing) obj).type);
    }
  }

  /** Logical formula marked with a role. */
  public static final class FormulaDeclaration extends Declaration {
    public final Reserved<Role> role;
    public final Formula formula;

    FormulaDeclaration(Reserved<Role> role, Formula formula) {
      super(Op.FORMULA_DECL);
      this.role = requireNonNull(role);
      this.formula = requireNonNull(formula);
    }

    @Override
    public Language language() {
      return formula.language();
    }

    @Override
    public Declaration normalize() {
      return new FormulaDeclaration(role, formula.normalize());
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append("Formula(").append(role).append(", ");
      return formula.describeTo(buf).append(')');
    }

    @Override
    public int hashCode() {
      return role.hashCode() * 31 + formula.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof FormulaDeclaration
              && role.equals(((FormulaDeclaration) obj).role)
              && formula.equals(((FormulaDeclaration) obj).formula);
    }
  }
}

// End Declaration.java
