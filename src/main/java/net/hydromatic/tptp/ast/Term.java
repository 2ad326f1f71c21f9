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

/** Term in first-order logic extended with arithmetic. */
public abstract class Term extends AstNode {
  private Term(Op op) {
    super(op);
  }

  /**
   * Creates an application of a function symbol. An empty list of arguments
   * is a constant.
   */
  public static Term function(Name<FunctionSymbol> name, List<Term> args) {
    return new FunctionTerm(name, ImmutableList.copyOf(args));
  }

  /** Creates a constant, the application of a user-defined function symbol
   * to no arguments. */
  public static Term constant(String name) {
    return function(Name.defined(name), ImmutableList.of());
  }

  /** Creates a reference to a variable. */
  public static Term variable(Var var) {
    return new VariableTerm(var);
  }

  /** Creates a reference to a variable. */
  public static Term variable(String name) {
    return new VariableTerm(Var.of(name));
  }

  /** Creates a number term. */
  public static Term number(Numeral numeral) {
    return new NumberTerm(numeral);
  }

  /** Creates a distinct object term. */
  public static Term distinct(DistinctObject distinctObject) {
    return new DistinctTerm(distinctObject);
  }

  /** Application of a function symbol. */
  public static final class FunctionTerm extends Term {
    public final Name<FunctionSymbol> name;
    public final ImmutableList<Term> args;

    FunctionTerm(Name<FunctionSymbol> name, ImmutableList<Term> args) {
      super(Op.FUNCTION_TERM);
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
          || obj instanceof FunctionTerm
              && name.equals(((FunctionTerm) obj).name)
              && args.equals(((FunctionTerm) obj).args);
    }
  }

  /** Quantified variable. */
  public static final class VariableTerm extends Term {
    public final Var var;

    VariableTerm(Var var) {
      super(Op.VARIABLE_TERM);
      this.var = requireNonNull(var);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof VariableTerm && var.equals(((VariableTerm) obj).var);
    }
  }

  /** Integer, rational or real constant. */
  public static final class NumberTerm extends Term {
    public final Numeral numeral;

    NumberTerm(Numeral numeral) {
      super(Op.NUMBER_TERM);
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
          || obj instanceof NumberTerm
              && numeral.equals(((NumberTerm) obj).numeral);
    }
  }

  /** Distinct object. */
  public static final class DistinctTerm extends Term {
    public final DistinctObject distinctObject;

    DistinctTerm(DistinctObject distinctObject) {
      super(Op.DISTINCT_TERM);
      this.distinctObject = requireNonNull(distinctObject);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(distinctObject);
    }

    @Override
    public int hashCode() {
      return distinctObject.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof DistinctTerm
              && distinctObject.equals(((DistinctTerm) obj).distinctObject);
    }
  }
}

// End Term.java
