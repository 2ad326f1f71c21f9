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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sort in sorted rank-1 polymorphic logic (TFF1).
 *
 * <p>Either a sort variable, introduced by a sort quantifier, or the
 * application of a sort constructor to zero or more sorts. An application
 * with no arguments is simply a sort; every TFF0 sort is a TFF1 sort, but not
 * the other way around.
 */
public abstract class TFF1Sort {
  private TFF1Sort() {}

  /** Creates a sort variable. */
  public static TFF1Sort variable(Var var) {
    return new SortVariable(var);
  }

  /** Creates an application of a sort constructor. */
  public static TFF1Sort apply(Name<Sort> name, List<TFF1Sort> args) {
    return new Application(name, ImmutableList.copyOf(args));
  }

  /** Creates a sort constructor with no arguments. */
  public static TFF1Sort of(Name<Sort> name) {
    return new Application(name, ImmutableList.of());
  }

  /**
   * Attempts to convert this sort to a TFF0 sort. Succeeds iff this is a sort
   * constructor with no arguments; otherwise returns null.
   */
  public abstract @Nullable Name<Sort> monomorphize();

  /** Sort variable. */
  public static final class SortVariable extends TFF1Sort {
    public final Var var;

    SortVariable(Var var) {
      this.var = requireNonNull(var);
    }

    @Override
    public @Nullable Name<Sort> monomorphize() {
      return null;
    }

    @Override
    public int hashCode() {
      return var.hashCode() + 11;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof SortVariable && var.equals(((SortVariable) obj).var);
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** Application of a sort constructor to zero or more sorts. */
  public static final class Application extends TFF1Sort {
    public final Name<Sort> name;
    public final ImmutableList<TFF1Sort> args;

    Application(Name<Sort> name, ImmutableList<TFF1Sort> args) {
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public @Nullable Name<Sort> monomorphize() {
      return args.isEmpty() ? name : null;
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + args.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Application
              && name.equals(((Application) obj).name)
              && args.equals(((Application) obj).args);
    }

    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder().append(name);
      if (!args.isEmpty()) {
        Static.appendList(buf, args);
      }
      return buf.toString();
    }
  }
}

// End TFF1Sort.java
