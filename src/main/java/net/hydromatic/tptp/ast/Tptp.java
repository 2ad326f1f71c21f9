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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.util.Static;

/** TPTP input: zero or more units, typically the axioms and conjecture of a
 * problem. */
public final class Tptp {
  public final ImmutableList<Unit> units;

  private Tptp(ImmutableList<Unit> units) {
    this.units = units;
  }

  /** Creates a Tptp. */
  public static Tptp of(List<Unit> units) {
    return new Tptp(ImmutableList.copyOf(units));
  }

  /** Returns a document with this document's units followed by
   * another's. */
  public Tptp plus(Tptp tptp) {
    return new Tptp(ImmutableList.<Unit>builder()
        .addAll(units).addAll(tptp.units).build());
  }

  /** Returns an equivalent document whose units are normalized. */
  public Tptp normalize() {
    return new Tptp(Static.transformEager(units, Unit::normalize));
  }

  @Override
  public int hashCode() {
    return units.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Tptp && units.equals(((Tptp) obj).units);
  }

  @Override
  public String toString() {
    return Static.appendList(new StringBuilder("Tptp"), units).toString();
  }
}

// End Tptp.java
