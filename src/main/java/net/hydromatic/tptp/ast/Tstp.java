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
import net.hydromatic.tptp.szs.Szs;
import net.hydromatic.tptp.util.Static;

/**
 * TSTP output: zero or more units, typically the steps of a proof, and the
 * SZS status of the proof search.
 */
public final class Tstp {
  public final Szs szs;
  public final ImmutableList<Unit> units;

  private Tstp(Szs szs, ImmutableList<Unit> units) {
    this.szs = requireNonNull(szs);
    this.units = units;
  }

  /** Creates a Tstp. */
  public static Tstp of(Szs szs, List<Unit> units) {
    return new Tstp(szs, ImmutableList.copyOf(units));
  }

  /** Returns an equivalent document whose units are normalized. */
  public Tstp normalize() {
    return new Tstp(szs, Static.transformEager(units, Unit::normalize));
  }

  @Override
  public int hashCode() {
    return szs.hashCode() * 31 + units.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Tstp
            && szs.equals(((Tstp) obj).szs)
            && units.equals(((Tstp) obj).units);
  }

  @Override
  public String toString() {
    return Static.appendList(
        new StringBuilder("Tstp(").append(szs).append(", "), units)
        .append(')').toString();
  }
}

// End Tstp.java
