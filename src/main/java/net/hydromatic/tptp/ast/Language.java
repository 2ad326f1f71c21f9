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

import java.util.Locale;

/**
 * Language of logical formulas in TPTP.
 *
 * <p>The languages form a hierarchy: every CNF formula is syntactically a
 * FOF formula, and every FOF formula is a TFF formula. TFF covers both the
 * monomorphic (TFF0) and the rank-1 polymorphic (TFF1) sorted logic.
 */
public enum Language implements Named {
  /** Clausal normal form of unsorted first-order logic. */
  CNF,
  /** Full unsorted first-order logic. */
  FOF,
  /** Full sorted first-order logic. */
  TFF,
  /** Quantified modal logic. */
  QMF;

  /** The keyword that introduces a unit, e.g. {@code cnf}. */
  private final String moniker = name().toLowerCase(Locale.ROOT);

  @Override
  public String moniker() {
    return moniker;
  }
}

// End Language.java
