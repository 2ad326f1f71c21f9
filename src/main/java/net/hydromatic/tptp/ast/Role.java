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
 * Predefined role of a formula. Theorem provers may introduce other roles,
 * which are represented as {@link Reserved.Extended}.
 */
public enum Role implements Named {
  AXIOM,
  HYPOTHESIS,
  DEFINITION,
  ASSUMPTION,
  LEMMA,
  THEOREM,
  COROLLARY,
  CONJECTURE,
  NEGATED_CONJECTURE,
  PLAIN,
  FI_DOMAIN,
  FI_FUNCTORS,
  FI_PREDICATES,
  UNKNOWN;

  private final String moniker = name().toLowerCase(Locale.ROOT);

  @Override
  public String moniker() {
    return moniker;
  }
}

// End Role.java
