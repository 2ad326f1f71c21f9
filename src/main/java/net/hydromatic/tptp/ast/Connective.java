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

/** Binary connective in full first-order logic. */
public enum Connective implements Named {
  CONJUNCTION("&"),
  DISJUNCTION("|"),
  IMPLICATION("=>"),
  EQUIVALENCE("<=>"),
  /** XOR. */
  EXCLUSIVE_OR("<~>"),
  /** NAND. */
  NEGATED_CONJUNCTION("~&"),
  /** NOR. */
  NEGATED_DISJUNCTION("~|"),
  REVERSED_IMPLICATION("<=");

  private final String moniker;

  Connective(String moniker) {
    this.moniker = moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  /** Whether this connective is associative; only {@code &} and {@code |}
   * are. */
  public boolean isAssociative() {
    return this == CONJUNCTION || this == DISJUNCTION;
  }
}

// End Connective.java
