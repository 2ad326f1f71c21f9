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

/**
 * Standard function symbol, an operation in the first-order theory of
 * arithmetic.
 *
 * <p>See <a href="http://www.tptp.org/TPTP/TR/TPTPTR.shtml#arithmetic">the
 * TPTP technical report</a>.
 */
public enum FunctionSymbol implements Named {
  /** {@code $uminus}, unary minus. */
  UMINUS("uminus"),
  /** {@code $sum}, sum of two numbers. */
  SUM("sum"),
  /** {@code $difference}, difference between two numbers. */
  DIFFERENCE("difference"),
  /** {@code $product}, product of two numbers. */
  PRODUCT("product"),
  /** {@code $quotient}, exact quotient of two {@code $rat} or
   * {@code $real} numbers. */
  QUOTIENT("quotient"),
  QUOTIENT_E("quotient_e"),
  QUOTIENT_T("quotient_t"),
  QUOTIENT_F("quotient_f"),
  REMAINDER_E("remainder_e"),
  REMAINDER_T("remainder_t"),
  REMAINDER_F("remainder_f"),
  FLOOR("floor"),
  CEILING("ceiling"),
  TRUNCATE("truncate"),
  ROUND("round"),
  /** {@code $to_int}, coercion of a number to {@code $int}. */
  TO_INT("to_int"),
  TO_RAT("to_rat"),
  TO_REAL("to_real");

  private final String moniker;

  FunctionSymbol(String moniker) {
    this.moniker = moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }
}

// End FunctionSymbol.java
