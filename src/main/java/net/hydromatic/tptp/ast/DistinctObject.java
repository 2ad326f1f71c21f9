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

import net.hydromatic.tptp.parse.Lexer;

/**
 * Distinct object: a possibly empty string of printable ASCII characters,
 * written in double quotes.
 *
 * <p>Distinct objects are interpreted as themselves, so two distinct objects
 * with different text are unequal. This library does not enforce that; it is
 * an instruction to consumers.
 */
public final class DistinctObject {
  public final String text;

  private DistinctObject(String text) {
    checkArgument(isValid(text), "invalid distinct object: %s", text);
    this.text = text;
  }

  /** Creates a DistinctObject. */
  public static DistinctObject of(String text) {
    return new DistinctObject(text);
  }

  /** Returns whether a string is a valid distinct object. */
  public static boolean isValid(String s) {
    return Lexer.isAsciiPrint(s);
  }

  @Override
  public int hashCode() {
    return text.hashCode() + 3;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof DistinctObject
            && text.equals(((DistinctObject) obj).text);
  }

  @Override
  public String toString() {
    return '"' + text + '"';
  }
}

// End DistinctObject.java
