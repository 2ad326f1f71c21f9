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
 * Variable in the TPTP language, a string that matches
 * {@code [A-Z][a-zA-Z0-9_]*}.
 *
 * <p>A variable is scoped by the quantifier or clause that introduces it;
 * there is no scope object.
 */
public final class Var implements Comparable<Var> {
  public final String name;

  private Var(String name) {
    checkArgument(isValid(name), "invalid variable: %s", name);
    this.name = name;
  }

  /** Creates a Var. */
  public static Var of(String name) {
    return new Var(name);
  }

  /** Returns whether a string is a valid variable name. */
  public static boolean isValid(String s) {
    if (s.isEmpty() || !Lexer.isAsciiUpper(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      if (!Lexer.isAlphaNumeric(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Var && name.equals(((Var) obj).name);
  }

  @Override
  public int compareTo(Var o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Var.java
