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
 * Atomic word in the TPTP language: a non-empty string of characters in the
 * printable ASCII range 0x20 to 0x7E.
 *
 * <p>If the string matches {@code [a-z][a-zA-Z0-9_]*} it is written as is,
 * otherwise in single quotes, with {@code '} and {@code \} escaped.
 */
public final class Atom implements Comparable<Atom> {
  public final String name;

  private Atom(String name) {
    checkArgument(isValid(name), "invalid atom: %s", name);
    this.name = name;
  }

  /** Creates an Atom. */
  public static Atom of(String name) {
    return new Atom(name);
  }

  /** Returns whether a string is a valid atom. */
  public static boolean isValid(String s) {
    return !s.isEmpty() && Lexer.isAsciiPrint(s);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Atom && name.equals(((Atom) obj).name);
  }

  @Override
  public int compareTo(Atom o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Atom.java
