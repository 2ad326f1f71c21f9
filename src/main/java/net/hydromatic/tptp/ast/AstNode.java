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

/**
 * Abstract syntax tree node.
 *
 * <p>Nodes are immutable and compare structurally. Each sub-class has one
 * or more values of {@link Op}; switch on {@link #op} to dispatch.
 */
public abstract class AstNode {
  public final Op op;

  AstNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string for debugging.
   *
   * <p>The string shows the structure of the tree; it is not TPTP syntax.
   * Sub-classes override {@link #describeTo}, not this method.
   */
  @Override
  public final String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes a description of this node to a string builder. */
  abstract StringBuilder describeTo(StringBuilder buf);
}

// End AstNode.java
