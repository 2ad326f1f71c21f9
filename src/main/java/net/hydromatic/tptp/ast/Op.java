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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // numbers
  INTEGER,
  RATIONAL,
  REAL,

  // terms
  FUNCTION_TERM,
  VARIABLE_TERM,
  NUMBER_TERM,
  DISTINCT_TERM,

  // literals
  PREDICATE,
  EQUALITY,

  // first-order and modal formulas
  ATOMIC,
  NEGATED,
  CONNECTED,
  QUANTIFIED,
  MODALED,

  // formulas, one per language
  CNF,
  FOF,
  TFF0,
  TFF1,
  QMF,

  // declarations
  SORT_DECL,
  TYPING_DECL("type"),
  FORMULA_DECL,

  // units
  INCLUDE("include"),
  ANNOTATED_UNIT,

  // sources
  UNKNOWN_SOURCE("unknown"),
  FILE_SOURCE("file"),
  THEORY_SOURCE("theory"),
  CREATOR_SOURCE("creator"),
  INTRODUCED_SOURCE("introduced"),
  INFERENCE_SOURCE("inference"),
  UNIT_SOURCE,

  // expressions
  LOGICAL_EXPRESSION,
  TERM_EXPRESSION("fot"),

  // infos
  DESCRIPTION("description"),
  IQUOTE("iquote"),
  STATUS("status"),
  ASSUMPTIONS("assumptions"),
  REFUTATION("refutation"),
  NEW_SYMBOLS("new_symbols"),
  BIND("bind"),
  EXPRESSION_INFO,
  APPLICATION,
  NUMBER_INFO,
  INFOS;

  /**
   * Keyword that introduces this kind of node, e.g. "inference" in
   * {@code inference(rule, [], [p1])}; null if the node has no keyword.
   */
  public final @Nullable String keyword;

  Op() {
    this(null);
  }

  Op(@Nullable String keyword) {
    this.keyword = keyword;
  }

  /** Returns the keyword; throws if this kind of node has none. */
  public String keyword() {
    if (keyword == null) {
      throw new AssertionError("no keyword for " + this);
    }
    return keyword;
  }
}

// End Op.java
