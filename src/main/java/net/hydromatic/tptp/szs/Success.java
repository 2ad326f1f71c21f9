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
package net.hydromatic.tptp.szs;

import net.hydromatic.tptp.ast.Named;
import net.hydromatic.tptp.ast.Vocabulary;

/**
 * Value of the SZS Success ontology.
 *
 * <p>Marks the result of a proof search, and also the status of an
 * inference in a TSTP derivation. Each value has a three-letter code (for
 * example {@code thm}), used in {@code status(...)} annotations, and an
 * ontology name (for example {@code Theorem}), used in SZS comment lines.
 *
 * <p>See <a href="http://www.tptp.org/Seminars/SZSOntologies/Summary.html">The
 * SZS Ontologies</a>.
 */
public enum Success implements Named {
  SUC("suc", "Success"),
  UNP("unp", "UnsatisfiabilityPreserving"),
  SAP("sap", "SatisfiabilityPreserving"),
  ESA("esa", "EquiSatisfiable"),
  SAT("sat", "Satisfiable"),
  FSA("fsa", "FinitelySatisfiable"),
  THM("thm", "Theorem"),
  EQV("eqv", "Equivalent"),
  TAC("tac", "TautologousConclusion"),
  WEC("wec", "WeakerConclusion"),
  ETH("eth", "EquivalentTheorem"),
  TAU("tau", "Tautology"),
  WTC("wtc", "WeakerTautologousConclusion"),
  WTH("wth", "WeakerTheorem"),
  CAX("cax", "ContradictoryAxioms"),
  SCA("sca", "SatisfiableConclusionContradictoryAxioms"),
  TCA("tca", "TautologousConclusionContradictoryAxioms"),
  WCA("wca", "WeakerConclusionContradictoryAxioms"),
  CUP("cup", "CounterUnsatisfiabilityPreserving"),
  CSP("csp", "CounterSatisfiabilityPreserving"),
  ECS("ecs", "EquiCounterSatisfiable"),
  CSA("csa", "CounterSatisfiable"),
  CTH("cth", "CounterTheorem"),
  CEQ("ceq", "CounterEquivalent"),
  UNC("unc", "UnsatisfiableConclusion"),
  WCC("wcc", "WeakerCounterConclusion"),
  ECT("ect", "EquivalentCounterTheorem"),
  FUN("fun", "FinitelyUnsatisfiable"),
  UNS("uns", "Unsatisfiable"),
  WUC("wuc", "WeakerUnsatisfiableConclusion"),
  WCT("wct", "WeakerCounterTheorem"),
  SCC("scc", "SatisfiableCounterConclusionContradictoryAxioms"),
  UCA("uca", "UnsatisfiableConclusionContradictoryAxioms"),
  NOC("noc", "NoConsequence");

  /** Vocabulary that maps ontology names, such as {@code Theorem}, to
   * values. */
  public static final Vocabulary<Success> ONTOLOGY =
      Vocabulary.of(Success.class, s -> s.ontologyName);

  private final String moniker;

  /** Full name in the ontology, e.g. "Theorem". */
  public final String ontologyName;

  Success(String moniker, String ontologyName) {
    this.moniker = moniker;
    this.ontologyName = ontologyName;
  }

  /** The three-letter code, e.g. "thm". */
  @Override
  public String moniker() {
    return moniker;
  }
}

// End Success.java
