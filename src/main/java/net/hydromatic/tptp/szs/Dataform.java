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

import net.hydromatic.tptp.ast.Vocabulary;

/**
 * Value of the SZS Dataform ontology, the form of the logical data that a
 * proof search produced.
 */
public enum Dataform {
  LDA("LogicalData"),
  SLN("Solution"),
  PRF("Proof"),
  DER("Derivation"),
  REF("Refutation"),
  CRF("CNFRefutation"),
  INT("Interpretation"),
  MOD("Model"),
  PIN("PartialInterpretation"),
  PMO("PartialModel"),
  SIN("StrictlyPartialInterpretation"),
  SMO("StrictlyPartialModel"),
  DIN("DomainInterpretation"),
  DMO("DomainModel"),
  DPI("DomainPartialInterpretation"),
  DPM("DomainPartialModel"),
  DSI("DomainStrictlyPartialInterpretation"),
  DSM("DomainStrictlyPartialModel"),
  FIN("FiniteInterpretation"),
  FMO("FiniteModel"),
  FPI("FinitePartialInterpretation"),
  FPM("FinitePartialModel"),
  FSI("FiniteStrictlyPartialInterpretation"),
  FSM("FiniteStrictlyPartialModel"),
  HIN("HerbrandInterpretation"),
  HMO("HerbrandModel"),
  TIN("FormulaInterpretation"),
  TMO("FormulaModel"),
  TPI("FormulaPartialInterpretation"),
  TSI("FormulaStrictlyPartialInterpretation"),
  TSM("FormulaStrictlyPartialModel"),
  SAT("Saturation"),
  LOF("ListOfFormulae"),
  LTH("ListOfTHF"),
  LTF("ListOfTFF"),
  LFO("ListOfFOF"),
  LCN("ListOfCNF"),
  NSO("NotASolution"),
  ASS("Assurance"),
  IPR("IncompleteProof"),
  IIN("IncompleteInterpretation"),
  NON("None");

  /** Vocabulary that maps ontology names to values. */
  public static final Vocabulary<Dataform> ONTOLOGY =
      Vocabulary.of(Dataform.class, v -> v.ontologyName);

  /** Full name in the ontology, e.g. "LogicalData". */
  public final String ontologyName;

  Dataform(String ontologyName) {
    this.ontologyName = ontologyName;
  }
}

// End Dataform.java
