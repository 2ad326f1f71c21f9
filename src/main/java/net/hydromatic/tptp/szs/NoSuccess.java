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
 * Value of the SZS NoSuccess ontology, the reason why a proof search did not
 * succeed.
 */
public enum NoSuccess {
  NOS("NoSuccess"),
  OPN("Open"),
  UNK("Unknown"),
  ASS("Assumed"),
  STP("Stopped"),
  ERR("Error"),
  OSE("OSError"),
  INE("InputError"),
  USE("UsageError"),
  SYE("SyntaxError"),
  SEE("SemanticError"),
  TYE("TypeError"),
  FOR("Forced"),
  USR("User"),
  RSO("ResourceOut"),
  TMO("Timeout"),
  MMO("MemoryOut"),
  GUP("GaveUp"),
  INC("Incomplete"),
  IAP("Inappropriate"),
  INP("InProgress"),
  NTT("NotTried"),
  NTY("NotTriedYet");

  /** Vocabulary that maps ontology names to values. */
  public static final Vocabulary<NoSuccess> ONTOLOGY =
      Vocabulary.of(NoSuccess.class, v -> v.ontologyName);

  /** Full name in the ontology, e.g. "NoSuccess". */
  public final String ontologyName;

  NoSuccess(String ontologyName) {
    this.ontologyName = ontologyName;
  }
}

// End NoSuccess.java
