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
 * Member of a closed vocabulary that has a canonical name in the TPTP
 * language.
 *
 * <p>Enumerations that implement this interface can be wrapped in
 * {@link Reserved} and looked up by name through a {@link Vocabulary}.
 */
public interface Named {
  /** The canonical name, e.g. {@code int} for the sort {@code $int}. */
  String moniker();
}

// End Named.java
