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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.util.Static;

/** Parent of an inference: a source, and information about how the
 * inference uses it. */
public final class Parent {
  public final Source source;
  public final ImmutableList<Info> infos;

  private Parent(Source source, ImmutableList<Info> infos) {
    this.source = requireNonNull(source);
    this.infos = requireNonNull(infos);
  }

  /** Creates a Parent. */
  public static Parent of(Source source, List<Info> infos) {
    return new Parent(source, ImmutableList.copyOf(infos));
  }

  /** Creates a Parent with no information. */
  public static Parent of(Source source) {
    return new Parent(source, ImmutableList.of());
  }

  Parent normalize() {
    return new Parent(source.normalize(),
        Static.transformEager(infos, Info::normalize));
  }

  @Override
  public int hashCode() {
    return source.hashCode() * 31 + infos.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Parent
            && source.equals(((Parent) obj).source)
            && infos.equals(((Parent) obj).infos);
  }

  @Override
  public String toString() {
    if (infos.isEmpty()) {
      return source.toString();
    }
    return Static.appendList(new StringBuilder().append(source).append(':'),
        infos).toString();
  }
}

// End Parent.java
