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
import java.util.Objects;
import net.hydromatic.tptp.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Annotation of a unit: its source, and optional useful information. Most
 * commonly found on units of TSTP proofs. */
public final class Annotation {
  public final Source source;
  public final @Nullable ImmutableList<Info> infos;

  private Annotation(Source source, @Nullable ImmutableList<Info> infos) {
    this.source = requireNonNull(source);
    this.infos = infos;
  }

  /** Creates an Annotation. */
  public static Annotation of(Source source, @Nullable List<Info> infos) {
    return new Annotation(source,
        infos == null ? null : ImmutableList.copyOf(infos));
  }

  /** Creates an Annotation with no information. */
  public static Annotation of(Source source) {
    return new Annotation(source, null);
  }

  /** Returns an equivalent annotation whose embedded formulas are
   * normalized. */
  public Annotation normalize() {
    return new Annotation(source.normalize(),
        infos == null ? null : Static.transformEager(infos, Info::normalize));
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, infos);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Annotation
            && source.equals(((Annotation) obj).source)
            && Objects.equals(infos, ((Annotation) obj).infos);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(source);
    if (infos != null) {
      Static.appendList(buf.append(", "), infos);
    }
    return buf.toString();
  }
}

// End Annotation.java
