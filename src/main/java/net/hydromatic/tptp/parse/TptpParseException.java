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
package net.hydromatic.tptp.parse;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tptp.ast.Pos;

/**
 * Exception caused by a parse error.
 *
 * <p>Carries the offset where parsing failed, the corresponding line and
 * column, and the labels of the grammar productions that were being
 * attempted, innermost first.
 */
public class TptpParseException extends RuntimeException {
  private final int offset;
  private final Pos pos;
  private final ImmutableList<String> labels;

  TptpParseException(int offset, Pos pos, List<String> labels) {
    super(describe(new StringBuilder(), pos, labels).toString());
    this.offset = offset;
    this.pos = pos;
    this.labels = ImmutableList.copyOf(labels);
  }

  /** Returns the offset, in characters from the start of the input, at
   * which parsing failed. */
  public int offset() {
    return offset;
  }

  /** Returns the line and column at which parsing failed. */
  public Pos pos() {
    return pos;
  }

  /** Returns the labels of the productions being attempted, innermost
   * first. */
  public List<String> labels() {
    return labels;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return describe(buf, pos, labels);
  }

  private static StringBuilder describe(StringBuilder buf, Pos pos,
      List<String> labels) {
    pos.describeTo(buf).append(": expected ").append(labels.get(0));
    if (labels.size() > 1) {
      buf.append(" (in ");
      for (int i = 1; i < labels.size(); i++) {
        if (i > 1) {
          buf.append(", ");
        }
        buf.append(labels.get(i));
      }
      buf.append(')');
    }
    return buf;
  }
}

// End TptpParseException.java
