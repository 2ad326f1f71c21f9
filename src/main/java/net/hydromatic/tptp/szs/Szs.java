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

import java.util.Objects;
import net.hydromatic.tptp.util.Either;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * SZS summary of a TSTP text: the status of the proof search and the form of
 * the data it produced. Either may be absent.
 *
 * <p>The status is {@code Either<NoSuccess, Success>}.
 */
public final class Szs {
  /** Summary with neither status nor dataform. */
  public static final Szs EMPTY = new Szs(null, null);

  public final @Nullable Either<NoSuccess, Success> status;
  public final @Nullable Dataform dataform;

  private Szs(
      @Nullable Either<NoSuccess, Success> status,
      @Nullable Dataform dataform) {
    this.status = status;
    this.dataform = dataform;
  }

  /** Creates a summary. */
  public static Szs of(
      @Nullable Either<NoSuccess, Success> status,
      @Nullable Dataform dataform) {
    return status == null && dataform == null
        ? EMPTY
        : new Szs(status, dataform);
  }

  /** Creates a summary with a successful status. */
  public static Szs success(Success success) {
    return of(Either.right(success), null);
  }

  /** Creates a summary with an unsuccessful status. */
  public static Szs noSuccess(NoSuccess noSuccess) {
    return of(Either.left(noSuccess), null);
  }

  /** Creates a summary with a dataform. */
  public static Szs dataform(Dataform dataform) {
    return of(null, dataform);
  }

  /**
   * Combines this summary with a later one. The first status and the first
   * dataform win; the later summary only fills in what is missing.
   */
  public Szs plus(Szs later) {
    return of(status != null ? status : later.status,
        dataform != null ? dataform : later.dataform);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, dataform);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Szs
            && Objects.equals(status, ((Szs) obj).status)
            && dataform == ((Szs) obj).dataform;
  }

  @Override
  public String toString() {
    return "SZS(" + status + ", " + dataform + ")";
  }
}

// End Szs.java
