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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tptp.util.Either;
import net.hydromatic.tptp.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Source of a unit in a TSTP proof. */
public abstract class Source extends AstNode {
  /** The source {@code unknown}. */
  public static final Source UNKNOWN = new Unknown();

  private Source(Op op) {
    super(op);
  }

  /** Creates a reference to another unit. */
  public static Source unit(Either<Atom, BigInteger> name) {
    return new UnitSource(name);
  }

  /** Creates a source {@code file(name, unit)}. */
  public static Source file(Atom file,
      @Nullable Either<Atom, BigInteger> unitName) {
    return new File(file, unitName);
  }

  /** Creates a source {@code theory(name, infos)}. */
  public static Source theory(Atom name, @Nullable List<Info> infos) {
    return new Attributed(Op.THEORY_SOURCE, name, copy(infos));
  }

  /** Creates a source {@code creator(name, infos)}. */
  public static Source creator(Atom name, @Nullable List<Info> infos) {
    return new Attributed(Op.CREATOR_SOURCE, name, copy(infos));
  }

  /** Creates a source {@code introduced(intro, infos)}. */
  public static Source introduced(Reserved<Intro> intro,
      @Nullable List<Info> infos) {
    return new Introduced(intro, copy(infos));
  }

  /** Creates a source {@code inference(rule, infos, parents)}. */
  public static Source inference(Atom rule, List<Info> infos,
      List<Parent> parents) {
    return new Inference(rule, ImmutableList.copyOf(infos),
        ImmutableList.copyOf(parents));
  }

  private static @Nullable ImmutableList<Info> copy(
      @Nullable List<Info> infos) {
    return infos == null ? null : ImmutableList.copyOf(infos);
  }

  private static @Nullable ImmutableList<Info> normalizeAll(
      @Nullable ImmutableList<Info> infos) {
    return infos == null ? null : Static.transformEager(infos, Info::normalize);
  }

  private static StringBuilder appendInfos(StringBuilder buf,
      @Nullable ImmutableList<Info> infos) {
    return infos == null ? buf : Static.appendList(buf.append(", "), infos);
  }

  /** Returns an equivalent source whose embedded formulas are
   * normalized. */
  public Source normalize() {
    return this;
  }

  /** The source {@code unknown}. */
  public static final class Unknown extends Source {
    private Unknown() {
      super(Op.UNKNOWN_SOURCE);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(op.keyword());
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Unknown;
    }
  }

  /** Reference to another unit by name. */
  public static final class UnitSource extends Source {
    public final Either<Atom, BigInteger> name;

    UnitSource(Either<Atom, BigInteger> name) {
      super(Op.UNIT_SOURCE);
      this.name = requireNonNull(name);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof UnitSource && name.equals(((UnitSource) obj).name);
    }
  }

  /** Unit that comes from a file, optionally naming the unit in that
   * file. */
  public static final class File extends Source {
    public final Atom file;
    public final @Nullable Either<Atom, BigInteger> unitName;

    File(Atom file, @Nullable Either<Atom, BigInteger> unitName) {
      super(Op.FILE_SOURCE);
      this.file = requireNonNull(file);
      this.unitName = unitName;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(file);
      if (unitName != null) {
        buf.append(", ").append(unitName);
      }
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, unitName);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof File
              && file.equals(((File) obj).file)
              && Objects.equals(unitName, ((File) obj).unitName);
    }
  }

  /** Source attributed to a named entity: {@code theory} or
   * {@code creator}. */
  public static final class Attributed extends Source {
    public final Atom name;
    public final @Nullable ImmutableList<Info> infos;

    Attributed(Op op, Atom name, @Nullable ImmutableList<Info> infos) {
      super(op);
      checkArgument(op == Op.THEORY_SOURCE || op == Op.CREATOR_SOURCE);
      this.name = requireNonNull(name);
      this.infos = infos;
    }

    @Override
    public Source normalize() {
      return new Attributed(op, name, normalizeAll(infos));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(name);
      return appendInfos(buf, infos).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, infos);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Attributed
              && op == ((Attributed) obj).op
              && name.equals(((Attributed) obj).name)
              && Objects.equals(infos, ((Attributed) obj).infos);
    }
  }

  /** Unit introduced by definition, by assumption, etc. */
  public static final class Introduced extends Source {
    public final Reserved<Intro> intro;
    public final @Nullable ImmutableList<Info> infos;

    Introduced(Reserved<Intro> intro, @Nullable ImmutableList<Info> infos) {
      super(Op.INTRODUCED_SOURCE);
      this.intro = requireNonNull(intro);
      this.infos = infos;
    }

    @Override
    public Source normalize() {
      return new Introduced(intro, normalizeAll(infos));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(intro);
      return appendInfos(buf, infos).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(intro, infos);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Introduced
              && intro.equals(((Introduced) obj).intro)
              && Objects.equals(infos, ((Introduced) obj).infos);
    }
  }

  /** Unit derived by an inference rule from zero or more parents. */
  public static final class Inference extends Source {
    public final Atom rule;
    public final ImmutableList<Info> infos;
    public final ImmutableList<Parent> parents;

    Inference(Atom rule, ImmutableList<Info> infos,
        ImmutableList<Parent> parents) {
      super(Op.INFERENCE_SOURCE);
      this.rule = requireNonNull(rule);
      this.infos = requireNonNull(infos);
      this.parents = requireNonNull(parents);
    }

    @Override
    public Source normalize() {
      return new Inference(rule,
          Static.transformEager(infos, Info::normalize),
          Static.transformEager(parents, Parent::normalize));
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append('(').append(rule).append(", ");
      Static.appendList(buf, infos).append(", ");
      return Static.appendList(buf, parents).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(rule, infos, parents);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Inference
              && rule.equals(((Inference) obj).rule)
              && infos.equals(((Inference) obj).infos)
              && parents.equals(((Inference) obj).parents);
    }
  }
}

// End Source.java
