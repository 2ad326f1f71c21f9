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

/**
 * Unit of TPTP input: an {@code include} directive, or a named, possibly
 * annotated declaration.
 *
 * <p>A unit name is either an atom or an integer, represented as
 * {@code Either<Atom, BigInteger>}.
 */
public abstract class Unit extends AstNode {
  private Unit(Op op) {
    super(op);
  }

  /** Creates a unit name that is an atom. */
  public static Either<Atom, BigInteger> name(String atom) {
    return Either.left(Atom.of(atom));
  }

  /** Creates a unit name that is an integer. */
  public static Either<Atom, BigInteger> name(long i) {
    return Either.right(BigInteger.valueOf(i));
  }

  /**
   * Creates an {@code include} directive.
   *
   * @param file File name
   * @param names Names of units to include; null means all units; if not
   *              null, must not be empty
   */
  public static Unit include(Atom file,
      @Nullable List<Either<Atom, BigInteger>> names) {
    return new Include(file,
        names == null ? null : ImmutableList.copyOf(names));
  }

  /** Creates a named, possibly annotated declaration. */
  public static Unit annotated(Either<Atom, BigInteger> name,
      Declaration declaration, @Nullable Annotation annotation) {
    return new AnnotatedUnit(name, declaration, annotation);
  }

  /** Returns an equivalent unit whose declaration and annotation are
   * normalized. */
  public abstract Unit normalize();

  /** The {@code include} directive. */
  public static final class Include extends Unit {
    public final Atom file;
    public final @Nullable ImmutableList<Either<Atom, BigInteger>> names;

    Include(Atom file, @Nullable ImmutableList<Either<Atom, BigInteger>> names) {
      super(Op.INCLUDE);
      checkArgument(names == null || !names.isEmpty(),
          "empty list of included names");
      this.file = requireNonNull(file);
      this.names = names;
    }

    @Override
    public Unit normalize() {
      return this;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(op.keyword()).append("('").append(file).append('\'');
      if (names != null) {
        Static.appendList(buf.append(", "), names);
      }
      return buf.append(").");
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, names);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Include
              && file.equals(((Include) obj).file)
              && Objects.equals(names, ((Include) obj).names);
    }
  }

  /** Named and possibly annotated logical declaration. */
  public static final class AnnotatedUnit extends Unit {
    public final Either<Atom, BigInteger> name;
    public final Declaration declaration;
    public final @Nullable Annotation annotation;

    AnnotatedUnit(Either<Atom, BigInteger> name, Declaration declaration,
        @Nullable Annotation annotation) {
      super(Op.ANNOTATED_UNIT);
      this.name = requireNonNull(name);
      this.declaration = requireNonNull(declaration);
      this.annotation = annotation;
    }

    @Override
    public Unit normalize() {
      return new AnnotatedUnit(name, declaration.normalize(),
          annotation == null ? null : annotation.normalize());
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append(declaration.language().moniker())
          .append('(').append(name).append(", ");
      declaration.describeTo(buf);
      if (annotation != null) {
        buf.append(", ").append(annotation);
      }
      return buf.append(").");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, declaration, annotation);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof AnnotatedUnit
              && name.equals(((AnnotatedUnit) obj).name)
              && declaration.equals(((AnnotatedUnit) obj).declaration)
              && Objects.equals(annotation, ((AnnotatedUnit) obj).annotation);
    }
  }
}

// End Unit.java
