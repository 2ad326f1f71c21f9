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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer, rational or real constant.
 *
 * <p>A rational is held as its numerator and a strictly positive
 * denominator, and is not reduced: {@code 2/4} and {@code 1/2} are different
 * values. A real keeps the coefficient and exponent it was written with, so
 * {@code 1.50} and {@code 1.5} are different values.
 */
public abstract class Numeral extends AstNode {
  private Numeral(Op op) {
    super(op);
  }

  /** Creates an integer constant. */
  public static Numeral integer(BigInteger value) {
    return new IntegerConstant(value);
  }

  /** Creates an integer constant. */
  public static Numeral integer(long value) {
    return new IntegerConstant(BigInteger.valueOf(value));
  }

  /** Creates a rational constant. */
  public static Numeral rational(BigInteger numerator,
      BigInteger denominator) {
    return new RationalConstant(numerator, denominator);
  }

  /** Creates a real constant. */
  public static Numeral real(BigDecimal value) {
    return new RealConstant(value);
  }

  /**
   * Creates an integer constant if a decimal number has exponent zero,
   * otherwise a real constant.
   */
  public static Numeral ofDecimal(BigDecimal value) {
    return value.scale() == 0
        ? integer(value.unscaledValue())
        : real(value);
  }

  /** Positive or negative integer. */
  public static final class IntegerConstant extends Numeral {
    public final BigInteger value;

    IntegerConstant(BigInteger value) {
      super(Op.INTEGER);
      this.value = requireNonNull(value);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IntegerConstant
              && value.equals(((IntegerConstant) obj).value);
    }
  }

  /** Rational number. */
  public static final class RationalConstant extends Numeral {
    public final BigInteger numerator;
    public final BigInteger denominator;

    RationalConstant(BigInteger numerator, BigInteger denominator) {
      super(Op.RATIONAL);
      this.numerator = requireNonNull(numerator);
      this.denominator = requireNonNull(denominator);
      checkArgument(denominator.signum() > 0,
          "denominator must be positive: %s", denominator);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(numerator).append('/').append(denominator);
    }

    @Override
    public int hashCode() {
      return numerator.hashCode() * 31 + denominator.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof RationalConstant
              && numerator.equals(((RationalConstant) obj).numerator)
              && denominator.equals(((RationalConstant) obj).denominator);
    }
  }

  /** Real number in scientific notation: coefficient times a power of
   * ten. */
  public static final class RealConstant extends Numeral {
    public final BigDecimal value;

    RealConstant(BigDecimal value) {
      super(Op.REAL);
      this.value = requireNonNull(value);
    }

    /** The decimal coefficient, e.g. 15 for {@code 1.5}. */
    public BigInteger coefficient() {
      return value.unscaledValue();
    }

    /** The base-10 exponent, e.g. -1 for {@code 1.5}. */
    public int exponent() {
      return -value.scale();
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    /** {@inheritDoc}
     *
     * <p>Compares using {@link BigDecimal#equals}, which distinguishes
     * {@code 1.5} from {@code 1.50}. */
    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof RealConstant
              && value.equals(((RealConstant) obj).value);
    }
  }
}

// End Numeral.java
