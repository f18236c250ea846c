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
package net.hydromatic.algebra.eval;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Arithmetic on the two numeric representations of an expression.
 *
 * <p>Every value is either a {@link BigInteger} (integer-valued) or a {@link
 * Double} (floating-point-valued). Addition, subtraction and multiplication of
 * two integers are exact; any operation involving a floating-point value
 * yields a floating-point value. Division always yields a floating-point
 * value.
 */
public final class Numbers {
  private Numbers() {}

  /** Largest integer result, in bits, that {@link #power} will compute. */
  public static final int MAX_POWER_BITS = 1 << 24;

  /** Integers of at most this many bits convert to {@code double} exactly. */
  private static final int EXACT_DOUBLE_BITS = 53;

  private static final String INT_TOO_LARGE =
      "int too large to convert to float";

  /**
   * Converts a number to one of the two canonical representations. Integral
   * types become {@link BigInteger}; {@link Float}, {@link Double} and {@link
   * BigDecimal} become {@link Double}.
   */
  public static Number normalize(Number n) {
    if (n instanceof BigInteger || n instanceof Double) {
      return n;
    }
    if (n instanceof Integer
        || n instanceof Long
        || n instanceof Short
        || n instanceof Byte) {
      return BigInteger.valueOf(n.longValue());
    }
    if (n instanceof Float || n instanceof BigDecimal) {
      return n.doubleValue();
    }
    throw new IllegalArgumentException(
        "unsupported number type " + n.getClass().getName());
  }

  /** Returns whether a value is zero (integer 0, 0.0 or -0.0). */
  public static boolean isZero(Number n) {
    return n instanceof BigInteger
        ? ((BigInteger) n).signum() == 0
        : n.doubleValue() == 0d;
  }

  /** Returns whether a value is one (integer 1 or 1.0). */
  public static boolean isOne(Number n) {
    return n instanceof BigInteger
        ? n.equals(BigInteger.ONE)
        : n.doubleValue() == 1d;
  }

  private static boolean bothInteger(Number a, Number b) {
    return a instanceof BigInteger && b instanceof BigInteger;
  }

  /** Returns whether a value converts to a finite {@code double}, or is
   * already a {@code double}. */
  private static boolean fitsDouble(Number n) {
    return !(n instanceof BigInteger)
        || Double.isFinite(n.doubleValue());
  }

  /**
   * Converts a value to {@code double}.
   *
   * @throws ArithmeticException if an integer is too large
   */
  private static double toDouble(Number n) {
    if (!fitsDouble(n)) {
      throw new ArithmeticException(INT_TOO_LARGE);
    }
    return n.doubleValue();
  }

  /**
   * Returns whether {@link #plus}, {@link #minus} and {@link #times} would
   * succeed. They fail only when an integer is too large to combine with a
   * floating-point value.
   */
  public static boolean canCombine(Number a, Number b) {
    return bothInteger(a, b) || fitsDouble(a) && fitsDouble(b);
  }

  public static Number plus(Number a, Number b) {
    if (bothInteger(a, b)) {
      return ((BigInteger) a).add((BigInteger) b);
    }
    return toDouble(a) + toDouble(b);
  }

  public static Number minus(Number a, Number b) {
    if (bothInteger(a, b)) {
      return ((BigInteger) a).subtract((BigInteger) b);
    }
    return toDouble(a) - toDouble(b);
  }

  public static Number times(Number a, Number b) {
    if (bothInteger(a, b)) {
      return ((BigInteger) a).multiply((BigInteger) b);
    }
    return toDouble(a) * toDouble(b);
  }

  /**
   * Divides two values. The result is always a {@link Double}.
   *
   * <p>The quotient of two integers is computed from their exact values, so
   * it is finite whenever the true quotient is in range, even if an operand
   * is not.
   *
   * @throws ArithmeticException if the divisor is zero, or if the result or
   *     an operand is out of range
   */
  public static Double divide(Number a, Number b) {
    final String error = divideError(a, b);
    if (error != null) {
      throw new ArithmeticException(error);
    }
    if (bothInteger(a, b)) {
      return integerDivide((BigInteger) a, (BigInteger) b);
    }
    return a.doubleValue() / b.doubleValue();
  }

  /** Returns whether {@link #divide} would succeed. */
  public static boolean canDivide(Number a, Number b) {
    return divideError(a, b) == null;
  }

  private static double integerDivide(BigInteger a, BigInteger b) {
    if (a.bitLength() <= EXACT_DOUBLE_BITS
        && b.bitLength() <= EXACT_DOUBLE_BITS) {
      return a.doubleValue() / b.doubleValue();
    }
    return new BigDecimal(a)
        .divide(new BigDecimal(b), MathContext.DECIMAL128)
        .doubleValue();
  }

  private static @Nullable String divideError(Number a, Number b) {
    if (bothInteger(a, b)) {
      if (isZero(b)) {
        return "division by zero";
      }
      if (Double.isInfinite(integerDivide((BigInteger) a, (BigInteger) b))) {
        return "integer division result too large for a float";
      }
      return null;
    }
    if (!fitsDouble(a) || !fitsDouble(b)) {
      return INT_TOO_LARGE;
    }
    return isZero(b) ? "division by zero" : null;
  }

  /**
   * Raises a value to a power.
   *
   * <p>An integer raised to a non-negative integer is an exact integer; other
   * combinations use {@link Math#pow}.
   *
   * @throws ArithmeticException if the base is zero and the exponent
   *     negative, if the base is negative and the exponent is not integral,
   *     or if the result is too large
   */
  public static Number power(Number a, Number b) {
    final String error = powerError(a, b);
    if (error != null) {
      throw new ArithmeticException(error);
    }
    if (bothInteger(a, b) && ((BigInteger) b).signum() >= 0) {
      return integerPower((BigInteger) a, (BigInteger) b);
    }
    return Math.pow(a.doubleValue(), b.doubleValue());
  }

  /** Returns whether {@link #power} would succeed. */
  public static boolean canPower(Number a, Number b) {
    return powerError(a, b) == null;
  }

  private static BigInteger integerPower(BigInteger a, BigInteger b) {
    if (a.signum() == 0) {
      return b.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
    }
    if (a.equals(BigInteger.ONE)) {
      return a;
    }
    if (a.equals(BigInteger.ONE.negate())) {
      return b.testBit(0) ? a : BigInteger.ONE;
    }
    return a.pow(b.intValueExact());
  }

  /**
   * Returns the message of the error that raising {@code a} to the power
   * {@code b} would cause, or null if it is valid.
   */
  private static @Nullable String powerError(Number a, Number b) {
    if (bothInteger(a, b)) {
      final BigInteger base = (BigInteger) a;
      final BigInteger exponent = (BigInteger) b;
      if (exponent.signum() < 0) {
        if (base.signum() == 0) {
          return "division by zero";
        }
        return fitsDouble(base) && fitsDouble(exponent)
            ? null
            : INT_TOO_LARGE;
      }
      if (base.abs().compareTo(BigInteger.ONE) <= 0) {
        return null;
      }
      if (exponent.bitLength() > 31
          || (long) base.bitLength() * exponent.intValue() > MAX_POWER_BITS) {
        return "integer power too large";
      }
      return null;
    }
    if (!fitsDouble(a) || !fitsDouble(b)) {
      return INT_TOO_LARGE;
    }
    final double x = a.doubleValue();
    final double y = b.doubleValue();
    if (x == 0d && y < 0d) {
      return "division by zero";
    }
    if (x < 0d && Double.isFinite(y) && y != Math.rint(y)) {
      return "math domain error";
    }
    if (Double.isFinite(x)
        && Double.isFinite(y)
        && Double.isInfinite(Math.pow(x, y))) {
      return "numerical result out of range";
    }
    return null;
  }
}

// End Numbers.java
