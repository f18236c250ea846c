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
package net.hydromatic.algebra.parse;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

  private static final Pattern SPECIAL =
      Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

  /**
   * Converts a token to a number, or returns null if it is not a number.
   *
   * <p>Tries integer syntax first: {@code "42"} and {@code "-7"} become {@link
   * BigInteger} values. Then floating-point syntax: {@code "1.5"}, {@code
   * ".5"}, {@code "2."}, {@code "1e10"}, {@code "inf"}, {@code "Infinity"} and
   * {@code "NaN"} become {@link Double} values. Java suffixes such as {@code
   * "1d"} and hexadecimal literals are not numbers.
   */
  public static @Nullable Number parseNumber(String s) {
    if (INTEGER.matcher(s).matches()) {
      return new BigInteger(s);
    }
    if (DECIMAL.matcher(s).matches()) {
      return Double.parseDouble(s);
    }
    if (SPECIAL.matcher(s).matches()) {
      final boolean negative = s.charAt(0) == '-';
      final String body = s.toLowerCase(Locale.ROOT).replaceFirst("^[+-]", "");
      if (body.equals("nan")) {
        return Double.NaN;
      }
      return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return null;
  }
}

// End Parsers.java
