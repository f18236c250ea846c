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
package net.hydromatic.algebra.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sub-types of {@link Expr}.
 *
 * <p>The set is closed: every operation on expressions is a {@code switch}
 * over these values.
 */
public enum Op {
  // leaves
  NUMBER("Num"),
  VARIABLE("Var"),

  // binary operators
  PLUS("Add", "+", 1, false, false),
  MINUS("Sub", "-", 1, false, true),
  TIMES("Mul", "*", 2, false, false),
  DIVIDE("Div", "/", 2, false, true),
  /** Exponentiation. Right-associative, so only the left side is wrapped. */
  POWER("Pow", "**", 3, true, false);

  /** Precedence of a leaf; higher than any operator. */
  public static final int LEAF_PRECEDENCE = 99;

  /** Name used by the constructor-style writer, e.g. "Add". */
  public final String className;
  /** Operator symbol, e.g. "**"; null for leaves. */
  public final @Nullable String symbol;
  /** Padded symbol, e.g. " ** "; null for leaves. */
  public final @Nullable String padded;
  public final int precedence;
  /** Whether to wrap a left operand of equal precedence. */
  public final boolean wrapLeft;
  /** Whether to wrap a right operand of equal precedence. */
  public final boolean wrapRight;

  /** Binary operators, keyed by symbol. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.symbol != null) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op(String className) {
    this(className, null, LEAF_PRECEDENCE, false, false);
  }

  Op(
      String className,
      @Nullable String symbol,
      int precedence,
      boolean wrapLeft,
      boolean wrapRight) {
    this.className = className;
    this.symbol = symbol;
    this.padded = symbol == null ? null : " " + symbol + " ";
    this.precedence = precedence;
    this.wrapLeft = wrapLeft;
    this.wrapRight = wrapRight;
  }

  /** Returns whether this is a leaf (number or variable). */
  public boolean isLeaf() {
    return symbol == null;
  }

  /** Looks up a binary operator by symbol; returns null if not found. */
  public static @Nullable Op ofSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }
}

// End Op.java
