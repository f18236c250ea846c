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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import net.hydromatic.algebra.eval.Numbers;
import net.hydromatic.algebra.parse.Tokenizer;

/** Builds expression nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final Ast.Literal ZERO = new Ast.Literal(BigInteger.ZERO);
  private static final Ast.Literal ONE = new Ast.Literal(BigInteger.ONE);

  /** Creates an integer literal. */
  public Ast.Literal num(long value) {
    if (value == 0) {
      return ZERO;
    }
    if (value == 1) {
      return ONE;
    }
    return new Ast.Literal(BigInteger.valueOf(value));
  }

  /** Creates a floating-point literal. */
  public Ast.Literal num(double value) {
    return new Ast.Literal(value);
  }

  /**
   * Creates a literal from any number. Integral types become integer literals;
   * {@link Float}, {@link Double} and {@link java.math.BigDecimal} become
   * floating-point literals.
   */
  public Ast.Literal num(Number value) {
    return new Ast.Literal(Numbers.normalize(value));
  }

  /** Creates a variable reference. */
  public Ast.Id var(String name) {
    checkArgument(isValidName(name), "invalid variable name '%s'", name);
    return new Ast.Id(name);
  }

  /**
   * Returns whether a string is a valid variable name: non-empty, and with no
   * whitespace or parentheses.
   */
  public static boolean isValidName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c == '(' || c == ')' || Tokenizer.isSpace(c)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Converts an operand to an expression. An {@link Expr} is returned as is; a
   * {@link Number} becomes a literal; a {@link String} becomes a variable.
   */
  public Expr coerce(Object o) {
    if (o instanceof Expr) {
      return (Expr) o;
    }
    if (o instanceof Number) {
      return num((Number) o);
    }
    if (o instanceof String) {
      return var((String) o);
    }
    throw new IllegalArgumentException(
        "cannot convert to expression: "
            + (o == null ? "null" : o.getClass().getName()));
  }

  /** Creates a call to a binary operator, coercing both operands. */
  public Ast.InfixCall call(Op op, Object a0, Object a1) {
    return new Ast.InfixCall(op, coerce(a0), coerce(a1));
  }

  public Ast.InfixCall plus(Object a0, Object a1) {
    return call(Op.PLUS, a0, a1);
  }

  public Ast.InfixCall minus(Object a0, Object a1) {
    return call(Op.MINUS, a0, a1);
  }

  public Ast.InfixCall times(Object a0, Object a1) {
    return call(Op.TIMES, a0, a1);
  }

  public Ast.InfixCall divide(Object a0, Object a1) {
    return call(Op.DIVIDE, a0, a1);
  }

  public Ast.InfixCall power(Object a0, Object a1) {
    return call(Op.POWER, a0, a1);
  }
}

// End AstBuilder.java
