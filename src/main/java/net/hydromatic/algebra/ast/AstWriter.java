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

import static java.util.Objects.requireNonNull;

/** Context for writing an expression out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private final Style style;

  /** Creates a writer in {@link Style#INFIX} style. */
  public AstWriter() {
    this(Style.INFIX);
  }

  /** Creates a writer. */
  public AstWriter(Style style) {
    this.style = requireNonNull(style);
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression to the output. */
  public AstWriter append(Expr e) {
    return e.unparseTo(this);
  }

  /** Appends a numeric literal. */
  public AstWriter appendLiteral(Number value) {
    if (style == Style.CONSTRUCTOR) {
      return append("Num(").append(value.toString()).append(")");
    }
    return append(value.toString());
  }

  /** Appends a variable name. */
  public AstWriter id(String name) {
    if (style == Style.CONSTRUCTOR) {
      return append("Var('").append(name).append("')");
    }
    return append(name);
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(Expr a0, Op op, Expr a1) {
    switch (style) {
      case CONSTRUCTOR:
        return append(op.className)
            .append("(")
            .append(a0)
            .append(", ")
            .append(a1)
            .append(")");
      case PARENTHESIZED:
        return append("(").append(a0).append(op.padded).append(a1).append(")");
      case INFIX:
        operand(a0, op.precedence, op.wrapLeft);
        append(op.padded);
        return operand(a1, op.precedence, op.wrapRight);
      default:
        throw new AssertionError("unknown style " + style);
    }
  }

  /**
   * Appends the operand of an operator whose precedence is {@code
   * precedence}, wrapping it in parentheses if it binds more loosely, or if it
   * binds equally and {@code wrapAtSame}.
   */
  private AstWriter operand(Expr e, int precedence, boolean wrapAtSame) {
    if (e.op.precedence < precedence
        || e.op.precedence == precedence && wrapAtSame) {
      return append("(").append(e).append(")");
    }
    return append(e);
  }

  @Override
  public String toString() {
    return b.toString();
  }

  /** How a writer renders expressions. */
  public enum Style {
    /** Infix, with as few parentheses as possible: {@code x * (2 + 3)}. */
    INFIX,
    /**
     * Every call wrapped in parentheses: {@code (x * (2 + 3))}. This is the
     * syntax accepted by the parser.
     */
    PARENTHESIZED,
    /** Constructor calls: {@code Mul(Var('x'), Add(Num(2), Num(3)))}. */
    CONSTRUCTOR
  }
}

// End AstWriter.java
