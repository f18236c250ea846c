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
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import java.util.Map;
import net.hydromatic.algebra.compile.Differentiator;
import net.hydromatic.algebra.compile.Simplifier;
import net.hydromatic.algebra.eval.Evaluator;

/**
 * Algebraic expression.
 *
 * <p>An expression is an immutable tree. Its leaves are numbers ({@link
 * Ast.Literal}) and variables ({@link Ast.Id}); its internal nodes are calls to
 * one of five binary operators ({@link Ast.InfixCall}). The {@link #op} field
 * says which.
 *
 * <p>Operations never modify an expression; {@link #simplify} and {@link
 * #deriv} return new trees.
 */
public abstract class Expr {
  public final Op op;

  Expr(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this expression to infix text, inserting only the parentheses
   * required by operator precedence.
   *
   * <p>Marked final because derived classes should override {@code
   * unparseTo}, not {@code toString}.
   */
  @Override
  public final String toString() {
    return unparse(new AstWriter());
  }

  /** Converts this expression to a string, with a given writer. */
  public final String unparse(AstWriter w) {
    return w.append(this).toString();
  }

  /**
   * Converts this expression to fully-parenthesized text, which the parser
   * reads back as an equal expression.
   */
  public final String toParenthesizedString() {
    return unparse(new AstWriter(AstWriter.Style.PARENTHESIZED));
  }

  /** Converts this expression to a constructor-style debugging string. */
  public final String toConstructorString() {
    return unparse(new AstWriter(AstWriter.Style.CONSTRUCTOR));
  }

  abstract AstWriter unparseTo(AstWriter w);

  /**
   * Evaluates this expression.
   *
   * @param env Values of variables
   * @return Value, a {@link java.math.BigInteger} or a {@link Double}
   * @throws net.hydromatic.algebra.eval.UndefinedVariableException if a
   *     variable is not bound
   * @throws ArithmeticException on division by zero or a power outside its
   *     domain
   */
  public Number eval(Map<String, ? extends Number> env) {
    return Evaluator.eval(this, env);
  }

  /**
   * Returns the derivative of this expression with respect to a variable. The
   * result is not simplified.
   *
   * @throws net.hydromatic.algebra.compile.NotConstantExponentException if a
   *     power's exponent is not a number
   */
  public Expr deriv(String name) {
    return Differentiator.deriv(this, name);
  }

  /** Returns a simplified version of this expression. */
  public Expr simplify() {
    return Simplifier.simplify(this);
  }

  /** Returns {@code this + o}. */
  public Ast.InfixCall plus(Object o) {
    return ast.plus(this, o);
  }

  /** Returns {@code o + this}. */
  public Ast.InfixCall rplus(Object o) {
    return ast.plus(o, this);
  }

  /** Returns {@code this - o}. */
  public Ast.InfixCall minus(Object o) {
    return ast.minus(this, o);
  }

  /** Returns {@code o - this}. */
  public Ast.InfixCall rminus(Object o) {
    return ast.minus(o, this);
  }

  /** Returns {@code this * o}. */
  public Ast.InfixCall times(Object o) {
    return ast.times(this, o);
  }

  /** Returns {@code o * this}. */
  public Ast.InfixCall rtimes(Object o) {
    return ast.times(o, this);
  }

  /** Returns {@code this / o}. */
  public Ast.InfixCall divide(Object o) {
    return ast.divide(this, o);
  }

  /** Returns {@code o / this}. */
  public Ast.InfixCall rdivide(Object o) {
    return ast.divide(o, this);
  }

  /** Returns {@code this ** o}. */
  public Ast.InfixCall power(Object o) {
    return ast.power(this, o);
  }

  /** Returns {@code o ** this}. */
  public Ast.InfixCall rpower(Object o) {
    return ast.power(o, this);
  }
}

// End Expr.java
