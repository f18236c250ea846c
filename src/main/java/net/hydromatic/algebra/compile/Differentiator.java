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
package net.hydromatic.algebra.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.Expr;

/**
 * Computes symbolic derivatives.
 *
 * <p>The result is built structurally and is not simplified; for example the
 * derivative of {@code x * x} with respect to {@code x} is {@code x * 1 + x *
 * 1}. Call {@link Simplifier#simplify} to tidy it.
 */
public class Differentiator {
  private final String name;
  private final Tracer tracer;

  Differentiator(String name, Tracer tracer) {
    this.name = requireNonNull(name);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the derivative of an expression with respect to a variable. */
  public static Expr deriv(Expr exp, String name) {
    return deriv(exp, name, Tracers.empty());
  }

  /**
   * Returns the derivative of an expression with respect to a variable, and
   * reports it to a tracer.
   */
  public static Expr deriv(Expr exp, String name, Tracer tracer) {
    final Expr derivative = new Differentiator(name, tracer).deriv(exp);
    tracer.onDerive(exp, name, derivative);
    return derivative;
  }

  Expr deriv(Expr exp) {
    switch (exp.op) {
      case NUMBER:
        return ast.num(0);

      case VARIABLE:
        return ast.num(((Ast.Id) exp).name.equals(name) ? 1 : 0);

      case PLUS:
      case MINUS:
        // Sum and difference rules
        final Ast.InfixCall sum = (Ast.InfixCall) exp;
        return ast.call(exp.op, deriv(sum.a0), deriv(sum.a1));

      case TIMES:
        // Product rule: (u * v)' = u * v' + v * u'
        final Ast.InfixCall product = (Ast.InfixCall) exp;
        return ast.plus(
            ast.times(product.a0, deriv(product.a1)),
            ast.times(product.a1, deriv(product.a0)));

      case DIVIDE:
        // Quotient rule: (u / v)' = (v * u' - u * v') / (v * v)
        final Ast.InfixCall quotient = (Ast.InfixCall) exp;
        final Expr u = quotient.a0;
        final Expr v = quotient.a1;
        return ast.divide(
            ast.minus(ast.times(v, deriv(u)), ast.times(u, deriv(v))),
            ast.times(v, v));

      case POWER:
        // Power rule, for constant n only: (u ** n)' = n * u ** (n - 1) * u'
        final Ast.InfixCall power = (Ast.InfixCall) exp;
        if (!(power.a1 instanceof Ast.Literal)) {
          throw new NotConstantExponentException(power);
        }
        final Expr base = power.a0;
        final Expr n = power.a1;
        return ast.times(
            ast.times(n, ast.power(base, ast.minus(n, 1))), deriv(base));

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }
}

// End Differentiator.java
