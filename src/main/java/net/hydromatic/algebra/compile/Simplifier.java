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
import net.hydromatic.algebra.eval.Numbers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of expressions.
 *
 * <p>Simplifies the operands of a call first, then applies the rules of the
 * call's operator, in order:
 *
 * <ul>
 *   <li>{@code +}: {@code 0 + x} &rarr; {@code x}; {@code x + 0} &rarr; {@code
 *       x}; {@code 2 + 3} &rarr; {@code 5}
 *   <li>{@code -}: {@code x - 0} &rarr; {@code x}; {@code 5 - 3} &rarr; {@code
 *       2}
 *   <li>{@code *}: {@code 0 * x} and {@code x * 0} &rarr; {@code 0}; {@code 1
 *       * x} and {@code x * 1} &rarr; {@code x}; {@code 2 * 3} &rarr; {@code 6}
 *   <li>{@code /}: {@code 0 / x} &rarr; {@code 0} (even if <i>x</i> is zero);
 *       {@code x / 1} &rarr; {@code x}; {@code 6 / 4} &rarr; {@code 1.5}
 *   <li>{@code **}: {@code x ** 0} &rarr; {@code 1} (so {@code 0 ** 0} &rarr;
 *       {@code 1}); {@code x ** 1} &rarr; {@code x}; {@code 0 ** x} &rarr;
 *       {@code 0}; {@code 2 ** 3} &rarr; {@code 8}
 * </ul>
 *
 * <p>The order matters. Zero and one are numeric tests, so {@code 0.0} counts
 * as zero. Constant folding uses {@link Numbers} and is skipped if the
 * arithmetic would fail, so simplification never throws.
 */
public class Simplifier {
  private final Tracer tracer;

  Simplifier(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Simplifies an expression. */
  public static Expr simplify(Expr exp) {
    return simplify(exp, Tracers.empty());
  }

  /** Simplifies an expression, reporting each rewrite to a tracer. */
  public static Expr simplify(Expr exp, Tracer tracer) {
    return new Simplifier(tracer).visit(exp);
  }

  Expr visit(Expr exp) {
    switch (exp.op) {
      case NUMBER:
      case VARIABLE:
        return exp;

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case POWER:
        final Ast.InfixCall call = (Ast.InfixCall) exp;
        final Expr a0 = visit(call.a0);
        final Expr a1 = visit(call.a1);
        final Expr rewritten = rewrite(call, a0, a1);
        if (rewritten != null) {
          tracer.onRewrite(call.copy(a0, a1), rewritten);
          return rewritten;
        }
        return call.copy(a0, a1);

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  /**
   * Applies the rules for a call whose operands have been simplified. Returns
   * null if no rule applies.
   */
  private static @Nullable Expr rewrite(Ast.InfixCall call, Expr a0, Expr a1) {
    final Number v0 = value(a0);
    final Number v1 = value(a1);
    switch (call.op) {
      case PLUS:
        if (v0 != null && Numbers.isZero(v0)) {
          return a1;
        }
        if (v1 != null && Numbers.isZero(v1)) {
          return a0;
        }
        if (v0 != null && v1 != null && Numbers.canCombine(v0, v1)) {
          return ast.num(Numbers.plus(v0, v1));
        }
        return null;

      case MINUS:
        // No rule for "0 - x"; there is no negation operator.
        if (v1 != null && Numbers.isZero(v1)) {
          return a0;
        }
        if (v0 != null && v1 != null && Numbers.canCombine(v0, v1)) {
          return ast.num(Numbers.minus(v0, v1));
        }
        return null;

      case TIMES:
        if (v0 != null && Numbers.isZero(v0)
            || v1 != null && Numbers.isZero(v1)) {
          return ast.num(0);
        }
        if (v0 != null && Numbers.isOne(v0)) {
          return a1;
        }
        if (v1 != null && Numbers.isOne(v1)) {
          return a0;
        }
        if (v0 != null && v1 != null && Numbers.canCombine(v0, v1)) {
          return ast.num(Numbers.times(v0, v1));
        }
        return null;

      case DIVIDE:
        if (v0 != null && Numbers.isZero(v0)) {
          return ast.num(0);
        }
        if (v1 != null && Numbers.isOne(v1)) {
          return a0;
        }
        if (v0 != null && v1 != null && Numbers.canDivide(v0, v1)) {
          return ast.num(Numbers.divide(v0, v1));
        }
        return null;

      case POWER:
        if (v1 != null && Numbers.isZero(v1)) {
          return ast.num(1);
        }
        if (v1 != null && Numbers.isOne(v1)) {
          return a0;
        }
        if (v0 != null && Numbers.isZero(v0)) {
          return ast.num(0);
        }
        if (v0 != null && v1 != null && Numbers.canPower(v0, v1)) {
          return ast.num(Numbers.power(v0, v1));
        }
        return null;

      default:
        throw new AssertionError("unknown op " + call.op);
    }
  }

  /** Returns the value of an expression if it is a literal, otherwise null. */
  private static @Nullable Number value(Expr e) {
    return e instanceof Ast.Literal ? ((Ast.Literal) e).value : null;
  }
}

// End Simplifier.java
