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

import java.util.Map;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.Expr;

/** Evaluates expressions. */
public final class Evaluator {
  private Evaluator() {}

  /**
   * Evaluates an expression, given values for its variables.
   *
   * <p>The result is a {@link java.math.BigInteger} if the expression only
   * adds, subtracts, multiplies and raises to non-negative powers integers;
   * otherwise a {@link Double}. See {@link Numbers}.
   *
   * @param exp Expression
   * @param env Values of variables; values may be any {@link Number}
   * @return Value of expression
   * @throws UndefinedVariableException if a variable is not in {@code env}
   * @throws ArithmeticException on division by zero or an invalid power
   */
  public static Number eval(Expr exp, Map<String, ? extends Number> env) {
    switch (exp.op) {
      case NUMBER:
        return ((Ast.Literal) exp).value;

      case VARIABLE:
        final String name = ((Ast.Id) exp).name;
        final Number value = env.get(name);
        if (value == null) {
          throw new UndefinedVariableException(name);
        }
        return Numbers.normalize(value);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case POWER:
        final Ast.InfixCall call = (Ast.InfixCall) exp;
        final Number v0 = eval(call.a0, env);
        final Number v1 = eval(call.a1, env);
        switch (exp.op) {
          case PLUS:
            return Numbers.plus(v0, v1);
          case MINUS:
            return Numbers.minus(v0, v1);
          case TIMES:
            return Numbers.times(v0, v1);
          case DIVIDE:
            return Numbers.divide(v0, v1);
          default:
            return Numbers.power(v0, v1);
        }

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }
}

// End Evaluator.java
