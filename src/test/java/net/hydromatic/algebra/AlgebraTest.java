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
package net.hydromatic.algebra;

import static net.hydromatic.algebra.Alg.alg;
import static net.hydromatic.algebra.Matchers.isDouble;
import static net.hydromatic.algebra.Matchers.isExpr;
import static net.hydromatic.algebra.Matchers.isInteger;
import static net.hydromatic.algebra.Matchers.throwsA;
import static net.hydromatic.algebra.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.algebra.ast.Expr;
import net.hydromatic.algebra.compile.Differentiator;
import net.hydromatic.algebra.compile.Simplifier;
import net.hydromatic.algebra.compile.Tracer;
import net.hydromatic.algebra.compile.Tracers;
import net.hydromatic.algebra.eval.UndefinedVariableException;
import org.junit.jupiter.api.Test;

/** Tests the main scenarios, through the {@link Algebra} entry points. */
public class AlgebraTest {
  @Test
  void testParseRenderEval() {
    alg("(x * (2 + 3))")
        .assertParse("Mul(Var('x'), Add(Num(2), Num(3)))")
        .assertParse(isExpr(ast.times("x", ast.plus(2, 3))))
        .assertRender("x * (2 + 3)")
        .assertEval(ImmutableMap.of("x", 4), isInteger(20));
  }

  @Test
  void testSimplifyScenarios() {
    alg("(x + 0)").assertSimplify(isExpr(ast.var("x")));
    alg("(0 * y)").assertSimplify(isExpr(ast.num(0)));
    alg("(x ** 0)").assertSimplify(isExpr(ast.num(1)));
    alg("((x * (3 - 2)) + (4 / 8))").assertSimplify("x + 0.5");
  }

  /** Integers too large for a {@code double} still divide exactly, but do not
   * mix with floating-point values. */
  @Test
  void testHugeIntegers() {
    alg("((10 ** 400) / (10 ** 399))")
        .assertSimplify(isExpr(ast.num(10d)))
        .assertEval(ImmutableMap.of(), isDouble(10d, 0d));
    alg("((10 ** 400) + 0.5)")
        .assertSimplify(isExpr(ast.plus(BigInteger.TEN.pow(400), 0.5)))
        .assertEvalThrows(
            ImmutableMap.of(),
            throwsA(
                ArithmeticException.class,
                is("int too large to convert to float")));
  }

  /** The derivative of x * x, simplified, evaluates like 2 * x. */
  @Test
  void testDerivSquare() {
    alg("(x * x)")
        .assertDeriv("x", isExpr("x * 1 + x * 1"))
        .assertDerivSimplified("x", "x + x");
    final Expr d = Algebra.parse("(x * x)").deriv("x").simplify();
    final Expr twoX = ast.times(2, "x");
    for (int x = -3; x <= 3; x++) {
      final ImmutableMap<String, Integer> env = ImmutableMap.of("x", x);
      assertThat(d.eval(env), is(twoX.eval(env)));
    }
  }

  @Test
  void testEvalUndefinedVariable() {
    alg("(x)")
        .assertParse(isExpr(ast.var("x")))
        .assertEvalThrows(
            ImmutableMap.of(),
            throwsA(
                UndefinedVariableException.class,
                is("undefined variable 'x'")));
  }

  @Test
  void testExpressionIsSynonymForParse() {
    assertThat(
        Algebra.expression("(a / (b - 1))"),
        is(Algebra.parse("(a / (b - 1))")));
  }

  @Test
  void testTokenize() {
    assertThat(
        Algebra.tokenize("(x * (2 + 3))"),
        is(ImmutableList.of("(", "x", "*", "(", "2", "+", "3", ")", ")")));
    // Parentheses split adjacent text; other characters do not.
    assertThat(
        Algebra.tokenize("(x*(2 +3))"),
        is(ImmutableList.of("(", "x*", "(", "2", "+3", ")", ")")));
    assertThat(
        Algebra.tokenize("  (a\t**\n\tb)  "),
        is(ImmutableList.of("(", "a", "**", "b", ")")));
    assertThat(Algebra.tokenize(""), is(ImmutableList.of()));
  }

  /** Tests that a tracer sees parse, rewrite and derive events. */
  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnParse(tracer, (s, e) -> events.add("parse " + s));
    tracer =
        Tracers.withOnRewrite(
            tracer, (before, after) -> events.add(before + " => " + after));
    tracer =
        Tracers.withOnDerive(
            tracer, (e, d) -> events.add("d(" + e + ") = " + d));

    final Expr e = Algebra.parse("((y * 1) + 0)", ImmutableMap.of(), tracer);
    final Expr e2 = Simplifier.simplify(e, tracer);
    assertThat(e2, isExpr(ast.var("y")));
    final Expr d = Differentiator.deriv(e2, "y", tracer);
    assertThat(d, isExpr(ast.num(1)));
    assertThat(events, hasSize(4));
    assertThat(
        events,
        is(
            Arrays.asList(
                "parse ((y * 1) + 0)",
                "y * 1 => y",
                "y + 0 => y",
                "d(y) = 1")));

    // The fixture passes its tracer to the parser
    final List<String> parsed = new ArrayList<>();
    alg("(z / 2)")
        .withTracer(
            Tracers.withOnParse(Tracers.empty(), (s, e3) -> parsed.add(s)))
        .assertRender("z / 2");
    assertThat(parsed, is(Arrays.asList("(z / 2)")));
  }
}

// End AlgebraTest.java
