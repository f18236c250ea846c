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

import static net.hydromatic.algebra.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.BiConsumer;
import net.hydromatic.algebra.Algebra;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Expr}, {@link AstBuilder} and {@link AstWriter}.
 */
public class AstTest {
  private final Ast.Id a = ast.var("a");
  private final Ast.Id b = ast.var("b");
  private final Ast.Id c = ast.var("c");
  private final Ast.Id x = ast.var("x");

  @Test
  void testRenderPrecedence() {
    final BiConsumer<Expr, String> check =
        (e, s) -> assertThat(e, hasToString(s));
    check.accept(ast.plus(a, ast.times(b, c)), "a + b * c");
    check.accept(ast.times(ast.plus(a, b), c), "(a + b) * c");
    check.accept(ast.times(a, ast.plus(b, c)), "a * (b + c)");
    check.accept(ast.plus(ast.plus(a, b), c), "a + b + c");
    check.accept(ast.plus(a, ast.plus(b, c)), "a + b + c");

    // Subtraction and division wrap their right operand at equal precedence
    check.accept(ast.minus(ast.minus(a, b), c), "a - b - c");
    check.accept(ast.minus(a, ast.minus(b, c)), "a - (b - c)");
    check.accept(ast.minus(a, ast.plus(b, c)), "a - (b + c)");
    check.accept(ast.plus(a, ast.minus(b, c)), "a + b - c");
    check.accept(ast.divide(ast.divide(a, b), c), "a / b / c");
    check.accept(ast.divide(a, ast.divide(b, c)), "a / (b / c)");
    check.accept(ast.divide(a, ast.times(b, c)), "a / (b * c)");
    check.accept(ast.times(a, ast.divide(b, c)), "a * b / c");

    // Power is right-associative
    check.accept(ast.power(x, ast.power(b, c)), "x ** b ** c");
    check.accept(ast.power(ast.power(x, b), c), "(x ** b) ** c");
    check.accept(ast.power(x, ast.plus(b, 1)), "x ** (b + 1)");
    check.accept(ast.times(2, ast.power(x, 2)), "2 * x ** 2");
    check.accept(ast.power(ast.times(2, x), 2), "(2 * x) ** 2");

    check.accept(ast.num(2.5), "2.5");
    check.accept(ast.num(-3), "-3");
    check.accept(ast.minus(x, -4), "x - -4");
  }

  @Test
  void testRenderStyles() {
    final Expr e = ast.times(x, ast.plus(2, 3));
    assertThat(e, hasToString("x * (2 + 3)"));
    assertThat(e.toParenthesizedString(), is("(x * (2 + 3))"));
    assertThat(
        e.toConstructorString(), is("Mul(Var('x'), Add(Num(2), Num(3)))"));
    assertThat(
        ast.power(ast.divide(a, 1.5), ast.minus(b, 0)).toConstructorString(),
        is("Pow(Div(Var('a'), Num(1.5)), Sub(Var('b'), Num(0)))"));
    assertThat(ast.var("x").toParenthesizedString(), is("x"));
    assertThat(
        ast.plus(a, b).unparse(new AstWriter(AstWriter.Style.PARENTHESIZED)),
        is("(a + b)"));
  }

  @Test
  void testCoerce() {
    assertThat(ast.coerce(3), is(ast.num(3)));
    assertThat(ast.coerce(3L), is(ast.num(3)));
    assertThat(ast.coerce((short) 3), is(ast.num(3)));
    assertThat(ast.coerce(2.5f), is(ast.num(2.5)));
    assertThat(ast.coerce(new BigDecimal("0.25")), is(ast.num(0.25)));
    assertThat(
        ((Ast.Literal) ast.coerce(BigInteger.TEN)).value,
        is(BigInteger.TEN));
    assertThat(ast.coerce("x"), is(x));
    assertThat(ast.coerce(x), sameInstance(x));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ast.coerce(true));
    assertThat(
        e.getMessage(), is("cannot convert to expression: java.lang.Boolean"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class, () -> ast.coerce(null));
    assertThat(e2.getMessage(), is("cannot convert to expression: null"));
  }

  /** Tests the operator methods on {@link Expr}, and that the reflected
   * forms put the argument on the left. */
  @Test
  void testOperatorMethods() {
    assertThat(x.plus(1), hasToString("x + 1"));
    assertThat(x.rplus(1), hasToString("1 + x"));
    assertThat(x.minus(1), hasToString("x - 1"));
    assertThat(x.rminus(1), hasToString("1 - x"));
    assertThat(x.times("y"), hasToString("x * y"));
    assertThat(x.rtimes("y"), hasToString("y * x"));
    assertThat(x.divide(2.0), hasToString("x / 2.0"));
    assertThat(x.rdivide(2.0), hasToString("2.0 / x"));
    assertThat(x.power(2), hasToString("x ** 2"));
    assertThat(x.rpower(2), hasToString("2 ** x"));
    assertThat(
        x.power(2).rtimes(3).minus(x.rdivide(1)),
        hasToString("3 * x ** 2 - 1 / x"));
    assertThat(x.rminus(1).op, is(Op.MINUS));
    assertThat(((Ast.InfixCall) x.rminus(1)).a1, is(x));
  }

  @Test
  void testVariableNames() {
    assertThat(ast.var("foo_bar'"), hasToString("foo_bar'"));
    assertThat(ast.var("x-1"), hasToString("x-1"));
    assertThat(AstBuilder.isValidName("+"), is(true));
    assertThat(AstBuilder.isValidName(""), is(false));
    assertThat(AstBuilder.isValidName("a b"), is(false));
    assertThat(AstBuilder.isValidName("f(x)"), is(false));
    assertThat(AstBuilder.isValidName("a\u00A0b"), is(false));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ast.var("a b"));
    assertThat(e.getMessage(), is("invalid variable name 'a b'"));
  }

  @Test
  void testEquals() {
    assertThat(ast.plus("x", 1), is(ast.plus("x", 1)));
    assertThat(
        ast.plus("x", 1).hashCode(), is(ast.plus("x", 1).hashCode()));
    assertThat(ast.plus("x", 1), not(is(ast.plus(1, "x"))));
    assertThat(ast.plus("x", 1), not(is(ast.minus("x", 1))));
    assertThat(ast.var("x"), not(is(ast.var("y"))));

    // An integer literal is not equal to a floating-point literal
    assertThat(ast.num(2), not(is(ast.num(2.0))));
    assertThat(ast.num(2), is(ast.num(BigInteger.valueOf(2))));
    assertThat(ast.num(2).isInteger(), is(true));
    assertThat(ast.num(2.0).isInteger(), is(false));
    assertThat(ast.num(Double.NaN), is(ast.num(Double.NaN)));

    // Floating-point zeros are equal whatever their sign
    final Expr negZero = ast.minus("x", -0.0);
    final Expr zero = ast.minus("x", 0.0);
    assertThat(negZero, is(zero));
    assertThat(negZero.hashCode(), is(zero.hashCode()));
    assertThat(
        Algebra.parse("(x - -0.0)"), is(Algebra.parse("(x - 0.0)")));
    assertThat(ast.num(-0.0), not(is(ast.num(0))));
  }

  @Test
  void testCopy() {
    final Ast.InfixCall call = ast.times(x, 2);
    assertThat(call.copy(x, ast.num(2)), sameInstance(call));
    final Ast.InfixCall call2 = call.copy(x, ast.num(3));
    assertThat(call2, hasToString("x * 3"));
    assertThat(call2.op, is(Op.TIMES));
  }

  @Test
  void testLiteralType() {
    assertThrows(IllegalArgumentException.class, () -> new Ast.Literal(5));
    assertThrows(
        IllegalArgumentException.class,
        () -> new Ast.InfixCall(Op.NUMBER, a, b));
  }

  @Test
  void testOp() {
    assertThat(Op.ofSymbol("**"), is(Op.POWER));
    assertThat(Op.ofSymbol("+"), is(Op.PLUS));
    assertThat(Op.ofSymbol("^"), nullValue());
    assertThat(Op.ofSymbol("("), nullValue());
    assertThat(Op.NUMBER.isLeaf(), is(true));
    assertThat(Op.DIVIDE.isLeaf(), is(false));
    assertThat(Op.BY_SYMBOL.size(), is(5));
  }

  /** Unit tests for {@link Pos}. */
  @Test
  void testPos() {
    final String s = "(a\n  + bc)";
    assertThat(Pos.of(s, 0, 0), hasToString("1.1"));
    assertThat(Pos.of(s, 1, 1), hasToString("1.2"));
    assertThat(Pos.of(s, 5, 5), hasToString("2.3"));
    assertThat(Pos.of(s, 7, 8), hasToString("2.5-2.6"));
    assertThat(Pos.of(s, 1, 5), hasToString("1.2-2.3"));
    assertThat(Pos.of(s, 7, 8), is(new Pos(2, 5, 2, 6)));
    assertThrows(IllegalArgumentException.class, () -> Pos.of(s, 3, 2));
  }
}

// End AstTest.java
