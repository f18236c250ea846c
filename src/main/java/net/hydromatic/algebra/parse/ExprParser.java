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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.algebra.ast.Expr;
import net.hydromatic.algebra.ast.Op;
import net.hydromatic.algebra.ast.Pos;
import net.hydromatic.algebra.compile.Tracer;
import net.hydromatic.algebra.compile.Tracers;
import net.hydromatic.algebra.eval.Prop;

/**
 * Recursive-descent parser for fully-parenthesized expressions.
 *
 * <p>The grammar is
 *
 * <pre>{@code
 * expr ::= number | identifier | "(" expr operator expr ")" | "(" expr ")"
 * operator ::= "+" | "-" | "*" | "/" | "**"
 * }</pre>
 *
 * <p>Every call is parenthesized, so the parser needs no precedence rules.
 * Redundant parentheses around a single expression are allowed.
 *
 * <p>By default the parser is lenient: it does not check that the token
 * closing a call is {@code )}, and it ignores any tokens after the first
 * complete expression. Set {@link Prop#STRICT} to reject such input. Running
 * out of tokens before a call is closed is always an error.
 */
public class ExprParser {
  private final String text;
  private final ImmutableList<Tokenizer.Token> tokens;
  private final boolean strict;
  private final int maxDepth;

  /** Index of the next token to read. */
  private int i;

  private ExprParser(String text, Map<Prop, Object> propMap) {
    this.text = requireNonNull(text);
    this.tokens = Tokenizer.tokenize(text);
    this.strict = Prop.STRICT.booleanValue(propMap);
    this.maxDepth = Prop.MAX_DEPTH.intValue(propMap);
  }

  /** Parses an expression with default properties. */
  public static Expr parse(String text) {
    return parse(text, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Parses an expression.
   *
   * @param text Text of expression
   * @param propMap Properties; see {@link Prop#STRICT}, {@link Prop#MAX_DEPTH}
   * @param tracer Tracer, notified of the parsed expression
   * @return Parsed expression
   * @throws AlgebraParseException if the text is not a valid expression
   */
  public static Expr parse(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    final Expr e = new ExprParser(text, propMap).parse();
    tracer.onParse(text, e);
    return e;
  }

  private Expr parse() {
    if (tokens.isEmpty()) {
      throw new AlgebraParseException("empty expression", endPos());
    }
    final Expr e = parseExpr(0);
    if (strict && i < tokens.size()) {
      final Tokenizer.Token token = tokens.get(i);
      throw new AlgebraParseException(
          format("unexpected '%s' after end of expression", token.image),
          token.pos);
    }
    return e;
  }

  private Expr parseExpr(int depth) {
    final Tokenizer.Token token = next("expression");
    final Number number = Parsers.parseNumber(token.image);
    if (number != null) {
      return ast.num(number);
    }
    switch (token.image) {
      case ")":
        throw new AlgebraParseException("unexpected ')'", token.pos);
      case "(":
        break;
      default:
        return ast.var(token.image);
    }

    if (depth >= maxDepth) {
      throw new AlgebraParseException(
          format("expression nested too deeply (maximum depth %d)", maxDepth),
          token.pos);
    }
    final Expr a0 = parseExpr(depth + 1);
    final Tokenizer.Token opToken = next("operator");
    if (opToken.image.equals(")")) {
      // Redundant parentheses, as in "(x)"
      return a0;
    }
    final Op op = Op.ofSymbol(opToken.image);
    if (op == null) {
      throw new AlgebraParseException(
          format("unknown operator '%s'", opToken.image), opToken.pos);
    }
    final Expr a1 = parseExpr(depth + 1);
    final Tokenizer.Token close = next("')'");
    if (strict && !close.image.equals(")")) {
      throw new AlgebraParseException(
          format("expected ')' but got '%s'", close.image), close.pos);
    }
    return ast.call(op, a0, a1);
  }

  /** Consumes the next token; throws if there are no more. */
  private Tokenizer.Token next(String expected) {
    if (i >= tokens.size()) {
      throw new AlgebraParseException(
          format("expected %s but reached end of input", expected), endPos());
    }
    return tokens.get(i++);
  }

  /** Returns the position just after the last character of the text. */
  private Pos endPos() {
    return Pos.of(text, text.length(), text.length());
  }
}

// End ExprParser.java
