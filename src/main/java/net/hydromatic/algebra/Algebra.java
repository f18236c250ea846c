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

import com.google.common.collect.ImmutableList;
import java.util.Map;
import net.hydromatic.algebra.ast.Expr;
import net.hydromatic.algebra.compile.Tracer;
import net.hydromatic.algebra.compile.Tracers;
import net.hydromatic.algebra.eval.Prop;
import net.hydromatic.algebra.parse.ExprParser;
import net.hydromatic.algebra.parse.Tokenizer;

/**
 * Entry points for symbolic algebra.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Expr e = Algebra.parse("(x * (2 + 3))");
 * e.toString();                       // "x * (2 + 3)"
 * e.eval(ImmutableMap.of("x", 4));    // 20
 * e.deriv("x").simplify().toString(); // "5"
 * }</pre>
 */
public final class Algebra {
  private Algebra() {}

  /**
   * Parses a fully-parenthesized expression.
   *
   * @throws net.hydromatic.algebra.parse.AlgebraParseException if the text is
   *     not a valid expression
   */
  public static Expr parse(String text) {
    return ExprParser.parse(text);
  }

  /** Parses a fully-parenthesized expression with the given properties. */
  public static Expr parse(String text, Map<Prop, Object> propMap) {
    return ExprParser.parse(text, propMap, Tracers.empty());
  }

  /**
   * Parses a fully-parenthesized expression with the given properties,
   * notifying a tracer.
   */
  public static Expr parse(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    return ExprParser.parse(text, propMap, tracer);
  }

  /** Synonym for {@link #parse(String)}. */
  public static Expr expression(String text) {
    return parse(text);
  }

  /** Splits text into the tokens that the parser reads. */
  public static ImmutableList<String> tokenize(String text) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Tokenizer.Token token : Tokenizer.tokenize(text)) {
      b.add(token.image);
    }
    return b.build();
  }
}

// End Algebra.java
