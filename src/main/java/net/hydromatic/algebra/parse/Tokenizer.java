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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.algebra.ast.Pos;

/**
 * Splits text into tokens.
 *
 * <p>Each parenthesis is a token by itself; everything else is split at
 * whitespace (see {@link #isSpace}). So {@code "(x*(2 +3))"} yields the
 * tokens {@code (}, {@code x*}, {@code (}, {@code 2}, {@code +3}, {@code )},
 * {@code )}. There is no quoting, escaping or comment syntax.
 */
public final class Tokenizer {
  private Tokenizer() {}

  /** Converts a string into a list of tokens. */
  public static ImmutableList<Token> tokenize(String text) {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int start = -1;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '(' || c == ')' || isSpace(c)) {
        if (start >= 0) {
          tokens.add(token(text, start, i));
          start = -1;
        }
        if (c == '(' || c == ')') {
          tokens.add(token(text, i, i + 1));
        }
      } else if (start < 0) {
        start = i;
      }
    }
    if (start >= 0) {
      tokens.add(token(text, start, text.length()));
    }
    return tokens.build();
  }

  /**
   * Returns whether a character separates tokens. Besides Java whitespace,
   * this includes the no-break spaces (U+00A0, U+2007, U+202F) and the next
   * line character (U+0085).
   */
  public static boolean isSpace(char c) {
    return Character.isWhitespace(c)
        || Character.isSpaceChar(c)
        || c == '\u0085';
  }

  private static Token token(String text, int start, int end) {
    return new Token(text.substring(start, end), Pos.of(text, start, end - 1));
  }

  /** Token, with its position in the source text. */
  public static final class Token {
    public final String image;
    public final Pos pos;

    Token(String image, Pos pos) {
      this.image = requireNonNull(image);
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return image;
    }
  }
}

// End Tokenizer.java
