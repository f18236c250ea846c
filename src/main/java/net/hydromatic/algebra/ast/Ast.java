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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.util.Objects;

/** Various sub-classes of expression nodes. */
public class Ast {
  private Ast() {}

  /**
   * Numeric literal.
   *
   * <p>The value is either a {@link BigInteger} or a {@link Double}. Two
   * literals are equal only if their values have the same representation, so
   * {@code 2} does not equal {@code 2.0}. Floating-point values compare by
   * value, except that {@code NaN} equals itself; {@code -0.0} equals
   * {@code 0.0}.
   */
  public static class Literal extends Expr {
    public final Number value;

    Literal(Number value) {
      super(Op.NUMBER);
      this.value = requireNonNull(value);
      checkArgument(
          value instanceof BigInteger || value instanceof Double,
          "literal must be BigInteger or Double: %s",
          value.getClass());
    }

    /** Returns whether the value is integer-valued. */
    public boolean isInteger() {
      return value instanceof BigInteger;
    }

    @Override
    public int hashCode() {
      if (value instanceof Double && (Double) value == 0d) {
        return Double.hashCode(0d);
      }
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && valueEquals(((Literal) o).value);
    }

    private boolean valueEquals(Number v) {
      if (value instanceof Double && v instanceof Double) {
        final double d0 = (Double) value;
        final double d1 = (Double) v;
        return d0 == d1 || Double.isNaN(d0) && Double.isNaN(d1);
      }
      return value.equals(v);
    }

    @Override
    AstWriter unparseTo(AstWriter w) {
      return w.appendLiteral(value);
    }
  }

  /** Variable reference. */
  public static class Id extends Expr {
    public final String name;

    Id(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    AstWriter unparseTo(AstWriter w) {
      return w.id(name);
    }
  }

  /**
   * Call to a binary operator; the {@link #op} is one of {@link Op#PLUS},
   * {@link Op#MINUS}, {@link Op#TIMES}, {@link Op#DIVIDE}, {@link Op#POWER}.
   */
  public static class InfixCall extends Expr {
    public final Expr a0;
    public final Expr a1;

    InfixCall(Op op, Expr a0, Expr a1) {
      super(op);
      checkArgument(!op.isLeaf(), "not a binary operator: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && this.op == ((InfixCall) o).op
              && this.a0.equals(((InfixCall) o).a0)
              && this.a1.equals(((InfixCall) o).a1);
    }

    @Override
    AstWriter unparseTo(AstWriter w) {
      return w.infix(a0, op, a1);
    }

    /**
     * Creates a copy of this {@code InfixCall} with given contents and same
     * operator, or {@code this} if the contents are the same.
     */
    public InfixCall copy(Expr a0, Expr a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : new InfixCall(op, a0, a1);
    }
  }
}

// End Ast.java
