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

import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.util.AlgebraException;

/**
 * Thrown when differentiating a power whose exponent is not a numeric
 * literal.
 */
public class NotConstantExponentException extends RuntimeException
    implements AlgebraException {
  /** The power expression. */
  public final Ast.InfixCall call;

  public NotConstantExponentException(Ast.InfixCall call) {
    super("cannot differentiate '" + call + "': exponent is not a number");
    this.call = requireNonNull(call);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End NotConstantExponentException.java
