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

import net.hydromatic.algebra.ast.Expr;

/** Called on various events while processing expressions. */
public interface Tracer {
  /** Called when text has been parsed into an expression. */
  void onParse(String text, Expr e);

  /**
   * Called when a simplification rule replaces an expression. {@code before}
   * has simplified operands; rebuilding a call from its simplified operands
   * is not a rewrite.
   */
  void onRewrite(Expr before, Expr after);

  /** Called when an expression has been differentiated. */
  void onDerive(Expr e, String name, Expr derivative);
}

// End Tracer.java
