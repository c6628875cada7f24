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
package net.hydromatic.zinc.eval;

import static java.util.Objects.requireNonNull;

import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.util.ZincException;

/** Error that occurs while evaluating an expression. */
public class EvalException extends RuntimeException
    implements ZincException {
  private final Pos pos;

  /** Creates an EvalException. */
  public EvalException(String message, Pos pos) {
    super(message);
    this.pos = requireNonNull(pos);
  }

  /** Creates an EvalException with a cause. */
  public EvalException(String message, Pos pos, Throwable cause) {
    super(message, cause);
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return getClass().getSimpleName() + ": " + getMessage() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  /** Returns the kind of error, as it appears in messages; for example
   * "evaluation error". */
  protected String kind() {
    return "evaluation error";
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(kind())
        .append(": ")
        .append(getMessage());
  }
}

// End EvalException.java
