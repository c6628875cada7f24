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

import net.hydromatic.zinc.ast.Pos;

/** Raised by the {@code assert} and {@code abort} builtins.
 *
 * <p>The message is the text that the model supplied, prefixed with
 * "Assertion failed: " or "Abort: ", and is shown to the user verbatim. */
public class AssertionFailureException extends EvalException {
  public AssertionFailureException(String message, Pos pos) {
    super(message, pos);
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos().describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }
}

// End AssertionFailureException.java
