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

/** Wrong number or kind of arguments reached a builtin at run time.
 *
 * <p>The type checker should have prevented this, so it indicates a defect
 * in the compiler, not in the user's model. Unlike {@link EvalException}, it
 * is never converted into an {@link EvalResult}. */
public class TypeMismatchException extends RuntimeException
    implements ZincException {
  private final Pos pos;

  public TypeMismatchException(String message, Pos pos) {
    super(message);
    this.pos = requireNonNull(pos);
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: dynamic type error: ")
        .append(getMessage());
  }
}

// End TypeMismatchException.java
