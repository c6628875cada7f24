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
package net.hydromatic.zinc.compile;

import net.hydromatic.zinc.ast.Pos;

/** The table of builtin implementations is inconsistent with the declared
 * functions; for example, an implementation was registered for a function
 * that has no declaration.
 *
 * <p>This is an internal error in the compiler, and must halt compilation
 * before any model is evaluated. */
public class RegistrationException extends CompileException {
  public RegistrationException(String message) {
    super(message, Pos.ZERO);
  }
}

// End RegistrationException.java
