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

/** Signals that an expression is well-typed but its value is undefined;
 * for example, the minimum of an empty array.
 *
 * <p>Undefinedness is part of the semantics of the modeling language: in a
 * boolean context the enclosing constraint becomes false. Therefore callers
 * must be able to tell this apart from other evaluation errors. */
public class ResultUndefinedException extends EvalException {
  public ResultUndefinedException(String message, Pos pos) {
    super(message, pos);
  }

  @Override protected String kind() {
    return "result of evaluation is undefined";
  }
}

// End ResultUndefinedException.java
