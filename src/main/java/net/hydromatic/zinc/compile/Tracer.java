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

import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.eval.EvalException;
import net.hydromatic.zinc.eval.ResultUndefinedException;

/** Called on various events during evaluation of builtins. */
public interface Tracer {
  /** Called before a builtin call is evaluated. */
  void onCall(Ast.Call call);

  /** Called with the value of a builtin call. */
  void onResult(Ast.Call call, Object result);

  /** Called when the value of a builtin call is undefined. */
  void onUndefined(Ast.Call call, ResultUndefinedException e);

  /** Called when evaluation of a builtin call fails. */
  void onError(Ast.Call call, EvalException e);

  /** Called when the model writes a message with {@code trace} or
   * {@code trace_stdout}. */
  void onTrace(Stream stream, String message);

  /** Stream that a trace message is written to. */
  enum Stream {
    /** Diagnostic stream, written by {@code trace}. */
    ERR,
    /** Primary output stream, written by {@code trace_stdout}. */
    OUT
  }
}

// End Tracer.java
