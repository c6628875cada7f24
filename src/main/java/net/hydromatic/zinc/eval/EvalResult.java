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

import java.util.Locale;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of evaluating a builtin call: a value, an undefined result, or an
 * error.
 *
 * <p>The modeling language has three-valued logic, so an undefined result is
 * not necessarily a failure; the caller decides, per call site, whether to
 * absorb it (say, by making the enclosing constraint false) or to report it.
 * Use {@link #fold} to handle each case.
 *
 * @see Evaluator#evaluate */
public final class EvalResult {
  public final Kind kind;
  private final @Nullable Object value;
  private final @Nullable EvalException exception;

  private EvalResult(Kind kind, @Nullable Object value,
      @Nullable EvalException exception) {
    this.kind = kind;
    this.value = value;
    this.exception = exception;
  }

  /** Creates a result that holds a value. */
  public static EvalResult value(Object value) {
    return new EvalResult(Kind.VALUE, requireNonNull(value), null);
  }

  /** Creates an undefined result. */
  public static EvalResult undefined(ResultUndefinedException e) {
    return new EvalResult(Kind.UNDEFINED, null, requireNonNull(e));
  }

  /** Creates a failed result. */
  public static EvalResult error(EvalException e) {
    return new EvalResult(Kind.ERROR, null, requireNonNull(e));
  }

  /** Applies the function that corresponds to the kind of this result. */
  public <R> R fold(Function<Object, R> onValue,
      Function<ResultUndefinedException, R> onUndefined,
      Function<EvalException, R> onError) {
    switch (kind) {
      case VALUE:
        return onValue.apply(requireNonNull(value));
      case UNDEFINED:
        return onUndefined.apply(
            (ResultUndefinedException) requireNonNull(exception));
      default:
        return onError.apply(requireNonNull(exception));
    }
  }

  /** Returns the value; throws the exception if this result is undefined or
   * an error. */
  public Object valueOrThrow() {
    if (exception != null) {
      throw exception;
    }
    return requireNonNull(value);
  }

  @Override public String toString() {
    return kind == Kind.VALUE
        ? "value " + value
        : kind.name().toLowerCase(Locale.ROOT) + " "
            + requireNonNull(exception).getMessage();
  }

  /** Kind of result. */
  public enum Kind {
    VALUE, UNDEFINED, ERROR
  }
}

// End EvalResult.java
