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

import net.hydromatic.zinc.ast.Ast;

/**
 * Implementation of a builtin function.
 *
 * <p>An implementation receives the evaluator and the call, and decides for
 * itself which arguments to evaluate, and how: some builtins need every
 * argument to be a constant, others (such as {@code lb} and {@code dom})
 * inspect unevaluated expressions.
 *
 * <p>There is one sub-interface per shape of result, and {@link #kind()}
 * says which. Implement the sub-interface, not this interface; for
 * example,
 *
 * <blockquote><pre>
 * Applicable.IntImpl impl = (ev, call) -&gt; ev.evalInt(call.arg(0)).abs();
 * </pre></blockquote>
 *
 * @see Codes#BUILT_IN_VALUES
 */
public interface Applicable {
  /** Returns the shape of the result. */
  Kind kind();

  /** Applies this builtin to a call, returning an {@link IntVal},
   * {@link Double}, {@link Boolean}, {@link String}, {@link IntSetVal},
   * {@link Ast.Exp} or {@link Unit}, according to {@link #kind()}. */
  Object apply(Evaluator evaluator, Ast.Call call);

  /** Shape of the result of an {@link Applicable}. */
  enum Kind {
    INT(IntVal.class),
    FLOAT(Double.class),
    BOOL(Boolean.class),
    STRING(String.class),
    INT_SET(IntSetVal.class),
    EXP(Ast.Exp.class),
    UNIT(Unit.class);

    /** Class of the values that a builtin of this kind returns. */
    public final Class<?> valueClass;

    Kind(Class<?> valueClass) {
      this.valueClass = valueClass;
    }
  }

  /** Builtin that returns an integer. */
  @FunctionalInterface
  interface IntImpl extends Applicable {
    IntVal applyInt(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.INT;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyInt(evaluator, call);
    }
  }

  /** Builtin that returns a float. */
  @FunctionalInterface
  interface FloatImpl extends Applicable {
    double applyFloat(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.FLOAT;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyFloat(evaluator, call);
    }
  }

  /** Builtin that returns a boolean. */
  @FunctionalInterface
  interface BoolImpl extends Applicable {
    boolean applyBool(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.BOOL;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyBool(evaluator, call);
    }
  }

  /** Builtin that returns a string. */
  @FunctionalInterface
  interface StringImpl extends Applicable {
    String applyString(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.STRING;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyString(evaluator, call);
    }
  }

  /** Builtin that returns a set of integers. */
  @FunctionalInterface
  interface IntSetImpl extends Applicable {
    IntSetVal applyIntSet(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.INT_SET;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyIntSet(evaluator, call);
    }
  }

  /** Builtin that returns an expression; for example, an array, or a
   * value of a type that is not known until the call is evaluated. */
  @FunctionalInterface
  interface ExpImpl extends Applicable {
    Ast.Exp applyExp(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.EXP;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      return applyExp(evaluator, call);
    }
  }

  /** Builtin that is evaluated only for its side effect. */
  @FunctionalInterface
  interface UnitImpl extends Applicable {
    void applyUnit(Evaluator evaluator, Ast.Call call);

    @Override default Kind kind() {
      return Kind.UNIT;
    }

    @Override default Object apply(Evaluator evaluator, Ast.Call call) {
      applyUnit(evaluator, call);
      return Unit.INSTANCE;
    }
  }
}

// End Applicable.java
