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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.eval.EvalException;
import net.hydromatic.zinc.eval.ResultUndefinedException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action before each call,
   * then calls the underlying tracer. */
  public static Tracer withOnCall(Tracer tracer,
      Consumer<Ast.Call> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCall(Ast.Call call) {
        consumer.accept(call);
        super.onCall(call);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * call, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      BiConsumer<Ast.Call, Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Ast.Call call, Object result) {
        consumer.accept(call, result);
        super.onResult(call, result);
      }
    };
  }

  public static Tracer withOnUndefined(Tracer tracer,
      Consumer<ResultUndefinedException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onUndefined(Ast.Call call,
          ResultUndefinedException e) {
        consumer.accept(e);
        super.onUndefined(call, e);
      }
    };
  }

  public static Tracer withOnError(Tracer tracer,
      Consumer<EvalException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onError(Ast.Call call, EvalException e) {
        consumer.accept(e);
        super.onError(call, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on each trace message,
   * then calls the underlying tracer. */
  public static Tracer withOnTrace(Tracer tracer,
      BiConsumer<Tracer.Stream, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTrace(Stream stream, String message) {
        consumer.accept(stream, message);
        super.onTrace(stream, message);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onCall(Ast.Call call) {
    }

    @Override public void onResult(Ast.Call call, Object result) {
    }

    @Override public void onUndefined(Ast.Call call,
        ResultUndefinedException e) {
    }

    @Override public void onError(Ast.Call call, EvalException e) {
    }

    @Override public void onTrace(Stream stream, String message) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onCall(Ast.Call call) {
      tracer.onCall(call);
    }

    @Override public void onResult(Ast.Call call, Object result) {
      tracer.onResult(call, result);
    }

    @Override public void onUndefined(Ast.Call call,
        ResultUndefinedException e) {
      tracer.onUndefined(call, e);
    }

    @Override public void onError(Ast.Call call, EvalException e) {
      tracer.onError(call, e);
    }

    @Override public void onTrace(Stream stream, String message) {
      tracer.onTrace(stream, message);
    }
  }
}

// End Tracers.java
