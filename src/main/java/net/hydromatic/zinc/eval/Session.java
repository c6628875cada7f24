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

import com.google.common.base.Suppliers;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.zinc.compile.Registry;
import net.hydromatic.zinc.compile.Tracer;
import net.hydromatic.zinc.compile.Tracers;
import org.apache.commons.math3.random.MersenneTwister;

/** Context for evaluating builtins.
 *
 * <p>Holds the registry of builtin implementations, property values, the
 * streams that {@code trace} and {@code trace_stdout} write to, a tracer,
 * and the random engine used by the distribution builtins. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  /** Builtin implementations, and the model whose declarations they
   * implement. */
  public final Registry registry;
  /** Primary output, written by {@code trace_stdout}. */
  public PrintWriter out;
  /** Diagnostic output, written by {@code trace}. */
  public PrintWriter err;
  /** Receives evaluation events. */
  public Tracer tracer = Tracers.empty();
  /** Depth of nesting within redundant constraints, as maintained by the
   * flattening pass; read by {@code mzn_in_redundant_constraint}. */
  public int redundantConstraintDepth;

  /** Random engine.
   *
   * <p>Wrapped in a Supplier so that the engine is created only if a
   * distribution builtin is evaluated. */
  private final Supplier<Sampler> sampler;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as is,
   * not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values
   * @param registry Builtin implementations */
  public Session(Map<Prop, Object> map, Registry registry) {
    this.map = requireNonNull(map);
    this.registry = requireNonNull(registry);
    this.out = stdWriter(System.out);
    this.err = stdWriter(System.err);
    this.sampler =
        Suppliers.memoize(() -> {
          final Object seed = Prop.RANDOM_SEED.get(this.map);
          return seed == null
              ? Sampler.instance()
              : new Sampler(new MersenneTwister((Integer) seed));
        });
  }

  private static PrintWriter stdWriter(PrintStream stream) {
    return new PrintWriter(
        new OutputStreamWriter(stream, StandardCharsets.UTF_8), true);
  }

  /** Returns the random engine. */
  public Sampler sampler() {
    return sampler.get();
  }

  /** Creates an evaluator in this session. */
  public Evaluator evaluator() {
    return new Evaluator(this);
  }
}

// End Session.java
