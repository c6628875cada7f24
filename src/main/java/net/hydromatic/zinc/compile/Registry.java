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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.eval.Applicable;
import net.hydromatic.zinc.eval.Codes;
import net.hydromatic.zinc.type.Type;

/** Binds function declarations to their builtin implementations.
 *
 * <p>A registry is populated once, by a {@link Builder}, and is immutable
 * thereafter; it is therefore safe to share between threads once
 * built.
 *
 * <p>Overload resolution is delegated to the model's
 * {@link Model#matchFn}; the registry only stores and looks up the
 * implementation of the declaration that resolution chose. */
public class Registry {
  public final Model model;
  private final ImmutableMap<FunctionDecl, Applicable> map;

  private Registry(Model model, ImmutableMap<FunctionDecl, Applicable> map) {
    this.model = requireNonNull(model);
    this.map = requireNonNull(map);
  }

  /** Creates a builder that registers implementations against the
   * declarations of a given model. */
  public static Builder builder(Model model) {
    return new Builder(model);
  }

  /** Creates a registry that contains every builtin in
   * {@link Codes#BUILT_IN_VALUES}. */
  public static Registry create(Model model) {
    final Builder builder = builder(model);
    Codes.registerAll(builder);
    return builder.build();
  }

  /** Returns the number of registered implementations. */
  public int size() {
    return map.size();
  }

  /** Returns whether a declaration has an implementation. */
  public boolean contains(FunctionDecl decl) {
    return map.containsKey(decl);
  }

  /** Returns the implementation of the overload of {@code name} that best
   * matches the argument types.
   *
   * @throws OverloadException if there is no unique best overload, or if it
   * has no builtin implementation */
  public Applicable resolve(String name, List<Type> argTypes, Pos pos) {
    final FunctionDecl decl = model.matchFn(name, argTypes, pos);
    return lookup(decl, pos);
  }

  /** Returns the implementation of a call, resolving and remembering its
   * declaration if this has not already been done. */
  public Applicable resolve(Ast.Call call) {
    FunctionDecl decl = call.decl;
    if (decl == null) {
      decl = model.matchFn(call.name, call.argTypes(), call.pos);
      call.decl = decl;
    }
    return lookup(decl, call.pos);
  }

  private Applicable lookup(FunctionDecl decl, Pos pos) {
    final Applicable applicable = map.get(decl);
    if (applicable == null) {
      throw new OverloadException("function " + decl
          + " has no builtin implementation", pos);
    }
    return applicable;
  }

  /** Builder for {@link Registry}. */
  public static class Builder {
    private final Model model;
    private final Map<FunctionDecl, Applicable> map = new LinkedHashMap<>();

    Builder(Model model) {
      this.model = requireNonNull(model);
    }

    /** Registers an implementation; throws if the model does not declare a
     * function with this name and these parameter types. */
    public Builder register(String name, List<Type> paramTypes,
        Applicable applicable) {
      return register(name, paramTypes, applicable, false);
    }

    /**
     * Registers an implementation.
     *
     * @param name Function name
     * @param paramTypes Parameter types
     * @param applicable Implementation
     * @param permissive If true, and the model does not declare a matching
     *   function, skip the registration rather than throwing; for functions
     *   that only some solver backends declare
     * @throws RegistrationException if there is no matching declaration and
     *   {@code permissive} is false, or if the function is already registered
     */
    public Builder register(String name, List<Type> paramTypes,
        Applicable applicable, boolean permissive) {
      final FunctionDecl decl =
          model.lookupExact(name, ImmutableList.copyOf(paramTypes));
      if (decl == null) {
        if (permissive) {
          return this;
        }
        throw new RegistrationException("no definition found for builtin "
            + FunctionDecl.signature(name, paramTypes));
      }
      if (map.containsKey(decl)) {
        throw new RegistrationException("duplicate builtin " + decl);
      }
      map.put(decl, requireNonNull(applicable));
      return this;
    }

    public Registry build() {
      return new Registry(model, ImmutableMap.copyOf(map));
    }
  }
}

// End Registry.java
