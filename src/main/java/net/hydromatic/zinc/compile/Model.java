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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Symbol table of a model: the functions it declares (including those of
 * the standard library) and its variable declarations.
 *
 * <p>A model is immutable once built. */
public class Model {
  private final ImmutableListMultimap<String, FunctionDecl> functions;
  public final ImmutableList<Ast.VarDecl> varDecls;

  private Model(ImmutableListMultimap<String, FunctionDecl> functions,
      ImmutableList<Ast.VarDecl> varDecls) {
    this.functions = functions;
    this.varDecls = varDecls;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a model that declares the standard library and nothing
   * else. */
  public static Model standard() {
    return builder().declareLibrary().build();
  }

  /** Returns the declarations of a given name. */
  public List<FunctionDecl> functions(String name) {
    return functions.get(name);
  }

  /** Returns the declaration with a given name and exactly the given
   * parameter types, or null. */
  public @Nullable FunctionDecl lookupExact(String name, List<Type> params) {
    for (FunctionDecl decl : functions.get(name)) {
      if (decl.paramTypes.equals(params)) {
        return decl;
      }
    }
    return null;
  }

  /**
   * Finds the declaration that a call with given argument types should
   * invoke.
   *
   * <p>Of the declarations that accept the arguments, returns the one that is
   * at least as specific as every other.
   *
   * @throws OverloadException if no declaration accepts the arguments, or if
   * none is the most specific
   */
  public FunctionDecl matchFn(String name, List<Type> argTypes, Pos pos) {
    final List<FunctionDecl> candidates = new ArrayList<>();
    for (FunctionDecl decl : functions.get(name)) {
      if (decl.accepts(argTypes)) {
        candidates.add(decl);
      }
    }
    if (candidates.isEmpty()) {
      throw new OverloadException("no function or predicate with this "
          + "signature found: `" + FunctionDecl.signature(name, argTypes)
          + "'", pos);
    }
    for (FunctionDecl candidate : candidates) {
      if (candidates.stream().allMatch(candidate::isAtLeastAsSpecificAs)) {
        return candidate;
      }
    }
    throw new OverloadException("ambiguous overloading of `"
        + FunctionDecl.signature(name, argTypes) + "'; candidates are "
        + candidates, pos);
  }

  /** Returns the declarations that are annotated as output parameters, in
   * declaration order. */
  public List<Ast.VarDecl> outputDecls() {
    return varDecls.stream().filter(d -> d.output)
        .collect(ImmutableList.toImmutableList());
  }

  /** Builder for {@link Model}. */
  public static class Builder {
    private final ImmutableListMultimap.Builder<String, FunctionDecl>
        functions = ImmutableListMultimap.builder();
    private final ImmutableList.Builder<Ast.VarDecl> varDecls =
        ImmutableList.builder();

    public Builder declare(FunctionDecl decl) {
      functions.put(decl.name, decl);
      return this;
    }

    public Builder declare(String name, Type returnType, Type... params) {
      return declare(new FunctionDecl(name, returnType, Arrays.asList(params)));
    }

    /** Declares every function in the standard library; that is, every
     * {@link BuiltIn} except those provided only by a solver backend. */
    public Builder declareLibrary() {
      for (BuiltIn builtIn : BuiltIn.values()) {
        if (!builtIn.backendOnly) {
          declare(builtIn.decl);
        }
      }
      return this;
    }

    public Builder add(Ast.VarDecl varDecl) {
      varDecls.add(varDecl);
      return this;
    }

    public Model build() {
      return new Model(functions.build(), varDecls.build());
    }
  }
}

// End Model.java
