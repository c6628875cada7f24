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
import java.util.List;
import java.util.Objects;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a function: its name, parameter types and return type.
 *
 * <p>Several declarations may share a name, provided that their parameter
 * types differ. */
public class FunctionDecl {
  public final String name;
  public final Type returnType;
  public final ImmutableList<Type> paramTypes;

  public FunctionDecl(String name, Type returnType, List<Type> paramTypes) {
    this.name = requireNonNull(name);
    this.returnType = requireNonNull(returnType);
    this.paramTypes = ImmutableList.copyOf(paramTypes);
  }

  /** Returns whether a call with the given argument types may invoke this
   * function. */
  public boolean accepts(List<Type> argTypes) {
    if (argTypes.size() != paramTypes.size()) {
      return false;
    }
    for (int i = 0; i < argTypes.size(); i++) {
      if (!argTypes.get(i).isSubtypeOf(paramTypes.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether every call that this function accepts is also accepted
   * by {@code decl}. */
  public boolean isAtLeastAsSpecificAs(FunctionDecl decl) {
    return decl.accepts(paramTypes);
  }

  @Override public int hashCode() {
    return Objects.hash(name, paramTypes);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof FunctionDecl
        && name.equals(((FunctionDecl) o).name)
        && paramTypes.equals(((FunctionDecl) o).paramTypes);
  }

  /** Returns the signature, for example
   * "min(array[$] of int): int". */
  @Override public String toString() {
    return signature(name, paramTypes) + ": " + returnType;
  }

  /** Formats a function name and argument types, for example
   * "max(int, int)". */
  public static String signature(String name, List<Type> types) {
    final StringBuilder b = new StringBuilder(name).append('(');
    for (int i = 0; i < types.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(types.get(i));
    }
    return b.append(')').toString();
  }
}

// End FunctionDecl.java
