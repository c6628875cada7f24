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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Pos;

/** Tracks the declarations on the current path while following identifiers
 * to their definitions.
 *
 * <p>A declaration that is entered twice on one path is part of a cycle,
 * and the chase fails rather than looping. A path longer than
 * {@link Prop#CHASE_LIMIT} also fails.
 *
 * <p>Use in a try-finally block:
 *
 * <blockquote><pre>
 * chase.enter(decl, pos);
 * try {
 *   ...
 * } finally {
 *   chase.exit(decl);
 * }
 * </pre></blockquote> */
final class Chase {
  private final Set<Ast.VarDecl> path =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private final int limit;

  Chase(int limit) {
    this.limit = limit;
  }

  void enter(Ast.VarDecl decl, Pos pos) {
    if (path.contains(decl)) {
      throw new EvalException("cyclic definition of " + decl.name, pos);
    }
    if (path.size() >= limit) {
      throw new EvalException("definition of " + decl.name
          + " is nested more than " + limit + " deep", pos);
    }
    path.add(decl);
  }

  void exit(Ast.VarDecl decl) {
    path.remove(decl);
  }
}

// End Chase.java
