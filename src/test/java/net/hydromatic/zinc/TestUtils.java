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
package net.hydromatic.zinc;

import static net.hydromatic.zinc.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.compile.Model;
import net.hydromatic.zinc.compile.Registry;
import net.hydromatic.zinc.eval.IntSetVal;
import net.hydromatic.zinc.eval.Session;
import net.hydromatic.zinc.type.Type;

/** Utilities for building expressions and sessions in tests. */
public abstract class TestUtils {
  private TestUtils() {}

  /** Position of every expression built by these utilities. */
  public static final Pos POS = Pos.of("/models/test.mzn", 3, 1, 20);

  /** Creates a session over the standard library. */
  public static Session session() {
    return session(Model.standard());
  }

  /** Creates a session over a given model. */
  public static Session session(Model model) {
    return new Session(new LinkedHashMap<>(), Registry.create(model));
  }

  public static Ast.IntLiteral intLit(long value) {
    return ast.intLiteral(POS, value);
  }

  public static Ast.FloatLiteral floatLit(double value) {
    return ast.floatLiteral(POS, value);
  }

  public static Ast.BoolLiteral boolLit(boolean value) {
    return ast.boolLiteral(POS, value);
  }

  public static Ast.StringLiteral stringLit(String value) {
    return ast.stringLiteral(POS, value);
  }

  public static Ast.SetLiteral setLit(long lower, long upper) {
    return ast.setLiteral(POS, IntSetVal.range(lower, upper));
  }

  /** Creates a one-dimensional array literal, indexed from 1. */
  public static Ast.ArrayLiteral array(Ast.Exp... elements) {
    return ast.arrayLiteral(POS, Arrays.asList(elements));
  }

  /** Creates a one-dimensional array of integer literals. */
  public static Ast.ArrayLiteral intArray(long... values) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (long value : values) {
      list.add(intLit(value));
    }
    return ast.arrayLiteral(POS, list);
  }

  /** Creates a one-dimensional array of float literals. */
  public static Ast.ArrayLiteral floatArray(double... values) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (double value : values) {
      list.add(floatLit(value));
    }
    return ast.arrayLiteral(POS, list);
  }

  /** Creates a 2x2 integer array, {@code [|a, b|c, d|]}. */
  public static Ast.ArrayLiteral intArray2d(long a, long b, long c, long d) {
    return ast.arrayLiteral2d(POS,
        ImmutableList.of(ImmutableList.of(intLit(a), intLit(b)),
            ImmutableList.of(intLit(c), intLit(d))));
  }

  /** Declares an integer decision variable with domain
   * {@code lower..upper}, and returns a reference to it. */
  public static Ast.Id varInt(String name, long lower, long upper) {
    final Ast.TypeInst ti =
        ast.typeInst(POS, Type.VAR_INT, setLit(lower, upper));
    return ast.id(POS, ast.varDecl(POS, ti, name, null));
  }

  /** Declares an integer decision variable with no domain. */
  public static Ast.Id varInt(String name) {
    final Ast.TypeInst ti = ast.typeInst(POS, Type.VAR_INT, null);
    return ast.id(POS, ast.varDecl(POS, ti, name, null));
  }

  /** Declares a parameter with an initializer, and returns a reference
   * to it. */
  public static Ast.Id par(String name, Ast.Exp e) {
    final Ast.TypeInst ti = e.type.isArray()
        ? ast.arrayTypeInst(POS, e.type.elementType(), null,
            nulls(e.type.dim))
        : ast.typeInst(POS, e.type, null);
    return ast.id(POS, ast.varDecl(POS, ti, name, e));
  }

  private static List<Ast.Exp> nulls(int n) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      list.add(null);
    }
    return list;
  }

  /** Creates a call to a function. */
  public static Ast.Call call(Type type, String name, Ast.Exp... args) {
    return ast.call(POS, type, name, args);
  }
}

// End TestUtils.java
