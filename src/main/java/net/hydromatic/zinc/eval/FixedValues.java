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

import static net.hydromatic.zinc.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Determines whether expressions are fixed, and if so, their values.
 *
 * <p>An expression is fixed if its value is known even though its type
 * allows it to vary. A fixed-parameter expression is always fixed. An
 * identifier is fixed if its declared domain is a single value, or if its
 * definition is fixed; the resolver follows chains of identifiers, using a
 * declaration's flattened binding if it has no initializer.
 */
public abstract class FixedValues {
  private FixedValues() {}

  /** Returns the value of an expression as a literal, or null if it is not
   * fixed. */
  public static Ast.@Nullable Exp resolve(Evaluator ev, Ast.Exp e) {
    if (e.type.isArray()) {
      return isFixedArray(ev, e) ? fixArray(ev, e) : null;
    }
    final Ast.Exp e2 = ev.evalPar(e);
    if (e2.isLiteral()) {
      return e2;
    }
    switch (e2.op) {
      case ID:
        final Ast.Id id = (Ast.Id) e2;
        final Ast.VarDecl decl = id.decl;
        ev.chase.enter(decl, id.pos);
        try {
          final Ast.Exp domain = fixedDomain(ev, decl);
          if (domain != null) {
            return domain;
          }
          final Ast.Exp def = Evaluator.definition(decl);
          return def == null ? null : resolve(ev, def);
        } finally {
          ev.chase.exit(decl);
        }

      case ARRAY_ACCESS:
        final Ast.ArrayAccess access = (Ast.ArrayAccess) e2;
        final ImmutableList.Builder<Ast.Exp> indices = ImmutableList.builder();
        for (Ast.Exp index : access.indices) {
          final Ast.Exp i = resolve(ev, index);
          if (i == null) {
            return null;
          }
          indices.add(i);
        }
        final Ast.ArrayAccess fixedAccess =
            ast.arrayAccess(access.pos, access.array, indices.build());
        return resolve(ev, ev.evalArrayAccess(fixedAccess));

      case ITE:
        final Ast.If if_ = (Ast.If) e2;
        final Ast.Exp condition = resolve(ev, if_.condition);
        if (condition == null) {
          return null;
        }
        return resolve(ev,
            ((Ast.BoolLiteral) condition).value ? if_.ifTrue : if_.ifFalse);

      default:
        return null;
    }
  }

  /** Returns the single value of a declaration's domain, or null if the
   * domain has more than one value. */
  private static Ast.@Nullable Exp fixedDomain(Evaluator ev,
      Ast.VarDecl decl) {
    final Ast.Exp domain = decl.ti.domain;
    if (domain == null || decl.type.set) {
      return null;
    }
    switch (domain.op) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case BOOL_LITERAL:
        return domain;
      default:
        break;
    }
    if (!domain.type.isPar()) {
      return null;
    }
    if (decl.type.base == PrimitiveType.INT) {
      final IntSetVal d = ev.evalIntSet(domain);
      return d.size() == 1 && d.min().equals(d.max())
          ? ast.intLiteral(domain.pos, d.min())
          : null;
    }
    if (decl.type.base == PrimitiveType.FLOAT) {
      final FloatSetVal d = ev.evalFloatSet(domain);
      return d.size() == 1 && d.min() == d.max()
          ? ast.floatLiteral(domain.pos, d.min())
          : null;
    }
    return null;
  }

  /** Returns whether an expression is fixed. An array is fixed if all of
   * its elements are fixed. */
  public static boolean isFixed(Evaluator ev, Ast.Exp e) {
    if (e.type.isArray()) {
      return isFixedArray(ev, e);
    }
    return resolve(ev, e) != null;
  }

  /** Returns whether every element of an array is fixed; true if the array
   * is empty. */
  public static boolean isFixedArray(Evaluator ev, Ast.Exp e) {
    for (Ast.Exp element : ev.evalArray(e).elements) {
      if (resolve(ev, element) == null) {
        return false;
      }
    }
    return true;
  }

  /** Returns the value of a fixed expression.
   *
   * @throws EvalException if the expression is not fixed */
  public static Ast.Exp fix(Evaluator ev, Ast.Exp e) {
    if (e.type.isArray()) {
      return fixArray(ev, e);
    }
    final Ast.Exp r = resolve(ev, e);
    if (r == null) {
      throw new EvalException("expression is not fixed", e.pos);
    }
    return r;
  }

  /** Returns an array with the same index sets as a given array, whose
   * elements are the values of its elements.
   *
   * @throws EvalException at the first element, from left to right, that is
   * not fixed */
  public static Ast.ArrayLiteral fixArray(Evaluator ev, Ast.Exp e) {
    final Ast.ArrayLiteral array = ev.evalArray(e);
    final ImmutableList.Builder<Ast.Exp> elements = ImmutableList.builder();
    for (Ast.Exp element : array.elements) {
      final Ast.Exp r = resolve(ev, element);
      if (r == null) {
        throw new EvalException("expression is not fixed", element.pos);
      }
      elements.add(r);
    }
    final List<Ast.Exp> list = elements.build();
    if (list.equals(array.elements) && array.type.isPar()) {
      return array;
    }
    return ast.arrayLiteral(array.pos, array.type.elementType().toPar(),
        list, array.dims);
  }

  /** Returns the value of a fixed optional expression.
   *
   * @throws ResultUndefinedException if the value is absent
   * @throws EvalException if the expression is not fixed */
  public static Ast.Exp deopt(Evaluator ev, Ast.Exp e, Pos pos) {
    final Ast.Exp r = fix(ev, e);
    if (r.op == Op.ABSENT) {
      throw new ResultUndefinedException(
          "cannot evaluate deopt on absent value", pos);
    }
    return r;
  }

  /** Returns whether an optional expression has a value; that is, whether it
   * does not evaluate to absent. An expression that is not fixed might
   * occur, and returns true. */
  public static boolean occurs(Evaluator ev, Ast.Exp e) {
    final Ast.Exp r = resolve(ev, e);
    return r == null || r.op != Op.ABSENT;
  }
}

// End FixedValues.java
