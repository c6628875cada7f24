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

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.Function;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes bounds of expressions by interval arithmetic.
 *
 * <p>A fixed expression has point bounds. An identifier has the bounds of
 * its declared domain, if it has one, otherwise those of its definition.
 * Operators combine the bounds of their operands. If bounds cannot be
 * computed, the result is invalid, which means "unbounded".
 *
 * <p>The bounds are sound but not necessarily tight. In particular, the
 * bounds of integer division are computed from the quotients at the corners
 * of the operands' intervals (see {@link #divBounds}).
 */
public abstract class BoundsComputer {
  private BoundsComputer() {}

  private static final Bounds<IntVal> BOOL_BOUNDS =
      Bounds.of(IntVal.ZERO, IntVal.ONE);

  /** Computes the bounds of an integer expression. */
  public static Bounds<IntVal> intBounds(Evaluator ev, Ast.Exp e) {
    try {
      return intBounds_(ev, e);
    } catch (ArithmeticException ex) {
      return Bounds.invalidInt();
    }
  }

  private static Bounds<IntVal> intBounds_(Evaluator ev, Ast.Exp e) {
    if (e.type.base == PrimitiveType.BOOL && !e.type.isArray()) {
      return e.type.isPar()
          ? Bounds.point(ev.evalBool(e) ? IntVal.ONE : IntVal.ZERO)
          : boolBounds(ev, e);
    }
    if (e.type.isPar()) {
      return Bounds.point(ev.evalInt(e));
    }
    switch (e.op) {
      case ID:
        final Ast.Id id = (Ast.Id) e;
        final Ast.Exp domain = id.decl.ti.domain;
        if (domain != null) {
          final IntSetVal d = ev.evalIntSet(domain);
          if (!d.isEmpty()) {
            return Bounds.of(d.min(), d.max());
          }
        }
        return viaDefinition(ev, id, Bounds.invalidInt(),
            def -> intBounds_(ev, def));

      case ARRAY_ACCESS:
        final Ast.ArrayAccess access = (Ast.ArrayAccess) e;
        if (access.indices.stream().allMatch(i -> i.type.isPar())) {
          return intBounds_(ev, ev.evalArrayAccess(access));
        }
        final Ast.@Nullable ArrayLiteral array = arrayOrNull(ev, access.array);
        if (array == null || array.size() == 0) {
          return Bounds.invalidInt();
        }
        Bounds<IntVal> hull = intBounds_(ev, array.get(0));
        for (Ast.Exp element : array.elements) {
          hull = hull.hull(intBounds_(ev, element));
        }
        return hull.valid ? hull : Bounds.invalidInt();

      case ITE:
        final Ast.If if_ = (Ast.If) e;
        if (if_.condition.type.isPar()) {
          return intBounds_(ev,
              ev.evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
        }
        final Bounds<IntVal> b =
            intBounds_(ev, if_.ifTrue).hull(intBounds_(ev, if_.ifFalse));
        return b.valid ? b : Bounds.invalidInt();

      case NEGATE:
        final Bounds<IntVal> n = intBounds_(ev, ((Ast.UnOp) e).a);
        return n.valid
            ? Bounds.of(n.upper.negate(), n.lower.negate())
            : n;

      case POSITIVE:
        return intBounds_(ev, ((Ast.UnOp) e).a);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIV:
      case MOD:
        final Ast.BinOp binOp = (Ast.BinOp) e;
        final Bounds<IntVal> b0 = intBounds_(ev, binOp.a0);
        final Bounds<IntVal> b1 = intBounds_(ev, binOp.a1);
        if (!b0.valid || !b1.valid) {
          return Bounds.invalidInt();
        }
        return arithmetic(e, b0, b1);

      case CALL:
        return callBounds(ev, (Ast.Call) e);

      default:
        return Bounds.invalidInt();
    }
  }

  private static Bounds<IntVal> boolBounds(Evaluator ev, Ast.Exp e) {
    if (e.op == Op.ID) {
      final Ast.Exp def = Evaluator.definition(((Ast.Id) e).decl);
      if (def != null && def.type.isPar()) {
        return viaDefinition(ev, (Ast.Id) e, BOOL_BOUNDS,
            d -> intBounds_(ev, d));
      }
    }
    return BOOL_BOUNDS;
  }

  private static Bounds<IntVal> arithmetic(Ast.Exp e, Bounds<IntVal> b0,
      Bounds<IntVal> b1) {
    switch (e.op) {
      case PLUS:
        return Bounds.of(b0.lower.plus(b1.lower), b0.upper.plus(b1.upper));
      case MINUS:
        return Bounds.of(b0.lower.minus(b1.upper), b0.upper.minus(b1.lower));
      case TIMES:
        final IntVal c0 = times(b0.lower, b1.lower);
        final IntVal c1 = times(b0.lower, b1.upper);
        final IntVal c2 = times(b0.upper, b1.lower);
        final IntVal c3 = times(b0.upper, b1.upper);
        return Bounds.of(IntVal.min(IntVal.min(c0, c1), IntVal.min(c2, c3)),
            IntVal.max(IntVal.max(c0, c1), IntVal.max(c2, c3)));
      case DIV:
        if (b1.lower.signum() == 0 && b1.upper.signum() == 0) {
          return Bounds.invalidInt();
        }
        return divBounds(b0, b1, e.pos);
      default:
        // The remainder has the sign of the dividend, and is smaller in
        // magnitude than both the dividend and the divisor.
        final IntVal m =
            IntVal.max(b1.lower.abs(), b1.upper.abs()).minus(IntVal.ONE);
        final IntVal lower = b0.lower.signum() < 0
            ? IntVal.max(m.negate(), b0.lower)
            : IntVal.ZERO;
        final IntVal upper = b0.upper.signum() > 0
            ? IntVal.min(m, b0.upper)
            : IntVal.ZERO;
        return Bounds.of(lower, upper);
    }
  }

  /** Multiplies, treating zero times infinity as zero. */
  private static IntVal times(IntVal v0, IntVal v1) {
    return v0.signum() == 0 || v1.signum() == 0 ? IntVal.ZERO : v0.times(v1);
  }

  private static Bounds<IntVal> callBounds(Evaluator ev, Ast.Call call) {
    switch (call.name) {
      case "abs":
        final Bounds<IntVal> b = intBounds_(ev, call.arg(0));
        if (!b.valid) {
          return b;
        }
        if (b.lower.signum() >= 0) {
          return b;
        }
        if (b.upper.signum() <= 0) {
          return Bounds.of(b.upper.negate(), b.lower.negate());
        }
        return Bounds.of(IntVal.ZERO,
            IntVal.max(b.lower.negate(), b.upper));

      case "bool2int":
        return intBounds_(ev, call.arg(0));

      case "min":
      case "max":
        final List<Bounds<IntVal>> list = argBounds(ev, call);
        if (list.isEmpty()) {
          return Bounds.invalidInt();
        }
        IntVal lower = list.get(0).lower;
        IntVal upper = list.get(0).upper;
        for (Bounds<IntVal> bounds : list) {
          if (!bounds.valid) {
            return Bounds.invalidInt();
          }
          if (call.name.equals("min")) {
            lower = IntVal.min(lower, bounds.lower);
            upper = IntVal.min(upper, bounds.upper);
          } else {
            lower = IntVal.max(lower, bounds.lower);
            upper = IntVal.max(upper, bounds.upper);
          }
        }
        return Bounds.of(lower, upper);

      case "sum":
        if (call.args.size() != 1 || !call.arg(0).type.isArray()) {
          return Bounds.invalidInt();
        }
        IntVal sumLower = IntVal.ZERO;
        IntVal sumUpper = IntVal.ZERO;
        for (Bounds<IntVal> bounds : argBounds(ev, call)) {
          if (!bounds.valid) {
            return Bounds.invalidInt();
          }
          sumLower = sumLower.plus(bounds.lower);
          sumUpper = sumUpper.plus(bounds.upper);
        }
        return Bounds.of(sumLower, sumUpper);

      default:
        return Bounds.invalidInt();
    }
  }

  /** Returns the bounds of the arguments of a call; if the call has a
   * single array argument, the bounds of its elements. An argument that is
   * a set, or an array that cannot be evaluated, yields an empty list. */
  private static List<Bounds<IntVal>> argBounds(Evaluator ev,
      Ast.Call call) {
    final List<Bounds<IntVal>> list = new ArrayList<>();
    if (call.args.size() == 1) {
      final Ast.Exp arg = call.arg(0);
      if (!arg.type.isArray()) {
        return list;
      }
      final Ast.@Nullable ArrayLiteral array = arrayOrNull(ev, arg);
      if (array != null) {
        for (Ast.Exp element : array.elements) {
          list.add(intBounds_(ev, element));
        }
      }
      return list;
    }
    for (Ast.Exp arg : call.args) {
      list.add(intBounds_(ev, arg));
    }
    return list;
  }

  /** Evaluates an array, or returns null if it is an identifier that has
   * no definition. */
  private static Ast.@Nullable ArrayLiteral arrayOrNull(Evaluator ev,
      Ast.Exp e) {
    if (e.op == Op.ID && Evaluator.definition(((Ast.Id) e).decl) == null) {
      return null;
    }
    return ev.evalArray(e);
  }

  private static <T> T viaDefinition(Evaluator ev, Ast.Id id, T orElse,
      Function<Ast.Exp, T> f) {
    final Ast.Exp def = Evaluator.definition(id.decl);
    if (def == null) {
      return orElse;
    }
    ev.chase.enter(id.decl, id.pos);
    try {
      return f.apply(def);
    } finally {
      ev.chase.exit(id.decl);
    }
  }

  /**
   * Computes the bounds of the integer quotient {@code x div y}.
   *
   * <p>If either interval is unbounded, so is the result. Otherwise the
   * divisor's interval is split into its negative and positive parts (zero
   * is excluded), and the result spans the quotients at the four corners of
   * each part. The result is sound, but not always tight.
   *
   * @throws EvalException if either bounds is invalid
   * @throws ResultUndefinedException if the divisor can only be zero
   */
  public static Bounds<IntVal> divBounds(Bounds<IntVal> x, Bounds<IntVal> y,
      Pos pos) {
    if (!x.valid || !y.valid) {
      throw new EvalException("cannot determine bounds", pos);
    }
    if (!x.lower.isFinite() || !x.upper.isFinite()
        || !y.lower.isFinite() || !y.upper.isFinite()) {
      return Bounds.of(IntVal.MINUS_INFINITY, IntVal.INFINITY);
    }
    final List<Bounds<IntVal>> divisors = new ArrayList<>();
    if (y.lower.signum() < 0) {
      divisors.add(
          Bounds.of(y.lower, IntVal.min(y.upper, IntVal.of(-1))));
    }
    if (y.upper.signum() > 0) {
      divisors.add(Bounds.of(IntVal.max(y.lower, IntVal.ONE), y.upper));
    }
    if (divisors.isEmpty()) {
      throw new ResultUndefinedException("division by zero", pos);
    }
    IntVal lower = IntVal.INFINITY;
    IntVal upper = IntVal.MINUS_INFINITY;
    for (Bounds<IntVal> d : divisors) {
      for (IntVal dividend : new IntVal[] {x.lower, x.upper}) {
        for (IntVal divisor : new IntVal[] {d.lower, d.upper}) {
          final IntVal q = dividend.div(divisor);
          lower = IntVal.min(lower, q);
          upper = IntVal.max(upper, q);
        }
      }
    }
    return Bounds.of(lower, upper);
  }

  /** Computes the bounds of a float expression. */
  public static Bounds<Double> floatBounds(Evaluator ev, Ast.Exp e) {
    if (e.type.isInt() || e.type.base == PrimitiveType.BOOL) {
      final Bounds<IntVal> b = intBounds(ev, e);
      return b.valid
          ? Bounds.of(b.lower.toDouble(), b.upper.toDouble())
          : Bounds.invalidFloat();
    }
    if (e.type.isPar()) {
      return Bounds.point(ev.evalFloat(e));
    }
    switch (e.op) {
      case ID:
        final Ast.Id id = (Ast.Id) e;
        final Ast.Exp domain = id.decl.ti.domain;
        if (domain != null) {
          final FloatSetVal d = ev.evalFloatSet(domain);
          if (!d.isEmpty()) {
            return Bounds.of(d.min(), d.max());
          }
        }
        return viaDefinition(ev, id, Bounds.invalidFloat(),
            def -> floatBounds(ev, def));

      case ARRAY_ACCESS:
        final Ast.ArrayAccess access = (Ast.ArrayAccess) e;
        if (access.indices.stream().allMatch(i -> i.type.isPar())) {
          return floatBounds(ev, ev.evalArrayAccess(access));
        }
        final Ast.@Nullable ArrayLiteral array = arrayOrNull(ev, access.array);
        if (array == null || array.size() == 0) {
          return Bounds.invalidFloat();
        }
        Bounds<Double> hull = floatBounds(ev, array.get(0));
        for (Ast.Exp element : array.elements) {
          hull = hull.hull(floatBounds(ev, element));
        }
        return hull.valid ? hull : Bounds.invalidFloat();

      case ITE:
        final Ast.If if_ = (Ast.If) e;
        if (if_.condition.type.isPar()) {
          return floatBounds(ev,
              ev.evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
        }
        final Bounds<Double> b =
            floatBounds(ev, if_.ifTrue).hull(floatBounds(ev, if_.ifFalse));
        return b.valid ? b : Bounds.invalidFloat();

      case NEGATE:
        final Bounds<Double> n = floatBounds(ev, ((Ast.UnOp) e).a);
        return n.valid ? Bounds.of(-n.upper, -n.lower) : n;

      case POSITIVE:
        return floatBounds(ev, ((Ast.UnOp) e).a);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
        final Ast.BinOp binOp = (Ast.BinOp) e;
        final Bounds<Double> b0 = floatBounds(ev, binOp.a0);
        final Bounds<Double> b1 = floatBounds(ev, binOp.a1);
        if (!b0.valid || !b1.valid) {
          return Bounds.invalidFloat();
        }
        switch (e.op) {
          case PLUS:
            return Bounds.of(b0.lower + b1.lower, b0.upper + b1.upper);
          case MINUS:
            return Bounds.of(b0.lower - b1.upper, b0.upper - b1.lower);
          case DIVIDE:
            if (b1.lower <= 0d && b1.upper >= 0d) {
              return Bounds.invalidFloat();
            }
            return corners(b0, b1, (v0, v1) -> v0 / v1);
          default:
            return corners(b0, b1, (v0, v1) ->
                v0 == 0d || v1 == 0d ? 0d : v0 * v1);
        }

      case CALL:
        final Ast.Call call = (Ast.Call) e;
        switch (call.name) {
          case "abs":
            final Bounds<Double> a = floatBounds(ev, call.arg(0));
            if (!a.valid || a.lower >= 0d) {
              return a;
            }
            if (a.upper <= 0d) {
              return Bounds.of(-a.upper, -a.lower);
            }
            return Bounds.of(0d, Math.max(-a.lower, a.upper));
          case "int2float":
            return floatBounds(ev, call.arg(0));
          case "min":
          case "max":
            if (call.args.size() != 2) {
              return Bounds.invalidFloat();
            }
            final Bounds<Double> m0 = floatBounds(ev, call.arg(0));
            final Bounds<Double> m1 = floatBounds(ev, call.arg(1));
            if (!m0.valid || !m1.valid) {
              return Bounds.invalidFloat();
            }
            return call.name.equals("min")
                ? Bounds.of(Math.min(m0.lower, m1.lower),
                    Math.min(m0.upper, m1.upper))
                : Bounds.of(Math.max(m0.lower, m1.lower),
                    Math.max(m0.upper, m1.upper));
          default:
            return Bounds.invalidFloat();
        }

      default:
        return Bounds.invalidFloat();
    }
  }

  private static Bounds<Double> corners(Bounds<Double> b0, Bounds<Double> b1,
      DoubleBinaryOperator op) {
    final double c0 = op.applyAsDouble(b0.lower, b1.lower);
    final double c1 = op.applyAsDouble(b0.lower, b1.upper);
    final double c2 = op.applyAsDouble(b0.upper, b1.lower);
    final double c3 = op.applyAsDouble(b0.upper, b1.upper);
    return Bounds.of(Math.min(Math.min(c0, c1), Math.min(c2, c3)),
        Math.max(Math.max(c0, c1), Math.max(c2, c3)));
  }

  /** Computes an upper bound of a set expression: a set that contains every
   * value the expression can take. Returns null if there is no such
   * bound. */
  public static @Nullable IntSetVal intSetBounds(Evaluator ev, Ast.Exp e) {
    if (e.type.isPar()) {
      return ev.evalIntSet(e);
    }
    switch (e.op) {
      case ID:
        final Ast.Id id = (Ast.Id) e;
        final Ast.Exp domain = id.decl.ti.domain;
        if (domain != null) {
          return ev.evalIntSet(domain);
        }
        return viaDefinition(ev, id, null, def -> intSetBounds(ev, def));

      case UNION:
      case INTERSECT:
      case DIFF:
      case SYMDIFF:
        final Ast.BinOp binOp = (Ast.BinOp) e;
        final IntSetVal s0 = intSetBounds(ev, binOp.a0);
        final IntSetVal s1 = intSetBounds(ev, binOp.a1);
        switch (e.op) {
          case INTERSECT:
            return s0 == null ? s1
                : s1 == null ? s0
                : s0.intersect(s1);
          case DIFF:
            return s0;
          default:
            return s0 == null || s1 == null ? null : s0.union(s1);
        }

      case ITE:
        final Ast.If if_ = (Ast.If) e;
        if (if_.condition.type.isPar()) {
          return intSetBounds(ev,
              ev.evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
        }
        final IntSetVal t = intSetBounds(ev, if_.ifTrue);
        final IntSetVal f = intSetBounds(ev, if_.ifFalse);
        return t == null || f == null ? null : t.union(f);

      case SET_LITERAL:
        final Ast.SetLiteral set = (Ast.SetLiteral) e;
        if (set.elements == null) {
          return ev.evalIntSet(set);
        }
        IntSetVal s = IntSetVal.EMPTY;
        for (Ast.Exp element : set.elements) {
          final Bounds<IntVal> b = intBounds(ev, element);
          if (!b.valid) {
            return null;
          }
          s = s.union(IntSetVal.range(b.lower, b.upper));
        }
        return s;

      case ARRAY_ACCESS:
        final Ast.ArrayAccess access = (Ast.ArrayAccess) e;
        if (access.indices.stream().allMatch(i -> i.type.isPar())) {
          return intSetBounds(ev, ev.evalArrayAccess(access));
        }
        final Ast.@Nullable ArrayLiteral array = arrayOrNull(ev, access.array);
        if (array == null) {
          return null;
        }
        IntSetVal u = IntSetVal.EMPTY;
        for (Ast.Exp element : array.elements) {
          final IntSetVal s2 = intSetBounds(ev, element);
          if (s2 == null) {
            return null;
          }
          u = u.union(s2);
        }
        return u;

      default:
        return null;
    }
  }

  /** Returns the lower bound of an integer expression, or -infinity. */
  public static IntVal lbInt(Evaluator ev, Ast.Exp e) {
    final Bounds<IntVal> b = intBounds(ev, e);
    return b.valid ? b.lower : IntVal.MINUS_INFINITY;
  }

  /** Returns the upper bound of an integer expression, or infinity. */
  public static IntVal ubInt(Evaluator ev, Ast.Exp e) {
    final Bounds<IntVal> b = intBounds(ev, e);
    return b.valid ? b.upper : IntVal.INFINITY;
  }

  /** Returns whether an integer expression has finite bounds. */
  public static boolean hasBoundsInt(Evaluator ev, Ast.Exp e) {
    final Bounds<IntVal> b = intBounds(ev, e);
    return b.valid && b.lower.isFinite() && b.upper.isFinite();
  }

  /** Returns whether bounds can be computed for a float expression. */
  public static boolean hasBoundsFloat(Evaluator ev, Ast.Exp e) {
    return floatBounds(ev, e).valid;
  }

  /** Returns the lower bound of a float expression. */
  public static double lbFloat(Evaluator ev, Ast.Exp e, Pos pos) {
    final Bounds<Double> b = floatBounds(ev, e);
    if (!b.valid) {
      throw new EvalException("cannot determine bounds", pos);
    }
    return b.lower;
  }

  /** Returns the upper bound of a float expression. */
  public static double ubFloat(Evaluator ev, Ast.Exp e, Pos pos) {
    final Bounds<Double> b = floatBounds(ev, e);
    if (!b.valid) {
      throw new EvalException("cannot determine bounds", pos);
    }
    return b.upper;
  }

  /** Returns the declared element domain of an array, if the array is an
   * identifier whose declaration has one. */
  private static @Nullable IntSetVal declaredIntDomain(Evaluator ev,
      Ast.Exp e) {
    if (e.op != Op.ID) {
      return null;
    }
    final Ast.Exp domain = ((Ast.Id) e).decl.ti.domain;
    return domain == null ? null : ev.evalIntSet(domain);
  }

  private static @Nullable FloatSetVal declaredFloatDomain(Evaluator ev,
      Ast.Exp e) {
    if (e.op != Op.ID) {
      return null;
    }
    final Ast.Exp domain = ((Ast.Id) e).decl.ti.domain;
    return domain == null ? null : ev.evalFloatSet(domain);
  }

  /** Returns whether an expression is a declared array with no
   * definition; its elements are known only through its declared domain. */
  private static boolean isUndefinedArray(Ast.Exp e) {
    return e.op == Op.ID && Evaluator.definition(((Ast.Id) e).decl) == null;
  }

  private static Ast.ArrayLiteral nonEmptyArray(Evaluator ev, Ast.Exp e,
      String which, Pos pos) {
    final Ast.ArrayLiteral array = ev.evalArray(e);
    if (array.size() == 0) {
      throw new EvalException(which + " bound of empty array undefined",
          pos);
    }
    return array;
  }

  /** Returns the least lower bound of the elements of an integer array,
   * met with the array's declared domain.
   *
   * <p>If the bounds of any element are invalid, returns the declared
   * domain's minimum, or -infinity. */
  public static IntVal lbArrayInt(Evaluator ev, Ast.Exp e, Pos pos) {
    final IntSetVal domain = declaredIntDomain(ev, e);
    final IntVal declared =
        domain == null || domain.isEmpty() ? null : domain.min();
    if (isUndefinedArray(e)) {
      return declared != null ? declared : IntVal.MINUS_INFINITY;
    }
    final Ast.ArrayLiteral array = nonEmptyArray(ev, e, "lower", pos);
    IntVal lower = IntVal.INFINITY;
    for (Ast.Exp element : array.elements) {
      final Bounds<IntVal> b = intBounds(ev, element);
      if (!b.valid) {
        return declared != null ? declared : IntVal.MINUS_INFINITY;
      }
      lower = IntVal.min(lower, b.lower);
    }
    return declared == null ? lower : IntVal.max(declared, lower);
  }

  /** Returns the greatest upper bound of the elements of an integer array,
   * met with the array's declared domain. */
  public static IntVal ubArrayInt(Evaluator ev, Ast.Exp e, Pos pos) {
    final IntSetVal domain = declaredIntDomain(ev, e);
    final IntVal declared =
        domain == null || domain.isEmpty() ? null : domain.max();
    if (isUndefinedArray(e)) {
      return declared != null ? declared : IntVal.INFINITY;
    }
    final Ast.ArrayLiteral array = nonEmptyArray(ev, e, "upper", pos);
    IntVal upper = IntVal.MINUS_INFINITY;
    for (Ast.Exp element : array.elements) {
      final Bounds<IntVal> b = intBounds(ev, element);
      if (!b.valid) {
        return declared != null ? declared : IntVal.INFINITY;
      }
      upper = IntVal.max(upper, b.upper);
    }
    return declared == null ? upper : IntVal.min(declared, upper);
  }

  /** Returns the least lower bound of the elements of a float array.
   *
   * @throws EvalException if neither the declared domain nor the bounds of
   * every element are known */
  public static double lbArrayFloat(Evaluator ev, Ast.Exp e, Pos pos) {
    final FloatSetVal domain = declaredFloatDomain(ev, e);
    final Double declared =
        domain == null || domain.isEmpty() ? null : domain.min();
    if (isUndefinedArray(e)) {
      if (declared == null) {
        throw new EvalException("cannot determine lower bound", pos);
      }
      return declared;
    }
    final Ast.ArrayLiteral array = nonEmptyArray(ev, e, "lower", pos);
    double lower = Double.POSITIVE_INFINITY;
    for (Ast.Exp element : array.elements) {
      final Bounds<Double> b = floatBounds(ev, element);
      if (!b.valid) {
        if (declared == null) {
          throw new EvalException("cannot determine lower bound", pos);
        }
        return declared;
      }
      lower = Math.min(lower, b.lower);
    }
    return declared == null ? lower : Math.max(declared, lower);
  }

  /** Returns the greatest upper bound of the elements of a float array. */
  public static double ubArrayFloat(Evaluator ev, Ast.Exp e, Pos pos) {
    final FloatSetVal domain = declaredFloatDomain(ev, e);
    final Double declared =
        domain == null || domain.isEmpty() ? null : domain.max();
    if (isUndefinedArray(e)) {
      if (declared == null) {
        throw new EvalException("cannot determine upper bound", pos);
      }
      return declared;
    }
    final Ast.ArrayLiteral array = nonEmptyArray(ev, e, "upper", pos);
    double upper = Double.NEGATIVE_INFINITY;
    for (Ast.Exp element : array.elements) {
      final Bounds<Double> b = floatBounds(ev, element);
      if (!b.valid) {
        if (declared == null) {
          throw new EvalException("cannot determine upper bound", pos);
        }
        return declared;
      }
      upper = Math.max(upper, b.upper);
    }
    return declared == null ? upper : Math.min(declared, upper);
  }

  /**
   * Returns the domain of an integer expression.
   *
   * <p>Follows identifiers to their definitions, and fixed array accesses to
   * their elements, intersecting the declared domains met along the way.
   * Where the chain ends, intersects with the computed bounds. If nothing is
   * known, returns the infinite set.
   */
  public static IntSetVal dom(Evaluator ev, Ast.Exp e) {
    if (e.type.isPar()) {
      final IntVal v = ev.evalInt(e);
      return IntSetVal.range(v, v);
    }
    final List<Ast.VarDecl> entered = new ArrayList<>();
    try {
      IntSetVal dom = IntSetVal.INFINITE;
      Ast.Exp cur = e;
      for (;;) {
        if (cur.op == Op.ID) {
          final Ast.VarDecl decl = ((Ast.Id) cur).decl;
          if (decl.ti.domain != null) {
            dom = dom.intersect(ev.evalIntSet(decl.ti.domain));
          }
          final Ast.Exp def = Evaluator.definition(decl);
          if (def == null) {
            break;
          }
          ev.chase.enter(decl, cur.pos);
          entered.add(decl);
          cur = def;
        } else if (cur.op == Op.ARRAY_ACCESS
            && ((Ast.ArrayAccess) cur).indices.stream()
                .allMatch(i -> i.type.isPar())) {
          cur = ev.evalArrayAccess((Ast.ArrayAccess) cur);
        } else {
          break;
        }
      }
      final Bounds<IntVal> b = intBounds(ev, cur);
      if (b.valid) {
        dom = dom.intersect(IntSetVal.range(b.lower, b.upper));
      }
      return dom;
    } finally {
      for (Ast.VarDecl decl : entered) {
        ev.chase.exit(decl);
      }
    }
  }

  /** Returns the union of the domains of the elements of an array. */
  public static IntSetVal domArray(Evaluator ev, Ast.Exp e) {
    if (isUndefinedArray(e)) {
      final IntSetVal domain = declaredIntDomain(ev, e);
      return domain != null ? domain : IntSetVal.INFINITE;
    }
    IntSetVal dom = IntSetVal.EMPTY;
    for (Ast.Exp element : ev.evalArray(e).elements) {
      dom = dom.union(dom(ev, element));
    }
    return dom;
  }

  /** Returns the smallest range that contains the domains of the elements
   * of an array. */
  public static IntSetVal domBoundsArray(Evaluator ev, Ast.Exp e) {
    final IntSetVal domain = declaredIntDomain(ev, e);
    if (isUndefinedArray(e)) {
      return domain != null && !domain.isEmpty()
          ? IntSetVal.range(domain.min(), domain.max())
          : IntSetVal.INFINITE;
    }
    final Ast.ArrayLiteral array = ev.evalArray(e);
    if (array.size() == 0) {
      return IntSetVal.EMPTY;
    }
    if (domain != null && !domain.isEmpty()) {
      return IntSetVal.range(domain.min(), domain.max());
    }
    IntVal lower = IntVal.INFINITY;
    IntVal upper = IntVal.MINUS_INFINITY;
    for (Ast.Exp element : array.elements) {
      final Bounds<IntVal> b = intBounds(ev, element);
      if (!b.valid) {
        return IntSetVal.INFINITE;
      }
      lower = IntVal.min(lower, b.lower);
      upper = IntVal.max(upper, b.upper);
    }
    return IntSetVal.range(lower, upper);
  }

  /** Returns the least upper bound of a set expression. */
  public static IntSetVal ubSet(Evaluator ev, Ast.Exp e, Pos pos) {
    final IntSetVal s = intSetBounds(ev, e);
    if (s == null) {
      throw new EvalException("cannot determine bounds of set expression",
          pos);
    }
    return s;
  }

  /** Returns the greatest lower bound of a set expression: its value if it
   * is fixed, otherwise the empty set. */
  public static IntSetVal lbSet(Evaluator ev, Ast.Exp e) {
    return e.type.isPar() ? ev.evalIntSet(e) : IntSetVal.EMPTY;
  }

  /** Returns whether an upper bound can be computed for a set
   * expression. */
  public static boolean hasUbSet(Evaluator ev, Ast.Exp e) {
    return intSetBounds(ev, e) != null;
  }

  /** Returns the union of the upper bounds of the elements of an array of
   * sets. */
  public static IntSetVal ubArraySet(Evaluator ev, Ast.Exp e, Pos pos) {
    if (isUndefinedArray(e)) {
      final IntSetVal domain = declaredIntDomain(ev, e);
      if (domain == null) {
        throw new EvalException("cannot determine bounds of set expression",
            pos);
      }
      return domain;
    }
    IntSetVal u = IntSetVal.EMPTY;
    for (Ast.Exp element : ev.evalArray(e).elements) {
      u = u.union(ubSet(ev, element, pos));
    }
    return u;
  }
}

// End BoundsComputer.java
