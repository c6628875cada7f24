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
import static net.hydromatic.zinc.ast.AstBuilder.ast;
import static net.hydromatic.zinc.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Pos;
import net.hydromatic.zinc.compile.FunctionDecl;
import net.hydromatic.zinc.type.PrimitiveType;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates calls to builtins, and the expressions that are their
 * arguments.
 *
 * <p>The {@code evalXxx} methods evaluate a fixed expression to a value.
 * Each follows identifiers to their definitions, evaluates nested builtin
 * calls, and applies operators. An expression that has no value (for
 * example, a decision variable without a definition) is an
 * {@link EvalException}; an expression whose type does not match the
 * requested kind is a {@link TypeMismatchException}.
 *
 * <p>An evaluator is not thread-safe. It keeps, in a {@link Chase}, the
 * declarations it is currently evaluating, and fails if it encounters one
 * of them again.
 */
public class Evaluator {
  public final Session session;
  final Chase chase;

  Evaluator(Session session) {
    this.session = requireNonNull(session);
    this.chase = new Chase(Prop.CHASE_LIMIT.intValue(session.map));
  }

  /** Returns the implementation of a call. */
  public Applicable resolve(Ast.Call call) {
    return session.registry.resolve(call);
  }

  /** Resolves and evaluates a call. */
  public EvalResult evaluate(Ast.Call call) {
    return evaluate(resolve(call), call);
  }

  /**
   * Evaluates a call, converting an undefined result or an evaluation error
   * into an {@link EvalResult}.
   *
   * <p>A {@link TypeMismatchException} is not converted; it is a defect in
   * the caller, and is thrown.
   */
  public EvalResult evaluate(Applicable applicable, Ast.Call call) {
    try {
      return EvalResult.value(apply(applicable, call));
    } catch (ResultUndefinedException e) {
      session.tracer.onUndefined(call, e);
      return EvalResult.undefined(e);
    } catch (EvalException e) {
      session.tracer.onError(call, e);
      return EvalResult.error(e);
    }
  }

  /** Applies an implementation to a call, and returns the value.
   *
   * <p>The value is an instance of the {@link Applicable.Kind#valueClass}
   * of the implementation's kind.
   *
   * @throws EvalException if evaluation fails, or if the result is undefined
   * @throws TypeMismatchException if the call does not fit the
   *   implementation */
  public Object apply(Applicable applicable, Ast.Call call) {
    final FunctionDecl decl = call.decl;
    if (decl != null && decl.paramTypes.size() != call.args.size()) {
      throw new TypeMismatchException("builtin " + decl + " applied to "
          + call.args.size() + " arguments", call.pos);
    }
    session.tracer.onCall(call);
    final Object result;
    try {
      result = applicable.apply(this, call);
    } catch (ArithmeticException e) {
      throw new EvalException(e.getMessage(), call.pos, e);
    }
    if (!applicable.kind().valueClass.isInstance(result)) {
      throw new TypeMismatchException("builtin " + call.name
          + " returned " + result + ", expected "
          + applicable.kind().name().toLowerCase(Locale.ROOT),
          call.pos);
    }
    session.tracer.onResult(call, result);
    return result;
  }

  /** Resolves and applies a call that is nested in an expression. */
  Object callValue(Ast.Call call) {
    return apply(resolve(call), call);
  }

  /** Converts the value of a builtin into a literal. */
  public static Ast.Exp toExp(Object o, Pos pos) {
    if (o instanceof Ast.Exp) {
      return (Ast.Exp) o;
    } else if (o instanceof IntVal) {
      return ast.intLiteral(pos, (IntVal) o);
    } else if (o instanceof Double) {
      return ast.floatLiteral(pos, (Double) o);
    } else if (o instanceof Boolean) {
      return ast.boolLiteral(pos, (Boolean) o);
    } else if (o instanceof String) {
      return ast.stringLiteral(pos, (String) o);
    } else if (o instanceof IntSetVal) {
      return ast.setLiteral(pos, (IntSetVal) o);
    } else if (o instanceof FloatSetVal) {
      return ast.setLiteral(pos, (FloatSetVal) o);
    } else if (o == Unit.INSTANCE) {
      return ast.boolLiteral(pos, true);
    }
    throw new IllegalArgumentException("not a value: " + o);
  }

  /** Returns the expression that defines a declaration: its initializer
   * or, failing that, the initializer of its flattened binding; or null. */
  public static Ast.@Nullable Exp definition(Ast.VarDecl decl) {
    final Ast.Exp e = decl.e();
    if (e != null) {
      return e;
    }
    final Ast.VarDecl flat = decl.flat();
    return flat == null || flat == decl ? null : flat.e();
  }

  /** Applies a function to the definition of an identifier, with the
   * identifier's declaration on the chase path. */
  <T> T viaDefinition(Ast.Id id, Function<Ast.Exp, T> f) {
    final Ast.Exp e = definition(id.decl);
    if (e == null) {
      throw new EvalException(id.type.isArray()
          ? "array without initialiser: " + id.name()
          : "cannot evaluate expression: " + id.name() + " has no value",
          id.pos);
    }
    chase.enter(id.decl, id.pos);
    try {
      return f.apply(e);
    } finally {
      chase.exit(id.decl);
    }
  }

  private static TypeMismatchException mismatch(String kind, Ast.Exp e) {
    return new TypeMismatchException("cannot evaluate " + e + " as "
        + kind, e.pos);
  }

  /** Evaluates an integer expression. */
  public IntVal evalInt(Ast.Exp e) {
    switch (e.op) {
      case INT_LITERAL:
        return ((Ast.IntLiteral) e).value;
      case ID:
        return viaDefinition((Ast.Id) e, this::evalInt);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof IntVal) {
          return (IntVal) o;
        }
        if (o instanceof Ast.Exp) {
          return evalInt((Ast.Exp) o);
        }
        throw mismatch("int", e);
      case ARRAY_ACCESS:
        return evalInt(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalInt(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case NEGATE:
        return evalInt(((Ast.UnOp) e).a).negate();
      case POSITIVE:
        return evalInt(((Ast.UnOp) e).a);
      case PLUS:
      case MINUS:
      case TIMES:
      case DIV:
      case MOD:
        final Ast.BinOp b = (Ast.BinOp) e;
        final IntVal v0 = evalInt(b.a0);
        final IntVal v1 = evalInt(b.a1);
        try {
          switch (e.op) {
            case PLUS:
              return v0.plus(v1);
            case MINUS:
              return v0.minus(v1);
            case TIMES:
              return v0.times(v1);
            case DIV:
              checkDivisor(v1.signum() == 0, e);
              return v0.div(v1);
            default:
              checkDivisor(v1.signum() == 0, e);
              return v0.mod(v1);
          }
        } catch (ArithmeticException ex) {
          throw new EvalException(ex.getMessage(), e.pos, ex);
        }
      default:
        throw mismatch("int", e);
    }
  }

  private static void checkDivisor(boolean zero, Ast.Exp e) {
    if (zero) {
      throw new ResultUndefinedException("division by zero", e.pos);
    }
  }

  /** Evaluates a float expression. An integer expression is converted to a
   * float. */
  public double evalFloat(Ast.Exp e) {
    if (e.type.isInt()) {
      return evalInt(e).toDouble();
    }
    switch (e.op) {
      case FLOAT_LITERAL:
        return ((Ast.FloatLiteral) e).value;
      case INT_LITERAL:
        return ((Ast.IntLiteral) e).value.toDouble();
      case ID:
        return viaDefinition((Ast.Id) e, this::evalFloat);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof Double) {
          return (Double) o;
        }
        if (o instanceof IntVal) {
          return ((IntVal) o).toDouble();
        }
        if (o instanceof Ast.Exp) {
          return evalFloat((Ast.Exp) o);
        }
        throw mismatch("float", e);
      case ARRAY_ACCESS:
        return evalFloat(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalFloat(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case NEGATE:
        return -evalFloat(((Ast.UnOp) e).a);
      case POSITIVE:
        return evalFloat(((Ast.UnOp) e).a);
      case PLUS:
        return evalFloat(((Ast.BinOp) e).a0) + evalFloat(((Ast.BinOp) e).a1);
      case MINUS:
        return evalFloat(((Ast.BinOp) e).a0) - evalFloat(((Ast.BinOp) e).a1);
      case TIMES:
        return evalFloat(((Ast.BinOp) e).a0) * evalFloat(((Ast.BinOp) e).a1);
      case DIVIDE:
        final double v0 = evalFloat(((Ast.BinOp) e).a0);
        final double v1 = evalFloat(((Ast.BinOp) e).a1);
        checkDivisor(v1 == 0d, e);
        return v0 / v1;
      default:
        throw mismatch("float", e);
    }
  }

  /** Evaluates a boolean expression. */
  public boolean evalBool(Ast.Exp e) {
    switch (e.op) {
      case BOOL_LITERAL:
        return ((Ast.BoolLiteral) e).value;
      case ID:
        return viaDefinition((Ast.Id) e, this::evalBool);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof Boolean) {
          return (Boolean) o;
        }
        if (o == Unit.INSTANCE) {
          return true;
        }
        if (o instanceof Ast.Exp) {
          return evalBool((Ast.Exp) o);
        }
        throw mismatch("bool", e);
      case ARRAY_ACCESS:
        return evalBool(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalBool(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case NOT:
        return !evalBool(((Ast.UnOp) e).a);
      case AND:
        return evalBool(((Ast.BinOp) e).a0) && evalBool(((Ast.BinOp) e).a1);
      case OR:
        return evalBool(((Ast.BinOp) e).a0) || evalBool(((Ast.BinOp) e).a1);
      case IMPL:
        return !evalBool(((Ast.BinOp) e).a0) || evalBool(((Ast.BinOp) e).a1);
      case RIMPL:
        return evalBool(((Ast.BinOp) e).a0) || !evalBool(((Ast.BinOp) e).a1);
      case XOR:
        return evalBool(((Ast.BinOp) e).a0) != evalBool(((Ast.BinOp) e).a1);
      case EQUIV:
        return evalBool(((Ast.BinOp) e).a0) == evalBool(((Ast.BinOp) e).a1);
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return compare((Ast.BinOp) e);
      case IN:
        final Ast.BinOp in = (Ast.BinOp) e;
        if (in.a1.type.base == PrimitiveType.FLOAT) {
          return evalFloatSet(in.a1).contains(evalFloat(in.a0));
        }
        return evalIntSet(in.a1).contains(evalInt(in.a0));
      case SUBSET:
        final Ast.BinOp subset = (Ast.BinOp) e;
        return evalIntSet(subset.a0).isSubsetOf(evalIntSet(subset.a1));
      case SUPERSET:
        final Ast.BinOp superset = (Ast.BinOp) e;
        return evalIntSet(superset.a1).isSubsetOf(evalIntSet(superset.a0));
      default:
        throw mismatch("bool", e);
    }
  }

  private boolean compare(Ast.BinOp e) {
    final Type t0 = e.a0.type;
    final Type t1 = e.a1.type;
    final int c;
    if (t0.set || t1.set) {
      final boolean equal = t0.base == PrimitiveType.FLOAT
          ? evalFloatSet(e.a0).equals(evalFloatSet(e.a1))
          : evalIntSet(e.a0).equals(evalIntSet(e.a1));
      switch (e.op) {
        case EQ:
          return equal;
        case NE:
          return !equal;
        default:
          throw mismatch("comparable value", e.a0);
      }
    } else if (t0.isInt() && t1.isInt()) {
      c = evalInt(e.a0).compareTo(evalInt(e.a1));
    } else if (isNumeric(t0) && isNumeric(t1)) {
      c = Double.compare(evalFloat(e.a0), evalFloat(e.a1));
    } else if (t0.base == PrimitiveType.BOOL) {
      c = Boolean.compare(evalBool(e.a0), evalBool(e.a1));
    } else if (t0.base == PrimitiveType.STRING) {
      c = evalString(e.a0).compareTo(evalString(e.a1));
    } else {
      throw mismatch("comparable value", e.a0);
    }
    switch (e.op) {
      case EQ:
        return c == 0;
      case NE:
        return c != 0;
      case LT:
        return c < 0;
      case LE:
        return c <= 0;
      case GT:
        return c > 0;
      default:
        return c >= 0;
    }
  }

  private static boolean isNumeric(Type type) {
    return type.isInt() || type.isFloat();
  }

  /** Evaluates a string expression. */
  public String evalString(Ast.Exp e) {
    switch (e.op) {
      case STRING_LITERAL:
        return ((Ast.StringLiteral) e).value;
      case ID:
        return viaDefinition((Ast.Id) e, this::evalString);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof String) {
          return (String) o;
        }
        if (o instanceof Ast.Exp) {
          return evalString((Ast.Exp) o);
        }
        throw mismatch("string", e);
      case ARRAY_ACCESS:
        return evalString(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalString(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case PLUS_PLUS:
        return evalString(((Ast.BinOp) e).a0)
            + evalString(((Ast.BinOp) e).a1);
      default:
        throw mismatch("string", e);
    }
  }

  /** Evaluates an expression whose value is a set of integers. */
  public IntSetVal evalIntSet(Ast.Exp e) {
    switch (e.op) {
      case SET_LITERAL:
        final Ast.SetLiteral s = (Ast.SetLiteral) e;
        if (s.intSet != null) {
          return s.intSet;
        }
        if (s.elements != null) {
          return IntSetVal.ofValues(transformEager(s.elements, this::evalInt));
        }
        throw mismatch("set of int", e);
      case ID:
        return viaDefinition((Ast.Id) e, this::evalIntSet);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof IntSetVal) {
          return (IntSetVal) o;
        }
        if (o instanceof Ast.Exp) {
          return evalIntSet((Ast.Exp) o);
        }
        throw mismatch("set of int", e);
      case ARRAY_ACCESS:
        return evalIntSet(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalIntSet(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case DOT_DOT:
        final Ast.BinOp range = (Ast.BinOp) e;
        return IntSetVal.range(evalInt(range.a0), evalInt(range.a1));
      case UNION:
      case INTERSECT:
      case DIFF:
      case SYMDIFF:
        final Ast.BinOp b = (Ast.BinOp) e;
        final IntSetVal s0 = evalIntSet(b.a0);
        final IntSetVal s1 = evalIntSet(b.a1);
        switch (e.op) {
          case UNION:
            return s0.union(s1);
          case INTERSECT:
            return s0.intersect(s1);
          case DIFF:
            return s0.diff(s1);
          default:
            return s0.diff(s1).union(s1.diff(s0));
        }
      default:
        throw mismatch("set of int", e);
    }
  }

  /** Evaluates an expression whose value is a set of floats. A set of
   * integers is converted. */
  public FloatSetVal evalFloatSet(Ast.Exp e) {
    if (e.type.base == PrimitiveType.INT) {
      return FloatSetVal.of(evalIntSet(e));
    }
    switch (e.op) {
      case SET_LITERAL:
        final Ast.SetLiteral s = (Ast.SetLiteral) e;
        if (s.floatSet != null) {
          return s.floatSet;
        }
        if (s.intSet != null) {
          return FloatSetVal.of(s.intSet);
        }
        FloatSetVal set = FloatSetVal.EMPTY;
        for (Ast.Exp element : requireNonNull(s.elements)) {
          final double d = evalFloat(element);
          set = set.union(FloatSetVal.range(d, d));
        }
        return set;
      case ID:
        return viaDefinition((Ast.Id) e, this::evalFloatSet);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof IntSetVal) {
          return FloatSetVal.of((IntSetVal) o);
        }
        if (o instanceof Ast.Exp) {
          return evalFloatSet((Ast.Exp) o);
        }
        throw mismatch("set of float", e);
      case ARRAY_ACCESS:
        return evalFloatSet(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalFloatSet(evalBool(if_.condition) ? if_.ifTrue
            : if_.ifFalse);
      case DOT_DOT:
        final Ast.BinOp range = (Ast.BinOp) e;
        return FloatSetVal.range(evalFloat(range.a0), evalFloat(range.a1));
      case UNION:
        return evalFloatSet(((Ast.BinOp) e).a0)
            .union(evalFloatSet(((Ast.BinOp) e).a1));
      case INTERSECT:
        return evalFloatSet(((Ast.BinOp) e).a0)
            .intersect(evalFloatSet(((Ast.BinOp) e).a1));
      default:
        throw mismatch("set of float", e);
    }
  }

  /**
   * Evaluates an array expression, returning an array literal.
   *
   * <p>Fixed elements are evaluated to literals, and decision-variable
   * elements are left as they are. If the expression is already an array
   * literal in that form, returns it.
   */
  public Ast.ArrayLiteral evalArray(Ast.Exp e) {
    switch (e.op) {
      case ARRAY_LITERAL:
        final Ast.ArrayLiteral a = (Ast.ArrayLiteral) e;
        if (a.elements.stream().allMatch(Evaluator::isEvaluated)) {
          return a;
        }
        return ast.arrayLiteral(a.pos, a.type.elementType(),
            transformEager(a.elements, this::evalPar), a.dims);
      case ID:
        return viaDefinition((Ast.Id) e, this::evalArray);
      case CALL:
        final Object o = callValue((Ast.Call) e);
        if (o instanceof Ast.Exp) {
          return evalArray((Ast.Exp) o);
        }
        throw mismatch("array", e);
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalArray(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      case PLUS_PLUS:
        final Ast.ArrayLiteral a0 = evalArray(((Ast.BinOp) e).a0);
        final Ast.ArrayLiteral a1 = evalArray(((Ast.BinOp) e).a1);
        final ImmutableList<Ast.Exp> elements =
            ImmutableList.<Ast.Exp>builder().addAll(a0.elements)
                .addAll(a1.elements).build();
        return ast.arrayLiteral(e.pos, e.type.elementType(), elements,
            ImmutableIntArray.of(1, elements.size()));
      default:
        throw mismatch("array", e);
    }
  }

  private static boolean isEvaluated(Ast.Exp e) {
    return e.isLiteral() || e.type.isVar();
  }

  /** Returns the element of an array that an array access refers to.
   *
   * @throws ResultUndefinedException if an index is out of bounds */
  public Ast.Exp evalArrayAccess(Ast.ArrayAccess access) {
    final Ast.ArrayLiteral a = evalArray(access.array);
    if (access.indices.size() != a.dimCount()) {
      throw new TypeMismatchException("array has " + a.dimCount()
          + " dimensions but is accessed with " + access.indices.size()
          + " indices", access.pos);
    }
    long offset = 0;
    for (int i = 0; i < a.dimCount(); i++) {
      final IntVal index = evalInt(access.indices.get(i));
      if (index.compareTo(IntVal.of(a.min(i))) < 0
          || index.compareTo(IntVal.of(a.max(i))) > 0) {
        throw new ResultUndefinedException("array access out of bounds",
            access.pos);
      }
      offset = offset * (a.max(i) - a.min(i) + 1)
          + (index.toLong() - a.min(i));
    }
    return a.get((int) offset);
  }

  /**
   * Evaluates an expression as far as possible.
   *
   * <p>A fixed scalar expression becomes a literal; an array becomes an
   * array literal (see {@link #evalArray}); an expression whose type is a
   * decision variable is returned as is.
   */
  public Ast.Exp evalPar(Ast.Exp e) {
    if (e.type.isArray()) {
      return evalArray(e);
    }
    if (e.isLiteral() || e.type.isVar()) {
      return e;
    }
    switch (e.op) {
      case ID:
        return viaDefinition((Ast.Id) e, this::evalPar);
      case CALL:
        return evalPar(toExp(callValue((Ast.Call) e), e.pos));
      case ARRAY_ACCESS:
        return evalPar(evalArrayAccess((Ast.ArrayAccess) e));
      case ITE:
        final Ast.If if_ = (Ast.If) e;
        return evalPar(evalBool(if_.condition) ? if_.ifTrue : if_.ifFalse);
      default:
        break;
    }
    if (e.type.set) {
      return e.type.base == PrimitiveType.FLOAT
          ? ast.setLiteral(e.pos, evalFloatSet(e))
          : ast.setLiteral(e.pos, evalIntSet(e));
    }
    switch (e.type.base) {
      case INT:
        return ast.intLiteral(e.pos, evalInt(e));
      case FLOAT:
        return ast.floatLiteral(e.pos, evalFloat(e));
      case BOOL:
        return ast.boolLiteral(e.pos, evalBool(e));
      case STRING:
        return ast.stringLiteral(e.pos, evalString(e));
      default:
        return e;
    }
  }

  /** Evaluates an array of integers. */
  public List<IntVal> evalIntArray(Ast.Exp e) {
    return transformEager(evalArray(e).elements, this::evalInt);
  }

  /** Evaluates an array of floats. */
  public List<Double> evalFloatArray(Ast.Exp e) {
    return transformEager(evalArray(e).elements, this::evalFloat);
  }

  /** Evaluates an array of booleans. */
  public List<Boolean> evalBoolArray(Ast.Exp e) {
    return transformEager(evalArray(e).elements, this::evalBool);
  }

  /** Evaluates an array of strings. */
  public List<String> evalStringArray(Ast.Exp e) {
    return transformEager(evalArray(e).elements, this::evalString);
  }

  /** Evaluates an array of sets of integers. */
  public List<IntSetVal> evalIntSetArray(Ast.Exp e) {
    return transformEager(evalArray(e).elements, this::evalIntSet);
  }
}

// End Evaluator.java
