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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.compile.BuiltIn;
import net.hydromatic.zinc.compile.Registry;
import net.hydromatic.zinc.compile.Tracer;
import net.hydromatic.zinc.type.Type;

/** Implementations of built-in functions. */
public abstract class Codes {
  private Codes() {}

  /** @see BuiltIn#MIN_INT_ARRAY */
  private static final Applicable.IntImpl MIN_INT_ARRAY = (ev, call) -> {
    final List<IntVal> list = ev.evalIntArray(call.arg(0));
    if (list.isEmpty()) {
      throw undefined("minimum of empty array is undefined", call);
    }
    IntVal m = list.get(0);
    for (IntVal v : list) {
      m = IntVal.min(m, v);
    }
    return m;
  };

  /** @see BuiltIn#MAX_INT_ARRAY */
  private static final Applicable.IntImpl MAX_INT_ARRAY = (ev, call) -> {
    final List<IntVal> list = ev.evalIntArray(call.arg(0));
    if (list.isEmpty()) {
      throw undefined("maximum of empty array is undefined", call);
    }
    IntVal m = list.get(0);
    for (IntVal v : list) {
      m = IntVal.max(m, v);
    }
    return m;
  };

  /** @see BuiltIn#MIN_INT */
  private static final Applicable.IntImpl MIN_INT = (ev, call) ->
      IntVal.min(ev.evalInt(call.arg(0)), ev.evalInt(call.arg(1)));

  /** @see BuiltIn#MAX_INT */
  private static final Applicable.IntImpl MAX_INT = (ev, call) ->
      IntVal.max(ev.evalInt(call.arg(0)), ev.evalInt(call.arg(1)));

  /** @see BuiltIn#MIN_FLOAT_ARRAY */
  private static final Applicable.FloatImpl MIN_FLOAT_ARRAY = (ev, call) -> {
    final List<Double> list = ev.evalFloatArray(call.arg(0));
    if (list.isEmpty()) {
      throw undefined("minimum of empty array is undefined", call);
    }
    double m = list.get(0);
    for (double v : list) {
      m = Math.min(m, v);
    }
    return m;
  };

  /** @see BuiltIn#MAX_FLOAT_ARRAY */
  private static final Applicable.FloatImpl MAX_FLOAT_ARRAY = (ev, call) -> {
    final List<Double> list = ev.evalFloatArray(call.arg(0));
    if (list.isEmpty()) {
      throw undefined("maximum of empty array is undefined", call);
    }
    double m = list.get(0);
    for (double v : list) {
      m = Math.max(m, v);
    }
    return m;
  };

  /** @see BuiltIn#MIN_FLOAT */
  private static final Applicable.FloatImpl MIN_FLOAT = (ev, call) ->
      Math.min(ev.evalFloat(call.arg(0)), ev.evalFloat(call.arg(1)));

  /** @see BuiltIn#MAX_FLOAT */
  private static final Applicable.FloatImpl MAX_FLOAT = (ev, call) ->
      Math.max(ev.evalFloat(call.arg(0)), ev.evalFloat(call.arg(1)));

  /** @see BuiltIn#MIN_SET */
  private static final Applicable.IntImpl MIN_SET = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    if (s.isEmpty()) {
      throw undefined("minimum of empty set is undefined", call);
    }
    return s.min();
  };

  /** @see BuiltIn#MAX_SET */
  private static final Applicable.IntImpl MAX_SET = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    if (s.isEmpty()) {
      throw undefined("maximum of empty set is undefined", call);
    }
    return s.max();
  };

  /** @see BuiltIn#ARG_MIN_INT */
  private static final Applicable.IntImpl ARG_MIN_INT = (ev, call) ->
      argExtreme(ev.evalIntArray(call.arg(0)), Comparator.reverseOrder(),
          "argmin", call);

  /** @see BuiltIn#ARG_MAX_INT */
  private static final Applicable.IntImpl ARG_MAX_INT = (ev, call) ->
      argExtreme(ev.evalIntArray(call.arg(0)), Comparator.naturalOrder(),
          "argmax", call);

  /** @see BuiltIn#ARG_MIN_FLOAT */
  private static final Applicable.IntImpl ARG_MIN_FLOAT = (ev, call) ->
      argExtreme(ev.evalFloatArray(call.arg(0)), Comparator.reverseOrder(),
          "argmin", call);

  /** @see BuiltIn#ARG_MAX_FLOAT */
  private static final Applicable.IntImpl ARG_MAX_FLOAT = (ev, call) ->
      argExtreme(ev.evalFloatArray(call.arg(0)), Comparator.naturalOrder(),
          "argmax", call);

  /** Returns the 1-based position of the first element that no other element
   * exceeds according to a comparator. */
  private static <E> IntVal argExtreme(List<E> list,
      Comparator<? super E> comparator, String name, Ast.Call call) {
    if (list.isEmpty()) {
      throw undefined(name + " of empty array is undefined", call);
    }
    int best = 0;
    for (int i = 1; i < list.size(); i++) {
      if (comparator.compare(list.get(i), list.get(best)) > 0) {
        best = i;
      }
    }
    return IntVal.of(best + 1);
  }

  /** @see BuiltIn#SUM_INT */
  private static final Applicable.IntImpl SUM_INT = (ev, call) -> {
    IntVal sum = IntVal.ZERO;
    for (IntVal v : ev.evalIntArray(call.arg(0))) {
      sum = sum.plus(v);
    }
    return sum;
  };

  /** @see BuiltIn#SUM_FLOAT */
  private static final Applicable.FloatImpl SUM_FLOAT = (ev, call) -> {
    double sum = 0d;
    for (double v : ev.evalFloatArray(call.arg(0))) {
      sum += v;
    }
    return sum;
  };

  /** @see BuiltIn#PRODUCT_INT */
  private static final Applicable.IntImpl PRODUCT_INT = (ev, call) -> {
    IntVal product = IntVal.ONE;
    for (IntVal v : ev.evalIntArray(call.arg(0))) {
      product = product.times(v);
    }
    return product;
  };

  /** @see BuiltIn#PRODUCT_FLOAT */
  private static final Applicable.FloatImpl PRODUCT_FLOAT = (ev, call) -> {
    double product = 1d;
    for (double v : ev.evalFloatArray(call.arg(0))) {
      product *= v;
    }
    return product;
  };

  /** @see BuiltIn#ABS_INT */
  private static final Applicable.IntImpl ABS_INT = (ev, call) ->
      ev.evalInt(call.arg(0)).abs();

  /** @see BuiltIn#ABS_FLOAT */
  private static final Applicable.FloatImpl ABS_FLOAT = (ev, call) ->
      Math.abs(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#INT2FLOAT */
  private static final Applicable.FloatImpl INT2FLOAT = (ev, call) ->
      ev.evalInt(call.arg(0)).toDouble();

  /** @see BuiltIn#BOOL2INT */
  private static final Applicable.IntImpl BOOL2INT = (ev, call) ->
      ev.evalBool(call.arg(0)) ? IntVal.ONE : IntVal.ZERO;

  /** @see BuiltIn#CEIL */
  private static final Applicable.IntImpl CEIL = (ev, call) ->
      IntVal.ofDouble(Math.ceil(ev.evalFloat(call.arg(0))));

  /** @see BuiltIn#FLOOR */
  private static final Applicable.IntImpl FLOOR = (ev, call) ->
      IntVal.ofDouble(Math.floor(ev.evalFloat(call.arg(0))));

  /** @see BuiltIn#ROUND */
  private static final Applicable.IntImpl ROUND = (ev, call) ->
      IntVal.ofDouble(ev.evalFloat(call.arg(0)) + 0.5d);

  /** @see BuiltIn#POW_INT */
  private static final Applicable.IntImpl POW_INT = (ev, call) -> {
    final IntVal base = ev.evalInt(call.arg(0));
    final IntVal exponent = ev.evalInt(call.arg(1));
    if (exponent.signum() < 0) {
      throw new EvalException("Cannot raise integer to a negative power",
          call.arg(1).pos);
    }
    return base.pow(exponent);
  };

  /** @see BuiltIn#POW_FLOAT */
  private static final Applicable.FloatImpl POW_FLOAT = (ev, call) ->
      Math.pow(ev.evalFloat(call.arg(0)), ev.evalFloat(call.arg(1)));

  /** @see BuiltIn#SQRT */
  private static final Applicable.FloatImpl SQRT = (ev, call) ->
      Math.sqrt(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#EXP */
  private static final Applicable.FloatImpl EXP = (ev, call) ->
      Math.exp(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#LN */
  private static final Applicable.FloatImpl LN = (ev, call) ->
      Math.log(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#LOG10 */
  private static final Applicable.FloatImpl LOG10 = (ev, call) ->
      Math.log10(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#LOG2 */
  private static final Applicable.FloatImpl LOG2 = (ev, call) ->
      Math.log(ev.evalFloat(call.arg(0))) / Math.log(2d);

  /** @see BuiltIn#LOG */
  private static final Applicable.FloatImpl LOG = (ev, call) ->
      Math.log(ev.evalFloat(call.arg(1)))
          / Math.log(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#SIN */
  private static final Applicable.FloatImpl SIN = (ev, call) ->
      Math.sin(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#COS */
  private static final Applicable.FloatImpl COS = (ev, call) ->
      Math.cos(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#TAN */
  private static final Applicable.FloatImpl TAN = (ev, call) ->
      Math.tan(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#ASIN */
  private static final Applicable.FloatImpl ASIN = (ev, call) ->
      Math.asin(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#ACOS */
  private static final Applicable.FloatImpl ACOS = (ev, call) ->
      Math.acos(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#ATAN */
  private static final Applicable.FloatImpl ATAN = (ev, call) ->
      Math.atan(ev.evalFloat(call.arg(0)));

  /** @see BuiltIn#FORALL */
  private static final Applicable.BoolImpl FORALL = (ev, call) ->
      !ev.evalBoolArray(call.arg(0)).contains(false);

  /** @see BuiltIn#EXISTS */
  private static final Applicable.BoolImpl EXISTS = (ev, call) ->
      ev.evalBoolArray(call.arg(0)).contains(true);

  /** @see BuiltIn#XORALL */
  private static final Applicable.BoolImpl XORALL = (ev, call) ->
      countTrue(ev.evalBoolArray(call.arg(0))) % 2 == 1;

  /** @see BuiltIn#IFFALL */
  private static final Applicable.BoolImpl IFFALL = (ev, call) ->
      countTrue(ev.evalBoolArray(call.arg(0))) % 2 == 0;

  private static int countTrue(List<Boolean> list) {
    int n = 0;
    for (boolean b : list) {
      if (b) {
        ++n;
      }
    }
    return n;
  }

  /** @see BuiltIn#CLAUSE */
  private static final Applicable.BoolImpl CLAUSE = (ev, call) ->
      ev.evalBoolArray(call.arg(0)).contains(true)
          || ev.evalBoolArray(call.arg(1)).contains(false);

  /** @see BuiltIn#CARD */
  private static final Applicable.IntImpl CARD = (ev, call) ->
      ev.evalIntSet(call.arg(0)).card();

  /** @see BuiltIn#SET2ARRAY */
  private static final Applicable.ExpImpl SET2ARRAY = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    if (!s.isFinite()) {
      throw new EvalException("set2array: set is infinite", call.pos);
    }
    final List<Ast.Exp> list = new ArrayList<>();
    for (IntVal v : s.values()) {
      list.add(ast.intLiteral(call.pos, v));
    }
    return ast.arrayLiteral(call.pos, Type.PAR_INT, list,
        ImmutableIntArray.of(1, list.size()));
  };

  /** @see BuiltIn#ARRAY_UNION */
  private static final Applicable.IntSetImpl ARRAY_UNION = (ev, call) -> {
    IntSetVal s = IntSetVal.EMPTY;
    for (IntSetVal s1 : ev.evalIntSetArray(call.arg(0))) {
      s = s.union(s1);
    }
    return s;
  };

  /** @see BuiltIn#ARRAY_INTERSECT */
  private static final Applicable.IntSetImpl ARRAY_INTERSECT = (ev, call) -> {
    final List<IntSetVal> list = ev.evalIntSetArray(call.arg(0));
    if (list.isEmpty()) {
      return IntSetVal.EMPTY;
    }
    IntSetVal s = list.get(0);
    for (IntSetVal s1 : list) {
      s = s.intersect(s1);
    }
    return s;
  };

  /** @see BuiltIn#HAS_BOUNDS_INT */
  private static final Applicable.BoolImpl HAS_BOUNDS_INT = (ev, call) ->
      BoundsComputer.hasBoundsInt(ev, call.arg(0));

  /** @see BuiltIn#HAS_BOUNDS_FLOAT */
  private static final Applicable.BoolImpl HAS_BOUNDS_FLOAT = (ev, call) ->
      BoundsComputer.hasBoundsFloat(ev, call.arg(0));

  /** @see BuiltIn#LB_INT */
  private static final Applicable.IntImpl LB_INT = (ev, call) ->
      BoundsComputer.lbInt(ev, call.arg(0));

  /** @see BuiltIn#UB_INT */
  private static final Applicable.IntImpl UB_INT = (ev, call) ->
      BoundsComputer.ubInt(ev, call.arg(0));

  /** @see BuiltIn#LB_FLOAT */
  private static final Applicable.FloatImpl LB_FLOAT = (ev, call) ->
      BoundsComputer.lbFloat(ev, call.arg(0), call.pos);

  /** @see BuiltIn#UB_FLOAT */
  private static final Applicable.FloatImpl UB_FLOAT = (ev, call) ->
      BoundsComputer.ubFloat(ev, call.arg(0), call.pos);

  /** @see BuiltIn#LB_SET */
  private static final Applicable.IntSetImpl LB_SET = (ev, call) ->
      BoundsComputer.lbSet(ev, call.arg(0));

  /** @see BuiltIn#UB_SET */
  private static final Applicable.IntSetImpl UB_SET = (ev, call) ->
      BoundsComputer.ubSet(ev, call.arg(0), call.pos);

  /** @see BuiltIn#HAS_UB_SET */
  private static final Applicable.BoolImpl HAS_UB_SET = (ev, call) ->
      BoundsComputer.hasUbSet(ev, call.arg(0));

  /** @see BuiltIn#LB_ARRAY_INT */
  private static final Applicable.IntImpl LB_ARRAY_INT = (ev, call) ->
      BoundsComputer.lbArrayInt(ev, call.arg(0), call.pos);

  /** @see BuiltIn#UB_ARRAY_INT */
  private static final Applicable.IntImpl UB_ARRAY_INT = (ev, call) ->
      BoundsComputer.ubArrayInt(ev, call.arg(0), call.pos);

  /** @see BuiltIn#LB_ARRAY_FLOAT */
  private static final Applicable.FloatImpl LB_ARRAY_FLOAT = (ev, call) ->
      BoundsComputer.lbArrayFloat(ev, call.arg(0), call.pos);

  /** @see BuiltIn#UB_ARRAY_FLOAT */
  private static final Applicable.FloatImpl UB_ARRAY_FLOAT = (ev, call) ->
      BoundsComputer.ubArrayFloat(ev, call.arg(0), call.pos);

  /** @see BuiltIn#UB_ARRAY_SET */
  private static final Applicable.IntSetImpl UB_ARRAY_SET = (ev, call) ->
      BoundsComputer.ubArraySet(ev, call.arg(0), call.pos);

  /** @see BuiltIn#DOM */
  private static final Applicable.IntSetImpl DOM = (ev, call) ->
      BoundsComputer.dom(ev, call.arg(0));

  /** @see BuiltIn#DOM_ARRAY */
  private static final Applicable.IntSetImpl DOM_ARRAY = (ev, call) ->
      BoundsComputer.domArray(ev, call.arg(0));

  /** @see BuiltIn#DOM_BOUNDS_ARRAY */
  private static final Applicable.IntSetImpl DOM_BOUNDS_ARRAY = (ev, call) ->
      BoundsComputer.domBoundsArray(ev, call.arg(0));

  /** @see BuiltIn#COMPUTE_DIV_BOUNDS */
  private static final Applicable.IntSetImpl COMPUTE_DIV_BOUNDS =
      (ev, call) -> {
        final Bounds<IntVal> b =
            BoundsComputer.divBounds(
                BoundsComputer.intBounds(ev, call.arg(0)),
                BoundsComputer.intBounds(ev, call.arg(1)), call.pos);
        return IntSetVal.range(b.lower, b.upper);
      };

  /** @see BuiltIn#IS_FIXED */
  private static final Applicable.BoolImpl IS_FIXED = (ev, call) ->
      FixedValues.isFixed(ev, call.arg(0));

  /** @see BuiltIn#IS_FIXED_ARRAY */
  private static final Applicable.BoolImpl IS_FIXED_ARRAY = (ev, call) ->
      FixedValues.isFixedArray(ev, call.arg(0));

  /** @see BuiltIn#FIX */
  private static final Applicable.ExpImpl FIX = (ev, call) ->
      FixedValues.fix(ev, call.arg(0));

  /** @see BuiltIn#FIX_ARRAY */
  private static final Applicable.ExpImpl FIX_ARRAY = (ev, call) ->
      FixedValues.fixArray(ev, call.arg(0));

  /** @see BuiltIn#DEOPT */
  private static final Applicable.ExpImpl DEOPT = (ev, call) ->
      FixedValues.deopt(ev, call.arg(0), call.pos);

  /** @see BuiltIn#OCCURS */
  private static final Applicable.BoolImpl OCCURS = (ev, call) ->
      FixedValues.occurs(ev, call.arg(0));

  /** @see BuiltIn#LENGTH */
  private static final Applicable.IntImpl LENGTH = (ev, call) ->
      IntVal.of(ev.evalArray(call.arg(0)).size());

  /** Returns an implementation of {@code index_set_KofN}; {@code k} is
   * 1-based. */
  private static Applicable.IntSetImpl indexSet(int k, int n) {
    return (ev, call) ->
        ArrayReshaper.indexSet(ev, call.arg(0), k - 1, n, call.pos);
  }

  /** @see BuiltIn#INDEX_SETS_AGREE */
  private static final Applicable.BoolImpl INDEX_SETS_AGREE = (ev, call) ->
      ArrayReshaper.indexSetsAgree(ev.evalArray(call.arg(0)),
          ev.evalArray(call.arg(1)));

  /** @see BuiltIn#ARRAY1D_LIST */
  private static final Applicable.ExpImpl ARRAY1D_LIST = (ev, call) ->
      ArrayReshaper.array1d(ev.evalArray(call.arg(0)), call.pos);

  /** Returns an implementation of {@code arrayNd} with {@code n} index
   * sets. */
  private static Applicable.ExpImpl arrayNd(int n) {
    return (ev, call) -> {
      final List<IntSetVal> indexSets = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        indexSets.add(ev.evalIntSet(call.arg(i)));
      }
      return ArrayReshaper.reshape(ev.evalArray(call.arg(n)), indexSets,
          call.pos);
    };
  }

  /** @see BuiltIn#ARRAYXD */
  private static final Applicable.ExpImpl ARRAYXD = (ev, call) ->
      ArrayReshaper.arrayXd(ev.evalArray(call.arg(0)),
          ev.evalArray(call.arg(1)), call.pos);

  /** Returns an implementation of {@code slice_Nd}, whose result has
   * {@code n} dimensions. */
  private static Applicable.ExpImpl slice(int n) {
    return (ev, call) -> {
      final Ast.ArrayLiteral source = ev.evalArray(call.arg(0));
      final List<IntSetVal> selectors = ev.evalIntSetArray(call.arg(1));
      final List<IntSetVal> indexSets = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        indexSets.add(ev.evalIntSet(call.arg(i + 2)));
      }
      return ArrayReshaper.slice(source, selectors, indexSets, call.pos);
    };
  }

  /** Implements {@code sort} for int, float and bool arrays. The sort is
   * stable.
   *
   * @see BuiltIn#SORT_INT
   * @see BuiltIn#SORT_FLOAT
   * @see BuiltIn#SORT_BOOL */
  private static final Applicable.ExpImpl SORT = (ev, call) -> {
    final Ast.ArrayLiteral a = ev.evalArray(call.arg(0));
    final List<Ast.Exp> list = new ArrayList<>(a.elements);
    switch (a.type.base) {
      case INT:
        list.sort(Comparator.comparing(ev::evalInt));
        break;
      case FLOAT:
        list.sort(Comparator.comparingDouble(ev::evalFloat));
        break;
      case BOOL:
        list.sort(Comparator.comparing(ev::evalBool));
        break;
      default:
        throw new EvalException("unsupported type for sorting",
            call.arg(0).pos);
    }
    return ast.arrayLiteral(call.pos, a.type.elementType(), list,
        ImmutableIntArray.of(1, list.size()));
  };

  /** @see BuiltIn#SORT_BY_INT */
  private static final Applicable.ExpImpl SORT_BY_INT = (ev, call) ->
      sortBy(ev.evalArray(call.arg(0)), ev.evalIntArray(call.arg(1)), call);

  /** @see BuiltIn#SORT_BY_FLOAT */
  private static final Applicable.ExpImpl SORT_BY_FLOAT = (ev, call) ->
      sortBy(ev.evalArray(call.arg(0)), ev.evalFloatArray(call.arg(1)),
          call);

  private static <K extends Comparable<K>> Ast.ArrayLiteral sortBy(
      Ast.ArrayLiteral a, List<K> keys, Ast.Call call) {
    if (keys.size() != a.size()) {
      throw new EvalException("sort_by: array and keys have different "
          + "lengths", call.pos);
    }
    final List<Integer> order = new ArrayList<>();
    for (int i = 0; i < a.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparing(keys::get));
    final List<Ast.Exp> list = new ArrayList<>();
    for (int i : order) {
      list.add(a.get(i));
    }
    return ast.arrayLiteral(call.pos, a.type.elementType(), list,
        ImmutableIntArray.of(1, list.size()));
  }

  /** @see BuiltIn#SHOW */
  private static final Applicable.StringImpl SHOW = (ev, call) ->
      Formatter.show(ev, call.arg(0));

  /** @see BuiltIn#SHOW_JSON */
  private static final Applicable.StringImpl SHOW_JSON = (ev, call) ->
      Formatter.showJson(ev, call.arg(0));

  /** @see BuiltIn#SHOW_DZN_ID */
  private static final Applicable.StringImpl SHOW_DZN_ID = (ev, call) ->
      Formatter.showDznId(ev.evalString(call.arg(0)));

  /** @see BuiltIn#SHOW_INT */
  private static final Applicable.StringImpl SHOW_INT = (ev, call) ->
      Formatter.showInt(ev, ev.evalInt(call.arg(0)).toInt(), call.arg(1));

  /** @see BuiltIn#SHOW_FLOAT */
  private static final Applicable.StringImpl SHOW_FLOAT = (ev, call) ->
      Formatter.showFloat(ev, ev.evalInt(call.arg(0)).toInt(),
          ev.evalInt(call.arg(1)).toInt(), call.arg(2), call.arg(1).pos);

  /** @see BuiltIn#FORMAT */
  private static final Applicable.StringImpl FORMAT = (ev, call) ->
      Formatter.format(ev, 0, null, call.arg(0), call.pos);

  /** @see BuiltIn#FORMAT_WIDTH */
  private static final Applicable.StringImpl FORMAT_WIDTH = (ev, call) ->
      Formatter.format(ev, ev.evalInt(call.arg(0)).toInt(), null,
          call.arg(1), call.pos);

  /** @see BuiltIn#FORMAT_WIDTH_PREC */
  private static final Applicable.StringImpl FORMAT_WIDTH_PREC = (ev, call) ->
      Formatter.format(ev, ev.evalInt(call.arg(0)).toInt(),
          ev.evalInt(call.arg(1)).toInt(), call.arg(2), call.arg(1).pos);

  /** @see BuiltIn#FORMAT_JUSTIFY_STRING */
  private static final Applicable.StringImpl FORMAT_JUSTIFY_STRING =
      (ev, call) -> Formatter.justify(ev.evalInt(call.arg(0)).toInt(),
          ev.evalString(call.arg(1)));

  /** @see BuiltIn#STRING_LENGTH */
  private static final Applicable.IntImpl STRING_LENGTH = (ev, call) ->
      IntVal.of(ev.evalString(call.arg(0)).length());

  /** @see BuiltIn#CONCAT */
  private static final Applicable.StringImpl CONCAT = (ev, call) ->
      String.join("", ev.evalStringArray(call.arg(0)));

  /** @see BuiltIn#JOIN */
  private static final Applicable.StringImpl JOIN = (ev, call) ->
      String.join(ev.evalString(call.arg(0)),
          ev.evalStringArray(call.arg(1)));

  /** @see BuiltIn#FILE_PATH */
  private static final Applicable.StringImpl FILE_PATH = (ev, call) ->
      call.pos.directory();

  /** @see BuiltIn#OUTPUT_JSON_PARAMETERS */
  private static final Applicable.StringImpl OUTPUT_JSON_PARAMETERS =
      (ev, call) -> Formatter.outputJsonParameters(ev);

  /** @see BuiltIn#ASSERT */
  private static final Applicable.BoolImpl ASSERT = (ev, call) -> {
    checkAssertion(ev, call);
    return true;
  };

  /** @see BuiltIn#ASSERT_EXP */
  private static final Applicable.ExpImpl ASSERT_EXP = (ev, call) -> {
    checkAssertion(ev, call);
    return call.arg(2);
  };

  private static void checkAssertion(Evaluator ev, Ast.Call call) {
    if (!ev.evalBool(call.arg(0))) {
      throw new AssertionFailureException("Assertion failed: "
          + ev.evalString(call.arg(1)), call.arg(0).pos);
    }
  }

  /** @see BuiltIn#ABORT */
  private static final Applicable.BoolImpl ABORT = (ev, call) -> {
    throw new AssertionFailureException("Abort: "
        + ev.evalString(call.arg(0)), call.arg(0).pos);
  };

  /** @see BuiltIn#TRACE */
  private static final Applicable.UnitImpl TRACE = (ev, call) ->
      trace(ev, Tracer.Stream.ERR, ev.evalString(call.arg(0)));

  /** @see BuiltIn#TRACE_EXP */
  private static final Applicable.ExpImpl TRACE_EXP = (ev, call) -> {
    trace(ev, Tracer.Stream.ERR, ev.evalString(call.arg(0)));
    return call.arg(1);
  };

  /** @see BuiltIn#TRACE_STDOUT */
  private static final Applicable.UnitImpl TRACE_STDOUT = (ev, call) ->
      trace(ev, Tracer.Stream.OUT, ev.evalString(call.arg(0)));

  /** @see BuiltIn#TRACE_STDOUT_EXP */
  private static final Applicable.ExpImpl TRACE_STDOUT_EXP = (ev, call) -> {
    trace(ev, Tracer.Stream.OUT, ev.evalString(call.arg(0)));
    return call.arg(1);
  };

  private static void trace(Evaluator ev, Tracer.Stream stream,
      String message) {
    switch (stream) {
      case OUT:
        ev.session.out.print(message);
        ev.session.out.flush();
        break;
      default:
        ev.session.err.print(message);
        ev.session.err.flush();
    }
    ev.session.tracer.onTrace(stream, message);
  }

  /** @see BuiltIn#MZN_IN_REDUNDANT_CONSTRAINT */
  private static final Applicable.BoolImpl MZN_IN_REDUNDANT_CONSTRAINT =
      (ev, call) -> ev.session.redundantConstraintDepth > 0;

  /** @see BuiltIn#MZN_COMPILER_VERSION */
  private static final Applicable.IntImpl MZN_COMPILER_VERSION =
      (ev, call) -> {
        final String version =
            Prop.COMPILER_VERSION.stringValue(ev.session.map);
        final String[] parts = version.split("\\.");
        if (parts.length != 3) {
          throw new EvalException("invalid compiler version " + version,
              call.pos);
        }
        try {
          return IntVal.of(Integer.parseInt(parts[0]) * 10_000L
              + Integer.parseInt(parts[1]) * 1_000L
              + Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
          throw new EvalException("invalid compiler version " + version,
              call.pos, e);
        }
      };

  /** @see BuiltIn#TO_ENUM */
  private static final Applicable.IntImpl TO_ENUM = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    final IntVal v = ev.evalInt(call.arg(1));
    if (!s.contains(v)) {
      throw undefined("value outside of enum range", call);
    }
    return v;
  };

  /** @see BuiltIn#ENUM_NEXT */
  private static final Applicable.IntImpl ENUM_NEXT = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    final IntVal v = ev.evalInt(call.arg(1)).plus(1);
    if (!s.contains(v)) {
      throw undefined("value outside of enum range", call);
    }
    return v;
  };

  /** @see BuiltIn#ENUM_PREV */
  private static final Applicable.IntImpl ENUM_PREV = (ev, call) -> {
    final IntSetVal s = ev.evalIntSet(call.arg(0));
    final IntVal v = ev.evalInt(call.arg(1)).plus(-1);
    if (!s.contains(v)) {
      throw undefined("value outside of enum range", call);
    }
    return v;
  };

  /** @see BuiltIn#NORMAL */
  private static final Applicable.FloatImpl NORMAL = (ev, call) ->
      ev.session.sampler().normal(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#UNIFORM_INT */
  private static final Applicable.IntImpl UNIFORM_INT = (ev, call) ->
      ev.session.sampler().uniform(ev.evalInt(call.arg(0)),
          ev.evalInt(call.arg(1)), call.pos);

  /** @see BuiltIn#UNIFORM_FLOAT */
  private static final Applicable.FloatImpl UNIFORM_FLOAT = (ev, call) ->
      ev.session.sampler().uniform(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#POISSON */
  private static final Applicable.IntImpl POISSON = (ev, call) ->
      ev.session.sampler().poisson(ev.evalFloat(call.arg(0)), call.pos);

  /** @see BuiltIn#GAMMA */
  private static final Applicable.FloatImpl GAMMA = (ev, call) ->
      ev.session.sampler().gamma(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#WEIBULL */
  private static final Applicable.FloatImpl WEIBULL = (ev, call) ->
      ev.session.sampler().weibull(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#EXPONENTIAL */
  private static final Applicable.FloatImpl EXPONENTIAL = (ev, call) ->
      ev.session.sampler().exponential(ev.evalFloat(call.arg(0)), call.pos);

  /** @see BuiltIn#LOGNORMAL */
  private static final Applicable.FloatImpl LOGNORMAL = (ev, call) ->
      ev.session.sampler().lognormal(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#CHISQUARED */
  private static final Applicable.FloatImpl CHISQUARED = (ev, call) ->
      ev.session.sampler().chiSquared(ev.evalFloat(call.arg(0)), call.pos);

  /** @see BuiltIn#CAUCHY */
  private static final Applicable.FloatImpl CAUCHY = (ev, call) ->
      ev.session.sampler().cauchy(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#FDISTRIBUTION */
  private static final Applicable.FloatImpl FDISTRIBUTION = (ev, call) ->
      ev.session.sampler().fDistribution(ev.evalFloat(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#TDISTRIBUTION */
  private static final Applicable.FloatImpl TDISTRIBUTION = (ev, call) ->
      ev.session.sampler().tDistribution(ev.evalFloat(call.arg(0)),
          call.pos);

  /** @see BuiltIn#DISCRETE_DISTRIBUTION */
  private static final Applicable.IntImpl DISCRETE_DISTRIBUTION =
      (ev, call) -> ev.session.sampler()
          .discrete(ev.evalIntArray(call.arg(0)), call.pos);

  /** @see BuiltIn#BERNOULLI */
  private static final Applicable.BoolImpl BERNOULLI = (ev, call) ->
      ev.session.sampler().bernoulli(ev.evalFloat(call.arg(0)), call.pos);

  /** @see BuiltIn#BINOMIAL */
  private static final Applicable.IntImpl BINOMIAL = (ev, call) ->
      ev.session.sampler().binomial(ev.evalInt(call.arg(0)),
          ev.evalFloat(call.arg(1)), call.pos);

  /** @see BuiltIn#REGULAR */
  private static final Applicable.ExpImpl REGULAR = (ev, call) -> {
    throw new EvalException("regular expressions are not supported by "
        + "this backend", call.pos);
  };

  private static ResultUndefinedException undefined(String message,
      Ast.Call call) {
    return new ResultUndefinedException(message, call.pos);
  }

  /** Map of all built-in functions to their implementations. */
  public static final ImmutableMap<BuiltIn, Applicable> BUILT_IN_VALUES =
      new Builder()
          .put(BuiltIn.MIN_INT_ARRAY, MIN_INT_ARRAY)
          .put(BuiltIn.MAX_INT_ARRAY, MAX_INT_ARRAY)
          .put(BuiltIn.MIN_INT, MIN_INT)
          .put(BuiltIn.MAX_INT, MAX_INT)
          .put(BuiltIn.MIN_FLOAT_ARRAY, MIN_FLOAT_ARRAY)
          .put(BuiltIn.MAX_FLOAT_ARRAY, MAX_FLOAT_ARRAY)
          .put(BuiltIn.MIN_FLOAT, MIN_FLOAT)
          .put(BuiltIn.MAX_FLOAT, MAX_FLOAT)
          .put(BuiltIn.MIN_SET, MIN_SET)
          .put(BuiltIn.MAX_SET, MAX_SET)
          .put(BuiltIn.ARG_MIN_INT, ARG_MIN_INT)
          .put(BuiltIn.ARG_MAX_INT, ARG_MAX_INT)
          .put(BuiltIn.ARG_MIN_FLOAT, ARG_MIN_FLOAT)
          .put(BuiltIn.ARG_MAX_FLOAT, ARG_MAX_FLOAT)
          .put(BuiltIn.SUM_INT, SUM_INT)
          .put(BuiltIn.SUM_FLOAT, SUM_FLOAT)
          .put(BuiltIn.PRODUCT_INT, PRODUCT_INT)
          .put(BuiltIn.PRODUCT_FLOAT, PRODUCT_FLOAT)
          .put(BuiltIn.ABS_INT, ABS_INT)
          .put(BuiltIn.ABS_FLOAT, ABS_FLOAT)
          .put(BuiltIn.INT2FLOAT, INT2FLOAT)
          .put(BuiltIn.BOOL2INT, BOOL2INT)
          .put(BuiltIn.CEIL, CEIL)
          .put(BuiltIn.FLOOR, FLOOR)
          .put(BuiltIn.ROUND, ROUND)
          .put(BuiltIn.POW_INT, POW_INT)
          .put(BuiltIn.POW_FLOAT, POW_FLOAT)
          .put(BuiltIn.SQRT, SQRT)
          .put(BuiltIn.EXP, EXP)
          .put(BuiltIn.LN, LN)
          .put(BuiltIn.LOG10, LOG10)
          .put(BuiltIn.LOG2, LOG2)
          .put(BuiltIn.LOG, LOG)
          .put(BuiltIn.SIN, SIN)
          .put(BuiltIn.COS, COS)
          .put(BuiltIn.TAN, TAN)
          .put(BuiltIn.ASIN, ASIN)
          .put(BuiltIn.ACOS, ACOS)
          .put(BuiltIn.ATAN, ATAN)
          .put(BuiltIn.FORALL, FORALL)
          .put(BuiltIn.EXISTS, EXISTS)
          .put(BuiltIn.XORALL, XORALL)
          .put(BuiltIn.IFFALL, IFFALL)
          .put(BuiltIn.CLAUSE, CLAUSE)
          .put(BuiltIn.CARD, CARD)
          .put(BuiltIn.SET2ARRAY, SET2ARRAY)
          .put(BuiltIn.ARRAY_UNION, ARRAY_UNION)
          .put(BuiltIn.ARRAY_INTERSECT, ARRAY_INTERSECT)
          .put(BuiltIn.HAS_BOUNDS_INT, HAS_BOUNDS_INT)
          .put(BuiltIn.HAS_BOUNDS_FLOAT, HAS_BOUNDS_FLOAT)
          .put(BuiltIn.LB_INT, LB_INT)
          .put(BuiltIn.UB_INT, UB_INT)
          .put(BuiltIn.LB_FLOAT, LB_FLOAT)
          .put(BuiltIn.UB_FLOAT, UB_FLOAT)
          .put(BuiltIn.LB_SET, LB_SET)
          .put(BuiltIn.UB_SET, UB_SET)
          .put(BuiltIn.HAS_UB_SET, HAS_UB_SET)
          .put(BuiltIn.LB_ARRAY_INT, LB_ARRAY_INT)
          .put(BuiltIn.UB_ARRAY_INT, UB_ARRAY_INT)
          .put(BuiltIn.LB_ARRAY_FLOAT, LB_ARRAY_FLOAT)
          .put(BuiltIn.UB_ARRAY_FLOAT, UB_ARRAY_FLOAT)
          .put(BuiltIn.UB_ARRAY_SET, UB_ARRAY_SET)
          .put(BuiltIn.DOM, DOM)
          .put(BuiltIn.DOM_ARRAY, DOM_ARRAY)
          .put(BuiltIn.DOM_BOUNDS_ARRAY, DOM_BOUNDS_ARRAY)
          .put(BuiltIn.COMPUTE_DIV_BOUNDS, COMPUTE_DIV_BOUNDS)
          .put(BuiltIn.IS_FIXED, IS_FIXED)
          .put(BuiltIn.IS_FIXED_ARRAY, IS_FIXED_ARRAY)
          .put(BuiltIn.FIX, FIX)
          .put(BuiltIn.FIX_ARRAY, FIX_ARRAY)
          .put(BuiltIn.DEOPT, DEOPT)
          .put(BuiltIn.OCCURS, OCCURS)
          .put(BuiltIn.LENGTH, LENGTH)
          .put(BuiltIn.INDEX_SET, indexSet(1, 1))
          .put(BuiltIn.INDEX_SET_1OF2, indexSet(1, 2))
          .put(BuiltIn.INDEX_SET_2OF2, indexSet(2, 2))
          .put(BuiltIn.INDEX_SET_1OF3, indexSet(1, 3))
          .put(BuiltIn.INDEX_SET_2OF3, indexSet(2, 3))
          .put(BuiltIn.INDEX_SET_3OF3, indexSet(3, 3))
          .put(BuiltIn.INDEX_SET_1OF4, indexSet(1, 4))
          .put(BuiltIn.INDEX_SET_2OF4, indexSet(2, 4))
          .put(BuiltIn.INDEX_SET_3OF4, indexSet(3, 4))
          .put(BuiltIn.INDEX_SET_4OF4, indexSet(4, 4))
          .put(BuiltIn.INDEX_SET_1OF5, indexSet(1, 5))
          .put(BuiltIn.INDEX_SET_2OF5, indexSet(2, 5))
          .put(BuiltIn.INDEX_SET_3OF5, indexSet(3, 5))
          .put(BuiltIn.INDEX_SET_4OF5, indexSet(4, 5))
          .put(BuiltIn.INDEX_SET_5OF5, indexSet(5, 5))
          .put(BuiltIn.INDEX_SET_1OF6, indexSet(1, 6))
          .put(BuiltIn.INDEX_SET_2OF6, indexSet(2, 6))
          .put(BuiltIn.INDEX_SET_3OF6, indexSet(3, 6))
          .put(BuiltIn.INDEX_SET_4OF6, indexSet(4, 6))
          .put(BuiltIn.INDEX_SET_5OF6, indexSet(5, 6))
          .put(BuiltIn.INDEX_SET_6OF6, indexSet(6, 6))
          .put(BuiltIn.INDEX_SETS_AGREE, INDEX_SETS_AGREE)
          .put(BuiltIn.ARRAY1D_LIST, ARRAY1D_LIST)
          .put(BuiltIn.ARRAY1D, arrayNd(1))
          .put(BuiltIn.ARRAY2D, arrayNd(2))
          .put(BuiltIn.ARRAY3D, arrayNd(3))
          .put(BuiltIn.ARRAY4D, arrayNd(4))
          .put(BuiltIn.ARRAY5D, arrayNd(5))
          .put(BuiltIn.ARRAY6D, arrayNd(6))
          .put(BuiltIn.ARRAYXD, ARRAYXD)
          .put(BuiltIn.SLICE_1D, slice(1))
          .put(BuiltIn.SLICE_2D, slice(2))
          .put(BuiltIn.SLICE_3D, slice(3))
          .put(BuiltIn.SLICE_4D, slice(4))
          .put(BuiltIn.SLICE_5D, slice(5))
          .put(BuiltIn.SLICE_6D, slice(6))
          .put(BuiltIn.SORT_INT, SORT)
          .put(BuiltIn.SORT_FLOAT, SORT)
          .put(BuiltIn.SORT_BOOL, SORT)
          .put(BuiltIn.SORT_BY_INT, SORT_BY_INT)
          .put(BuiltIn.SORT_BY_FLOAT, SORT_BY_FLOAT)
          .put(BuiltIn.SHOW, SHOW)
          .put(BuiltIn.SHOW_ARRAY, SHOW)
          .put(BuiltIn.SHOW_JSON, SHOW_JSON)
          .put(BuiltIn.SHOW_JSON_ARRAY, SHOW_JSON)
          .put(BuiltIn.SHOW_DZN_ID, SHOW_DZN_ID)
          .put(BuiltIn.SHOW_INT, SHOW_INT)
          .put(BuiltIn.SHOW_FLOAT, SHOW_FLOAT)
          .put(BuiltIn.FORMAT, FORMAT)
          .put(BuiltIn.FORMAT_WIDTH, FORMAT_WIDTH)
          .put(BuiltIn.FORMAT_WIDTH_PREC, FORMAT_WIDTH_PREC)
          .put(BuiltIn.FORMAT_JUSTIFY_STRING, FORMAT_JUSTIFY_STRING)
          .put(BuiltIn.STRING_LENGTH, STRING_LENGTH)
          .put(BuiltIn.CONCAT, CONCAT)
          .put(BuiltIn.JOIN, JOIN)
          .put(BuiltIn.FILE_PATH, FILE_PATH)
          .put(BuiltIn.OUTPUT_JSON_PARAMETERS, OUTPUT_JSON_PARAMETERS)
          .put(BuiltIn.ASSERT, ASSERT)
          .put(BuiltIn.ASSERT_EXP, ASSERT_EXP)
          .put(BuiltIn.ABORT, ABORT)
          .put(BuiltIn.TRACE, TRACE)
          .put(BuiltIn.TRACE_EXP, TRACE_EXP)
          .put(BuiltIn.TRACE_STDOUT, TRACE_STDOUT)
          .put(BuiltIn.TRACE_STDOUT_EXP, TRACE_STDOUT_EXP)
          .put(BuiltIn.MZN_IN_REDUNDANT_CONSTRAINT,
              MZN_IN_REDUNDANT_CONSTRAINT)
          .put(BuiltIn.MZN_COMPILER_VERSION, MZN_COMPILER_VERSION)
          .put(BuiltIn.TO_ENUM, TO_ENUM)
          .put(BuiltIn.ENUM_NEXT, ENUM_NEXT)
          .put(BuiltIn.ENUM_PREV, ENUM_PREV)
          .put(BuiltIn.NORMAL, NORMAL)
          .put(BuiltIn.UNIFORM_INT, UNIFORM_INT)
          .put(BuiltIn.UNIFORM_FLOAT, UNIFORM_FLOAT)
          .put(BuiltIn.POISSON, POISSON)
          .put(BuiltIn.GAMMA, GAMMA)
          .put(BuiltIn.WEIBULL, WEIBULL)
          .put(BuiltIn.EXPONENTIAL, EXPONENTIAL)
          .put(BuiltIn.LOGNORMAL, LOGNORMAL)
          .put(BuiltIn.CHISQUARED, CHISQUARED)
          .put(BuiltIn.CAUCHY, CAUCHY)
          .put(BuiltIn.FDISTRIBUTION, FDISTRIBUTION)
          .put(BuiltIn.TDISTRIBUTION, TDISTRIBUTION)
          .put(BuiltIn.DISCRETE_DISTRIBUTION, DISCRETE_DISTRIBUTION)
          .put(BuiltIn.BERNOULLI, BERNOULLI)
          .put(BuiltIn.BINOMIAL, BINOMIAL)
          .put(BuiltIn.REGULAR, REGULAR)
          .build();

  /** Registers the implementation of every built-in function.
   *
   * <p>A function that only some backends declare, such as
   * {@link BuiltIn#REGULAR}, is skipped if the model does not declare it. */
  public static void registerAll(Registry.Builder builder) {
    for (Map.Entry<BuiltIn, Applicable> entry : BUILT_IN_VALUES.entrySet()) {
      final BuiltIn builtIn = entry.getKey();
      builder.register(builtIn.mznName, builtIn.decl.paramTypes,
          entry.getValue(), builtIn.backendOnly);
    }
  }

  /** Accumulates implementations, and checks that every built-in has exactly
   * one. */
  private static class Builder {
    final Map<BuiltIn, Applicable> map = new EnumMap<>(BuiltIn.class);

    Builder put(BuiltIn builtIn, Applicable applicable) {
      if (map.put(builtIn, applicable) != null) {
        throw new AssertionError("duplicate implementation of " + builtIn);
      }
      return this;
    }

    ImmutableMap<BuiltIn, Applicable> build() {
      final Set<BuiltIn> missing = EnumSet.allOf(BuiltIn.class);
      missing.removeAll(map.keySet());
      if (!missing.isEmpty()) {
        throw new AssertionError("no implementation for " + missing);
      }
      return Maps.immutableEnumMap(map);
    }
  }
}

// End Codes.java
