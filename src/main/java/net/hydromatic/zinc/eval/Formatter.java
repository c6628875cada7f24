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

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.google.common.base.Strings;
import com.google.common.collect.Range;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.regex.Pattern;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts values to text.
 *
 * <p>{@link #show} renders a value in the syntax of the modeling language,
 * {@link #showJson} as JSON, and {@link #format} as justified text with
 * fixed-point floats.
 *
 * <p>A decision variable that is not fixed is rendered as the text of its
 * expression.
 */
public abstract class Formatter {
  private Formatter() {}

  private static final Pattern DZN_ID =
      Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  /** Converts a float to a string, as it would appear in a model; for
   * example, "3.0", "1.5e-07", "infinity". */
  public static String showFloat(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "infinity" : "-infinity";
    }
    return Double.toString(d).replace('E', 'e');
  }

  /** Converts a string to a quoted string literal. */
  public static String quote(String s) {
    final StringBuilder b = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        default:
          b.append(c);
      }
    }
    return b.append('"').toString();
  }

  /** Renders an expression, fixed or not, in the syntax of the modeling
   * language. An array is rendered as a flat list of its elements. */
  public static String show(Evaluator ev, Ast.Exp e) {
    final Ast.Exp v = ev.evalPar(e);
    if (v instanceof Ast.ArrayLiteral) {
      final StringBuilder b = new StringBuilder("[");
      final List<Ast.Exp> elements = ((Ast.ArrayLiteral) v).elements;
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(elements.get(i));
      }
      return b.append("]").toString();
    }
    return v.toString();
  }

  /**
   * Renders an expression as JSON.
   *
   * <p>An array becomes nested JSON arrays, one level per dimension; a set
   * becomes an object {@code {"set":[...]}} whose elements are single values
   * and two-element ranges; the absent value becomes {@code null}. An
   * expression that is not fixed becomes a JSON string containing its
   * text.
   */
  public static String showJson(Evaluator ev, Ast.Exp e) {
    final Ast.Exp v = ev.evalPar(e);
    if (!(v instanceof Ast.ArrayLiteral)) {
      return showJsonScalar(v);
    }
    final Ast.ArrayLiteral a = (Ast.ArrayLiteral) v;
    if (a.size() == 0) {
      return "[]";
    }
    // strides[i] is the number of elements in one sub-array of dimension i
    final int n = a.dimCount();
    final int[] strides = new int[n];
    int stride = 1;
    for (int i = n - 1; i >= 0; i--) {
      stride *= a.max(i) - a.min(i) + 1;
      strides[i] = stride;
    }
    final StringBuilder b = new StringBuilder();
    for (int j = 0; j < a.size(); j++) {
      if (j > 0) {
        b.append(',');
      }
      for (int i = 0; i < n; i++) {
        if (j % strides[i] == 0) {
          b.append('[');
        }
      }
      b.append(showJsonScalar(ev.evalPar(a.get(j))));
      for (int i = n - 1; i >= 0; i--) {
        if ((j + 1) % strides[i] == 0) {
          b.append(']');
        }
      }
    }
    return b.toString();
  }

  private static String showJsonScalar(Ast.Exp v) {
    switch (v.op) {
      case INT_LITERAL:
        return jsonInt(((Ast.IntLiteral) v).value, v.pos);
      case FLOAT_LITERAL:
        return jsonFloat(((Ast.FloatLiteral) v).value, v.pos);
      case BOOL_LITERAL:
        return ((Ast.BoolLiteral) v).value ? "true" : "false";
      case STRING_LITERAL:
        return jsonString(((Ast.StringLiteral) v).value);
      case ABSENT:
        return "null";
      case SET_LITERAL:
        final Ast.SetLiteral set = (Ast.SetLiteral) v;
        final StringBuilder b = new StringBuilder("{\"set\":[");
        if (set.intSet != null) {
          int i = 0;
          for (Range<IntVal> range : set.intSet.ranges) {
            if (i++ > 0) {
              b.append(',');
            }
            final String lower = jsonInt(range.lowerEndpoint(), v.pos);
            if (range.lowerEndpoint().equals(range.upperEndpoint())) {
              b.append(lower);
            } else {
              b.append('[').append(lower).append(',')
                  .append(jsonInt(range.upperEndpoint(), v.pos)).append(']');
            }
          }
        } else if (set.floatSet != null) {
          int i = 0;
          for (Range<Double> range : set.floatSet.ranges) {
            if (i++ > 0) {
              b.append(',');
            }
            final String lower = jsonFloat(range.lowerEndpoint(), v.pos);
            if (range.lowerEndpoint().equals(range.upperEndpoint())) {
              b.append(lower);
            } else {
              b.append('[').append(lower).append(',')
                  .append(jsonFloat(range.upperEndpoint(), v.pos)).append(']');
            }
          }
        } else {
          return jsonString(v.toString());
        }
        return b.append("]}").toString();
      default:
        return jsonString(v.toString());
    }
  }

  private static String jsonInt(IntVal i, Pos pos) {
    if (!i.isFinite()) {
      throw new EvalException("cannot represent " + i + " in JSON", pos);
    }
    return i.toString();
  }

  private static String jsonFloat(double d, Pos pos) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new EvalException("cannot represent " + showFloat(d)
          + " in JSON", pos);
    }
    return showFloat(d);
  }

  private static String jsonString(String s) {
    return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(s))
        + '"';
  }

  /**
   * Formats a value.
   *
   * <p>An integer is justified to {@code width}. A float is printed in
   * fixed-point notation with {@code precision} digits after the point, or
   * {@link Prop#FLOAT_PRECISION} digits if precision is null, and justified.
   * Any other value is rendered by {@link #show}, truncated to
   * {@code precision} characters, and justified.
   *
   * @param width Width; if negative, the value is left-justified in
   *   {@code -width} characters; if zero, there is no padding
   * @param precision Precision, or null
   *
   * @throws EvalException if precision is negative
   */
  public static String format(Evaluator ev, int width,
      @Nullable Integer precision, Ast.Exp e, Pos pos) {
    if (precision != null && precision < 0) {
      throw new EvalException("output precision cannot be negative", pos);
    }
    final Ast.Exp v = ev.evalPar(e);
    switch (v.op) {
      case INT_LITERAL:
        return justify(width, v.toString());
      case FLOAT_LITERAL:
        final int digits = precision != null ? precision
            : Prop.FLOAT_PRECISION.intValue(ev.session.map);
        return justify(width, fixed(((Ast.FloatLiteral) v).value, digits));
      default:
        String s = show(ev, v);
        if (precision != null && precision < s.length()) {
          s = s.substring(0, precision);
        }
        return justify(width, s);
    }
  }

  /** Pads a string with spaces to {@code width} characters, on the left if
   * width is positive, on the right if negative. A string that is already
   * wide enough is returned unchanged. */
  public static String justify(int width, String s) {
    return width >= 0
        ? Strings.padStart(s, width, ' ')
        : Strings.padEnd(s, -width, ' ');
  }

  /** Prints a float in fixed-point notation with {@code digits} digits
   * after the point, rounding half to even. */
  public static String fixed(double d, int digits) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return showFloat(d);
    }
    final boolean negative = Double.doubleToRawLongBits(d) < 0;
    final String s = new BigDecimal(Math.abs(d))
        .setScale(digits, RoundingMode.HALF_EVEN)
        .toPlainString();
    return negative ? "-" + s : s;
  }

  /** Implements {@code show_int}: justifies a fixed integer, and renders any
   * other expression as text. */
  public static String showInt(Evaluator ev, int width, Ast.Exp e) {
    final Ast.Exp v = ev.evalPar(e);
    if (v.op == Op.INT_LITERAL) {
      return justify(width, v.toString());
    }
    return v.toString();
  }

  /** Implements {@code show_float}: prints a fixed float in fixed-point
   * notation, and renders any other expression as text.
   *
   * @throws EvalException if {@code digits} is negative */
  public static String showFloat(Evaluator ev, int width, int digits,
      Ast.Exp e, Pos pos) {
    final Ast.Exp v = ev.evalPar(e);
    if (v.op == Op.FLOAT_LITERAL) {
      if (digits < 0) {
        throw new EvalException(
            "number of digits in show_float cannot be negative", pos);
      }
      return justify(width, fixed(((Ast.FloatLiteral) v).value, digits));
    }
    return v.toString();
  }

  /** Renders a string as an identifier in a data file, quoting it if it is
   * not a valid identifier. */
  public static String showDznId(String s) {
    return DZN_ID.matcher(s).matches() ? s : "'" + s + "'";
  }

  /** Renders the output parameters of the model as a JSON object, one
   * member per parameter, in declaration order. */
  public static String outputJsonParameters(Evaluator ev) {
    final StringBuilder b = new StringBuilder("{\n");
    int i = 0;
    for (Ast.VarDecl decl : ev.session.registry.model.outputDecls()) {
      if (i++ > 0) {
        b.append(",\n");
      }
      b.append("  \"").append(decl.name).append("\" : ")
          .append(showJson(ev, ast.id(decl.pos, decl)));
    }
    return b.append("\n}\n").toString();
  }
}

// End Formatter.java
