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

import static net.hydromatic.zinc.type.Type.PAR_BOOL;
import static net.hydromatic.zinc.type.Type.PAR_FLOAT;
import static net.hydromatic.zinc.type.Type.PAR_INT;
import static net.hydromatic.zinc.type.Type.PAR_SET_INT;
import static net.hydromatic.zinc.type.Type.PAR_STRING;
import static net.hydromatic.zinc.type.Type.PAR_TOP;
import static net.hydromatic.zinc.type.Type.VAR_BOOL;
import static net.hydromatic.zinc.type.Type.VAR_FLOAT;
import static net.hydromatic.zinc.type.Type.VAR_INT;
import static net.hydromatic.zinc.type.Type.VAR_SET_INT;
import static net.hydromatic.zinc.type.Type.VAR_TOP;
import static net.hydromatic.zinc.type.Type.array;

import java.util.Arrays;
import net.hydromatic.zinc.type.Type;

/** Built-in functions.
 *
 * <p>Each constant is one overload: a function name, return type and
 * parameter types. Several constants may share a name. The implementation of
 * each is in {@link net.hydromatic.zinc.eval.Codes#BUILT_IN_VALUES}. */
public enum BuiltIn {
  /** Function "min", of type "array[$] of int: int". */
  MIN_INT_ARRAY("min", PAR_INT, array(PAR_INT)),

  /** Function "max", of type "array[$] of int: int". */
  MAX_INT_ARRAY("max", PAR_INT, array(PAR_INT)),

  /** Function "min", of type "(int, int): int". */
  MIN_INT("min", PAR_INT, PAR_INT, PAR_INT),

  /** Function "max", of type "(int, int): int". */
  MAX_INT("max", PAR_INT, PAR_INT, PAR_INT),

  MIN_FLOAT_ARRAY("min", PAR_FLOAT, array(PAR_FLOAT)),
  MAX_FLOAT_ARRAY("max", PAR_FLOAT, array(PAR_FLOAT)),
  MIN_FLOAT("min", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  MAX_FLOAT("max", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),

  /** Function "min", of type "set of int: int"; the least element of a
   * set. */
  MIN_SET("min", PAR_INT, PAR_SET_INT),

  /** Function "max", of type "set of int: int". */
  MAX_SET("max", PAR_INT, PAR_SET_INT),

  /** Function "arg_min", of type "array[int] of int: int"; the index of the
   * first occurrence of the minimum. */
  ARG_MIN_INT("arg_min", PAR_INT, array(1, PAR_INT)),
  ARG_MAX_INT("arg_max", PAR_INT, array(1, PAR_INT)),
  ARG_MIN_FLOAT("arg_min", PAR_INT, array(1, PAR_FLOAT)),
  ARG_MAX_FLOAT("arg_max", PAR_INT, array(1, PAR_FLOAT)),

  SUM_INT("sum", PAR_INT, array(PAR_INT)),
  SUM_FLOAT("sum", PAR_FLOAT, array(PAR_FLOAT)),
  PRODUCT_INT("product", PAR_INT, array(PAR_INT)),
  PRODUCT_FLOAT("product", PAR_FLOAT, array(PAR_FLOAT)),

  // arithmetic

  ABS_INT("abs", PAR_INT, PAR_INT),
  ABS_FLOAT("abs", PAR_FLOAT, PAR_FLOAT),
  INT2FLOAT("int2float", PAR_FLOAT, PAR_INT),
  BOOL2INT("bool2int", PAR_INT, PAR_BOOL),
  CEIL("ceil", PAR_INT, PAR_FLOAT),
  FLOOR("floor", PAR_INT, PAR_FLOAT),
  ROUND("round", PAR_INT, PAR_FLOAT),
  POW_INT("pow", PAR_INT, PAR_INT, PAR_INT),
  POW_FLOAT("pow", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  SQRT("sqrt", PAR_FLOAT, PAR_FLOAT),
  EXP("exp", PAR_FLOAT, PAR_FLOAT),
  LN("ln", PAR_FLOAT, PAR_FLOAT),
  LOG10("log10", PAR_FLOAT, PAR_FLOAT),
  LOG2("log2", PAR_FLOAT, PAR_FLOAT),
  /** Function "log", of type "(float, float): float"; the logarithm of the
   * second argument to the base of the first. */
  LOG("log", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  SIN("sin", PAR_FLOAT, PAR_FLOAT),
  COS("cos", PAR_FLOAT, PAR_FLOAT),
  TAN("tan", PAR_FLOAT, PAR_FLOAT),
  ASIN("asin", PAR_FLOAT, PAR_FLOAT),
  ACOS("acos", PAR_FLOAT, PAR_FLOAT),
  ATAN("atan", PAR_FLOAT, PAR_FLOAT),

  // logic

  FORALL("forall", PAR_BOOL, array(PAR_BOOL)),
  EXISTS("exists", PAR_BOOL, array(PAR_BOOL)),
  XORALL("xorall", PAR_BOOL, array(PAR_BOOL)),
  IFFALL("iffall", PAR_BOOL, array(PAR_BOOL)),
  /** Function "clause", of type
   * "(array[$] of bool, array[$] of bool): bool"; true if any of the first
   * array is true or any of the second is false. */
  CLAUSE("clause", PAR_BOOL, array(PAR_BOOL), array(PAR_BOOL)),

  // sets

  CARD("card", PAR_INT, PAR_SET_INT),
  SET2ARRAY("set2array", array(1, PAR_INT), PAR_SET_INT),
  ARRAY_UNION("array_union", PAR_SET_INT, array(PAR_SET_INT)),
  ARRAY_INTERSECT("array_intersect", PAR_SET_INT, array(PAR_SET_INT)),

  // bounds

  /** Function "has_bounds", of type "var int: bool"; whether finite bounds
   * can be computed for an integer expression. */
  HAS_BOUNDS_INT("has_bounds", PAR_BOOL, VAR_INT),
  HAS_BOUNDS_FLOAT("has_bounds", PAR_BOOL, VAR_FLOAT),
  LB_INT("lb", PAR_INT, VAR_INT),
  UB_INT("ub", PAR_INT, VAR_INT),
  LB_FLOAT("lb", PAR_FLOAT, VAR_FLOAT),
  UB_FLOAT("ub", PAR_FLOAT, VAR_FLOAT),
  LB_SET("lb", PAR_SET_INT, VAR_SET_INT),
  UB_SET("ub", PAR_SET_INT, VAR_SET_INT),
  HAS_UB_SET("has_ub_set", PAR_BOOL, VAR_SET_INT),
  LB_ARRAY_INT("lb_array", PAR_INT, array(VAR_INT)),
  UB_ARRAY_INT("ub_array", PAR_INT, array(VAR_INT)),
  LB_ARRAY_FLOAT("lb_array", PAR_FLOAT, array(VAR_FLOAT)),
  UB_ARRAY_FLOAT("ub_array", PAR_FLOAT, array(VAR_FLOAT)),
  UB_ARRAY_SET("ub_array", PAR_SET_INT, array(VAR_SET_INT)),
  DOM("dom", PAR_SET_INT, VAR_INT),
  DOM_ARRAY("dom_array", PAR_SET_INT, array(VAR_INT)),
  DOM_BOUNDS_ARRAY("dom_bounds_array", PAR_SET_INT, array(VAR_INT)),
  /** Function "compute_div_bounds", of type "(var int, var int): set of
   * int"; bounds of the quotient of two integer expressions. */
  COMPUTE_DIV_BOUNDS("compute_div_bounds", PAR_SET_INT, VAR_INT, VAR_INT),

  // fixed values

  IS_FIXED("is_fixed", PAR_BOOL, VAR_TOP),
  IS_FIXED_ARRAY("is_fixed", PAR_BOOL, array(VAR_TOP)),
  FIX("fix", PAR_TOP, VAR_TOP),
  FIX_ARRAY("fix", array(PAR_TOP), array(VAR_TOP)),
  DEOPT("deopt", PAR_TOP, VAR_TOP),
  OCCURS("occurs", PAR_BOOL, VAR_TOP),

  // index sets

  LENGTH("length", PAR_INT, array(VAR_TOP)),
  INDEX_SET("index_set", PAR_SET_INT, array(1, VAR_TOP)),
  INDEX_SET_1OF2("index_set_1of2", PAR_SET_INT, array(2, VAR_TOP)),
  INDEX_SET_2OF2("index_set_2of2", PAR_SET_INT, array(2, VAR_TOP)),
  INDEX_SET_1OF3("index_set_1of3", PAR_SET_INT, array(3, VAR_TOP)),
  INDEX_SET_2OF3("index_set_2of3", PAR_SET_INT, array(3, VAR_TOP)),
  INDEX_SET_3OF3("index_set_3of3", PAR_SET_INT, array(3, VAR_TOP)),
  INDEX_SET_1OF4("index_set_1of4", PAR_SET_INT, array(4, VAR_TOP)),
  INDEX_SET_2OF4("index_set_2of4", PAR_SET_INT, array(4, VAR_TOP)),
  INDEX_SET_3OF4("index_set_3of4", PAR_SET_INT, array(4, VAR_TOP)),
  INDEX_SET_4OF4("index_set_4of4", PAR_SET_INT, array(4, VAR_TOP)),
  INDEX_SET_1OF5("index_set_1of5", PAR_SET_INT, array(5, VAR_TOP)),
  INDEX_SET_2OF5("index_set_2of5", PAR_SET_INT, array(5, VAR_TOP)),
  INDEX_SET_3OF5("index_set_3of5", PAR_SET_INT, array(5, VAR_TOP)),
  INDEX_SET_4OF5("index_set_4of5", PAR_SET_INT, array(5, VAR_TOP)),
  INDEX_SET_5OF5("index_set_5of5", PAR_SET_INT, array(5, VAR_TOP)),
  INDEX_SET_1OF6("index_set_1of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SET_2OF6("index_set_2of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SET_3OF6("index_set_3of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SET_4OF6("index_set_4of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SET_5OF6("index_set_5of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SET_6OF6("index_set_6of6", PAR_SET_INT, array(6, VAR_TOP)),
  INDEX_SETS_AGREE("index_sets_agree", PAR_BOOL, array(VAR_TOP),
      array(VAR_TOP)),

  // reshaping

  /** Function "array1d", of type "array[$] of $T: array[int] of $T";
   * flattens an array, with index set {@code 1..n}. */
  ARRAY1D_LIST("array1d", array(1, PAR_TOP), array(VAR_TOP)),
  ARRAY1D("array1d", array(1, PAR_TOP), PAR_SET_INT, array(VAR_TOP)),
  ARRAY2D("array2d", array(2, PAR_TOP), PAR_SET_INT, PAR_SET_INT,
      array(VAR_TOP)),
  ARRAY3D("array3d", array(3, PAR_TOP), PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, array(VAR_TOP)),
  ARRAY4D("array4d", array(4, PAR_TOP), PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, PAR_SET_INT, array(VAR_TOP)),
  ARRAY5D("array5d", array(5, PAR_TOP), PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, PAR_SET_INT, PAR_SET_INT, array(VAR_TOP)),
  ARRAY6D("array6d", array(6, PAR_TOP), PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, PAR_SET_INT, PAR_SET_INT, PAR_SET_INT, array(VAR_TOP)),
  /** Function "arrayXd", of type "(array[$] of $U, array[$] of $T):
   * array[$] of $T"; gives the second array the index sets of the
   * first. */
  ARRAYXD("arrayXd", array(PAR_TOP), array(VAR_TOP), array(VAR_TOP)),
  /** Function "slice_1d"; selects a contiguous sub-array, given one index set
   * per dimension of the source, and re-indexes it as a one-dimensional
   * array. */
  SLICE_1D("slice_1d", array(1, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT),
  SLICE_2D("slice_2d", array(2, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT, PAR_SET_INT),
  SLICE_3D("slice_3d", array(3, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT, PAR_SET_INT, PAR_SET_INT),
  SLICE_4D("slice_4d", array(4, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT, PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT),
  SLICE_5D("slice_5d", array(5, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT, PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, PAR_SET_INT),
  SLICE_6D("slice_6d", array(6, PAR_TOP), array(VAR_TOP),
      array(1, PAR_SET_INT), PAR_SET_INT, PAR_SET_INT, PAR_SET_INT,
      PAR_SET_INT, PAR_SET_INT, PAR_SET_INT),

  // sorting

  SORT_INT("sort", array(1, PAR_INT), array(PAR_INT)),
  SORT_FLOAT("sort", array(1, PAR_FLOAT), array(PAR_FLOAT)),
  SORT_BOOL("sort", array(1, PAR_BOOL), array(PAR_BOOL)),
  /** Function "sort_by", of type "(array[$] of $T, array[$] of int):
   * array[int] of $T"; a stable sort of the first array by the keys in the
   * second. */
  SORT_BY_INT("sort_by", array(1, PAR_TOP), array(VAR_TOP), array(PAR_INT)),
  SORT_BY_FLOAT("sort_by", array(1, PAR_TOP), array(VAR_TOP),
      array(PAR_FLOAT)),

  // strings and output

  SHOW("show", PAR_STRING, VAR_TOP),
  SHOW_ARRAY("show", PAR_STRING, array(VAR_TOP)),
  SHOW_JSON("showJSON", PAR_STRING, VAR_TOP),
  SHOW_JSON_ARRAY("showJSON", PAR_STRING, array(VAR_TOP)),
  SHOW_DZN_ID("showDznId", PAR_STRING, PAR_STRING),
  SHOW_INT("show_int", PAR_STRING, PAR_INT, VAR_INT),
  SHOW_FLOAT("show_float", PAR_STRING, PAR_INT, PAR_INT, VAR_FLOAT),
  FORMAT("format", PAR_STRING, VAR_TOP),
  FORMAT_WIDTH("format", PAR_STRING, PAR_INT, VAR_TOP),
  FORMAT_WIDTH_PREC("format", PAR_STRING, PAR_INT, PAR_INT, VAR_TOP),
  FORMAT_JUSTIFY_STRING("format_justify_string", PAR_STRING, PAR_INT,
      PAR_STRING),
  STRING_LENGTH("string_length", PAR_INT, PAR_STRING),
  CONCAT("concat", PAR_STRING, array(PAR_STRING)),
  JOIN("join", PAR_STRING, PAR_STRING, array(PAR_STRING)),
  FILE_PATH("file_path", PAR_STRING),
  /** Function "outputJSONParameters", of type "(): string"; renders every
   * output parameter of the model as a JSON object. */
  OUTPUT_JSON_PARAMETERS("outputJSONParameters", PAR_STRING),

  // diagnostics

  ASSERT("assert", PAR_BOOL, PAR_BOOL, PAR_STRING),
  ASSERT_EXP("assert", PAR_TOP, PAR_BOOL, PAR_STRING, VAR_TOP),
  ABORT("abort", PAR_BOOL, PAR_STRING),
  TRACE("trace", PAR_BOOL, PAR_STRING),
  TRACE_EXP("trace", PAR_TOP, PAR_STRING, VAR_TOP),
  TRACE_STDOUT("trace_stdout", PAR_BOOL, PAR_STRING),
  TRACE_STDOUT_EXP("trace_stdout", PAR_TOP, PAR_STRING, VAR_TOP),
  MZN_IN_REDUNDANT_CONSTRAINT("mzn_in_redundant_constraint", PAR_BOOL),
  MZN_COMPILER_VERSION("mzn_compiler_version", PAR_INT),

  // enums

  TO_ENUM("to_enum", PAR_INT, PAR_SET_INT, PAR_INT),
  ENUM_NEXT("enum_next", PAR_INT, PAR_SET_INT, PAR_INT),
  ENUM_PREV("enum_prev", PAR_INT, PAR_SET_INT, PAR_INT),

  // random sampling

  NORMAL("normal", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  UNIFORM_INT("uniform", PAR_INT, PAR_INT, PAR_INT),
  UNIFORM_FLOAT("uniform", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  POISSON("poisson", PAR_INT, PAR_FLOAT),
  GAMMA("gamma", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  WEIBULL("weibull", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  EXPONENTIAL("exponential", PAR_FLOAT, PAR_FLOAT),
  LOGNORMAL("lognormal", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  CHISQUARED("chisquared", PAR_FLOAT, PAR_FLOAT),
  CAUCHY("cauchy", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  FDISTRIBUTION("fdistribution", PAR_FLOAT, PAR_FLOAT, PAR_FLOAT),
  TDISTRIBUTION("tdistribution", PAR_FLOAT, PAR_FLOAT),
  DISCRETE_DISTRIBUTION("discrete_distribution", PAR_INT,
      array(1, PAR_INT)),
  BERNOULLI("bernoulli", PAR_BOOL, PAR_FLOAT),
  BINOMIAL("binomial", PAR_INT, PAR_INT, PAR_FLOAT),

  /** Function "regular", of type "(array[int] of var int, string): var
   * bool"; a regular constraint given as a regular expression. Only solver
   * backends that can compile regular expressions to automata declare it. */
  REGULAR(true, "regular", VAR_BOOL, array(1, VAR_INT), PAR_STRING);

  /** Name of the function, e.g. "min". */
  public final String mznName;

  /** Declaration of this overload. */
  public final FunctionDecl decl;

  /** Whether the function is declared only by some solver backends, and
   * therefore is absent from the standard library. */
  public final boolean backendOnly;

  BuiltIn(String mznName, Type returnType, Type... paramTypes) {
    this(false, mznName, returnType, paramTypes);
  }

  BuiltIn(boolean backendOnly, String mznName, Type returnType,
      Type... paramTypes) {
    this.backendOnly = backendOnly;
    this.mznName = mznName;
    this.decl = new FunctionDecl(mznName, returnType,
        Arrays.asList(paramTypes));
  }
}

// End BuiltIn.java
