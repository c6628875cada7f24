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

import static net.hydromatic.zinc.TestUtils.POS;
import static net.hydromatic.zinc.TestUtils.array;
import static net.hydromatic.zinc.TestUtils.boolLit;
import static net.hydromatic.zinc.TestUtils.call;
import static net.hydromatic.zinc.TestUtils.floatArray;
import static net.hydromatic.zinc.TestUtils.floatLit;
import static net.hydromatic.zinc.TestUtils.intArray;
import static net.hydromatic.zinc.TestUtils.intArray2d;
import static net.hydromatic.zinc.TestUtils.intLit;
import static net.hydromatic.zinc.TestUtils.session;
import static net.hydromatic.zinc.TestUtils.setLit;
import static net.hydromatic.zinc.TestUtils.stringLit;
import static net.hydromatic.zinc.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.compile.BuiltIn;
import net.hydromatic.zinc.compile.Tracers;
import net.hydromatic.zinc.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for the built-in functions in {@link Codes}. */
public class CodesTest {
  private final Session session = session();

  private Object eval(Ast.Call call) {
    return session.evaluator().evaluate(call).valueOrThrow();
  }

  private EvalResult result(Ast.Call call) {
    return session.evaluator().evaluate(call);
  }

  private static EvalException exception(EvalResult result) {
    return result.fold(v -> {
      throw new AssertionError("expected exception, got " + v);
    }, u -> u, e -> e);
  }

  @Test void testBuiltInValuesComplete() {
    for (BuiltIn builtIn : BuiltIn.values()) {
      assertThat(builtIn.name(), Codes.BUILT_IN_VALUES.containsKey(builtIn),
          is(true));
    }
  }

  @Test void testReductions() {
    assertThat(eval(call(Type.PAR_INT, "min", intArray(4, -2, 7))),
        is(IntVal.of(-2)));
    assertThat(eval(call(Type.PAR_INT, "max", intArray(4, -2, 7))),
        is(IntVal.of(7)));
    assertThat(eval(call(Type.PAR_INT, "sum", intArray(4, -2, 7))),
        is(IntVal.of(9)));
    assertThat(eval(call(Type.PAR_INT, "product", intArray(4, -2, 7))),
        is(IntVal.of(-56)));
    assertThat(eval(call(Type.PAR_INT, "sum", intArray())),
        is(IntVal.ZERO));
    assertThat(eval(call(Type.PAR_INT, "product", intArray())),
        is(IntVal.ONE));
    assertThat(eval(call(Type.PAR_FLOAT, "sum", floatArray(1.5, 2.25))),
        is(3.75d));
    assertThat(eval(call(Type.PAR_INT, "max", intLit(3), intLit(8))),
        is(IntVal.of(8)));
    assertThat(eval(call(Type.PAR_INT, "min", setLit(3, 8))),
        is(IntVal.of(3)));
  }

  @Test void testMinOfEmptyArrayIsUndefined() {
    final EvalResult r = result(call(Type.PAR_INT, "min", intArray()));
    assertThat(r.kind, is(EvalResult.Kind.UNDEFINED));
    assertThat(exception(r).getMessage(),
        is("minimum of empty array is undefined"));
  }

  @Test void testArgMinMax() {
    // Ties resolve to the first occurrence; positions are 1-based.
    assertThat(eval(call(Type.PAR_INT, "arg_min", intArray(5, 2, 9, 2))),
        is(IntVal.of(2)));
    assertThat(eval(call(Type.PAR_INT, "arg_max", intArray(9, 2, 9))),
        is(IntVal.of(1)));
    assertThat(eval(call(Type.PAR_INT, "arg_max", floatArray(0.5, 1.5))),
        is(IntVal.of(2)));
    final EvalResult r = result(call(Type.PAR_INT, "arg_min", intArray()));
    assertThat(r.kind, is(EvalResult.Kind.UNDEFINED));
    assertThat(exception(r).getMessage(),
        is("argmin of empty array is undefined"));
  }

  @Test void testArithmetic() {
    assertThat(eval(call(Type.PAR_INT, "abs", intLit(-4))), is(IntVal.of(4)));
    assertThat(eval(call(Type.PAR_INT, "ceil", floatLit(1.2))),
        is(IntVal.of(2)));
    assertThat(eval(call(Type.PAR_INT, "floor", floatLit(-1.2))),
        is(IntVal.of(-2)));
    assertThat(eval(call(Type.PAR_INT, "round", floatLit(2.5))),
        is(IntVal.of(3)));
    assertThat(eval(call(Type.PAR_INT, "round", floatLit(2.4))),
        is(IntVal.of(2)));
    assertThat(eval(call(Type.PAR_INT, "pow", intLit(3), intLit(4))),
        is(IntVal.of(81)));
    assertThat(eval(call(Type.PAR_INT, "bool2int", boolLit(true))),
        is(IntVal.ONE));
    assertThat(eval(call(Type.PAR_FLOAT, "int2float", intLit(7))), is(7d));
    assertThat((Double) eval(call(Type.PAR_FLOAT, "log", floatLit(2),
        floatLit(8))), closeTo(3d, 1e-12));
    assertThat((Double) eval(call(Type.PAR_FLOAT, "log2", floatLit(1024))),
        closeTo(10d, 1e-12));
  }

  @Test void testNegativePower() {
    final Ast.IntLiteral exponent = intLit(-1);
    final EvalResult r =
        result(call(Type.PAR_INT, "pow", intLit(2), exponent));
    assertThat(r.kind, is(EvalResult.Kind.ERROR));
    assertThat(exception(r).getMessage(),
        is("Cannot raise integer to a negative power"));
    assertThat(exception(r).pos(), is(exponent.pos));
  }

  @Test void testOverflowIsError() {
    final EvalResult r =
        result(call(Type.PAR_INT, "pow", intLit(10), intLit(30)));
    assertThat(r.kind, is(EvalResult.Kind.ERROR));
  }

  @Test void testLogic() {
    final Ast.ArrayLiteral tft =
        array(boolLit(true), boolLit(false), boolLit(true));
    assertThat(eval(call(Type.PAR_BOOL, "forall", tft)), is(false));
    assertThat(eval(call(Type.PAR_BOOL, "exists", tft)), is(true));
    assertThat(eval(call(Type.PAR_BOOL, "xorall", tft)), is(false));
    assertThat(eval(call(Type.PAR_BOOL, "iffall", tft)), is(true));
    assertThat(eval(call(Type.PAR_BOOL, "forall", array())), is(true));
    assertThat(eval(call(Type.PAR_BOOL, "clause",
            array(boolLit(false)), array(boolLit(true)))),
        is(false));
    assertThat(eval(call(Type.PAR_BOOL, "clause",
            array(boolLit(false)), array(boolLit(false)))),
        is(true));
  }

  @Test void testSets() {
    assertThat(eval(call(Type.PAR_INT, "card", setLit(3, 7))),
        is(IntVal.of(5)));
    assertThat(eval(call(Type.array(1, Type.PAR_INT), "set2array",
            setLit(3, 5))),
        hasToString("[3, 4, 5]"));
    assertThat(eval(call(Type.PAR_SET_INT, "array_union",
            array(setLit(1, 3), setLit(5, 6)))),
        hasToString("1..3 union 5..6"));
    assertThat(eval(call(Type.PAR_SET_INT, "array_intersect",
            array(setLit(1, 5), setLit(3, 9)))),
        hasToString("3..5"));
    final Ast.ArrayLiteral noSets = ast.arrayLiteral(POS, Type.PAR_SET_INT,
        ImmutableList.of(), ImmutableIntArray.of(1, 0));
    assertThat(eval(call(Type.PAR_SET_INT, "array_intersect", noSets)),
        is(IntSetVal.EMPTY));
  }

  @Test void testIndexSet() {
    assertThat(eval(call(Type.PAR_SET_INT, "index_set", intArray(1, 2, 3))),
        is(IntSetVal.range(1, 3)));
    assertThat(eval(call(Type.PAR_SET_INT, "index_set_2of2",
            intArray2d(1, 2, 3, 4))),
        is(IntSetVal.range(1, 2)));
    assertThat(eval(call(Type.PAR_INT, "length", intArray2d(1, 2, 3, 4))),
        is(IntVal.of(4)));
  }

  @Test void testSortIsIdempotent() {
    final Type type = Type.array(1, Type.PAR_INT);
    final Object sorted = eval(call(type, "sort", intArray(3, 1, 2, 1)));
    assertThat(sorted, hasToString("[1, 1, 2, 3]"));
    final Object sorted2 = eval(call(type, "sort", (Ast.Exp) sorted));
    assertThat(sorted2, hasToString(sorted.toString()));
    assertThat(eval(call(Type.array(1, Type.PAR_FLOAT), "sort",
            floatArray(2.5, 1.0))),
        hasToString("[1.0, 2.5]"));
  }

  @Test void testSortByIsStable() {
    final Ast.ArrayLiteral words = array(stringLit("a"), stringLit("b"),
        stringLit("c"), stringLit("d"));
    assertThat(eval(call(Type.array(1, Type.PAR_STRING), "sort_by", words,
            intArray(2, 1, 2, 1))),
        hasToString("[\"b\", \"d\", \"a\", \"c\"]"));
  }

  @Test void testStrings() {
    final Ast.ArrayLiteral words = array(stringLit("ab"), stringLit("c"));
    assertThat(eval(call(Type.PAR_STRING, "concat", words)), is("abc"));
    assertThat(eval(call(Type.PAR_STRING, "join", stringLit(", "), words)),
        is("ab, c"));
    assertThat(eval(call(Type.PAR_INT, "string_length", stringLit("hello"))),
        is(IntVal.of(5)));
    assertThat(eval(call(Type.PAR_STRING, "file_path")), is("/models/"));
  }

  @Test void testEnums() {
    assertThat(eval(call(Type.PAR_INT, "enum_next", setLit(1, 3),
            intLit(2))),
        is(IntVal.of(3)));
    final EvalResult r =
        result(call(Type.PAR_INT, "enum_next", setLit(1, 3), intLit(3)));
    assertThat(r.kind, is(EvalResult.Kind.UNDEFINED));
    assertThat(exception(r).getMessage(), is("value outside of enum range"));
    assertThat(result(call(Type.PAR_INT, "to_enum", setLit(1, 3), intLit(0)))
        .kind, is(EvalResult.Kind.UNDEFINED));
  }

  @Test void testAssert() {
    assertThat(eval(call(Type.PAR_BOOL, "assert", boolLit(true),
            stringLit("ok"))),
        is(true));
    final Ast.BoolLiteral condition = boolLit(false);
    final EvalResult r = result(call(Type.PAR_BOOL, "assert", condition,
        stringLit("x must be positive")));
    assertThat(r.kind, is(EvalResult.Kind.ERROR));
    final EvalException e = exception(r);
    assertThat(e, instanceOf(AssertionFailureException.class));
    assertThat(e.getMessage(), is("Assertion failed: x must be positive"));
    assertThat(e.pos(), is(condition.pos));
  }

  @Test void testAssertReturnsExpression() {
    final Ast.IntLiteral three = intLit(3);
    final Object o = eval(call(Type.PAR_INT, "assert", boolLit(true),
        stringLit("ok"), three));
    assertThat(o, sameInstance(three));
  }

  @Test void testAbort() {
    final EvalResult r =
        result(call(Type.PAR_BOOL, "abort", stringLit("stop")));
    assertThat(exception(r).getMessage(), is("Abort: stop"));
  }

  @Test void testTrace() {
    final StringWriter err = new StringWriter();
    final StringWriter out = new StringWriter();
    final List<String> traces = new ArrayList<>();
    session.err = new PrintWriter(err);
    session.out = new PrintWriter(out);
    session.tracer = Tracers.withOnTrace(Tracers.empty(),
        (stream, message) -> traces.add(stream + ":" + message));
    assertThat(eval(call(Type.PAR_BOOL, "trace", stringLit("a\n"))),
        is(Unit.INSTANCE));
    assertThat(session.evaluator()
            .evalInt(call(Type.PAR_INT, "trace_stdout", stringLit("b"),
                intLit(5))),
        is(IntVal.of(5)));
    assertThat(err.toString(), is("a\n"));
    assertThat(out.toString(), is("b"));
    assertThat(traces, hasToString("[ERR:a\n, OUT:b]"));
  }

  @Test void testTraceCountsAsTrue() {
    session.err = new PrintWriter(new StringWriter());
    assertThat(session.evaluator()
            .evalBool(call(Type.PAR_BOOL, "trace", stringLit("x"))),
        is(true));
  }

  @Test void testCompilerInfo() {
    assertThat(eval(call(Type.PAR_INT, "mzn_compiler_version")),
        is(IntVal.of(21007)));
    Prop.COMPILER_VERSION.set(session.map, "2.8.3");
    assertThat(eval(call(Type.PAR_INT, "mzn_compiler_version")),
        is(IntVal.of(28003)));
    assertThat(eval(call(Type.PAR_BOOL, "mzn_in_redundant_constraint")),
        is(false));
    session.redundantConstraintDepth = 1;
    assertThat(eval(call(Type.PAR_BOOL, "mzn_in_redundant_constraint")),
        is(true));
  }

  @Test void testRegularRequiresBackend() {
    final EvalResult r = session.evaluator()
        .evaluate(Codes.BUILT_IN_VALUES.get(BuiltIn.REGULAR),
            call(Type.VAR_BOOL, "regular", intArray(1, 2),
                stringLit("1 2*")));
    assertThat(r.kind, is(EvalResult.Kind.ERROR));
    assertThat(exception(r).pos(), is(POS));
  }
}

// End CodesTest.java
