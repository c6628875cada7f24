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
import static net.hydromatic.zinc.TestUtils.boolLit;
import static net.hydromatic.zinc.TestUtils.call;
import static net.hydromatic.zinc.TestUtils.floatLit;
import static net.hydromatic.zinc.TestUtils.intArray;
import static net.hydromatic.zinc.TestUtils.intArray2d;
import static net.hydromatic.zinc.TestUtils.intLit;
import static net.hydromatic.zinc.TestUtils.par;
import static net.hydromatic.zinc.TestUtils.session;
import static net.hydromatic.zinc.TestUtils.setLit;
import static net.hydromatic.zinc.TestUtils.stringLit;
import static net.hydromatic.zinc.TestUtils.varInt;
import static net.hydromatic.zinc.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.compile.Tracers;
import net.hydromatic.zinc.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}. */
public class EvaluatorTest {
  private final Session session = session();

  private static Ast.Exp intOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    return ast.binOp(POS, Type.PAR_INT, op, a0, a1);
  }

  private static Ast.Exp boolOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    return ast.binOp(POS, Type.PAR_BOOL, op, a0, a1);
  }

  /** Declares an integer parameter with no value. */
  private static Ast.Id undefinedPar(String name) {
    final Ast.TypeInst ti = ast.typeInst(POS, Type.PAR_INT, null);
    return ast.id(POS, ast.varDecl(POS, ti, name, null));
  }

  @Test void testEvalInt() {
    final Evaluator ev = session.evaluator();
    assertThat(ev.evalInt(intOp(Op.PLUS, intLit(2), intLit(3))),
        is(IntVal.of(5)));
    assertThat(ev.evalInt(intOp(Op.TIMES, intLit(4), intLit(-3))),
        is(IntVal.of(-12)));
    assertThat(ev.evalInt(intOp(Op.DIV, intLit(7), intLit(2))),
        is(IntVal.of(3)));
    assertThat(ev.evalInt(intOp(Op.MOD, intLit(7), intLit(3))),
        is(IntVal.of(1)));
    assertThat(
        ev.evalInt(ast.unOp(POS, Type.PAR_INT, Op.NEGATE, intLit(4))),
        is(IntVal.of(-4)));
    assertThat(
        ev.evalInt(
            ast.ifThenElse(POS, Type.PAR_INT, boolLit(false), intLit(1),
                intLit(2))),
        is(IntVal.of(2)));
  }

  @Test void testDivisionByZero() {
    final Evaluator ev = session.evaluator();
    final ResultUndefinedException e =
        assertThrows(ResultUndefinedException.class, () ->
            ev.evalInt(intOp(Op.DIV, intLit(7), intLit(0))));
    assertThat(e.getMessage(), is("division by zero"));
    assertThrows(ResultUndefinedException.class, () ->
        ev.evalFloat(
            ast.binOp(POS, Type.PAR_FLOAT, Op.DIVIDE, floatLit(1d),
                floatLit(0d))));
  }

  @Test void testIntegerOverflow() {
    final Evaluator ev = session.evaluator();
    final Ast.Exp e =
        intOp(Op.DIV, intLit(Long.MIN_VALUE), intLit(-1));
    final EvalException ex =
        assertThrows(EvalException.class, () -> ev.evalInt(e));
    assertThat(ex.getMessage(), is("integer overflow"));
    assertThat(ex.getCause() instanceof ArithmeticException, is(true));
    assertThrows(EvalException.class, () ->
        ev.evalInt(intOp(Op.PLUS, intLit(Long.MAX_VALUE), intLit(1))));
    assertThrows(EvalException.class, () ->
        ev.evalInt(intOp(Op.TIMES, intLit(Long.MAX_VALUE / 2), intLit(3))));
  }

  @Test void testEvalBool() {
    final Evaluator ev = session.evaluator();
    assertThat(ev.evalBool(boolOp(Op.LT, intLit(1), floatLit(1.5d))),
        is(true));
    assertThat(ev.evalBool(boolOp(Op.IN, intLit(3), setLit(1, 5))),
        is(true));
    assertThat(ev.evalBool(boolOp(Op.IMPL, boolLit(false), boolLit(false))),
        is(true));
    assertThat(ev.evalBool(boolOp(Op.XOR, boolLit(true), boolLit(true))),
        is(false));
    assertThat(ev.evalBool(boolOp(Op.EQ, stringLit("a"), stringLit("a"))),
        is(true));
  }

  @Test void testFollowsDefinitions() {
    final Evaluator ev = session.evaluator();
    final Ast.Id x = par("x", intLit(6));
    final Ast.Id y = par("y", intOp(Op.PLUS, x, intLit(1)));
    assertThat(ev.evalInt(y), is(IntVal.of(7)));

    // a declaration without an initializer uses its flattened binding
    final Ast.Id z = undefinedPar("z");
    z.decl.setFlat(x.decl);
    assertThat(ev.evalInt(z), is(IntVal.of(6)));
  }

  @Test void testNoValue() {
    final Evaluator ev = session.evaluator();
    final EvalException e =
        assertThrows(EvalException.class, () ->
            ev.evalInt(undefinedPar("p")));
    assertThat(e.getMessage(),
        is("cannot evaluate expression: p has no value"));
    assertThrows(EvalException.class, () -> ev.evalInt(varInt("v", 1, 3)));
  }

  @Test void testCyclicDefinition() {
    final Evaluator ev = session.evaluator();
    final Ast.Id x = undefinedPar("x");
    x.decl.setInitializer(intOp(Op.PLUS, x, intLit(1)));
    final EvalException e =
        assertThrows(EvalException.class, () -> ev.evalInt(x));
    assertThat(e.getMessage(), is("cyclic definition of x"));

    // the evaluator is still usable after the failure
    assertThat(ev.evalInt(par("y", intLit(2))), is(IntVal.of(2)));
  }

  @Test void testChaseLimit() {
    final Session session = session();
    Prop.CHASE_LIMIT.set(session.map, 3);
    final Ast.Id d = par("d", intLit(5));
    final Ast.Id c = par("c", d);
    final Ast.Id b = par("b", c);
    final Ast.Id a = par("a", b);
    final Evaluator ev = session.evaluator();
    assertThat(ev.evalInt(b), is(IntVal.of(5)));
    final EvalException e =
        assertThrows(EvalException.class, () -> ev.evalInt(a));
    assertThat(e.getMessage(),
        is("definition of d is nested more than 3 deep"));
  }

  @Test void testArrayAccess() {
    final Evaluator ev = session.evaluator();
    final Ast.ArrayAccess access =
        ast.arrayAccess(POS, intArray2d(1, 2, 3, 4),
            ImmutableList.of(intLit(2), intLit(1)));
    assertThat(ev.evalInt(access), is(IntVal.of(3)));

    final ResultUndefinedException e =
        assertThrows(ResultUndefinedException.class, () ->
            ev.evalInt(
                ast.arrayAccess(POS, intArray(1, 2, 3),
                    ImmutableList.of(intLit(4)))));
    assertThat(e.getMessage(), is("array access out of bounds"));
    assertThrows(TypeMismatchException.class, () ->
        ev.evalArrayAccess(
            ast.arrayAccess(POS, intArray(1, 2, 3),
                ImmutableList.of(intLit(1), intLit(1)))));
  }

  @Test void testEvalArray() {
    final Evaluator ev = session.evaluator();
    final Ast.ArrayLiteral a = intArray(1, 2);
    assertThat(ev.evalArray(a), sameInstance(a));
    final Ast.Exp concat =
        ast.binOp(POS, Type.array(1, Type.PAR_INT), Op.PLUS_PLUS, a,
            intArray(3));
    assertThat(ev.evalArray(concat), hasToString("[1, 2, 3]"));
    assertThat(ev.evalIntArray(par("xs", a)),
        is(ImmutableList.of(IntVal.of(1), IntVal.of(2))));
  }

  @Test void testTypeMismatch() {
    final Evaluator ev = session.evaluator();
    final TypeMismatchException e =
        assertThrows(TypeMismatchException.class, () ->
            ev.evalInt(stringLit("a")));
    assertThat(e.getMessage(), is("cannot evaluate \"a\" as int"));
  }

  @Test void testEvaluateResultKinds() {
    final Evaluator ev = session.evaluator();
    final EvalResult value =
        ev.evaluate(call(Type.PAR_INT, "abs", intLit(-3)));
    assertThat(value.kind, is(EvalResult.Kind.VALUE));
    assertThat(value.valueOrThrow(), is(IntVal.of(3)));

    final EvalResult undefined =
        ev.evaluate(
            call(Type.PAR_INT, "abs", intOp(Op.DIV, intLit(1), intLit(0))));
    assertThat(undefined.kind, is(EvalResult.Kind.UNDEFINED));
    assertThat(undefined, hasToString("undefined division by zero"));

    final EvalResult error =
        ev.evaluate(call(Type.PAR_INT, "abs", undefinedPar("p")));
    assertThat(error.kind, is(EvalResult.Kind.ERROR));
    assertThrows(EvalException.class, error::valueOrThrow);
  }

  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    session.tracer =
        Tracers.withOnCall(
            Tracers.withOnResult(
                Tracers.withOnError(
                    Tracers.withOnUndefined(Tracers.empty(),
                        e -> events.add("undefined " + e.getMessage())),
                    e -> events.add("error " + e.getMessage())),
                (call, result) -> events.add("result " + result)),
            call -> events.add("call " + call.name));
    final Evaluator ev = session.evaluator();
    ev.evaluate(call(Type.PAR_INT, "abs", intLit(-3)));
    ev.evaluate(call(Type.PAR_INT, "abs", intOp(Op.MOD, intLit(1),
        intLit(0))));
    ev.evaluate(call(Type.PAR_INT, "abs", undefinedPar("p")));
    assertThat(events,
        is(
            ImmutableList.of("call abs", "result 3",
                "call abs", "undefined division by zero",
                "call abs",
                "error cannot evaluate expression: p has no value")));
  }
}

// End EvaluatorTest.java
