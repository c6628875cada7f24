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
import static net.hydromatic.zinc.TestUtils.intLit;
import static net.hydromatic.zinc.TestUtils.session;
import static net.hydromatic.zinc.TestUtils.setLit;
import static net.hydromatic.zinc.TestUtils.varInt;
import static net.hydromatic.zinc.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoundsComputer}. */
public class BoundsComputerTest {
  private final Evaluator ev = session().evaluator();

  private static Ast.BinOp binOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    return ast.binOp(POS, Type.VAR_INT, op, a0, a1);
  }

  private static Bounds<IntVal> bounds(long lower, long upper) {
    return Bounds.of(IntVal.of(lower), IntVal.of(upper));
  }

  @Test void testIdentifier() {
    final Ast.Id x = varInt("x", 1, 5);
    assertThat(BoundsComputer.intBounds(ev, x), is(bounds(1, 5)));
    assertThat(BoundsComputer.hasBoundsInt(ev, x), is(true));
    assertThat(BoundsComputer.intBounds(ev, intLit(7)), is(bounds(7, 7)));
  }

  @Test void testUnboundedIdentifier() {
    final Ast.Id z = varInt("z");
    assertThat(BoundsComputer.intBounds(ev, z).valid, is(false));
    assertThat(BoundsComputer.hasBoundsInt(ev, z), is(false));
    assertThat(BoundsComputer.lbInt(ev, z), is(IntVal.MINUS_INFINITY));
    assertThat(BoundsComputer.ubInt(ev, z), is(IntVal.INFINITY));
  }

  @Test void testArithmetic() {
    final Ast.Id x = varInt("x", -2, 3);
    final Ast.Id y = varInt("y", -4, 5);
    assertThat(BoundsComputer.intBounds(ev, binOp(Op.PLUS, x, y)),
        is(bounds(-6, 8)));
    assertThat(BoundsComputer.intBounds(ev, binOp(Op.MINUS, x, y)),
        is(bounds(-7, 7)));
    assertThat(BoundsComputer.intBounds(ev, binOp(Op.TIMES, x, y)),
        is(bounds(-12, 15)));
    assertThat(
        BoundsComputer.intBounds(ev,
            ast.unOp(POS, Type.VAR_INT, Op.NEGATE, x)),
        is(bounds(-3, 2)));
  }

  @Test void testCalls() {
    final Ast.Id x = varInt("x", -7, 3);
    final Ast.Id y = varInt("y", 2, 4);
    assertThat(
        BoundsComputer.intBounds(ev,
            ast.call(POS, Type.VAR_INT, "abs", x)),
        is(bounds(0, 7)));
    assertThat(
        BoundsComputer.intBounds(ev,
            ast.call(POS, Type.VAR_INT, "max", x, y)),
        is(bounds(2, 4)));
    assertThat(
        BoundsComputer.intBounds(ev,
            ast.call(POS, Type.VAR_INT, "sum", array(x, y, intLit(10)))),
        is(bounds(5, 17)));
  }

  @Test void testDivisionBoundsAreSound() {
    for (int a = -4; a <= 4; a++) {
      for (int b = a; b <= 4; b++) {
        for (int c = -3; c <= 3; c++) {
          for (int d = c; d <= 3; d++) {
            if (c == 0 && d == 0) {
              continue;
            }
            final Bounds<IntVal> q =
                BoundsComputer.divBounds(bounds(a, b), bounds(c, d), POS);
            for (int x = a; x <= b; x++) {
              for (int y = c; y <= d; y++) {
                if (y == 0) {
                  continue;
                }
                final IntVal v = IntVal.of(x).div(IntVal.of(y));
                assertThat(x + " div " + y, v,
                    greaterThanOrEqualTo(q.lower));
                assertThat(x + " div " + y, v, lessThanOrEqualTo(q.upper));
              }
            }
          }
        }
      }
    }
  }

  @Test void testDivisionBoundsEdgeCases() {
    assertThrows(ResultUndefinedException.class, () ->
        BoundsComputer.divBounds(bounds(1, 5), bounds(0, 0), POS));
    assertThrows(EvalException.class, () ->
        BoundsComputer.divBounds(Bounds.invalidInt(), bounds(1, 2), POS));
    final Bounds<IntVal> unbounded =
        BoundsComputer.divBounds(
            Bounds.of(IntVal.ONE, IntVal.INFINITY), bounds(1, 2), POS);
    assertThat(unbounded,
        is(Bounds.of(IntVal.MINUS_INFINITY, IntVal.INFINITY)));
    assertThat(BoundsComputer.divBounds(bounds(7, 9), bounds(2, 3), POS),
        is(bounds(2, 4)));
  }

  @Test void testDivByZeroExpressionIsInvalid() {
    final Ast.Id x = varInt("x", 1, 5);
    final Ast.BinOp e = binOp(Op.DIV, x, intLit(0));
    assertThat(BoundsComputer.intBounds(ev, e).valid, is(false));
  }

  @Test void testDomain() {
    final Ast.Id y = varInt("y", 5, 20);
    final Ast.VarDecl xDecl =
        ast.varDecl(POS, ast.typeInst(POS, Type.VAR_INT, setLit(1, 10)), "x",
            y);
    final Ast.Id x = ast.id(POS, xDecl);
    assertThat(BoundsComputer.dom(ev, x), is(IntSetVal.range(5, 10)));
    assertThat(BoundsComputer.dom(ev, intLit(3)), is(IntSetVal.range(3, 3)));
    assertThat(BoundsComputer.dom(ev, varInt("z")), is(IntSetVal.INFINITE));
  }

  @Test void testDomArray() {
    final Ast.ArrayLiteral a =
        array(varInt("x", 1, 3), varInt("y", 7, 8), intLit(5));
    assertThat(BoundsComputer.domArray(ev, a),
        hasToString("1..3 union 5..5 union 7..8"));
    assertThat(BoundsComputer.domBoundsArray(ev, a),
        is(IntSetVal.range(1, 8)));
  }

  @Test void testArrayBounds() {
    final Ast.ArrayLiteral a =
        array(varInt("x", 1, 5), varInt("y", -2, 3), intLit(4));
    assertThat(BoundsComputer.lbArrayInt(ev, a, POS), is(IntVal.of(-2)));
    assertThat(BoundsComputer.ubArrayInt(ev, a, POS), is(IntVal.of(5)));
    final Ast.ArrayLiteral withUnbounded = array(varInt("x", 1, 5),
        varInt("z"));
    assertThat(BoundsComputer.ubArrayInt(ev, withUnbounded, POS),
        is(IntVal.INFINITY));
  }

  /** Declares a one-dimensional array of integer decision variables with
   * index set {@code 1..3}. */
  private static Ast.Id varIntArray(String name, Ast.@Nullable Exp domain,
      Ast.@Nullable Exp e) {
    final Ast.TypeInst ti =
        ast.arrayTypeInst(POS, Type.VAR_INT, domain,
            Collections.<Ast.Exp>singletonList(setLit(1, 3)));
    return ast.id(POS, ast.varDecl(POS, ti, name, e));
  }

  @Test void testDeclaredArrayWithoutDefinition() {
    final Ast.Id x = varIntArray("x", setLit(1, 10), null);
    assertThat(BoundsComputer.lbArrayInt(ev, x, POS), is(IntVal.of(1)));
    assertThat(BoundsComputer.ubArrayInt(ev, x, POS), is(IntVal.of(10)));
    assertThat(BoundsComputer.domBoundsArray(ev, x),
        is(IntSetVal.range(1, 10)));
    assertThat(BoundsComputer.domArray(ev, x), is(IntSetVal.range(1, 10)));

    final Ast.Id y = varIntArray("y", null, null);
    assertThat(BoundsComputer.lbArrayInt(ev, y, POS),
        is(IntVal.MINUS_INFINITY));
    assertThat(BoundsComputer.ubArrayInt(ev, y, POS), is(IntVal.INFINITY));
    assertThat(BoundsComputer.domBoundsArray(ev, y), is(IntSetVal.INFINITE));
  }

  @Test void testDeclaredArrayMeetsElementBounds() {
    final Ast.Id x =
        varIntArray("x", setLit(0, 10),
            array(varInt("a", 2, 5), varInt("b", 3, 12), intLit(4)));
    assertThat(BoundsComputer.lbArrayInt(ev, x, POS), is(IntVal.of(2)));
    assertThat(BoundsComputer.ubArrayInt(ev, x, POS), is(IntVal.of(10)));
    assertThat(BoundsComputer.domBoundsArray(ev, x),
        is(IntSetVal.range(0, 10)));

    // a declaration without an initializer uses its flattened binding
    final Ast.Id z = varIntArray("z", null, null);
    z.decl.setFlat(x.decl);
    assertThat(BoundsComputer.lbArrayInt(ev, z, POS), is(IntVal.of(2)));
    assertThat(BoundsComputer.ubArrayInt(ev, z, POS), is(IntVal.of(12)));
  }

  @Test void testDeclaredFloatArrayWithoutDefinition() {
    final Ast.TypeInst ti =
        ast.arrayTypeInst(POS, Type.VAR_FLOAT, null,
            Collections.<Ast.Exp>singletonList(setLit(1, 2)));
    final Ast.Id f = ast.id(POS, ast.varDecl(POS, ti, "f", null));
    final EvalException e =
        assertThrows(EvalException.class, () ->
            BoundsComputer.lbArrayFloat(ev, f, POS));
    assertThat(e.getMessage(), is("cannot determine lower bound"));
  }

  @Test void testEmptyArrayBounds() {
    final EvalException e =
        assertThrows(EvalException.class, () ->
            BoundsComputer.lbArrayInt(ev, array(), POS));
    assertThat(e.getMessage(), is("lower bound of empty array undefined"));
  }

  @Test void testFloatArrayBoundsUnknown() {
    final Ast.TypeInst ti = ast.typeInst(POS, Type.VAR_FLOAT, null);
    final Ast.Id f = ast.id(POS, ast.varDecl(POS, ti, "f", null));
    final EvalException e =
        assertThrows(EvalException.class, () ->
            BoundsComputer.ubArrayFloat(ev, array(f), POS));
    assertThat(e.getMessage(), is("cannot determine upper bound"));
  }

  @Test void testSetBounds() {
    final Ast.TypeInst ti =
        ast.typeInst(POS, Type.VAR_SET_INT, setLit(1, 4));
    final Ast.Id s = ast.id(POS, ast.varDecl(POS, ti, "s", null));
    assertThat(BoundsComputer.ubSet(ev, s, POS), is(IntSetVal.range(1, 4)));
    assertThat(BoundsComputer.lbSet(ev, s), is(IntSetVal.EMPTY));
    assertThat(BoundsComputer.hasUbSet(ev, s), is(true));
    final Ast.TypeInst ti2 = ast.typeInst(POS, Type.VAR_SET_INT, null);
    final Ast.Id t = ast.id(POS, ast.varDecl(POS, ti2, "t", null));
    assertThat(BoundsComputer.hasUbSet(ev, t), is(false));
    assertThrows(EvalException.class, () ->
        BoundsComputer.ubSet(ev, t, POS));
  }
}

// End BoundsComputerTest.java
