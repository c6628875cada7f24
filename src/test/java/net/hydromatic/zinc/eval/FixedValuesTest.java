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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link FixedValues}. */
public class FixedValuesTest {
  private final Evaluator ev = session().evaluator();

  @Test void testLiteralIsFixed() {
    final Ast.IntLiteral three = intLit(3);
    assertThat(FixedValues.isFixed(ev, three), is(true));
    assertThat(FixedValues.fix(ev, three), sameInstance(three));
  }

  @Test void testSingletonDomainIsFixed() {
    final Ast.Id x = varInt("x", 4, 4);
    assertThat(FixedValues.isFixed(ev, x), is(true));
    assertThat(FixedValues.fix(ev, x), hasToString("4"));
  }

  @Test void testDefinedVariableIsFixed() {
    final Ast.TypeInst ti = ast.typeInst(POS, Type.VAR_INT, setLit(1, 9));
    final Ast.Id x = ast.id(POS, ast.varDecl(POS, ti, "x", intLit(6)));
    assertThat(FixedValues.fix(ev, x), hasToString("6"));
  }

  @Test void testUnfixed() {
    final Ast.Id y = varInt("y", 1, 5);
    assertThat(FixedValues.isFixed(ev, y), is(false));
    assertThat(FixedValues.resolve(ev, y), nullValue());
    final EvalException e =
        assertThrows(EvalException.class, () -> FixedValues.fix(ev, y));
    assertThat(e.getMessage(), is("expression is not fixed"));
  }

  @Test void testFixArray() {
    final Ast.ArrayLiteral a = array(intLit(1), varInt("x", 2, 2));
    assertThat(FixedValues.isFixedArray(ev, a), is(true));
    final Ast.ArrayLiteral fixed = FixedValues.fixArray(ev, a);
    assertThat(fixed, hasToString("[1, 2]"));
    assertThat(fixed.type, is(Type.array(1, Type.PAR_INT)));
    assertThat(fixed.dims, is(a.dims));
  }

  @Test void testFixArrayReportsFirstUnfixedElement() {
    final Ast.Id y = varInt("y", 1, 5);
    final Ast.ArrayLiteral a = array(intLit(1), y, varInt("z", 1, 5));
    assertThat(FixedValues.isFixedArray(ev, a), is(false));
    final EvalException e =
        assertThrows(EvalException.class, () -> FixedValues.fixArray(ev, a));
    assertThat(e.pos(), is(y.pos));
  }

  @Test void testEmptyArrayIsFixed() {
    assertThat(FixedValues.isFixedArray(ev, array()), is(true));
  }

  @Test void testOptional() {
    final Ast.Absent absent = ast.absent(POS);
    assertThat(FixedValues.occurs(ev, absent), is(false));
    assertThat(FixedValues.occurs(ev, intLit(2)), is(true));
    assertThat(FixedValues.occurs(ev, varInt("y", 1, 5)), is(true));
    assertThat(FixedValues.deopt(ev, intLit(2), POS), hasToString("2"));
    final ResultUndefinedException e =
        assertThrows(ResultUndefinedException.class, () ->
            FixedValues.deopt(ev, absent, POS));
    assertThat(e.getMessage(), is("cannot evaluate deopt on absent value"));
  }
}

// End FixedValuesTest.java
