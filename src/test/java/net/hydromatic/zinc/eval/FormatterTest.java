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
import static net.hydromatic.zinc.TestUtils.floatLit;
import static net.hydromatic.zinc.TestUtils.intArray;
import static net.hydromatic.zinc.TestUtils.intArray2d;
import static net.hydromatic.zinc.TestUtils.intLit;
import static net.hydromatic.zinc.TestUtils.session;
import static net.hydromatic.zinc.TestUtils.setLit;
import static net.hydromatic.zinc.TestUtils.stringLit;
import static net.hydromatic.zinc.TestUtils.varInt;
import static net.hydromatic.zinc.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collections;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.compile.Model;
import net.hydromatic.zinc.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Formatter}. */
public class FormatterTest {
  private final Evaluator ev = session().evaluator();

  @Test void testShow() {
    assertThat(Formatter.show(ev, intLit(3)), is("3"));
    assertThat(Formatter.show(ev, intArray(1, 2, 3)), is("[1, 2, 3]"));
    assertThat(Formatter.show(ev, intArray2d(1, 2, 3, 4)),
        is("[1, 2, 3, 4]"));
    assertThat(Formatter.show(ev, varInt("x", 1, 5)), is("x"));
    assertThat(Formatter.show(ev, stringLit("a\"b")), is("\"a\\\"b\""));
  }

  @Test void testShowFloat() {
    assertThat(Formatter.showFloat(3d), is("3.0"));
    assertThat(Formatter.showFloat(1.5e-7), is("1.5e-7"));
    assertThat(Formatter.showFloat(Double.NEGATIVE_INFINITY),
        is("-infinity"));
    assertThat(Formatter.showFloat(Double.NaN), is("nan"));
  }

  @Test void testShowJson() throws IOException {
    assertThat(Formatter.showJson(ev, intLit(-2)), is("-2"));
    assertThat(Formatter.showJson(ev, floatLit(2.5d)), is("2.5"));
    assertThat(Formatter.showJson(ev, stringLit("tab\there")),
        is("\"tab\\there\""));
    assertThat(Formatter.showJson(ev, ast.absent(POS)), is("null"));
    assertThat(Formatter.showJson(ev, varInt("x", 1, 5)), is("\"x\""));
    assertThat(Formatter.showJson(ev, array()), is("[]"));

    final String json = Formatter.showJson(ev, intArray2d(1, 2, 3, 4));
    assertThat(json, is("[[1,2],[3,4]]"));
    final JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.size(), is(2));
    assertThat(node.get(1).get(0).asInt(), is(3));
  }

  @Test void testShowJsonSet() throws IOException {
    final Ast.SetLiteral set =
        ast.setLiteral(POS, IntSetVal.ofValues(1, 2, 3, 5));
    final String json = Formatter.showJson(ev, set);
    assertThat(json, is("{\"set\":[[1,3],5]}"));
    final JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.get("set").get(0).isArray(), is(true));
    assertThat(node.get("set").get(1).asInt(), is(5));
  }

  @Test void testShowJsonNonFinite() {
    final EvalException e =
        assertThrows(EvalException.class, () ->
            Formatter.showJson(ev, floatLit(Double.POSITIVE_INFINITY)));
    assertThat(e.getMessage(), is("cannot represent infinity in JSON"));
  }

  @Test void testFormat() {
    assertThat(Formatter.format(ev, 8, 2, floatLit(3.14159d), POS),
        is("    3.14"));
    assertThat(Formatter.format(ev, -6, 1, floatLit(2.25d), POS),
        is("2.2   "));
    assertThat(Formatter.format(ev, 5, null, intLit(42), POS), is("   42"));
    assertThat(Formatter.format(ev, 0, null, floatLit(3.14159d), POS),
        is("3.14158999999999988"));
    assertThat(Formatter.format(ev, 6, 3, stringLit("abcdef"), POS),
        is("   \"ab"));
    final EvalException e =
        assertThrows(EvalException.class, () ->
            Formatter.format(ev, 5, -1, intLit(1), POS));
    assertThat(e.getMessage(), is("output precision cannot be negative"));
  }

  @Test void testFormatUsesPrecisionProperty() {
    final Session session = session();
    Prop.FLOAT_PRECISION.set(session.map, 3);
    assertThat(
        Formatter.format(session.evaluator(), 0, null, floatLit(0.5d), POS),
        is("0.500"));
  }

  @Test void testJustify() {
    assertThat(Formatter.justify(4, "ab"), is("  ab"));
    assertThat(Formatter.justify(-4, "ab"), is("ab  "));
    assertThat(Formatter.justify(0, "ab"), is("ab"));
    assertThat(Formatter.justify(1, "abc"), is("abc"));
  }

  @Test void testFixed() {
    assertThat(Formatter.fixed(-1.5d, 0), is("-2"));
    assertThat(Formatter.fixed(-0d, 1), is("-0.0"));
    assertThat(Formatter.fixed(1d, 3), is("1.000"));
  }

  @Test void testShowIntAndShowFloat() {
    assertThat(Formatter.showInt(ev, 4, intLit(7)), is("   7"));
    assertThat(Formatter.showInt(ev, 4, varInt("y", 1, 5)), is("y"));
    assertThat(Formatter.showFloat(ev, 6, 2, floatLit(1.005d), POS),
        is("  1.00"));
    assertThrows(EvalException.class, () ->
        Formatter.showFloat(ev, 6, -2, floatLit(1d), POS));
  }

  @Test void testShowDznId() {
    assertThat(Formatter.showDznId("x_1"), is("x_1"));
    assertThat(Formatter.showDznId("1x"), is("'1x'"));
    assertThat(Formatter.showDznId("a b"), is("'a b'"));
  }

  @Test void testOutputJsonParameters() throws IOException {
    final Ast.VarDecl n =
        ast.outputVarDecl(POS, ast.typeInst(POS, Type.PAR_INT, null), "n",
            intLit(3));
    final Ast.VarDecl xs =
        ast.outputVarDecl(POS,
            ast.arrayTypeInst(POS, Type.PAR_INT, null,
                Collections.<Ast.Exp>singletonList(setLit(1, 2))),
            "xs", intArray(4, 5));
    final Ast.VarDecl hidden =
        ast.varDecl(POS, ast.typeInst(POS, Type.PAR_INT, null), "hidden",
            intLit(9));
    final Model model =
        Model.builder().declareLibrary().add(n).add(hidden).add(xs).build();
    final String json =
        Formatter.outputJsonParameters(session(model).evaluator());
    assertThat(json, is("{\n  \"n\" : 3,\n  \"xs\" : [4,5]\n}\n"));
    final JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.has("hidden"), is(false));
    assertThat(node.get("xs").get(1).asInt(), is(5));
  }
}

// End FormatterTest.java
