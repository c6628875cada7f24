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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link IntVal} and {@link IntSetVal}. */
public class IntValTest {
  @Test void testArithmetic() {
    assertThat(IntVal.of(7).div(IntVal.of(-2)), is(IntVal.of(-3)));
    assertThat(IntVal.of(-7).mod(IntVal.of(2)), is(IntVal.of(-1)));
    assertThat(IntVal.of(2).pow(IntVal.of(10)), is(IntVal.of(1024)));
    assertThat(IntVal.INFINITY.plus(IntVal.of(3)), is(IntVal.INFINITY));
    assertThat(IntVal.of(-2).times(IntVal.INFINITY),
        is(IntVal.MINUS_INFINITY));
    assertThat(IntVal.of(5).div(IntVal.INFINITY), is(IntVal.ZERO));
  }

  @Test void testArithmeticErrors() {
    assertThrows(ArithmeticException.class, () ->
        IntVal.of(Long.MAX_VALUE).plus(IntVal.ONE));
    assertThrows(ArithmeticException.class, () ->
        IntVal.INFINITY.plus(IntVal.MINUS_INFINITY));
    assertThrows(ArithmeticException.class, () ->
        IntVal.ZERO.times(IntVal.INFINITY));
    assertThrows(ArithmeticException.class, () ->
        IntVal.ONE.div(IntVal.ZERO));
    assertThrows(ArithmeticException.class, () ->
        IntVal.of(2).pow(IntVal.of(-1)));
  }

  @Test void testInfinity() {
    assertThat(IntVal.INFINITY.isFinite(), is(false));
    assertThat(IntVal.INFINITY.compareTo(IntVal.of(Long.MAX_VALUE)), is(1));
    assertThat(IntVal.MINUS_INFINITY.compareTo(IntVal.of(Long.MIN_VALUE)),
        is(-1));
    assertThat(IntVal.MINUS_INFINITY.toDouble(),
        is(Double.NEGATIVE_INFINITY));
    assertThat(IntVal.ofDouble(-2.7d), is(IntVal.of(-2)));
    assertThat(IntVal.INFINITY, hasToString("infinity"));
  }

  @Test void testSetToString() {
    assertThat(IntSetVal.EMPTY, hasToString("{}"));
    assertThat(IntSetVal.range(1, 5), hasToString("1..5"));
    assertThat(IntSetVal.ofValues(5, 1, 3), hasToString("{1, 3, 5}"));
    assertThat(IntSetVal.ofValues(1, 2, 3, 7, 8),
        hasToString("1..3 union 7..8"));
  }

  @Test void testSetOperations() {
    final IntSetVal s = IntSetVal.range(1, 10);
    final IntSetVal t = IntSetVal.ofValues(3, 4, 12);
    assertThat(s.union(t), hasToString("1..10 union 12..12"));
    assertThat(s.intersect(t), hasToString("3..4"));
    assertThat(s.diff(t), hasToString("1..2 union 5..10"));
    assertThat(s.card(), is(IntVal.of(10)));
    assertThat(s.isContiguous(), is(true));
    assertThat(s.diff(t).isContiguous(), is(false));
    assertThat(t.isSubsetOf(s), is(false));
    assertThat(s.contains(IntVal.of(10)), is(true));
    assertThat(IntSetVal.range(5, 1).isEmpty(), is(true));
    assertThat(IntSetVal.INFINITE.isFinite(), is(false));
    assertThat(IntSetVal.INFINITE.card(), is(IntVal.INFINITY));
  }
}

// End IntValTest.java
