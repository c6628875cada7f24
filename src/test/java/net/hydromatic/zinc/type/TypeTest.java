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
package net.hydromatic.zinc.type;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import org.junit.jupiter.api.Test;

/** Tests for {@link Type}. */
public class TypeTest {
  @Test void testToString() {
    assertThat(Type.PAR_INT, hasToString("int"));
    assertThat(Type.VAR_SET_INT, hasToString("var set of int"));
    assertThat(Type.VAR_TOP, hasToString("var opt $T"));
    assertThat(Type.array(Type.PAR_FLOAT), hasToString("array[$] of float"));
    assertThat(Type.array(2, Type.VAR_BOOL),
        hasToString("array[int, int] of var bool"));
  }

  @Test void testSubtype() {
    assertThat(Type.PAR_INT.isSubtypeOf(Type.PAR_FLOAT), is(true));
    assertThat(Type.PAR_FLOAT.isSubtypeOf(Type.PAR_INT), is(false));
    assertThat(Type.PAR_INT.isSubtypeOf(Type.VAR_INT), is(true));
    assertThat(Type.VAR_INT.isSubtypeOf(Type.PAR_INT), is(false));
    assertThat(Type.PAR_SET_INT.isSubtypeOf(Type.VAR_TOP), is(true));
    assertThat(Type.PAR_SET_INT.isSubtypeOf(Type.VAR_INT), is(false));
    assertThat(Type.PAR_INT.toOpt().isSubtypeOf(Type.PAR_INT), is(false));
  }

  @Test void testArraySubtype() {
    final Type array2d = Type.array(2, Type.PAR_INT);
    assertThat(array2d.isSubtypeOf(Type.array(Type.VAR_TOP)), is(true));
    assertThat(array2d.isSubtypeOf(Type.array(1, Type.VAR_TOP)), is(false));
    assertThat(Type.PAR_INT.isSubtypeOf(Type.array(Type.PAR_INT)), is(false));
    assertThat(Type.array(1, Type.PAR_BOTTOM)
        .isSubtypeOf(Type.array(Type.PAR_STRING)), is(true));
  }

  @Test void testConversions() {
    assertThat(Type.VAR_INT.toPar(), is(Type.PAR_INT));
    assertThat(Type.PAR_INT.toVar(), is(Type.VAR_INT));
    assertThat(Type.array(3, Type.PAR_INT).elementType(), is(Type.PAR_INT));
    assertThat(Type.PAR_INT.withDim(1), is(Type.array(1, Type.PAR_INT)));
  }
}

// End TypeTest.java
