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
package net.hydromatic.zinc.ast;

import com.google.common.collect.ImmutableMap;

/** Sub-types of {@link AstNode}, and the operators of binary and unary
 * expressions.
 *
 * <p>Precedences follow the modeling language: a higher number binds more
 * tightly. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),
  SET_LITERAL(true),
  ARRAY_LITERAL(true),
  ABSENT(true),

  // declarations
  VAR_DECL(" : "),
  TYPE_INST,

  CALL(true),
  ARRAY_ACCESS(true),
  ITE,

  // binary operators
  PLUS_PLUS(" ++ ", 10, false),
  TIMES(" * ", 9),
  DIVIDE(" / ", 9),
  DIV(" div ", 9),
  MOD(" mod ", 9),
  INTERSECT(" intersect ", 9),
  PLUS(" + ", 8),
  MINUS(" - ", 8),
  DOT_DOT(" .. ", 7),
  UNION(" union ", 6),
  DIFF(" diff ", 6),
  SYMDIFF(" symdiff ", 6),
  EQ(" = ", 5),
  NE(" != ", 5),
  LT(" < ", 5),
  LE(" <= ", 5),
  GT(" > ", 5),
  GE(" >= ", 5),
  IN(" in ", 5),
  SUBSET(" subset ", 5),
  SUPERSET(" superset ", 5),
  AND(" /\\ ", 4),
  OR(" \\/ ", 3),
  XOR(" xor ", 3),
  IMPL(" -> ", 2, false),
  RIMPL(" <- ", 2),
  EQUIV(" <-> ", 1),

  // unary operators
  NEGATE("-", 11, 11),
  POSITIVE("+", 11, 11),
  NOT("not ", 11, 11);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Binary and unary operators, keyed by their unpadded name, for example
   * "+" and "div". */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isBinary()) {
        b.put(op.padded.trim(), op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return compareTo(PLUS_PLUS) >= 0 && compareTo(EQUIV) <= 0;
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
