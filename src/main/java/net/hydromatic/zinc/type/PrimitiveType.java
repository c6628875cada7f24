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

/** Base kind of a {@link Type}. */
public enum PrimitiveType {
  BOOL("bool"),
  INT("int"),
  FLOAT("float"),
  STRING("string"),
  ANN("ann"),
  /** Type of the empty set and empty array literals; a sub-type of every
   * other primitive type. */
  BOTTOM("bot"),
  /** Generic type, written "$T" in signatures; a super-type of every other
   * primitive type. */
  TOP("$T");

  /** Name of this type in the modeling language, e.g. "int". */
  public final String description;

  PrimitiveType(String description) {
    this.description = description;
  }

  /** Returns whether a value of this type may be used where a value of
   * another type is expected. Integers coerce to floats. */
  public boolean isSubtypeOf(PrimitiveType type) {
    return this == type
        || this == BOTTOM
        || type == TOP
        || this == INT && type == FLOAT;
  }
}

// End PrimitiveType.java
