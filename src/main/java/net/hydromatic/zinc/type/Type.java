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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Type of an expression.
 *
 * <p>A type combines a base {@link PrimitiveType}, whether it is a set of
 * that base, whether it is optional, whether it is a fixed parameter or a
 * decision variable, and its dimensionality.
 *
 * <p>Dimensionality 0 is a scalar, N is an N-dimensional array, and -1 means
 * an array of any dimension; -1 occurs only in the parameter types of function
 * declarations. */
public final class Type {
  public static final Type PAR_BOOL = new Type(PrimitiveType.BOOL, Inst.PAR);
  public static final Type VAR_BOOL = new Type(PrimitiveType.BOOL, Inst.VAR);
  public static final Type PAR_INT = new Type(PrimitiveType.INT, Inst.PAR);
  public static final Type VAR_INT = new Type(PrimitiveType.INT, Inst.VAR);
  public static final Type PAR_FLOAT = new Type(PrimitiveType.FLOAT, Inst.PAR);
  public static final Type VAR_FLOAT = new Type(PrimitiveType.FLOAT, Inst.VAR);
  public static final Type PAR_STRING =
      new Type(PrimitiveType.STRING, Inst.PAR);
  public static final Type ANN = new Type(PrimitiveType.ANN, Inst.PAR);
  public static final Type PAR_SET_INT = PAR_INT.setOf();
  public static final Type VAR_SET_INT = VAR_INT.setOf();
  public static final Type PAR_SET_FLOAT = PAR_FLOAT.setOf();
  public static final Type PAR_BOTTOM =
      new Type(PrimitiveType.BOTTOM, Inst.PAR);
  /** Generic parameter type, "$T". */
  public static final Type PAR_TOP = new Type(PrimitiveType.TOP, Inst.PAR);
  /** Most general scalar type, "var opt $T". */
  public static final Type VAR_TOP = new Type(PrimitiveType.TOP, Inst.VAR,
      false, true, 0);

  public final PrimitiveType base;
  public final Inst inst;
  public final boolean set;
  public final boolean opt;
  public final int dim;

  private Type(PrimitiveType base, Inst inst) {
    this(base, inst, false, false, 0);
  }

  private Type(PrimitiveType base, Inst inst, boolean set, boolean opt,
      int dim) {
    this.base = requireNonNull(base);
    this.inst = requireNonNull(inst);
    this.set = set;
    this.opt = opt;
    this.dim = dim;
    checkArgument(dim >= -1, "invalid dimension %s", dim);
  }

  /** Returns an array type of any dimension whose elements have type
   * {@code element}; for example, {@code array(PAR_INT)} is
   * "array[$] of int". */
  public static Type array(Type element) {
    return array(-1, element);
  }

  /** Returns an array type with a given number of dimensions. */
  public static Type array(int dim, Type element) {
    checkArgument(element.dim == 0, "element must be scalar");
    return new Type(element.base, element.inst, element.set, element.opt,
        dim);
  }

  /** Returns the set type whose elements have this type. */
  public Type setOf() {
    checkArgument(dim == 0 && !set, "cannot make set of %s", this);
    return new Type(base, inst, true, false, 0);
  }

  /** Returns the type of the elements of this array type. */
  public Type elementType() {
    return dim == 0 ? this : new Type(base, inst, set, opt, 0);
  }

  /** Returns this type with a different number of dimensions. */
  public Type withDim(int dim) {
    return dim == this.dim ? this : new Type(base, inst, set, opt, dim);
  }

  /** Returns this type as a decision variable. */
  public Type toVar() {
    return inst == Inst.VAR ? this : new Type(base, Inst.VAR, set, opt, dim);
  }

  /** Returns this type as a fixed parameter. */
  public Type toPar() {
    return inst == Inst.PAR ? this : new Type(base, Inst.PAR, set, opt, dim);
  }

  /** Returns this type as an optional type. */
  public Type toOpt() {
    return opt ? this : new Type(base, inst, set, true, dim);
  }

  public boolean isPar() {
    return inst == Inst.PAR;
  }

  public boolean isVar() {
    return inst == Inst.VAR;
  }

  public boolean isArray() {
    return dim != 0;
  }

  /** Returns whether this is a scalar integer type, par or var. */
  public boolean isInt() {
    return base == PrimitiveType.INT && !set && dim == 0;
  }

  /** Returns whether this is a scalar float type, par or var. */
  public boolean isFloat() {
    return base == PrimitiveType.FLOAT && !set && dim == 0;
  }

  /** Returns whether this is a scalar set-of-int type. */
  public boolean isIntSet() {
    return base == PrimitiveType.INT && set && dim == 0;
  }

  /**
   * Returns whether an argument of this type may be passed to a parameter of
   * type {@code type}.
   *
   * <p>A parameter may accept a supertype base (see
   * {@link PrimitiveType#isSubtypeOf}); a decision variable parameter accepts
   * a fixed argument; an optional parameter accepts a non-optional argument;
   * and a parameter of dimension -1 accepts an array of any dimension.
   */
  public boolean isSubtypeOf(Type type) {
    if (type.dim == -1 ? dim == 0 : dim != type.dim) {
      return false;
    }
    if (set != type.set && type.base != PrimitiveType.TOP) {
      return false;
    }
    if (inst == Inst.VAR && type.inst == Inst.PAR) {
      return false;
    }
    if (opt && !type.opt) {
      return false;
    }
    return base.isSubtypeOf(type.base);
  }

  @Override public int hashCode() {
    return Objects.hash(base, inst, set, opt, dim);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Type
        && base == ((Type) o).base
        && inst == ((Type) o).inst
        && set == ((Type) o).set
        && opt == ((Type) o).opt
        && dim == ((Type) o).dim;
  }

  /** Returns the description of this type in the modeling language, for
   * example "array[int, int] of var opt int". */
  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    if (dim == -1) {
      b.append("array[$] of ");
    } else if (dim > 0) {
      b.append("array[int");
      for (int i = 1; i < dim; i++) {
        b.append(", int");
      }
      b.append("] of ");
    }
    if (inst == Inst.VAR) {
      b.append("var ");
    }
    if (opt) {
      b.append("opt ");
    }
    if (set) {
      b.append("set of ");
    }
    return b.append(base.description).toString();
  }

  /** Instantiation of a type. */
  public enum Inst {
    /** Fixed parameter, known at compile time. */
    PAR,
    /** Decision variable. */
    VAR
  }
}

// End Type.java
