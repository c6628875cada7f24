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

import com.google.common.collect.DiscreteDomain;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Integer value that may be positive or negative infinity.
 *
 * <p>Arithmetic on finite values throws {@link ArithmeticException} on
 * overflow. Arithmetic that involves infinities follows the extended
 * real line, and throws {@link ArithmeticException} where the result is
 * undefined, such as {@code infinity - infinity} or {@code 0 * infinity}.
 * {@link Evaluator#apply} and {@link Evaluator#evalInt} convert it to an
 * {@link EvalException} at the position of the failing expression. */
public final class IntVal implements Comparable<IntVal> {
  public static final IntVal ZERO = new IntVal(0, 0);
  public static final IntVal ONE = new IntVal(1, 0);
  public static final IntVal INFINITY = new IntVal(0, 1);
  public static final IntVal MINUS_INFINITY = new IntVal(0, -1);

  /** Discrete domain of integers, including the two infinities. The
   * successor of positive infinity is undefined, and each infinity is its
   * own predecessor or successor. */
  public static final DiscreteDomain<IntVal> DOMAIN = new IntDomain();

  private final long value;
  /** -1 for negative infinity, 1 for positive infinity, 0 if finite. */
  private final int inf;

  private IntVal(long value, int inf) {
    this.value = value;
    this.inf = inf;
  }

  /** Creates a finite IntVal. */
  public static IntVal of(long value) {
    return value == 0 ? ZERO : value == 1 ? ONE : new IntVal(value, 0);
  }

  public boolean isFinite() {
    return inf == 0;
  }

  public boolean isPlusInfinity() {
    return inf > 0;
  }

  public boolean isMinusInfinity() {
    return inf < 0;
  }

  /** Returns the value as a long; throws if infinite. */
  public long toLong() {
    if (inf != 0) {
      throw new ArithmeticException("cannot convert " + this + " to integer");
    }
    return value;
  }

  /** Returns the value as an int; throws if infinite or out of range. */
  public int toInt() {
    return Math.toIntExact(toLong());
  }

  /** Returns the value as a double; infinities map to IEEE infinities. */
  public double toDouble() {
    return inf > 0 ? Double.POSITIVE_INFINITY
        : inf < 0 ? Double.NEGATIVE_INFINITY
        : (double) value;
  }

  /** Converts a double to an integer, truncating towards zero. */
  public static IntVal ofDouble(double d) {
    if (d == Double.POSITIVE_INFINITY) {
      return INFINITY;
    }
    if (d == Double.NEGATIVE_INFINITY) {
      return MINUS_INFINITY;
    }
    if (Double.isNaN(d) || d >= 0x1p63 || d < -0x1p63) {
      throw new ArithmeticException("integer overflow converting " + d);
    }
    return of((long) d);
  }

  public int signum() {
    return inf != 0 ? inf : Long.signum(value);
  }

  public IntVal negate() {
    if (inf != 0) {
      return inf > 0 ? MINUS_INFINITY : INFINITY;
    }
    return of(Math.negateExact(value));
  }

  public IntVal abs() {
    return signum() < 0 ? negate() : this;
  }

  public IntVal plus(IntVal v) {
    if (inf != 0 || v.inf != 0) {
      if (inf != 0 && v.inf != 0 && inf != v.inf) {
        throw new ArithmeticException("undefined result of infinity + "
            + "-infinity");
      }
      return inf != 0 ? this : v;
    }
    return of(Math.addExact(value, v.value));
  }

  public IntVal minus(IntVal v) {
    return plus(v.negate());
  }

  public IntVal times(IntVal v) {
    if (inf != 0 || v.inf != 0) {
      final int sign = signum() * v.signum();
      if (sign == 0) {
        throw new ArithmeticException("undefined result of 0 * infinity");
      }
      return sign > 0 ? INFINITY : MINUS_INFINITY;
    }
    return of(Math.multiplyExact(value, v.value));
  }

  /** Integer division, truncating towards zero. */
  public IntVal div(IntVal v) {
    if (v.signum() == 0) {
      throw new ArithmeticException("division by zero");
    }
    if (inf != 0) {
      if (v.inf != 0) {
        throw new ArithmeticException("undefined result of infinity div "
            + "infinity");
      }
      return signum() * v.signum() > 0 ? INFINITY : MINUS_INFINITY;
    }
    if (v.inf != 0) {
      return ZERO;
    }
    if (value == Long.MIN_VALUE && v.value == -1) {
      throw new ArithmeticException("integer overflow");
    }
    return of(value / v.value);
  }

  /** Remainder of truncating division; has the sign of the dividend. */
  public IntVal mod(IntVal v) {
    if (v.signum() == 0) {
      throw new ArithmeticException("division by zero");
    }
    if (inf != 0 || v.inf != 0) {
      throw new ArithmeticException("undefined result of mod with infinity");
    }
    if (v.value == -1) {
      return ZERO;
    }
    return of(value % v.value);
  }

  /** Raises to a non-negative power. */
  public IntVal pow(IntVal exponent) {
    long e = exponent.toLong();
    if (e < 0) {
      throw new ArithmeticException("negative exponent");
    }
    long base = toLong();
    long result = 1;
    while (e > 0) {
      if ((e & 1) != 0) {
        result = Math.multiplyExact(result, base);
      }
      e >>= 1;
      if (e > 0) {
        base = Math.multiplyExact(base, base);
      }
    }
    return of(result);
  }

  public IntVal plus(long v) {
    return plus(of(v));
  }

  public static IntVal min(IntVal v0, IntVal v1) {
    return v0.compareTo(v1) <= 0 ? v0 : v1;
  }

  public static IntVal max(IntVal v0, IntVal v1) {
    return v0.compareTo(v1) >= 0 ? v0 : v1;
  }

  @Override public int compareTo(IntVal o) {
    if (inf != o.inf) {
      return Integer.compare(inf, o.inf);
    }
    return inf != 0 ? 0 : Long.compare(value, o.value);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof IntVal
        && inf == ((IntVal) o).inf
        && value == ((IntVal) o).value;
  }

  @Override public int hashCode() {
    return inf == 0 ? Long.hashCode(value) : inf * 0x7fffffff;
  }

  @Override public String toString() {
    return inf > 0 ? "infinity"
        : inf < 0 ? "-infinity"
        : Long.toString(value);
  }

  /** Implementation of {@link #DOMAIN}. */
  private static class IntDomain extends DiscreteDomain<IntVal> {
    @Override public @Nullable IntVal next(IntVal value) {
      if (value.inf != 0) {
        return value.inf > 0 ? null : value;
      }
      return value.value == Long.MAX_VALUE ? INFINITY : value.plus(ONE);
    }

    @Override public @Nullable IntVal previous(IntVal value) {
      if (value.inf != 0) {
        return value.inf < 0 ? null : value;
      }
      return value.value == Long.MIN_VALUE ? MINUS_INFINITY
          : value.minus(ONE);
    }

    @Override public long distance(IntVal start, IntVal end) {
      if (start.inf != 0 || end.inf != 0) {
        return end.compareTo(start) >= 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
      }
      try {
        return Math.subtractExact(end.value, start.value);
      } catch (ArithmeticException e) {
        return end.value > start.value ? Long.MAX_VALUE : Long.MIN_VALUE;
      }
    }

    @Override public IntVal minValue() {
      return MINUS_INFINITY;
    }

    @Override public IntVal maxValue() {
      return INFINITY;
    }
  }
}

// End IntVal.java
