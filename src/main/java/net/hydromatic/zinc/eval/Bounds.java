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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lower and upper bound of an expression.
 *
 * <p>If {@link #valid} is false, the bounds could not be determined, and the
 * expression should be treated as unbounded; {@link #lower} and
 * {@link #upper} then hold the widest possible bounds.
 *
 * @param <C> Value type, {@link IntVal} or {@link Double} */
public final class Bounds<C extends Comparable<C>> {
  public final C lower;
  public final C upper;
  public final boolean valid;

  private Bounds(C lower, C upper, boolean valid) {
    this.lower = requireNonNull(lower);
    this.upper = requireNonNull(upper);
    this.valid = valid;
  }

  public static <C extends Comparable<C>> Bounds<C> of(C lower, C upper) {
    return new Bounds<>(lower, upper, true);
  }

  public static <C extends Comparable<C>> Bounds<C> point(C value) {
    return new Bounds<>(value, value, true);
  }

  /** Returns invalid integer bounds, -infinity to infinity. */
  public static Bounds<IntVal> invalidInt() {
    return new Bounds<>(IntVal.MINUS_INFINITY, IntVal.INFINITY, false);
  }

  /** Returns invalid float bounds, -infinity to infinity. */
  public static Bounds<Double> invalidFloat() {
    return new Bounds<>(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
        false);
  }

  /** Returns the smallest bounds that contain both these and {@code b};
   * invalid if either is invalid. */
  public Bounds<C> hull(Bounds<C> b) {
    final C l = lower.compareTo(b.lower) <= 0 ? lower : b.lower;
    final C u = upper.compareTo(b.upper) >= 0 ? upper : b.upper;
    return new Bounds<>(l, u, valid && b.valid);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Bounds
        && lower.equals(((Bounds<?>) o).lower)
        && upper.equals(((Bounds<?>) o).upper)
        && valid == ((Bounds<?>) o).valid;
  }

  @Override public int hashCode() {
    return Objects.hash(lower, upper, valid);
  }

  @Override public String toString() {
    return (valid ? "" : "invalid ") + "[" + lower + ", " + upper + "]";
  }
}

// End Bounds.java
