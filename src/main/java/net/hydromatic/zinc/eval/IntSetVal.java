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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import net.hydromatic.zinc.util.RangeSets;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Set of integers, represented as a canonical list of closed ranges.
 *
 * <p>Ranges are sorted, and no two ranges overlap or are adjacent. Ranges may
 * have infinite endpoints.
 *
 * @see RangeSets */
public final class IntSetVal {
  public static final IntSetVal EMPTY = new IntSetVal(ImmutableList.of());

  /** The set of all integers, {@code -infinity..infinity}. */
  public static final IntSetVal INFINITE =
      new IntSetVal(
          ImmutableList.of(
              Range.closed(IntVal.MINUS_INFINITY, IntVal.INFINITY)));

  public final ImmutableList<Range<IntVal>> ranges;

  private IntSetVal(ImmutableList<Range<IntVal>> ranges) {
    this.ranges = ranges;
  }

  /** Creates a set from ranges in any order, merging ranges that overlap or
   * are adjacent. */
  public static IntSetVal of(Iterable<Range<IntVal>> ranges) {
    return new IntSetVal(RangeSets.canonical(ranges, IntVal.DOMAIN));
  }

  /** Creates a set containing the range {@code lower..upper}; empty if
   * {@code lower > upper}. */
  public static IntSetVal range(IntVal lower, IntVal upper) {
    if (lower.compareTo(upper) > 0) {
      return EMPTY;
    }
    return new IntSetVal(ImmutableList.of(Range.closed(lower, upper)));
  }

  public static IntSetVal range(long lower, long upper) {
    return range(IntVal.of(lower), IntVal.of(upper));
  }

  /** Creates a set from a collection of values. */
  public static IntSetVal ofValues(Iterable<IntVal> values) {
    final List<Range<IntVal>> list = new ArrayList<>();
    for (IntVal value : values) {
      list.add(Range.singleton(value));
    }
    return of(list);
  }

  /** Creates a set from a list of values. */
  public static IntSetVal ofValues(long... values) {
    final List<Range<IntVal>> list = new ArrayList<>();
    for (long value : values) {
      list.add(Range.singleton(IntVal.of(value)));
    }
    return of(list);
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  /** Returns the number of ranges. */
  public int size() {
    return ranges.size();
  }

  /** Returns the lower endpoint of the {@code i}th range. */
  public IntVal min(int i) {
    return ranges.get(i).lowerEndpoint();
  }

  /** Returns the upper endpoint of the {@code i}th range. */
  public IntVal max(int i) {
    return ranges.get(i).upperEndpoint();
  }

  /** Returns the least element; throws if the set is empty. */
  public IntVal min() {
    if (ranges.isEmpty()) {
      throw new NoSuchElementException("empty set");
    }
    return min(0);
  }

  /** Returns the greatest element; throws if the set is empty. */
  public IntVal max() {
    if (ranges.isEmpty()) {
      throw new NoSuchElementException("empty set");
    }
    return max(ranges.size() - 1);
  }

  /** Returns the number of elements, or infinity if the set is unbounded. */
  public IntVal card() {
    IntVal c = IntVal.ZERO;
    for (Range<IntVal> range : ranges) {
      final IntVal width =
          range.upperEndpoint().minus(range.lowerEndpoint()).plus(1);
      c = c.plus(width);
      if (!c.isFinite()) {
        return IntVal.INFINITY;
      }
    }
    return c;
  }

  /** Returns whether this set is a single contiguous range (or empty). */
  public boolean isContiguous() {
    return ranges.size() <= 1;
  }

  /** Returns whether every range is bounded. */
  public boolean isFinite() {
    return ranges.isEmpty()
        || min().isFinite() && max().isFinite();
  }

  public boolean contains(IntVal v) {
    for (Range<IntVal> range : ranges) {
      if (range.contains(v)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether every element of this set is in {@code s}. */
  public boolean isSubsetOf(IntSetVal s) {
    return diff(s).isEmpty();
  }

  public IntSetVal union(IntSetVal s) {
    return new IntSetVal(RangeSets.union(ranges, s.ranges, IntVal.DOMAIN));
  }

  public IntSetVal intersect(IntSetVal s) {
    return new IntSetVal(RangeSets.intersect(ranges, s.ranges));
  }

  public IntSetVal diff(IntSetVal s) {
    return new IntSetVal(RangeSets.diff(ranges, s.ranges, IntVal.DOMAIN));
  }

  /** Returns the elements in ascending order; throws if the set is
   * unbounded. */
  public List<IntVal> values() {
    final List<IntVal> list = new ArrayList<>();
    for (Range<IntVal> range : ranges) {
      final long upper = range.upperEndpoint().toLong();
      for (long v = range.lowerEndpoint().toLong(); v <= upper; v++) {
        list.add(IntVal.of(v));
      }
    }
    return list;
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof IntSetVal
        && ranges.equals(((IntSetVal) o).ranges);
  }

  @Override public int hashCode() {
    return ranges.hashCode();
  }

  /** Returns this set in the syntax of the modeling language, for example
   * "{}", "1..5", "{1, 3, 5}" or "1..3 union 5..7". */
  @Override public String toString() {
    if (ranges.isEmpty()) {
      return "{}";
    }
    final StringBuilder b = new StringBuilder();
    boolean allSingletons = true;
    for (Range<IntVal> range : ranges) {
      allSingletons &= range.lowerEndpoint().equals(range.upperEndpoint());
    }
    if (allSingletons) {
      b.append('{');
      for (int i = 0; i < ranges.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(min(i));
      }
      return b.append('}').toString();
    }
    for (int i = 0; i < ranges.size(); i++) {
      if (i > 0) {
        b.append(" union ");
      }
      b.append(min(i)).append("..").append(max(i));
    }
    return b.toString();
  }
}

// End IntSetVal.java
