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
import java.util.NoSuchElementException;
import net.hydromatic.zinc.util.RangeSets;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Set of floating-point numbers, represented as a canonical list of closed
 * ranges.
 *
 * <p>Unlike {@link IntSetVal}, adjacent ranges are not merged, because
 * floating-point ranges are not discrete. There is no difference
 * operation. */
public final class FloatSetVal {
  public static final FloatSetVal EMPTY = new FloatSetVal(ImmutableList.of());

  public final ImmutableList<Range<Double>> ranges;

  private FloatSetVal(ImmutableList<Range<Double>> ranges) {
    this.ranges = ranges;
  }

  public static FloatSetVal of(Iterable<Range<Double>> ranges) {
    return new FloatSetVal(RangeSets.canonical(ranges, null));
  }

  public static FloatSetVal range(double lower, double upper) {
    if (lower > upper) {
      return EMPTY;
    }
    return new FloatSetVal(ImmutableList.of(Range.closed(lower, upper)));
  }

  /** Converts an integer set to a float set. */
  public static FloatSetVal of(IntSetVal s) {
    final ImmutableList.Builder<Range<Double>> b = ImmutableList.builder();
    for (Range<IntVal> range : s.ranges) {
      b.add(
          Range.closed(range.lowerEndpoint().toDouble(),
              range.upperEndpoint().toDouble()));
    }
    return of(b.build());
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  public int size() {
    return ranges.size();
  }

  public double min(int i) {
    return ranges.get(i).lowerEndpoint();
  }

  public double max(int i) {
    return ranges.get(i).upperEndpoint();
  }

  public double min() {
    if (ranges.isEmpty()) {
      throw new NoSuchElementException("empty set");
    }
    return min(0);
  }

  public double max() {
    if (ranges.isEmpty()) {
      throw new NoSuchElementException("empty set");
    }
    return max(ranges.size() - 1);
  }

  public boolean contains(double v) {
    for (Range<Double> range : ranges) {
      if (range.contains(v)) {
        return true;
      }
    }
    return false;
  }

  public FloatSetVal union(FloatSetVal s) {
    return new FloatSetVal(RangeSets.union(ranges, s.ranges, null));
  }

  public FloatSetVal intersect(FloatSetVal s) {
    return new FloatSetVal(RangeSets.intersect(ranges, s.ranges));
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof FloatSetVal
        && ranges.equals(((FloatSetVal) o).ranges);
  }

  @Override public int hashCode() {
    return ranges.hashCode();
  }

  @Override public String toString() {
    if (ranges.isEmpty()) {
      return "{}";
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < ranges.size(); i++) {
      if (i > 0) {
        b.append(" union ");
      }
      b.append(Formatter.showFloat(min(i)))
          .append("..")
          .append(Formatter.showFloat(max(i)));
    }
    return b.toString();
  }
}

// End FloatSetVal.java
