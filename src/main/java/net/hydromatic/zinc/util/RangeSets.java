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
package net.hydromatic.zinc.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.BoundType;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Algorithms on canonical range sets.
 *
 * <p>A canonical range set is a list of closed ranges, sorted by lower
 * endpoint, in which no two ranges overlap. If a {@link DiscreteDomain} is
 * given, no two ranges are adjacent either; for example, over the integers,
 * {@code [1..3, 4..6]} is not canonical but {@code [1..6]} is.
 *
 * <p>Each binary operation makes a single pass over both arguments, and
 * therefore runs in time proportional to the sum of their lengths. */
public abstract class RangeSets {
  private RangeSets() {}

  /** Converts a collection of closed ranges, in any order, to a canonical
   * range set. */
  public static <C extends Comparable<? super C>> ImmutableList<Range<C>>
      canonical(Iterable<Range<C>> ranges,
      @Nullable DiscreteDomain<C> domain) {
    final List<Range<C>> sorted = new ArrayList<>();
    for (Range<C> range : ranges) {
      checkClosed(range);
      sorted.add(range);
    }
    sorted.sort(Comparator.comparing(Range::lowerEndpoint));
    final Merger<C> merger = new Merger<>(domain);
    sorted.forEach(merger::add);
    return merger.build();
  }

  /** Returns the union of two canonical range sets. */
  public static <C extends Comparable<? super C>> ImmutableList<Range<C>>
      union(List<Range<C>> a, List<Range<C>> b,
      @Nullable DiscreteDomain<C> domain) {
    if (b.isEmpty()) {
      return ImmutableList.copyOf(a);
    }
    if (a.isEmpty()) {
      return ImmutableList.copyOf(b);
    }
    final Merger<C> merger = new Merger<>(domain);
    int i = 0;
    int j = 0;
    while (i < a.size() || j < b.size()) {
      if (j == b.size()
          || i < a.size()
          && a.get(i).lowerEndpoint().compareTo(b.get(j).lowerEndpoint())
              <= 0) {
        merger.add(a.get(i++));
      } else {
        merger.add(b.get(j++));
      }
    }
    return merger.build();
  }

  /** Returns the intersection of two canonical range sets. */
  public static <C extends Comparable<? super C>> ImmutableList<Range<C>>
      intersect(List<Range<C>> a, List<Range<C>> b) {
    final ImmutableList.Builder<Range<C>> builder = ImmutableList.builder();
    int i = 0;
    int j = 0;
    while (i < a.size() && j < b.size()) {
      final Range<C> x = a.get(i);
      final Range<C> y = b.get(j);
      final C lower = max(x.lowerEndpoint(), y.lowerEndpoint());
      final C upper = min(x.upperEndpoint(), y.upperEndpoint());
      if (lower.compareTo(upper) <= 0) {
        builder.add(Range.closed(lower, upper));
      }
      // Advance whichever range ends first; the other may overlap the next.
      if (x.upperEndpoint().compareTo(y.upperEndpoint()) < 0) {
        ++i;
      } else {
        ++j;
      }
    }
    return builder.build();
  }

  /** Returns the values in canonical range set {@code a} that are not in
   * canonical range set {@code b}.
   *
   * <p>Requires a discrete domain, because removing a closed range from a
   * closed range leaves ranges whose endpoints are the neighbors of the
   * removed endpoints. */
  public static <C extends Comparable<? super C>> ImmutableList<Range<C>>
      diff(List<Range<C>> a, List<Range<C>> b, DiscreteDomain<C> domain) {
    final ImmutableList.Builder<Range<C>> builder = ImmutableList.builder();
    int j = 0;
    for (Range<C> x : a) {
      C lower = x.lowerEndpoint();
      final C upper = x.upperEndpoint();
      boolean exhausted = false;
      // Skip ranges of b that end before this range starts.
      while (j < b.size() && b.get(j).upperEndpoint().compareTo(lower) < 0) {
        ++j;
      }
      int k = j;
      while (k < b.size()
          && b.get(k).lowerEndpoint().compareTo(upper) <= 0) {
        final Range<C> y = b.get(k);
        if (y.lowerEndpoint().compareTo(lower) > 0) {
          final C before = domain.previous(y.lowerEndpoint());
          if (before != null) {
            builder.add(Range.closed(lower, before));
          }
        }
        if (y.upperEndpoint().compareTo(upper) >= 0) {
          exhausted = true;
          break;
        }
        final C after = domain.next(y.upperEndpoint());
        if (after == null) {
          exhausted = true;
          break;
        }
        lower = after;
        ++k;
      }
      if (!exhausted) {
        builder.add(Range.closed(lower, upper));
      }
    }
    return builder.build();
  }

  private static <C extends Comparable<? super C>> C min(C c0, C c1) {
    return c0.compareTo(c1) <= 0 ? c0 : c1;
  }

  private static <C extends Comparable<? super C>> C max(C c0, C c1) {
    return c0.compareTo(c1) >= 0 ? c0 : c1;
  }

  private static void checkClosed(Range<?> range) {
    checkArgument(range.hasLowerBound()
            && range.hasUpperBound()
            && range.lowerBoundType() == BoundType.CLOSED
            && range.upperBoundType() == BoundType.CLOSED,
        "range must be closed: %s", range);
  }

  /** Accumulates ranges, in ascending order of lower endpoint, merging each
   * with its predecessor if they overlap or are adjacent.
   *
   * @param <C> Value type */
  private static class Merger<C extends Comparable<? super C>> {
    private final @Nullable DiscreteDomain<C> domain;
    private final List<Range<C>> list = new ArrayList<>();
    private @Nullable C lower;
    private @Nullable C upper;

    Merger(@Nullable DiscreteDomain<C> domain) {
      this.domain = domain;
    }

    void add(Range<C> range) {
      if (lower == null || upper == null) {
        lower = range.lowerEndpoint();
        upper = range.upperEndpoint();
      } else if (touches(upper, range.lowerEndpoint())) {
        upper = max(upper, range.upperEndpoint());
      } else {
        list.add(Range.closed(lower, upper));
        lower = range.lowerEndpoint();
        upper = range.upperEndpoint();
      }
    }

    /** Returns whether a range that ends at {@code upper} overlaps or is
     * adjacent to a range that starts at {@code nextLower}. */
    private boolean touches(C upper, C nextLower) {
      if (nextLower.compareTo(upper) <= 0) {
        return true;
      }
      if (domain == null) {
        return false;
      }
      final C next = domain.next(upper);
      return next != null && next.compareTo(nextLower) >= 0;
    }

    ImmutableList<Range<C>> build() {
      if (lower != null && upper != null) {
        list.add(Range.closed(lower, upper));
        lower = null;
        upper = null;
      }
      return ImmutableList.copyOf(list);
    }
  }
}

// End RangeSets.java
