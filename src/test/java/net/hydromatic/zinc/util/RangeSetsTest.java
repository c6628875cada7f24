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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

/** Tests for {@link RangeSets}. */
public class RangeSetsTest {
  private static final DiscreteDomain<Integer> INTEGERS =
      DiscreteDomain.integers();

  private static List<Range<Integer>> ranges(int... endpoints) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    for (int i = 0; i < endpoints.length; i += 2) {
      b.add(Range.closed(endpoints[i], endpoints[i + 1]));
    }
    return b.build();
  }

  @Test void testCanonicalMergesAdjacent() {
    assertThat(RangeSets.canonical(ranges(5, 7, 1, 2, 3, 3), INTEGERS),
        hasToString("[[1..3], [5..7]]"));
    assertThat(RangeSets.canonical(ranges(5, 7, 1, 2, 3, 4), INTEGERS),
        hasToString("[[1..7]]"));
  }

  @Test void testCanonicalContinuousDomain() {
    // Without a discrete domain, adjacent integers do not touch.
    assertThat(RangeSets.canonical(ranges(1, 2, 3, 4), null),
        hasToString("[[1..2], [3..4]]"));
    assertThat(RangeSets.canonical(ranges(1, 3, 2, 4), null),
        hasToString("[[1..4]]"));
  }

  @Test void testCanonicalRejectsOpenRange() {
    assertThrows(IllegalArgumentException.class, () ->
        RangeSets.canonical(ImmutableList.of(Range.open(1, 3)), INTEGERS));
  }

  @Test void testUnion() {
    assertThat(RangeSets.union(ranges(1, 3), ranges(4, 6), INTEGERS),
        hasToString("[[1..6]]"));
    assertThat(RangeSets.union(ranges(1, 3, 10, 12), ranges(5, 6), INTEGERS),
        hasToString("[[1..3], [5..6], [10..12]]"));
    assertThat(RangeSets.union(ranges(), ranges(5, 6), INTEGERS),
        hasToString("[[5..6]]"));
  }

  @Test void testIntersect() {
    assertThat(RangeSets.intersect(ranges(1, 5, 8, 10), ranges(4, 9)),
        hasToString("[[4..5], [8..9]]"));
    assertThat(RangeSets.intersect(ranges(1, 2), ranges(3, 4)), empty());
  }

  @Test void testDiff() {
    assertThat(RangeSets.diff(ranges(1, 10), ranges(3, 4, 6, 6), INTEGERS),
        hasToString("[[1..2], [5..5], [7..10]]"));
    assertThat(RangeSets.diff(ranges(1, 10), ranges(0, 20), INTEGERS),
        empty());
    assertThat(RangeSets.diff(ranges(1, 3), ranges(), INTEGERS),
        hasToString("[[1..3]]"));
  }

  /** Generates a canonical range set of up to four ranges within 0..40. */
  private static List<Range<Integer>> randomRanges(Random random) {
    final ImmutableList.Builder<Range<Integer>> b = ImmutableList.builder();
    final int n = random.nextInt(5);
    for (int i = 0; i < n; i++) {
      final int lower = random.nextInt(40);
      b.add(Range.closed(lower, lower + random.nextInt(8)));
    }
    return RangeSets.canonical(b.build(), INTEGERS);
  }

  /** Returns the integers in a range set. */
  private static Set<Integer> members(List<Range<Integer>> ranges) {
    final Set<Integer> set = new TreeSet<>();
    for (Range<Integer> range : ranges) {
      set.addAll(ContiguousSet.create(range, INTEGERS));
    }
    return set;
  }

  /** Checks the algebraic laws of union and intersection on randomly
   * generated range sets, and checks each result against the members of
   * its operands. */
  @Test void testRandomUnionIntersectLaws() {
    final Random random = new Random(1234L);
    for (int i = 0; i < 500; i++) {
      final List<Range<Integer>> a = randomRanges(random);
      final List<Range<Integer>> b = randomRanges(random);
      final List<Range<Integer>> c = randomRanges(random);

      final List<Range<Integer>> aUnionB = RangeSets.union(a, b, INTEGERS);
      final List<Range<Integer>> aInterB = RangeSets.intersect(a, b);
      assertThat(aUnionB, is(RangeSets.union(b, a, INTEGERS)));
      assertThat(aInterB, is(RangeSets.intersect(b, a)));

      assertThat(RangeSets.union(aUnionB, c, INTEGERS),
          is(RangeSets.union(a, RangeSets.union(b, c, INTEGERS), INTEGERS)));
      assertThat(RangeSets.intersect(aInterB, c),
          is(RangeSets.intersect(a, RangeSets.intersect(b, c))));

      // a * (b + c) = (a * b) + (a * c)
      assertThat(
          RangeSets.intersect(a, RangeSets.union(b, c, INTEGERS)),
          is(
              RangeSets.union(RangeSets.intersect(a, b),
                  RangeSets.intersect(a, c), INTEGERS)));

      // Results are canonical and hold the expected members.
      assertThat(RangeSets.canonical(aUnionB, INTEGERS), is(aUnionB));
      assertThat(RangeSets.canonical(aInterB, INTEGERS), is(aInterB));
      final Set<Integer> union = new TreeSet<>(members(a));
      union.addAll(members(b));
      assertThat(members(aUnionB), is(union));
      final Set<Integer> inter = new TreeSet<>(members(a));
      inter.retainAll(members(b));
      assertThat(members(aInterB), is(inter));
    }
  }
}

// End RangeSetsTest.java
