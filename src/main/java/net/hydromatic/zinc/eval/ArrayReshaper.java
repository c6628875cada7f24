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
import static net.hydromatic.zinc.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;
import net.hydromatic.zinc.ast.Ast;
import net.hydromatic.zinc.ast.Op;
import net.hydromatic.zinc.ast.Pos;

/**
 * Re-indexes arrays and takes slices of them.
 *
 * <p>A re-indexed array shares its list of elements with the source array;
 * only the index sets change. If the index sets do not change, the source
 * array is returned.
 */
public abstract class ArrayReshaper {
  private ArrayReshaper() {}

  /** Returns an array with the elements of {@code source} and the given
   * index sets; the implementation of {@code array1d} ... {@code array6d}.
   *
   * @throws EvalException if an index set is not a finite range, or if the
   * index sets do not have as many elements as the array */
  public static Ast.ArrayLiteral reshape(Ast.ArrayLiteral source,
      List<IntSetVal> indexSets, Pos pos) {
    final ImmutableIntArray dims = dims(indexSets, pos);
    if (size(dims) != source.size()) {
      throw new EvalException("mismatch in array dimensions", pos);
    }
    if (dims.equals(source.dims)) {
      return source;
    }
    return ast.arrayLiteral(pos, source.type.elementType(), source.elements,
        dims);
  }

  private static ImmutableIntArray dims(List<IntSetVal> indexSets, Pos pos) {
    final ImmutableIntArray.Builder b =
        ImmutableIntArray.builder(indexSets.size() * 2);
    for (IntSetVal s : indexSets) {
      if (s.isEmpty()) {
        b.add(1).add(0);
        continue;
      }
      if (!s.isContiguous()) {
        throw new EvalException("arrayXd only defined for ranges", pos);
      }
      if (!s.isFinite()) {
        throw new EvalException("arrayXd only defined for finite ranges",
            pos);
      }
      b.add(s.min().toInt()).add(s.max().toInt());
    }
    return b.build();
  }

  private static long size(ImmutableIntArray dims) {
    long size = 1;
    for (int i = 0; i < dims.length(); i += 2) {
      size = Math.multiplyExact(size,
          Math.max(0L, (long) dims.get(i + 1) - dims.get(i) + 1));
    }
    return size;
  }

  /** Returns a one-dimensional array, indexed from 1, with the elements of
   * {@code source}. */
  public static Ast.ArrayLiteral array1d(Ast.ArrayLiteral source, Pos pos) {
    return reshape(source,
        ImmutableList.of(IntSetVal.range(1, source.size())), pos);
  }

  /** Returns an array with the elements of {@code value} and the index sets
   * of {@code template}; the implementation of {@code arrayXd}. */
  public static Ast.ArrayLiteral arrayXd(Ast.ArrayLiteral template,
      Ast.ArrayLiteral value, Pos pos) {
    if (template.sameDims(value)) {
      return value;
    }
    if (template.size() != value.size()) {
      throw new EvalException("mismatch in array dimensions", pos);
    }
    return ast.arrayLiteral(pos, value.type.elementType(), value.elements,
        template.dims);
  }

  /**
   * Returns a contiguous sub-array.
   *
   * @param source Array
   * @param selectors For each dimension of the source, the range of indices
   *   to select; an unbounded end of a range selects to the end of the
   *   dimension
   * @param indexSets Index sets of the result
   * @param pos Position of the call
   *
   * @throws ResultUndefinedException if a selector is not contiguous or is
   *   out of bounds
   * @throws EvalException if the number of selectors is wrong, or the index
   *   sets do not fit the selected elements
   */
  public static Ast.ArrayLiteral slice(Ast.ArrayLiteral source,
      List<IntSetVal> selectors, List<IntSetVal> indexSets, Pos pos) {
    final int n = source.dimCount();
    if (selectors.size() != n) {
      throw new EvalException("slice: array has " + n
          + " dimensions, but " + selectors.size() + " index sets given", pos);
    }
    final int[] lower = new int[n];
    final int[] upper = new int[n];
    boolean empty = false;
    for (int i = 0; i < n; i++) {
      final IntSetVal s = selectors.get(i);
      if (s.isEmpty()) {
        empty = true;
        continue;
      }
      if (!s.isContiguous()) {
        throw new ResultUndefinedException("array slice must be contiguous",
            pos);
      }
      final long lo = s.min().isFinite() ? s.min().toLong() : source.min(i);
      final long hi = s.max().isFinite() ? s.max().toLong() : source.max(i);
      if (lo > hi) {
        empty = true;
        continue;
      }
      if (lo < source.min(i) || hi > source.max(i)) {
        throw new ResultUndefinedException("array slice out of bounds", pos);
      }
      lower[i] = (int) lo;
      upper[i] = (int) hi;
    }
    final ImmutableList.Builder<Ast.Exp> elements = ImmutableList.builder();
    if (!empty && n > 0) {
      // Walk the selected indices in row-major order.
      final int[] index = lower.clone();
      for (;;) {
        int offset = 0;
        for (int i = 0; i < n; i++) {
          offset = offset * (source.max(i) - source.min(i) + 1)
              + (index[i] - source.min(i));
        }
        elements.add(source.get(offset));
        int i = n - 1;
        while (i >= 0 && index[i] == upper[i]) {
          index[i] = lower[i];
          --i;
        }
        if (i < 0) {
          break;
        }
        ++index[i];
      }
    }
    final ImmutableList<Ast.Exp> list = elements.build();
    final Ast.ArrayLiteral flat =
        ast.arrayLiteral(pos, source.type.elementType(), list,
            ImmutableIntArray.of(1, list.size()));
    return reshape(flat, indexSets, pos);
  }

  /**
   * Returns the index set of dimension {@code k} (0-based) of an
   * {@code n}-dimensional array.
   *
   * <p>If the array is an identifier whose declaration gives the index sets,
   * returns the declared set; otherwise evaluates the array.
   *
   * @throws EvalException if the array does not have {@code n} dimensions
   */
  public static IntSetVal indexSet(Evaluator ev, Ast.Exp e, int k, int n,
      Pos pos) {
    if (e.op == Op.ID) {
      final Ast.TypeInst ti = ((Ast.Id) e).decl.ti;
      if (!ti.ranges.isEmpty() && !ti.hasGenericRange()) {
        if (ti.ranges.size() != n) {
          throw new EvalException("index_set: wrong dimension", pos);
        }
        return ev.evalIntSet(requireNonNull(ti.ranges.get(k).domain));
      }
    }
    final Ast.ArrayLiteral a = ev.evalArray(e);
    if (a.dimCount() != n) {
      throw new EvalException("index_set: wrong dimension", pos);
    }
    return indexSet(a, k);
  }

  /** Returns the index set of dimension {@code k} of an array literal. */
  public static IntSetVal indexSet(Ast.ArrayLiteral a, int k) {
    return IntSetVal.range(a.min(k), a.max(k));
  }

  /** Returns whether two arrays have the same index sets. */
  public static boolean indexSetsAgree(Ast.ArrayLiteral a0,
      Ast.ArrayLiteral a1) {
    if (a0.dimCount() != a1.dimCount()) {
      return false;
    }
    for (int i = 0; i < a0.dimCount(); i++) {
      if (!indexSet(a0, i).equals(indexSet(a1, i))) {
        return false;
      }
    }
    return true;
  }
}

// End ArrayReshaper.java
