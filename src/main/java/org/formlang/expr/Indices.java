/*
 * Copyright 2025 The Formlang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.formlang.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A static-only class implementing the index algebra shared by all index-consuming operators. */
public class Indices {

  private Indices() {}

  /**
   * The result of {@link #extract}.
   *
   * @param freeIndices the indices that occurred exactly once, in order of first occurrence
   * @param repeatedIndices the indices that occurred exactly twice, in order of first occurrence
   * @param additionalShape the dimensions of {@code freeIndices}, in the same order
   * @param indexDimensions the dimension of each free and repeated index
   */
  public record Extraction(
      ImmutableList<Index> freeIndices,
      ImmutableList<Index> repeatedIndices,
      ImmutableList<Integer> additionalShape,
      ImmutableMap<Index, Integer> indexDimensions) {

    /** Returns {@link #indexDimensions} restricted to the free indices. */
    public ImmutableMap<Index, Integer> freeIndexDimensions() {
      if (repeatedIndices.isEmpty()) {
        return indexDimensions;
      }
      ImmutableMap.Builder<Index, Integer> builder = ImmutableMap.builder();
      for (Index i : freeIndices) {
        builder.put(i, indexDimensions.get(i));
      }
      return builder.buildOrThrow();
    }
  }

  /**
   * Partitions a sequence of indices into those that occur once (free) and those that occur twice
   * (repeated, i.e. summed over). {@code dimensions} gives the dimension bound to each position in
   * {@code indices} and must be the same length. {@link FixedIndex} entries are ignored.
   *
   * <p>Throws a {@link FormError.Kind#INDEX_ARITY} FormError if any index occurs more than twice,
   * or if the two occurrences of a repeated index have different dimensions.
   */
  public static Extraction extract(List<? extends IndexBase> indices, List<Integer> dimensions) {
    Preconditions.checkArgument(
        indices.size() == dimensions.size(),
        "%s indices but %s dimensions",
        indices.size(),
        dimensions.size());
    // Both maps are keyed by first occurrence, so iterating them preserves that order.
    Map<Index, Integer> counts = new LinkedHashMap<>();
    Map<Index, Integer> dims = new LinkedHashMap<>();
    for (int pos = 0; pos < indices.size(); pos++) {
      if (!(indices.get(pos) instanceof Index index)) {
        continue;
      }
      int dim = dimensions.get(pos);
      Integer prevCount = counts.get(index);
      if (prevCount == null) {
        counts.put(index, 1);
        dims.put(index, dim);
      } else if (prevCount == 1) {
        int prevDim = dims.get(index);
        if (prevDim != dim) {
          throw FormError.of(
              FormError.Kind.INDEX_ARITY,
              "Index %s is repeated with different dimensions (%s and %s)",
              index,
              prevDim,
              dim);
        }
        counts.put(index, 2);
      } else {
        throw FormError.of(
            FormError.Kind.INDEX_ARITY, "Index %s occurs more than twice", index);
      }
    }
    ImmutableList.Builder<Index> free = ImmutableList.builder();
    ImmutableList.Builder<Index> repeated = ImmutableList.builder();
    ImmutableList.Builder<Integer> shape = ImmutableList.builder();
    counts.forEach(
        (index, count) -> {
          if (count == 1) {
            free.add(index);
            shape.add(dims.get(index));
          } else {
            repeated.add(index);
          }
        });
    return new Extraction(free.build(), repeated.build(), shape.build(), ImmutableMap.copyOf(dims));
  }
}
