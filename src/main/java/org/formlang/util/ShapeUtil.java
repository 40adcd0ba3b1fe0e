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

package org.formlang.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A static-only class with methods for working with tensor shapes, which are represented as
 * immutable lists of non-negative dimensions.
 */
public class ShapeUtil {

  private ShapeUtil() {}

  /** The shape of a scalar. */
  public static final ImmutableList<Integer> SCALAR = ImmutableList.of();

  /** Returns a shape with the given dimensions, which must be non-negative. */
  public static ImmutableList<Integer> of(int... dims) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builderWithExpectedSize(dims.length);
    for (int dim : dims) {
      Preconditions.checkArgument(dim >= 0, "Negative dimension %s", dim);
      builder.add(dim);
    }
    return builder.build();
  }

  /** Returns an immutable copy of {@code shape}, verifying that each dimension is non-negative. */
  public static ImmutableList<Integer> copyOf(List<Integer> shape) {
    if (shape instanceof ImmutableList<Integer> immutable) {
      assert immutable.stream().allMatch(d -> d >= 0);
      return immutable;
    }
    for (Integer dim : shape) {
      Preconditions.checkArgument(dim != null && dim >= 0, "Bad dimension %s", dim);
    }
    return ImmutableList.copyOf(shape);
  }

  /** Returns the dimensions of {@code first} followed by those of {@code second}. */
  public static ImmutableList<Integer> concat(List<Integer> first, List<Integer> second) {
    if (second.isEmpty()) {
      return ImmutableList.copyOf(first);
    } else if (first.isEmpty()) {
      return ImmutableList.copyOf(second);
    }
    return ImmutableList.<Integer>builderWithExpectedSize(first.size() + second.size())
        .addAll(first)
        .addAll(second)
        .build();
  }

  /** Returns {@code shape} with {@code dim} inserted before its first dimension. */
  public static ImmutableList<Integer> prepend(int dim, List<Integer> shape) {
    Preconditions.checkArgument(dim >= 0, "Negative dimension %s", dim);
    return ImmutableList.<Integer>builderWithExpectedSize(shape.size() + 1)
        .add(dim)
        .addAll(shape)
        .build();
  }

  /**
   * Returns {@code shape} without its first dimension. Dropping the first dimension of a scalar
   * shape returns the scalar shape.
   */
  public static ImmutableList<Integer> dropFirst(List<Integer> shape) {
    return shape.isEmpty() ? SCALAR : ImmutableList.copyOf(shape.subList(1, shape.size()));
  }

  /** Formats a shape as a parenthesized tuple, e.g. {@code (3,)} or {@code (2, 2)}. */
  public static String toString(List<Integer> shape) {
    if (shape.size() == 1) {
      return "(" + shape.get(0) + ",)";
    }
    return shape.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
  }
}
