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
import java.util.List;
import java.util.Map;
import org.formlang.util.ShapeUtil;

/**
 * A literal zero of a given shape, possibly with free indices. This is what the simplifying
 * factories return when they can tell that a result is trivially zero.
 */
public final class Zero extends Terminal {

  private static final Zero SCALAR =
      new Zero(ShapeUtil.SCALAR, ImmutableList.of(), ImmutableMap.of());

  private final ImmutableList<Integer> shape;
  private final ImmutableList<Index> freeIndices;
  private final ImmutableMap<Index, Integer> indexDimensions;

  private Zero(
      ImmutableList<Integer> shape,
      ImmutableList<Index> freeIndices,
      ImmutableMap<Index, Integer> indexDimensions) {
    this.shape = shape;
    this.freeIndices = freeIndices;
    this.indexDimensions = indexDimensions;
  }

  /** Returns a scalar zero. */
  public static Zero of() {
    return SCALAR;
  }

  /** Returns a zero with the given shape and no free indices. */
  public static Zero of(List<Integer> shape) {
    return shape.isEmpty()
        ? SCALAR
        : new Zero(ShapeUtil.copyOf(shape), ImmutableList.of(), ImmutableMap.of());
  }

  /**
   * Returns a zero with the given shape and free indices. {@code indexDimensions} must have an
   * entry for each free index; any other entries are dropped.
   */
  public static Zero of(
      List<Integer> shape, List<Index> freeIndices, Map<Index, Integer> indexDimensions) {
    if (freeIndices.isEmpty()) {
      return of(shape);
    }
    ImmutableMap.Builder<Index, Integer> dims = ImmutableMap.builder();
    for (Index i : freeIndices) {
      Integer dim = indexDimensions.get(i);
      Preconditions.checkArgument(dim != null, "No dimension for free index %s", i);
      dims.put(i, dim);
    }
    return new Zero(
        ShapeUtil.copyOf(shape), ImmutableList.copyOf(freeIndices), dims.buildOrThrow());
  }

  /** Returns a zero with the same shape and free indices as {@code like}. */
  public static Zero like(Expr like) {
    return (like instanceof Zero zero)
        ? zero
        : of(like.shape(), like.freeIndices(), like.indexDimensions());
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return freeIndices;
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return indexDimensions;
  }

  @Override
  public boolean isSpatiallyConstant() {
    return true;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitZero(this);
  }

  @Override
  protected boolean sameAs(Expr other) {
    Zero zero = (Zero) other;
    return shape.equals(zero.shape)
        && freeIndices.equals(zero.freeIndices)
        && indexDimensions.equals(zero.indexDimensions);
  }

  @Override
  protected int computeHash() {
    return (shape.hashCode() * 31 + freeIndices.hashCode()) * 31 + 7;
  }

  @Override
  protected String computeRepr() {
    return String.format(
        "Zero(%s, %s, %s)", ShapeUtil.toString(shape), freeIndices, indexDimensions);
  }

  @Override
  public String toString() {
    if (shape.isEmpty() && freeIndices.isEmpty()) {
      return "0";
    } else if (freeIndices.isEmpty()) {
      return "(0<" + ShapeUtil.toString(shape) + ">)";
    }
    return "(0<" + ShapeUtil.toString(shape) + ", " + freeIndices + ">)";
  }
}
