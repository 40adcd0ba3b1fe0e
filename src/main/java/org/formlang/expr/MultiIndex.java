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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.formlang.util.ShapeUtil;

/**
 * An ordered sequence of {@link Index} and {@link FixedIndex} entries, used as an operand of
 * {@link Indexed} and {@link SpatialDerivative}. A MultiIndex is not a tensor value: its shape is
 * empty and its entries are not free indices of the MultiIndex itself (they only become free or
 * repeated in the context of the Operator using them).
 */
public final class MultiIndex extends Terminal {

  private final ImmutableList<IndexBase> indices;

  private MultiIndex(ImmutableList<IndexBase> indices) {
    this.indices = indices;
  }

  public static MultiIndex of(List<? extends IndexBase> indices) {
    return new MultiIndex(ImmutableList.copyOf(indices));
  }

  public static MultiIndex of(IndexBase... indices) {
    return of(Arrays.asList(indices));
  }

  /** The entries of this MultiIndex. */
  public ImmutableList<IndexBase> indices() {
    return indices;
  }

  public int size() {
    return indices.size();
  }

  @Override
  public ImmutableList<Integer> shape() {
    return ShapeUtil.SCALAR;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitMultiIndex(this);
  }

  @Override
  protected boolean sameAs(Expr other) {
    return indices.equals(((MultiIndex) other).indices);
  }

  @Override
  protected int computeHash() {
    return indices.hashCode();
  }

  @Override
  protected String computeRepr() {
    return indices.stream()
        .map(IndexBase::repr)
        .collect(Collectors.joining(", ", "MultiIndex((", "))"));
  }

  @Override
  public String toString() {
    return indices.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }
}
