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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.formlang.util.ShapeUtil;

/**
 * A scalar component of a tensor expression, selected by a {@link MultiIndex} with one entry per
 * axis. Each {@link Index} entry becomes a free index ranging over its axis, unless it is paired
 * with another entry or with a free index of the expression, in which case it is summed over.
 */
public final class Indexed extends Operator {

  private final ImmutableList<Expr> operands;
  private final Indices.Extraction extraction;
  private final ImmutableMap<Index, Integer> indexDimensions;

  private Indexed(Expr expression, MultiIndex indices, Indices.Extraction extraction) {
    this.operands = ImmutableList.of(expression, indices);
    this.extraction = extraction;
    this.indexDimensions = extraction.freeIndexDimensions();
  }

  /**
   * Returns {@code expression[indices]}. The number of indices must equal the rank of {@code
   * expression}, and each {@link FixedIndex} must be in range for its axis.
   *
   * <p>Indexing a scalar with an empty MultiIndex returns the scalar, and indexing a {@link Zero}
   * returns a scalar Zero with the resulting free indices.
   */
  public static Expr of(Expr expression, MultiIndex indices) {
    ImmutableList<Integer> shape = expression.shape();
    if (indices.size() != shape.size()) {
      throw FormError.of(
          FormError.Kind.RANK,
          "Invalid number of indices (%s) for tensor expression of rank %s",
          indices.size(),
          shape.size());
    }
    if (indices.size() == 0) {
      return expression;
    }
    for (int axis = 0; axis < shape.size(); axis++) {
      IndexBase index = indices.indices().get(axis);
      if (index instanceof FixedIndex fixed && fixed.value >= shape.get(axis)) {
        throw FormError.of(
            FormError.Kind.INDEX_ARITY,
            "Fixed index %s is out of range for axis %s of shape %s",
            fixed,
            axis,
            ShapeUtil.toString(shape));
      }
    }
    List<IndexBase> all = new ArrayList<>(expression.freeIndices());
    all.addAll(indices.indices());
    List<Integer> dims = new ArrayList<>(expression.indexShape());
    dims.addAll(shape);
    Indices.Extraction extraction = Indices.extract(all, dims);
    if (expression instanceof Zero) {
      return Zero.of(ShapeUtil.SCALAR, extraction.freeIndices(), extraction.indexDimensions());
    }
    return new Indexed(expression, indices, extraction);
  }

  public Expr expression() {
    return operands.get(0);
  }

  public MultiIndex indices() {
    return (MultiIndex) operands.get(1);
  }

  /** The indices that are summed over. */
  public ImmutableList<Index> repeatedIndices() {
    return extraction.repeatedIndices();
  }

  @Override
  public ImmutableList<Integer> shape() {
    return ShapeUtil.SCALAR;
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return extraction.freeIndices();
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return indexDimensions;
  }

  @Override
  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Expr reconstruct(List<Expr> newOperands) {
    if (sameOperands(newOperands)) {
      return this;
    } else if (!(newOperands.get(1) instanceof MultiIndex indices)) {
      throw FormError.of(
          FormError.Kind.INVALID_OPERAND,
          "Expected a MultiIndex to index with, not %s",
          newOperands.get(1));
    } else {
      return of(newOperands.get(0), indices);
    }
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitIndexed(this);
  }

  @Override
  public String toString() {
    return expression() + "[" + indices() + "]";
  }
}
