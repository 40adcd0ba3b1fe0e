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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.formlang.element.DomainRegistry;

/**
 * The partial derivative of an expression with respect to the spatial directions named by a
 * {@link MultiIndex}. Each {@link Index} in the multi-index ranges over the spatial dimension; it
 * becomes a free index of the result unless it is paired, either within the multi-index or with a
 * free index of the expression (in which case it is summed over). A {@link FixedIndex} selects a
 * single direction.
 *
 * <p>The result has the same shape as the expression; the differentiation directions appear only
 * as free indices (see {@link #indexShape}).
 */
public final class SpatialDerivative extends Operator {

  private final ImmutableList<Expr> operands;
  private final DomainRegistry registry;
  private final Indices.Extraction dx;
  private final Indices.Extraction combined;
  private final ImmutableMap<Index, Integer> indexDimensions;

  private SpatialDerivative(
      Expr expression,
      MultiIndex indices,
      DomainRegistry registry,
      Indices.Extraction dx,
      Indices.Extraction combined) {
    this.operands = ImmutableList.of(expression, indices);
    this.registry = registry;
    this.dx = dx;
    this.combined = combined;
    this.indexDimensions = combined.freeIndexDimensions();
  }

  /**
   * Returns the derivative of {@code expression} in the directions given by {@code indices}.
   *
   * <p>If {@code expression} is a spatially constant Terminal and every Index in {@code indices}
   * is paired (so that no differentiation index is left free), returns a {@link Zero} with the
   * expression's shape and free indices. Otherwise {@code expression} must have a domain known to
   * {@code registry}, and the combined index list must be valid (see {@link Indices#extract}).
   */
  public static Expr of(Expr expression, MultiIndex indices, DomainRegistry registry) {
    if (isSpatiallyConstant(expression) && allPaired(indices)) {
      return Zero.like(expression);
    }
    int dim = registry.dimension(expression.domain(), "a spatial derivative");
    List<Integer> dxDims = Collections.nCopies(indices.size(), dim);
    for (IndexBase i : indices.indices()) {
      if (i instanceof FixedIndex fixed && fixed.value >= dim) {
        throw FormError.of(
            FormError.Kind.INDEX_ARITY,
            "Fixed index %s is out of range for spatial dimension %s",
            fixed,
            dim);
      }
    }
    Indices.Extraction dx = Indices.extract(indices.indices(), dxDims);
    List<IndexBase> all = new ArrayList<>(expression.freeIndices());
    all.addAll(indices.indices());
    List<Integer> allDims = new ArrayList<>(expression.indexShape());
    allDims.addAll(dxDims);
    Indices.Extraction combined = Indices.extract(all, allDims);
    return new SpatialDerivative(expression, indices, registry, dx, combined);
  }

  /**
   * True if each Index in {@code indices} occurs exactly twice; FixedIndex entries are ignored.
   * Throws an {@link FormError.Kind#INDEX_ARITY} FormError if any Index occurs more than twice.
   */
  private static boolean allPaired(MultiIndex indices) {
    Multiset<Index> counts = HashMultiset.create();
    for (IndexBase i : indices.indices()) {
      if (i instanceof Index index) {
        counts.add(index);
      }
    }
    boolean paired = true;
    for (Multiset.Entry<Index> entry : counts.entrySet()) {
      if (entry.getCount() > 2) {
        throw FormError.of(
            FormError.Kind.INDEX_ARITY, "Index %s occurs more than twice", entry.getElement());
      }
      paired &= (entry.getCount() == 2);
    }
    return paired;
  }

  /** The expression being differentiated. */
  public Expr expression() {
    return operands.get(0);
  }

  /** The differentiation directions. */
  public MultiIndex indices() {
    return (MultiIndex) operands.get(1);
  }

  /** The indices that occur once among the differentiation directions. */
  public ImmutableList<Index> dxFreeIndices() {
    return dx.freeIndices();
  }

  /** The indices that are paired among the differentiation directions. */
  public ImmutableList<Index> dxRepeatedIndices() {
    return dx.repeatedIndices();
  }

  /** The indices that are summed over, either within the directions or with the expression. */
  public ImmutableList<Index> repeatedIndices() {
    return combined.repeatedIndices();
  }

  @Override
  public ImmutableList<Integer> shape() {
    return expression().shape();
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return combined.freeIndices();
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
          "Expected a MultiIndex as the directions of a spatial derivative, not %s",
          newOperands.get(1));
    } else {
      return of(newOperands.get(0), indices, registry);
    }
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitSpatialDerivative(this);
  }

  @Override
  public String toString() {
    return "(d[" + expression() + "] / dx_(" + indices() + "))";
  }
}
