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
import java.util.List;
import org.formlang.element.DomainRegistry;
import org.formlang.util.ShapeUtil;

/**
 * The spatial gradient of an expression. The result's shape is the spatial dimension followed by
 * the operand's shape.
 */
public final class Grad extends Operator {

  private final ImmutableList<Expr> operands;
  private final ImmutableList<Integer> shape;
  private final DomainRegistry registry;

  private Grad(Expr f, int dim, DomainRegistry registry) {
    this.operands = ImmutableList.of(f);
    this.shape = ShapeUtil.prepend(dim, f.shape());
    this.registry = registry;
  }

  /**
   * Returns the gradient of {@code f}, or a {@link Zero} of the gradient's shape if {@code f} is
   * spatially constant.
   *
   * <p>{@code f} must have a domain known to {@code registry}, and (unless it is spatially
   * constant) no free indices.
   */
  public static Expr of(Expr f, DomainRegistry registry) {
    int dim = registry.dimension(f.domain(), "a gradient");
    if (isSpatiallyConstant(f)) {
      return Zero.of(ShapeUtil.prepend(dim, f.shape()), f.freeIndices(), f.indexDimensions());
    }
    checkNoFreeIndices(f, "gradient");
    return new Grad(f, dim, registry);
  }

  /** The expression whose gradient this is. */
  public Expr operand() {
    return operands.get(0);
  }

  /** The spatial dimension. */
  public int dim() {
    return shape.get(0);
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return operand().freeIndices();
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return operand().indexDimensions();
  }

  @Override
  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Expr reconstruct(List<Expr> newOperands) {
    return sameOperands(newOperands) ? this : of(newOperands.get(0), registry);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitGrad(this);
  }

  @Override
  public String toString() {
    return "grad(" + operand() + ")";
  }
}
