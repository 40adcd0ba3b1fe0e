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
import org.formlang.util.ShapeUtil;

/** The divergence of an expression of rank at least one; contracts the leading axis. */
public final class Div extends Operator {

  private final ImmutableList<Expr> operands;
  private final ImmutableList<Integer> shape;

  private Div(Expr f) {
    this.operands = ImmutableList.of(f);
    this.shape = ShapeUtil.dropFirst(f.shape());
  }

  /**
   * Returns the divergence of {@code f}, or a {@link Zero} of the divergence's shape if {@code f}
   * is spatially constant. Otherwise {@code f} must have rank at least one and no free indices.
   */
  public static Expr of(Expr f) {
    if (isSpatiallyConstant(f)) {
      return Zero.of(ShapeUtil.dropFirst(f.shape()), f.freeIndices(), f.indexDimensions());
    }
    if (f.rank() < 1) {
      throw FormError.of(FormError.Kind.RANK, "Can't take the divergence of scalar %s", f);
    }
    checkNoFreeIndices(f, "divergence");
    return new Div(f);
  }

  public Expr operand() {
    return operands.get(0);
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
    return sameOperands(newOperands) ? this : of(newOperands.get(0));
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitDiv(this);
  }

  @Override
  public String toString() {
    return "div(" + operand() + ")";
  }
}
