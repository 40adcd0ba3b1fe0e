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
 * The curl of a vector expression; the result is a vector with one component per spatial
 * dimension.
 *
 * <p>Unlike {@link Grad} and {@link Div}, no attempt is made to recognize a spatially constant
 * operand; {@code Curl.of(constant)} returns a Curl.
 */
public final class Curl extends Operator {

  private final ImmutableList<Expr> operands;
  private final ImmutableList<Integer> shape;
  private final DomainRegistry registry;

  private Curl(Expr f, int dim, DomainRegistry registry) {
    this.operands = ImmutableList.of(f);
    this.shape = ShapeUtil.of(dim);
    this.registry = registry;
  }

  /**
   * Returns the curl of {@code f}, which must be a vector with one component per spatial dimension
   * of its domain, and have no free indices.
   */
  public static Expr of(Expr f, DomainRegistry registry) {
    if (f.rank() != 1) {
      throw FormError.of(
          FormError.Kind.RANK, "Need a vector to take the curl, not shape %s", f.shape());
    }
    checkNoFreeIndices(f, "curl");
    int dim = registry.dimension(f.domain(), "a curl");
    if (f.shape().get(0) != dim) {
      throw FormError.of(
          FormError.Kind.RANK,
          "Need a vector of length %s to take the curl, not shape %s",
          dim,
          f.shape());
    }
    return new Curl(f, dim, registry);
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
    return sameOperands(newOperands) ? this : of(newOperands.get(0), registry);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitCurl(this);
  }

  @Override
  public String toString() {
    return "curl(" + operand() + ")";
  }
}
