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
import org.formlang.util.ShapeUtil;

/** The identity tensor of shape {@code (dim, dim)}. */
public final class Identity extends Terminal {

  public final int dim;
  private final ImmutableList<Integer> shape;

  private Identity(int dim) {
    this.dim = dim;
    this.shape = ShapeUtil.of(dim, dim);
  }

  public static Identity of(int dim) {
    Preconditions.checkArgument(dim > 0, "Identity dimension must be positive, not %s", dim);
    return new Identity(dim);
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public boolean isSpatiallyConstant() {
    return true;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitIdentity(this);
  }

  @Override
  protected boolean sameAs(Expr other) {
    return dim == ((Identity) other).dim;
  }

  @Override
  protected int computeHash() {
    return 0x1d00 + dim;
  }

  @Override
  protected String computeRepr() {
    return "Identity(" + dim + ")";
  }

  @Override
  public String toString() {
    return "I";
  }
}
