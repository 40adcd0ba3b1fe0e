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

/** A literal non-zero scalar. Zero is always represented by {@link Zero}. */
public final class ScalarValue extends Terminal {

  public final double value;

  private ScalarValue(double value) {
    this.value = value;
  }

  /**
   * Returns an Expr for the given value: {@link Zero#of()} if it is zero, otherwise a new
   * ScalarValue.
   */
  public static Terminal of(double value) {
    Preconditions.checkArgument(Double.isFinite(value), "Not a finite value: %s", value);
    return (value == 0) ? Zero.of() : new ScalarValue(value);
  }

  /** True if {@link #value} is an integer. */
  public boolean isIntegral() {
    return value == Math.rint(value) && Math.abs(value) < 1e15;
  }

  @Override
  public ImmutableList<Integer> shape() {
    return ShapeUtil.SCALAR;
  }

  @Override
  public boolean isSpatiallyConstant() {
    return true;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitScalarValue(this);
  }

  @Override
  protected boolean sameAs(Expr other) {
    return Double.compare(value, ((ScalarValue) other).value) == 0;
  }

  @Override
  protected int computeHash() {
    return Double.hashCode(value);
  }

  @Override
  protected String computeRepr() {
    return isIntegral() ? "IntValue(" + (long) value + ")" : "FloatValue(" + value + ")";
  }

  @Override
  public String toString() {
    return isIntegral() ? String.valueOf((long) value) : String.valueOf(value);
  }
}
