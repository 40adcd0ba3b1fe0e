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
import org.formlang.util.ShapeUtil;

/**
 * The name of a {@link Variable}. Labels are distinguished by their count; {@link
 * org.formlang.Forms#label} hands out a new count each time.
 */
public final class Label extends Terminal {

  public final int count;

  public Label(int count) {
    this.count = count;
  }

  @Override
  public ImmutableList<Integer> shape() {
    return ShapeUtil.SCALAR;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitLabel(this);
  }

  @Override
  protected boolean sameAs(Expr other) {
    return count == ((Label) other).count;
  }

  @Override
  protected int computeHash() {
    return 0x1abe1000 + count;
  }

  @Override
  protected String computeRepr() {
    return "Label(" + count + ")";
  }

  @Override
  public String toString() {
    return "l_" + count;
  }
}
