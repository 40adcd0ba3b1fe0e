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
import org.jspecify.annotations.Nullable;

/** A leaf Expr, with no operands. */
public abstract class Terminal extends Expr {

  @Override
  public final ImmutableList<Expr> operands() {
    return ImmutableList.of();
  }

  @Override
  public final boolean isTerminal() {
    return true;
  }

  /**
   * True if this Terminal's value cannot vary in space, so that any spatial derivative of it is
   * zero. Literals and the Constant family are spatially constant; ordinary coefficients and
   * arguments are not.
   */
  public boolean isSpatiallyConstant() {
    return false;
  }

  @Override
  public @Nullable String domain() {
    return null;
  }
}
