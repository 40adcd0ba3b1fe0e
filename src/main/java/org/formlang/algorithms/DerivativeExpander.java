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

package org.formlang.algorithms;

import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Expr;

/**
 * Replaces each {@link CoefficientDerivative} in an expression with an equivalent expression built
 * from explicit derivative nodes.
 */
public interface DerivativeExpander {
  /**
   * Returns an expression equivalent to {@code expr} that contains no CoefficientDerivative.
   * Returns {@code expr} itself if it contains none.
   */
  Expr expand(Expr expr);
}
