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

import org.formlang.element.Cell;
import org.formlang.element.Element;
import org.formlang.element.FiniteElement;

/** A scalar Coefficient that is constant on each cell. */
public final class Constant extends Coefficient {

  public Constant(Cell cell, int count) {
    super(Element.scalar(Element.DISCONTINUOUS_LAGRANGE, cell, 0), count);
  }

  @Override
  Coefficient withElement(FiniteElement newElement, int newCount) {
    return new Constant(newElement.cell(), newCount);
  }

  @Override
  public boolean isSpatiallyConstant() {
    return true;
  }

  @Override
  protected String computeRepr() {
    return "Constant(" + element.cell() + ", " + count + ")";
  }

  @Override
  public String toString() {
    return subscripted("c");
  }
}
