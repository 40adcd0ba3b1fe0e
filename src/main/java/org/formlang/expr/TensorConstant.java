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
import org.formlang.element.Cell;
import org.formlang.element.Element;
import org.formlang.element.FiniteElement;
import org.formlang.util.ShapeUtil;

/** A tensor-valued Coefficient that is constant on each cell, optionally symmetric. */
public final class TensorConstant extends Coefficient {

  public TensorConstant(Cell cell, ImmutableList<Integer> shape, boolean symmetric, int count) {
    super(Element.tensor(Element.DISCONTINUOUS_LAGRANGE, cell, 0, shape, symmetric), count);
  }

  /** True if this tensor is declared symmetric. */
  public boolean isSymmetric() {
    return ((Element) element).symmetric;
  }

  @Override
  Coefficient withElement(FiniteElement newElement, int newCount) {
    boolean symmetric = (newElement instanceof Element e) ? e.symmetric : isSymmetric();
    return new TensorConstant(newElement.cell(), newElement.valueShape(), symmetric, newCount);
  }

  @Override
  public boolean isSpatiallyConstant() {
    return true;
  }

  @Override
  protected String computeRepr() {
    return String.format(
        "TensorConstant(%s, %s, %s, %s)",
        element.cell(), ShapeUtil.toString(shape()), isSymmetric(), count);
  }

  @Override
  public String toString() {
    return subscripted("C");
  }
}
