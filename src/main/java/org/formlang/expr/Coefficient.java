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

import org.formlang.element.FiniteElement;

/**
 * A known function in a finite element space. Coefficients may vary in space; the subclasses
 * {@link Constant}, {@link VectorConstant}, and {@link TensorConstant} are piecewise constant on
 * their cell and are treated as spatially constant.
 */
public class Coefficient extends FormArgument {

  public Coefficient(FiniteElement element, int count) {
    super(element, count);
  }

  /**
   * Returns a Coefficient of the same class as this one, with the given element and count;
   * returns this if both are unchanged. The new element must have the same value shape.
   */
  public final Coefficient reconstruct(FiniteElement newElement, int newCount) {
    if (newCount == count && newElement.equals(element)) {
      return this;
    }
    checkReconstruct(newElement);
    return withElement(newElement, newCount);
  }

  /** Creates a new instance of this class; the element's value shape has already been checked. */
  Coefficient withElement(FiniteElement newElement, int newCount) {
    return new Coefficient(newElement, newCount);
  }

  @Override
  public final <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitCoefficient(this);
  }

  @Override
  protected String computeRepr() {
    return "Coefficient(" + element + ", " + count + ")";
  }

  @Override
  public String toString() {
    return subscripted("w");
  }
}
