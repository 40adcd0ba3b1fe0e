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
 * A basis function placeholder of a form: the test function (count {@link #TEST}), the trial
 * function (count {@link #TRIAL}), or any other argument number.
 */
public final class Argument extends FormArgument {

  public static final int TEST = -2;
  public static final int TRIAL = -1;

  public Argument(FiniteElement element, int count) {
    super(element, count);
  }

  public static Argument testFunction(FiniteElement element) {
    return new Argument(element, TEST);
  }

  public static Argument trialFunction(FiniteElement element) {
    return new Argument(element, TRIAL);
  }

  /**
   * Returns an Argument like this one but with the given element and count; returns this if both
   * are unchanged. The new element must have the same value shape.
   */
  public Argument reconstruct(FiniteElement newElement, int newCount) {
    if (newCount == count && newElement.equals(element)) {
      return this;
    }
    checkReconstruct(newElement);
    return new Argument(newElement, newCount);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitArgument(this);
  }

  @Override
  protected String computeRepr() {
    return "Argument(" + element + ", " + count + ")";
  }

  @Override
  public String toString() {
    return subscripted("v");
  }
}
