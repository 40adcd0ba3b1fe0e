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
import org.formlang.element.FiniteElement;
import org.jspecify.annotations.Nullable;

/**
 * The common base of {@link Argument} and {@link Coefficient}: a Terminal standing for a function
 * in a finite element space, identified by its element and a count.
 */
public abstract class FormArgument extends Terminal {

  final FiniteElement element;
  final int count;

  FormArgument(FiniteElement element, int count) {
    this.element = Preconditions.checkNotNull(element);
    this.count = count;
  }

  public FiniteElement element() {
    return element;
  }

  /** Distinguishes this FormArgument from others on the same element. */
  public int count() {
    return count;
  }

  @Override
  public ImmutableList<Integer> shape() {
    return element.valueShape();
  }

  @Override
  public @Nullable String domain() {
    return element.cell().domain();
  }

  /**
   * Throws a {@link FormError.Kind#SHAPE_MISMATCH} FormError unless {@code newElement} has the
   * same value shape as this FormArgument's element.
   */
  final void checkReconstruct(FiniteElement newElement) {
    if (!newElement.valueShape().equals(element.valueShape())) {
      throw FormError.of(
          FormError.Kind.SHAPE_MISMATCH,
          "Cannot reconstruct %s with an element of value shape %s (expected %s)",
          this,
          newElement.valueShape(),
          element.valueShape());
    }
  }

  @Override
  protected boolean sameAs(Expr other) {
    FormArgument arg = (FormArgument) other;
    return count == arg.count && element.equals(arg.element);
  }

  @Override
  protected int computeHash() {
    return (getClass().getSimpleName().hashCode() * 31 + element.hashCode()) * 31 + count;
  }

  /** Formats {@code prefix} with this FormArgument's count as a subscript. */
  final String subscripted(String prefix) {
    String c = String.valueOf(count);
    return (c.length() == 1) ? prefix + "_" + c : prefix + "_{" + c + "}";
  }
}
