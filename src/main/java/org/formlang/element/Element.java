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

package org.formlang.element;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.formlang.util.ShapeUtil;

/**
 * A simple FiniteElement described by a family name, a cell, a polynomial degree, and a value
 * shape. Rank-2 square elements may be marked symmetric.
 */
public final class Element implements FiniteElement {

  /** The family used for piecewise constants. */
  public static final String DISCONTINUOUS_LAGRANGE = "Discontinuous Lagrange";

  public final String family;
  public final int degree;
  public final boolean symmetric;
  private final Cell cell;
  private final ImmutableList<Integer> valueShape;

  private Element(
      String family, Cell cell, int degree, ImmutableList<Integer> valueShape, boolean symmetric) {
    Preconditions.checkArgument(degree >= 0, "Negative degree %s", degree);
    Preconditions.checkArgument(
        !symmetric || (valueShape.size() == 2 && valueShape.get(0).equals(valueShape.get(1))),
        "Only square rank-2 elements can be symmetric, not %s",
        valueShape);
    this.family = family;
    this.cell = cell;
    this.degree = degree;
    this.valueShape = valueShape;
    this.symmetric = symmetric;
  }

  /** Returns a scalar-valued element. */
  public static Element scalar(String family, Cell cell, int degree) {
    return new Element(family, cell, degree, ShapeUtil.SCALAR, false);
  }

  /** Returns a vector-valued element with {@code dim} components. */
  public static Element vector(String family, Cell cell, int degree, int dim) {
    return new Element(family, cell, degree, ShapeUtil.of(dim), false);
  }

  /** Returns a tensor-valued element with the given value shape. */
  public static Element tensor(
      String family, Cell cell, int degree, ImmutableList<Integer> shape, boolean symmetric) {
    return new Element(family, cell, degree, ShapeUtil.copyOf(shape), symmetric);
  }

  @Override
  public ImmutableList<Integer> valueShape() {
    return valueShape;
  }

  @Override
  public Cell cell() {
    return cell;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Element other
        && family.equals(other.family)
        && cell.equals(other.cell)
        && degree == other.degree
        && valueShape.equals(other.valueShape)
        && symmetric == other.symmetric;
  }

  @Override
  public int hashCode() {
    return Objects.hash(family, cell, degree, valueShape, symmetric);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Element('").append(family).append("', ");
    sb.append(cell).append(", ").append(degree);
    if (!valueShape.isEmpty()) {
      sb.append(", ").append(ShapeUtil.toString(valueShape));
    }
    if (symmetric) {
      sb.append(", symmetric");
    }
    return sb.append(")").toString();
  }
}
