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
import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * An unexpanded Gateaux derivative: the derivative of an integrand with respect to one or more
 * {@link Coefficient}s, each in the direction of the corresponding argument expression. The
 * expansion into explicit derivative nodes is done by an {@link
 * org.formlang.algorithms.DerivativeExpander}; until then, this node stands in for the result,
 * which has the same shape and free indices as the integrand.
 *
 * <p>The operands are the integrand, followed by the coefficients, followed by the arguments.
 */
public final class CoefficientDerivative extends Operator {

  private final ImmutableList<Expr> operands;
  private final int numCoefficients;

  private CoefficientDerivative(ImmutableList<Expr> operands, int numCoefficients) {
    this.operands = operands;
    this.numCoefficients = numCoefficients;
  }

  /**
   * Returns the derivative of {@code integrand} with respect to {@code coefficients} in the
   * directions {@code arguments}. There must be at least one coefficient, as many arguments as
   * coefficients, and each argument must have the same shape as its coefficient. If the integrand
   * is a {@link Zero}, returns it.
   */
  public static Expr of(
      Expr integrand, List<? extends Expr> coefficients, List<? extends Expr> arguments) {
    if (coefficients.isEmpty() || coefficients.size() != arguments.size()) {
      throw FormError.of(
          FormError.Kind.INVALID_OPERAND,
          "Need one argument for each coefficient (got %s coefficients and %s arguments)",
          coefficients.size(),
          arguments.size());
    }
    for (int i = 0; i < coefficients.size(); i++) {
      Expr w = coefficients.get(i);
      Expr v = arguments.get(i);
      if (!(w instanceof Coefficient)) {
        throw FormError.of(
            FormError.Kind.INVALID_OPERAND, "Can only differentiate by a Coefficient, not %s", w);
      }
      if (!w.shape().equals(v.shape())) {
        throw FormError.of(
            FormError.Kind.SHAPE_MISMATCH,
            "Direction %s has shape %s but coefficient %s has shape %s",
            v,
            v.shape(),
            w,
            w.shape());
      }
    }
    if (integrand instanceof Zero) {
      return integrand;
    }
    ImmutableList<Expr> operands =
        ImmutableList.<Expr>builder().add(integrand).addAll(coefficients).addAll(arguments).build();
    return new CoefficientDerivative(operands, coefficients.size());
  }

  public Expr integrand() {
    return operands.get(0);
  }

  /** The coefficients being differentiated by. */
  public ImmutableList<Expr> coefficients() {
    return operands.subList(1, 1 + numCoefficients);
  }

  /** The direction for each coefficient. */
  public ImmutableList<Expr> arguments() {
    return operands.subList(1 + numCoefficients, operands.size());
  }

  @Override
  public ImmutableList<Integer> shape() {
    return integrand().shape();
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return integrand().freeIndices();
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return integrand().indexDimensions();
  }

  @Override
  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Expr reconstruct(List<Expr> newOperands) {
    if (sameOperands(newOperands)) {
      return this;
    }
    return of(
        newOperands.get(0),
        newOperands.subList(1, 1 + numCoefficients),
        newOperands.subList(1 + numCoefficients, newOperands.size()));
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitCoefficientDerivative(this);
  }

  @Override
  public String toString() {
    return "d/d" + coefficients() + " (" + integrand() + ")" + arguments();
  }
}
