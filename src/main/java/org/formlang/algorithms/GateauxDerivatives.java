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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Curl;
import org.formlang.expr.Div;
import org.formlang.expr.Expr;
import org.formlang.expr.FormError;
import org.formlang.expr.Grad;
import org.formlang.expr.Indexed;
import org.formlang.expr.Label;
import org.formlang.expr.MultiIndex;
import org.formlang.expr.Operator;
import org.formlang.expr.Rot;
import org.formlang.expr.SpatialDerivative;
import org.formlang.expr.Terminal;
import org.formlang.expr.Variable;
import org.formlang.expr.VariableDerivative;
import org.formlang.expr.Zero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@link CoefficientDerivative}s by applying the Gateaux derivative rules for the
 * operators this library knows. All of them are linear in their value operand, so the derivative
 * of an Operator is the same Operator applied to the derivative of that operand.
 *
 * <p>Nested CoefficientDerivatives are expanded innermost first.
 */
public final class GateauxDerivatives implements DerivativeExpander {

  private static final Logger logger = LoggerFactory.getLogger(GateauxDerivatives.class);

  public static final GateauxDerivatives INSTANCE = new GateauxDerivatives();

  private GateauxDerivatives() {}

  @Override
  public Expr expand(Expr expr) {
    if (!Traversal.hasExactType(expr, CoefficientDerivative.class)) {
      return expr;
    }
    return new MarkerExpander().apply(expr);
  }

  /** Finds each CoefficientDerivative and replaces it with its expansion. */
  private static class MarkerExpander extends ExprMapper {
    @Override
    public Expr visitCoefficientDerivative(CoefficientDerivative derivative) {
      // Expand any derivatives nested in the integrand before differentiating it.
      Expr integrand = map(derivative.integrand());
      logger.debug(
          "Expanding derivative of {} with respect to {}",
          derivative.integrand(),
          derivative.coefficients());
      ImmutableMap.Builder<Expr, Expr> directions = ImmutableMap.builder();
      for (int i = 0; i < derivative.coefficients().size(); i++) {
        directions.put(derivative.coefficients().get(i), derivative.arguments().get(i));
      }
      return new GateauxRules(directions.buildKeepingLast()).apply(integrand);
    }
  }

  /** Differentiates an expression with respect to some coefficients, in the given directions. */
  private static class GateauxRules extends ExprMapper {
    final ImmutableMap<Expr, Expr> directions;

    GateauxRules(ImmutableMap<Expr, Expr> directions) {
      this.directions = directions;
    }

    /** A coefficient being differentiated by maps to its direction; anything else is constant. */
    @Override
    protected Expr terminal(Terminal terminal) {
      Expr direction = directions.get(terminal);
      return (direction != null) ? direction : Zero.like(terminal);
    }

    /** Operators that aren't linear in their first operand need their own rule. */
    @Override
    protected Expr operator(Operator operator) {
      throw FormError.of(
          FormError.Kind.UNSUPPORTED_DERIVATIVE,
          "No Gateaux derivative rule for %s",
          operator.getClass().getSimpleName());
    }

    /** Applies {@code operator} to the derivative of its first operand. */
    private Expr linear(Operator operator) {
      Expr operand = operator.operands().get(0);
      Expr derivative = map(operand);
      if (derivative instanceof Zero) {
        // Don't reconstruct, since some operators (e.g. Grad) can't be applied to a Zero.
        return Zero.like(operator);
      }
      List<Expr> newOperands = new ArrayList<>(operator.operands());
      newOperands.set(0, derivative);
      return operator.reconstruct(ImmutableList.copyOf(newOperands));
    }

    @Override
    public Expr visitMultiIndex(MultiIndex multiIndex) {
      return multiIndex;
    }

    @Override
    public Expr visitLabel(Label label) {
      return label;
    }

    @Override
    public Expr visitIndexed(Indexed indexed) {
      return linear(indexed);
    }

    @Override
    public Expr visitSpatialDerivative(SpatialDerivative derivative) {
      return linear(derivative);
    }

    @Override
    public Expr visitGrad(Grad grad) {
      return linear(grad);
    }

    @Override
    public Expr visitDiv(Div div) {
      return linear(div);
    }

    @Override
    public Expr visitCurl(Curl curl) {
      return linear(curl);
    }

    @Override
    public Expr visitRot(Rot rot) {
      return linear(rot);
    }

    /** A Variable is just a name for its expression. */
    @Override
    public Expr visitVariable(Variable variable) {
      return map(variable.expression());
    }

    @Override
    public Expr visitVariableDerivative(VariableDerivative derivative) {
      throw FormError.of(
          FormError.Kind.UNSUPPORTED_DERIVATIVE,
          "Variable derivatives must be applied before coefficient derivatives: %s",
          derivative);
    }

    @Override
    public Expr visitCoefficientDerivative(CoefficientDerivative derivative) {
      throw FormError.of(
          FormError.Kind.UNEXPANDED_DERIVATIVE,
          "Nested coefficient derivative %s should already have been expanded",
          derivative);
    }
  }
}
