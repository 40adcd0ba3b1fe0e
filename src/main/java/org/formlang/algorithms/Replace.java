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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Expr;
import org.formlang.expr.FormError;
import org.formlang.expr.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A static-only class implementing substitution of terminals in an expression. */
public class Replace {

  private static final Logger logger = LoggerFactory.getLogger(Replace.class);

  private Replace() {}

  /**
   * Returns {@code expr} with each occurrence of a key of {@code mapping} replaced by the
   * corresponding value. Every subexpression that does not contain a replaced terminal is shared
   * with {@code expr}; if nothing is replaced, {@code expr} itself is returned.
   *
   * <p>Every key must be a {@link Terminal}, and every value must have the same shape as its key.
   * Any {@link CoefficientDerivative} in {@code expr} is expanded (using {@link
   * GateauxDerivatives}) before substituting, since its expansion depends on the identity of the
   * coefficients being replaced.
   */
  public static Expr replace(Expr expr, Map<? extends Expr, ? extends Expr> mapping) {
    return replace(expr, mapping, GateauxDerivatives.INSTANCE);
  }

  /** As {@link #replace(Expr, Map)}, but using the given expander for coefficient derivatives. */
  public static Expr replace(
      Expr expr, Map<? extends Expr, ? extends Expr> mapping, DerivativeExpander expander) {
    ImmutableMap<Expr, Expr> checked = checkMapping(mapping);
    if (Traversal.hasExactType(expr, CoefficientDerivative.class)) {
      logger.debug("Expanding coefficient derivatives before replacing terminals");
      expr = expander.expand(expr);
    }
    if (checked.isEmpty()) {
      return expr;
    }
    Replacer replacer = new Replacer(checked);
    Expr result = replacer.apply(expr);
    logger.debug("Replaced {} terminal occurrence(s)", replacer.replaced);
    return result;
  }

  /** Verifies that {@code mapping} is a valid substitution, and returns an immutable copy. */
  private static ImmutableMap<Expr, Expr> checkMapping(
      Map<? extends Expr, ? extends Expr> mapping) {
    mapping.forEach(
        (key, value) -> {
          if (!key.isTerminal()) {
            throw FormError.of(
                FormError.Kind.UNSUPPORTED_SUBSTITUTION_TARGET,
                "Can only replace Terminals, not %s",
                key);
          } else if (!key.shape().equals(value.shape())) {
            throw FormError.of(
                FormError.Kind.SHAPE_MISMATCH,
                "Replacement %s has shape %s but %s has shape %s",
                value,
                value.shape(),
                key,
                key.shape());
          }
        });
    return ImmutableMap.copyOf(mapping);
  }

  /** Replaces terminals that appear in its mapping. */
  private static class Replacer extends ExprMapper {
    final ImmutableMap<Expr, Expr> mapping;

    /** The number of distinct terminals replaced. */
    int replaced;

    Replacer(ImmutableMap<Expr, Expr> mapping) {
      this.mapping = mapping;
    }

    @Override
    protected Expr terminal(Terminal terminal) {
      Expr replacement = mapping.get(terminal);
      if (replacement == null) {
        return terminal;
      }
      replaced++;
      return replacement;
    }

    @Override
    public Expr visitCoefficientDerivative(CoefficientDerivative derivative) {
      throw FormError.of(
          FormError.Kind.UNEXPANDED_DERIVATIVE,
          "Derivatives should be applied before executing replace: %s",
          derivative);
    }
  }
}
