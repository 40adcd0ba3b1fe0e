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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.formlang.expr.Argument;
import org.formlang.expr.Coefficient;
import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Curl;
import org.formlang.expr.Div;
import org.formlang.expr.Expr;
import org.formlang.expr.ExprVisitor;
import org.formlang.expr.Grad;
import org.formlang.expr.Identity;
import org.formlang.expr.Indexed;
import org.formlang.expr.Label;
import org.formlang.expr.MultiIndex;
import org.formlang.expr.Operator;
import org.formlang.expr.Rot;
import org.formlang.expr.ScalarValue;
import org.formlang.expr.SpatialDerivative;
import org.formlang.expr.Terminal;
import org.formlang.expr.Variable;
import org.formlang.expr.VariableDerivative;
import org.formlang.expr.Zero;

/**
 * A base class for rewriting passes over an expression graph. Subclasses override the visit
 * methods for the kinds of Expr they want to rewrite; everything else gets a default:
 *
 * <ul>
 *   <li>Terminals are passed to {@link #terminal}, which returns them unchanged.
 *   <li>Operators are passed to {@link #operator}, which rewrites their operands and reuses the
 *       Operator if none of them changed (see {@link #reuseIfUntouched}).
 * </ul>
 *
 * <p>Within a single call to {@link #apply}, each distinct subexpression is visited at most once:
 * results are memoized by (structural) Expr equality, so a subexpression shared by several parents
 * is rewritten once and every parent sees the same result, and the cost of a pass is linear in the
 * number of distinct nodes rather than the number of paths through the graph.
 *
 * <p>Visit methods should call {@link #map} (never {@link Expr#accept} directly) to rewrite an
 * operand, so that the memo is used.
 *
 * <p>An ExprMapper may be reused for several passes, but not concurrently.
 */
public abstract class ExprMapper implements ExprVisitor<Expr> {

  /** Results of the current pass; null if no pass is in progress. */
  private Map<Expr, Expr> memo;

  /** Rewrites {@code root}, returning a graph that shares every unchanged subexpression. */
  public final Expr apply(Expr root) {
    Preconditions.checkState(memo == null, "ExprMapper is already running");
    memo = new HashMap<>();
    try {
      return map(root);
    } finally {
      memo = null;
    }
  }

  /** Returns the rewritten form of {@code expr}, computing it if this pass hasn't already. */
  protected final Expr map(Expr expr) {
    Expr result = memo.get(expr);
    if (result == null) {
      result = expr.accept(this);
      memo.put(expr, result);
    }
    return result;
  }

  /**
   * Rewrites each of {@code operator}'s operands. If they are all unchanged (equal to the
   * originals), returns {@code operator} itself; otherwise reconstructs it with the new operands,
   * which revalidates (and may simplify) it.
   */
  protected final Expr reuseIfUntouched(Operator operator) {
    ImmutableList<Expr> operands = operator.operands();
    Expr[] newOperands = null;
    for (int i = 0; i < operands.size(); i++) {
      Expr operand = operands.get(i);
      Expr newOperand = map(operand);
      if (newOperand == operand || newOperand.equals(operand)) {
        continue;
      }
      if (newOperands == null) {
        newOperands = operands.toArray(Expr[]::new);
      }
      newOperands[i] = newOperand;
    }
    return (newOperands == null)
        ? operator
        : operator.reconstruct(ImmutableList.copyOf(newOperands));
  }

  /** The default handling of Terminals; returns {@code terminal}. */
  protected Expr terminal(Terminal terminal) {
    return terminal;
  }

  /** The default handling of Operators; calls {@link #reuseIfUntouched}. */
  protected Expr operator(Operator operator) {
    return reuseIfUntouched(operator);
  }

  @Override
  public Expr visitArgument(Argument argument) {
    return terminal(argument);
  }

  @Override
  public Expr visitCoefficient(Coefficient coefficient) {
    return terminal(coefficient);
  }

  @Override
  public Expr visitZero(Zero zero) {
    return terminal(zero);
  }

  @Override
  public Expr visitIdentity(Identity identity) {
    return terminal(identity);
  }

  @Override
  public Expr visitScalarValue(ScalarValue value) {
    return terminal(value);
  }

  @Override
  public Expr visitMultiIndex(MultiIndex multiIndex) {
    return terminal(multiIndex);
  }

  @Override
  public Expr visitLabel(Label label) {
    return terminal(label);
  }

  @Override
  public Expr visitIndexed(Indexed indexed) {
    return operator(indexed);
  }

  @Override
  public Expr visitVariable(Variable variable) {
    return operator(variable);
  }

  @Override
  public Expr visitSpatialDerivative(SpatialDerivative derivative) {
    return operator(derivative);
  }

  @Override
  public Expr visitVariableDerivative(VariableDerivative derivative) {
    return operator(derivative);
  }

  @Override
  public Expr visitGrad(Grad grad) {
    return operator(grad);
  }

  @Override
  public Expr visitDiv(Div div) {
    return operator(div);
  }

  @Override
  public Expr visitCurl(Curl curl) {
    return operator(curl);
  }

  @Override
  public Expr visitRot(Rot rot) {
    return operator(rot);
  }

  @Override
  public Expr visitCoefficientDerivative(CoefficientDerivative derivative) {
    return operator(derivative);
  }
}
