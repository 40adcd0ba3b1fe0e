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
 * A named subexpression. Wrapping an expression in a Variable does not change its value, but
 * makes it possible to differentiate other expressions with respect to it (see {@link
 * VariableDerivative}).
 */
public final class Variable extends Operator {

  private final ImmutableList<Expr> operands;

  private Variable(Expr expression, Label label) {
    this.operands = ImmutableList.of(expression, label);
  }

  public static Variable of(Expr expression, Label label) {
    return new Variable(expression, label);
  }

  public Expr expression() {
    return operands.get(0);
  }

  public Label label() {
    return (Label) operands.get(1);
  }

  @Override
  public ImmutableList<Integer> shape() {
    return expression().shape();
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return expression().freeIndices();
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return expression().indexDimensions();
  }

  @Override
  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Expr reconstruct(List<Expr> newOperands) {
    if (sameOperands(newOperands)) {
      return this;
    } else if (!(newOperands.get(1) instanceof Label label)) {
      throw FormError.of(
          FormError.Kind.INVALID_OPERAND,
          "Expected a Label to name a variable, not %s",
          newOperands.get(1));
    } else {
      return of(newOperands.get(0), label);
    }
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitVariable(this);
  }

  @Override
  public String toString() {
    return "var" + label().count + "(" + expression() + ")";
  }
}
