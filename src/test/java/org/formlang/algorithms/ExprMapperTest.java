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

import static com.google.common.truth.Truth.assertThat;

import org.formlang.element.Cell;
import org.formlang.element.DomainRegistry;
import org.formlang.element.Element;
import org.formlang.expr.Coefficient;
import org.formlang.expr.Div;
import org.formlang.expr.Expr;
import org.formlang.expr.Grad;
import org.formlang.expr.Label;
import org.formlang.expr.Terminal;
import org.formlang.expr.Variable;
import org.formlang.expr.VariableDerivative;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExprMapperTest {

  private static final DomainRegistry REGISTRY = DomainRegistry.standard();
  private static final Element P1 = Element.scalar("Lagrange", Cell.of("triangle"), 1);

  /** Counts the calls to each visit method, and otherwise leaves the expression unchanged. */
  private static class CountingMapper extends ExprMapper {
    int coefficients;
    int grads;
    int terminals;

    @Override
    protected Expr terminal(Terminal terminal) {
      terminals++;
      return terminal;
    }

    @Override
    public Expr visitCoefficient(Coefficient coefficient) {
      coefficients++;
      return super.visitCoefficient(coefficient);
    }

    @Override
    public Expr visitGrad(Grad grad) {
      grads++;
      return super.visitGrad(grad);
    }
  }

  @Test
  public void sharedNodesVisitedOnce() {
    Coefficient w = new Coefficient(P1, 0);
    Expr grad = Grad.of(w, REGISTRY);
    // w is shared by the gradient and the variable
    Expr e = VariableDerivative.of(Div.of(grad), Variable.of(w, new Label(0)));
    CountingMapper mapper = new CountingMapper();
    assertThat(mapper.apply(e)).isSameInstanceAs(e);
    assertThat(mapper.coefficients).isEqualTo(1);
    assertThat(mapper.grads).isEqualTo(1);
    // w and the label
    assertThat(mapper.terminals).isEqualTo(2);
  }

  @Test
  public void equalNodesVisitedOnce() {
    // Two distinct but equal gradients
    Expr grad1 = Grad.of(new Coefficient(P1, 0), REGISTRY);
    Expr grad2 = Grad.of(new Coefficient(P1, 0), REGISTRY);
    Expr e = VariableDerivative.of(grad1, Variable.of(grad2, new Label(0)));
    CountingMapper mapper = new CountingMapper();
    assertThat(mapper.apply(e)).isSameInstanceAs(e);
    assertThat(mapper.grads).isEqualTo(1);
    assertThat(mapper.coefficients).isEqualTo(1);
  }

  @Test
  public void memoIsPerPass() {
    Expr e = Div.of(Grad.of(Grad.of(new Coefficient(P1, 0), REGISTRY), REGISTRY));
    CountingMapper mapper = new CountingMapper();
    mapper.apply(e);
    mapper.apply(e);
    assertThat(mapper.grads).isEqualTo(4);
  }

  @Test
  public void rebuildsOnlyChangedPath() {
    Coefficient w = new Coefficient(P1, 0);
    Coefficient u = new Coefficient(P1, 1);
    Coefficient q = new Coefficient(P1, 2);
    Expr left = Div.of(Grad.of(Grad.of(w, REGISTRY), REGISTRY));
    Expr e = VariableDerivative.of(left, Variable.of(u, new Label(0)));
    ExprMapper uToQ =
        new ExprMapper() {
          @Override
          public Expr visitCoefficient(Coefficient coefficient) {
            return coefficient.equals(u) ? q : coefficient;
          }
        };
    VariableDerivative result = (VariableDerivative) uToQ.apply(e);
    assertThat(result).isNotSameInstanceAs(e);
    assertThat(result.f()).isSameInstanceAs(left);
    assertThat(result.v()).isEqualTo(Variable.of(q, new Label(0)));
  }
}
