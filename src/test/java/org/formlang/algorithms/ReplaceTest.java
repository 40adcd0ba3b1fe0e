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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.formlang.element.Cell;
import org.formlang.element.DomainRegistry;
import org.formlang.element.Element;
import org.formlang.expr.Argument;
import org.formlang.expr.Coefficient;
import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Constant;
import org.formlang.expr.Div;
import org.formlang.expr.Expr;
import org.formlang.expr.FormError;
import org.formlang.expr.Grad;
import org.formlang.expr.Index;
import org.formlang.expr.Indexed;
import org.formlang.expr.Label;
import org.formlang.expr.MultiIndex;
import org.formlang.expr.Variable;
import org.formlang.expr.VariableDerivative;
import org.formlang.expr.Zero;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReplaceTest {

  private static final DomainRegistry REGISTRY = DomainRegistry.standard();
  private static final Cell TRIANGLE = Cell.of("triangle");
  private static final Element P1 = Element.scalar("Lagrange", TRIANGLE, 1);
  private static final Element VP1 = Element.vector("Lagrange", TRIANGLE, 1, 2);

  private final Coefficient w = new Coefficient(P1, 0);
  private final Coefficient u = new Coefficient(P1, 1);
  private final Coefficient q = new Coefficient(P1, 2);

  @Test
  public void emptyMapping() {
    Expr e = Div.of(Grad.of(w, REGISTRY));
    assertThat(Replace.replace(e, ImmutableMap.of())).isSameInstanceAs(e);
  }

  @Test
  public void unmatchedMapping() {
    Expr e = Div.of(Grad.of(w, REGISTRY));
    assertThat(Replace.replace(e, ImmutableMap.of(u, q))).isSameInstanceAs(e);
  }

  @Test
  public void singleTerminal() {
    assertThat(Replace.replace(w, ImmutableMap.of(w, u))).isSameInstanceAs(u);
    Expr e = Div.of(Grad.of(w, REGISTRY));
    assertThat(Replace.replace(e, ImmutableMap.of(w, u)))
        .isEqualTo(Div.of(Grad.of(u, REGISTRY)));
  }

  @Test
  public void sharingPreserved() {
    Expr left = Div.of(Grad.of(w, REGISTRY));
    Expr e = VariableDerivative.of(left, Variable.of(u, new Label(0)));
    VariableDerivative result =
        (VariableDerivative) Replace.replace(e, ImmutableMap.of(u, q));
    assertThat(result.f()).isSameInstanceAs(left);
    assertThat(result.v()).isEqualTo(Variable.of(q, new Label(0)));
  }

  @Test
  public void sharedTerminalReplacedConsistently() {
    Expr grad = Grad.of(w, REGISTRY);
    Expr e = VariableDerivative.of(grad, Variable.of(w, new Label(0)));
    VariableDerivative result =
        (VariableDerivative) Replace.replace(e, ImmutableMap.of(w, u));
    Variable v = (Variable) result.v();
    assertThat(v.expression()).isSameInstanceAs(u);
    assertThat(((Grad) result.f()).operand()).isSameInstanceAs(u);
  }

  @Test
  public void idempotent() {
    Expr e = Div.of(Grad.of(w, REGISTRY));
    ImmutableMap<Expr, Expr> mapping = ImmutableMap.of(w, u);
    Expr once = Replace.replace(e, mapping);
    assertThat(Replace.replace(once, mapping)).isSameInstanceAs(once);
  }

  @Test
  public void replaceWithSimplification() {
    // Replacing with a constant makes the gradient zero
    Expr e = Grad.of(w, REGISTRY);
    Coefficient c = new Constant(TRIANGLE, 5);
    assertThat(Replace.replace(e, ImmutableMap.of(w, c))).isEqualTo(Zero.of(ImmutableList.of(2)));
  }

  @Test
  public void replaceIndexedOperand() {
    Coefficient wv = new Coefficient(VP1, 3);
    Coefficient uv = new Coefficient(VP1, 4);
    Index i = new Index();
    Expr e = Indexed.of(wv, MultiIndex.of(i));
    Expr result = Replace.replace(e, ImmutableMap.of(wv, uv));
    assertThat(result).isEqualTo(Indexed.of(uv, MultiIndex.of(i)));
    assertThat(result.freeIndices()).containsExactly(i);
  }

  @Test
  public void nonTerminalKey() {
    Expr grad = Grad.of(w, REGISTRY);
    FormError e =
        assertThrows(
            FormError.class,
            () -> Replace.replace(grad, ImmutableMap.of(grad, Zero.of(ImmutableList.of(2)))));
    assertThat(e.kind).isEqualTo(FormError.Kind.UNSUPPORTED_SUBSTITUTION_TARGET);
  }

  @Test
  public void shapeMismatch() {
    Expr grad = Grad.of(w, REGISTRY);
    Coefficient vector = new Coefficient(VP1, 3);
    FormError e =
        assertThrows(FormError.class, () -> Replace.replace(grad, ImmutableMap.of(w, vector)));
    assertThat(e.kind).isEqualTo(FormError.Kind.SHAPE_MISMATCH);
  }

  @Test
  public void derivativesExpandedFirst() {
    Argument v = Argument.testFunction(P1);
    Argument t = Argument.trialFunction(P1);
    Expr marker =
        CoefficientDerivative.of(Grad.of(w, REGISTRY), ImmutableList.of(w), ImmutableList.of(v));
    Expr result = Replace.replace(marker, ImmutableMap.of(v, t));
    assertThat(result).isEqualTo(Grad.of(t, REGISTRY));
  }

  @Test
  public void unexpandedDerivative() {
    Argument v = Argument.testFunction(P1);
    Expr marker =
        CoefficientDerivative.of(Grad.of(w, REGISTRY), ImmutableList.of(w), ImmutableList.of(v));
    FormError e =
        assertThrows(
            FormError.class, () -> Replace.replace(marker, ImmutableMap.of(w, u), expr -> expr));
    assertThat(e.kind).isEqualTo(FormError.Kind.UNEXPANDED_DERIVATIVE);
  }
}
