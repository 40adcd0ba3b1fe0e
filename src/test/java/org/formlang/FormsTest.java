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

package org.formlang;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.formlang.element.Cell;
import org.formlang.element.DomainRegistry;
import org.formlang.element.Element;
import org.formlang.expr.Argument;
import org.formlang.expr.Coefficient;
import org.formlang.expr.Expr;
import org.formlang.expr.FormError;
import org.formlang.expr.Index;
import org.formlang.expr.Label;
import org.formlang.expr.TensorConstant;
import org.formlang.expr.Variable;
import org.formlang.expr.Zero;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FormsTest {

  private static final Cell TRIANGLE = Cell.of("triangle");

  @Test
  public void countersIncrease() {
    Forms forms = Forms.standard();
    Element p1 = forms.lagrange(TRIANGLE, 1);
    Coefficient w0 = forms.coefficient(p1);
    Coefficient w1 = forms.coefficient(p1);
    assertThat(w0.count()).isEqualTo(0);
    assertThat(w1.count()).isEqualTo(1);
    assertThat(w0).isNotEqualTo(w1);
    assertThat(forms.constant(TRIANGLE).count()).isEqualTo(2);
    Label l0 = forms.label();
    assertThat(forms.label()).isNotEqualTo(l0);
  }

  @Test
  public void builder() {
    DomainRegistry registry = DomainRegistry.builder().put("prism", 3).build();
    Forms forms = Forms.builder().registry(registry).firstCoefficient(10).build();
    assertThat(forms.registry()).isSameInstanceAs(registry);
    Cell prism = Cell.of("prism");
    assertThat(forms.coefficient(forms.lagrange(prism, 1)).count()).isEqualTo(10);
    assertThat(forms.grad(forms.coefficient(forms.lagrange(prism, 2))).shape()).containsExactly(3);
    assertThrows(IllegalArgumentException.class, () -> Forms.builder().firstCoefficient(-1));
  }

  @Test
  public void constantShapes() {
    Forms forms = Forms.standard();
    Cell tet = Cell.of("tetrahedron");
    assertThat(forms.vectorConstant(tet).shape()).containsExactly(3);
    assertThat(forms.vectorConstant(tet, 5).shape()).containsExactly(5);
    assertThat(forms.tensorConstant(tet).shape()).containsExactly(3, 3);
    TensorConstant symmetric = forms.tensorConstant(TRIANGLE, ImmutableList.of(2, 2), true);
    assertThat(symmetric.isSymmetric()).isTrue();
    assertThat(forms.tensorConstant(TRIANGLE, ImmutableList.of(2, 4)).shape())
        .containsExactly(2, 4)
        .inOrder();
    FormError e = assertThrows(FormError.class, () -> forms.vectorConstant(Cell.UNDEFINED));
    assertThat(e.kind).isEqualTo(FormError.Kind.MISSING_DOMAIN);
  }

  @Test
  public void buildAndDifferentiate() {
    Forms forms = Forms.standard();
    Element p1 = forms.vectorLagrange(TRIANGLE, 1);
    Coefficient w = forms.coefficient(p1);
    Argument v = forms.testFunction(p1);
    ImmutableList<Index> ij = forms.indices(2);
    Index i = ij.get(0);
    Index j = ij.get(1);
    Expr dwij = forms.dx(forms.indexed(w, i), j);
    assertThat(dwij.freeIndices()).containsExactly(i, j).inOrder();
    assertThat(dwij.indexShape()).containsExactly(2, 2);

    Expr divW = forms.div(w);
    Expr marker = forms.derivative(divW, w, v);
    assertThat(forms.expandDerivatives(marker)).isEqualTo(forms.div(v));
    assertThat(forms.replace(marker, ImmutableMap.of(v, forms.trialFunction(p1))))
        .isEqualTo(forms.div(forms.trialFunction(p1)));
    assertThat(forms.rot(w).shape()).isEmpty();
    Coefficient hex = forms.coefficient(forms.vectorLagrange(Cell.of("hexahedron"), 1));
    assertThat(forms.curl(hex).shape()).containsExactly(3);
  }

  @Test
  public void variables() {
    Forms forms = Forms.standard();
    Coefficient w = forms.coefficient(forms.vectorLagrange(TRIANGLE, 1));
    Variable var = forms.variable(w);
    Expr f = forms.grad(var);
    assertThat(forms.diff(f, var).shape()).containsExactly(2, 2, 2);
    assertThat(forms.diff(w, var)).isEqualTo(Zero.of(ImmutableList.of(2)));
  }

  @Test
  public void simpleTerminals() {
    Forms forms = Forms.standard();
    assertThat(forms.scalar(0)).isSameInstanceAs(Zero.of());
    assertThat(forms.zero(2, 3).shape()).containsExactly(2, 3).inOrder();
    assertThat(forms.zero()).isSameInstanceAs(Zero.of());
    assertThat(forms.identity(2).shape()).containsExactly(2, 2);
    assertThat(forms.index()).isNotEqualTo(forms.index());
  }
}
