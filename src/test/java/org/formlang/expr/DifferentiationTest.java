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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.formlang.element.Cell;
import org.formlang.element.DomainRegistry;
import org.formlang.element.Element;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class DifferentiationTest {

  private static final DomainRegistry REGISTRY = DomainRegistry.standard();
  private static final Cell TRIANGLE = Cell.of("triangle");
  private static final Cell TETRAHEDRON = Cell.of("tetrahedron");

  private static Coefficient scalar(Cell cell, int count) {
    return new Coefficient(Element.scalar("Lagrange", cell, 1), count);
  }

  private static Coefficient vector(Cell cell, int dim, int count) {
    return new Coefficient(Element.vector("Lagrange", cell, 1, dim), count);
  }

  private static void assertError(FormError.Kind kind, Runnable op) {
    FormError e = assertThrows(FormError.class, op::run);
    assertThat(e.kind).isEqualTo(kind);
  }

  @Test
  public void gradOfConstantIsZero(
      @TestParameter({"interval", "triangle", "quadrilateral", "tetrahedron", "hexahedron"})
          String domain) {
    int dim = REGISTRY.dimension(domain, "test");
    Expr grad = Grad.of(new Constant(Cell.of(domain), 0), REGISTRY);
    assertThat(grad).isEqualTo(Zero.of(ImmutableList.of(dim)));
    Expr gradVector = Grad.of(new VectorConstant(Cell.of(domain), dim, 1), REGISTRY);
    assertThat(gradVector).isEqualTo(Zero.of(ImmutableList.of(dim, dim)));
  }

  @Test
  public void gradShape(@TestParameter({"interval", "triangle", "tetrahedron"}) String domain) {
    int dim = REGISTRY.dimension(domain, "test");
    Cell cell = Cell.of(domain);
    Grad grad = (Grad) Grad.of(scalar(cell, 0), REGISTRY);
    assertThat(grad.shape()).containsExactly(dim);
    assertThat(grad.dim()).isEqualTo(dim);
    assertThat(grad.domain()).isEqualTo(domain);
    assertThat(Grad.of(vector(cell, 4, 1), REGISTRY).shape()).containsExactly(dim, 4).inOrder();
    assertThat(Grad.of(grad, REGISTRY).shape()).containsExactly(dim, dim);
  }

  @Test
  public void gradErrors() {
    assertError(FormError.Kind.MISSING_DOMAIN, () -> Grad.of(scalar(Cell.UNDEFINED, 0), REGISTRY));
    // A Zero has no domain, so its gradient's shape is unknown
    assertError(FormError.Kind.MISSING_DOMAIN, () -> Grad.of(Zero.of(), REGISTRY));
    Expr wi = Indexed.of(vector(TRIANGLE, 2, 0), MultiIndex.of(new Index()));
    assertError(FormError.Kind.FREE_INDEX, () -> Grad.of(wi, REGISTRY));
  }

  @Test
  public void gradWithUnknownDomain() {
    DomainRegistry registry = DomainRegistry.builder().remove("triangle").build();
    assertError(FormError.Kind.MISSING_DOMAIN, () -> Grad.of(scalar(TRIANGLE, 0), registry));
  }

  @Test
  public void divergence() {
    Expr div = Div.of(vector(TETRAHEDRON, 3, 0));
    assertThat(div).isInstanceOf(Div.class);
    assertThat(div.shape()).isEmpty();
    Expr grad = Grad.of(vector(TRIANGLE, 2, 1), REGISTRY);
    assertThat(Div.of(grad).shape()).containsExactly(2);
    assertThat(Div.of(grad).toString()).isEqualTo("div(grad(w_1))");
  }

  @Test
  public void divergenceOfConstantIsZero() {
    assertThat(Div.of(new VectorConstant(TETRAHEDRON, 3, 0))).isEqualTo(Zero.of());
    assertThat(Div.of(new Constant(TRIANGLE, 1))).isEqualTo(Zero.of());
    assertThat(Div.of(new TensorConstant(TRIANGLE, ImmutableList.of(2, 2), false, 2)))
        .isEqualTo(Zero.of(ImmutableList.of(2)));
    assertThat(Div.of(Zero.of(ImmutableList.of(3, 4)))).isEqualTo(Zero.of(ImmutableList.of(4)));
  }

  @Test
  public void divergenceErrors() {
    assertError(FormError.Kind.RANK, () -> Div.of(scalar(TRIANGLE, 0)));
    Expr dx = SpatialDerivative.of(vector(TRIANGLE, 2, 0), MultiIndex.of(new Index()), REGISTRY);
    assertError(FormError.Kind.FREE_INDEX, () -> Div.of(dx));
  }

  @Test
  public void spatialDerivativeOfZero() {
    Index i = new Index();
    Expr result = SpatialDerivative.of(Zero.of(), MultiIndex.of(i, i), REGISTRY);
    assertThat(result).isEqualTo(Zero.of());
    // A constant differentiated in paired directions is also zero
    Expr constant = new VectorConstant(TRIANGLE, 2, 0);
    Index j = new Index();
    assertThat(SpatialDerivative.of(constant, MultiIndex.of(j, j), REGISTRY))
        .isEqualTo(Zero.of(ImmutableList.of(2)));
  }

  @Test
  public void spatialDerivativeIndices() {
    Index i = new Index();
    SpatialDerivative d =
        (SpatialDerivative) SpatialDerivative.of(scalar(TRIANGLE, 0), MultiIndex.of(i), REGISTRY);
    assertThat(d.shape()).isEmpty();
    assertThat(d.freeIndices()).containsExactly(i);
    assertThat(d.indexShape()).containsExactly(2);
    assertThat(d.dxFreeIndices()).containsExactly(i);
    assertThat(d.repeatedIndices()).isEmpty();

    // Laplacian-like: both directions summed
    Index j = new Index();
    SpatialDerivative dd =
        (SpatialDerivative)
            SpatialDerivative.of(scalar(TETRAHEDRON, 1), MultiIndex.of(j, j), REGISTRY);
    assertThat(dd.freeIndices()).isEmpty();
    assertThat(dd.dxRepeatedIndices()).containsExactly(j);

    // A free index of the operand contracts with a differentiation direction
    Index k = new Index();
    Expr wk = Indexed.of(vector(TRIANGLE, 2, 2), MultiIndex.of(k));
    SpatialDerivative div =
        (SpatialDerivative) SpatialDerivative.of(wk, MultiIndex.of(k), REGISTRY);
    assertThat(div.freeIndices()).isEmpty();
    assertThat(div.repeatedIndices()).containsExactly(k);

    Expr fixed =
        SpatialDerivative.of(scalar(TRIANGLE, 3), MultiIndex.of(FixedIndex.of(1)), REGISTRY);
    assertThat(fixed.freeIndices()).isEmpty();
  }

  @Test
  public void spatialDerivativeOfConstantRejectsTripleIndex() {
    Index i = new Index();
    Index j = new Index();
    assertError(
        FormError.Kind.INDEX_ARITY,
        () -> SpatialDerivative.of(new Constant(TRIANGLE, 0), MultiIndex.of(i, i, i, j), REGISTRY));
    assertError(
        FormError.Kind.INDEX_ARITY,
        () -> SpatialDerivative.of(Zero.of(), MultiIndex.of(j, j, j), REGISTRY));
  }

  @Test
  public void spatialDerivativeOfConstantWithFreeDirection() {
    // i is paired but j is not, so the result is a derivative with free index j
    Index i = new Index();
    Index j = new Index();
    Expr d = SpatialDerivative.of(new Constant(TRIANGLE, 0), MultiIndex.of(i, j, i), REGISTRY);
    assertThat(d).isInstanceOf(SpatialDerivative.class);
    assertThat(d.freeIndices()).containsExactly(j);
  }

  @Test
  public void spatialDerivativeErrors() {
    Index i = new Index();
    Coefficient w = scalar(TRIANGLE, 0);
    assertError(
        FormError.Kind.INDEX_ARITY,
        () -> SpatialDerivative.of(w, MultiIndex.of(FixedIndex.of(2)), REGISTRY));
    assertError(
        FormError.Kind.INDEX_ARITY,
        () -> SpatialDerivative.of(w, MultiIndex.of(i, i, i), REGISTRY));
    assertError(
        FormError.Kind.MISSING_DOMAIN,
        () -> SpatialDerivative.of(scalar(Cell.UNDEFINED, 1), MultiIndex.of(i), REGISTRY));
    // The operand's free index has dimension 3, but the spatial dimension is 2
    Expr wk = Indexed.of(vector(TRIANGLE, 3, 2), MultiIndex.of(i));
    assertError(
        FormError.Kind.INDEX_ARITY, () -> SpatialDerivative.of(wk, MultiIndex.of(i), REGISTRY));
  }

  @Test
  public void curl() {
    Expr curl = Curl.of(vector(TETRAHEDRON, 3, 0), REGISTRY);
    assertThat(curl.shape()).containsExactly(3);
    assertThat(curl.toString()).isEqualTo("curl(w_0)");
    // Curl has no constant simplification
    assertThat(Curl.of(new VectorConstant(TETRAHEDRON, 3, 1), REGISTRY)).isInstanceOf(Curl.class);
  }

  @Test
  public void curlErrors() {
    assertError(FormError.Kind.RANK, () -> Curl.of(scalar(TETRAHEDRON, 0), REGISTRY));
    assertError(FormError.Kind.RANK, () -> Curl.of(vector(TETRAHEDRON, 2, 0), REGISTRY));
    assertError(
        FormError.Kind.MISSING_DOMAIN, () -> Curl.of(vector(Cell.UNDEFINED, 3, 0), REGISTRY));
    Expr dx = SpatialDerivative.of(vector(TETRAHEDRON, 3, 0), MultiIndex.of(new Index()), REGISTRY);
    assertError(FormError.Kind.FREE_INDEX, () -> Curl.of(dx, REGISTRY));
  }

  @Test
  public void rot() {
    Expr rot = Rot.of(vector(TRIANGLE, 2, 0), REGISTRY);
    assertThat(rot.shape()).isEmpty();
    assertThat(rot.toString()).isEqualTo("rot(w_0)");
    // Without a domain the length isn't checked
    assertThat(Rot.of(new VectorConstant(Cell.UNDEFINED, 5, 1), REGISTRY).shape()).isEmpty();
  }

  @Test
  public void rotErrors() {
    assertError(FormError.Kind.RANK, () -> Rot.of(scalar(TRIANGLE, 0), REGISTRY));
    assertError(FormError.Kind.RANK, () -> Rot.of(vector(TRIANGLE, 3, 0), REGISTRY));
  }

  @Test
  public void variableDerivativeOfTerminalIsZero() {
    Coefficient w = scalar(TRIANGLE, 0);
    // The zero has the shape of w, not of the derivative
    Variable v = Variable.of(vector(TRIANGLE, 2, 1), new Label(0));
    Expr dwdv = VariableDerivative.of(w, v);
    assertThat(dwdv).isEqualTo(Zero.of());
    assertThat(dwdv.shape()).isEmpty();
    Coefficient wv = vector(TRIANGLE, 3, 3);
    assertThat(VariableDerivative.of(wv, v)).isEqualTo(Zero.of(ImmutableList.of(3)));
    Variable s = Variable.of(scalar(TRIANGLE, 2), new Label(1));
    assertThat(VariableDerivative.of(w, s)).isEqualTo(Zero.of());
  }

  @Test
  public void variableDerivative() {
    Coefficient w = vector(TRIANGLE, 2, 0);
    Variable v = Variable.of(w, new Label(0));
    Expr grad = Grad.of(v, REGISTRY);
    VariableDerivative d = (VariableDerivative) VariableDerivative.of(grad, v);
    assertThat(d.shape()).containsExactly(2, 2, 2);
    assertThat(d.f()).isSameInstanceAs(grad);
    assertThat(d.v()).isSameInstanceAs(v);

    Index i = new Index();
    Index j = new Index();
    Expr vi = Indexed.of(v, MultiIndex.of(i));
    Expr gj = Indexed.of(Grad.of(scalar(TRIANGLE, 1), REGISTRY), MultiIndex.of(j));
    Expr dij = VariableDerivative.of(gj, vi);
    assertThat(dij.shape()).isEmpty();
    assertThat(dij.freeIndices()).containsExactly(j, i).inOrder();
  }

  @Test
  public void variableDerivativeErrors() {
    Coefficient w = vector(TRIANGLE, 2, 0);
    Variable v = Variable.of(w, new Label(0));
    Expr grad = Grad.of(v, REGISTRY);
    assertError(FormError.Kind.INVALID_OPERAND, () -> VariableDerivative.of(grad, w));
    Index i = new Index();
    Expr gi = Indexed.of(Div.of(grad), MultiIndex.of(i));
    Expr vi = Indexed.of(v, MultiIndex.of(i));
    assertError(FormError.Kind.FREE_INDEX, () -> VariableDerivative.of(gi, vi));
  }
}
