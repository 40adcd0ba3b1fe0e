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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.formlang.algorithms.DerivativeExpander;
import org.formlang.algorithms.GateauxDerivatives;
import org.formlang.algorithms.Replace;
import org.formlang.element.Cell;
import org.formlang.element.DomainRegistry;
import org.formlang.element.Element;
import org.formlang.element.FiniteElement;
import org.formlang.expr.Argument;
import org.formlang.expr.Coefficient;
import org.formlang.expr.CoefficientDerivative;
import org.formlang.expr.Constant;
import org.formlang.expr.Curl;
import org.formlang.expr.Div;
import org.formlang.expr.Expr;
import org.formlang.expr.Grad;
import org.formlang.expr.Identity;
import org.formlang.expr.Index;
import org.formlang.expr.IndexBase;
import org.formlang.expr.Indexed;
import org.formlang.expr.Label;
import org.formlang.expr.MultiIndex;
import org.formlang.expr.Rot;
import org.formlang.expr.ScalarValue;
import org.formlang.expr.SpatialDerivative;
import org.formlang.expr.TensorConstant;
import org.formlang.expr.Variable;
import org.formlang.expr.VariableDerivative;
import org.formlang.expr.VectorConstant;
import org.formlang.expr.Zero;
import org.formlang.util.ShapeUtil;

/**
 * A Forms instance is the starting point for building expressions; it provides the domain
 * registry that operators use to look up spatial dimensions, and numbers the coefficients and
 * labels it creates so that each is distinct.
 *
 * <p>A Forms instance is safe to share between threads; the expressions it returns are immutable.
 */
public class Forms {

  private final DomainRegistry registry;
  private final AtomicInteger nextCoefficient;
  private final AtomicInteger nextLabel;

  private Forms(DomainRegistry registry, int firstCoefficient, int firstLabel) {
    this.registry = registry;
    this.nextCoefficient = new AtomicInteger(firstCoefficient);
    this.nextLabel = new AtomicInteger(firstLabel);
  }

  /** Returns a new Forms using {@link DomainRegistry#standard}. */
  public static Forms standard() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public DomainRegistry registry() {
    return registry;
  }

  /** Returns the spatial dimension of {@code cell}'s domain. */
  public int dimension(Cell cell) {
    return registry.dimension(cell.domain(), "cell dimension");
  }

  // Terminals

  public Argument testFunction(FiniteElement element) {
    return Argument.testFunction(element);
  }

  public Argument trialFunction(FiniteElement element) {
    return Argument.trialFunction(element);
  }

  /** Returns an Argument with an explicit number; the test and trial functions are -2 and -1. */
  public Argument argument(FiniteElement element, int number) {
    return new Argument(element, number);
  }

  /** Returns a new Coefficient, distinct from all others created by this Forms. */
  public Coefficient coefficient(FiniteElement element) {
    return new Coefficient(element, nextCoefficient.getAndIncrement());
  }

  public Constant constant(Cell cell) {
    return new Constant(cell, nextCoefficient.getAndIncrement());
  }

  /** Returns a vector-valued constant with one component per spatial dimension of {@code cell}. */
  public VectorConstant vectorConstant(Cell cell) {
    return vectorConstant(cell, dimension(cell));
  }

  public VectorConstant vectorConstant(Cell cell, int dim) {
    return new VectorConstant(cell, dim, nextCoefficient.getAndIncrement());
  }

  /** Returns a (dim, dim) tensor-valued constant, where dim is {@code cell}'s dimension. */
  public TensorConstant tensorConstant(Cell cell) {
    int dim = dimension(cell);
    return tensorConstant(cell, ShapeUtil.of(dim, dim), false);
  }

  public TensorConstant tensorConstant(Cell cell, List<Integer> shape) {
    return tensorConstant(cell, shape, false);
  }

  /**
   * Returns a tensor-valued constant. If {@code symmetric} is true, {@code shape} must be square
   * and of rank 2.
   */
  public TensorConstant tensorConstant(Cell cell, List<Integer> shape, boolean symmetric) {
    return new TensorConstant(
        cell, ShapeUtil.copyOf(shape), symmetric, nextCoefficient.getAndIncrement());
  }

  public Expr scalar(double value) {
    return ScalarValue.of(value);
  }

  public Zero zero(Integer... shape) {
    return Zero.of(Arrays.asList(shape));
  }

  public Identity identity(int dim) {
    return Identity.of(dim);
  }

  /** Returns a new Index, distinct from all others. */
  public Index index() {
    return new Index();
  }

  /** Returns {@code n} new Indices. */
  public ImmutableList<Index> indices(int n) {
    Preconditions.checkArgument(n >= 0);
    ImmutableList.Builder<Index> builder = ImmutableList.builderWithExpectedSize(n);
    for (int i = 0; i < n; i++) {
      builder.add(new Index());
    }
    return builder.build();
  }

  public Label label() {
    return new Label(nextLabel.getAndIncrement());
  }

  // Operators

  /** Returns {@code expr} wrapped in a Variable with a new Label. */
  public Variable variable(Expr expr) {
    return Variable.of(expr, label());
  }

  public Expr indexed(Expr expr, IndexBase... indices) {
    return Indexed.of(expr, MultiIndex.of(indices));
  }

  /** Returns the derivative of {@code expr} in the spatial directions given by {@code indices}. */
  public Expr dx(Expr expr, IndexBase... indices) {
    return SpatialDerivative.of(expr, MultiIndex.of(indices), registry);
  }

  public Expr spatialDerivative(Expr expr, MultiIndex indices) {
    return SpatialDerivative.of(expr, indices, registry);
  }

  /** Returns the derivative of {@code f} with respect to {@code v}, a Variable or its component. */
  public Expr diff(Expr f, Expr v) {
    return VariableDerivative.of(f, v);
  }

  public Expr grad(Expr f) {
    return Grad.of(f, registry);
  }

  public Expr div(Expr f) {
    return Div.of(f);
  }

  public Expr curl(Expr f) {
    return Curl.of(f, registry);
  }

  public Expr rot(Expr f) {
    return Rot.of(f, registry);
  }

  /**
   * Returns an unexpanded Gateaux derivative of {@code integrand} with respect to {@code
   * coefficient} in the direction {@code argument}.
   */
  public Expr derivative(Expr integrand, Coefficient coefficient, Expr argument) {
    return CoefficientDerivative.of(
        integrand, ImmutableList.of(coefficient), ImmutableList.of(argument));
  }

  public Expr derivative(
      Expr integrand, List<? extends Expr> coefficients, List<? extends Expr> arguments) {
    return CoefficientDerivative.of(integrand, coefficients, arguments);
  }

  // Algorithms

  public Expr expandDerivatives(Expr expr) {
    return GateauxDerivatives.INSTANCE.expand(expr);
  }

  public Expr replace(Expr expr, Map<? extends Expr, ? extends Expr> mapping) {
    return Replace.replace(expr, mapping);
  }

  public Expr replace(
      Expr expr, Map<? extends Expr, ? extends Expr> mapping, DerivativeExpander expander) {
    return Replace.replace(expr, mapping, expander);
  }

  /** Convenience for a Lagrange element on {@code cell}. */
  public Element lagrange(Cell cell, int degree) {
    return Element.scalar("Lagrange", cell, degree);
  }

  /** Convenience for a vector Lagrange element with one component per spatial dimension. */
  public Element vectorLagrange(Cell cell, int degree) {
    return Element.vector("Lagrange", cell, degree, dimension(cell));
  }

  public static final class Builder {
    private DomainRegistry registry = DomainRegistry.standard();
    private int firstCoefficient = 0;
    private int firstLabel = 0;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder registry(DomainRegistry registry) {
      this.registry = Preconditions.checkNotNull(registry);
      return this;
    }

    /** Sets the count of the first Coefficient created; defaults to 0. */
    @CanIgnoreReturnValue
    public Builder firstCoefficient(int count) {
      Preconditions.checkArgument(count >= 0);
      this.firstCoefficient = count;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder firstLabel(int count) {
      Preconditions.checkArgument(count >= 0);
      this.firstLabel = count;
      return this;
    }

    public Forms build() {
      return new Forms(registry, firstCoefficient, firstLabel);
    }
  }
}
