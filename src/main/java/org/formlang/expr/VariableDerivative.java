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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.List;
import org.formlang.util.ShapeUtil;

/**
 * The derivative of an expression {@code f} with respect to a {@link Variable} {@code v} (or a
 * component {@code v[i]} of one). The result's shape is {@code f}'s shape followed by {@code v}'s,
 * and its free indices are {@code f}'s followed by {@code v}'s.
 */
public final class VariableDerivative extends Operator {

  private final ImmutableList<Expr> operands;
  private final ImmutableList<Integer> shape;
  private final ImmutableList<Index> freeIndices;
  private final ImmutableMap<Index, Integer> indexDimensions;

  private VariableDerivative(Expr f, Expr v) {
    this.operands = ImmutableList.of(f, v);
    this.shape = ShapeUtil.concat(f.shape(), v.shape());
    this.freeIndices =
        ImmutableList.<Index>builder().addAll(f.freeIndices()).addAll(v.freeIndices()).build();
    this.indexDimensions =
        ImmutableMap.<Index, Integer>builder()
            .putAll(f.indexDimensions())
            .putAll(v.indexDimensions())
            .buildOrThrow();
  }

  /**
   * Returns the derivative of {@code f} with respect to {@code v}, which must be a Variable or an
   * {@link Indexed} Variable.
   *
   * <p>A Terminal {@code f} cannot depend on a Variable, so if {@code f} is a Terminal and {@code
   * f} and {@code v} have the same set of free indices the result is a {@link Zero} with {@code f}'s
   * shape (not the shape of the derivative). Otherwise
   * {@code f} and {@code v} may not share any free index.
   */
  public static Expr of(Expr f, Expr v) {
    if (!(v instanceof Variable
        || (v instanceof Indexed indexed && indexed.expression() instanceof Variable))) {
      throw FormError.of(
          FormError.Kind.INVALID_OPERAND, "Expecting a Variable to differentiate by, not %s", v);
    }
    ImmutableSet<Index> fi = ImmutableSet.copyOf(f.freeIndices());
    ImmutableSet<Index> vi = ImmutableSet.copyOf(v.freeIndices());
    if (f.isTerminal() && Sets.symmetricDifference(fi, vi).isEmpty()) {
      return Zero.of(f.shape(), f.freeIndices(), f.indexDimensions());
    }
    Sets.SetView<Index> shared = Sets.intersection(fi, vi);
    if (!shared.isEmpty()) {
      throw FormError.of(
          FormError.Kind.FREE_INDEX,
          "Repeated indices %s not allowed in a variable derivative",
          shared.immutableCopy());
    }
    return new VariableDerivative(f, v);
  }

  /** The expression being differentiated. */
  public Expr f() {
    return operands.get(0);
  }

  /** The Variable (or component of a Variable) being differentiated by. */
  public Expr v() {
    return operands.get(1);
  }

  @Override
  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public ImmutableList<Index> freeIndices() {
    return freeIndices;
  }

  @Override
  public ImmutableMap<Index, Integer> indexDimensions() {
    return indexDimensions;
  }

  @Override
  public ImmutableList<Expr> operands() {
    return operands;
  }

  @Override
  public Expr reconstruct(List<Expr> newOperands) {
    return sameOperands(newOperands) ? this : of(newOperands.get(0), newOperands.get(1));
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitVariableDerivative(this);
  }

  @Override
  public String toString() {
    return "(d[" + f() + "] / d[" + v() + "])";
  }
}
