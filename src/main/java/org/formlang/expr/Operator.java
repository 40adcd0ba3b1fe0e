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
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An Expr computed from one or more operands. Subclasses derive their shape and free indices from
 * their operands when constructed, and never accept them as separate inputs.
 */
public abstract class Operator extends Expr {

  /**
   * Returns an Expr of the same kind as this one, but with the given operands (which must be as
   * many as {@link #operands} returns, in the same order). The result is constructed by the same
   * validating factory as this Operator was, so it may be simplified (e.g. to a {@link Zero}) and
   * will throw a {@link FormError} if the new operands are invalid.
   *
   * <p>If {@code newOperands} are all identical to the current operands, returns this.
   */
  public abstract Expr reconstruct(List<Expr> newOperands);

  /** True if each of {@code newOperands} is the same object as the corresponding operand. */
  protected final boolean sameOperands(List<Expr> newOperands) {
    ImmutableList<Expr> operands = operands();
    assert newOperands.size() == operands.size();
    for (int i = 0; i < operands.size(); i++) {
      if (newOperands.get(i) != operands.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code expr} is a Terminal whose value cannot vary in space. */
  static boolean isSpatiallyConstant(Expr expr) {
    return expr instanceof Terminal terminal && terminal.isSpatiallyConstant();
  }

  /**
   * Throws a {@link FormError.Kind#FREE_INDEX} FormError if {@code operand} has any free indices;
   * {@code what} names the operation, for the error message.
   */
  static void checkNoFreeIndices(Expr operand, String what) {
    if (!operand.freeIndices().isEmpty()) {
      throw FormError.of(
          FormError.Kind.FREE_INDEX,
          "Taking the %s of an expression with free indices %s is not supported",
          what,
          operand.freeIndices());
    }
  }

  /** Returns the domain of the first operand that has one. */
  @Override
  public @Nullable String domain() {
    for (Expr operand : operands()) {
      String domain = operand.domain();
      if (domain != null) {
        return domain;
      }
    }
    return null;
  }

  /**
   * Operators are equal if their operands are equal and they have the same shape and free index
   * dimensions; either may depend on a spatial dimension that isn't one of the operands.
   */
  @Override
  protected boolean sameAs(Expr other) {
    ImmutableList<Expr> operands = operands();
    ImmutableList<Expr> otherOperands = other.operands();
    if (operands.size() != otherOperands.size()
        || !shape().equals(other.shape())
        || !indexShape().equals(other.indexShape())) {
      return false;
    }
    for (int i = 0; i < operands.size(); i++) {
      if (!operands.get(i).equals(otherOperands.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  protected int computeHash() {
    int result = getClass().getSimpleName().hashCode() * 31 + shape().hashCode();
    for (Expr operand : operands()) {
      result = result * 31 + operand.hashCode();
    }
    return result;
  }

  @Override
  protected String computeRepr() {
    return operands().stream()
        .map(Expr::repr)
        .collect(Collectors.joining(", ", getClass().getSimpleName() + "(", ")"));
  }
}
