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
import org.jspecify.annotations.Nullable;

/**
 * An Expr is a node in the graph of a tensor-valued expression. There are two subclasses:
 *
 * <ul>
 *   <li>{@link Terminal}: a leaf, such as a basis function, a coefficient, or a literal
 *   <li>{@link Operator}: a node computed from one or more operand Exprs
 * </ul>
 *
 * <p>Exprs are immutable, and an expression graph is a DAG: an Expr may be an operand of any
 * number of other Exprs. Each Expr has a {@link #shape} and, separately, an ordered list of {@link
 * #freeIndices}; the free indices contribute implicit dimensions that are never included in the
 * shape.
 *
 * <p>Equality is structural: two Exprs are equal if they are the same kind of node with equal
 * operands (terminals define their own equality). This makes Exprs usable as keys in substitution
 * maps and memo tables regardless of how many times an equal subexpression was allocated. {@link
 * #repr} returns a canonical string that is equal for equal Exprs.
 *
 * <p>Instances are created by the static {@code of} methods on each subclass (or the convenience
 * methods on {@link org.formlang.Forms}), which validate their operands and may return a simpler
 * Expr (usually a {@link Zero}) than the one requested.
 */
public abstract class Expr {

  /** Cached result of {@link #hashCode}; zero if not yet computed. */
  private int hash;

  /** Cached result of {@link #repr}; null if not yet computed. */
  private String repr;

  /** The dimensions of this Expr's value, not including those contributed by free indices. */
  public abstract ImmutableList<Integer> shape();

  /** This Expr's operands, in order; empty for a Terminal. */
  public abstract ImmutableList<Expr> operands();

  /** Calls the {@link ExprVisitor} method for this Expr's kind of node. */
  public abstract <T> T accept(ExprVisitor<T> visitor);

  /**
   * The indices that appear exactly once in this Expr, in order of first occurrence. Indices that
   * appear twice are summed over and are not included.
   */
  public ImmutableList<Index> freeIndices() {
    return ImmutableList.of();
  }

  /** The dimension bound to each of this Expr's free indices. */
  public ImmutableMap<Index, Integer> indexDimensions() {
    return ImmutableMap.of();
  }

  /**
   * Returns the name of the domain that this Expr is defined on, or null if it is not bound to a
   * domain (e.g. a literal).
   */
  public abstract @Nullable String domain();

  /** True if this is a Terminal. */
  public boolean isTerminal() {
    return false;
  }

  /** The number of dimensions in {@link #shape}. */
  public final int rank() {
    return shape().size();
  }

  /** The dimensions of this Expr's free indices, in the same order as {@link #freeIndices}. */
  public final ImmutableList<Integer> indexShape() {
    ImmutableMap<Index, Integer> dims = indexDimensions();
    return freeIndices().stream().map(dims::get).collect(ImmutableList.toImmutableList());
  }

  /** Returns a canonical string identifying this Expr; equal Exprs have equal reprs. */
  public final String repr() {
    if (repr == null) {
      repr = computeRepr();
    }
    return repr;
  }

  /** Computes the result of {@link #repr}; only called once. */
  protected abstract String computeRepr();

  /**
   * Given another Expr of the same class as this one, returns true if they are structurally
   * equal.
   */
  protected abstract boolean sameAs(Expr other);

  /** Computes the result of {@link #hashCode}; only called once. */
  protected abstract int computeHash();

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Expr other = (Expr) obj;
    return hashCode() == other.hashCode() && sameAs(other);
  }

  @Override
  public final int hashCode() {
    int result = hash;
    if (result == 0) {
      result = computeHash();
      // Zero is reserved to mean "not yet computed"
      if (result == 0) {
        result = 1;
      }
      hash = result;
    }
    return result;
  }

  /** Returns a short human-readable form of this Expr. */
  @Override
  public abstract String toString();
}
