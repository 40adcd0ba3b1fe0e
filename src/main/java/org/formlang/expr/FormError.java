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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All invalid expressions and invalid rewrites detected by this library throw a FormError. These
 * are contract violations by the caller; none of them is transient, and no partially-constructed
 * expression is ever returned alongside one.
 */
public class FormError extends RuntimeException {

  /** Distinguishes the different ways in which an expression can be invalid. */
  public enum Kind {
    /** A replacement or reconstruction would change the shape of a terminal. */
    SHAPE_MISMATCH,
    /** An index occurs more than twice, or its occurrences disagree on dimension. */
    INDEX_ARITY,
    /** An operator that needs the spatial dimension was applied to an expression without one. */
    MISSING_DOMAIN,
    /** An operand has the wrong rank (or, for vectors, the wrong length). */
    RANK,
    /** An operand carries free indices where none are allowed. */
    FREE_INDEX,
    /** A substitution mapping has a key that is not a terminal. */
    UNSUPPORTED_SUBSTITUTION_TARGET,
    /** A rewrite reached a coefficient derivative that should already have been expanded. */
    UNEXPANDED_DERIVATIVE,
    /** An operand is not of the kind of expression the operator requires. */
    INVALID_OPERAND,
    /** Derivative expansion reached an expression it has no rule for. */
    UNSUPPORTED_DERIVATIVE
  }

  public final Kind kind;

  public FormError(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  /** Returns a new FormError with a message formatted from {@code fmt} and {@code fmtArgs}. */
  @FormatMethod
  public static FormError of(Kind kind, String fmt, Object... fmtArgs) {
    return new FormError(kind, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", super.getMessage(), kind);
  }
}
