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

import com.google.common.base.Preconditions;

/** An index with a concrete non-negative value, selecting a single component along a dimension. */
public final class FixedIndex extends IndexBase {

  /** Cached instances for the small values that account for nearly all uses. */
  private static final FixedIndex[] SMALL = new FixedIndex[8];

  static {
    for (int i = 0; i < SMALL.length; i++) {
      SMALL[i] = new FixedIndex(i);
    }
  }

  public final int value;

  private FixedIndex(int value) {
    this.value = value;
  }

  /** Returns a FixedIndex with the given value, which must be non-negative. */
  public static FixedIndex of(int value) {
    Preconditions.checkArgument(value >= 0, "Negative fixed index %s", value);
    return (value < SMALL.length) ? SMALL[value] : new FixedIndex(value);
  }

  @Override
  public boolean isFixed() {
    return true;
  }

  @Override
  public String repr() {
    return "FixedIndex(" + value + ")";
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FixedIndex other && value == other.value;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
