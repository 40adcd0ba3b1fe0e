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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A symbolic index, used purely as a name in index notation. Every Index created is distinct from
 * every other: two Indices are equal only if they are the same object.
 *
 * <p>Indices may be created concurrently from any thread.
 */
public final class Index extends IndexBase {

  private static final AtomicInteger counter = new AtomicInteger();

  /** Distinguishes this Index from all others; used only for printing and hashing. */
  public final int count;

  /** Returns a new Index, distinct from all previously created Indices. */
  public Index() {
    this.count = counter.getAndIncrement();
  }

  @Override
  public boolean isFixed() {
    return false;
  }

  @Override
  public String repr() {
    return "Index(" + count + ")";
  }

  @Override
  public int hashCode() {
    return count;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this;
  }

  @Override
  public String toString() {
    return "i_" + count;
  }
}
