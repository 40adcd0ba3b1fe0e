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

/**
 * An entry in a {@link MultiIndex}: either a symbolic {@link Index}, which names a dimension to be
 * left free or summed over, or a {@link FixedIndex}, which selects a single concrete component.
 */
public abstract class IndexBase {

  IndexBase() {}

  /** True if this is a FixedIndex. */
  public abstract boolean isFixed();

  /** Returns a canonical string identifying this index. */
  public abstract String repr();
}
