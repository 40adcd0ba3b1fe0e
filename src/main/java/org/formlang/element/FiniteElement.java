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

package org.formlang.element;

import com.google.common.collect.ImmutableList;

/**
 * The two things expressions need to know about a finite element. Everything else about an
 * element (degrees of freedom, basis functions, mappings) is the concern of other code.
 *
 * <p>Implementations should be immutable and have value semantics, since terminals built on an
 * element compare equal only if their elements do.
 */
public interface FiniteElement {
  /** The shape of the values of functions in this element's space. */
  ImmutableList<Integer> valueShape();

  /** The cell this element is defined on. */
  Cell cell();
}
