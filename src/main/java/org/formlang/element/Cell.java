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

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An opaque handle for the geometric cell that a finite element is defined on. The only thing a
 * Cell tells us is the name of its domain (e.g. {@code "triangle"}), which a {@link
 * DomainRegistry} maps to a spatial dimension.
 */
public final class Cell {

  /** A Cell with no domain; operators that need a spatial dimension reject expressions on it. */
  public static final Cell UNDEFINED = new Cell(null);

  private final @Nullable String domain;

  private Cell(@Nullable String domain) {
    this.domain = domain;
  }

  /** Returns a Cell on the named domain. */
  public static Cell of(String domain) {
    Preconditions.checkArgument(!domain.isEmpty(), "Empty domain name");
    return new Cell(domain);
  }

  /** Returns the name of this Cell's domain, or null if it has none. */
  public @Nullable String domain() {
    return domain;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Cell other && Objects.equals(domain, other.domain);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(domain);
  }

  @Override
  public String toString() {
    return (domain == null) ? "Cell(None)" : "Cell('" + domain + "')";
  }
}
