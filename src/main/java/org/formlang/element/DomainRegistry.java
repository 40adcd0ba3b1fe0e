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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.formlang.expr.FormError;
import org.jspecify.annotations.Nullable;

/**
 * Maps domain names to spatial dimensions. Every operator that needs to know the spatial
 * dimension of its operand (gradients, spatial derivatives, curls) looks it up here.
 *
 * <p>DomainRegistries are immutable; use {@link #builder} to create one with additional or
 * different domains.
 */
public final class DomainRegistry {

  private static final DomainRegistry STANDARD =
      new DomainRegistry(
          ImmutableMap.<String, Integer>builder()
              .put("interval", 1)
              .put("triangle", 2)
              .put("quadrilateral", 2)
              .put("tetrahedron", 3)
              .put("hexahedron", 3)
              .buildOrThrow());

  private final ImmutableMap<String, Integer> dimensions;

  private DomainRegistry(ImmutableMap<String, Integer> dimensions) {
    this.dimensions = dimensions;
  }

  /** Returns a registry that knows the standard simplex and box domains. */
  public static DomainRegistry standard() {
    return STANDARD;
  }

  /** Returns a Builder initialized with the standard domains. */
  public static Builder builder() {
    return new Builder(STANDARD);
  }

  /**
   * Returns the spatial dimension of the named domain; throws a {@link
   * FormError.Kind#MISSING_DOMAIN} FormError if {@code domain} is null or unknown. {@code what}
   * describes the operation needing it, for the error message.
   */
  public int dimension(@Nullable String domain, String what) {
    if (domain == null) {
      throw FormError.of(
          FormError.Kind.MISSING_DOMAIN,
          "Need to know the spatial dimension to compute %s, but the operand has no domain",
          what);
    }
    Integer dim = dimensions.get(domain);
    if (dim == null) {
      throw FormError.of(
          FormError.Kind.MISSING_DOMAIN, "Unknown domain '%s' (computing %s)", domain, what);
    }
    return dim;
  }

  /** Returns the names of all domains this registry knows, with their dimensions. */
  public ImmutableMap<String, Integer> asMap() {
    return dimensions;
  }

  @Override
  public String toString() {
    return "DomainRegistry" + dimensions;
  }

  /** A Builder is used to construct a DomainRegistry. */
  public static final class Builder {
    private final Map<String, Integer> dimensions = new LinkedHashMap<>();

    private Builder(DomainRegistry base) {
      dimensions.putAll(base.dimensions);
    }

    /** Adds the named domain, replacing any previous dimension for it. */
    @CanIgnoreReturnValue
    public Builder put(String domain, int dim) {
      Preconditions.checkArgument(!domain.isEmpty(), "Empty domain name");
      Preconditions.checkArgument(dim > 0, "Non-positive dimension %s for %s", dim, domain);
      dimensions.put(domain, dim);
      return this;
    }

    /** Removes the named domain, if present. */
    @CanIgnoreReturnValue
    public Builder remove(String domain) {
      dimensions.remove(domain);
      return this;
    }

    public DomainRegistry build() {
      return new DomainRegistry(ImmutableMap.copyOf(dimensions));
    }
  }
}
