/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.query;

import com.google.common.base.Preconditions;

/**
 * A single field argument. The value is a GraphQL literal: {@link String}, {@link Number}, {@link
 * Boolean}, {@code null}, {@link java.util.List}, {@link java.util.Map} (input object) or {@link
 * EnumValue}.
 */
public record Argument(String name, Object value) {

  public Argument {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Argument name is required");
  }

  public static Argument of(String name, Object value) {
    return new Argument(name, value);
  }
}
