/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.query;

/** Enum literal argument value, serialized without quotes. */
public record EnumValue(String name) {

  @Override
  public String toString() {
    return name;
  }
}
