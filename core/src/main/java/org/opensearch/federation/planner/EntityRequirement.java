/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Describes how an entity fetch references the parent objects produced by the preceding
 * operation.
 *
 * @param typeName entity type, sent as {@code __typename} in every representation
 * @param keyFields key field names, in declaration order
 * @param keyBindings key field name to the response key holding its value in the parent objects
 */
public record EntityRequirement(
    String typeName, List<String> keyFields, Map<String, String> keyBindings) {

  public EntityRequirement {
    keyFields = ImmutableList.copyOf(keyFields);
    keyBindings = ImmutableMap.copyOf(keyBindings);
  }

  /** Response key under which the parent objects carry the value of {@code keyField}. */
  public String parentResponseKey(String keyField) {
    return keyBindings.getOrDefault(keyField, keyField);
  }
}
