/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.query;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * Normalized operation handed over by the upstream parser and validator: fragments are inlined
 * and only field selections remain.
 */
public record ParsedQuery(
    OperationType operationType, String operationName, List<FieldSelection> selections) {

  public ParsedQuery {
    operationType = operationType == null ? OperationType.QUERY : operationType;
    selections = selections == null ? ImmutableList.of() : ImmutableList.copyOf(selections);
  }

  public static ParsedQuery query(FieldSelection... selections) {
    return new ParsedQuery(OperationType.QUERY, null, Arrays.asList(selections));
  }

  public static ParsedQuery mutation(FieldSelection... selections) {
    return new ParsedQuery(OperationType.MUTATION, null, Arrays.asList(selections));
  }

  public String rootTypeName() {
    return operationType.getRootTypeName();
  }
}
