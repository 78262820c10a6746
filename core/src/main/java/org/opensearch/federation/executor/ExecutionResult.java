/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merged response of a federated request.
 *
 * @param data response tree shaped exactly like the client selection
 * @param errors partial errors, empty when every operation succeeded
 */
public record ExecutionResult(Map<String, Object> data, List<GraphQLError> errors) {

  public ExecutionResult {
    data = Collections.unmodifiableMap(data);
    errors = List.copyOf(errors);
  }

  public static ExecutionResult empty() {
    return new ExecutionResult(new LinkedHashMap<>(), List.of());
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Renders the {@code {data, errors}} response envelope. */
  public Map<String, Object> toSpecification() {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("data", data);
    if (!errors.isEmpty()) {
      result.put(
          "errors",
          errors.stream().map(GraphQLError::toSpecification).collect(Collectors.toList()));
    }
    return result;
  }
}
