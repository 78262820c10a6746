/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.federation.exception.FederationException;

/**
 * One entry of the response {@code errors} array.
 *
 * @param message human readable message
 * @param path response path of the failing sub-selection, field names and list indices; null when
 *     the error is not attached to a single field
 * @param extensions extra members, {@code code} at least
 */
public record GraphQLError(String message, List<Object> path, Map<String, Object> extensions) {

  public GraphQLError {
    path = path == null ? null : Collections.unmodifiableList(new ArrayList<>(path));
    extensions =
        extensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  /** Creates an error from a federation exception, attaching the exception's code. */
  public static GraphQLError from(FederationException exception, List<Object> path) {
    Map<String, Object> extensions = new LinkedHashMap<>();
    extensions.put("code", exception.getErrorCode().name());
    return new GraphQLError(exception.getMessage(), path, extensions);
  }

  /** Renders the error the way it appears in a GraphQL response. */
  public Map<String, Object> toSpecification() {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("message", message);
    if (path != null && !path.isEmpty()) {
      result.put("path", path);
    }
    if (!extensions.isEmpty()) {
      result.put("extensions", extensions);
    }
    return result;
  }
}
