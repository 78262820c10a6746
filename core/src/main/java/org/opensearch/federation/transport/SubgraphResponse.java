/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.transport;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Body of a subgraph's GraphQL response.
 *
 * @param data the {@code data} member, null when the service produced none
 * @param errors the {@code errors} member, empty when the service reported none
 */
public record SubgraphResponse(Map<String, Object> data, List<Map<String, Object>> errors) {

  public SubgraphResponse {
    errors = errors == null ? List.of() : Collections.unmodifiableList(errors);
  }

  public static SubgraphResponse of(Map<String, Object> data) {
    return new SubgraphResponse(data, List.of());
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public boolean hasData() {
    return data != null;
  }
}
