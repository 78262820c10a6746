/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.registry;

import com.google.common.base.Preconditions;

/**
 * A backend service that owns part of the supergraph.
 *
 * @param id unique service id, as referenced by the ownership map
 * @param url endpoint GraphQL requests are sent to
 */
public record ServiceDescriptor(String id, String url) {

  public ServiceDescriptor {
    Preconditions.checkArgument(id != null && !id.isEmpty(), "Service id is required");
    Preconditions.checkArgument(
        url != null && !url.isEmpty(), "Service url is required for %s", id);
  }
}
