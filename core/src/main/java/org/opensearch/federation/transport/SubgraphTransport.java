/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.opensearch.federation.registry.ServiceDescriptor;

/**
 * Sends GraphQL documents to subgraph services. Retries, pooling, TLS and per-service concurrency
 * limits are the transport's business; the executor only issues calls and applies its own
 * per-call timeout.
 *
 * <p>Implementations complete the returned future exceptionally on network or protocol failure
 * and must stop the underlying call when the future is cancelled.
 */
@FunctionalInterface
public interface SubgraphTransport {

  /**
   * Sends one request.
   *
   * @param service target service
   * @param query GraphQL document
   * @param variables request variables, never null
   * @return future of the parsed response
   */
  CompletableFuture<SubgraphResponse> send(
      ServiceDescriptor service, String query, Map<String, Object> variables);
}
