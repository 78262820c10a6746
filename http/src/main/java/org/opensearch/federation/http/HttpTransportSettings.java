/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Connection settings of the HTTP subgraph transport. */
@Getter
@Builder
@ToString
public class HttpTransportSettings {

  @Builder.Default private final Duration connectTimeout = Duration.ofSeconds(5);

  @Builder.Default private final Duration readTimeout = Duration.ofSeconds(10);

  /** Calls in flight per service; further calls are queued. */
  @Builder.Default private final int maxConcurrentCallsPerService = 16;

  public static HttpTransportSettings defaults() {
    return HttpTransportSettings.builder().build();
  }
}
