/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.registry.SupergraphConfiguration;

/** Timeouts applied by the {@link PlanExecutor}. */
@Getter
@Builder
@ToString
public class ExecutorSettings {

  public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(10);

  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  /** Upper bound of a single subgraph call. */
  @Builder.Default private final Duration operationTimeout = DEFAULT_OPERATION_TIMEOUT;

  /** Upper bound of a whole federated request, after which outstanding calls are cancelled. */
  @Builder.Default private final Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

  public static ExecutorSettings defaults() {
    return ExecutorSettings.builder().build();
  }

  /**
   * Reads the optional {@code execution} block of a supergraph configuration, falling back to the
   * defaults for anything not set.
   */
  public static ExecutorSettings fromConfiguration(SupergraphConfiguration configuration) {
    ExecutorSettingsBuilder builder = ExecutorSettings.builder();
    SupergraphConfiguration.ExecutionConfig execution = configuration.getExecution();
    if (execution != null) {
      if (execution.getOperationTimeoutMillis() != null) {
        builder.operationTimeout(Duration.ofMillis(execution.getOperationTimeoutMillis()));
      }
      if (execution.getRequestTimeoutMillis() != null) {
        builder.requestTimeout(Duration.ofMillis(execution.getRequestTimeoutMillis()));
      }
    }
    return builder.build();
  }
}
