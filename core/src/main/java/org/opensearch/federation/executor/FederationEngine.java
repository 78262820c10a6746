/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.common.response.ResponseListener;
import org.opensearch.federation.planner.QueryPlan;
import org.opensearch.federation.planner.QueryPlanFormatter;
import org.opensearch.federation.planner.QueryPlanner;
import org.opensearch.federation.query.ParsedQuery;
import org.opensearch.federation.registry.SchemaRegistry;
import org.opensearch.federation.transport.SubgraphTransport;

/**
 * Entry point for federated requests: plans the query against the schema registry and executes
 * the plan over the subgraph transport. Planning errors are reported to the listener before any
 * service is called.
 */
@Log4j2
public class FederationEngine {

  private final QueryPlanner planner;

  private final PlanExecutor executor;

  private final SubgraphTransport transport;

  public FederationEngine(
      SchemaRegistry registry, SubgraphTransport transport, ExecutorSettings settings) {
    this.planner = new QueryPlanner(registry);
    this.executor = new PlanExecutor(registry, settings);
    this.transport = transport;
    log.info("Initialized FederationEngine with {}", settings);
  }

  /**
   * Executes a query and reports the merged response to {@code listener}.
   *
   * @return the execution context of the request, which can be used to cancel it
   */
  public ExecutionContext execute(ParsedQuery query, ResponseListener<ExecutionResult> listener) {
    ExecutionContext context = new ExecutionContext();
    QueryPlan plan;
    try {
      plan = planner.plan(query);
    } catch (RuntimeException e) {
      log.error("Failed to plan request {}", context.getRequestId(), e);
      listener.onFailure(e);
      return context;
    }
    log.debug("Request {} plan:\n{}", context.getRequestId(), plan);

    CompletableFuture<ExecutionResult> result = executor.executeAsync(plan, context, transport);
    result.whenComplete(
        (response, error) -> {
          if (error == null) {
            listener.onResponse(response);
          } else {
            Exception cause = unwrap(error);
            log.error("Request {} failed", context.getRequestId(), cause);
            listener.onFailure(cause);
          }
        });
    return context;
  }

  /** Reports the plan of a query, rendered as an indented tree, without executing it. */
  public void explain(ParsedQuery query, ResponseListener<String> listener) {
    try {
      listener.onResponse(QueryPlanFormatter.format(planner.plan(query)));
    } catch (RuntimeException e) {
      log.error("Error generating federated explain", e);
      listener.onFailure(e);
    }
  }

  private static Exception unwrap(Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    return cause instanceof Exception exception ? exception : new RuntimeException(cause);
  }
}
