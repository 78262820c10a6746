/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.query.OperationType;

/**
 * Immutable result of planning one query shape. Top-level steps have no data dependency on each
 * other. Plans are deterministic for a given selection and registry, so they can be cached by the
 * selection tree and shared between concurrent requests.
 *
 * @param operationType query or mutation
 * @param selections client selection the plan was built from, the shape of the final response
 * @param steps top-level steps
 */
public record QueryPlan(
    OperationType operationType, List<FieldSelection> selections, List<QueryPlanStep> steps) {

  public QueryPlan {
    selections = ImmutableList.copyOf(selections);
    steps = ImmutableList.copyOf(steps);
  }

  public static QueryPlan empty(OperationType operationType) {
    return new QueryPlan(operationType, List.of(), List.of());
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  /** Returns every fetch of the plan, in depth-first order. */
  public List<FetchStep> fetches() {
    return steps.stream().flatMap(step -> step.fetches().stream()).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return QueryPlanFormatter.format(this);
  }
}
