/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** Independent operations that may be dispatched concurrently. */
public record ParallelStep(List<QueryPlanStep> operations) implements QueryPlanStep {

  public ParallelStep {
    Preconditions.checkArgument(
        operations != null && operations.size() >= 2,
        "A parallel step needs at least two operations");
    operations = ImmutableList.copyOf(operations);
  }

  @Override
  public List<FetchStep> fetches() {
    return operations.stream()
        .flatMap(operation -> operation.fetches().stream())
        .collect(Collectors.toList());
  }
}
