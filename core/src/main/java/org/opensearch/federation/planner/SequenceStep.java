/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations that run strictly one after another. Operation {@code i + 1} is built from the
 * entities returned by operation {@code i}; the first operation is always a {@link FetchStep}.
 */
public record SequenceStep(List<QueryPlanStep> operations) implements QueryPlanStep {

  public SequenceStep {
    Preconditions.checkArgument(
        operations != null && operations.size() >= 2, "A sequence needs at least two operations");
    Preconditions.checkArgument(
        operations.get(0) instanceof FetchStep, "A sequence must start with a fetch");
    operations = ImmutableList.copyOf(operations);
  }

  public FetchStep first() {
    return (FetchStep) operations.get(0);
  }

  @Override
  public List<FetchStep> fetches() {
    return operations.stream()
        .flatMap(operation -> operation.fetches().stream())
        .collect(Collectors.toList());
  }
}
