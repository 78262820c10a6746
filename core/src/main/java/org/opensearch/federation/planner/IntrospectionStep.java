/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.federation.query.FieldSelection;

/**
 * Root introspection fields ({@code __schema}, {@code __type}) answered by the gateway from the
 * schema registry. Contains no fetch and never reaches the transport.
 *
 * @param selections root introspection selections, in declaration order
 */
public record IntrospectionStep(List<FieldSelection> selections) implements QueryPlanStep {

  public IntrospectionStep {
    Preconditions.checkArgument(
        selections != null && !selections.isEmpty(), "Nothing to introspect");
    selections = ImmutableList.copyOf(selections);
  }

  @Override
  public List<FetchStep> fetches() {
    return List.of();
  }
}
