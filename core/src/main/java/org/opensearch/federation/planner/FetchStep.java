/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.federation.query.FieldSelection;

/**
 * A single request to a single service.
 *
 * <p>A root fetch ({@code entity == null}) selects root fields and its data is merged at the top
 * of the response. An entity fetch resolves the objects found at {@code mergePath} by
 * representation and its results are merged back onto those objects by key.
 *
 * @param serviceId owning service
 * @param mergePath response keys leading from the root to the objects this fetch extends
 * @param selections selections requested from the service, in declaration order
 * @param entity entity resolution details, null for root fetches
 */
public record FetchStep(
    String serviceId,
    List<String> mergePath,
    List<FieldSelection> selections,
    EntityRequirement entity)
    implements QueryPlanStep {

  public FetchStep {
    mergePath = ImmutableList.copyOf(mergePath);
    selections = ImmutableList.copyOf(selections);
  }

  public static FetchStep root(String serviceId, List<FieldSelection> selections) {
    return new FetchStep(serviceId, List.of(), selections, null);
  }

  public boolean isEntityFetch() {
    return entity != null;
  }

  @Override
  public List<FetchStep> fetches() {
    return List.of(this);
  }
}
