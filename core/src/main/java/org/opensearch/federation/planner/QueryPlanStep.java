/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import java.util.List;

/**
 * One node of a query plan. {@link FetchStep} sends one request to one service. {@link
 * SequenceStep} runs its operations strictly in order, each consuming the entities produced by its
 * predecessor. {@link ParallelStep} runs independent operations that share the same predecessor.
 * {@link IntrospectionStep} is answered by the gateway itself from the schema registry.
 */
public interface QueryPlanStep {

  /** Returns every fetch contained in this step, in depth-first order. */
  List<FetchStep> fetches();
}
