/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import java.util.List;

/**
 * Renders a query plan as an indented tree for logs and explain output:
 *
 * <pre>
 * QueryPlan(query) {
 *   Sequence {
 *     Fetch(service: LOC) { locations { id name } }
 *     Fetch(service: REV, entity: Location, keys: [id], at: locations) { reviews { comment } }
 *   }
 * }
 * </pre>
 */
public final class QueryPlanFormatter {

  private static final String INDENT = "  ";

  private QueryPlanFormatter() {}

  public static String format(QueryPlan plan) {
    StringBuilder sb = new StringBuilder();
    sb.append("QueryPlan(").append(plan.operationType().getKeyword()).append(") {\n");
    for (QueryPlanStep step : plan.steps()) {
      appendStep(sb, step, 1);
    }
    sb.append('}');
    return sb.toString();
  }

  private static void appendStep(StringBuilder sb, QueryPlanStep step, int depth) {
    String indent = INDENT.repeat(depth);
    if (step instanceof FetchStep fetch) {
      sb.append(indent).append("Fetch(service: ").append(fetch.serviceId());
      if (fetch.isEntityFetch()) {
        sb.append(", entity: ")
            .append(fetch.entity().typeName())
            .append(", keys: ")
            .append(fetch.entity().keyFields())
            .append(", at: ")
            .append(String.join(".", fetch.mergePath()));
      }
      sb.append(") ").append(GraphQLQueryBuilder.selectionSet(fetch.selections())).append('\n');
    } else if (step instanceof IntrospectionStep introspection) {
      sb.append(indent)
          .append("Introspection ")
          .append(GraphQLQueryBuilder.selectionSet(introspection.selections()))
          .append('\n');
    } else if (step instanceof SequenceStep sequence) {
      appendGroup(sb, "Sequence", sequence.operations(), depth);
    } else if (step instanceof ParallelStep parallel) {
      appendGroup(sb, "Parallel", parallel.operations(), depth);
    }
  }

  private static void appendGroup(
      StringBuilder sb, String name, List<QueryPlanStep> operations, int depth) {
    String indent = INDENT.repeat(depth);
    sb.append(indent).append(name).append(" {\n");
    for (QueryPlanStep operation : operations) {
      appendStep(sb, operation, depth + 1);
    }
    sb.append(indent).append("}\n");
  }
}
