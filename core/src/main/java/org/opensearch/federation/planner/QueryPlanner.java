/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.SchemaMismatchException;
import org.opensearch.federation.exception.UnknownFieldException;
import org.opensearch.federation.introspection.SchemaIntrospection;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.query.OperationType;
import org.opensearch.federation.query.ParsedQuery;
import org.opensearch.federation.registry.SchemaRegistry;

/**
 * Decomposes a client selection into fetches against the services owning each field.
 *
 * <p>Planning is a depth-first walk from the virtual root type. Root fields are grouped by owner,
 * one fetch per service. Inside a fetch, a child owned by the same service is folded into it; a
 * child owned by another service is a boundary crossing:
 *
 * <ul>
 *   <li>the current fetch additionally selects the key fields of the parent entity
 *   <li>a dependent entity fetch against the new owner receives the crossed subtree
 *   <li>crossed siblings with the same owner share one dependent fetch
 * </ul>
 *
 * <p>A fetch with dependents turns into a {@link SequenceStep}; several dependents of one fetch
 * run inside a {@link ParallelStep}. Children are visited in declaration order and every
 * collection is ordered, so planning the same selection twice yields equal plans.
 *
 * <p>Root {@code __schema} and {@code __type} fields of a query are collected into one {@link
 * IntrospectionStep} answered by the gateway itself.
 *
 * <p>The planner has no side effects. Unresolvable fields abort planning with a {@link
 * SchemaMismatchException} before anything is dispatched.
 */
@Log4j2
@RequiredArgsConstructor
public class QueryPlanner {

  public static final String TYPENAME_FIELD = "__typename";

  /** Alias prefix for key fields the planner adds under a response key already in use. */
  public static final String KEY_ALIAS_PREFIX = "_key_";

  private final SchemaRegistry registry;

  /**
   * Builds the query plan for a parsed query.
   *
   * @param query normalized selection tree
   * @return deterministic query plan, empty for an empty selection
   */
  public QueryPlan plan(ParsedQuery query) {
    if (query.selections().isEmpty()) {
      return QueryPlan.empty(query.operationType());
    }

    String rootType = query.rootTypeName();
    String typenameOwner = typenameOwner(rootType, query.selections());
    List<FieldSelection> introspection = new ArrayList<>();
    List<RootGroup> rootGroups = new ArrayList<>();
    for (FieldSelection selection : query.selections()) {
      if (query.operationType() == OperationType.QUERY
          && SchemaIntrospection.isIntrospectionField(selection.name())) {
        SchemaIntrospection.validate(rootType, selection);
        introspection.add(selection);
        continue;
      }
      String owner =
          TYPENAME_FIELD.equals(selection.name())
              ? typenameOwner
              : resolveOwner(rootType, selection, null);
      groupFor(query.operationType(), rootGroups, owner).selections.add(selection);
    }

    List<QueryPlanStep> steps = new ArrayList<>();
    if (!introspection.isEmpty()) {
      steps.add(new IntrospectionStep(introspection));
    }
    for (RootGroup group : rootGroups) {
      FetchNode node = new FetchNode(group.serviceId, List.of(), null);
      node.selections = rewrite(node, rootType, group.selections, List.of());
      steps.add(toStep(node));
    }

    QueryPlan plan = new QueryPlan(query.operationType(), query.selections(), steps);
    log.debug(
        "Planned {} fetch(es) in {} top-level step(s)", plan.fetches().size(), steps.size());
    return plan;
  }

  /**
   * Queries batch every root field of a service into one fetch. Mutation fields run in the order
   * they are written, so only consecutive fields of the same service share a fetch.
   */
  private static RootGroup groupFor(
      OperationType operationType, List<RootGroup> groups, String serviceId) {
    if (operationType == OperationType.MUTATION) {
      RootGroup last = groups.isEmpty() ? null : groups.get(groups.size() - 1);
      if (last != null && last.serviceId.equals(serviceId)) {
        return last;
      }
    } else {
      for (RootGroup group : groups) {
        if (group.serviceId.equals(serviceId)) {
          return group;
        }
      }
    }
    RootGroup group = new RootGroup(serviceId);
    groups.add(group);
    return group;
  }

  /**
   * Rewrites the children of one object for the fetch {@code context}: folds the children owned
   * by the context's service, moves the others into dependent entity fetches and adds the parent
   * key fields those dependents need.
   */
  private List<FieldSelection> rewrite(
      FetchNode context, String parentType, List<FieldSelection> children, List<String> path) {
    List<FieldSelection> result = new ArrayList<>();
    Map<String, List<FieldSelection>> crossings = new LinkedHashMap<>();

    for (FieldSelection child : children) {
      if (TYPENAME_FIELD.equals(child.name())) {
        result.add(child);
        continue;
      }
      String owner = resolveOwner(parentType, child, context.serviceId);
      if (!owner.equals(context.serviceId)) {
        crossings.computeIfAbsent(owner, k -> new ArrayList<>()).add(child);
      } else if (child.isLeaf()) {
        result.add(child);
      } else {
        String childType = resolveFieldType(parentType, child);
        List<String> childPath = append(path, child.responseKey());
        result.add(child.withChildren(rewrite(context, childType, child.children(), childPath)));
      }
    }

    if (!crossings.isEmpty()) {
      List<String> keyFields = registry.entityKey(parentType);
      Map<String, String> keyBindings = bindKeyFields(result, keyFields);
      EntityRequirement entity = new EntityRequirement(parentType, keyFields, keyBindings);
      for (Map.Entry<String, List<FieldSelection>> crossing : crossings.entrySet()) {
        FetchNode dependent = new FetchNode(crossing.getKey(), path, entity);
        dependent.selections = rewrite(dependent, parentType, crossing.getValue(), path);
        context.dependents.add(dependent);
      }
    }
    return result;
  }

  /**
   * Makes sure {@code selections} carries every key field and returns where each one is found. A
   * plain client-requested key field is reused, so its value comes from this fetch and is not
   * fetched again.
   */
  private Map<String, String> bindKeyFields(
      List<FieldSelection> selections, List<String> keyFields) {
    Map<String, String> bindings = new LinkedHashMap<>();
    for (String keyField : keyFields) {
      FieldSelection existing =
          selections.stream()
              .filter(s -> s.name().equals(keyField) && s.isLeaf() && !s.hasArguments())
              .findFirst()
              .orElse(null);
      if (existing != null) {
        bindings.put(keyField, existing.responseKey());
        continue;
      }
      Set<String> taken =
          selections.stream().map(FieldSelection::responseKey).collect(Collectors.toSet());
      String responseKey = keyField;
      for (int attempt = 1; taken.contains(responseKey); attempt++) {
        responseKey = KEY_ALIAS_PREFIX + keyField + (attempt == 1 ? "" : String.valueOf(attempt));
      }
      FieldSelection keySelection = FieldSelection.leaf(keyField);
      selections.add(
          responseKey.equals(keyField) ? keySelection : keySelection.withAlias(responseKey));
      bindings.put(keyField, responseKey);
    }
    return bindings;
  }

  private QueryPlanStep toStep(FetchNode node) {
    registry.resolveService(node.serviceId);
    FetchStep fetch = new FetchStep(node.serviceId, node.mergePath, node.selections, node.entity);
    if (node.dependents.isEmpty()) {
      return fetch;
    }

    List<QueryPlanStep> dependents =
        node.dependents.stream().map(this::toStep).collect(Collectors.toList());
    ImmutableList.Builder<QueryPlanStep> operations =
        ImmutableList.<QueryPlanStep>builder().add(fetch);
    if (dependents.size() == 1 && dependents.get(0) instanceof SequenceStep sequence) {
      operations.addAll(sequence.operations());
    } else if (dependents.size() == 1) {
      operations.add(dependents.get(0));
    } else {
      operations.add(new ParallelStep(dependents));
    }
    return new SequenceStep(operations.build());
  }

  private String resolveOwner(String parentType, FieldSelection child, String preferredService) {
    try {
      return registry.resolveOwner(parentType, child.name(), preferredService);
    } catch (UnknownFieldException e) {
      throw new SchemaMismatchException(parentType, child.name(), e);
    }
  }

  private String resolveFieldType(String parentType, FieldSelection child) {
    try {
      return registry.resolveFieldType(parentType, child.name());
    } catch (UnknownFieldException e) {
      throw new SchemaMismatchException(parentType, child.name(), e);
    }
  }

  /**
   * A root {@code __typename} is answered by the service of the first other root field sent to a
   * service, or by the first service in id order when there is none.
   */
  private String typenameOwner(String rootType, List<FieldSelection> selections) {
    for (FieldSelection selection : selections) {
      if (!TYPENAME_FIELD.equals(selection.name())
          && !SchemaIntrospection.isIntrospectionField(selection.name())) {
        return resolveOwner(rootType, selection, null);
      }
    }
    return registry.getServiceIds().stream()
        .sorted()
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("Schema registry has no services"));
  }

  private static List<String> append(List<String> path, String segment) {
    return ImmutableList.<String>builder().addAll(path).add(segment).build();
  }

  private static final class RootGroup {
    private final String serviceId;
    private final List<FieldSelection> selections = new ArrayList<>();

    private RootGroup(String serviceId) {
      this.serviceId = serviceId;
    }
  }

  /** Mutable fetch under construction. */
  private static final class FetchNode {
    private final String serviceId;
    private final List<String> mergePath;
    private final EntityRequirement entity;
    private final List<FetchNode> dependents = new ArrayList<>();
    private List<FieldSelection> selections = List.of();

    private FetchNode(String serviceId, List<String> mergePath, EntityRequirement entity) {
      this.serviceId = serviceId;
      this.mergePath = mergePath;
      this.entity = entity;
    }
  }
}
