/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.common.utils.StringUtils;
import org.opensearch.federation.exception.EntityResolutionMismatchException;
import org.opensearch.federation.exception.ErrorCode;
import org.opensearch.federation.exception.FederationException;
import org.opensearch.federation.exception.RequestCancelledException;
import org.opensearch.federation.exception.TransportException;
import org.opensearch.federation.exception.UpstreamProtocolException;
import org.opensearch.federation.executor.EntityStitcher.EntityTarget;
import org.opensearch.federation.executor.EntityStitcher.Representations;
import org.opensearch.federation.executor.ExecutionContext.EntityCacheKey;
import org.opensearch.federation.introspection.SchemaIntrospection;
import org.opensearch.federation.planner.FetchStep;
import org.opensearch.federation.planner.GraphQLQueryBuilder;
import org.opensearch.federation.planner.IntrospectionStep;
import org.opensearch.federation.planner.ParallelStep;
import org.opensearch.federation.planner.QueryPlan;
import org.opensearch.federation.planner.QueryPlanStep;
import org.opensearch.federation.planner.SequenceStep;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.query.OperationType;
import org.opensearch.federation.registry.SchemaRegistry;
import org.opensearch.federation.registry.ServiceDescriptor;
import org.opensearch.federation.transport.SubgraphResponse;
import org.opensearch.federation.transport.SubgraphTransport;

/**
 * Interprets a {@link QueryPlan} against the subgraph services and assembles the response.
 *
 * <p>Execution flow:
 *
 * <ol>
 *   <li>Top-level steps are dispatched concurrently for queries and one after another for
 *       mutations
 *   <li>A fetch serializes its selections, sends them and merges the returned data into the
 *       response tree of the {@link ExecutionContext}
 *   <li>A sequence runs its operations strictly in order; each entity fetch builds its
 *       representations from what the previous operation merged and stitches the returned
 *       entities onto their parents by key
 *   <li>Root introspection fields are answered from the schema registry without any call
 *   <li>The merged tree is projected onto the client selection
 * </ol>
 *
 * <p>A failed operation nulls its own subtree and adds one error; operations depending on it are
 * never dispatched, while independent operations carry on. Cancelling the returned future, or
 * exceeding the request timeout, cancels every call still in flight and discards late results.
 */
@Log4j2
@RequiredArgsConstructor
public class PlanExecutor {

  private final SchemaRegistry registry;

  private final ExecutorSettings settings;

  public PlanExecutor(SchemaRegistry registry) {
    this(registry, ExecutorSettings.defaults());
  }

  /**
   * Executes a plan and waits for the result.
   *
   * @throws RequestCancelledException if the request timed out or the calling thread was
   *     interrupted
   */
  public ExecutionResult execute(
      QueryPlan plan, ExecutionContext context, SubgraphTransport transport) {
    CompletableFuture<ExecutionResult> future = executeAsync(plan, context, transport);
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new RequestCancelledException(
          StringUtils.format("Interrupted while executing request %s", context.getRequestId()), e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new IllegalStateException("Plan execution failed", e.getCause());
    }
  }

  /**
   * Executes a plan without blocking. Partial failures are reported in the result; the future
   * only fails when the request as a whole is cancelled or times out.
   */
  public CompletableFuture<ExecutionResult> executeAsync(
      QueryPlan plan, ExecutionContext context, SubgraphTransport transport) {
    if (plan.isEmpty()) {
      return CompletableFuture.completedFuture(ExecutionResult.empty());
    }
    log.info(
        "Executing request {}: {} fetch(es) in {} top-level step(s)",
        context.getRequestId(),
        plan.fetches().size(),
        plan.steps().size());

    OperationType operationType = plan.operationType();
    CompletableFuture<Boolean> steps;
    if (operationType == OperationType.MUTATION) {
      steps = CompletableFuture.completedFuture(true);
      for (QueryPlanStep step : plan.steps()) {
        steps = steps.thenCompose(ignored -> run(step, operationType, context, transport));
      }
    } else {
      steps =
          all(
              plan.steps().stream()
                  .map(step -> run(step, operationType, context, transport))
                  .collect(Collectors.toList()));
    }

    CompletableFuture<ExecutionResult> outcome = new CompletableFuture<>();
    steps
        .thenApply(ignored -> buildResult(plan, context))
        .orTimeout(settings.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete(
            (result, error) -> {
              if (error == null) {
                outcome.complete(result);
              } else {
                context.cancel();
                outcome.completeExceptionally(translate(error, context));
              }
            });
    outcome.whenComplete(
        (result, error) -> {
          if (outcome.isCancelled()) {
            context.cancel();
          }
        });
    return outcome;
  }

  private CompletableFuture<Boolean> run(
      QueryPlanStep step,
      OperationType operationType,
      ExecutionContext context,
      SubgraphTransport transport) {
    if (step instanceof FetchStep fetch) {
      return runFetch(fetch, operationType, context, transport);
    }
    if (step instanceof SequenceStep sequence) {
      return runSequence(sequence, operationType, context, transport);
    }
    if (step instanceof ParallelStep parallel) {
      return all(
          parallel.operations().stream()
              .map(operation -> run(operation, operationType, context, transport))
              .collect(Collectors.toList()));
    }
    if (step instanceof IntrospectionStep introspection) {
      return CompletableFuture.completedFuture(runIntrospection(introspection, context));
    }
    throw new IllegalStateException("Unsupported plan step: " + step.getClass().getSimpleName());
  }

  /** Answers root introspection fields from the registry and merges them at the root. */
  private boolean runIntrospection(IntrospectionStep step, ExecutionContext context) {
    if (context.isCancelled()) {
      return false;
    }
    Map<String, Object> fields = new SchemaIntrospection(registry).resolve(step.selections());
    context.locked(
        () -> {
          EntityStitcher.deepMerge(context.data(), fields);
          return null;
        });
    log.debug(
        "Request {}: answered {} introspection field(s) locally",
        context.getRequestId(),
        fields.size());
    return true;
  }

  private CompletableFuture<Boolean> runSequence(
      SequenceStep sequence,
      OperationType operationType,
      ExecutionContext context,
      SubgraphTransport transport) {
    context.transition(sequence, SequenceState.FIRST_DISPATCHED);
    CompletableFuture<Boolean> chain =
        run(sequence.first(), operationType, context, transport)
            .thenApply(
                succeeded -> {
                  context.transition(
                      sequence,
                      succeeded ? SequenceState.KEYS_EXTRACTED : SequenceState.FAILED);
                  return succeeded;
                });

    List<QueryPlanStep> operations = sequence.operations();
    for (int i = 1; i < operations.size(); i++) {
      QueryPlanStep operation = operations.get(i);
      SequenceState onSuccess =
          i == operations.size() - 1 ? SequenceState.MERGED : SequenceState.KEYS_EXTRACTED;
      chain =
          chain.thenCompose(
              previousSucceeded -> {
                if (!previousSucceeded) {
                  return CompletableFuture.completedFuture(false);
                }
                context.transition(sequence, SequenceState.SECOND_DISPATCHED);
                return run(operation, operationType, context, transport)
                    .thenApply(
                        succeeded -> {
                          context.transition(
                              sequence, succeeded ? onSuccess : SequenceState.FAILED);
                          return succeeded;
                        });
              });
    }
    return chain;
  }

  private CompletableFuture<Boolean> runFetch(
      FetchStep fetch,
      OperationType operationType,
      ExecutionContext context,
      SubgraphTransport transport) {
    if (context.isCancelled()) {
      return CompletableFuture.completedFuture(false);
    }

    ServiceDescriptor service;
    try {
      service = registry.resolveService(fetch.serviceId());
    } catch (FederationException e) {
      failFetch(fetch, null, context, e);
      return CompletableFuture.completedFuture(false);
    }

    Representations representations = null;
    Map<String, Object> variables = Map.of();
    if (fetch.isEntityFetch()) {
      representations = context.locked(() -> collectRepresentations(fetch, context));
      if (representations.isEmpty()) {
        log.debug(
            "Request {}: no {} entities left to resolve from {}",
            context.getRequestId(),
            fetch.entity().typeName(),
            fetch.serviceId());
        return CompletableFuture.completedFuture(true);
      }
      variables =
          Map.of(GraphQLQueryBuilder.REPRESENTATIONS_VARIABLE, representations.toVariable());
    }

    String query = GraphQLQueryBuilder.build(fetch, operationType);
    log.debug("Request {}: sending to {}: {}", context.getRequestId(), service.id(), query);

    CompletableFuture<SubgraphResponse> call;
    try {
      call = transport.send(service, query, variables);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    context.track(call);
    call.orTimeout(settings.getOperationTimeout().toMillis(), TimeUnit.MILLISECONDS);

    Representations sent = representations;
    return call.handle((response, error) -> complete(fetch, sent, context, response, error));
  }

  /**
   * Builds the representations of an entity fetch. Entities resolved earlier in the request with
   * the same selections are merged right away instead of being sent again; parents without key
   * values are nulled with an error.
   */
  private Representations collectRepresentations(FetchStep fetch, ExecutionContext context) {
    Representations representations = EntityStitcher.collect(context.data(), fetch);
    for (List<Object> key : representations.keys()) {
      Map<String, Object> cached = context.cachedEntity(cacheKey(fetch, key));
      if (cached != null) {
        for (EntityTarget target : representations.remove(key)) {
          EntityStitcher.mergeEntity(target, cached);
        }
      }
    }
    for (EntityTarget target : representations.unkeyed()) {
      EntityStitcher.nullSelections(target.object(), fetch.selections());
      context.addError(
          GraphQLError.from(
              new EntityResolutionMismatchException(
                  fetch.serviceId(),
                  StringUtils.format(
                      "Cannot resolve %s without values for key fields %s",
                      fetch.entity().typeName(),
                      fetch.entity().keyFields())),
              errorPath(target.path(), fetch)));
    }
    return representations;
  }

  private boolean complete(
      FetchStep fetch,
      Representations representations,
      ExecutionContext context,
      SubgraphResponse response,
      Throwable error) {
    if (context.isCancelled()) {
      log.debug(
          "Request {}: discarding response of {} after cancellation",
          context.getRequestId(),
          fetch.serviceId());
      return false;
    }
    try {
      if (error != null) {
        failFetch(fetch, representations, context, toFederationException(fetch, error));
        return false;
      }
      if (response == null) {
        failFetch(
            fetch,
            representations,
            context,
            new UpstreamProtocolException(fetch.serviceId(), "Service returned no response"));
        return false;
      }
      return context.locked(
          () ->
              fetch.isEntityFetch()
                  ? mergeEntities(fetch, representations, context, response)
                  : mergeRoot(fetch, context, response));
    } catch (RuntimeException e) {
      log.error("Request {}: unable to merge response of {}", context.getRequestId(), fetch, e);
      failFetch(
          fetch,
          representations,
          context,
          new UpstreamProtocolException(
              fetch.serviceId(),
              StringUtils.format(
                  "Unable to merge response of service %s: %s",
                  fetch.serviceId(),
                  e.getMessage())));
      return false;
    }
  }

  private boolean mergeRoot(FetchStep fetch, ExecutionContext context, SubgraphResponse response) {
    passUpstreamErrors(fetch, null, context, response);
    if (!response.hasData()) {
      if (response.hasErrors()) {
        nullSubtree(fetch, null, context);
        return false;
      }
      failFetch(fetch, null, context, noDataException(fetch));
      return false;
    }

    Map<String, Object> fields = new LinkedHashMap<>();
    for (FieldSelection selection : fetch.selections()) {
      fields.put(
          selection.responseKey(),
          EntityStitcher.copyTree(response.data().get(selection.responseKey())));
    }
    EntityStitcher.deepMerge(context.data(), fields);
    return true;
  }

  private boolean mergeEntities(
      FetchStep fetch,
      Representations representations,
      ExecutionContext context,
      SubgraphResponse response) {
    passUpstreamErrors(fetch, representations, context, response);
    if (!response.hasData()) {
      if (response.hasErrors()) {
        nullSubtree(fetch, representations, context);
        return false;
      }
      failFetch(fetch, representations, context, noDataException(fetch));
      return false;
    }
    if (!(response.data().get(GraphQLQueryBuilder.ENTITIES_FIELD) instanceof List<?> entities)) {
      failFetch(
          fetch,
          representations,
          context,
          new UpstreamProtocolException(
              fetch.serviceId(),
              StringUtils.format(
                  "Service %s did not return an %s list",
                  fetch.serviceId(),
                  GraphQLQueryBuilder.ENTITIES_FIELD)));
      return false;
    }

    List<Object> rejected = new ArrayList<>();
    Map<List<Object>, Map<String, Object>> hashTable =
        EntityStitcher.buildHashTable(entities, fetch.entity(), rejected);
    for (List<Object> key : representations.keys()) {
      Map<String, Object> entity = hashTable.get(key);
      List<EntityTarget> targets = representations.targets(key);
      if (entity == null) {
        for (EntityTarget target : targets) {
          EntityStitcher.nullSelections(target.object(), fetch.selections());
          context.addError(
              GraphQLError.from(
                  new EntityResolutionMismatchException(
                      fetch.serviceId(),
                      StringUtils.format(
                          "Service %s returned no %s entity for key %s",
                          fetch.serviceId(),
                          fetch.entity().typeName(),
                          key)),
                  errorPath(target.path(), fetch)));
        }
        continue;
      }
      context.cacheEntity(cacheKey(fetch, key), entity);
      for (EntityTarget target : targets) {
        EntityStitcher.mergeEntity(target, entity);
      }
    }

    if (entities.size() != representations.size() || !rejected.isEmpty()) {
      log.warn(
          "Request {}: service {} returned {} entities ({} without a key echo) for {}"
              + " representations",
          context.getRequestId(),
          fetch.serviceId(),
          entities.size(),
          rejected.size(),
          representations.size());
    }
    return true;
  }

  /**
   * Adds the errors reported by a service. Paths of entity fetches point into {@code _entities};
   * they are rewritten to the parent object the representation was built from.
   */
  private void passUpstreamErrors(
      FetchStep fetch,
      Representations representations,
      ExecutionContext context,
      SubgraphResponse response) {
    if (!response.hasErrors()) {
      return;
    }
    log.warn(
        "Request {}: service {} reported {} error(s)",
        context.getRequestId(),
        fetch.serviceId(),
        response.errors().size());
    for (Map<String, Object> upstream : response.errors()) {
      Map<String, Object> extensions = new LinkedHashMap<>();
      if (upstream.get("extensions") instanceof Map<?, ?> upstreamExtensions) {
        upstreamExtensions.forEach((name, value) -> extensions.put(String.valueOf(name), value));
      }
      extensions.putIfAbsent("code", ErrorCode.UPSTREAM_PROTOCOL_ERROR.name());
      extensions.put("serviceName", fetch.serviceId());
      String message =
          Objects.toString(
              upstream.get("message"), "Service " + fetch.serviceId() + " reported an error");
      context.addError(
          new GraphQLError(
              message, rewritePath(fetch, representations, upstream.get("path")), extensions));
    }
  }

  private List<Object> rewritePath(
      FetchStep fetch, Representations representations, Object upstreamPath) {
    if (!(upstreamPath instanceof List<?> segments)) {
      return fetch.isEntityFetch() ? new ArrayList<>(fetch.mergePath()) : null;
    }
    if (!fetch.isEntityFetch()) {
      return new ArrayList<>(segments);
    }
    if (segments.size() >= 2
        && GraphQLQueryBuilder.ENTITIES_FIELD.equals(segments.get(0))
        && segments.get(1) instanceof Number index
        && index.intValue() >= 0
        && index.intValue() < representations.size()) {
      List<Object> key = representations.keys().get(index.intValue());
      List<EntityTarget> targets = representations.targets(key);
      if (!targets.isEmpty()) {
        List<Object> path = new ArrayList<>(targets.get(0).path());
        path.addAll(segments.subList(2, segments.size()));
        return path;
      }
    }
    return new ArrayList<>(fetch.mergePath());
  }

  /**
   * Nulls the subtree of a failed fetch and reports one error for it. An entity fetch extending a
   * single parent reports that parent's concrete path, list indices included; one extending
   * several parents reports the collapsed merge path, such as {@code [locations, reviews]}.
   */
  private void failFetch(
      FetchStep fetch,
      Representations representations,
      ExecutionContext context,
      FederationException exception) {
    log.warn(
        "Request {}: fetch from {} at {} failed: {}",
        context.getRequestId(),
        fetch.serviceId(),
        StringUtils.formatPath(fetch.mergePath()),
        exception.getMessage());
    List<?> base = fetch.mergePath();
    if (representations != null) {
      List<List<Object>> targetPaths =
          representations.allTargets().stream()
              .map(EntityTarget::path)
              .distinct()
              .collect(Collectors.toList());
      if (targetPaths.size() == 1) {
        base = targetPaths.get(0);
      }
    }
    nullSubtree(fetch, representations, context);
    context.addError(GraphQLError.from(exception, errorPath(base, fetch)));
  }

  private void nullSubtree(
      FetchStep fetch, Representations representations, ExecutionContext context) {
    context.locked(
        () -> {
          if (!fetch.isEntityFetch()) {
            EntityStitcher.nullSelections(context.data(), fetch.selections());
          } else if (representations != null) {
            for (EntityTarget target : representations.allTargets()) {
              EntityStitcher.nullSelections(target.object(), fetch.selections());
            }
          }
          return null;
        });
  }

  private ExecutionResult buildResult(QueryPlan plan, ExecutionContext context) {
    if (context.isCancelled()) {
      throw new RequestCancelledException(
          StringUtils.format("Request %s was cancelled", context.getRequestId()));
    }
    Map<String, Object> data =
        context.locked(() -> ResultProjector.project(context.data(), plan.selections()));
    List<GraphQLError> errors = context.getErrors();
    log.info(
        "Request {} completed with {} error(s)", context.getRequestId(), errors.size());
    return new ExecutionResult(data, errors);
  }

  private FederationException toFederationException(FetchStep fetch, Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof TimeoutException) {
      return new TransportException(
          fetch.serviceId(),
          StringUtils.format(
              "Request to service %s timed out after %d ms",
              fetch.serviceId(),
              settings.getOperationTimeout().toMillis()));
    }
    if (cause instanceof FederationException federationException) {
      return federationException;
    }
    return new TransportException(
        fetch.serviceId(),
        StringUtils.format(
            "Request to service %s failed: %s", fetch.serviceId(), cause.getMessage()),
        cause);
  }

  private Throwable translate(Throwable error, ExecutionContext context) {
    Throwable cause = unwrap(error);
    if (cause instanceof TimeoutException) {
      return new RequestCancelledException(
          StringUtils.format(
              "Request %s timed out after %d ms",
              context.getRequestId(),
              settings.getRequestTimeout().toMillis()));
    }
    if (cause instanceof CancellationException) {
      return new RequestCancelledException(
          StringUtils.format("Request %s was cancelled", context.getRequestId()), cause);
    }
    if (cause instanceof RuntimeException) {
      return cause;
    }
    return new IllegalStateException("Plan execution failed", cause);
  }

  private static UpstreamProtocolException noDataException(FetchStep fetch) {
    return new UpstreamProtocolException(
        fetch.serviceId(),
        StringUtils.format("Service %s returned neither data nor errors", fetch.serviceId()));
  }

  /** Appends the field name when the fetch selects a single field, the one that failed. */
  private static List<Object> errorPath(List<?> base, FetchStep fetch) {
    List<Object> path = new ArrayList<>(base);
    if (fetch.selections().size() == 1) {
      path.add(fetch.selections().get(0).responseKey());
    }
    return path;
  }

  private static EntityCacheKey cacheKey(FetchStep fetch, List<Object> key) {
    return new EntityCacheKey(
        fetch.serviceId(), fetch.entity().typeName(), key, fetch.selections());
  }

  private static Throwable unwrap(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  private static CompletableFuture<Boolean> all(List<CompletableFuture<Boolean>> futures) {
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .thenApply(ignored -> futures.stream().allMatch(CompletableFuture::join));
  }
}
