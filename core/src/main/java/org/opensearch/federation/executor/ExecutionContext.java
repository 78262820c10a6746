/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.common.utils.StringUtils;
import org.opensearch.federation.planner.SequenceStep;

/**
 * Scratch state of one federated request: the merged response tree, the collected errors, the
 * entities already resolved, the subgraph calls in flight and the state of every sequence.
 *
 * <p>Fetch callbacks run on transport threads; every read or write of the response tree goes
 * through {@link #locked(Supplier)}. A context serves exactly one request and must not be reused.
 */
@Log4j2
public class ExecutionContext {

  @Getter private final String requestId;

  private final ReentrantLock lock = new ReentrantLock();

  private final Map<String, Object> data = new LinkedHashMap<>();

  private final List<GraphQLError> errors = Collections.synchronizedList(new ArrayList<>());

  private final Map<EntityCacheKey, Map<String, Object>> entityCache = new ConcurrentHashMap<>();

  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

  private final Map<SequenceStep, SequenceState> sequenceStates =
      Collections.synchronizedMap(new IdentityHashMap<>());

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public ExecutionContext() {
    this(UUID.randomUUID().toString());
  }

  public ExecutionContext(String requestId) {
    this.requestId = requestId;
  }

  /** Runs {@code action} while holding the lock of the response tree. */
  public <T> T locked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Merged response tree. Callers must hold the lock, see {@link #locked(Supplier)}. */
  Map<String, Object> data() {
    return data;
  }

  public void addError(GraphQLError error) {
    errors.add(error);
  }

  public List<GraphQLError> getErrors() {
    synchronized (errors) {
      return List.copyOf(errors);
    }
  }

  /** Returns the entity resolved earlier in this request for the given key, or null. */
  Map<String, Object> cachedEntity(EntityCacheKey key) {
    return entityCache.get(key);
  }

  void cacheEntity(EntityCacheKey key, Map<String, Object> entity) {
    entityCache.putIfAbsent(key, entity);
  }

  /**
   * Registers a subgraph call so {@link #cancel()} can reach it. A call registered after
   * cancellation is cancelled immediately.
   */
  public <T> CompletableFuture<T> track(CompletableFuture<T> call) {
    inFlight.add(call);
    call.whenComplete((result, error) -> inFlight.remove(call));
    if (cancelled.get()) {
      call.cancel(true);
    }
    return call;
  }

  /** Cancels every call in flight. Results arriving afterwards are discarded. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Cancelling request {} with {} call(s) in flight", requestId, inFlight.size());
      for (CompletableFuture<?> call : List.copyOf(inFlight)) {
        call.cancel(true);
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public int inFlightCalls() {
    return inFlight.size();
  }

  /** Moves a sequence to {@code next}, rejecting transitions its lifecycle does not allow. */
  void transition(SequenceStep sequence, SequenceState next) {
    sequenceStates.compute(
        sequence,
        (step, current) -> {
          SequenceState from = current == null ? SequenceState.PENDING : current;
          if (!from.canTransitionTo(next)) {
            throw new IllegalStateException(
                StringUtils.format("Illegal sequence transition from %s to %s", from, next));
          }
          return next;
        });
  }

  /** Returns the state of a sequence, {@link SequenceState#PENDING} if it has not started. */
  public SequenceState sequenceState(SequenceStep sequence) {
    return sequenceStates.getOrDefault(sequence, SequenceState.PENDING);
  }

  /**
   * Identity of a resolved entity: the service that resolved it, its type, its normalized key and
   * the selections it was resolved with.
   */
  record EntityCacheKey(String serviceId, String typeName, List<Object> key, Object selections) {}
}
