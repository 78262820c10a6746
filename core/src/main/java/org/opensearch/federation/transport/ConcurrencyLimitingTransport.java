/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.transport;

import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.registry.ServiceDescriptor;

/**
 * Decorates a transport with a bound on in-flight calls per service. Calls beyond the bound wait
 * in a per-service queue and are dispatched as earlier calls complete; a call cancelled while
 * waiting is never dispatched.
 */
@Log4j2
public class ConcurrencyLimitingTransport implements SubgraphTransport {

  private final SubgraphTransport delegate;

  private final int maxConcurrentCallsPerService;

  private final Map<String, Limiter> limiters = new ConcurrentHashMap<>();

  public ConcurrencyLimitingTransport(
      SubgraphTransport delegate, int maxConcurrentCallsPerService) {
    Preconditions.checkArgument(
        maxConcurrentCallsPerService > 0, "Concurrency limit must be positive");
    this.delegate = delegate;
    this.maxConcurrentCallsPerService = maxConcurrentCallsPerService;
  }

  @Override
  public CompletableFuture<SubgraphResponse> send(
      ServiceDescriptor service, String query, Map<String, Object> variables) {
    Limiter limiter =
        limiters.computeIfAbsent(service.id(), id -> new Limiter(maxConcurrentCallsPerService));
    CompletableFuture<SubgraphResponse> result = new CompletableFuture<>();
    limiter.submit(() -> dispatch(limiter, result, service, query, variables));
    if (!result.isDone() && limiter.queued.get() > 0) {
      log.debug(
          "Service {} at its limit of {} call(s), {} queued",
          service.id(),
          maxConcurrentCallsPerService,
          limiter.queued.get());
    }
    return result;
  }

  /** Returns the number of calls waiting for a permit of {@code serviceId}. */
  public int queuedCalls(String serviceId) {
    Limiter limiter = limiters.get(serviceId);
    return limiter == null ? 0 : limiter.queued.get();
  }

  private void dispatch(
      Limiter limiter,
      CompletableFuture<SubgraphResponse> result,
      ServiceDescriptor service,
      String query,
      Map<String, Object> variables) {
    if (result.isDone()) {
      limiter.release();
      return;
    }
    CompletableFuture<SubgraphResponse> call;
    try {
      call = delegate.send(service, query, variables);
    } catch (RuntimeException e) {
      limiter.release();
      result.completeExceptionally(e);
      return;
    }
    result.whenComplete(
        (response, error) -> {
          if (result.isCompletedExceptionally()) {
            call.cancel(true);
          }
        });
    call.whenComplete(
        (response, error) -> {
          limiter.release();
          if (error != null) {
            result.completeExceptionally(error);
          } else {
            result.complete(response);
          }
        });
  }

  /**
   * Permits and queued dispatches of one service. A permit released while this thread is already
   * draining only returns the permit; the running loop picks up the next queued call, so a long
   * run of cancelled calls is skipped iteratively.
   */
  private static final class Limiter {
    private final Semaphore permits;
    private final Queue<Runnable> waiting = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final ThreadLocal<Boolean> draining = ThreadLocal.withInitial(() -> false);

    private Limiter(int limit) {
      this.permits = new Semaphore(limit);
    }

    private void submit(Runnable task) {
      queued.incrementAndGet();
      waiting.add(task);
      drain();
    }

    private void release() {
      permits.release();
      drain();
    }

    private void drain() {
      if (draining.get()) {
        return;
      }
      draining.set(true);
      try {
        while (!waiting.isEmpty() && permits.tryAcquire()) {
          Runnable task = waiting.poll();
          if (task == null) {
            permits.release();
            return;
          }
          queued.decrementAndGet();
          task.run();
        }
      } finally {
        draining.set(false);
      }
    }
  }
}
