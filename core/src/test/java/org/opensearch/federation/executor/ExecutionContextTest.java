/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.federation.query.FieldSelection.field;
import static org.opensearch.federation.query.FieldSelection.leaf;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.executor.ExecutionContext.EntityCacheKey;
import org.opensearch.federation.planner.EntityRequirement;
import org.opensearch.federation.planner.FetchStep;
import org.opensearch.federation.planner.SequenceStep;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionContextTest {

  private final ExecutionContext context = new ExecutionContext("ctx-1");

  // ===== SEQUENCE LIFECYCLE =====

  @Test
  void sequence_starts_pending_and_walks_through_its_lifecycle() {
    SequenceStep sequence = sequence();
    assertEquals(SequenceState.PENDING, context.sequenceState(sequence));

    context.transition(sequence, SequenceState.FIRST_DISPATCHED);
    context.transition(sequence, SequenceState.KEYS_EXTRACTED);
    context.transition(sequence, SequenceState.SECOND_DISPATCHED);
    context.transition(sequence, SequenceState.MERGED);

    assertEquals(SequenceState.MERGED, context.sequenceState(sequence));
  }

  @Test
  void dependent_operation_cannot_be_dispatched_before_keys_are_extracted() {
    SequenceStep sequence = sequence();
    context.transition(sequence, SequenceState.FIRST_DISPATCHED);

    IllegalStateException exception =
        assertThrows(
            IllegalStateException.class,
            () -> context.transition(sequence, SequenceState.SECOND_DISPATCHED));

    assertEquals(
        "Illegal sequence transition from FIRST_DISPATCHED to SECOND_DISPATCHED",
        exception.getMessage());
    assertEquals(SequenceState.FIRST_DISPATCHED, context.sequenceState(sequence));
  }

  @Test
  void failed_and_merged_states_are_terminal() {
    for (SequenceState next : SequenceState.values()) {
      assertFalse(SequenceState.FAILED.canTransitionTo(next));
      assertFalse(SequenceState.MERGED.canTransitionTo(next));
    }
  }

  @Test
  void equal_sequences_are_tracked_separately() {
    SequenceStep first = sequence();
    SequenceStep second = sequence();

    context.transition(first, SequenceState.FIRST_DISPATCHED);

    assertEquals(first, second);
    assertEquals(SequenceState.PENDING, context.sequenceState(second));
  }

  // ===== CANCELLATION =====

  @Test
  void cancel_cancels_every_call_in_flight() {
    CompletableFuture<String> first = context.track(new CompletableFuture<>());
    CompletableFuture<String> second = context.track(new CompletableFuture<>());
    CompletableFuture<String> done = context.track(CompletableFuture.completedFuture("x"));
    assertEquals(2, context.inFlightCalls());

    context.cancel();

    assertTrue(context.isCancelled());
    assertTrue(first.isCancelled());
    assertTrue(second.isCancelled());
    assertFalse(done.isCancelled());
    assertEquals(0, context.inFlightCalls());
  }

  @Test
  void call_tracked_after_cancel_is_cancelled_immediately() {
    context.cancel();

    CompletableFuture<String> late = context.track(new CompletableFuture<>());

    assertTrue(late.isCancelled());
    assertEquals(0, context.inFlightCalls());
  }

  // ===== STATE =====

  @Test
  void errors_are_returned_as_a_snapshot() {
    context.addError(new GraphQLError("boom", List.of("a"), Map.of()));

    List<GraphQLError> errors = context.getErrors();
    context.addError(new GraphQLError("later", List.of(), Map.of()));

    assertEquals(1, errors.size());
    assertEquals(2, context.getErrors().size());
  }

  @Test
  void entity_cache_keeps_the_first_entity_per_key() {
    EntityCacheKey key = new EntityCacheKey("REV", "Location", List.of(1L), List.of(leaf("a")));
    assertNull(context.cachedEntity(key));

    context.cacheEntity(key, Map.of("a", 1));
    context.cacheEntity(key, Map.of("a", 2));

    assertEquals(Map.of("a", 1), context.cachedEntity(key));
    assertNull(
        context.cachedEntity(
            new EntityCacheKey("REV", "Location", List.of(1L), List.of(leaf("b")))));
  }

  @Test
  void generated_request_ids_are_unique() {
    ExecutionContext other = new ExecutionContext();

    assertNotNull(other.getRequestId());
    assertFalse(other.getRequestId().equals(new ExecutionContext().getRequestId()));
    assertEquals("ctx-1", context.getRequestId());
  }

  private static SequenceStep sequence() {
    FetchStep first = FetchStep.root("LOC", List.of(field("locations", leaf("id"))));
    FetchStep second =
        new FetchStep(
            "REV",
            List.of("locations"),
            List.of(field("reviews", leaf("rating"))),
            new EntityRequirement("Location", List.of("id"), Map.of()));
    return new SequenceStep(List.of(first, second));
  }
}
