/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.opensearch.federation.TestSchemas.LOC;
import static org.opensearch.federation.TestSchemas.REV;
import static org.opensearch.federation.executor.FakeSubgraphTransport.data;
import static org.opensearch.federation.executor.FakeSubgraphTransport.json;
import static org.opensearch.federation.query.FieldSelection.field;
import static org.opensearch.federation.query.FieldSelection.leaf;

import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.federation.TestSchemas;
import org.opensearch.federation.common.response.ResponseListener;
import org.opensearch.federation.exception.RequestCancelledException;
import org.opensearch.federation.exception.SchemaMismatchException;
import org.opensearch.federation.query.ParsedQuery;
import org.opensearch.federation.transport.SubgraphResponse;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FederationEngineTest {

  @Mock private ResponseListener<ExecutionResult> listener;

  @Mock private ResponseListener<String> explainListener;

  private FakeSubgraphTransport transport;

  private FederationEngine engine;

  @BeforeEach
  void setUp() {
    transport = new FakeSubgraphTransport();
    engine = new FederationEngine(TestSchemas.registry(), transport, ExecutorSettings.defaults());
  }

  @Test
  void execute_plans_and_reports_merged_response() {
    // Given
    transport
        .respond(LOC, call -> data("{'locations': [{'id': '1', 'name': 'A'}]}"))
        .respond(
            REV,
            call ->
                data("{'_entities': [{'_entity_key_id': '1', 'reviews': [{'rating': 5}]}]}"));
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name"), field("reviews", leaf("rating"))));

    // When
    engine.execute(query, listener);

    // Then
    ArgumentCaptor<ExecutionResult> captor = ArgumentCaptor.forClass(ExecutionResult.class);
    verify(listener, times(1)).onResponse(captor.capture());
    verify(listener, never()).onFailure(any());
    assertEquals(
        json("{'locations': [{'name': 'A', 'reviews': [{'rating': 5}]}]}"),
        captor.getValue().data());
    assertFalse(captor.getValue().hasErrors());
  }

  @Test
  void planning_failure_reaches_listener_before_any_service_is_called() {
    // Given
    ParsedQuery query = ParsedQuery.query(field("locations", leaf("unknownField")));

    // When
    engine.execute(query, listener);

    // Then
    verify(listener, times(1)).onFailure(any(SchemaMismatchException.class));
    verify(listener, never()).onResponse(any());
    assertTrue(transport.calls(LOC).isEmpty());
  }

  @Test
  void partial_failure_is_reported_as_response_with_errors() {
    // Given
    transport
        .respond(LOC, call -> data("{'locations': [{'id': '1', 'name': 'A'}]}"))
        .fail(REV, new IllegalStateException("down"));
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name"), field("reviews", leaf("rating"))));

    // When
    engine.execute(query, listener);

    // Then
    ArgumentCaptor<ExecutionResult> captor = ArgumentCaptor.forClass(ExecutionResult.class);
    verify(listener, times(1)).onResponse(captor.capture());
    assertEquals(
        json("{'locations': [{'name': 'A', 'reviews': null}]}"), captor.getValue().data());
    assertEquals(1, captor.getValue().errors().size());
  }

  @Test
  void cancelling_the_returned_context_fails_the_request() {
    // Given
    CompletableFuture<SubgraphResponse> pending = new CompletableFuture<>();
    transport.respondAsync(LOC, call -> pending);

    // When
    ExecutionContext context =
        engine.execute(ParsedQuery.query(field("locations", leaf("name"))), listener);
    context.cancel();

    // Then
    assertTrue(pending.isCancelled());
    verify(listener, times(1)).onFailure(any(RequestCancelledException.class));
    verify(listener, never()).onResponse(any());
  }

  @Test
  void explain_reports_formatted_plan_without_calling_services() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name"), field("reviews", leaf("rating"))));

    // When
    engine.explain(query, explainListener);

    // Then
    verify(explainListener, times(1))
        .onResponse(
            "QueryPlan(query) {\n"
                + "  Sequence {\n"
                + "    Fetch(service: LOC) { locations { name id } }\n"
                + "    Fetch(service: REV, entity: Location, keys: [id], at: locations)"
                + " { reviews { rating } }\n"
                + "  }\n"
                + "}");
    assertTrue(transport.calls(LOC).isEmpty());
    assertTrue(transport.calls(REV).isEmpty());
  }

  @Test
  void explain_reports_planning_failure() {
    engine.explain(ParsedQuery.query(field("nope", leaf("x"))), explainListener);

    verify(explainListener, times(1)).onFailure(any(SchemaMismatchException.class));
  }
}
