/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.opensearch.federation.TestSchemas.ACC;
import static org.opensearch.federation.TestSchemas.LOC;
import static org.opensearch.federation.TestSchemas.REV;
import static org.opensearch.federation.query.FieldSelection.field;
import static org.opensearch.federation.query.FieldSelection.leaf;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.federation.TestSchemas;
import org.opensearch.federation.exception.ErrorCode;
import org.opensearch.federation.exception.MissingEntityKeyException;
import org.opensearch.federation.exception.SchemaMismatchException;
import org.opensearch.federation.exception.UnknownServiceException;
import org.opensearch.federation.query.Argument;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.query.OperationType;
import org.opensearch.federation.query.ParsedQuery;
import org.opensearch.federation.registry.SchemaRegistry;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlannerTest {

  private static final EntityRequirement LOCATION_BY_ID =
      new EntityRequirement("Location", List.of("id"), Map.of("id", "id"));

  @Mock private SchemaRegistry mockRegistry;

  private final QueryPlanner planner = new QueryPlanner(TestSchemas.registry());

  @Test
  void single_service_query_plans_one_fetch() {
    // Given
    ParsedQuery query = ParsedQuery.query(field("locations", leaf("id"), leaf("name")));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    assertEquals(
        List.of(FetchStep.root(LOC, List.of(field("locations", leaf("id"), leaf("name"))))),
        plan.steps());
    assertEquals(OperationType.QUERY, plan.operationType());
    assertEquals(query.selections(), plan.selections());
  }

  @Test
  void crossing_plans_a_sequence_of_key_fetch_and_entity_fetch() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("id"),
                leaf("name"),
                field("reviews", leaf("comment"), leaf("rating"))));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    FetchStep locations =
        FetchStep.root(LOC, List.of(field("locations", leaf("id"), leaf("name"))));
    FetchStep reviews =
        new FetchStep(
            REV,
            List.of("locations"),
            List.of(field("reviews", leaf("comment"), leaf("rating"))),
            LOCATION_BY_ID);
    assertEquals(List.of(new SequenceStep(List.of(locations, reviews))), plan.steps());
  }

  @Test
  void key_field_is_added_to_the_first_operation_when_not_requested() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name"), field("reviews", leaf("comment"))));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    assertEquals(
        List.of(field("locations", leaf("name"), leaf("id"))), sequence.first().selections());
    assertEquals(LOCATION_BY_ID, ((FetchStep) sequence.operations().get(1)).entity());
  }

  @Test
  void requested_key_field_is_served_from_the_first_operation() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field("locations", leaf("id"), leaf("name"), field("reviews", leaf("comment"))));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    FetchStep first = sequence.first();
    FetchStep second = (FetchStep) sequence.operations().get(1);
    assertEquals(List.of(field("locations", leaf("id"), leaf("name"))), first.selections());
    assertEquals(List.of(field("reviews", leaf("comment"))), second.selections());
    assertEquals("id", second.entity().parentResponseKey("id"));
  }

  @Test
  void aliased_key_field_is_reused_through_its_alias() {
    // Given
    FieldSelection locId = leaf("id").withAlias("locId");
    ParsedQuery query =
        ParsedQuery.query(field("locations", locId, field("reviews", leaf("comment"))));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    assertEquals(List.of(field("locations", locId)), sequence.first().selections());
    assertEquals(
        "locId", ((FetchStep) sequence.operations().get(1)).entity().parentResponseKey("id"));
  }

  @Test
  void key_field_is_aliased_when_its_response_key_is_taken() {
    // Given
    FieldSelection nameAsId = leaf("name").withAlias("id");
    ParsedQuery query =
        ParsedQuery.query(field("locations", nameAsId, field("reviews", leaf("comment"))));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    assertEquals(
        List.of(field("locations", nameAsId, leaf("id").withAlias("_key_id"))),
        sequence.first().selections());
    assertEquals(
        "_key_id", ((FetchStep) sequence.operations().get(1)).entity().parentResponseKey("id"));
  }

  @Test
  void deep_crossings_flatten_into_one_sequence() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("name"),
                field("reviews", leaf("rating"), field("author", leaf("username")))));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    FetchStep locations =
        FetchStep.root(LOC, List.of(field("locations", leaf("name"), leaf("id"))));
    FetchStep reviews =
        new FetchStep(
            REV,
            List.of("locations"),
            List.of(field("reviews", leaf("rating"), field("author", leaf("id")))),
            LOCATION_BY_ID);
    FetchStep authors =
        new FetchStep(
            ACC,
            List.of("locations", "reviews", "author"),
            List.of(leaf("username")),
            new EntityRequirement("User", List.of("id"), Map.of("id", "id")));
    assertEquals(List.of(new SequenceStep(List.of(locations, reviews, authors))), plan.steps());
  }

  @Test
  void sibling_crossings_into_different_services_run_in_parallel() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations", leaf("name"), field("reviews", leaf("comment")), leaf("checkins")));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    FetchStep locations =
        FetchStep.root(LOC, List.of(field("locations", leaf("name"), leaf("id"))));
    FetchStep reviews =
        new FetchStep(
            REV, List.of("locations"), List.of(field("reviews", leaf("comment"))), LOCATION_BY_ID);
    FetchStep checkins =
        new FetchStep(ACC, List.of("locations"), List.of(leaf("checkins")), LOCATION_BY_ID);
    assertEquals(
        List.of(
            new SequenceStep(List.of(locations, new ParallelStep(List.of(reviews, checkins))))),
        plan.steps());
  }

  @Test
  void crossed_siblings_of_one_service_share_a_fetch() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("name"),
                field("reviews", leaf("comment")),
                leaf("photo"),
                leaf("overallRating")));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    assertEquals(2, sequence.operations().size());
    assertEquals(
        List.of(field("locations", leaf("name"), leaf("photo"), leaf("id"))),
        sequence.first().selections());
    assertEquals(
        List.of(field("reviews", leaf("comment")), leaf("overallRating")),
        ((FetchStep) sequence.operations().get(1)).selections());
  }

  @Test
  void root_fields_are_grouped_per_service_in_first_occurrence_order() {
    // Given
    FieldSelection location =
        field("location", leaf("photo")).withArguments(Argument.of("id", "1"));
    ParsedQuery query =
        ParsedQuery.query(
            field("locations", leaf("name")), field("latestReviews", leaf("comment")), location);

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    assertEquals(
        List.of(
            FetchStep.root(LOC, List.of(field("locations", leaf("name")), location)),
            FetchStep.root(REV, List.of(field("latestReviews", leaf("comment"))))),
        plan.steps());
  }

  @Test
  void mutation_fields_keep_their_order_across_services() {
    // Given
    FieldSelection addLocation =
        field("addLocation", leaf("id")).withArguments(Argument.of("name", "Harbour"));
    FieldSelection addReview =
        field("addReview", leaf("id")).withArguments(Argument.of("comment", "Windy"));
    FieldSelection renameLocation =
        field("renameLocation", leaf("name")).withArguments(Argument.of("id", "1"));
    ParsedQuery mutation = ParsedQuery.mutation(addLocation, addReview, renameLocation);

    // When
    QueryPlan plan = planner.plan(mutation);

    // Then
    assertEquals(OperationType.MUTATION, plan.operationType());
    assertEquals(
        List.of(
            FetchStep.root(LOC, List.of(addLocation)),
            FetchStep.root(REV, List.of(addReview)),
            FetchStep.root(LOC, List.of(renameLocation))),
        plan.steps());
  }

  @Test
  void typename_is_folded_into_the_current_fetch() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("__typename"),
                leaf("name"),
                field("reviews", leaf("__typename"), leaf("comment"))));

    // When
    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    // Then
    assertEquals(
        List.of(field("locations", leaf("__typename"), leaf("name"), leaf("id"))),
        sequence.first().selections());
    assertEquals(
        List.of(field("reviews", leaf("__typename"), leaf("comment"))),
        ((FetchStep) sequence.operations().get(1)).selections());
  }

  @Test
  void root_typename_joins_the_fetch_of_the_first_root_field() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(leaf("__typename"), field("latestReviews", leaf("comment")));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    assertEquals(
        List.of(
            FetchStep.root(
                REV, List.of(leaf("__typename"), field("latestReviews", leaf("comment"))))),
        plan.steps());
  }

  @Test
  void planning_is_deterministic() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("name"),
                field("reviews", leaf("rating"), field("author", leaf("name"))),
                leaf("checkins")),
            field("me", leaf("username")),
            field("latestReviews", leaf("comment")));

    // When
    QueryPlan first = planner.plan(query);
    QueryPlan second = planner.plan(query);

    // Then
    assertEquals(first, second);
    assertEquals(first.toString(), second.toString());
  }

  @Test
  void every_requested_leaf_is_fetched_exactly_once() {
    // Given
    ParsedQuery query =
        ParsedQuery.query(
            field(
                "locations",
                leaf("name"),
                leaf("photo"),
                field("reviews", leaf("rating"), leaf("comment")),
                leaf("checkins")));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    List<String> leaves =
        plan.fetches().stream()
            .flatMap(fetch -> fetch.selections().stream())
            .flatMap(QueryPlannerTest::leafNames)
            .collect(Collectors.toList());
    assertEquals(List.of("name", "photo", "id", "rating", "comment", "checkins"), leaves);
  }

  @Test
  void unknown_field_fails_with_schema_mismatch() {
    // Given
    ParsedQuery query = ParsedQuery.query(field("locations", leaf("name"), leaf("size")));

    // When
    SchemaMismatchException exception =
        assertThrows(SchemaMismatchException.class, () -> planner.plan(query));

    // Then
    assertEquals(ErrorCode.SCHEMA_MISMATCH, exception.getErrorCode());
    assertEquals("Cannot resolve field \"size\" on type Location", exception.getMessage());
  }

  @Test
  void unknown_root_field_fails_with_schema_mismatch() {
    SchemaMismatchException exception =
        assertThrows(
            SchemaMismatchException.class,
            () -> planner.plan(ParsedQuery.query(field("planets", leaf("name")))));

    assertEquals("Cannot resolve field \"planets\" on type Query", exception.getMessage());
  }

  @Test
  void owner_without_service_descriptor_fails_before_dispatch() {
    // Given
    when(mockRegistry.resolveOwner("Query", "inventory", null)).thenReturn("INV");
    when(mockRegistry.resolveFieldType("Query", "inventory")).thenReturn("Stock");
    when(mockRegistry.resolveOwner("Stock", "count", "INV")).thenReturn("INV");
    when(mockRegistry.resolveService("INV")).thenThrow(new UnknownServiceException("INV"));
    QueryPlanner mockPlanner = new QueryPlanner(mockRegistry);

    // When
    UnknownServiceException exception =
        assertThrows(
            UnknownServiceException.class,
            () -> mockPlanner.plan(ParsedQuery.query(field("inventory", leaf("count")))));

    // Then
    assertEquals(ErrorCode.UNKNOWN_SERVICE, exception.getErrorCode());
    verify(mockRegistry, never()).entityKey("Stock");
  }

  @Test
  void crossing_out_of_a_type_without_key_fails() {
    ParsedQuery query = ParsedQuery.query(field("stats", leaf("count"), leaf("trend")));

    MissingEntityKeyException exception =
        assertThrows(MissingEntityKeyException.class, () -> planner.plan(query));

    assertTrue(exception.getMessage().contains("Stats"));
  }

  @Test
  void empty_selection_plans_nothing() {
    QueryPlan plan = planner.plan(ParsedQuery.query());

    assertTrue(plan.isEmpty());
    assertTrue(plan.fetches().isEmpty());
  }

  @Test
  void fetch_steps_expose_entity_details() {
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name"), field("reviews", leaf("comment"))));

    SequenceStep sequence = (SequenceStep) planner.plan(query).steps().get(0);

    assertFalse(sequence.first().isEntityFetch());
    assertInstanceOf(FetchStep.class, sequence.operations().get(1));
    assertTrue(((FetchStep) sequence.operations().get(1)).isEntityFetch());
  }

  @Test
  void root_introspection_fields_are_answered_without_any_fetch() {
    // Given
    FieldSelection schema = field("__schema", field("types", leaf("name")));
    FieldSelection type =
        field("__type", leaf("kind")).withArguments(Argument.of("name", "Location"));

    // When
    QueryPlan plan = planner.plan(ParsedQuery.query(schema, type));

    // Then
    assertEquals(List.of(new IntrospectionStep(List.of(schema, type))), plan.steps());
    assertTrue(plan.fetches().isEmpty());
    assertFalse(plan.isEmpty());
  }

  @Test
  void introspection_next_to_service_fields_gets_its_own_step() {
    // Given
    FieldSelection schema = field("__schema", field("queryType", leaf("name")));
    ParsedQuery query =
        ParsedQuery.query(field("locations", leaf("name")), schema, leaf("__typename"));

    // When
    QueryPlan plan = planner.plan(query);

    // Then
    assertEquals(
        List.of(
            new IntrospectionStep(List.of(schema)),
            FetchStep.root(LOC, List.of(field("locations", leaf("name")), leaf("__typename")))),
        plan.steps());
  }

  @Test
  void invalid_introspection_selection_fails_before_dispatch() {
    ParsedQuery query = ParsedQuery.query(field("__schema", field("types", leaf("color"))));

    SchemaMismatchException exception =
        assertThrows(SchemaMismatchException.class, () -> planner.plan(query));

    assertEquals("Cannot resolve field \"color\" on type __Type", exception.getMessage());
  }

  @Test
  void introspection_is_not_a_mutation_field() {
    ParsedQuery mutation =
        ParsedQuery.mutation(field("__schema", field("queryType", leaf("name"))));

    SchemaMismatchException exception =
        assertThrows(SchemaMismatchException.class, () -> planner.plan(mutation));

    assertEquals("Cannot resolve field \"__schema\" on type Mutation", exception.getMessage());
  }

  private static Stream<String> leafNames(FieldSelection selection) {
    if (selection.isLeaf()) {
      return Stream.of(selection.name());
    }
    return selection.children().stream().flatMap(QueryPlannerTest::leafNames);
  }
}
