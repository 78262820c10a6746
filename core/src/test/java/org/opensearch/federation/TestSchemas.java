/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation;

import java.util.List;
import org.opensearch.federation.registry.DefaultSchemaRegistry;

/**
 * Registry shared by planner and executor tests. Three services:
 *
 * <ul>
 *   <li>LOC owns locations; REV can also resolve {@code Location.id}
 *   <li>REV owns reviews, {@code Location.reviews} and {@code Review.author}
 *   <li>ACC owns users and {@code Location.checkins}; REV can also resolve {@code User.id}
 * </ul>
 *
 * <p>{@code Stats} has no entity key, so nothing can cross out of it.
 */
public final class TestSchemas {

  public static final String LOC = "LOC";
  public static final String REV = "REV";
  public static final String ACC = "ACC";

  private TestSchemas() {}

  public static DefaultSchemaRegistry registry() {
    return DefaultSchemaRegistry.builder()
        .service(LOC, "http://locations.internal/graphql")
        .service(REV, "http://reviews.internal/graphql")
        .service(ACC, "http://accounts.internal/graphql")
        .field("Query", "locations", "[Location!]!", LOC)
        .field("Query", "location", "Location", LOC)
        .field("Query", "stats", "Stats", LOC)
        .field("Query", "latestReviews", "[Review!]!", REV)
        .field("Query", "me", "User", ACC)
        .field("Mutation", "addLocation", "Location", LOC)
        .field("Mutation", "addReview", "Review", REV)
        .field("Mutation", "renameLocation", "Location", LOC)
        .entityKey("Location", "id")
        .field("Location", "id", "ID!", List.of(LOC, REV))
        .field("Location", "name", "String", LOC)
        .field("Location", "photo", "String", LOC)
        .field("Location", "reviews", "[Review!]", REV)
        .field("Location", "overallRating", "Float", REV)
        .field("Location", "checkins", "Int", ACC)
        .entityKey("Review", "id")
        .field("Review", "id", "ID!", REV)
        .field("Review", "comment", "String", REV)
        .field("Review", "rating", "Int", REV)
        .field("Review", "author", "User", REV)
        .entityKey("User", "id")
        .field("User", "id", "ID!", List.of(ACC, REV))
        .field("User", "name", "String", ACC)
        .field("User", "username", "String", ACC)
        .field("Stats", "count", "Int", LOC)
        .field("Stats", "trend", "String", REV)
        .build();
  }
}
