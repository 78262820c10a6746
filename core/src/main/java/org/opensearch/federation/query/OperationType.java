/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.query;

/** Root operation types a federated request can carry. */
public enum OperationType {
  QUERY("query", "Query"),
  MUTATION("mutation", "Mutation");

  private final String keyword;
  private final String rootTypeName;

  OperationType(String keyword, String rootTypeName) {
    this.keyword = keyword;
    this.rootTypeName = rootTypeName;
  }

  /** Returns the keyword that opens an operation of this type in a GraphQL document. */
  public String getKeyword() {
    return keyword;
  }

  /** Returns the name of the virtual root type whose fields start a selection. */
  public String getRootTypeName() {
    return rootTypeName;
  }
}
