/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** Machine-readable error codes, rendered as {@code extensions.code} in GraphQL responses. */
public enum ErrorCode {
  CONFIGURATION_ERROR,
  SCHEMA_MISMATCH,
  UNKNOWN_FIELD,
  UNKNOWN_SERVICE,
  MISSING_ENTITY_KEY,
  TRANSPORT_ERROR,
  UPSTREAM_PROTOCOL_ERROR,
  ENTITY_RESOLUTION_MISMATCH,
  REQUEST_CANCELLED
}
