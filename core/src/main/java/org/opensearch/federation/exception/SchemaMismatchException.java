/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import static org.opensearch.federation.common.utils.StringUtils.format;

import lombok.Getter;

/**
 * The incoming selection references a field or type the registry cannot resolve. Raised while
 * planning, before anything is sent to a service.
 */
@Getter
public class SchemaMismatchException extends FederationException {

  private final String parentTypeName;
  private final String fieldName;

  public SchemaMismatchException(String parentTypeName, String fieldName, Throwable cause) {
    super(
        ErrorCode.SCHEMA_MISMATCH,
        format("Cannot resolve field \"%s\" on type %s", fieldName, parentTypeName),
        cause);
    this.parentTypeName = parentTypeName;
    this.fieldName = fieldName;
  }
}
