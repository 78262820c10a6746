/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import static org.opensearch.federation.common.utils.StringUtils.format;

import lombok.Getter;

/** No ownership mapping exists for a (type, field) pair. */
@Getter
public class UnknownFieldException extends FederationException {

  private final String typeName;
  private final String fieldName;

  public UnknownFieldException(String typeName, String fieldName) {
    super(
        ErrorCode.UNKNOWN_FIELD,
        format("Field \"%s\" is not available on type %s", fieldName, typeName));
    this.typeName = typeName;
    this.fieldName = fieldName;
  }
}
