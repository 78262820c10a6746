/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import static org.opensearch.federation.common.utils.StringUtils.format;

import lombok.Getter;

/** A boundary crossing targets a type that declares no entity key. */
@Getter
public class MissingEntityKeyException extends FederationException {

  private final String typeName;

  public MissingEntityKeyException(String typeName) {
    super(
        ErrorCode.MISSING_ENTITY_KEY,
        format("Type %s declares no entity key and cannot be resolved across services", typeName));
    this.typeName = typeName;
  }
}
