/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/**
 * An entity fetch returned a different number of entities than representations sent, or an entity
 * whose key does not match any representation.
 */
@Getter
public class EntityResolutionMismatchException extends FederationException {

  private final String serviceId;

  public EntityResolutionMismatchException(String serviceId, String message) {
    super(ErrorCode.ENTITY_RESOLUTION_MISMATCH, message);
    this.serviceId = serviceId;
  }
}
