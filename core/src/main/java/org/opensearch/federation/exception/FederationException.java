/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/** Base class of all federation planning and execution exceptions. */
@Getter
public class FederationException extends RuntimeException {

  private final ErrorCode errorCode;

  public FederationException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public FederationException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
