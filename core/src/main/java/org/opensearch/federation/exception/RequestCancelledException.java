/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/**
 * The request was cancelled by its caller or exceeded its timeout. Outstanding subgraph calls are
 * cancelled and partial results are discarded.
 */
public class RequestCancelledException extends FederationException {

  public RequestCancelledException(String message) {
    super(ErrorCode.REQUEST_CANCELLED, message);
  }

  public RequestCancelledException(String message, Throwable cause) {
    super(ErrorCode.REQUEST_CANCELLED, message, cause);
  }
}
