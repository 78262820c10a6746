/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/** Network, timeout or HTTP level failure of a single subgraph call. */
@Getter
public class TransportException extends FederationException {

  private final String serviceId;

  public TransportException(String serviceId, String message) {
    super(ErrorCode.TRANSPORT_ERROR, message);
    this.serviceId = serviceId;
  }

  public TransportException(String serviceId, String message, Throwable cause) {
    super(ErrorCode.TRANSPORT_ERROR, message, cause);
    this.serviceId = serviceId;
  }
}
