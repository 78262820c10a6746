/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/** A subgraph answered, but its response is unusable or carries only errors. */
@Getter
public class UpstreamProtocolException extends FederationException {

  private final String serviceId;

  public UpstreamProtocolException(String serviceId, String message) {
    super(ErrorCode.UPSTREAM_PROTOCOL_ERROR, message);
    this.serviceId = serviceId;
  }
}
