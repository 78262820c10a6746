/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import static org.opensearch.federation.common.utils.StringUtils.format;

import lombok.Getter;

/** A service id is referenced but has no descriptor. */
@Getter
public class UnknownServiceException extends FederationException {

  private final String serviceId;

  public UnknownServiceException(String serviceId) {
    super(ErrorCode.UNKNOWN_SERVICE, format("Service %s is not registered", serviceId));
    this.serviceId = serviceId;
  }
}
