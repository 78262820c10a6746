/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** The supergraph configuration is malformed or internally inconsistent. */
public class ConfigurationException extends FederationException {

  public ConfigurationException(String message) {
    super(ErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
