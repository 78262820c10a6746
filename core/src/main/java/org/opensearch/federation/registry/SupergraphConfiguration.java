/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.ConfigurationException;

/**
 * Composed supergraph as produced by the schema composition layer: services, per-type field
 * ownership and entity keys.
 *
 * <pre>
 * {
 *   "services": [{"id": "LOC", "url": "http://locations:4001/graphql"}],
 *   "types": {
 *     "Query":    {"fields": {"locations": {"type": "[Location!]!", "owners": ["LOC"]}}},
 *     "Location": {"keys": ["id"], "owners": ["LOC"],
 *                  "fields": {"id": {"type": "ID!", "owners": ["LOC", "REV"]},
 *                             "name": {"type": "String"},
 *                             "reviews": {"type": "[Review]", "owners": ["REV"]}}}
 *   },
 *   "execution": {"operationTimeoutMillis": 5000, "requestTimeoutMillis": 30000}
 * }
 * </pre>
 *
 * <p>A field without {@code owners} inherits the owners of its type.
 */
@Log4j2
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SupergraphConfiguration {

  @JsonProperty(required = true)
  private List<ServiceConfig> services = new ArrayList<>();

  @JsonProperty(required = true)
  private Map<String, TypeConfig> types = new LinkedHashMap<>();

  private ExecutionConfig execution;

  /**
   * Converts an input stream of JSON into a supergraph configuration.
   *
   * @param inputStream inputstream.
   * @return supergraph configuration.
   */
  public static SupergraphConfiguration fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, SupergraphConfiguration.class);
    } catch (IOException e) {
      log.error("Supergraph configuration is malformed. Verify and reload.");
      throw new ConfigurationException(
          "Malformed supergraph configuration json: " + e.getMessage(), e);
    }
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ServiceConfig {

    @JsonProperty(required = true)
    private String id;

    @JsonProperty(required = true)
    private String url;
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TypeConfig {

    private List<String> keys = new ArrayList<>();

    private List<String> owners = new ArrayList<>();

    private Map<String, FieldConfig> fields = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FieldConfig {

    @JsonProperty(required = true)
    private String type;

    private List<String> owners = new ArrayList<>();
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExecutionConfig {

    private Long operationTimeoutMillis;

    private Long requestTimeoutMillis;
  }
}
