/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.registry;

import static org.opensearch.federation.common.utils.StringUtils.format;
import static org.opensearch.federation.common.utils.StringUtils.isValidGraphQLName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.ConfigurationException;
import org.opensearch.federation.exception.MissingEntityKeyException;
import org.opensearch.federation.exception.UnknownFieldException;
import org.opensearch.federation.exception.UnknownServiceException;

/**
 * Default implementation of {@link SchemaRegistry}. All lookups are answered from precomputed
 * immutable maps, so an unresolvable field is detected before any request leaves the gateway.
 *
 * <p>Instances are built once, either with {@link #builder()} or from a {@link
 * SupergraphConfiguration}, and never change afterwards.
 */
@Log4j2
public class DefaultSchemaRegistry implements SchemaRegistry {

  private final ImmutableMap<String, ServiceDescriptor> services;

  private final ImmutableMap<String, ImmutableMap<String, FieldDefinition>> fields;

  private final ImmutableMap<String, ImmutableList<String>> entityKeys;

  private DefaultSchemaRegistry(
      ImmutableMap<String, ServiceDescriptor> services,
      ImmutableMap<String, ImmutableMap<String, FieldDefinition>> fields,
      ImmutableMap<String, ImmutableList<String>> entityKeys) {
    this.services = services;
    this.fields = fields;
    this.entityKeys = entityKeys;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a registry from a loaded supergraph configuration.
   *
   * @param configuration supergraph configuration
   * @return immutable registry
   * @throws ConfigurationException if the configuration is inconsistent
   */
  public static DefaultSchemaRegistry fromConfiguration(SupergraphConfiguration configuration) {
    Builder builder = builder();
    for (SupergraphConfiguration.ServiceConfig service : configuration.getServices()) {
      builder.service(service.getId(), service.getUrl());
    }
    for (Map.Entry<String, SupergraphConfiguration.TypeConfig> type :
        configuration.getTypes().entrySet()) {
      String typeName = type.getKey();
      SupergraphConfiguration.TypeConfig typeConfig = type.getValue();
      if (typeConfig.getKeys() != null && !typeConfig.getKeys().isEmpty()) {
        builder.entityKey(typeName, typeConfig.getKeys());
      }
      for (Map.Entry<String, SupergraphConfiguration.FieldConfig> field :
          typeConfig.getFields().entrySet()) {
        SupergraphConfiguration.FieldConfig fieldConfig = field.getValue();
        List<String> owners =
            fieldConfig.getOwners() == null || fieldConfig.getOwners().isEmpty()
                ? typeConfig.getOwners()
                : fieldConfig.getOwners();
        if (owners == null || owners.isEmpty()) {
          throw new ConfigurationException(
              format(
                  "Field %s.%s has no owner and its type declares none",
                  typeName,
                  field.getKey()));
        }
        builder.field(typeName, field.getKey(), fieldConfig.getType(), owners);
      }
    }
    return builder.build();
  }

  @Override
  public String resolveOwner(String typeName, String fieldName) {
    return lookup(typeName, fieldName).primaryOwner();
  }

  @Override
  public String resolveOwner(String typeName, String fieldName, String preferredServiceId) {
    FieldDefinition definition = lookup(typeName, fieldName);
    if (preferredServiceId != null && definition.isOwnedBy(preferredServiceId)) {
      return preferredServiceId;
    }
    return definition.primaryOwner();
  }

  @Override
  public String resolveFieldType(String typeName, String fieldName) {
    return lookup(typeName, fieldName).typeName();
  }

  @Override
  public ServiceDescriptor resolveService(String serviceId) {
    ServiceDescriptor descriptor = serviceId == null ? null : services.get(serviceId);
    if (descriptor == null) {
      throw new UnknownServiceException(serviceId);
    }
    return descriptor;
  }

  @Override
  public List<String> entityKey(String typeName) {
    List<String> key = entityKeys.get(typeName);
    if (key == null) {
      throw new MissingEntityKeyException(typeName);
    }
    return key;
  }

  @Override
  public Set<String> getServiceIds() {
    return services.keySet();
  }

  @Override
  public List<String> getTypeNames() {
    return fields.keySet().asList();
  }

  @Override
  public Map<String, FieldDefinition> getFields(String typeName) {
    return fields.getOrDefault(typeName, ImmutableMap.of());
  }

  private FieldDefinition lookup(String typeName, String fieldName) {
    Map<String, FieldDefinition> typeFields = fields.get(typeName);
    FieldDefinition definition = typeFields == null ? null : typeFields.get(fieldName);
    if (definition == null) {
      throw new UnknownFieldException(typeName, fieldName);
    }
    return definition;
  }

  @Override
  public String toString() {
    return "DefaultSchemaRegistry{services="
        + services.keySet()
        + ", types="
        + fields.size()
        + ", entities="
        + entityKeys.keySet()
        + '}';
  }

  /** Collects services, fields and keys, then freezes them into a registry. */
  public static class Builder {

    private final Map<String, ServiceDescriptor> services = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldDefinition>> fields = new LinkedHashMap<>();
    private final Map<String, List<String>> entityKeys = new LinkedHashMap<>();

    private Builder() {}

    public Builder service(String id, String url) {
      if (services.containsKey(id)) {
        throw new ConfigurationException("Duplicate service ids are not allowed: " + id);
      }
      services.put(id, new ServiceDescriptor(id, url));
      return this;
    }

    public Builder field(
        String typeName, String fieldName, String typeReference, List<String> owners) {
      if (!isValidGraphQLName(typeName) || !isValidGraphQLName(fieldName)) {
        throw new ConfigurationException(
            format("Invalid field name %s.%s in supergraph", typeName, fieldName));
      }
      if (typeReference == null || typeReference.isBlank()) {
        throw new ConfigurationException(
            format("Field %s.%s declares no type", typeName, fieldName));
      }
      fields
          .computeIfAbsent(typeName, k -> new LinkedHashMap<>())
          .put(fieldName, new FieldDefinition(typeReference, owners));
      return this;
    }

    public Builder field(String typeName, String fieldName, String typeReference, String owner) {
      return field(typeName, fieldName, typeReference, List.of(owner));
    }

    public Builder entityKey(String typeName, List<String> keyFields) {
      if (keyFields.isEmpty()) {
        throw new ConfigurationException("Entity key of " + typeName + " must not be empty");
      }
      entityKeys.put(typeName, keyFields);
      return this;
    }

    public Builder entityKey(String typeName, String... keyFields) {
      return entityKey(typeName, List.of(keyFields));
    }

    /**
     * Validates cross references and freezes the registry.
     *
     * @throws ConfigurationException if an owner has no service descriptor
     */
    public DefaultSchemaRegistry build() {
      Set<String> unknownOwners = new HashSet<>();
      fields.values().stream()
          .flatMap(typeFields -> typeFields.values().stream())
          .flatMap(definition -> definition.owners().stream())
          .filter(owner -> !services.containsKey(owner))
          .forEach(unknownOwners::add);
      if (!unknownOwners.isEmpty()) {
        log.error("Fields are owned by services without a descriptor: {}", unknownOwners);
        throw new ConfigurationException(
            "Fields are owned by services without a descriptor: "
                + unknownOwners.stream().sorted().collect(Collectors.toList()));
      }

      ImmutableMap.Builder<String, ImmutableMap<String, FieldDefinition>> frozenFields =
          ImmutableMap.builder();
      fields.forEach((type, typeFields) -> frozenFields.put(type, ImmutableMap.copyOf(typeFields)));
      ImmutableMap.Builder<String, ImmutableList<String>> frozenKeys = ImmutableMap.builder();
      entityKeys.forEach((type, key) -> frozenKeys.put(type, ImmutableList.copyOf(key)));

      DefaultSchemaRegistry registry =
          new DefaultSchemaRegistry(
              ImmutableMap.copyOf(services), frozenFields.build(), frozenKeys.build());
      log.info("Built schema registry: {}", registry);
      return registry;
    }
  }
}
