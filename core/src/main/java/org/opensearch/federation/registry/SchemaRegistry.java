/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.registry;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.opensearch.federation.exception.MissingEntityKeyException;
import org.opensearch.federation.exception.UnknownFieldException;
import org.opensearch.federation.exception.UnknownServiceException;

/**
 * Read-only view of the composed supergraph: which service owns which field, where services
 * live, and which fields identify an entity across services. Implementations are immutable after
 * construction and safe for unsynchronized concurrent reads.
 */
public interface SchemaRegistry {

  /**
   * Resolves the primary owner of a field.
   *
   * @param typeName parent type name
   * @param fieldName field name
   * @return owning service id
   * @throws UnknownFieldException if no mapping exists
   */
  String resolveOwner(String typeName, String fieldName);

  /**
   * Resolves the owner of a field, preferring {@code preferredServiceId} when that service is able
   * to resolve the field as well. Keeps shared fields inside the current fetch instead of crossing
   * into another service.
   *
   * @param typeName parent type name
   * @param fieldName field name
   * @param preferredServiceId service of the current traversal context, may be null
   * @return owning service id
   * @throws UnknownFieldException if no mapping exists
   */
  String resolveOwner(String typeName, String fieldName, String preferredServiceId);

  /**
   * Resolves the named return type of a field.
   *
   * @throws UnknownFieldException if no mapping exists
   */
  String resolveFieldType(String typeName, String fieldName);

  /**
   * Resolves a service descriptor.
   *
   * @throws UnknownServiceException if the id is not registered
   */
  ServiceDescriptor resolveService(String serviceId);

  /**
   * Returns the ordered key field names of an entity type.
   *
   * @throws MissingEntityKeyException if the type declares no key
   */
  List<String> entityKey(String typeName);

  /** Returns the ids of all registered services. */
  Set<String> getServiceIds();

  /** Returns the names of all composed object types, in registration order. */
  List<String> getTypeNames();

  /**
   * Returns the fields of a composed type, in registration order.
   *
   * @return field definitions by field name, empty for an unknown type
   */
  Map<String, FieldDefinition> getFields(String typeName);
}
