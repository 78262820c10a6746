/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.registry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ownership of one field of a composed type.
 *
 * @param typeReference declared return type, wrappers included, e.g. {@code [Review!]!}
 * @param owners services able to resolve the field, primary owner first
 */
public record FieldDefinition(String typeReference, List<String> owners) {

  public FieldDefinition {
    Preconditions.checkArgument(
        typeReference != null && !typeReference.isBlank(), "A field needs a type");
    Preconditions.checkArgument(owners != null && !owners.isEmpty(), "A field needs an owner");
    typeReference = typeReference.trim();
    owners = ImmutableList.copyOf(owners);
  }

  /** Name of the named return type, list and non-null wrappers removed. */
  public String typeName() {
    return unwrapTypeName(typeReference);
  }

  public String primaryOwner() {
    return owners.get(0);
  }

  public boolean isOwnedBy(String serviceId) {
    return owners.contains(serviceId);
  }

  /**
   * Strips list and non-null wrappers from a type reference, e.g. {@code [Review!]!} becomes
   * {@code Review}.
   */
  public static String unwrapTypeName(String typeReference) {
    String unwrapped = typeReference.trim();
    while (unwrapped.endsWith("!") || unwrapped.endsWith("]")) {
      unwrapped = unwrapped.substring(0, unwrapped.length() - 1);
    }
    while (unwrapped.startsWith("[")) {
      unwrapped = unwrapped.substring(1);
    }
    return unwrapped.trim();
  }
}
