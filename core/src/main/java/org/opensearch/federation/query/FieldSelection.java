/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * One field of a normalized selection tree. Children are kept in declaration order; a selection
 * without children is a scalar leaf.
 *
 * <p>Selections are immutable and compare structurally, so a selection tree can serve as the
 * signature of a query shape.
 */
public record FieldSelection(
    String name, String alias, List<Argument> arguments, List<FieldSelection> children) {

  public FieldSelection {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Field name is required");
    arguments = arguments == null ? ImmutableList.of() : ImmutableList.copyOf(arguments);
    children = children == null ? ImmutableList.of() : ImmutableList.copyOf(children);
  }

  /** Scalar leaf without alias or arguments. */
  public static FieldSelection leaf(String name) {
    return new FieldSelection(name, null, List.of(), List.of());
  }

  /** Object field without alias or arguments. */
  public static FieldSelection field(String name, FieldSelection... children) {
    return new FieldSelection(name, null, List.of(), Arrays.asList(children));
  }

  /** Returns the key this field occupies in the response: the alias if set, else the name. */
  public String responseKey() {
    return alias != null ? alias : name;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public boolean hasArguments() {
    return !arguments.isEmpty();
  }

  public FieldSelection withAlias(String newAlias) {
    return new FieldSelection(name, newAlias, arguments, children);
  }

  public FieldSelection withArguments(Argument... newArguments) {
    return new FieldSelection(name, alias, Arrays.asList(newArguments), children);
  }

  public FieldSelection withChildren(List<FieldSelection> newChildren) {
    return new FieldSelection(name, alias, arguments, newChildren);
  }
}
