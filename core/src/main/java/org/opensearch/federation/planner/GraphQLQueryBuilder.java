/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.opensearch.federation.query.Argument;
import org.opensearch.federation.query.EnumValue;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.query.OperationType;

/**
 * Serializes fetch steps back into GraphQL documents.
 *
 * <p>Root fetches become a plain operation, e.g. {@code query { locations { id name } } }. Entity
 * fetches use the entity resolution convention: a {@code _entities} root field receiving the
 * {@code $representations} variable, with the key fields selected under reserved aliases so the
 * returned objects can be matched to their parents by key:
 *
 * <pre>
 * query($representations: [_Any!]!) {
 *   _entities(representations: $representations) {
 *     ... on Location { _entity_key_id: id reviews { comment rating } }
 *   }
 * }
 * </pre>
 */
public final class GraphQLQueryBuilder {

  public static final String ENTITIES_FIELD = "_entities";

  public static final String REPRESENTATIONS_VARIABLE = "representations";

  /** Alias prefix under which entity fetches echo key fields. */
  public static final String ENTITY_KEY_ALIAS_PREFIX = "_entity_key_";

  private GraphQLQueryBuilder() {}

  /**
   * Builds the document sent for a fetch.
   *
   * @param fetch fetch step
   * @param operationType operation type of the client request; entity fetches are always queries
   * @return GraphQL document
   */
  public static String build(FetchStep fetch, OperationType operationType) {
    StringBuilder sb = new StringBuilder();
    if (!fetch.isEntityFetch()) {
      sb.append(operationType.getKeyword()).append(' ');
      appendSelectionSet(sb, fetch.selections());
      return sb.toString();
    }

    EntityRequirement entity = fetch.entity();
    sb.append(OperationType.QUERY.getKeyword())
        .append("($")
        .append(REPRESENTATIONS_VARIABLE)
        .append(": [_Any!]!) { ")
        .append(ENTITIES_FIELD)
        .append("(")
        .append(REPRESENTATIONS_VARIABLE)
        .append(": $")
        .append(REPRESENTATIONS_VARIABLE)
        .append(") { ... on ")
        .append(entity.typeName())
        .append(" {");
    for (String keyField : entity.keyFields()) {
      sb.append(' ').append(entityKeyAlias(keyField)).append(": ").append(keyField);
    }
    for (FieldSelection selection : fetch.selections()) {
      sb.append(' ');
      appendSelection(sb, selection);
    }
    sb.append(" } } }");
    return sb.toString();
  }

  /** Response key under which an entity fetch echoes {@code keyField}. */
  public static String entityKeyAlias(String keyField) {
    return ENTITY_KEY_ALIAS_PREFIX + keyField;
  }

  /** Serializes a selection set, e.g. {@code { a b { c } }}. */
  public static String selectionSet(List<FieldSelection> selections) {
    StringBuilder sb = new StringBuilder();
    appendSelectionSet(sb, selections);
    return sb.toString();
  }

  private static void appendSelectionSet(StringBuilder sb, List<FieldSelection> selections) {
    sb.append('{');
    for (FieldSelection selection : selections) {
      sb.append(' ');
      appendSelection(sb, selection);
    }
    sb.append(" }");
  }

  private static void appendSelection(StringBuilder sb, FieldSelection selection) {
    if (selection.alias() != null && !selection.alias().equals(selection.name())) {
      sb.append(selection.alias()).append(": ");
    }
    sb.append(selection.name());
    if (selection.hasArguments()) {
      sb.append('(');
      Iterator<Argument> arguments = selection.arguments().iterator();
      while (arguments.hasNext()) {
        Argument argument = arguments.next();
        sb.append(argument.name()).append(": ");
        appendValue(sb, argument.value());
        if (arguments.hasNext()) {
          sb.append(", ");
        }
      }
      sb.append(')');
    }
    if (!selection.isLeaf()) {
      sb.append(' ');
      appendSelectionSet(sb, selection.children());
    }
  }

  /** Writes a GraphQL input literal. */
  static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String string) {
      sb.append('"');
      JsonStringEncoder.getInstance().quoteAsString(string, sb);
      sb.append('"');
    } else if (value instanceof Number || value instanceof Boolean || value instanceof EnumValue) {
      sb.append(value);
    } else if (value instanceof List<?> list) {
      sb.append('[');
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        appendValue(sb, list.get(i));
      }
      sb.append(']');
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      Iterator<? extends Map.Entry<?, ?>> entries = map.entrySet().iterator();
      while (entries.hasNext()) {
        Map.Entry<?, ?> entry = entries.next();
        sb.append(entry.getKey()).append(": ");
        appendValue(sb, entry.getValue());
        if (entries.hasNext()) {
          sb.append(", ");
        }
      }
      sb.append('}');
    } else {
      throw new IllegalArgumentException(
          "Unsupported argument value type: " + value.getClass().getName());
    }
  }
}
