/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.introspection;

import static org.opensearch.federation.common.utils.StringUtils.format;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.opensearch.federation.exception.SchemaMismatchException;
import org.opensearch.federation.query.Argument;
import org.opensearch.federation.query.FieldSelection;
import org.opensearch.federation.registry.FieldDefinition;
import org.opensearch.federation.registry.SchemaRegistry;

/**
 * Answers the root introspection fields {@code __schema} and {@code __type(name:)} from the schema
 * registry. No service is involved: the composed schema is the registry.
 *
 * <p>Every composed type is an {@code OBJECT} carrying the fields the registry knows, with their
 * declared list and non-null wrappers. A type that fields refer to without being composed, the
 * built-in scalars among them, is a {@code SCALAR}. Arguments, directives and interfaces are not
 * part of the registry and come back as empty lists.
 */
public class SchemaIntrospection {

  public static final String SCHEMA_FIELD = "__schema";

  public static final String TYPE_FIELD = "__type";

  private static final String TYPENAME_FIELD = "__typename";

  private static final List<String> BUILT_IN_SCALARS =
      List.of("Boolean", "Float", "ID", "Int", "String");

  /** Marks a field of an introspection type that has no sub-selection. */
  private static final String LEAF = "";

  /** Fields of each introspection type and the introspection type each one returns. */
  private static final Map<String, Map<String, String>> META_FIELDS =
      ImmutableMap.<String, Map<String, String>>builder()
          .put(
              "__Schema",
              ImmutableMap.<String, String>builder()
                  .put("description", LEAF)
                  .put("types", "__Type")
                  .put("queryType", "__Type")
                  .put("mutationType", "__Type")
                  .put("subscriptionType", "__Type")
                  .put("directives", "__Directive")
                  .build())
          .put(
              "__Type",
              ImmutableMap.<String, String>builder()
                  .put("kind", LEAF)
                  .put("name", LEAF)
                  .put("description", LEAF)
                  .put("specifiedByURL", LEAF)
                  .put("fields", "__Field")
                  .put("interfaces", "__Type")
                  .put("possibleTypes", "__Type")
                  .put("enumValues", "__EnumValue")
                  .put("inputFields", "__InputValue")
                  .put("ofType", "__Type")
                  .build())
          .put(
              "__Field",
              ImmutableMap.of(
                  "name", LEAF,
                  "description", LEAF,
                  "args", "__InputValue",
                  "type", "__Type",
                  "isDeprecated", LEAF,
                  "deprecationReason", LEAF))
          .put(
              "__InputValue",
              ImmutableMap.of(
                  "name", LEAF,
                  "description", LEAF,
                  "type", "__Type",
                  "defaultValue", LEAF))
          .put(
              "__EnumValue",
              ImmutableMap.of(
                  "name", LEAF,
                  "description", LEAF,
                  "isDeprecated", LEAF,
                  "deprecationReason", LEAF))
          .put(
              "__Directive",
              ImmutableMap.of(
                  "name", LEAF,
                  "description", LEAF,
                  "locations", LEAF,
                  "args", "__InputValue",
                  "isRepeatable", LEAF))
          .build();

  private final SchemaRegistry registry;

  private final Set<String> scalarNames;

  public SchemaIntrospection(SchemaRegistry registry) {
    this.registry = registry;
    this.scalarNames = new TreeSet<>(BUILT_IN_SCALARS);
    for (String typeName : registry.getTypeNames()) {
      for (FieldDefinition field : registry.getFields(typeName).values()) {
        if (registry.getFields(field.typeName()).isEmpty()) {
          scalarNames.add(field.typeName());
        }
      }
    }
  }

  /** Returns whether a root field is answered by the gateway itself. */
  public static boolean isIntrospectionField(String fieldName) {
    return SCHEMA_FIELD.equals(fieldName) || TYPE_FIELD.equals(fieldName);
  }

  /**
   * Checks a root introspection selection against the introspection types.
   *
   * @param rootType name of the root type the field was selected on
   * @param selection {@code __schema} or {@code __type} selection
   * @throws SchemaMismatchException if a selected field does not exist, a leaf has a
   *     sub-selection, an object has none, or {@code __type} has no {@code name}
   */
  public static void validate(String rootType, FieldSelection selection) {
    if (TYPE_FIELD.equals(selection.name()) && !(typeNameArgument(selection) instanceof String)) {
      throw new SchemaMismatchException(
          rootType,
          TYPE_FIELD,
          new IllegalArgumentException("__type requires a String argument \"name\""));
    }
    String metaType = SCHEMA_FIELD.equals(selection.name()) ? "__Schema" : "__Type";
    validateObject(rootType, selection, metaType);
  }

  private static void validateObject(String parentType, FieldSelection selection, String type) {
    if (selection.isLeaf()) {
      throw new SchemaMismatchException(
          parentType,
          selection.name(),
          new IllegalArgumentException(
              format(
                  "Field %s of type %s must have a selection of subfields",
                  selection.name(),
                  type)));
    }
    Map<String, String> fields = META_FIELDS.get(type);
    for (FieldSelection child : selection.children()) {
      if (TYPENAME_FIELD.equals(child.name())) {
        continue;
      }
      String childType = fields.get(child.name());
      if (childType == null) {
        throw new SchemaMismatchException(type, child.name(), null);
      }
      if (!LEAF.equals(childType)) {
        validateObject(type, child, childType);
      } else if (!child.isLeaf()) {
        throw new SchemaMismatchException(
            type,
            child.name(),
            new IllegalArgumentException(
                format("Field %s is a leaf and takes no selection of subfields", child.name())));
      }
    }
  }

  /**
   * Resolves validated root introspection selections.
   *
   * @return values by response key, in selection order
   */
  public Map<String, Object> resolve(List<FieldSelection> selections) {
    Map<String, Object> data = new LinkedHashMap<>();
    for (FieldSelection selection : selections) {
      Object value =
          SCHEMA_FIELD.equals(selection.name())
              ? schema(selection.children())
              : type(named((String) typeNameArgument(selection)), selection.children());
      data.put(selection.responseKey(), value);
    }
    return data;
  }

  private Map<String, Object> schema(List<FieldSelection> children) {
    Map<String, Object> schema = new LinkedHashMap<>();
    for (FieldSelection child : children) {
      Object value =
          switch (child.name()) {
            case TYPENAME_FIELD -> "__Schema";
            case "types" -> types(child.children());
            case "queryType" -> type(named("Query"), child.children());
            case "mutationType" -> type(objectType("Mutation"), child.children());
            case "directives" -> List.of();
            default -> null;
          };
      schema.put(child.responseKey(), value);
    }
    return schema;
  }

  private List<Object> types(List<FieldSelection> children) {
    List<Object> types = new ArrayList<>();
    for (String typeName : registry.getTypeNames()) {
      types.add(type(TypeRef.named("OBJECT", typeName), children));
    }
    for (String scalarName : scalarNames) {
      types.add(type(TypeRef.named("SCALAR", scalarName), children));
    }
    return types;
  }

  private Map<String, Object> type(TypeRef type, List<FieldSelection> children) {
    if (type == null) {
      return null;
    }
    boolean object = "OBJECT".equals(type.kind());
    Map<String, Object> result = new LinkedHashMap<>();
    for (FieldSelection child : children) {
      Object value =
          switch (child.name()) {
            case TYPENAME_FIELD -> "__Type";
            case "kind" -> type.kind();
            case "name" -> type.name();
            case "fields" -> object ? fields(type.name(), child.children()) : null;
            case "interfaces" -> object ? List.of() : null;
            case "ofType" -> type(type.ofType(), child.children());
            default -> null;
          };
      result.put(child.responseKey(), value);
    }
    return result;
  }

  private List<Object> fields(String typeName, List<FieldSelection> children) {
    List<Object> fields = new ArrayList<>();
    for (Map.Entry<String, FieldDefinition> field : registry.getFields(typeName).entrySet()) {
      Map<String, Object> result = new LinkedHashMap<>();
      for (FieldSelection child : children) {
        Object value =
            switch (child.name()) {
              case TYPENAME_FIELD -> "__Field";
              case "name" -> field.getKey();
              case "type" -> type(parse(field.getValue().typeReference()), child.children());
              case "args" -> List.of();
              case "isDeprecated" -> false;
              default -> null;
            };
        result.put(child.responseKey(), value);
      }
      fields.add(result);
    }
    return fields;
  }

  /** Turns a type reference such as {@code [Review!]!} into its chain of wrappers. */
  private TypeRef parse(String typeReference) {
    String reference = typeReference.trim();
    if (reference.endsWith("!")) {
      return TypeRef.wrapping("NON_NULL", parse(reference.substring(0, reference.length() - 1)));
    }
    if (reference.startsWith("[") && reference.endsWith("]")) {
      return TypeRef.wrapping("LIST", parse(reference.substring(1, reference.length() - 1)));
    }
    return named(reference);
  }

  private TypeRef named(String typeName) {
    TypeRef object = objectType(typeName);
    if (object != null) {
      return object;
    }
    return scalarNames.contains(typeName) ? TypeRef.named("SCALAR", typeName) : null;
  }

  private TypeRef objectType(String typeName) {
    return registry.getFields(typeName).isEmpty() ? null : TypeRef.named("OBJECT", typeName);
  }

  private static Object typeNameArgument(FieldSelection selection) {
    return selection.arguments().stream()
        .filter(argument -> "name".equals(argument.name()))
        .map(Argument::value)
        .findFirst()
        .orElse(null);
  }

  /** A named type, or a LIST or NON_NULL wrapper around {@code ofType}. */
  private record TypeRef(String kind, String name, TypeRef ofType) {

    static TypeRef named(String kind, String name) {
      return new TypeRef(kind, name, null);
    }

    static TypeRef wrapping(String kind, TypeRef ofType) {
      return new TypeRef(kind, null, ofType);
    }
  }
}
