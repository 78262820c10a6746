/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.federation.planner.EntityRequirement;
import org.opensearch.federation.planner.FetchStep;
import org.opensearch.federation.planner.GraphQLQueryBuilder;
import org.opensearch.federation.query.FieldSelection;

/**
 * Hash join of entity fetch results onto the parent objects they extend. The parents found at the
 * fetch's merge path are the build side, keyed by their normalized key values; the returned
 * entities are looked up in that table through the key values they echo. Matching never relies on
 * the position of an entity in the response. All methods are stateless.
 */
final class EntityStitcher {

  private EntityStitcher() {}

  /**
   * Parent object an entity fetch extends.
   *
   * @param object the object inside the merged response tree
   * @param path concrete response path of the object, list indices included
   */
  record EntityTarget(Map<String, Object> object, List<Object> path) {}

  /** Representations of one entity fetch: one per distinct key, with every parent sharing it. */
  static final class Representations {
    private final EntityRequirement entity;
    private final Map<List<Object>, Map<String, Object>> representations = new LinkedHashMap<>();
    private final Map<List<Object>, List<EntityTarget>> targets = new LinkedHashMap<>();
    private final List<EntityTarget> unkeyed = new ArrayList<>();

    private Representations(EntityRequirement entity) {
      this.entity = entity;
    }

    private void add(EntityTarget target) {
      Map<String, Object> representation = new LinkedHashMap<>();
      representation.put("__typename", entity.typeName());
      List<Object> key = new ArrayList<>(entity.keyFields().size());
      for (String keyField : entity.keyFields()) {
        Object value = target.object().get(entity.parentResponseKey(keyField));
        if (value == null) {
          unkeyed.add(target);
          return;
        }
        representation.put(keyField, value);
        key.add(normalizeKeyValue(value));
      }
      representations.putIfAbsent(key, representation);
      targets.computeIfAbsent(key, k -> new ArrayList<>()).add(target);
    }

    boolean isEmpty() {
      return representations.isEmpty();
    }

    int size() {
      return representations.size();
    }

    /** Normalized keys, in the order the representations are sent. */
    List<List<Object>> keys() {
      return new ArrayList<>(representations.keySet());
    }

    /** Drops a key that no longer needs to be sent, returning the parents that shared it. */
    List<EntityTarget> remove(List<Object> key) {
      representations.remove(key);
      List<EntityTarget> removed = targets.remove(key);
      return removed == null ? List.of() : removed;
    }

    List<EntityTarget> targets(List<Object> key) {
      return targets.getOrDefault(key, List.of());
    }

    /** Parents whose key fields are null; they cannot be resolved. */
    List<EntityTarget> unkeyed() {
      return unkeyed;
    }

    /** Every parent still waiting for a representation to be resolved. */
    List<EntityTarget> allTargets() {
      List<EntityTarget> all = new ArrayList<>();
      targets.values().forEach(all::addAll);
      return all;
    }

    /** Value of the {@code representations} variable. */
    List<Map<String, Object>> toVariable() {
      return new ArrayList<>(representations.values());
    }
  }

  /** Collects the parents at the fetch's merge path and builds de-duplicated representations. */
  static Representations collect(Map<String, Object> root, FetchStep fetch) {
    Representations representations = new Representations(fetch.entity());
    for (EntityTarget target : findTargets(root, fetch.mergePath())) {
      representations.add(target);
    }
    return representations;
  }

  /**
   * Finds the objects at {@code mergePath}, descending through lists at any depth. Null and
   * missing values along the way contribute no targets.
   */
  static List<EntityTarget> findTargets(Map<String, Object> root, List<String> mergePath) {
    List<EntityTarget> targets = new ArrayList<>();
    collectTargets(root, mergePath, 0, new ArrayList<>(), targets);
    return targets;
  }

  @SuppressWarnings("unchecked")
  private static void collectTargets(
      Object node, List<String> mergePath, int depth, List<Object> path, List<EntityTarget> out) {
    if (node instanceof List<?> list) {
      for (int i = 0; i < list.size(); i++) {
        path.add(i);
        collectTargets(list.get(i), mergePath, depth, path, out);
        path.remove(path.size() - 1);
      }
    } else if (node instanceof Map) {
      Map<String, Object> object = (Map<String, Object>) node;
      if (depth == mergePath.size()) {
        out.add(new EntityTarget(object, List.copyOf(path)));
        return;
      }
      String segment = mergePath.get(depth);
      path.add(segment);
      collectTargets(object.get(segment), mergePath, depth + 1, path, out);
      path.remove(path.size() - 1);
    }
  }

  /**
   * Builds a hash table of returned entities keyed by the key values they echo. Entities that are
   * null, not objects or missing a key echo are left out and reported through {@code rejected}.
   */
  @SuppressWarnings("unchecked")
  static Map<List<Object>, Map<String, Object>> buildHashTable(
      List<?> entities, EntityRequirement entity, List<Object> rejected) {
    Map<List<Object>, Map<String, Object>> hashTable = new HashMap<>();
    for (Object candidate : entities) {
      if (!(candidate instanceof Map)) {
        rejected.add(candidate);
        continue;
      }
      Map<String, Object> object = (Map<String, Object>) candidate;
      List<Object> key = extractEchoedKey(object, entity);
      if (key == null) {
        rejected.add(candidate);
      } else {
        hashTable.putIfAbsent(key, object);
      }
    }
    return hashTable;
  }

  /** Returns the normalized echoed key of an entity, or null if any key value is missing. */
  static List<Object> extractEchoedKey(Map<String, Object> object, EntityRequirement entity) {
    List<Object> key = new ArrayList<>(entity.keyFields().size());
    for (String keyField : entity.keyFields()) {
      Object value = object.get(GraphQLQueryBuilder.entityKeyAlias(keyField));
      if (value == null) {
        return null;
      }
      key.add(normalizeKeyValue(value));
    }
    return key;
  }

  /**
   * Normalizes a key value for consistent hash/equals behavior. Converts all integer numeric types
   * to Long and Float to Double.
   */
  static Object normalizeKeyValue(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }

  /** Merges a returned entity into a parent, leaving out the echoed key aliases. */
  static void mergeEntity(EntityTarget target, Map<String, Object> entity) {
    Map<String, Object> fields = new LinkedHashMap<>();
    entity.forEach(
        (name, value) -> {
          if (!name.startsWith(GraphQLQueryBuilder.ENTITY_KEY_ALIAS_PREFIX)) {
            fields.put(name, copyTree(value));
          }
        });
    deepMerge(target.object(), fields);
  }

  /** Sets each selection of the fetch to null on a parent, keeping values already present. */
  static void nullSelections(Map<String, Object> object, Collection<FieldSelection> selections) {
    for (FieldSelection selection : selections) {
      object.putIfAbsent(selection.responseKey(), null);
    }
  }

  /**
   * Merges {@code source} into {@code target}. Objects are merged recursively, lists of equal size
   * element by element; otherwise an existing non-null value is kept.
   */
  @SuppressWarnings("unchecked")
  static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      Object existing = target.get(entry.getKey());
      Object incoming = entry.getValue();
      if (existing instanceof Map && incoming instanceof Map) {
        deepMerge((Map<String, Object>) existing, (Map<String, Object>) incoming);
      } else if (existing instanceof List<?> existingList
          && incoming instanceof List<?> incomingList
          && existingList.size() == incomingList.size()) {
        for (int i = 0; i < existingList.size(); i++) {
          if (existingList.get(i) instanceof Map && incomingList.get(i) instanceof Map) {
            deepMerge(
                (Map<String, Object>) existingList.get(i),
                (Map<String, Object>) incomingList.get(i));
          }
        }
      } else if (existing == null) {
        target.put(entry.getKey(), incoming);
      }
    }
  }

  /** Copies a response value into mutable maps and lists that later fetches can extend. */
  @SuppressWarnings("unchecked")
  static Object copyTree(Object value) {
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      ((Map<String, Object>) value).forEach((k, v) -> copy.put(k, copyTree(v)));
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      list.forEach(element -> copy.add(copyTree(element)));
      return copy;
    }
    return value;
  }
}
