/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.federation.query.FieldSelection;

/**
 * Projects the merged response tree onto the client selection. The result has exactly the
 * selection's response keys, in declaration order and at every depth; key fields added for
 * stitching are dropped and missing fields become null.
 */
final class ResultProjector {

  private ResultProjector() {}

  static Map<String, Object> project(Map<String, Object> data, List<FieldSelection> selections) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (FieldSelection selection : selections) {
      Object value = data.get(selection.responseKey());
      result.put(selection.responseKey(), projectValue(value, selection));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Object projectValue(Object value, FieldSelection selection) {
    if (value == null || selection.isLeaf()) {
      return value;
    }
    if (value instanceof List<?> list) {
      List<Object> projected = new ArrayList<>(list.size());
      for (Object element : list) {
        projected.add(projectValue(element, selection));
      }
      return projected;
    }
    if (value instanceof Map) {
      return project((Map<String, Object>) value, selection.children());
    }
    return value;
  }
}
