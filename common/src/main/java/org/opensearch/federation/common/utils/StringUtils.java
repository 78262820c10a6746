/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.utils;

import com.google.common.base.Strings;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class StringUtils {

  private StringUtils() {}

  /**
   * Returns a formatted string using the specified format string and arguments, as well as the
   * {@link Locale#ROOT} locale.
   *
   * @param format format string
   * @param args arguments referenced by the format specifiers in the format string
   * @return A formatted string
   * @throws java.util.IllegalFormatException If a format string contains an illegal syntax, a
   *     format specifier that is incompatible with the given arguments, insufficient arguments
   *     given the format string, or other illegal conditions.
   * @see java.lang.String#format(Locale, String, Object...)
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Renders a response path the way it is written in error messages, e.g. {@code
   * users.0.reviews}. An empty path renders as {@code <root>}.
   *
   * @param path path segments, field names or list indices
   * @return dotted path
   */
  public static String formatPath(List<?> path) {
    if (path == null || path.isEmpty()) {
      return "<root>";
    }
    return path.stream().map(String::valueOf).collect(Collectors.joining("."));
  }

  /**
   * Checks that a name can be used as a GraphQL name: an ASCII letter or underscore followed by
   * ASCII letters, digits or underscores.
   *
   * @param name candidate name
   * @return true if the name is a valid GraphQL name
   */
  public static boolean isValidGraphQLName(String name) {
    if (Strings.isNullOrEmpty(name)) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
      boolean digit = c >= '0' && c <= '9';
      if (!letter && !(digit && i > 0)) {
        return false;
      }
    }
    return true;
  }
}
