/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.google.httpmiddleware.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Headers is an immutable, case-insensitive multimap of HTTP header fields.
 * Names keep the spelling they were first added with.
 */
public final class Headers {

  private static final Headers EMPTY = new Headers(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

  private final Map<String, List<String>> fields;

  private Headers(TreeMap<String, List<String>> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Returns an empty Headers.
   *
   * @return the empty headers
   */
  public static Headers empty() {
    return EMPTY;
  }

  /**
   * Creates Headers from a map of names to values. No validation is applied.
   *
   * @param map
   *            the header fields
   * @return the headers
   */
  public static Headers of(Map<String, List<String>> map) {
    TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Map.Entry<String, List<String>> entry : map.entrySet()) {
      copy.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
    }
    return freeze(copy);
  }

  static Headers freeze(TreeMap<String, List<String>> fields) {
    TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Map.Entry<String, List<String>> entry : fields.entrySet()) {
      if (!entry.getValue().isEmpty()) {
        copy.put(entry.getKey(), List.copyOf(entry.getValue()));
      }
    }
    return copy.isEmpty() ? EMPTY : new Headers(copy);
  }

  /**
   * Returns the first value of a header.
   *
   * @param name
   *            the header name, matched case-insensitively
   * @return the first value, if present
   */
  public Optional<String> firstValue(String name) {
    List<String> values = fields.get(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  /**
   * Returns every value of a header.
   *
   * @param name
   *            the header name, matched case-insensitively
   * @return the values, empty if absent
   */
  public List<String> allValues(String name) {
    List<String> values = fields.get(name);
    return values != null ? values : List.of();
  }

  /**
   * Checks whether a header is present.
   *
   * @param name
   *            the header name
   * @return true if present
   */
  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  /**
   * Returns the header names.
   *
   * @return the names
   */
  public Set<String> names() {
    return fields.keySet();
  }

  /**
   * Returns an unmodifiable map view of the headers.
   *
   * @return the header map
   */
  public Map<String, List<String>> map() {
    return fields;
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Headers && fields.equals(((Headers) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
