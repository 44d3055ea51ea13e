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

package com.google.httpmiddleware.core;

import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the JSON serialization used by request bodies, query and
 * form encoding, and response decoding.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Serializes an object to UTF-8 JSON bytes.
   *
   * @param value
   *            the object to serialize
   * @return the JSON bytes
   * @throws JsonProcessingException
   *             if serialization fails
   */
  public static byte[] toJsonBytes(Object value) throws JsonProcessingException {
    return objectMapper.writeValueAsBytes(value);
  }

  /**
   * Parses JSON bytes to the specified type.
   *
   * @param json
   *            the JSON bytes
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the parsed object
   * @throws HttpMiddlewareException
   *             if parsing fails
   */
  public static <T> T fromJson(byte[] json, Class<T> clazz) throws HttpMiddlewareException {
    try {
      return objectMapper.readValue(json, clazz);
    } catch (IOException e) {
      throw new HttpMiddlewareException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Flattens an object into ordered name/value pairs, as used for URL query
   * strings and url-encoded forms. The object may be a map, a bean, or a list of
   * {@link Map.Entry}. Nested objects are not supported; array values repeat
   * the name once per element and nulls are skipped.
   *
   * @param value
   *            the object to flatten
   * @return the pairs, in declaration order
   * @throws IllegalArgumentException
   *             if the value does not flatten to name/value pairs
   */
  public static List<Map.Entry<String, String>> toPairs(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("Expected an object or map but found null");
    }
    List<Map.Entry<String, String>> pairs = new ArrayList<>();
    if (value instanceof Iterable) {
      for (Object item : (Iterable<?>) value) {
        if (!(item instanceof Map.Entry)) {
          throw new IllegalArgumentException("Expected name/value entries but found " + item);
        }
        Map.Entry<?, ?> entry = (Map.Entry<?, ?>) item;
        if (entry.getValue() != null) {
          pairs.add(new AbstractMap.SimpleImmutableEntry<>(String.valueOf(entry.getKey()),
              String.valueOf(entry.getValue())));
        }
      }
      return pairs;
    }

    JsonNode tree = objectMapper.valueToTree(value);
    if (!(tree instanceof ObjectNode)) {
      throw new IllegalArgumentException("Expected an object or map but found " + tree.getNodeType());
    }
    Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode node = field.getValue();
      if (node instanceof ArrayNode) {
        for (JsonNode element : node) {
          addScalar(pairs, field.getKey(), element);
        }
      } else {
        addScalar(pairs, field.getKey(), node);
      }
    }
    return pairs;
  }

  private static void addScalar(List<Map.Entry<String, String>> pairs, String name, JsonNode node) {
    if (node == null || node.isNull()) {
      return;
    }
    if (node.isContainerNode()) {
      throw new IllegalArgumentException("Nested value for '" + name + "' cannot be encoded as a pair");
    }
    pairs.add(new AbstractMap.SimpleImmutableEntry<>(name, node.asText()));
  }
}
