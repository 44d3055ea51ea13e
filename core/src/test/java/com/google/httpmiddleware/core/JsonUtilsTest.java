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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Unit tests for JsonUtils.
 */
class JsonUtilsTest {

  static class Filter {
    private final String status;
    private final Integer limit;

    Filter(String status, Integer limit) {
      this.status = status;
      this.limit = limit;
    }

    public String getStatus() {
      return status;
    }

    public Integer getLimit() {
      return limit;
    }
  }

  @Test
  void testToJsonBytesWritesDatesAsIsoStrings() throws JsonProcessingException {
    Map<String, Object> value = new HashMap<>();
    value.put("at", Instant.parse("2025-01-02T03:04:05Z"));

    String json = new String(JsonUtils.toJsonBytes(value), StandardCharsets.UTF_8);

    assertEquals("{\"at\":\"2025-01-02T03:04:05Z\"}", json);
  }

  @Test
  void testFromJsonIgnoresUnknownProperties() {
    @SuppressWarnings("unchecked")
    Map<String, Object> parsed = JsonUtils.fromJson("{\"a\":1}".getBytes(StandardCharsets.UTF_8), Map.class);

    assertEquals(1, parsed.get("a"));
  }

  @Test
  void testFromJsonWrapsFailure() {
    HttpMiddlewareException e = assertThrows(HttpMiddlewareException.class,
        () -> JsonUtils.fromJson("[".getBytes(StandardCharsets.UTF_8), Map.class));

    assertTrue(e.isMiddleware());
  }

  @Test
  void testToPairsFromMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("a", 1);
    map.put("b", true);
    map.put("skip", null);
    map.put("c", Arrays.asList("x", null, "y"));

    List<Map.Entry<String, String>> pairs = JsonUtils.toPairs(map);

    assertEquals(List.of(pair("a", "1"), pair("b", "true"), pair("c", "x"), pair("c", "y")), pairs);
  }

  @Test
  void testToPairsFromBean() {
    List<Map.Entry<String, String>> pairs = JsonUtils.toPairs(new Filter("open", null));

    assertEquals(List.of(pair("status", "open")), pairs);
  }

  @Test
  void testToPairsFromEntriesKeepsOrderAndDuplicates() {
    List<Map.Entry<String, Object>> entries = List.of(pair("z", "1"), pair("a", "2"), pair("z", "3"));

    assertEquals(List.of(pair("z", "1"), pair("a", "2"), pair("z", "3")), JsonUtils.toPairs(entries));
  }

  @Test
  void testToPairsRejectsNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.toPairs("just a string"));
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.toPairs(List.of("not", "entries")));
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.toPairs(Map.of("n", Map.of("x", 1))));
  }

  private static <V> Map.Entry<String, V> pair(String name, V value) {
    return new AbstractMap.SimpleImmutableEntry<>(name, value);
  }
}
