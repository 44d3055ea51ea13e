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

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.httpmiddleware.core.HttpMiddlewareException;

/**
 * Unit tests for Response.
 */
class ResponseTest {

  static class Item {
    public String name;
    public int count;
  }

  @Test
  void testDefaults() {
    Response response = Response.builder().build();

    assertEquals(200, response.getStatus());
    assertTrue(response.isSuccess());
    assertEquals(0, response.getBody().length);
    assertEquals("", response.getText());
    assertNull(response.getUri());
  }

  @Test
  void testHeadersAndUri() {
    Response response = Response.builder().status(404).header("Content-Type", "text/plain")
        .headers(Map.of("set-cookie", List.of("a=1", "b=2"))).uri(URI.create("http://example.com/x")).build();

    assertFalse(response.isSuccess());
    assertEquals("text/plain", response.getHeaders().firstValue("content-type").orElseThrow());
    assertEquals(List.of("a=1", "b=2"), response.getHeaders().allValues("Set-Cookie"));
    assertEquals("/x", response.getUri().getPath());
  }

  @Test
  void testJsonBody() {
    Response response = Response.builder().body("{\"name\":\"widget\",\"count\":3,\"extra\":true}").build();

    Item item = response.json(Item.class);

    assertEquals("widget", item.name);
    assertEquals(3, item.count);
  }

  @Test
  void testMalformedJsonThrows() {
    Response response = Response.builder().body("{not json").build();

    HttpMiddlewareException e = assertThrows(HttpMiddlewareException.class, () -> response.json(Item.class));
    assertTrue(e.getMessage().startsWith("Failed to parse JSON"));
  }

  @Test
  void testBodyIsCopied() {
    byte[] content = {1, 2, 3};
    Response response = Response.builder().body(content).build();

    content[0] = 9;
    response.getBody()[1] = 9;

    assertArrayEquals(new byte[]{1, 2, 3}, response.getBody());
  }

  @Test
  void testInvalidStatusRejected() {
    assertThrows(IllegalStateException.class, () -> Response.builder().status(42).build());
  }
}
