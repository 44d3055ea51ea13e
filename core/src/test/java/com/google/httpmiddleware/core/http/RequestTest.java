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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.AbstractMap;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.google.httpmiddleware.core.RequestBuildException;

/**
 * Unit tests for Request and Request.Builder.
 */
class RequestTest {

  @Test
  void testBuildMinimalRequest() {
    Request request = Request.newBuilder("get", "https://example.com/items").build();

    assertEquals("GET", request.getMethod());
    assertEquals("https://example.com/items", request.getUri().toString());
    assertTrue(request.getHeaders().isEmpty());
    assertTrue(request.getBody().isEmpty());
    assertTrue(request.getTimeout().isEmpty());
    assertTrue(request.isReplayable());
  }

  @Test
  void testHeadersAreCaseInsensitiveAndAppend() {
    Request request = Request.newBuilder("GET", "http://example.com/").header("Accept", "text/plain")
        .header("accept", "application/json").build();

    assertEquals(List.of("text/plain", "application/json"), request.getHeaders().allValues("ACCEPT"));
    assertEquals("text/plain", request.getHeaders().firstValue("Accept").orElseThrow());
  }

  @Test
  void testSetHeaderReplaces() {
    Request request = Request.newBuilder("GET", "http://example.com/").header("X-Id", "1").setHeader("x-id", "2")
        .headers(Map.of("X-Other", "3")).build();

    assertEquals(List.of("2"), request.getHeaders().allValues("X-Id"));
    assertEquals(List.of("3"), request.getHeaders().allValues("X-Other"));
  }

  @Test
  void testRemoveHeader() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").header("X-Id", "1");
    assertTrue(builder.hasHeader("x-id"));

    builder.removeHeader("X-ID");

    assertFalse(builder.hasHeader("X-Id"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "Bad Name", "X-Header:", "Zürich"})
  void testInvalidHeaderNameIsBuildError(String name) {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").header(name, "v");

    RequestBuildException e = assertThrows(RequestBuildException.class, builder::build);
    assertTrue(e.isBuild());
  }

  @Test
  void testInvalidHeaderValueIsBuildError() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").header("X-Test", "line\nbreak");

    RequestBuildException e = assertThrows(RequestBuildException.class, builder::build);
    assertTrue(e.getMessage().contains("X-Test"));
  }

  @Test
  void testFirstErrorIsReported() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").header("bad name", "v")
        .timeout(Duration.ZERO);

    RequestBuildException e = assertThrows(RequestBuildException.class, builder::build);
    assertTrue(e.getMessage().contains("header name"));
  }

  @Test
  void testHeaderValueWithTabIsAllowed() {
    Request request = Request.newBuilder("GET", "http://example.com/").header("X-Test", "a\tb").build();

    assertEquals("a\tb", request.getHeaders().firstValue("X-Test").orElseThrow());
  }

  @ParameterizedTest
  @ValueSource(strings = {"not a url", "ftp://example.com/", "/relative/path", "http:///nohost"})
  void testInvalidUrlIsBuildError(String url) {
    assertThrows(RequestBuildException.class, () -> Request.newBuilder("GET", url).build());
  }

  @Test
  void testInvalidMethodIsBuildError() {
    assertThrows(RequestBuildException.class, () -> Request.newBuilder("GE T", "http://example.com/").build());
    assertThrows(RequestBuildException.class, () -> Request.newBuilder(null, "http://example.com/").build());
  }

  @Test
  void testJsonBodySetsContentType() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", "widget");
    payload.put("count", 3);

    Request request = Request.newBuilder("POST", "http://example.com/").json(payload).build();

    assertEquals("application/json", request.getHeaders().firstValue("Content-Type").orElseThrow());
    byte[] body = request.getBody().orElseThrow().bytes().orElseThrow();
    assertEquals("{\"name\":\"widget\",\"count\":3}", new String(body, StandardCharsets.UTF_8));
  }

  @Test
  void testJsonKeepsExplicitContentType() {
    Request request = Request.newBuilder("POST", "http://example.com/")
        .setHeader("Content-Type", "application/vnd.api+json").json(Map.of("a", 1)).build();

    assertEquals("application/vnd.api+json", request.getHeaders().firstValue("Content-Type").orElseThrow());
  }

  @Test
  void testFormBodyIsUrlEncoded() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("q", "a b&c");
    fields.put("tag", List.of("x", "y"));

    Request request = Request.newBuilder("POST", "http://example.com/").form(fields).build();

    assertEquals("application/x-www-form-urlencoded",
        request.getHeaders().firstValue("Content-Type").orElseThrow());
    byte[] body = request.getBody().orElseThrow().bytes().orElseThrow();
    assertEquals("q=a+b%26c&tag=x&tag=y", new String(body, StandardCharsets.UTF_8));
  }

  @Test
  void testNestedFormIsBuildError() {
    Request.Builder builder = Request.newBuilder("POST", "http://example.com/")
        .form(Map.of("outer", Map.of("inner", 1)));

    assertThrows(RequestBuildException.class, builder::build);
  }

  @Test
  void testQueryIsAppendedToExistingQuery() {
    Request request = Request.newBuilder("GET", "http://example.com/search?lang=en")
        .query(List.of(new AbstractMap.SimpleEntry<>("q", "hello world"), new AbstractMap.SimpleEntry<>("page", 2)))
        .build();

    assertEquals("lang=en&q=hello+world&page=2", request.getUri().getRawQuery());
    assertEquals("/search", request.getUri().getPath());
  }

  @Test
  void testQueryPreservesFragment() {
    Request request = Request.newBuilder("GET", "http://example.com/page#top").query(Map.of("a", "1")).build();

    assertEquals("a=1", request.getUri().getRawQuery());
    assertEquals("top", request.getUri().getFragment());
  }

  @Test
  void testMultipartBody() {
    MultipartForm form = new MultipartForm("XyZ").text("title", "report").file("file", "a.txt", "text/plain",
        "hello".getBytes(StandardCharsets.UTF_8));

    Request request = Request.newBuilder("POST", "http://example.com/upload").multipart(form).build();

    assertEquals("multipart/form-data; boundary=XyZ", request.getHeaders().firstValue("Content-Type").orElseThrow());
    String body = new String(request.getBody().orElseThrow().bytes().orElseThrow(), StandardCharsets.UTF_8);
    assertTrue(body.startsWith("--XyZ\r\nContent-Disposition: form-data; name=\"title\"\r\n\r\nreport\r\n"));
    assertTrue(body.contains("filename=\"a.txt\"\r\nContent-Type: text/plain\r\n\r\nhello\r\n"));
    assertTrue(body.endsWith("--XyZ--\r\n"));
  }

  @Test
  void testBasicAuth() {
    Request request = Request.newBuilder("GET", "http://example.com/").basicAuth("user", "secret").build();

    String expected = "Basic " + Base64.getEncoder().encodeToString("user:secret".getBytes(StandardCharsets.UTF_8));
    assertEquals(expected, request.getHeaders().firstValue("Authorization").orElseThrow());
  }

  @Test
  void testBasicAuthWithoutPassword() {
    Request request = Request.newBuilder("GET", "http://example.com/").basicAuth("user", null).build();

    String expected = "Basic " + Base64.getEncoder().encodeToString("user:".getBytes(StandardCharsets.UTF_8));
    assertEquals(expected, request.getHeaders().firstValue("Authorization").orElseThrow());
  }

  @Test
  void testBearerAuth() {
    Request request = Request.newBuilder("GET", "http://example.com/").bearerAuth("tok").build();

    assertEquals("Bearer tok", request.getHeaders().firstValue("Authorization").orElseThrow());
  }

  @Test
  void testTimeout() {
    Request request = Request.newBuilder("GET", "http://example.com/").timeout(Duration.ofSeconds(5)).build();

    assertEquals(Duration.ofSeconds(5), request.getTimeout().orElseThrow());
  }

  @Test
  void testNegativeTimeoutIsBuildError() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").timeout(Duration.ofSeconds(-1));

    assertThrows(RequestBuildException.class, builder::build);
  }

  @Test
  void testTryCloneIsIndependent() {
    Request.Builder original = Request.newBuilder("POST", "http://example.com/").header("X-Id", "1").body("data");

    Request.Builder copy = original.tryClone().orElseThrow();
    copy.setHeader("X-Id", "2");

    assertEquals("1", original.build().getHeaders().firstValue("X-Id").orElseThrow());
    Request copied = copy.build();
    assertEquals("2", copied.getHeaders().firstValue("X-Id").orElseThrow());
    assertEquals("data", new String(copied.getBody().orElseThrow().bytes().orElseThrow(), StandardCharsets.UTF_8));
  }

  @Test
  void testTryCloneWithStreamingBodyIsEmpty() {
    Request.Builder builder = Request.newBuilder("POST", "http://example.com/")
        .body(new ByteArrayInputStream(new byte[]{1, 2, 3}));

    assertTrue(builder.tryClone().isEmpty());
    assertFalse(builder.build().isReplayable());
  }

  @Test
  void testToBuilderCopiesState() {
    Request original = Request.newBuilder("PUT", "http://example.com/a").header("X-Id", "1").body("x")
        .timeout(Duration.ofSeconds(1)).build();

    Request modified = original.toBuilder().url("http://example.com/b").build();

    assertEquals("PUT", modified.getMethod());
    assertEquals("/b", modified.getUri().getPath());
    assertEquals("1", modified.getHeaders().firstValue("X-Id").orElseThrow());
    assertEquals(Duration.ofSeconds(1), modified.getTimeout().orElseThrow());
    assertEquals("/a", original.getUri().getPath());
  }

  @Test
  void testHeadersOfBuiltRequestAreImmutable() {
    Request request = Request.newBuilder("GET", "http://example.com/").header("X-Id", "1").build();

    assertThrows(UnsupportedOperationException.class, () -> request.getHeaders().map().put("X-New", List.of()));
  }

  @Test
  void testNullBodyIsBuildError() {
    assertThrows(RequestBuildException.class,
        Request.newBuilder("POST", "http://example.com/").body((String) null)::build);
    assertThrows(RequestBuildException.class,
        Request.newBuilder("POST", "http://example.com/").body((byte[]) null)::build);
    assertThrows(RequestBuildException.class,
        Request.newBuilder("POST", "http://example.com/").body((InputStream) null)::build);
  }

  @Test
  void testNullHeadersMapIsBuildError() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").headers(null);

    RequestBuildException e = assertThrows(RequestBuildException.class, builder::build);
    assertTrue(e.isBuild());
  }

  @Test
  void testNullMultipartFormIsBuildError() {
    Request.Builder builder = Request.newBuilder("POST", "http://example.com/").multipart(null);

    RequestBuildException e = assertThrows(RequestBuildException.class, builder::build);
    assertTrue(e.getMessage().contains("Multipart"));
  }

  @Test
  void testNullQueryAndFormAreBuildErrors() {
    assertThrows(RequestBuildException.class, Request.newBuilder("GET", "http://example.com/").query(null)::build);
    assertThrows(RequestBuildException.class, Request.newBuilder("POST", "http://example.com/").form(null)::build);
  }

  @Test
  void testNullBearerTokenIsBuildError() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").bearerAuth(null);

    assertThrows(RequestBuildException.class, builder::build);
  }
}
