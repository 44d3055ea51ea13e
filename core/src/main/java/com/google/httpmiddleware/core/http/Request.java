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

import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.httpmiddleware.core.JsonUtils;
import com.google.httpmiddleware.core.RequestBuildException;

/**
 * Request is an immutable HTTP request: method, target URI, headers, optional
 * body and optional per-request timeout. It is materialized from a
 * {@link Builder} and is not modified afterwards.
 */
public final class Request {

  private final String method;
  private final URI uri;
  private final Headers headers;
  private final RequestBody body;
  private final Duration timeout;

  private Request(String method, URI uri, Headers headers, RequestBody body, Duration timeout) {
    this.method = method;
    this.uri = uri;
    this.headers = headers;
    this.body = body;
    this.timeout = timeout;
  }

  /**
   * Creates a builder for the given method and URL. The URL is parsed when the
   * request is built.
   *
   * @param method
   *            the HTTP method
   * @param url
   *            the target URL
   * @return a new builder
   */
  public static Builder newBuilder(String method, String url) {
    return new Builder(method, url);
  }

  /**
   * Creates a builder for the given method and URI.
   *
   * @param method
   *            the HTTP method
   * @param uri
   *            the target URI
   * @return a new builder
   */
  public static Builder newBuilder(String method, URI uri) {
    return new Builder(method, uri.toString());
  }

  public String getMethod() {
    return method;
  }

  public URI getUri() {
    return uri;
  }

  public Headers getHeaders() {
    return headers;
  }

  public Optional<RequestBody> getBody() {
    return Optional.ofNullable(body);
  }

  public Optional<Duration> getTimeout() {
    return Optional.ofNullable(timeout);
  }

  /**
   * Checks whether this request can be sent more than once, which is the case
   * unless its body is streaming.
   *
   * @return true if the request is replayable
   */
  public boolean isReplayable() {
    return body == null || body.isReplayable();
  }

  /**
   * Returns a builder initialized with this request's state, for middleware
   * that needs to send a modified copy.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder(method, uri.toString());
    for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
      builder.headers.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
    builder.body = body;
    builder.timeout = timeout;
    return builder;
  }

  @Override
  public String toString() {
    return "Request{" + method + " " + uri + "}";
  }

  /**
   * Builder is the fluent surface used to assemble a request. Setters never
   * throw on bad input: the first problem is recorded and reported by
   * {@link #build()} as a {@link RequestBuildException}.
   */
  public static final class Builder {
    private String method;
    private String url;
    private final TreeMap<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<Map.Entry<String, String>> query = new ArrayList<>();
    private RequestBody body;
    private Duration timeout;
    private RequestBuildException error;

    private Builder(String method, String url) {
      this.method = method;
      this.url = url;
    }

    /**
     * Sets the HTTP method.
     *
     * @param method
     *            the method, e.g. {@code GET}
     * @return this builder
     */
    public Builder method(String method) {
      this.method = method;
      return this;
    }

    /**
     * Sets the target URL.
     *
     * @param url
     *            the URL
     * @return this builder
     */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /**
     * Appends a header value.
     *
     * @param name
     *            the header name
     * @param value
     *            the header value
     * @return this builder
     */
    public Builder header(String name, String value) {
      if (validateHeader(name, value)) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      }
      return this;
    }

    /**
     * Sets a header, replacing any existing values for that name.
     *
     * @param name
     *            the header name
     * @param value
     *            the header value
     * @return this builder
     */
    public Builder setHeader(String name, String value) {
      if (validateHeader(name, value)) {
        List<String> values = new ArrayList<>();
        values.add(value);
        headers.put(name, values);
      }
      return this;
    }

    /**
     * Sets several headers, each replacing existing values of the same name.
     *
     * @param headers
     *            the headers to set
     * @return this builder
     */
    public Builder headers(Map<String, String> headers) {
      if (headers == null) {
        recordError(new RequestBuildException("Headers must not be null"));
        return this;
      }
      for (Map.Entry<String, String> entry : headers.entrySet()) {
        setHeader(entry.getKey(), entry.getValue());
      }
      return this;
    }

    /**
     * Removes every value of a header.
     *
     * @param name
     *            the header name
     * @return this builder
     */
    public Builder removeHeader(String name) {
      headers.remove(name);
      return this;
    }

    /**
     * Checks whether a header has been set.
     *
     * @param name
     *            the header name
     * @return true if present
     */
    public boolean hasHeader(String name) {
      return headers.containsKey(name);
    }

    /**
     * Sets HTTP Basic authentication.
     *
     * @param username
     *            the user name
     * @param password
     *            the password, or null to send none
     * @return this builder
     */
    public Builder basicAuth(String username, String password) {
      if (username == null) {
        recordError(new RequestBuildException("Basic auth username must not be null"));
        return this;
      }
      String credentials = username + ":" + (password != null ? password : "");
      String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
      return setHeader("Authorization", "Basic " + encoded);
    }

    /**
     * Sets bearer token authentication.
     *
     * @param token
     *            the token
     * @return this builder
     */
    public Builder bearerAuth(String token) {
      if (token == null) {
        recordError(new RequestBuildException("Bearer token must not be null"));
        return this;
      }
      return setHeader("Authorization", "Bearer " + token);
    }

    /**
     * Sets the body.
     *
     * @param body
     *            the body, or null to clear it
     * @return this builder
     */
    public Builder body(RequestBody body) {
      this.body = body;
      return this;
    }

    /**
     * Sets a buffered UTF-8 body.
     *
     * @param text
     *            the content
     * @return this builder
     */
    public Builder body(String text) {
      if (text == null) {
        recordError(new RequestBuildException("Body text must not be null"));
        return this;
      }
      return body(RequestBody.ofString(text));
    }

    /**
     * Sets a buffered body.
     *
     * @param bytes
     *            the content
     * @return this builder
     */
    public Builder body(byte[] bytes) {
      if (bytes == null) {
        recordError(new RequestBuildException("Body bytes must not be null"));
        return this;
      }
      return body(RequestBody.ofBytes(bytes));
    }

    /**
     * Sets a streaming body. A builder with a streaming body cannot be cloned.
     *
     * @param stream
     *            the content
     * @return this builder
     */
    public Builder body(InputStream stream) {
      if (stream == null) {
        recordError(new RequestBuildException("Body stream must not be null"));
        return this;
      }
      return body(RequestBody.ofStream(stream));
    }

    /**
     * Serializes the value as a JSON body and sets {@code Content-Type} to
     * {@code application/json} unless already set.
     *
     * @param value
     *            the value to serialize
     * @return this builder
     */
    public Builder json(Object value) {
      try {
        body(RequestBody.ofBytes(JsonUtils.toJsonBytes(value)));
        setDefaultContentType("application/json");
      } catch (JsonProcessingException e) {
        recordError(new RequestBuildException("Failed to serialize JSON body: " + e.getOriginalMessage(), e));
      }
      return this;
    }

    /**
     * Encodes the value as an {@code application/x-www-form-urlencoded} body.
     * Maps, beans and lists of {@link Map.Entry} are accepted.
     *
     * @param value
     *            the form fields
     * @return this builder
     */
    public Builder form(Object value) {
      try {
        body(RequestBody.ofString(encode(JsonUtils.toPairs(value))));
        setDefaultContentType("application/x-www-form-urlencoded");
      } catch (IllegalArgumentException e) {
        recordError(new RequestBuildException("Failed to encode form body: " + e.getMessage(), e));
      }
      return this;
    }

    /**
     * Appends query parameters to the URL. Maps, beans and lists of
     * {@link Map.Entry} are accepted.
     *
     * @param value
     *            the query parameters
     * @return this builder
     */
    public Builder query(Object value) {
      try {
        query.addAll(JsonUtils.toPairs(value));
      } catch (IllegalArgumentException e) {
        recordError(new RequestBuildException("Failed to encode query: " + e.getMessage(), e));
      }
      return this;
    }

    /**
     * Sets a multipart form body and the matching {@code Content-Type}.
     *
     * @param form
     *            the form
     * @return this builder
     */
    public Builder multipart(MultipartForm form) {
      if (form == null) {
        recordError(new RequestBuildException("Multipart form must not be null"));
        return this;
      }
      body(RequestBody.ofBytes(form.toBytes()));
      return setHeader("Content-Type", form.contentType());
    }

    /**
     * Sets the per-request timeout, measured by the transport from the moment
     * the request is sent until response headers are received.
     *
     * @param timeout
     *            the timeout
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      if (timeout == null || timeout.isNegative() || timeout.isZero()) {
        recordError(new RequestBuildException("Timeout must be positive: " + timeout));
      } else {
        this.timeout = timeout;
      }
      return this;
    }

    /**
     * Attempts to copy this builder. Copying is impossible when the body is
     * streaming, since the stream cannot be read twice.
     *
     * @return an independent copy, or empty if the body is streaming
     */
    public Optional<Builder> tryClone() {
      if (body != null && !body.isReplayable()) {
        return Optional.empty();
      }
      Builder copy = new Builder(method, url);
      for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
        copy.headers.put(entry.getKey(), new ArrayList<>(entry.getValue()));
      }
      copy.query.addAll(query);
      copy.body = body;
      copy.timeout = timeout;
      copy.error = error;
      return Optional.of(copy);
    }

    /**
     * Materializes the request.
     *
     * @return the request
     * @throws RequestBuildException
     *             if any setter recorded an error, or the method or URL is
     *             invalid
     */
    public Request build() throws RequestBuildException {
      if (error != null) {
        throw error;
      }
      if (method == null || !isToken(method)) {
        throw new RequestBuildException("Invalid HTTP method: " + method);
      }
      URI uri = parseUrl();
      return new Request(method.toUpperCase(Locale.ROOT), uri, Headers.freeze(headers), body, timeout);
    }

    private URI parseUrl() {
      if (url == null) {
        throw new RequestBuildException("URL is required");
      }
      URI parsed;
      try {
        parsed = new URI(url);
      } catch (URISyntaxException e) {
        throw new RequestBuildException("Invalid URL: " + url, e);
      }
      String scheme = parsed.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new RequestBuildException("URL scheme must be http or https: " + url);
      }
      if (parsed.getHost() == null) {
        throw new RequestBuildException("URL has no host: " + url);
      }
      if (query.isEmpty()) {
        return parsed;
      }

      String rawQuery = parsed.getRawQuery();
      String encoded = encode(query);
      StringBuilder target = new StringBuilder(scheme).append("://").append(parsed.getRawAuthority());
      target.append(parsed.getRawPath() != null ? parsed.getRawPath() : "");
      target.append('?');
      if (rawQuery != null && !rawQuery.isEmpty()) {
        target.append(rawQuery).append('&');
      }
      target.append(encoded);
      if (parsed.getRawFragment() != null) {
        target.append('#').append(parsed.getRawFragment());
      }
      try {
        return new URI(target.toString());
      } catch (URISyntaxException e) {
        throw new RequestBuildException("Invalid URL after adding query: " + target, e);
      }
    }

    private void setDefaultContentType(String contentType) {
      if (!headers.containsKey("Content-Type")) {
        setHeader("Content-Type", contentType);
      }
    }

    private boolean validateHeader(String name, String value) {
      if (name == null || name.isEmpty() || !isToken(name)) {
        recordError(new RequestBuildException("Invalid header name: " + name));
        return false;
      }
      if (value == null || !isValidHeaderValue(value)) {
        recordError(new RequestBuildException("Invalid value for header " + name));
        return false;
      }
      return true;
    }

    private void recordError(RequestBuildException e) {
      // Only the first problem is reported.
      if (error == null) {
        error = e;
      }
    }

    private static boolean isToken(String s) {
      if (s.isEmpty()) {
        return false;
      }
      for (int i = 0; i < s.length(); i++) {
        char c = s.charAt(i);
        boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
        if (!valid) {
          return false;
        }
      }
      return true;
    }

    private static boolean isValidHeaderValue(String value) {
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        if ((c < 0x20 && c != '\t') || c == 0x7f || c > 0xff) {
          return false;
        }
      }
      return true;
    }

    private static String encode(List<Map.Entry<String, String>> pairs) {
      StringBuilder sb = new StringBuilder();
      for (Map.Entry<String, String> pair : pairs) {
        if (sb.length() > 0) {
          sb.append('&');
        }
        sb.append(URLEncoder.encode(pair.getKey(), StandardCharsets.UTF_8)).append('=')
            .append(URLEncoder.encode(Objects.toString(pair.getValue(), ""), StandardCharsets.UTF_8));
      }
      return sb.toString();
    }
  }
}
