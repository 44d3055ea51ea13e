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

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.httpmiddleware.core.HttpMiddlewareException;
import com.google.httpmiddleware.core.JsonUtils;

/**
 * Response is an HTTP response: status, headers and fully read body. A non-2xx
 * status is a normal response, not an error.
 */
public final class Response {

  private final int status;
  private final Headers headers;
  private final byte[] body;
  private final URI uri;

  private Response(Builder builder) {
    this.status = builder.status;
    this.headers = Headers.freeze(builder.headers);
    this.body = builder.body;
    this.uri = builder.uri;
  }

  public int getStatus() {
    return status;
  }

  public Headers getHeaders() {
    return headers;
  }

  /**
   * Returns the URI the response was received from.
   *
   * @return the URI, or null if unknown
   */
  public URI getUri() {
    return uri;
  }

  /**
   * Returns a copy of the body bytes.
   *
   * @return the body
   */
  public byte[] getBody() {
    return body.clone();
  }

  /**
   * Decodes the body as UTF-8 text.
   *
   * @return the body text
   */
  public String getText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Parses the body as JSON.
   *
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the parsed body
   * @throws HttpMiddlewareException
   *             if the body is not valid JSON for the type
   */
  public <T> T json(Class<T> clazz) throws HttpMiddlewareException {
    return JsonUtils.fromJson(body, clazz);
  }

  /**
   * Checks for a 2xx status.
   *
   * @return true if successful
   */
  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  @Override
  public String toString() {
    return "Response{" + status + (uri != null ? " " + uri : "") + ", " + body.length + " bytes}";
  }

  /**
   * Creates a builder for Response.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for Response.
   */
  public static class Builder {
    private int status = 200;
    private final TreeMap<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body = new byte[0];
    private URI uri;

    public Builder status(int status) {
      this.status = status;
      return this;
    }

    public Builder header(String name, String value) {
      headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder headers(Map<String, List<String>> headers) {
      for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
        this.headers.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
      }
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body != null ? body.clone() : new byte[0];
      return this;
    }

    public Builder body(String body) {
      return body(body.getBytes(StandardCharsets.UTF_8));
    }

    public Builder uri(URI uri) {
      this.uri = uri;
      return this;
    }

    public Response build() {
      if (status < 100 || status > 999) {
        throw new IllegalStateException("Invalid status: " + status);
      }
      return new Response(this);
    }
  }
}
