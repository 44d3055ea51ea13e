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

package com.google.httpmiddleware.client;

import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.Extensions;
import com.google.httpmiddleware.core.RequestBuildException;
import com.google.httpmiddleware.core.http.MultipartForm;
import com.google.httpmiddleware.core.http.Request;
import com.google.httpmiddleware.core.http.RequestBody;
import com.google.httpmiddleware.core.http.Response;

/**
 * RequestBuilder assembles one request for a {@link ClientWithMiddleware}.
 *
 * <p>
 * Setters never throw on bad input. The first problem is reported by
 * {@link #build()} or {@link #send()} as a {@link RequestBuildException}, and
 * in that case no middleware runs. A builder can be built or sent once; use
 * {@link #tryClone()} beforehand to send the same request again.
 */
public final class RequestBuilder {

  private static final Logger logger = LoggerFactory.getLogger(RequestBuilder.class);

  private final ClientWithMiddleware client;
  private final Request.Builder builder;
  private final Extensions extensions;
  private boolean consumed;

  RequestBuilder(ClientWithMiddleware client, Request.Builder builder, Extensions extensions) {
    this.client = client;
    this.builder = builder;
    this.extensions = extensions;
  }

  public RequestBuilder header(String name, String value) {
    builder.header(name, value);
    return this;
  }

  public RequestBuilder headers(Map<String, String> headers) {
    builder.headers(headers);
    return this;
  }

  public RequestBuilder basicAuth(String username, String password) {
    builder.basicAuth(username, password);
    return this;
  }

  public RequestBuilder bearerAuth(String token) {
    builder.bearerAuth(token);
    return this;
  }

  public RequestBuilder body(RequestBody body) {
    builder.body(body);
    return this;
  }

  public RequestBuilder body(String body) {
    builder.body(body);
    return this;
  }

  public RequestBuilder body(byte[] body) {
    builder.body(body);
    return this;
  }

  /**
   * Sets a streaming body. The request can then be neither cloned nor retried.
   *
   * @param body
   *            the content
   * @return this builder
   */
  public RequestBuilder body(InputStream body) {
    builder.body(body);
    return this;
  }

  public RequestBuilder timeout(Duration timeout) {
    builder.timeout(timeout);
    return this;
  }

  public RequestBuilder multipart(MultipartForm form) {
    builder.multipart(form);
    return this;
  }

  public RequestBuilder query(Object query) {
    builder.query(query);
    return this;
  }

  public RequestBuilder form(Object form) {
    builder.form(form);
    return this;
  }

  public RequestBuilder json(Object json) {
    builder.json(json);
    return this;
  }

  /**
   * Adds a value to this request's extensions under its own class, replacing
   * any value of the same class.
   *
   * @param value
   *            the value
   * @return this builder
   */
  public RequestBuilder withExtension(Object value) {
    extensions.insert(value);
    return this;
  }

  /**
   * Adds a value to this request's extensions under the given type.
   *
   * @param type
   *            the key
   * @param value
   *            the value
   * @param <T>
   *            the value type
   * @return this builder
   */
  public <T> RequestBuilder withExtension(Class<T> type, T value) {
    extensions.insert(type, value);
    return this;
  }

  /**
   * Returns this request's extensions, which initializers and middleware will
   * see.
   *
   * @return the extensions
   */
  public Extensions extensions() {
    return extensions;
  }

  /**
   * Runs the client's initializers and materializes the request.
   *
   * @return the request
   * @throws RequestBuildException
   *             if an initializer fails or the request is invalid
   * @throws IllegalStateException
   *             if this builder was already built or sent
   */
  public Request build() {
    markConsumed();
    return materialize();
  }

  /**
   * Runs the client's initializers, materializes the request and sends it
   * through the middleware. A build failure fails the returned future without
   * invoking any middleware.
   *
   * @return the response, or a future failed with an
   *         {@link com.google.httpmiddleware.core.HttpMiddlewareException}
   * @throws IllegalStateException
   *             if this builder was already built or sent
   */
  public CompletableFuture<Response> send() {
    markConsumed();
    Request request;
    try {
      request = materialize();
    } catch (RequestBuildException e) {
      logger.warn("Request was not sent: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
    return client.execute(request, extensions);
  }

  /**
   * Copies this builder for another request. The copy starts with empty
   * extensions.
   *
   * @return the copy, or empty if the body is streaming
   */
  public Optional<RequestBuilder> tryClone() {
    return builder.tryClone().map(copy -> new RequestBuilder(client, copy, new Extensions()));
  }

  private void markConsumed() {
    if (consumed) {
      throw new IllegalStateException("RequestBuilder was already built or sent");
    }
    consumed = true;
  }

  private Request materialize() {
    // Initializers work on a copy so a clone taken later starts from the caller's settings.
    Request.Builder working = builder.tryClone().orElse(builder);
    Request.Builder initialized;
    try {
      initialized = client.getInitializer().init(working, extensions);
    } catch (RequestBuildException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RequestBuildException("Request initializer failed: " + e.getMessage(), e);
    }
    return initialized.build();
  }
}
