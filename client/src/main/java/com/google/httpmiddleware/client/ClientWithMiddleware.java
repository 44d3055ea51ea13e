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

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.Extensions;
import com.google.httpmiddleware.core.HttpMiddlewareException;
import com.google.httpmiddleware.core.Layer;
import com.google.httpmiddleware.core.RequestInitializer;
import com.google.httpmiddleware.core.Service;
import com.google.httpmiddleware.core.http.Request;
import com.google.httpmiddleware.core.http.Response;

/**
 * ClientWithMiddleware sends requests through the registered middleware
 * layers and on to the transport.
 *
 * <p>
 * A client is immutable once built and safe to share between threads. Every
 * request gets its own {@link Extensions} and its own chain, composed from
 * the registered layers at send time.
 */
public final class ClientWithMiddleware {

  private static final Logger logger = LoggerFactory.getLogger(ClientWithMiddleware.class);

  private final Service transport;
  private final Layer middleware;
  private final RequestInitializer initializer;

  ClientWithMiddleware(Service transport, Layer middleware, RequestInitializer initializer) {
    this.transport = transport;
    this.middleware = middleware;
    this.initializer = initializer;
  }

  public RequestBuilder get(String url) {
    return request("GET", url);
  }

  public RequestBuilder post(String url) {
    return request("POST", url);
  }

  public RequestBuilder put(String url) {
    return request("PUT", url);
  }

  public RequestBuilder patch(String url) {
    return request("PATCH", url);
  }

  public RequestBuilder delete(String url) {
    return request("DELETE", url);
  }

  public RequestBuilder head(String url) {
    return request("HEAD", url);
  }

  /**
   * Starts a request. Nothing is validated until the request is built or
   * sent.
   *
   * @param method
   *            the HTTP method
   * @param url
   *            the target URL
   * @return a builder bound to this client
   */
  public RequestBuilder request(String method, String url) {
    return new RequestBuilder(this, Request.newBuilder(method, url), new Extensions());
  }

  /**
   * Starts a request.
   *
   * @param method
   *            the HTTP method
   * @param uri
   *            the target URI
   * @return a builder bound to this client
   */
  public RequestBuilder request(String method, URI uri) {
    return new RequestBuilder(this, Request.newBuilder(method, uri), new Extensions());
  }

  /**
   * Sends an already built request through the middleware. Initializers do
   * not run, since there is no builder for them to act on.
   *
   * @param request
   *            the request
   * @return the response, or a future failed with an
   *         {@link HttpMiddlewareException}
   */
  public CompletableFuture<Response> execute(Request request) {
    return execute(request, new Extensions());
  }

  /**
   * Sends an already built request through the middleware with the given
   * extensions, which must not be shared with another request.
   *
   * @param request
   *            the request
   * @param extensions
   *            the request's extensions
   * @return the response, or a future failed with an
   *         {@link HttpMiddlewareException}
   */
  public CompletableFuture<Response> execute(Request request, Extensions extensions) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(extensions, "extensions");
    Service chain = middleware.layer(transport);
    logger.debug("Executing {}", request);
    CompletableFuture<Response> call = Service.invoke(chain, request, extensions);
    return Service.linkCancellation(call.handle((response, error) -> {
      if (error == null) {
        return response;
      }
      Throwable cause = HttpMiddlewareException.unwrap(error);
      if (cause instanceof CancellationException) {
        throw (CancellationException) cause;
      }
      HttpMiddlewareException e = HttpMiddlewareException.from(cause);
      logger.debug("{} failed with {} error: {}", request, e.getKind(), e.getMessage());
      throw e;
    }), call);
  }

  RequestInitializer getInitializer() {
    return initializer;
  }
}
