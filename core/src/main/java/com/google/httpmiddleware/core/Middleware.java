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

import java.util.concurrent.CompletableFuture;

import com.google.httpmiddleware.core.http.Request;
import com.google.httpmiddleware.core.http.Response;

/**
 * Middleware is a function that handles a request given the next service in the
 * pipeline. It is the shortest way to write a {@link Layer}: the middleware
 * receives the request, the request's extensions and a "next" service to call
 * the rest of the chain (or the transport, at the end of the chain).
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * Middleware timing = (request, extensions, next) -> {
 * 	long start = System.nanoTime();
 * 	CompletableFuture<Response> call = next.call(request, extensions);
 * 	return Service.linkCancellation(call.whenComplete((response, error) -> record(System.nanoTime() - start)), call);
 * };
 * client = ClientBuilder.create().with(timing.toLayer()).build();
 * }
 * </pre>
 *
 * <p>
 * A middleware that returns a future derived from {@code next}'s should link
 * it with {@link Service#linkCancellation} so that cancelling the request
 * reaches the transport.
 */
@FunctionalInterface
public interface Middleware {

  /**
   * Processes the request through this middleware.
   *
   * @param request
   *            the request
   * @param extensions
   *            the request-scoped extensions
   * @param next
   *            the next service in the chain
   * @return a future completed with the response
   */
  CompletableFuture<Response> handle(Request request, Extensions extensions, Service next);

  /**
   * Adapts this middleware to a {@link Layer}.
   *
   * @return a layer whose services delegate to this middleware
   */
  default Layer toLayer() {
    Middleware middleware = this;
    return inner -> {
      Service next = Service.guarded(inner);
      return (request, extensions) -> middleware.handle(request, extensions, next);
    };
  }
}
