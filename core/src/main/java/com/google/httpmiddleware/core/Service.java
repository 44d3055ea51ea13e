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
 * Service is a unit of work in the request pipeline: given a request and the
 * request's {@link Extensions}, it asynchronously produces a response.
 *
 * <p>
 * A service produced by a {@link Layer} typically delegates to the service it
 * wraps. It may do work before and after delegating, delegate several times
 * (retry), or not at all (short-circuit), and may read or modify the extensions
 * at any point. Failures are reported by completing the future exceptionally,
 * preferably with an {@link HttpMiddlewareException}.
 *
 * <p>
 * The extensions belong to a single request and are only valid for the
 * duration of that call; a service must not retain them.
 */
@FunctionalInterface
public interface Service {

  /**
   * Processes the request.
   *
   * @param request
   *            the request
   * @param extensions
   *            the request-scoped extensions
   * @return a future completed with the response, or exceptionally with the
   *         failure
   */
  CompletableFuture<Response> call(Request request, Extensions extensions);

  /**
   * Calls a service, turning a synchronous throw into a failed future.
   *
   * @param service
   *            the service to call
   * @param request
   *            the request
   * @param extensions
   *            the request-scoped extensions
   * @return the service's future, or a failed future if the service threw
   */
  static CompletableFuture<Response> invoke(Service service, Request request, Extensions extensions) {
    try {
      CompletableFuture<Response> future = service.call(request, extensions);
      if (future == null) {
        return CompletableFuture
            .failedFuture(new HttpMiddlewareException("Service " + service + " returned no future"));
      }
      return future;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Wraps a service so that a synchronous throw reaches the caller as a failed
   * future.
   *
   * @param service
   *            the service to wrap
   * @return the wrapped service
   */
  static Service guarded(Service service) {
    return (request, extensions) -> invoke(service, request, extensions);
  }

  /**
   * Cancels {@code source} when {@code derived} is cancelled. Stages that
   * return a future derived from the inner call use this so that cancelling a
   * request reaches the transport.
   *
   * @param derived
   *            the future handed to the caller
   * @param source
   *            the inner future it was derived from
   * @param <T>
   *            the result type
   * @return {@code derived}
   */
  static <T> CompletableFuture<T> linkCancellation(CompletableFuture<T> derived, CompletableFuture<?> source) {
    derived.whenComplete((result, error) -> {
      if (derived.isCancelled()) {
        source.cancel(true);
      }
    });
    return derived;
  }
}
