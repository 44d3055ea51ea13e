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

/**
 * Layer decorates a {@link Service}, producing a new service with added
 * behavior.
 *
 * <p>
 * Applying a layer is a pure construction step: it must not perform I/O or
 * fail. Everything the produced service needs at call time is captured when
 * the layer is created, and all effects happen when that service is called.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * Layer requestId = inner -> (request, extensions) -> {
 * 	Request tagged = request.toBuilder().setHeader("X-Request-Id", UUID.randomUUID().toString()).build();
 * 	return inner.call(tagged, extensions);
 * };
 * }
 * </pre>
 */
@FunctionalInterface
public interface Layer {

  /**
   * Wraps a service.
   *
   * @param inner
   *            the service to wrap
   * @return the wrapping service
   */
  Service layer(Service inner);

  /**
   * Returns a layer that applies {@code this} around {@code next}, so
   * {@code this} sees the request first and the response last.
   *
   * @param next
   *            the layer to nest inside this one
   * @return the composed layer
   */
  default Layer andThen(Layer next) {
    return new Stack(this, next);
  }

  /**
   * Returns the identity layer.
   *
   * @return the identity layer
   */
  static Layer identity() {
    return Identity.INSTANCE;
  }
}
