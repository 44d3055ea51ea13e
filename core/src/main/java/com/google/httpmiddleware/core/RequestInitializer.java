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

import com.google.httpmiddleware.core.http.Request;

/**
 * RequestInitializer runs before a request is materialized. It receives the
 * request builder and the request's {@link Extensions} and returns the builder
 * to continue with, typically after adding default headers or seeding
 * extensions that middleware reads later.
 *
 * <p>
 * Initializers run synchronously and must not perform network I/O. Throwing
 * from an initializer fails the request with a {@link RequestBuildException}
 * before any middleware runs.
 */
@FunctionalInterface
public interface RequestInitializer {

  /**
   * Initializes the request.
   *
   * @param builder
   *            the request builder
   * @param extensions
   *            the request-scoped extensions
   * @return the builder to continue with
   */
  Request.Builder init(Request.Builder builder, Extensions extensions);

  /**
   * Returns an initializer that runs {@code this} and then {@code next}.
   *
   * @param next
   *            the initializer to run afterwards
   * @return the composed initializer
   */
  default RequestInitializer andThen(RequestInitializer next) {
    return new InitializerStack(this, next);
  }

  /**
   * Returns the identity initializer.
   *
   * @return the identity initializer
   */
  static RequestInitializer identity() {
    return Identity.INSTANCE;
  }
}
