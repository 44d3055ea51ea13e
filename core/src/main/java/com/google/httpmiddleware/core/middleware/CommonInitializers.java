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

package com.google.httpmiddleware.core.middleware;

import java.util.function.Supplier;

import com.google.httpmiddleware.core.RequestInitializer;

/**
 * CommonInitializers provides factory methods for commonly-used request
 * initializers.
 */
public final class CommonInitializers {

  private CommonInitializers() {
    // Utility class
  }

  /**
   * Creates an initializer that sets a header unless the request already has
   * one of that name.
   *
   * @param name
   *            the header name
   * @param value
   *            the header value
   * @return the initializer
   */
  public static RequestInitializer defaultHeader(String name, String value) {
    return (builder, extensions) -> builder.hasHeader(name) ? builder : builder.setHeader(name, value);
  }

  /**
   * Creates an initializer that seeds an extension unless one of that type is
   * already present. The supplier is called once per request.
   *
   * @param type
   *            the extension type
   * @param supplier
   *            produces the extension value
   * @param <T>
   *            the extension type
   * @return the initializer
   */
  public static <T> RequestInitializer extension(Class<T> type, Supplier<? extends T> supplier) {
    return (builder, extensions) -> {
      extensions.getOrInsert(type, supplier);
      return builder;
    };
  }
}
