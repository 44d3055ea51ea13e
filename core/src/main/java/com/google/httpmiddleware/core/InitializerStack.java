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

import java.util.List;
import java.util.Objects;

import com.google.httpmiddleware.core.http.Request;

/**
 * InitializerStack is a {@link RequestInitializer} composed of two
 * initializers, following the same registration law as {@link Stack}: the
 * first registered initializer is outermost and sees the builder first, the
 * last registered one runs last, right before the request is built.
 */
public final class InitializerStack implements RequestInitializer {

  private final RequestInitializer outer;
  private final RequestInitializer inner;

  /**
   * Creates a new InitializerStack.
   *
   * @param outer
   *            the initializers registered earlier, run first
   * @param inner
   *            the initializer registered later, run second
   */
  public InitializerStack(RequestInitializer outer, RequestInitializer inner) {
    this.outer = Objects.requireNonNull(outer, "outer");
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  /**
   * Returns a stack with {@code initializer} registered after every initializer
   * of {@code base}.
   *
   * @param base
   *            the initializers registered so far
   * @param initializer
   *            the initializer to register
   * @return the new stack
   */
  public static InitializerStack push(RequestInitializer base, RequestInitializer initializer) {
    return new InitializerStack(base, initializer);
  }

  /**
   * Returns an initializer equivalent to registering the given initializers in
   * order.
   *
   * @param initializers
   *            the initializers, first to run first
   * @return the composed initializer, or {@link Identity} for an empty list
   */
  public static RequestInitializer of(List<? extends RequestInitializer> initializers) {
    RequestInitializer result = Identity.INSTANCE;
    for (RequestInitializer initializer : initializers) {
      result = push(result, initializer);
    }
    return result;
  }

  public RequestInitializer getOuter() {
    return outer;
  }

  public RequestInitializer getInner() {
    return inner;
  }

  @Override
  public Request.Builder init(Request.Builder builder, Extensions extensions) {
    Request.Builder afterOuter = outer.init(builder, extensions);
    if (afterOuter == null) {
      throw new RequestBuildException("Initializer " + outer + " returned no builder");
    }
    Request.Builder afterInner = inner.init(afterOuter, extensions);
    if (afterInner == null) {
      throw new RequestBuildException("Initializer " + inner + " returned no builder");
    }
    return afterInner;
  }

  @Override
  public String toString() {
    return "InitializerStack{outer=" + outer + ", inner=" + inner + "}";
  }
}
