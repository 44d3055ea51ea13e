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

/**
 * Stack is a {@link Layer} composed of two layers. Applying it to a service
 * applies {@code inner} first and then wraps the result with {@code outer}:
 *
 * <pre>
 * stack.layer(service) == outer.layer(inner.layer(service))
 * </pre>
 *
 * <p>
 * Registering layers {@code L1, L2, ..., Ln} one at a time with
 * {@link #push(Layer)} nests each new layer inside the previous ones, so
 * {@code L1} ends up outermost (it sees the request first and the response
 * last) and {@code Ln} is adjacent to the wrapped service.
 */
public final class Stack implements Layer {

  private final Layer outer;
  private final Layer inner;

  /**
   * Creates a new Stack.
   *
   * @param outer
   *            the layer applied last, which ends up on the outside
   * @param inner
   *            the layer applied first, closer to the wrapped service
   */
  public Stack(Layer outer, Layer inner) {
    this.outer = Objects.requireNonNull(outer, "outer");
    this.inner = Objects.requireNonNull(inner, "inner");
  }

  /**
   * Returns a stack with {@code layer} registered after every layer of
   * {@code base}.
   *
   * @param base
   *            the layers registered so far
   * @param layer
   *            the layer to register
   * @return the new stack
   */
  public static Stack push(Layer base, Layer layer) {
    return new Stack(base, layer);
  }

  /**
   * Returns a layer equivalent to registering the given layers in order.
   *
   * @param layers
   *            the layers, outermost first
   * @return the composed layer, or {@link Identity} for an empty list
   */
  public static Layer of(List<? extends Layer> layers) {
    Layer result = Identity.INSTANCE;
    for (Layer layer : layers) {
      result = push(result, layer);
    }
    return result;
  }

  /**
   * Returns a layer equivalent to registering the given layers in order.
   *
   * @param layers
   *            the layers, outermost first
   * @return the composed layer
   */
  public static Layer of(Layer... layers) {
    return of(List.of(layers));
  }

  /**
   * Registers a layer inside this stack.
   *
   * @param layer
   *            the layer to register
   * @return the new stack
   */
  public Stack push(Layer layer) {
    return push(this, layer);
  }

  public Layer getOuter() {
    return outer;
  }

  public Layer getInner() {
    return inner;
  }

  @Override
  public Service layer(Service service) {
    // Each stage sees a throw from the stage below as a failed future.
    Service innerService = Service.guarded(inner.layer(Service.guarded(service)));
    return outer.layer(innerService);
  }

  @Override
  public String toString() {
    return "Stack{outer=" + outer + ", inner=" + inner + "}";
  }
}
