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

import java.net.http.HttpClient;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.Identity;
import com.google.httpmiddleware.core.InitializerStack;
import com.google.httpmiddleware.core.Layer;
import com.google.httpmiddleware.core.Middleware;
import com.google.httpmiddleware.core.RequestInitializer;
import com.google.httpmiddleware.core.Service;
import com.google.httpmiddleware.core.Stack;

/**
 * ClientBuilder registers middleware layers and request initializers around a
 * transport and produces a {@link ClientWithMiddleware}.
 *
 * <p>
 * Registration order is execution order: the first layer passed to
 * {@link #with(Layer)} is the outermost, so it sees every request first and
 * every response last. Initializers registered with
 * {@link #withInit(RequestInitializer)} run in the same order.
 *
 * <pre>
 * {@code
 * ClientWithMiddleware client = ClientBuilder.create()
 * 		.withInit(CommonInitializers.defaultHeader("Accept", "application/json"))
 * 		.with(CommonLayers.logging("api"))
 * 		.with(CommonLayers.retry(3, 100))
 * 		.build();
 * }
 * </pre>
 */
public final class ClientBuilder {

  private static final Logger logger = LoggerFactory.getLogger(ClientBuilder.class);

  private final Service transport;
  private Layer middleware = Identity.INSTANCE;
  private RequestInitializer initializer = Identity.INSTANCE;
  private int layerCount;
  private int initializerCount;

  private ClientBuilder(Service transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * Creates a builder over a new JDK engine configured from the environment.
   *
   * @return a new builder
   */
  public static ClientBuilder create() {
    return create(ClientOptions.defaults());
  }

  /**
   * Creates a builder over a new JDK engine configured from the options.
   *
   * @param options
   *            the client options
   * @return a new builder
   */
  public static ClientBuilder create(ClientOptions options) {
    return new ClientBuilder(HttpClientService.create(options));
  }

  /**
   * Creates a builder over an existing engine, which is shared, not copied.
   *
   * @param httpClient
   *            the engine
   * @return a new builder
   */
  public static ClientBuilder create(HttpClient httpClient) {
    return new ClientBuilder(new HttpClientService(httpClient, ClientOptions.defaults()));
  }

  /**
   * Creates a builder over any terminal service.
   *
   * @param transport
   *            the service that performs the request
   * @return a new builder
   */
  public static ClientBuilder create(Service transport) {
    return new ClientBuilder(transport);
  }

  /**
   * Registers a layer inside every layer registered before it.
   *
   * @param layer
   *            the layer
   * @return this builder
   */
  public ClientBuilder with(Layer layer) {
    Objects.requireNonNull(layer, "layer");
    middleware = Stack.push(middleware, layer);
    layerCount++;
    return this;
  }

  /**
   * Registers a middleware inside every layer registered before it.
   *
   * @param middleware
   *            the middleware
   * @return this builder
   */
  public ClientBuilder withMiddleware(Middleware middleware) {
    Objects.requireNonNull(middleware, "middleware");
    return with(middleware.toLayer());
  }

  /**
   * Registers an initializer that runs after every initializer registered
   * before it.
   *
   * @param init
   *            the initializer
   * @return this builder
   */
  public ClientBuilder withInit(RequestInitializer init) {
    Objects.requireNonNull(init, "init");
    initializer = InitializerStack.push(initializer, init);
    initializerCount++;
    return this;
  }

  /**
   * Builds the client. The builder may keep being used afterwards; clients
   * already built are not affected.
   *
   * @return the client
   */
  public ClientWithMiddleware build() {
    logger.debug("Building client with {} layer(s) and {} initializer(s)", layerCount, initializerCount);
    return new ClientWithMiddleware(transport, middleware, initializer);
  }
}
