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

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.Extensions;
import com.google.httpmiddleware.core.HttpMiddlewareException;
import com.google.httpmiddleware.core.Service;
import com.google.httpmiddleware.core.TransportException;
import com.google.httpmiddleware.core.http.Request;
import com.google.httpmiddleware.core.http.RequestBody;
import com.google.httpmiddleware.core.http.Response;

/**
 * HttpClientService is the terminal service of every chain built by
 * {@link ClientBuilder}: it sends the request with a
 * {@link java.net.http.HttpClient} and reports every engine failure as a
 * {@link TransportException}.
 *
 * <p>
 * The service keeps no per-request state and never retries, so one instance
 * can be shared by any number of concurrent requests.
 */
public final class HttpClientService implements Service {

  private static final Logger logger = LoggerFactory.getLogger(HttpClientService.class);

  private final HttpClient httpClient;
  private final ClientOptions options;

  /**
   * Creates a transport over the given engine.
   *
   * @param httpClient
   *            the engine
   * @param options
   *            supplies the default timeout and user agent
   */
  public HttpClientService(HttpClient httpClient, ClientOptions options) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Creates a JDK engine configured from the options. Redirects are never
   * followed.
   *
   * @param options
   *            the options
   * @return a transport over a new engine
   */
  public static HttpClientService create(ClientOptions options) {
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(options.getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NEVER).build();
    return new HttpClientService(httpClient, options);
  }

  public HttpClient getHttpClient() {
    return httpClient;
  }

  @Override
  public CompletableFuture<Response> call(Request request, Extensions extensions) {
    HttpRequest httpRequest;
    try {
      httpRequest = toHttpRequest(request);
    } catch (IllegalArgumentException e) {
      // The engine refuses some headers it manages itself, such as Host.
      return CompletableFuture.failedFuture(
          new TransportException("Engine rejected " + request + ": " + e.getMessage(), e, "REJECTED", null));
    }

    logger.debug("Sending {}", request);
    CompletableFuture<HttpResponse<byte[]>> sent;
    try {
      sent = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new TransportException("Engine rejected " + request + ": " + e.getMessage(), e, "REJECTED", null));
    }
    return Service.linkCancellation(sent.handle((httpResponse, error) -> {
      if (error != null) {
        throw toTransportException(request, error);
      }
      Response response = toResponse(httpResponse);
      logger.debug("Received {} for {}", response.getStatus(), request);
      return response;
    }), sent);
  }

  HttpRequest toHttpRequest(Request request) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUri())
        .method(request.getMethod(), toPublisher(request));
    for (Map.Entry<String, List<String>> header : request.getHeaders().map().entrySet()) {
      for (String value : header.getValue()) {
        builder.header(header.getKey(), value);
      }
    }
    if (!request.getHeaders().contains("User-Agent") && options.getUserAgent() != null) {
      builder.header("User-Agent", options.getUserAgent());
    }
    if (request.getTimeout().isPresent()) {
      builder.timeout(request.getTimeout().get());
    } else {
      options.getRequestTimeout().ifPresent(builder::timeout);
    }
    return builder.build();
  }

  private static HttpRequest.BodyPublisher toPublisher(Request request) {
    if (request.getBody().isEmpty()) {
      return HttpRequest.BodyPublishers.noBody();
    }
    RequestBody body = request.getBody().get();
    if (body.isReplayable()) {
      return HttpRequest.BodyPublishers.ofByteArray(body.bytes().orElseThrow());
    }
    return HttpRequest.BodyPublishers.ofInputStream(body::openStream);
  }

  private static Response toResponse(HttpResponse<byte[]> httpResponse) {
    return Response.builder().status(httpResponse.statusCode()).headers(httpResponse.headers().map())
        .body(httpResponse.body()).uri(httpResponse.uri()).build();
  }

  private static RuntimeException toTransportException(Request request, Throwable error) {
    Throwable cause = HttpMiddlewareException.unwrap(error);
    if (cause instanceof CancellationException) {
      return (CancellationException) cause;
    }
    String code;
    if (cause instanceof HttpTimeoutException) {
      code = "TIMEOUT";
    } else if (cause instanceof ConnectException) {
      code = "CONNECT";
    } else {
      code = "IO";
    }
    String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    logger.debug("Transport failure ({}) for {}: {}", code, request, detail);
    return new TransportException("Failed to send " + request + ": " + detail, cause, code, null);
  }
}
