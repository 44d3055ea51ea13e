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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.Extensions;
import com.google.httpmiddleware.core.HttpMiddlewareException;
import com.google.httpmiddleware.core.Layer;
import com.google.httpmiddleware.core.Middleware;
import com.google.httpmiddleware.core.Service;
import com.google.httpmiddleware.core.http.Request;
import com.google.httpmiddleware.core.http.Response;

/**
 * CommonLayers provides factory methods for commonly-used middleware layers.
 */
public final class CommonLayers {

  private static final Logger logger = LoggerFactory.getLogger(CommonLayers.class);

  private CommonLayers() {
    // Utility class
  }

  /**
   * Creates a logging layer that logs requests, responses and failures.
   *
   * @param name
   *            the name to use in log messages
   * @return a logging layer
   */
  public static Layer logging(String name) {
    return logging(name, logger);
  }

  /**
   * Creates a logging layer with a custom logger.
   *
   * @param name
   *            the name to use in log messages
   * @param customLogger
   *            the logger to use
   * @return a logging layer
   */
  public static Layer logging(String name, Logger customLogger) {
    Middleware middleware = (request, extensions, next) -> {
      customLogger.info("[{}] Request: {}", name, request);
      long start = System.nanoTime();
      CompletableFuture<Response> call = Service.invoke(next, request, extensions);
      return Service.linkCancellation(call.whenComplete((response, error) -> {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (error == null) {
          customLogger.info("[{}] Response ({}ms): {}", name, millis, response);
        } else {
          HttpMiddlewareException e = HttpMiddlewareException.from(error);
          customLogger.error("[{}] {} error ({}ms): {}", name, e.getKind(), millis, e.getMessage());
        }
      }), call);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a timing layer that reports how long the rest of the chain took,
   * whether it succeeded or failed.
   *
   * @param callback
   *            receives the duration in milliseconds
   * @return a timing layer
   */
  public static Layer timing(Consumer<Long> callback) {
    Middleware middleware = (request, extensions, next) -> {
      long start = System.nanoTime();
      CompletableFuture<Response> call = Service.invoke(next, request, extensions);
      return Service.linkCancellation(call.whenComplete(
          (response, error) -> callback.accept(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))), call);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a retry layer with exponential backoff that retries transport
   * errors.
   *
   * @param maxRetries
   *            maximum number of retry attempts
   * @param initialDelayMs
   *            initial delay between retries in milliseconds
   * @return a retry layer
   */
  public static Layer retry(int maxRetries, long initialDelayMs) {
    return retry(maxRetries, initialDelayMs, HttpMiddlewareException::isTransport);
  }

  /**
   * Creates a retry layer with exponential backoff and a custom retry
   * predicate. Requests with a streaming body are never retried.
   *
   * @param maxRetries
   *            maximum number of retry attempts
   * @param initialDelayMs
   *            initial delay between retries in milliseconds
   * @param shouldRetry
   *            decides whether an error should trigger a retry
   * @return a retry layer
   */
  public static Layer retry(int maxRetries, long initialDelayMs, Predicate<HttpMiddlewareException> shouldRetry) {
    if (maxRetries < 0 || initialDelayMs < 0) {
      throw new IllegalArgumentException("maxRetries and initialDelayMs must not be negative");
    }
    Middleware middleware = (request, extensions, next) -> {
      CompletableFuture<Response> result = new CompletableFuture<>();
      AtomicReference<CompletableFuture<Response>> inFlight = new AtomicReference<>();
      result.whenComplete((response, error) -> {
        CompletableFuture<Response> current = inFlight.get();
        if (result.isCancelled() && current != null) {
          current.cancel(true);
        }
      });
      attempt(result, inFlight, request, extensions, next, 0, maxRetries, initialDelayMs, shouldRetry);
      return result;
    };
    return middleware.toLayer();
  }

  private static void attempt(CompletableFuture<Response> result,
      AtomicReference<CompletableFuture<Response>> inFlight, Request request, Extensions extensions, Service next,
      int attempt, int maxRetries, long delayMs, Predicate<HttpMiddlewareException> shouldRetry) {
    if (result.isDone()) {
      return;
    }
    CompletableFuture<Response> call = Service.invoke(next, request, extensions);
    inFlight.set(call);
    if (result.isCancelled()) {
      call.cancel(true);
      return;
    }
    call.whenComplete((response, error) -> {
      if (error == null) {
        result.complete(response);
        return;
      }
      HttpMiddlewareException e = HttpMiddlewareException.from(error);
      if (result.isDone() || attempt >= maxRetries || !request.isReplayable() || !shouldRetry.test(e)) {
        result.completeExceptionally(e);
        return;
      }
      logger.warn("Retry attempt {} for {} after error: {}", attempt + 1, request, e.getMessage());
      CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS).execute(() -> attempt(result, inFlight,
          request, extensions, next, attempt + 1, maxRetries, delayMs * 2, shouldRetry));
    });
  }

  /**
   * Creates a timeout layer that fails the request with a middleware error if
   * the rest of the chain does not complete in time. The inner call is
   * cancelled when the timeout fires.
   *
   * @param timeout
   *            the overall time allowed
   * @return a timeout layer
   */
  public static Layer timeout(Duration timeout) {
    long timeoutMs = timeout.toMillis();
    Middleware middleware = (request, extensions, next) -> {
      CompletableFuture<Response> call = Service.invoke(next, request, extensions);
      CompletableFuture<Response> limited = call.copy().orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
      return Service.linkCancellation(limited.handle((response, error) -> {
        if (error == null) {
          return response;
        }
        if (HttpMiddlewareException.unwrap(error) instanceof TimeoutException) {
          call.cancel(true);
          logger.warn("Request {} exceeded timeout of {}ms", request, timeoutMs);
          throw HttpMiddlewareException.builder().message("Request timed out after " + timeoutMs + "ms")
              .errorCode("TIMEOUT").cause(error).build();
        }
        throw HttpMiddlewareException.from(error);
      }), call);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a validation layer. The validator throws to reject a request, in
   * which case the rest of the chain is never called.
   *
   * @param validator
   *            the validation function
   * @return a validation layer
   */
  public static Layer validate(Consumer<Request> validator) {
    Middleware middleware = (request, extensions, next) -> {
      try {
        validator.accept(request);
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(HttpMiddlewareException.from(e));
      }
      return Service.invoke(next, request, extensions);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a layer that transforms the request before passing it on.
   *
   * @param transformer
   *            the transformation function
   * @return a transformation layer
   */
  public static Layer transformRequest(UnaryOperator<Request> transformer) {
    Middleware middleware = (request, extensions, next) -> Service.invoke(next, transformer.apply(request),
        extensions);
    return middleware.toLayer();
  }

  /**
   * Creates a layer that transforms successful responses.
   *
   * @param transformer
   *            the transformation function
   * @return a transformation layer
   */
  public static Layer transformResponse(UnaryOperator<Response> transformer) {
    Middleware middleware = (request, extensions, next) -> {
      CompletableFuture<Response> call = Service.invoke(next, request, extensions);
      return Service.linkCancellation(call.thenApply(transformer), call);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a layer that turns failures of the rest of the chain into
   * responses.
   *
   * @param errorHandler
   *            produces a response for an error
   * @return an error handling layer
   */
  public static Layer recover(Function<HttpMiddlewareException, Response> errorHandler) {
    Middleware middleware = (request, extensions, next) -> {
      CompletableFuture<Response> call = Service.invoke(next, request, extensions);
      return Service.linkCancellation(call.handle((response, error) -> error == null
          ? response
          : errorHandler.apply(HttpMiddlewareException.from(error))), call);
    };
    return middleware.toLayer();
  }

  /**
   * Creates a layer that only applies {@code layer} to requests matching the
   * predicate; other requests go straight to the next service.
   *
   * @param predicate
   *            the condition to check
   * @param layer
   *            the layer to apply if the condition is true
   * @return a conditional layer
   */
  public static Layer conditional(BiPredicate<Request, Extensions> predicate, Layer layer) {
    return inner -> {
      Service wrapped = layer.layer(inner);
      return (request, extensions) -> predicate.test(request, extensions)
          ? Service.invoke(wrapped, request, extensions)
          : Service.invoke(inner, request, extensions);
    };
  }

  /**
   * Creates a rate limiting layer (fixed window). Requests over the limit fail
   * without reaching the rest of the chain.
   *
   * @param maxRequests
   *            maximum requests allowed in the time window
   * @param windowMs
   *            time window in milliseconds
   * @return a rate limiting layer
   */
  public static Layer rateLimit(int maxRequests, long windowMs) {
    return new RateLimitMiddleware(maxRequests, windowMs).toLayer();
  }

  /**
   * Rate limiting middleware. One instance is shared by every request of the
   * client it is registered on, so its window state is synchronized.
   */
  private static class RateLimitMiddleware implements Middleware {

    private final int maxRequests;
    private final long windowMs;
    private int requestCount;
    private long windowStart;

    RateLimitMiddleware(int maxRequests, long windowMs) {
      this.maxRequests = maxRequests;
      this.windowMs = windowMs;
      this.requestCount = 0;
      this.windowStart = System.currentTimeMillis();
    }

    private synchronized boolean tryAcquire() {
      long now = System.currentTimeMillis();

      if (now - windowStart >= windowMs) {
        windowStart = now;
        requestCount = 0;
      }
      if (requestCount >= maxRequests) {
        return false;
      }
      requestCount++;
      return true;
    }

    @Override
    public CompletableFuture<Response> handle(Request request, Extensions extensions, Service next) {
      if (!tryAcquire()) {
        return CompletableFuture.failedFuture(HttpMiddlewareException.builder()
            .message("Rate limit exceeded: " + maxRequests + " requests per " + windowMs + "ms")
            .errorCode("RATE_LIMITED").build());
      }
      return Service.invoke(next, request, extensions);
    }
  }
}
