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

package com.google.httpmiddleware.core.tracing;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.httpmiddleware.core.HttpMiddlewareException;
import com.google.httpmiddleware.core.Layer;
import com.google.httpmiddleware.core.Service;
import com.google.httpmiddleware.core.http.Response;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

/**
 * TracingLayer records an OpenTelemetry CLIENT span around the rest of the
 * chain for every request.
 *
 * <p>
 * The span is inserted into the request's extensions under {@link Span}, so
 * middleware registered after this layer can add attributes or events to it:
 *
 * <pre>
 * {@code
 * Span span = extensions.get(Span.class);
 * if (span != null) {
 * 	span.setAttribute("cache.hit", true);
 * }
 * }
 * </pre>
 */
public final class TracingLayer implements Layer {

  private static final Logger logger = LoggerFactory.getLogger(TracingLayer.class);
  private static final String INSTRUMENTATION_NAME = "http-middleware-java";

  private final Tracer tracer;

  /**
   * Creates a TracingLayer using the given tracer.
   *
   * @param tracer
   *            the tracer to create spans with
   */
  public TracingLayer(Tracer tracer) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
  }

  /**
   * Creates a TracingLayer using a tracer from the given OpenTelemetry instance.
   *
   * @param openTelemetry
   *            the OpenTelemetry instance
   * @return the layer
   */
  public static TracingLayer create(OpenTelemetry openTelemetry) {
    return new TracingLayer(openTelemetry.getTracer(INSTRUMENTATION_NAME));
  }

  @Override
  public Service layer(Service inner) {
    return (request, extensions) -> {
      Span span = tracer.spanBuilder("HTTP " + request.getMethod()).setSpanKind(SpanKind.CLIENT)
          .setParent(Context.current()).startSpan();
      span.setAttribute("http.request.method", request.getMethod());
      span.setAttribute("url.full", request.getUri().toString());
      if (request.getUri().getHost() != null) {
        span.setAttribute("server.address", request.getUri().getHost());
      }
      Span previous = extensions.insert(Span.class, span);

      try (Scope ignored = span.makeCurrent()) {
        CompletableFuture<Response> call = Service.invoke(inner, request, extensions);
        return Service.linkCancellation(call.whenComplete((response, error) -> {
          if (error == null) {
            span.setAttribute("http.response.status_code", response.getStatus());
            if (response.getStatus() >= 400) {
              span.setStatus(StatusCode.ERROR);
            }
          } else {
            HttpMiddlewareException e = HttpMiddlewareException.from(error);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute("error.type", e.getKind().name());
            span.recordException(e);
          }
          span.end();
          logger.debug("Ended span {} for {}", span.getSpanContext().getSpanId(), request);
          if (previous != null) {
            extensions.insert(Span.class, previous);
          }
        }), call);
      }
    };
  }
}
