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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * HttpMiddlewareException is the base exception for every failure reported by
 * a request pipeline. Its {@link ErrorKind} tells whether the request failed to
 * build, was rejected by middleware, or failed in the transport.
 *
 * <p>
 * Instances created directly (or through {@link #middleware(String)}) are
 * middleware errors. {@link RequestBuildException} and
 * {@link TransportException} cover the other two kinds.
 */
public class HttpMiddlewareException extends RuntimeException {

  private final ErrorKind kind;
  private final String errorCode;
  private final Object details;

  /**
   * Creates a new middleware error.
   *
   * @param message
   *            the error message
   */
  public HttpMiddlewareException(String message) {
    this(message, null, ErrorKind.MIDDLEWARE, null, null);
  }

  /**
   * Creates a new middleware error with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public HttpMiddlewareException(String message, Throwable cause) {
    this(message, cause, ErrorKind.MIDDLEWARE, null, null);
  }

  /**
   * Creates a new HttpMiddlewareException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param kind
   *            where the failure originated
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public HttpMiddlewareException(String message, Throwable cause, ErrorKind kind, String errorCode,
      Object details) {
    super(message, cause);
    this.kind = kind != null ? kind : ErrorKind.MIDDLEWARE;
    this.errorCode = errorCode;
    this.details = details;
  }

  /**
   * Returns where the failure originated.
   *
   * @return the error kind
   */
  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Checks whether this error came from the request builder.
   *
   * @return true for build errors
   */
  public boolean isBuild() {
    return kind == ErrorKind.BUILD;
  }

  /**
   * Checks whether this error came from a middleware unit.
   *
   * @return true for middleware errors
   */
  public boolean isMiddleware() {
    return kind == ErrorKind.MIDDLEWARE;
  }

  /**
   * Checks whether this error came from the HTTP engine.
   *
   * @return true for transport errors
   */
  public boolean isTransport() {
    return kind == ErrorKind.TRANSPORT;
  }

  /**
   * Creates a middleware error.
   *
   * @param message
   *            the error message
   * @return the exception
   */
  public static HttpMiddlewareException middleware(String message) {
    return new HttpMiddlewareException(message);
  }

  /**
   * Converts any throwable that completed a pipeline stage into an
   * HttpMiddlewareException. Wrappers added by {@code CompletableFuture} are
   * removed first; exceptions that are already part of the taxonomy are
   * returned as-is and anything else becomes a middleware error.
   *
   * @param throwable
   *            the failure
   * @return the normalized exception
   */
  public static HttpMiddlewareException from(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof HttpMiddlewareException) {
      return (HttpMiddlewareException) cause;
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return new HttpMiddlewareException(message, cause);
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
   *
   * @param throwable
   *            the failure
   * @return the innermost meaningful cause
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Creates a builder for HttpMiddlewareException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for HttpMiddlewareException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private ErrorKind kind = ErrorKind.MIDDLEWARE;
    private String errorCode;
    private Object details;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder kind(ErrorKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder errorCode(String errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public HttpMiddlewareException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      switch (kind) {
        case BUILD :
          return new RequestBuildException(message, cause, errorCode, details);
        case TRANSPORT :
          return new TransportException(message, cause, errorCode, details);
        default :
          return new HttpMiddlewareException(message, cause, kind, errorCode, details);
      }
    }
  }
}
