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
 * Thrown when a request cannot be materialized from its builder: an invalid
 * header, an unserializable body, a malformed URL or a failing initializer. No
 * middleware runs for a request that failed to build.
 */
public class RequestBuildException extends HttpMiddlewareException {

  /**
   * Creates a new RequestBuildException.
   *
   * @param message
   *            the error message
   */
  public RequestBuildException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new RequestBuildException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public RequestBuildException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new RequestBuildException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public RequestBuildException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause, ErrorKind.BUILD, errorCode, details);
  }
}
