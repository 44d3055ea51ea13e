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
 * Failure originating from the underlying HTTP engine: connection errors,
 * timeouts and protocol violations. It travels back through every outer
 * middleware, which may observe, log or retry it.
 */
public class TransportException extends HttpMiddlewareException {

  /**
   * Creates a new TransportException.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public TransportException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new TransportException with full details.
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
  public TransportException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause, ErrorKind.TRANSPORT, errorCode, details);
  }
}
