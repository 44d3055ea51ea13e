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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for HttpMiddlewareException and its subclasses.
 */
class HttpMiddlewareExceptionTest {

  @Test
  void testConstructorWithMessageOnly() {
    HttpMiddlewareException exception = new HttpMiddlewareException("Test error message");

    assertEquals("Test error message", exception.getMessage());
    assertNull(exception.getCause());
    assertEquals(ErrorKind.MIDDLEWARE, exception.getKind());
    assertNull(exception.getErrorCode());
    assertNull(exception.getDetails());
  }

  @Test
  void testConstructorWithAllParameters() {
    RuntimeException cause = new RuntimeException("Root cause");
    Map<String, Object> details = Map.of("field", "value");

    HttpMiddlewareException exception = new HttpMiddlewareException("msg", cause, ErrorKind.TRANSPORT, "ERR_001",
        details);

    assertEquals(cause, exception.getCause());
    assertEquals(ErrorKind.TRANSPORT, exception.getKind());
    assertEquals("ERR_001", exception.getErrorCode());
    assertEquals(details, exception.getDetails());
  }

  @Test
  void testSubclassKinds() {
    assertTrue(new RequestBuildException("bad header").isBuild());
    assertTrue(new TransportException("refused", new IOException()).isTransport());
    assertTrue(HttpMiddlewareException.middleware("nope").isMiddleware());
  }

  @Test
  void testIsRuntimeException() {
    assertInstanceOf(RuntimeException.class, new TransportException("Test", null));
  }

  @Test
  void testFromReturnsTaxonomyExceptionUnwrapped() {
    TransportException original = new TransportException("refused", null);

    assertSame(original, HttpMiddlewareException.from(new CompletionException(original)));
    assertSame(original, HttpMiddlewareException.from(new ExecutionException(new CompletionException(original))));
  }

  @Test
  void testFromWrapsForeignThrowableAsMiddlewareError() {
    IllegalArgumentException foreign = new IllegalArgumentException("bad state");

    HttpMiddlewareException converted = HttpMiddlewareException.from(new CompletionException(foreign));

    assertTrue(converted.isMiddleware());
    assertEquals("bad state", converted.getMessage());
    assertSame(foreign, converted.getCause());
  }

  @Test
  void testFromUsesClassNameWhenMessageMissing() {
    HttpMiddlewareException converted = HttpMiddlewareException.from(new NullPointerException());

    assertEquals(NullPointerException.class.getName(), converted.getMessage());
  }

  @Test
  void testBuilderCreatesMatchingSubclass() {
    HttpMiddlewareException build = HttpMiddlewareException.builder().message("m").kind(ErrorKind.BUILD).build();
    HttpMiddlewareException transport = HttpMiddlewareException.builder().message("m").kind(ErrorKind.TRANSPORT)
        .errorCode("E").details("d").build();

    assertInstanceOf(RequestBuildException.class, build);
    assertInstanceOf(TransportException.class, transport);
    assertEquals("E", transport.getErrorCode());
    assertEquals("d", transport.getDetails());
  }

  @Test
  void testBuilderRequiresMessage() {
    assertThrows(IllegalStateException.class, () -> HttpMiddlewareException.builder().build());
  }
}
