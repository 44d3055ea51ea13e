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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.google.httpmiddleware.core.Extensions;
import com.google.httpmiddleware.core.RequestInitializer;
import com.google.httpmiddleware.core.http.Request;

class CommonInitializersTest {

  @Test
  void testDefaultHeaderAddsMissingHeader() {
    Request request = CommonInitializers.defaultHeader("Accept", "application/json")
        .init(Request.newBuilder("GET", "http://example.com/"), new Extensions()).build();

    assertEquals("application/json", request.getHeaders().firstValue("Accept").orElseThrow());
  }

  @Test
  void testDefaultHeaderKeepsExplicitHeader() {
    Request.Builder builder = Request.newBuilder("GET", "http://example.com/").header("accept", "text/html");

    Request request = CommonInitializers.defaultHeader("Accept", "application/json")
        .init(builder, new Extensions()).build();

    assertEquals(List.of("text/html"), request.getHeaders().allValues("Accept"));
  }

  @Test
  void testExtensionSeedsOnlyWhenAbsent() {
    AtomicInteger created = new AtomicInteger();
    RequestInitializer seed = CommonInitializers.extension(AtomicInteger.class, () -> {
      created.incrementAndGet();
      return new AtomicInteger(7);
    });
    Extensions fresh = new Extensions();
    Extensions preset = new Extensions();
    preset.insert(new AtomicInteger(1));

    seed.init(Request.newBuilder("GET", "http://example.com/"), fresh);
    seed.init(Request.newBuilder("GET", "http://example.com/"), preset);

    assertEquals(7, fresh.get(AtomicInteger.class).get());
    assertEquals(1, preset.get(AtomicInteger.class).get());
    assertEquals(1, created.get());
  }
}
