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

import com.google.httpmiddleware.core.http.Request;

/**
 * Identity is the neutral element of composition: as a {@link Layer} it returns
 * the wrapped service unchanged, and as a {@link RequestInitializer} it returns
 * the builder unchanged. A client with nothing registered uses it for both.
 */
public enum Identity implements Layer, RequestInitializer {

  INSTANCE;

  @Override
  public Service layer(Service inner) {
    return inner;
  }

  @Override
  public Request.Builder init(Request.Builder builder, Extensions extensions) {
    return builder;
  }

  @Override
  public String toString() {
    return "Identity";
  }
}
