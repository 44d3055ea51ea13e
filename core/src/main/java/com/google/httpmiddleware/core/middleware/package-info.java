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

/**
 * Ready-made layers and initializers.
 *
 * <p>
 * This package provides layers for cross-cutting request behavior:
 * <ul>
 * <li>Logging and timing</li>
 * <li>Retry with backoff</li>
 * <li>Overall timeout</li>
 * <li>Rate limiting</li>
 * <li>Validation</li>
 * <li>Request/response transformation</li>
 * <li>Error recovery</li>
 * </ul>
 *
 * <p>
 * Example usage:
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
 *
 * @see com.google.httpmiddleware.core.middleware.CommonLayers
 * @see com.google.httpmiddleware.core.middleware.CommonInitializers
 */
package com.google.httpmiddleware.core.middleware;
