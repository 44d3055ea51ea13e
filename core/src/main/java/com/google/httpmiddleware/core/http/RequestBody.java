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

package com.google.httpmiddleware.core.http;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * RequestBody is the payload of a request. A body is either buffered (held in
 * memory and replayable any number of times) or streaming (read once from an
 * {@link InputStream}). Builders and requests carrying a streaming body cannot
 * be cloned or retried.
 */
public final class RequestBody {

  private final byte[] bytes;
  private final InputStream stream;

  private RequestBody(byte[] bytes, InputStream stream) {
    this.bytes = bytes;
    this.stream = stream;
  }

  /**
   * Creates a buffered body. The array is copied.
   *
   * @param bytes
   *            the content
   * @return the body
   */
  public static RequestBody ofBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return new RequestBody(bytes.clone(), null);
  }

  /**
   * Creates a buffered UTF-8 body.
   *
   * @param text
   *            the content
   * @return the body
   */
  public static RequestBody ofString(String text) {
    Objects.requireNonNull(text, "text");
    return new RequestBody(text.getBytes(StandardCharsets.UTF_8), null);
  }

  /**
   * Creates a streaming body. The stream is consumed by the transport and
   * cannot be replayed.
   *
   * @param stream
   *            the content
   * @return the body
   */
  public static RequestBody ofStream(InputStream stream) {
    Objects.requireNonNull(stream, "stream");
    return new RequestBody(null, stream);
  }

  /**
   * Checks whether the body is held in memory and can be sent more than once.
   *
   * @return true for buffered bodies
   */
  public boolean isReplayable() {
    return bytes != null;
  }

  /**
   * Returns a copy of the buffered content.
   *
   * @return the content, or empty for a streaming body
   */
  public Optional<byte[]> bytes() {
    return bytes != null ? Optional.of(bytes.clone()) : Optional.empty();
  }

  /**
   * Returns the content length.
   *
   * @return the number of bytes, or -1 when unknown (streaming)
   */
  public long contentLength() {
    return bytes != null ? bytes.length : -1;
  }

  /**
   * Opens the content as a stream. For a buffered body every call returns a
   * fresh stream; for a streaming body the same single-use stream is returned.
   *
   * @return the content stream
   */
  public InputStream openStream() {
    return bytes != null ? new ByteArrayInputStream(bytes) : stream;
  }

  @Override
  public String toString() {
    return bytes != null ? "RequestBody[" + bytes.length + " bytes]" : "RequestBody[streaming]";
  }
}
