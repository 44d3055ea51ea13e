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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * MultipartForm collects the parts of a {@code multipart/form-data} body.
 *
 * <pre>
 * {@code
 * MultipartForm form = new MultipartForm().text("title", "report").file("data", "report.csv", "text/csv", bytes);
 * builder.multipart(form);
 * }
 * </pre>
 */
public final class MultipartForm {

  private static final byte[] CRLF = {'\r', '\n'};

  private final String boundary;
  private final List<Part> parts = new ArrayList<>();

  /**
   * Creates an empty form with a random boundary.
   */
  public MultipartForm() {
    this("----http-middleware-" + UUID.randomUUID().toString().replace("-", ""));
  }

  /**
   * Creates an empty form with the given boundary.
   *
   * @param boundary
   *            the part delimiter
   */
  public MultipartForm(String boundary) {
    this.boundary = Objects.requireNonNull(boundary, "boundary");
  }

  /**
   * Adds a text field.
   *
   * @param name
   *            the field name
   * @param value
   *            the field value
   * @return this form
   */
  public MultipartForm text(String name, String value) {
    parts.add(new Part(name, null, null, value.getBytes(StandardCharsets.UTF_8)));
    return this;
  }

  /**
   * Adds a file field.
   *
   * @param name
   *            the field name
   * @param fileName
   *            the file name sent to the server
   * @param contentType
   *            the part content type
   * @param content
   *            the file content
   * @return this form
   */
  public MultipartForm file(String name, String fileName, String contentType, byte[] content) {
    parts.add(new Part(name, fileName, contentType, content.clone()));
    return this;
  }

  public String getBoundary() {
    return boundary;
  }

  /**
   * Returns the value for the Content-Type header.
   *
   * @return the content type including the boundary
   */
  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  /**
   * Returns the number of parts.
   *
   * @return the part count
   */
  public int size() {
    return parts.size();
  }

  /**
   * Encodes the form into a body.
   *
   * @return the encoded bytes
   */
  public byte[] toBytes() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (Part part : parts) {
      write(out, "--" + boundary);
      out.writeBytes(CRLF);
      StringBuilder disposition = new StringBuilder("Content-Disposition: form-data; name=\"")
          .append(escape(part.name)).append('"');
      if (part.fileName != null) {
        disposition.append("; filename=\"").append(escape(part.fileName)).append('"');
      }
      write(out, disposition.toString());
      out.writeBytes(CRLF);
      if (part.contentType != null) {
        write(out, "Content-Type: " + part.contentType);
        out.writeBytes(CRLF);
      }
      out.writeBytes(CRLF);
      out.writeBytes(part.content);
      out.writeBytes(CRLF);
    }
    write(out, "--" + boundary + "--");
    out.writeBytes(CRLF);
    return out.toByteArray();
  }

  private static void write(ByteArrayOutputStream out, String text) {
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  private static String escape(String value) {
    return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
  }

  private static final class Part {
    final String name;
    final String fileName;
    final String contentType;
    final byte[] content;

    Part(String name, String fileName, String contentType, byte[] content) {
      this.name = Objects.requireNonNull(name, "name");
      this.fileName = fileName;
      this.contentType = contentType;
      this.content = content;
    }
  }
}
