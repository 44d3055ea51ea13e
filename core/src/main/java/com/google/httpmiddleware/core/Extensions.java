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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Extensions is a per-request, type-indexed store that carries request-scoped
 * state between initializers, middleware and the transport.
 *
 * <p>
 * Each type has exactly one slot: inserting a value of a type that is already
 * present replaces the previous value. A new instance is created for every
 * logical request and is passed by reference through the whole call chain of
 * that request, so it is never shared between concurrent requests and is not
 * thread-safe.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * record Attempt(int number) {
 * }
 *
 * Extensions extensions = new Extensions();
 * extensions.insert(new Attempt(1));
 * Attempt attempt = extensions.get(Attempt.class); // Attempt[number=1]
 * }
 * </pre>
 */
public final class Extensions {

  private final Map<Class<?>, Object> values;

  /**
   * Creates an empty Extensions.
   */
  public Extensions() {
    this.values = new HashMap<>();
  }

  /**
   * Inserts a value under its own runtime class, replacing any value already
   * stored for that class.
   *
   * @param value
   *            the value to insert
   * @param <T>
   *            the value type
   * @return the previous value of the same class, or null if there was none
   */
  @SuppressWarnings("unchecked")
  public <T> T insert(T value) {
    Objects.requireNonNull(value, "value");
    return insert((Class<T>) value.getClass(), value);
  }

  /**
   * Inserts a value under an explicit type, replacing any value already stored
   * for that type. Use this when the key should be an interface or supertype
   * rather than the runtime class of the value.
   *
   * @param type
   *            the key type
   * @param value
   *            the value to insert
   * @param <T>
   *            the value type
   * @return the previous value of that type, or null if there was none
   */
  public <T> T insert(Class<T> type, T value) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    return type.cast(values.put(type, type.cast(value)));
  }

  /**
   * Returns the value stored for the given type.
   *
   * @param type
   *            the key type
   * @param <T>
   *            the value type
   * @return the value, or null if none is present
   */
  public <T> T get(Class<T> type) {
    return type.cast(values.get(type));
  }

  /**
   * Returns the value stored for the given type, inserting one produced by the
   * supplier if none is present.
   *
   * @param type
   *            the key type
   * @param supplier
   *            produces the value to insert when the slot is empty
   * @param <T>
   *            the value type
   * @return the present or newly inserted value
   */
  public <T> T getOrInsert(Class<T> type, Supplier<? extends T> supplier) {
    T existing = get(type);
    if (existing != null) {
      return existing;
    }
    T created = Objects.requireNonNull(supplier.get(), "supplier returned null");
    insert(type, created);
    return created;
  }

  /**
   * Checks whether a value is stored for the given type.
   *
   * @param type
   *            the key type
   * @return true if a value is present
   */
  public boolean contains(Class<?> type) {
    return values.containsKey(type);
  }

  /**
   * Returns the number of stored values.
   *
   * @return the number of occupied type slots
   */
  public int size() {
    return values.size();
  }

  /**
   * Checks if no value is stored.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public String toString() {
    return "Extensions" + values.keySet();
  }
}
