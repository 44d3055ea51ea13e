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

package com.google.httpmiddleware.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ClientOptions contains configuration options for the HTTP transport.
 */
public class ClientOptions {

  static final String CONNECT_TIMEOUT_ENV = "HTTP_MIDDLEWARE_CONNECT_TIMEOUT_MS";
  static final String REQUEST_TIMEOUT_ENV = "HTTP_MIDDLEWARE_REQUEST_TIMEOUT_MS";
  static final String DEFAULT_USER_AGENT = "http-middleware-java";
  static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final Duration connectTimeout;
  private final Duration requestTimeout;
  private final String userAgent;

  private ClientOptions(Builder builder) {
    this.connectTimeout = builder.connectTimeout;
    this.requestTimeout = builder.requestTimeout;
    this.userAgent = builder.userAgent;
  }

  /**
   * Creates a new builder with defaults read from the environment.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder(System::getenv);
  }

  /**
   * Returns the default options.
   *
   * @return options built from the environment
   */
  public static ClientOptions defaults() {
    return builder().build();
  }

  /**
   * Returns the TCP connect timeout.
   *
   * @return the connect timeout
   */
  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  /**
   * Returns the timeout applied to requests that do not set their own.
   *
   * @return the default request timeout, or empty for none
   */
  public Optional<Duration> getRequestTimeout() {
    return Optional.ofNullable(requestTimeout);
  }

  /**
   * Returns the User-Agent sent when a request does not set one.
   *
   * @return the user agent, or null to send the engine's own
   */
  public String getUserAgent() {
    return userAgent;
  }

  /**
   * Builder for ClientOptions.
   */
  public static class Builder {
    private static final Logger logger = LoggerFactory.getLogger(ClientOptions.class);

    private Duration connectTimeout;
    private Duration requestTimeout;
    private String userAgent = DEFAULT_USER_AGENT;

    Builder(Function<String, String> env) {
      this.connectTimeout = durationFromEnv(env, CONNECT_TIMEOUT_ENV);
      if (this.connectTimeout == null) {
        this.connectTimeout = DEFAULT_CONNECT_TIMEOUT;
      }
      this.requestTimeout = durationFromEnv(env, REQUEST_TIMEOUT_ENV);
    }

    private static Duration durationFromEnv(Function<String, String> env, String name) {
      String value = env.apply(name);
      if (value == null || value.isBlank()) {
        return null;
      }
      try {
        long millis = Long.parseLong(value.trim());
        if (millis > 0) {
          return Duration.ofMillis(millis);
        }
      } catch (NumberFormatException e) {
        logger.warn("Ignoring {}={}: not a number", name, value);
        return null;
      }
      logger.warn("Ignoring {}={}: must be positive", name, value);
      return null;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout == null ? null : requirePositive(requestTimeout, "requestTimeout");
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    private static Duration requirePositive(Duration duration, String name) {
      Objects.requireNonNull(duration, name);
      if (duration.isNegative() || duration.isZero()) {
        throw new IllegalArgumentException(name + " must be positive: " + duration);
      }
      return duration;
    }

    public ClientOptions build() {
      return new ClientOptions(this);
    }
  }
}
