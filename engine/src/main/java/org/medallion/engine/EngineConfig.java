/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.medallion.engine;

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.ValidationAction;

import java.util.Map;

/**
 * Runtime settings of the engine.
 *
 * <p>Settings come from {@link #builder()} or from the optional
 * {@code settings} block of a pipeline document, which overrides the
 * engine's own values for that pipeline:
 * <pre>{@code
 * pipeline:
 *   settings:
 *     max_concurrency: 4          # target tables evaluated in parallel
 *     invocation_timeout_ms: 5000 # per custom op / parser / validation call, 0 = none
 *     default_error_action: fail  # for row errors on fields without an action
 * }</pre>
 */
public class EngineConfig {

  public static final long DEFAULT_INVOCATION_TIMEOUT_MS = 30_000L;

  private final int maxConcurrency;
  private final long invocationTimeoutMs;
  private final ValidationAction defaultErrorAction;

  private EngineConfig(Builder builder) {
    this.maxConcurrency = builder.maxConcurrency;
    this.invocationTimeoutMs = builder.invocationTimeoutMs;
    this.defaultErrorAction = builder.defaultErrorAction;
  }

  public static EngineConfig defaults() {
    return builder().build();
  }

  /**
   * Returns the maximum number of target tables evaluated concurrently.
   */
  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  /**
   * Returns the timeout per custom operation, parser and validation
   * invocation in milliseconds; 0 means no timeout.
   */
  public long getInvocationTimeoutMs() {
    return invocationTimeoutMs;
  }

  /**
   * Returns the action for row-level errors (cast failures, custom operation
   * exceptions, timeouts) on fields that declare none.
   */
  public ValidationAction getDefaultErrorAction() {
    return defaultErrorAction;
  }

  /**
   * Returns a copy of this configuration overridden by a document's
   * {@code settings} block.
   *
   * @throws ConfigException If the block holds an unknown key or a bad value
   */
  public EngineConfig withSettings(Map<String, Object> settings) {
    Builder builder = toBuilder();
    for (Map.Entry<String, Object> entry : settings.entrySet()) {
      String path = "pipeline.settings." + entry.getKey();
      Object value = entry.getValue();
      switch (entry.getKey()) {
        case "max_concurrency":
          builder.maxConcurrency((int) positiveNumber(value, path));
          break;
        case "invocation_timeout_ms":
          if (!(value instanceof Integer || value instanceof Long)
              || ((Number) value).longValue() < 0) {
            throw new ConfigException("expected a non-negative integer", path);
          }
          builder.invocationTimeoutMs(((Number) value).longValue());
          break;
        case "default_error_action":
          try {
            builder.defaultErrorAction(ValidationAction.parse(String.valueOf(value)));
          } catch (IllegalArgumentException e) {
            throw new ConfigException("unknown action '" + value
                + "'; expected drop, quarantine or fail", path, e);
          }
          break;
        default:
          throw new ConfigException("unknown setting '" + entry.getKey() + "'", path);
      }
    }
    return builder.build();
  }

  private static long positiveNumber(Object value, String path) {
    if (!(value instanceof Integer || value instanceof Long) || ((Number) value).longValue() < 1) {
      throw new ConfigException("expected a positive integer", path);
    }
    return ((Number) value).longValue();
  }

  public Builder toBuilder() {
    return builder()
        .maxConcurrency(maxConcurrency)
        .invocationTimeoutMs(invocationTimeoutMs)
        .defaultErrorAction(defaultErrorAction);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "EngineConfig{maxConcurrency=" + maxConcurrency
        + ", invocationTimeoutMs=" + invocationTimeoutMs
        + ", defaultErrorAction=" + defaultErrorAction + "}";
  }

  /**
   * Builder for EngineConfig.
   */
  public static class Builder {
    private int maxConcurrency = Runtime.getRuntime().availableProcessors();
    private long invocationTimeoutMs = DEFAULT_INVOCATION_TIMEOUT_MS;
    private ValidationAction defaultErrorAction = ValidationAction.FAIL;

    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    public Builder invocationTimeoutMs(long invocationTimeoutMs) {
      this.invocationTimeoutMs = invocationTimeoutMs;
      return this;
    }

    public Builder defaultErrorAction(ValidationAction defaultErrorAction) {
      this.defaultErrorAction = defaultErrorAction;
      return this;
    }

    public EngineConfig build() {
      if (maxConcurrency < 1) {
        throw new IllegalArgumentException("maxConcurrency must be at least 1");
      }
      if (invocationTimeoutMs < 0) {
        throw new IllegalArgumentException("invocationTimeoutMs must not be negative");
      }
      return new EngineConfig(this);
    }
  }
}
