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
package org.medallion.engine.config;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of one validation rule of a target table.
 *
 * <pre>{@code
 * validation:
 *   - field: answer_score
 *     op: custom_validation
 *     validation: valid_score
 *     action: drop
 *   - field: email
 *     op: regex
 *     parameters: {pattern: "^[^@]+@[^@]+$"}
 *     action: quarantine
 * }</pre>
 *
 * <p>{@code op} names a validation in the validation registry. The special
 * op {@code custom_validation} dispatches to the registered validation named
 * by {@code validation}. The action defaults to {@code fail}.
 */
public class ValidationConfig {

  private final String field;
  private final String op;
  private final @Nullable String validation;
  private final ValidationAction action;
  private final Map<String, Object> parameters;
  private final String location;

  private ValidationConfig(Builder builder) {
    this.field = builder.field;
    this.op = builder.op;
    this.validation = builder.validation;
    this.action = builder.action != null ? builder.action : ValidationAction.FAIL;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    this.location = builder.location != null ? builder.location : builder.field + "." + builder.op;
  }

  /**
   * Returns the validated field reference.
   */
  public String getField() {
    return field;
  }

  public String getOp() {
    return op;
  }

  /**
   * Returns the registered validation invoked by {@code custom_validation}, or null.
   */
  public @Nullable String getValidation() {
    return validation;
  }

  public ValidationAction getAction() {
    return action;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  /**
   * Returns the name reported in quarantine records and failures: the custom
   * validation name when present, otherwise the op.
   */
  public String getName() {
    return validation != null ? validation : op;
  }

  public String getLocation() {
    return location;
  }

  public static Builder builder() {
    return new Builder();
  }

  static ValidationConfig fromMap(Object raw, String parentPath, int index) {
    ConfigReader reader = ConfigReader.of(raw, parentPath + "[" + index + "]");
    reader.allowKeys("field", "op", "validation", "action", "parameters", "params");
    Builder builder = builder()
        .location(reader.path())
        .field(reader.requireString("field"))
        .op(reader.requireString("op"))
        .validation(reader.optString("validation"))
        .parameters(reader.has("params")
            ? reader.optMap("params") : reader.optMap("parameters"));
    String action = reader.optString("action");
    if (action != null) {
      try {
        builder.action(ValidationAction.parse(action));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("unknown action '" + action
            + "'; expected drop, quarantine or fail", reader.path("action"), e);
      }
    }
    return builder.build();
  }

  @Override public String toString() {
    return "ValidationConfig{field='" + field + "', op='" + op + "'"
        + (validation != null ? ", validation='" + validation + "'" : "")
        + ", action=" + action + "}";
  }

  /**
   * Builder for ValidationConfig.
   */
  public static class Builder {
    private String field;
    private String op;
    private String validation;
    private ValidationAction action;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private String location;

    public Builder field(String field) {
      this.field = field;
      return this;
    }

    public Builder op(String op) {
      this.op = op;
      return this;
    }

    public Builder validation(String validation) {
      this.validation = validation;
      return this;
    }

    public Builder action(ValidationAction action) {
      this.action = action;
      return this;
    }

    public Builder parameters(Map<String, Object> parameters) {
      this.parameters.putAll(parameters);
      return this;
    }

    public Builder parameter(String key, Object value) {
      this.parameters.put(key, value);
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public ValidationConfig build() {
      if (field == null || field.isEmpty()) {
        throw new ConfigException("missing required key 'field'", location);
      }
      if (op == null || op.isEmpty()) {
        throw new ConfigException("missing required key 'op'", location);
      }
      return new ValidationConfig(this);
    }
  }
}
