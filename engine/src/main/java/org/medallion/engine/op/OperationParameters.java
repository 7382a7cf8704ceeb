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
package org.medallion.engine.op;

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.FieldConfig;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Typed access to the parameters block of a field while a built-in
 * operation binds, reporting problems with the parameter's document path.
 */
final class OperationParameters {

  private final FieldConfig field;

  private OperationParameters(FieldConfig field) {
    this.field = field;
  }

  /**
   * Returns parameters of a field, rejecting keys outside {@code allowed}.
   */
  static OperationParameters of(FieldConfig field, String... allowed) {
    Set<String> known = ImmutableSet.copyOf(allowed);
    for (String key : field.getParameters().keySet()) {
      if (!known.contains(key)) {
        throw new ConfigException("unknown parameter '" + key + "' for op '" + field.getOp()
            + "'; expected one of " + known, field.getLocation() + ".parameters." + key);
      }
    }
    return new OperationParameters(field);
  }

  boolean has(String key) {
    return field.getParameters().containsKey(key);
  }

  @Nullable Object get(String key) {
    return field.getParameter(key);
  }

  String requireString(String key) {
    String value = optString(key);
    if (value == null) {
      throw error(key, "missing required parameter '" + key + "' for op '" + field.getOp() + "'");
    }
    return value;
  }

  @Nullable String optString(String key) {
    Object value = get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw error(key, "expected a string");
    }
    return (String) value;
  }

  boolean optBoolean(String key, boolean defaultValue) {
    Object value = get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Boolean)) {
      throw error(key, "expected true or false");
    }
    return (Boolean) value;
  }

  @Nullable BigDecimal optNumber(String key) {
    Object value = get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Integer || value instanceof Long) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    }
    throw error(key, "expected a number");
  }

  @SuppressWarnings("unchecked")
  @Nullable Map<String, Object> optMap(String key) {
    Object value = get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw error(key, "expected a mapping");
    }
    return (Map<String, Object>) value;
  }

  ConfigException error(String key, String reason) {
    return new ConfigException(reason, field.getLocation() + ".parameters." + key);
  }

  /**
   * Fails unless the field has exactly one input reference.
   */
  static void requireSingleInput(FieldConfig field) {
    if (field.getFields().size() != 1) {
      throw new ConfigException("op '" + field.getOp() + "' takes exactly one field but found "
          + field.getFields().size(), field.getLocation() + ".fields");
    }
  }
}
