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
package org.medallion.engine.validation;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The validations every engine provides, by registered name.
 *
 * <p>Apart from {@code not_null}, the built-ins pass null values; combine
 * them with {@code not_null} to reject nulls.
 *
 * <pre>{@code
 * validation:
 *   - {field: question_id, op: not_null, action: fail}
 *   - {field: score, op: range, parameters: {min: 0, max: 100}, action: drop}
 *   - {field: email, op: regex, parameters: {pattern: "^[^@]+@[^@]+$"}, action: quarantine}
 *   - {field: status, op: allowed_values, parameters: {values: [open, closed]}, action: drop}
 *   - {field: answer_score, op: custom_validation, validation: valid_score, action: drop}
 * }</pre>
 */
public final class BuiltinValidations {

  public static final String CUSTOM_VALIDATION = "custom_validation";

  private BuiltinValidations() {
  }

  public static Map<String, ValidationFunction> all() {
    return ImmutableMap.<String, ValidationFunction>builder()
        .put("not_null", (value, params) -> value != null)
        .put("range", new RangeValidation())
        .put("regex", new RegexValidation())
        .put("allowed_values", new AllowedValuesValidation())
        .put(CUSTOM_VALIDATION, (value, params) -> {
          throw new IllegalStateException(
              "custom_validation is resolved to the validation it names at compile time");
        })
        .build();
  }

  /** {@code range}: {@code min} and/or {@code max}, inclusive unless {@code exclusive: true}. */
  private static class RangeValidation implements ValidationFunction {
    @Override public boolean test(@Nullable Object value, Map<String, Object> params) {
      if (value == null) {
        return true;
      }
      BigDecimal number = toNumber(value);
      if (number == null) {
        return false;
      }
      boolean exclusive = Boolean.TRUE.equals(params.get("exclusive"));
      BigDecimal min = toNumber(params.get("min"));
      BigDecimal max = toNumber(params.get("max"));
      if (min != null) {
        int c = number.compareTo(min);
        if (c < 0 || (exclusive && c == 0)) {
          return false;
        }
      }
      if (max != null) {
        int c = number.compareTo(max);
        if (c > 0 || (exclusive && c == 0)) {
          return false;
        }
      }
      return true;
    }

    @Override public void checkParameters(Map<String, Object> params) {
      for (String key : params.keySet()) {
        if (!key.equals("min") && !key.equals("max") && !key.equals("exclusive")) {
          throw new IllegalArgumentException("unknown parameter '" + key
              + "' for range; expected min, max or exclusive");
        }
      }
      if (!params.containsKey("min") && !params.containsKey("max")) {
        throw new IllegalArgumentException("range requires 'min' or 'max'");
      }
      for (String key : new String[] {"min", "max"}) {
        if (params.containsKey(key) && toNumber(params.get(key)) == null) {
          throw new IllegalArgumentException("range '" + key + "' must be a number");
        }
      }
    }

    private static @Nullable BigDecimal toNumber(@Nullable Object value) {
      if (value instanceof BigDecimal) {
        return (BigDecimal) value;
      }
      if (value instanceof Integer || value instanceof Long || value instanceof Short) {
        return BigDecimal.valueOf(((Number) value).longValue());
      }
      if (value instanceof Number && Double.isFinite(((Number) value).doubleValue())) {
        return BigDecimal.valueOf(((Number) value).doubleValue());
      }
      if (value instanceof String) {
        try {
          return new BigDecimal(((String) value).trim());
        } catch (NumberFormatException e) {
          return null;
        }
      }
      return null;
    }
  }

  /** {@code regex}: the whole string value must match {@code pattern}. */
  private static class RegexValidation implements ValidationFunction {
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    @Override public boolean test(@Nullable Object value, Map<String, Object> params) {
      if (value == null) {
        return true;
      }
      Pattern pattern = patterns.computeIfAbsent((String) params.get("pattern"), Pattern::compile);
      return pattern.matcher(value.toString()).matches();
    }

    @Override public void checkParameters(Map<String, Object> params) {
      Object pattern = params.get("pattern");
      if (!(pattern instanceof String)) {
        throw new IllegalArgumentException("regex requires a string 'pattern'");
      }
      try {
        Pattern.compile((String) pattern);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("invalid pattern: " + e.getDescription(), e);
      }
    }
  }

  /** {@code allowed_values}: the value must equal one of {@code values}. */
  private static class AllowedValuesValidation implements ValidationFunction {
    @Override public boolean test(@Nullable Object value, Map<String, Object> params) {
      if (value == null) {
        return true;
      }
      for (Object allowed : (Collection<?>) params.get("values")) {
        if (Objects.equals(allowed, value)
            || (allowed != null && allowed.toString().equals(value.toString()))) {
          return true;
        }
      }
      return false;
    }

    @Override public void checkParameters(Map<String, Object> params) {
      if (!(params.get("values") instanceof Collection)) {
        throw new IllegalArgumentException("allowed_values requires a list 'values'");
      }
    }
  }
}
