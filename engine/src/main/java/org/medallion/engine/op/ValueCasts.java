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

import org.medallion.engine.config.FieldType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Value conversions shared by the {@code cast}, {@code date} and schema
 * projecting operations.
 *
 * <p>Java types used for each {@link FieldType.Kind}:
 * <ul>
 *   <li>STRING: {@link String}</li>
 *   <li>INTEGER: {@link Integer}; LONG: {@link Long}; DOUBLE: {@link Double}</li>
 *   <li>DECIMAL: {@link BigDecimal}</li>
 *   <li>BOOLEAN: {@link Boolean}</li>
 *   <li>DATE: {@link LocalDate}; TIMESTAMP: {@link Instant}</li>
 *   <li>ARRAY: {@link List}; OBJECT: {@link Map}</li>
 * </ul>
 *
 * <p>Numeric conversions truncate toward zero and never round. A strict
 * cast raises {@link CastException} instead of dropping a fractional part
 * or time of day. Values out of the target's range always raise. A value
 * already of the target type is returned unchanged.
 *
 * <p>A strict cast to DOUBLE raises only when significant digits are lost,
 * that is when the shortest decimal form of the nearest double differs
 * from the input's value. {@code "19.99"} casts to {@code 19.99} although
 * no double equals it exactly, while {@code 9007199254740993} raises.
 */
public final class ValueCasts {

  private static final ObjectMapper JSON = new ObjectMapper();

  private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
  private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private ValueCasts() {
  }

  /**
   * Converts a value to a type. Null stays null.
   *
   * @param value Value to convert
   * @param type Target type
   * @param strict Whether a lossy conversion raises instead of truncating
   * @throws CastException If the value cannot be converted
   */
  public static @Nullable Object cast(@Nullable Object value, FieldType type, boolean strict) {
    if (value == null) {
      return null;
    }
    switch (type.getKind()) {
      case STRING:
        return toText(value, type);
      case INTEGER:
        if (value instanceof Integer) {
          return value;
        }
        return integral(value, type, strict, INT_MIN, INT_MAX).intValueExact();
      case LONG:
        if (value instanceof Long) {
          return value;
        }
        return integral(value, type, strict, LONG_MIN, LONG_MAX).longValueExact();
      case DOUBLE:
        return toDouble(value, type, strict);
      case DECIMAL:
        return toDecimal(value, type, strict);
      case BOOLEAN:
        return toBoolean(value, type);
      case DATE:
        return toDate(value, type, null, strict);
      case TIMESTAMP:
        return toTimestamp(value, type);
      case ARRAY:
        if (value instanceof List) {
          return value;
        }
        throw new CastException(value, type, "not an array");
      case OBJECT:
        if (value instanceof Map) {
          return value;
        }
        throw new CastException(value, type, "not an object");
      default:
        throw new AssertionError(type);
    }
  }

  /**
   * Converts a value to a date, parsing text with an optional pattern.
   *
   * @param value Value to convert
   * @param type Type reported in errors
   * @param format Pattern for text values, or null for ISO-8601
   * @param strict Whether dropping a non-midnight time of day raises
   */
  public static @Nullable Object toDate(@Nullable Object value, FieldType type,
      @Nullable DateTimeFormatter format, boolean strict) {
    if (value == null || value instanceof LocalDate) {
      return value;
    }
    LocalDateTime dateTime;
    if (value instanceof LocalDateTime) {
      dateTime = (LocalDateTime) value;
    } else if (value instanceof Instant) {
      dateTime = LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
    } else if (value instanceof OffsetDateTime) {
      dateTime = ((OffsetDateTime) value).toLocalDateTime();
    } else if (value instanceof ZonedDateTime) {
      dateTime = ((ZonedDateTime) value).toLocalDateTime();
    } else if (value instanceof String) {
      String text = ((String) value).trim();
      try {
        if (format != null) {
          return LocalDate.parse(text, format);
        }
        if (text.length() == 10) {
          return LocalDate.parse(text);
        }
      } catch (DateTimeParseException e) {
        throw new CastException(value, type, "unparseable date", e);
      }
      dateTime = LocalDateTime.ofInstant(parseInstant(text, type), ZoneOffset.UTC);
    } else {
      throw new CastException(value, type, "unsupported source type");
    }
    if (strict && !dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)) {
      throw new CastException(value, type, "strict cast would drop the time of day");
    }
    return dateTime.toLocalDate();
  }

  private static String toText(Object value, FieldType type) {
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (value instanceof Map || value instanceof List) {
      try {
        return JSON.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new CastException(value, type, "not serializable", e);
      }
    }
    return value.toString();
  }

  private static BigDecimal integral(Object value, FieldType type, boolean strict,
      BigDecimal min, BigDecimal max) {
    BigDecimal decimal = numeric(value, type);
    BigDecimal truncated = decimal.setScale(0, RoundingMode.DOWN);
    if (strict && truncated.compareTo(decimal) != 0) {
      throw new CastException(value, type, "strict cast would drop the fractional part");
    }
    if (truncated.compareTo(min) < 0 || truncated.compareTo(max) > 0) {
      throw new CastException(value, type, "out of range");
    }
    return truncated;
  }

  private static Double toDouble(Object value, FieldType type, boolean strict) {
    if (value instanceof Double) {
      return (Double) value;
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      String lower = text.toLowerCase(Locale.ROOT);
      if (lower.equals("nan") || lower.equals("infinity") || lower.equals("-infinity")) {
        return Double.parseDouble(lower.equals("nan") ? "NaN"
            : lower.startsWith("-") ? "-Infinity" : "Infinity");
      }
    }
    BigDecimal decimal = numeric(value, type);
    double result = decimal.doubleValue();
    if (Double.isInfinite(result)) {
      throw new CastException(value, type, "out of range");
    }
    if (strict && BigDecimal.valueOf(result).compareTo(decimal) != 0) {
      throw new CastException(value, type, "strict cast would lose significant digits");
    }
    return result;
  }

  private static BigDecimal toDecimal(Object value, FieldType type, boolean strict) {
    BigDecimal decimal = numeric(value, type);
    if (type.getScale() < 0) {
      return decimal;
    }
    BigDecimal scaled = decimal.setScale(type.getScale(), RoundingMode.DOWN);
    if (strict && scaled.compareTo(decimal) != 0) {
      throw new CastException(value, type, "strict cast would drop digits beyond scale "
          + type.getScale());
    }
    if (type.getPrecision() > 0 && scaled.precision() - scaled.scale() > type.getPrecision()
        - type.getScale()) {
      throw new CastException(value, type, "out of range");
    }
    return scaled;
  }

  private static BigDecimal numeric(Object value, FieldType type) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d)) {
        throw new CastException(value, type, "not a finite number");
      }
      return BigDecimal.valueOf(d);
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? BigDecimal.ONE : BigDecimal.ZERO;
    }
    if (value instanceof String) {
      try {
        return new BigDecimal(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new CastException(value, type, "not a number", e);
      }
    }
    throw new CastException(value, type, "unsupported source type");
  }

  private static Boolean toBoolean(Object value, FieldType type) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      switch (((String) value).trim().toLowerCase(Locale.ROOT)) {
        case "true":
        case "yes":
        case "y":
        case "1":
          return Boolean.TRUE;
        case "false":
        case "no":
        case "n":
        case "0":
          return Boolean.FALSE;
        default:
          throw new CastException(value, type, "not a boolean");
      }
    }
    if (value instanceof Number) {
      BigDecimal decimal = numeric(value, type);
      if (decimal.compareTo(BigDecimal.ONE) == 0) {
        return Boolean.TRUE;
      }
      if (decimal.signum() == 0) {
        return Boolean.FALSE;
      }
    }
    throw new CastException(value, type, "not a boolean");
  }

  private static Instant toTimestamp(Object value, FieldType type) {
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof Integer || value instanceof Long) {
      return Instant.ofEpochMilli(((Number) value).longValue());
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if (text.length() == 10) {
        try {
          return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
          throw new CastException(value, type, "unparseable timestamp", e);
        }
      }
      return parseInstant(text, type);
    }
    throw new CastException(value, type, "unsupported source type");
  }

  private static Instant parseInstant(String text, FieldType type) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e2) {
        throw new CastException(text, type, "unparseable timestamp", e2);
      }
    }
  }
}
