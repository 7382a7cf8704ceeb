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

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logical type of a field, as used by {@code cast} and by explicit parse schemas.
 *
 * <p>Type names are case-insensitive. Accepted spellings:
 * <ul>
 *   <li>{@code string}, {@code varchar}, {@code text}</li>
 *   <li>{@code integer}, {@code int}</li>
 *   <li>{@code long}, {@code bigint}</li>
 *   <li>{@code double}, {@code float}</li>
 *   <li>{@code decimal}, {@code decimal(p,s)}</li>
 *   <li>{@code boolean}, {@code bool}</li>
 *   <li>{@code date}, {@code timestamp}</li>
 *   <li>{@code array}, {@code object} (alias {@code struct})</li>
 * </ul>
 */
public final class FieldType {

  private static final Pattern DECIMAL =
      Pattern.compile("decimal\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

  /**
   * Kind of value a type describes.
   */
  public enum Kind {
    STRING, INTEGER, LONG, DOUBLE, DECIMAL, BOOLEAN, DATE, TIMESTAMP, ARRAY, OBJECT
  }

  private final Kind kind;
  private final int precision;
  private final int scale;

  private FieldType(Kind kind, int precision, int scale) {
    this.kind = kind;
    this.precision = precision;
    this.scale = scale;
  }

  public static FieldType of(Kind kind) {
    return new FieldType(kind, -1, -1);
  }

  public static FieldType decimal(int precision, int scale) {
    if (scale > precision) {
      throw new IllegalArgumentException("Decimal scale " + scale
          + " exceeds precision " + precision);
    }
    return new FieldType(Kind.DECIMAL, precision, scale);
  }

  /**
   * Parses a type name.
   *
   * @throws IllegalArgumentException if the name is not a known type
   */
  public static FieldType parse(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    Matcher matcher = DECIMAL.matcher(normalized);
    if (matcher.matches()) {
      return decimal(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }
    switch (normalized) {
      case "string":
      case "varchar":
      case "text":
        return of(Kind.STRING);
      case "integer":
      case "int":
        return of(Kind.INTEGER);
      case "long":
      case "bigint":
        return of(Kind.LONG);
      case "double":
      case "float":
        return of(Kind.DOUBLE);
      case "decimal":
        return of(Kind.DECIMAL);
      case "boolean":
      case "bool":
        return of(Kind.BOOLEAN);
      case "date":
        return of(Kind.DATE);
      case "timestamp":
        return of(Kind.TIMESTAMP);
      case "array":
        return of(Kind.ARRAY);
      case "object":
      case "struct":
        return of(Kind.OBJECT);
      default:
        throw new IllegalArgumentException("Unknown type '" + name + "'");
    }
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the decimal precision, or -1 when unbounded or not a decimal.
   */
  public int getPrecision() {
    return precision;
  }

  /**
   * Returns the decimal scale, or -1 when unbounded or not a decimal.
   */
  public int getScale() {
    return scale;
  }

  public boolean isNumeric() {
    return kind == Kind.INTEGER || kind == Kind.LONG || kind == Kind.DOUBLE
        || kind == Kind.DECIMAL;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldType)) {
      return false;
    }
    FieldType that = (FieldType) o;
    return kind == that.kind && precision == that.precision && scale == that.scale;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, precision, scale);
  }

  @Override public String toString() {
    String name = kind.name().toLowerCase(Locale.ROOT);
    return precision >= 0 ? name + "(" + precision + "," + scale + ")" : name;
  }
}
