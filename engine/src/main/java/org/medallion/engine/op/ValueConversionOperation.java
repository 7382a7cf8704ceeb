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

import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.FieldType;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;

/**
 * The {@code value_conversion} operation: maps values through a lookup
 * table, or converts numbers linearly or between units.
 *
 * <h3>Value mapping</h3>
 * <pre>{@code
 * parameters:
 *   mapping: {Y: true, N: false}
 *   default: null        # for unmapped values; omit to pass them through
 * }</pre>
 *
 * <h3>Linear conversion</h3>
 * <pre>{@code
 * parameters: {factor: 100, offset: 0}
 * }</pre>
 *
 * <h3>Unit conversion</h3>
 * <pre>{@code
 * parameters:
 *   unit: {from: km, to: m}
 * }</pre>
 *
 * <p>Numeric results are {@code Double} for floating-point inputs and
 * {@code BigDecimal} otherwise. Null stays null.
 */
public class ValueConversionOperation implements Operation {

  private static final MathContext CONTEXT = MathContext.DECIMAL64;
  private static final FieldType DECIMAL = FieldType.of(FieldType.Kind.DECIMAL);

  /** Linear units by name: dimension and size in the dimension's base unit. */
  private static final Map<String, Unit> UNITS = ImmutableMap.<String, Unit>builder()
      .put("mm", new Unit("length", "0.001"))
      .put("cm", new Unit("length", "0.01"))
      .put("m", new Unit("length", "1"))
      .put("km", new Unit("length", "1000"))
      .put("in", new Unit("length", "0.0254"))
      .put("ft", new Unit("length", "0.3048"))
      .put("yd", new Unit("length", "0.9144"))
      .put("mi", new Unit("length", "1609.344"))
      .put("mg", new Unit("mass", "0.000001"))
      .put("g", new Unit("mass", "0.001"))
      .put("kg", new Unit("mass", "1"))
      .put("t", new Unit("mass", "1000"))
      .put("oz", new Unit("mass", "0.028349523125"))
      .put("lb", new Unit("mass", "0.45359237"))
      .put("ms", new Unit("time", "0.001"))
      .put("s", new Unit("time", "1"))
      .put("min", new Unit("time", "60"))
      .put("h", new Unit("time", "3600"))
      .put("d", new Unit("time", "86400"))
      .put("b", new Unit("data", "1"))
      .put("kb", new Unit("data", "1024"))
      .put("mb", new Unit("data", "1048576"))
      .put("gb", new Unit("data", "1073741824"))
      .build();

  /** Temperature conversions as (factor, offset) pairs keyed "from>to". */
  private static final Map<String, BigDecimal[]> TEMPERATURES =
      ImmutableMap.<String, BigDecimal[]>builder()
          .put("c>f", pair("1.8", "32"))
          .put("f>c", new BigDecimal[] {
              new BigDecimal(5).divide(new BigDecimal(9), CONTEXT),
              new BigDecimal(-160).divide(new BigDecimal(9), CONTEXT)})
          .put("c>k", pair("1", "273.15"))
          .put("k>c", pair("1", "-273.15"))
          .put("f>k", new BigDecimal[] {
              new BigDecimal(5).divide(new BigDecimal(9), CONTEXT),
              new BigDecimal("2298.35").divide(new BigDecimal(9), CONTEXT)})
          .put("k>f", pair("1.8", "-459.67"))
          .build();

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    OperationParameters.requireSingleInput(field);
    OperationParameters params =
        OperationParameters.of(field, "mapping", "default", "factor", "offset", "unit");
    Map<String, Object> mapping = params.optMap("mapping");
    BigDecimal factor = params.optNumber("factor");
    BigDecimal offset = params.optNumber("offset");
    Map<String, Object> unit = params.optMap("unit");

    if (mapping != null) {
      if (factor != null || offset != null || unit != null) {
        throw params.error("mapping", "mapping cannot be combined with factor, offset or unit");
      }
      boolean hasDefault = params.has("default");
      Object defaultValue = params.get("default");
      return new ElementwiseOperation(field) {
        @Override protected @Nullable Object convert(OperationContext context,
            @Nullable Object value) {
          String key = String.valueOf(value);
          if (mapping.containsKey(key)) {
            return mapping.get(key);
          }
          return hasDefault ? defaultValue : value;
        }
      };
    }
    if (params.has("default")) {
      throw params.error("default", "default applies only to a mapping");
    }

    if (unit != null) {
      if (factor != null || offset != null) {
        throw params.error("unit", "unit cannot be combined with factor or offset");
      }
      String from = unitName(params, unit, "from");
      String to = unitName(params, unit, "to");
      BigDecimal[] temperature = TEMPERATURES.get(from + ">" + to);
      if (temperature != null) {
        return linear(field, temperature[0], temperature[1]);
      }
      Unit fromUnit = UNITS.get(from);
      Unit toUnit = UNITS.get(to);
      if (fromUnit == null || toUnit == null) {
        throw params.error("unit", "unknown unit '" + (fromUnit == null ? from : to)
            + "'; expected one of " + UNITS.keySet() + " or c, f, k");
      }
      if (!fromUnit.dimension.equals(toUnit.dimension)) {
        throw params.error("unit", "cannot convert " + fromUnit.dimension + " unit '" + from
            + "' to " + toUnit.dimension + " unit '" + to + "'");
      }
      return linear(field, fromUnit.size.divide(toUnit.size, CONTEXT), BigDecimal.ZERO);
    }

    if (factor == null && offset == null) {
      throw params.error("mapping", "value_conversion needs a mapping, factor, offset or unit");
    }
    return linear(field, factor != null ? factor : BigDecimal.ONE,
        offset != null ? offset : BigDecimal.ZERO);
  }

  private static String unitName(OperationParameters params, Map<String, Object> unit,
      String key) {
    Object name = unit.get(key);
    if (!(name instanceof String)) {
      throw params.error("unit", "unit requires '" + key + "'");
    }
    return ((String) name).toLowerCase(Locale.ROOT);
  }

  private static BoundOperation linear(FieldConfig field, BigDecimal factor, BigDecimal offset) {
    return new ElementwiseOperation(field) {
      @Override protected @Nullable Object convert(OperationContext context,
          @Nullable Object value) {
        if (value == null) {
          return null;
        }
        BigDecimal decimal = (BigDecimal) ValueCasts.cast(value, DECIMAL, false);
        BigDecimal result = decimal.multiply(factor, CONTEXT).add(offset, CONTEXT);
        if (value instanceof Double || value instanceof Float) {
          return result.doubleValue();
        }
        return result;
      }
    };
  }

  private static BigDecimal[] pair(String factor, String offset) {
    return new BigDecimal[] {new BigDecimal(factor), new BigDecimal(offset)};
  }

  /** A linear unit. */
  private static class Unit {
    final String dimension;
    final BigDecimal size;

    Unit(String dimension, String size) {
      this.dimension = dimension;
      this.size = new BigDecimal(size);
    }
  }
}
