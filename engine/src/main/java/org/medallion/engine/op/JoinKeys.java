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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes join key values so that numerically equal keys of different
 * Java types (an {@code Integer} from one table, a {@code Long} from another)
 * match.
 */
final class JoinKeys {

  private JoinKeys() {
  }

  /**
   * Returns the normalized key, or null if any component is null.
   */
  static @Nullable List<Object> normalize(List<@Nullable Object> key) {
    List<Object> normalized = new ArrayList<>(key.size());
    for (Object value : key) {
      if (value == null) {
        return null;
      }
      normalized.add(normalizeValue(value));
    }
    return normalized;
  }

  private static Object normalizeValue(Object value) {
    if ((value instanceof Double && !Double.isFinite((Double) value))
        || (value instanceof Float && !Float.isFinite((Float) value))) {
      return value;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Double || value instanceof Float || value instanceof BigDecimal
        || value instanceof BigInteger) {
      BigDecimal decimal = value instanceof BigDecimal ? (BigDecimal) value
          : value instanceof BigInteger ? new BigDecimal((BigInteger) value)
          : BigDecimal.valueOf(((Number) value).doubleValue());
      decimal = decimal.stripTrailingZeros();
      if (decimal.scale() <= 0 && decimal.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
          && decimal.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
        return decimal.longValueExact();
      }
      return decimal;
    }
    return value;
  }
}
