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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ValueCasts.
 */
@Tag("unit")
public class ValueCastsTest {

  private static final FieldType INTEGER = FieldType.of(FieldType.Kind.INTEGER);
  private static final FieldType LONG = FieldType.of(FieldType.Kind.LONG);
  private static final FieldType DOUBLE = FieldType.of(FieldType.Kind.DOUBLE);
  private static final FieldType STRING = FieldType.of(FieldType.Kind.STRING);
  private static final FieldType BOOLEAN = FieldType.of(FieldType.Kind.BOOLEAN);
  private static final FieldType DATE = FieldType.of(FieldType.Kind.DATE);
  private static final FieldType TIMESTAMP = FieldType.of(FieldType.Kind.TIMESTAMP);

  @Test void testNullStaysNull() {
    assertNull(ValueCasts.cast(null, INTEGER, true));
    assertNull(ValueCasts.cast(null, STRING, false));
  }

  @Test void testCastToOwnTypeIsIdentity() {
    Integer i = 42;
    Long l = 42L;
    Double d = 0.1;
    String s = "text";
    BigDecimal decimal = new BigDecimal("1.50");
    List<Object> array = Arrays.asList(1, "two");
    Map<String, Object> object = Collections.singletonMap("k", "v");
    LocalDate date = LocalDate.of(2024, 2, 29);

    assertSame(i, ValueCasts.cast(i, INTEGER, true));
    assertSame(l, ValueCasts.cast(l, LONG, true));
    assertSame(d, ValueCasts.cast(d, DOUBLE, true));
    assertSame(s, ValueCasts.cast(s, STRING, true));
    assertSame(decimal, ValueCasts.cast(decimal, FieldType.of(FieldType.Kind.DECIMAL), true));
    assertSame(array, ValueCasts.cast(array, FieldType.of(FieldType.Kind.ARRAY), true));
    assertSame(object, ValueCasts.cast(object, FieldType.of(FieldType.Kind.OBJECT), true));
    assertSame(date, ValueCasts.cast(date, DATE, true));
    assertSame(Boolean.TRUE, ValueCasts.cast(Boolean.TRUE, BOOLEAN, true));
  }

  @Test void testNumericCastTruncatesTowardZero() {
    assertEquals(3, ValueCasts.cast(3.9, INTEGER, false));
    assertEquals(-3, ValueCasts.cast(-3.9, INTEGER, false));
    assertEquals(12L, ValueCasts.cast("12.7", LONG, false));
    assertEquals(new BigDecimal("1.23"),
        ValueCasts.cast(new BigDecimal("1.239"), FieldType.decimal(10, 2), false));
  }

  @Test void testStrictCastRaisesOnPrecisionLoss() {
    CastException e = assertThrows(CastException.class,
        () -> ValueCasts.cast(3.5, INTEGER, true));
    assertTrue(e.getMessage().contains("fractional"), e.getMessage());

    assertThrows(CastException.class,
        () -> ValueCasts.cast(new BigDecimal("1.239"), FieldType.decimal(10, 2), true));
    assertEquals(4, ValueCasts.cast(4.0, INTEGER, true));
  }

  @Test void testOutOfRangeAlwaysRaises() {
    assertThrows(CastException.class, () -> ValueCasts.cast(3_000_000_000L, INTEGER, false));
    assertThrows(CastException.class,
        () -> ValueCasts.cast(new BigDecimal("123456789.5"), FieldType.decimal(5, 2), false));
  }

  @Test void testUnconvertibleInputRaises() {
    assertThrows(CastException.class, () -> ValueCasts.cast("abc", INTEGER, false));
    assertThrows(CastException.class, () -> ValueCasts.cast("maybe", BOOLEAN, false));
    assertThrows(CastException.class,
        () -> ValueCasts.cast("x", FieldType.of(FieldType.Kind.ARRAY), false));
    assertThrows(CastException.class, () -> ValueCasts.cast(Double.NaN, LONG, false));
  }

  @Test void testStringCasts() {
    assertEquals("12", ValueCasts.cast(12, STRING, false));
    assertEquals("1.50", ValueCasts.cast(new BigDecimal("1.50"), STRING, false));
    assertEquals("{\"k\":[1,2]}",
        ValueCasts.cast(Collections.singletonMap("k", Arrays.asList(1, 2)), STRING, false));
  }

  @Test void testBooleanCasts() {
    assertEquals(Boolean.TRUE, ValueCasts.cast("Yes", BOOLEAN, false));
    assertEquals(Boolean.FALSE, ValueCasts.cast("0", BOOLEAN, false));
    assertEquals(Boolean.TRUE, ValueCasts.cast(1, BOOLEAN, false));
    assertThrows(CastException.class, () -> ValueCasts.cast(2, BOOLEAN, false));
  }

  @Test void testDoubleCasts() {
    assertEquals(2.5, ValueCasts.cast("2.5", DOUBLE, false));
    assertEquals(7.0, ValueCasts.cast(7, DOUBLE, true));
    assertTrue(Double.isNaN((Double) ValueCasts.cast("NaN", DOUBLE, false)));
  }

  @Test void testStrictDoubleCastKeepsSignificantDigits() {
    assertEquals(19.99, ValueCasts.cast("19.99", DOUBLE, true));
    assertEquals(0.1, ValueCasts.cast(new BigDecimal("0.1"), DOUBLE, true));
    assertThrows(CastException.class,
        () -> ValueCasts.cast(9007199254740993L, DOUBLE, true));
    assertEquals(9007199254740992.0, ValueCasts.cast(9007199254740993L, DOUBLE, false));
  }

  @Test void testDateCasts() {
    assertEquals(LocalDate.of(2024, 3, 1), ValueCasts.cast("2024-03-01", DATE, false));
    assertEquals(LocalDate.of(2024, 3, 1),
        ValueCasts.cast("2024-03-01T15:30:00Z", DATE, false));
    assertThrows(CastException.class,
        () -> ValueCasts.cast("2024-03-01T15:30:00Z", DATE, true));
    assertEquals(LocalDate.of(2024, 3, 1), ValueCasts.toDate("01/03/2024", DATE,
        DateTimeFormatter.ofPattern("dd/MM/yyyy"), false));
    assertThrows(CastException.class, () -> ValueCasts.cast("yesterday", DATE, false));
  }

  @Test void testTimestampCasts() {
    Instant expected = Instant.parse("2024-03-01T15:30:00Z");

    assertEquals(expected, ValueCasts.cast("2024-03-01T15:30:00Z", TIMESTAMP, false));
    assertSame(expected, ValueCasts.cast(expected, TIMESTAMP, false));
  }
}
