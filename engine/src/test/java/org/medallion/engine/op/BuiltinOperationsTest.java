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
import org.medallion.engine.config.JoinConfig;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the built-in operations.
 */
@Tag("unit")
public class BuiltinOperationsTest {

  private static final Map<String, List<Map<String, Object>>> TABLES = ImmutableMap.of(
      "users", ImmutableList.of(
          ImmutableMap.of("user_id", 1, "name", "ann", "team", 10),
          ImmutableMap.of("user_id", 2, "name", "bob", "team", 20),
          ImmutableMap.of("user_id", 2, "name", "bobby", "team", 20)),
      "teams", ImmutableList.of(
          ImmutableMap.of("team_id", 10, "label", "core")));

  private final Map<String, Operation> operations = new HashMap<>(BuiltinOperations.all());

  private BoundOperation bind(FieldConfig field) {
    return operations.get(field.getOp()).bind(field, (name, location) -> {
      Operation operation = operations.get(name);
      if (operation == null) {
        throw new ConfigException("unknown operation '" + name + "'", location);
      }
      return operation;
    });
  }

  private static Object apply(BoundOperation operation, Object input) throws Exception {
    List<Object> inputs = new ArrayList<>();
    inputs.add(input);
    return operation.apply(context(operation.getField()), inputs);
  }

  private static OperationContext context(FieldConfig field) {
    return OperationContext.builder()
        .tableName("t")
        .field(field)
        .parser("json", StructuredTextParsers.json())
        .tables(TABLES::get)
        .build();
  }

  private static FieldConfig.Builder field(String op, String input) {
    return FieldConfig.builder().name("out").op(op).field(input);
  }

  @Test void testCopy() throws Exception {
    BoundOperation copy = bind(field("copy", "a").build());
    List<String> tags = Arrays.asList("x", "y", "z");

    assertEquals(Cardinality.ONE_TO_ONE, copy.getCardinality());
    assertEquals(Collections.singletonList("a"), copy.getInputs());
    assertEquals(tags, apply(copy, tags));
    assertNull(apply(copy, null));
  }

  @Test void testCopyWithElementsPathExplodes() throws Exception {
    BoundOperation copy = bind(field("copy", "doc").path("items[].id").build());

    assertEquals(Cardinality.ONE_TO_MANY, copy.getCardinality());
    Map<String, Object> doc = ImmutableMap.of("items", Arrays.asList(
        ImmutableMap.of("id", 1), ImmutableMap.of("id", 2)));
    assertEquals(Arrays.asList(1, 2), apply(copy, doc));
  }

  @Test void testRenameRejectsSameName() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> bind(FieldConfig.builder().name("a").op("rename").field("a").build()));
    assertEquals("a.name", e.getPath());

    BoundOperation rename = bind(field("rename", "a").build());
    assertEquals(Cardinality.ONE_TO_ONE, rename.getCardinality());
  }

  @Test void testOperationsRejectUnknownParameters() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> bind(field("copy", "a").parameter("typo", 1).build()));

    assertEquals("out.parameters.typo", e.getPath());
  }

  @Test void testCast() throws Exception {
    BoundOperation cast = bind(field("cast", "a").parameter("type", "int").build());

    assertEquals(12, apply(cast, "12.9"));
    assertThrows(CastException.class, () -> apply(cast, "twelve"));

    BoundOperation strict = bind(field("cast", "a").parameter("type", "int")
        .parameter("strict", true).build());
    assertThrows(CastException.class, () -> apply(strict, "12.9"));
  }

  @Test void testCastRequiresKnownType() {
    ConfigException missing = assertThrows(ConfigException.class,
        () -> bind(field("cast", "a").build()));
    assertEquals("out.parameters.type", missing.getPath());

    ConfigException unknown = assertThrows(ConfigException.class,
        () -> bind(field("cast", "a").parameter("type", "uuid").build()));
    assertEquals("out.parameters.type", unknown.getPath());
  }

  @Test void testCastTakesOneField() {
    ConfigException e = assertThrows(ConfigException.class, () -> bind(FieldConfig.builder()
        .name("out").op("cast").fields(Arrays.asList("a", "b")).parameter("type", "int")
        .build()));

    assertEquals("out.fields", e.getPath());
  }

  @Test void testDate() throws Exception {
    BoundOperation iso = bind(field("date", "a").build());
    BoundOperation pattern = bind(field("date", "a").parameter("format", "dd/MM/yyyy").build());

    assertEquals(LocalDate.of(2024, 5, 17), apply(iso, "2024-05-17"));
    assertEquals(LocalDate.of(2024, 5, 17), apply(pattern, "17/05/2024"));
    assertThrows(CastException.class, () -> apply(pattern, "2024-05-17"));
    assertThrows(ConfigException.class,
        () -> bind(field("date", "a").parameter("format", "qqqqq{").build()));
  }

  @Test void testValueConversionMapping() throws Exception {
    Map<String, Object> mapping = ImmutableMap.of("O", "open", "C", "closed");
    BoundOperation withDefault = bind(field("value_conversion", "a")
        .parameter("mapping", mapping).parameter("default", "unknown").build());
    BoundOperation withoutDefault = bind(field("value_conversion", "a")
        .parameter("mapping", mapping).build());

    assertEquals("open", apply(withDefault, "O"));
    assertEquals("unknown", apply(withDefault, "X"));
    assertEquals("X", apply(withoutDefault, "X"));
  }

  @Test void testValueConversionFactorAndOffset() throws Exception {
    BoundOperation linear = bind(field("value_conversion", "a")
        .parameter("factor", 2).parameter("offset", 1).build());

    assertEquals(0, new BigDecimal("21").compareTo((BigDecimal) apply(linear, 10)));
    assertEquals(4.0, apply(linear, 1.5));
    assertNull(apply(linear, null));
  }

  @Test void testValueConversionUnits() throws Exception {
    BoundOperation meters = bind(field("value_conversion", "a")
        .parameter("unit", ImmutableMap.of("from", "km", "to", "m")).build());
    BoundOperation fahrenheit = bind(field("value_conversion", "a")
        .parameter("unit", ImmutableMap.of("from", "C", "to", "F")).build());

    assertEquals(0, new BigDecimal("2500").compareTo((BigDecimal) apply(meters, "2.5")));
    assertEquals(0, new BigDecimal("212").compareTo((BigDecimal) apply(fahrenheit, 100)));
  }

  @Test void testValueConversionRejectsBadParameters() {
    assertThrows(ConfigException.class, () -> bind(field("value_conversion", "a")
        .parameter("unit", ImmutableMap.of("from", "km", "to", "kg")).build()));
    assertThrows(ConfigException.class, () -> bind(field("value_conversion", "a")
        .parameter("unit", ImmutableMap.of("from", "km", "to", "parsec")).build()));
    assertThrows(ConfigException.class, () -> bind(field("value_conversion", "a")
        .parameter("mapping", ImmutableMap.of("a", "b")).parameter("factor", 2).build()));
    assertThrows(ConfigException.class, () -> bind(field("value_conversion", "a").build()));
  }

  @Test void testParseJson() throws Exception {
    BoundOperation parse = bind(field("parse_json", "doc").build());

    assertEquals("json", parse.getParserName());
    Object decoded = apply(parse, "{\"a\": {\"b\": [1, 2]}}");
    assertEquals(ImmutableMap.of("a", ImmutableMap.of("b", Arrays.asList(1, 2))), decoded);

    Map<String, Object> structured = ImmutableMap.of("a", 1);
    assertEquals(structured, apply(parse, structured));
    assertNull(apply(parse, null));
  }

  @Test void testParseJsonWithPath() throws Exception {
    BoundOperation nested = bind(field("parse_json", "doc").path("a.b").build());
    BoundOperation exploded = bind(field("parse_json", "doc").path("a.b[]").build());

    assertEquals(Cardinality.ONE_TO_ONE, nested.getCardinality());
    assertEquals(Cardinality.ONE_TO_MANY, exploded.getCardinality());
    assertEquals(Arrays.asList(1, 2), apply(nested, "{\"a\": {\"b\": [1, 2]}}"));
    assertEquals(Arrays.asList(1, 2), apply(exploded, "{\"a\": {\"b\": [1, 2]}}"));
    assertEquals(Collections.emptyList(), apply(exploded, "{\"a\": {}}"));
  }

  @Test void testParseJsonSchemaProjection() throws Exception {
    BoundOperation parse = bind(field("parse_json", "doc").path("[]")
        .schemaField("id", "int").schemaField("missing", "string").build());

    Object rows = apply(parse, "[{\"x\": true, \"id\": \"7\"}]");

    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("id", 7);
    expected.put("missing", null);
    assertEquals(Collections.singletonList(expected), rows);
    assertEquals(Arrays.asList("id", "missing"),
        new ArrayList<>(((Map<?, ?>) ((List<?>) rows).get(0)).keySet()));
    assertThrows(CastException.class, () -> apply(parse, "[1]"));
  }

  @Test void testParseJsonMalformedInputFails() {
    BoundOperation parse = bind(field("parse_json", "doc").build());

    assertThrows(Exception.class, () -> apply(parse, "{not json"));
  }

  @Test void testParseAndFlatten() throws Exception {
    BoundOperation flatten = bind(field("parse_and_flatten", "doc").build());
    BoundOperation dotted = bind(field("parse_and_flatten", "doc")
        .parameter("separator", ".").build());
    String doc = "{\"a\": {\"b\": 1, \"c\": {\"d\": 2}}, \"e\": {}, \"f\": [1]}";

    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("a__b", 1);
    expected.put("a__c__d", 2);
    expected.put("f", Collections.singletonList(1));
    assertEquals(expected, apply(flatten, doc));
    assertTrue(((Map<?, ?>) apply(dotted, doc)).containsKey("a.c.d"));
  }

  @Test void testJoin() throws Exception {
    BoundOperation join = bind(field("join", "users.name")
        .join(new JoinConfig("users", ImmutableMap.of("owner_id", "user_id"))).build());

    assertEquals(Cardinality.ONE_TO_MANY, join.getCardinality());
    assertEquals(Collections.singletonList("owner_id"), join.getInputs());
    assertEquals(Collections.singletonList("users"), join.getLookupTables());
    assertEquals(Collections.singletonList("ann"), apply(join, 1L));
    assertEquals(Arrays.asList("bob", "bobby"), apply(join, 2));
    assertEquals(Collections.emptyList(), apply(join, 3));
    assertEquals(Collections.emptyList(), apply(join, null));
  }

  @Test void testLeftJoinKeepsUnmatchedRows() throws Exception {
    BoundOperation join = bind(field("join", "users")
        .join(new JoinConfig("users", ImmutableMap.of("owner_id", "users.user_id")))
        .parameter("join_type", "left").build());

    List<?> matched = (List<?>) apply(join, 1);
    assertEquals(1, matched.size());
    assertEquals("ann", ((Map<?, ?>) matched.get(0)).get("name"));
    assertEquals(Collections.singletonList(null), apply(join, 3));
  }

  @Test void testChainedJoin() throws Exception {
    BoundOperation join = bind(field("join", "teams.label")
        .join(new JoinConfig("users", ImmutableMap.of("owner_id", "user_id")))
        .join(new JoinConfig("teams", ImmutableMap.of("users.team", "team_id"))).build());

    assertEquals(Collections.singletonList("owner_id"), join.getInputs());
    assertEquals(Arrays.asList("users", "teams"), join.getLookupTables());
    assertEquals(Collections.singletonList("core"), apply(join, 1));
    assertEquals(Collections.emptyList(), apply(join, 2));
  }

  @Test void testJoinValidation() {
    assertThrows(ConfigException.class, () -> bind(field("join", "users.name").build()));
    assertThrows(ConfigException.class, () -> bind(field("join", "orders.total")
        .join(new JoinConfig("users", ImmutableMap.of("owner_id", "user_id"))).build()));
    assertThrows(ConfigException.class, () -> bind(field("join", "users.name")
        .join(new JoinConfig("users", ImmutableMap.of("owner_id", "user_id")))
        .parameter("join_type", "outer").build()));
  }

  @Test void testCustomOpDispatch() throws Exception {
    operations.put("shout", new CustomOperation("shout", (values, params) -> {
      assertFalse(params.containsKey("operation"));
      return values.get(0).toString().toUpperCase() + params.get("suffix");
    }));
    BoundOperation direct = bind(field("shout", "a").parameter("suffix", "?").build());
    BoundOperation dispatched = bind(field("custom_op", "a")
        .parameter("operation", "shout").parameter("suffix", "!").build());

    assertTrue(direct.isUserCode());
    assertEquals(Cardinality.ONE_TO_ONE, dispatched.getCardinality());
    assertEquals("HI?", apply(direct, "hi"));
    assertEquals("HI!", apply(dispatched, "hi"));
  }

  @Test void testCustomOpDispatchRequiresCustomOperation() {
    ConfigException builtin = assertThrows(ConfigException.class, () -> bind(
        field("custom_op", "a").parameter("operation", "copy").build()));
    assertEquals("out.parameters.operation", builtin.getPath());

    assertThrows(ConfigException.class, () -> bind(field("custom_op", "a").build()));
    assertThrows(ConfigException.class, () -> bind(
        field("custom_op", "a").parameter("operation", "nope").build()));
  }
}
