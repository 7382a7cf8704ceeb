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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PipelineConfigParser.
 */
@Tag("unit")
public class PipelineConfigParserTest {

  private static PipelineConfig load(String resource) throws IOException {
    try (InputStream in = PipelineConfigParserTest.class.getResourceAsStream(resource)) {
      assertNotNull(in, "missing test resource " + resource);
      return PipelineConfigParser.parse(in);
    }
  }

  @Test void testParseYamlDocument() throws IOException {
    PipelineConfig config = load("/pipelines/questions.yaml");

    assertEquals("stack_questions", config.getName());
    assertEquals(2, config.getSourceTables().size());
    assertEquals(2, config.getTargetTables().size());

    SourceTableConfig questions = config.getSourceTable("bronze.questions");
    assertNotNull(questions);
    assertEquals(2, questions.getTransients().size());
    FieldConfig answers = questions.getTransients().get(1);
    assertEquals("answers_struct", answers.getName());
    assertEquals("parse_and_flatten", answers.getOp());
    assertEquals("payload", answers.getField());
    assertTrue(answers.getPath().hasElements());
    assertEquals(3, answers.getSchema().size());
    assertEquals("author__name", answers.getSchema().get(2).getName());
    assertEquals(FieldType.Kind.INTEGER, answers.getSchema().get(0).getType().getKind());

    SourceTableConfig users = config.getSourceTable("bronze.users");
    assertNotNull(users);
    assertTrue(users.getTransients().isEmpty());
    assertFalse(users.isUndeclaredColumn("user_id"));
    assertTrue(users.isUndeclaredColumn("email"));
  }

  @Test void testParseTargetTables() throws IOException {
    PipelineConfig config = load("/pipelines/questions.yaml");

    TargetTableConfig questions = config.getTargetTable("silver.questions");
    assertNotNull(questions);
    assertEquals("One row per question", questions.getDescription());
    assertEquals(WriteMode.OVERWRITE, questions.getMode());
    assertTrue(questions.getMergeKey().isEmpty());
    FieldConfig owner = questions.getColumns().get(3);
    assertEquals("join", owner.getOp());
    assertEquals("bronze.users.display_name", owner.getField());
    assertEquals(1, owner.getJoins().size());
    assertEquals("bronze.users", owner.getJoins().get(0).getTable());
    assertEquals(Collections.singletonMap("owner_id", "user_id"),
        owner.getJoins().get(0).getOn());
    assertEquals("left", owner.getParameter("join_type"));

    TargetTableConfig answers = config.getTargetTable("silver.answers");
    assertNotNull(answers);
    assertEquals(WriteMode.MERGE, answers.getMode());
    assertEquals(Collections.singletonList("answer_id"), answers.getMergeKey());
    assertEquals(4, answers.getColumns().size());
    assertTrue(answers.getTransients().isEmpty());
    assertEquals(1, answers.getValidations().size());
    ValidationConfig validation = answers.getValidations().get(0);
    assertEquals("answer_score", validation.getField());
    assertEquals("custom_validation", validation.getOp());
    assertEquals("valid_score", validation.getValidation());
    assertEquals(ValidationAction.DROP, validation.getAction());
  }

  @Test void testParseJsonDocument(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("orders.json");
    try (InputStream in = getClass().getResourceAsStream("/pipelines/orders.json")) {
      assertNotNull(in);
      Files.copy(in, file);
    }

    PipelineConfig config = PipelineConfigParser.parse(file);

    assertEquals("orders", config.getName());
    Map<String, Object> settings = config.getSettings();
    assertEquals(2, settings.get("max_concurrency"));
    assertEquals("quarantine", settings.get("default_error_action"));
    TargetTableConfig orders = config.getTargetTables().get(0);
    assertEquals(WriteMode.APPEND, orders.getMode());
    assertNull(orders.getDefaultSource());
    assertEquals("bronze.orders", config.resolveDefaultSource(orders).getName());
    assertEquals("decimal(10,2)", orders.getColumns().get(1).getParameter("type"));
  }

  @Test void testTransientColumnsAreNotPersisted() throws IOException {
    PipelineConfig config = load("/pipelines/cyclic.yaml");
    TargetTableConfig events = config.getTargetTables().get(0);

    assertEquals(5, events.getFields().size());
    assertEquals(Arrays.asList("id", "total"), Arrays.asList(
        events.getColumns().get(0).getName(), events.getColumns().get(1).getName()));
    assertEquals(3, events.getTransients().size());
    assertEquals(WriteMode.OVERWRITE, events.getMode());
  }

  @Test void testUnknownKeyNamesPath() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - table: t\n"
            + "      columns:\n"
            + "        - {name: a, op: copy, field: a, colour: red}\n"));

    assertEquals("pipeline.target_tables[t].columns[a].colour", e.getPath());
    assertTrue(e.getMessage().contains("unknown key 'colour'"), e.getMessage());
  }

  @Test void testMissingOp() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - {table: t, columns: [{name: a, field: a}]}\n"));

    assertEquals("pipeline.target_tables[t].columns[a].op", e.getPath());
  }

  @Test void testMergeRequiresMergeKey() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - {table: t, mode: merge, columns: [{name: a, op: copy, field: a}]}\n"));

    assertTrue(e.getPath().endsWith(".merge_key"), e.getPath());
  }

  @Test void testMergeKeyMustBePersisted() {
    assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - table: t\n"
            + "      mode: merge\n"
            + "      merge_key: [b]\n"
            + "      columns:\n"
            + "        - {name: a, op: copy, field: a}\n"
            + "        - {name: b, op: copy, field: a, transient: true}\n"));
  }

  @Test void testDuplicateColumn() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - table: t\n"
            + "      columns:\n"
            + "        - {name: a, op: copy, field: a}\n"
            + "        - {name: a, op: copy, field: b}\n"));

    assertTrue(e.getMessage().contains("duplicate column 'a'"), e.getMessage());
  }

  @Test void testUnknownAction() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s}]\n"
            + "  target_tables:\n"
            + "    - table: t\n"
            + "      columns: [{name: a, op: copy, field: a}]\n"
            + "      validation: [{field: a, op: not_null, action: warn}]\n"));

    assertEquals("pipeline.target_tables[t].validation[0].action", e.getPath());
  }

  @Test void testSourceTransientCannotBePersisted() {
    ConfigException e = assertThrows(ConfigException.class, () -> PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables:\n"
            + "    - name: s\n"
            + "      transients: [{name: x, op: copy, field: a, transient: false}]\n"
            + "  target_tables:\n"
            + "    - {table: t, columns: [{name: a, op: copy, field: x}]}\n"));

    assertEquals("pipeline.source_tables[s].transients[0].transient", e.getPath());
  }

  @Test void testUnknownDefaultSource() {
    PipelineConfig config = PipelineConfigParser.parse(
        "pipeline:\n"
            + "  name: p\n"
            + "  source_tables: [{name: s1}, {name: s2}]\n"
            + "  target_tables:\n"
            + "    - {table: t, columns: [{name: a, op: copy, field: a}]}\n");

    ConfigException e = assertThrows(ConfigException.class,
        () -> config.resolveDefaultSource(config.getTargetTables().get(0)));
    assertTrue(e.getPath().endsWith(".default_source"), e.getPath());
  }

  @Test void testMalformedDocument() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> PipelineConfigParser.parse("pipeline: [unclosed"));
    assertEquals("pipeline", e.getPath());

    ConfigException unknown = assertThrows(ConfigException.class,
        () -> PipelineConfigParser.parse("{\"other\": 1}"));
    assertEquals("other", unknown.getPath());
  }
}
