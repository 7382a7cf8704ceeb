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
package org.medallion.engine.graph;

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.PipelineConfig;
import org.medallion.engine.config.PipelineConfigParser;
import org.medallion.engine.registry.Registries;
import org.medallion.engine.registry.UnknownOperationException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DependencyGraphBuilder}.
 */
@Tag("unit")
public class DependencyGraphBuilderTest {

  private static PipelineConfig pipeline(String... lines) {
    return PipelineConfigParser.parse(String.join("\n", lines));
  }

  private static DependencyGraph build(PipelineConfig pipeline, String table) {
    DependencyGraphBuilder builder =
        new DependencyGraphBuilder(pipeline, Registries.withBuiltins());
    return builder.build(pipeline.getTargetTable(table));
  }

  @Test void testCycleIsReported() throws IOException {
    PipelineConfig pipeline;
    try (InputStream in = getClass().getResourceAsStream("/pipelines/cyclic.yaml")) {
      assertNotNull(in);
      pipeline = PipelineConfigParser.parse(in);
    }

    CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
        () -> build(pipeline, "silver.events"));

    assertEquals(Arrays.asList("a", "b", "c"), e.getCycle());
    assertEquals("cyclic dependency: a -> b -> c -> a", e.getReason());
    assertEquals("pipeline.target_tables[silver.events].columns[a]", e.getPath());
  }

  @Test void testCycleAmongUnusedTransientsIsReported() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables: [{name: src}]",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: id, op: copy, field: id}",
        "        - {name: x, op: copy, field: y, transient: true}",
        "        - {name: y, op: copy, field: x, transient: true}");

    CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
        () -> build(pipeline, "t"));
    assertEquals(Arrays.asList("x", "y"), e.getCycle());
  }

  @Test void testOnlyReachableTransientsBecomeNodes() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables:",
        "    - name: src",
        "      transients:",
        "        - {name: doc, op: parse_json, field: raw}",
        "        - {name: unused, op: parse_json, field: other}",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: kind, op: copy, field: doc.kind}",
        "        - {name: label, op: copy, field: kind_text, transient: true}",
        "        - {name: kind_text, op: cast, field: kind, transient: true,"
            + " parameters: {type: string}}");

    DependencyGraph graph = build(pipeline, "t");

    assertEquals(2, graph.getNodes().size());
    DagNode doc = graph.getNode("src::doc");
    assertNotNull(doc);
    assertEquals(DagNode.Kind.SOURCE_TRANSIENT, doc.getKind());
    assertEquals("src", doc.getTable());
    assertNull(graph.getNode("src::unused"));
    assertNull(graph.getNode("label"));

    DagNode kind = graph.getNode("kind");
    assertNotNull(kind);
    InputRef input = kind.getInputs().get(0);
    assertEquals(InputRef.Namespace.SOURCE_TRANSIENT, input.getNamespace());
    assertEquals("doc", input.getKey());
    assertEquals("kind", input.getPath().toString());
    assertEquals("src::doc", input.getProducer());
    assertEquals(Collections.singletonList(doc), graph.getProducers(kind));
    assertEquals(Collections.singletonList(kind), graph.getConsumers(doc));
  }

  @Test void testReferenceResolution() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables:",
        "    - name: src",
        "      transients:",
        "        - {name: total, op: cast, field: total, parameters: {type: long}}",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: id, op: copy, field: id}",
        "        - {name: raw_total, op: copy, field: src.total}",
        "        - {name: total, op: copy, field: total}",
        "        - {name: doubled, op: copy, field: total}");

    DependencyGraph graph = build(pipeline, "t");

    InputRef id = graph.getNode("id").getInputs().get(0);
    assertEquals(InputRef.Namespace.SOURCE_FIELD, id.getNamespace());
    assertNull(id.getProducer());
    InputRef raw = graph.getNode("raw_total").getInputs().get(0);
    assertEquals(InputRef.Namespace.SOURCE_FIELD, raw.getNamespace());
    assertEquals("total", raw.getKey());
    InputRef total = graph.getNode("total").getInputs().get(0);
    assertEquals(InputRef.Namespace.SOURCE_TRANSIENT, total.getNamespace());
    InputRef doubled = graph.getNode("doubled").getInputs().get(0);
    assertEquals(InputRef.Namespace.TARGET, doubled.getNamespace());
    assertEquals("total", doubled.getProducer());
  }

  @Test void testValidationFieldsJoinTheGraph() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables: [{name: src}]",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: id, op: copy, field: id}",
        "        - {name: score, op: cast, field: score, transient: true,"
            + " parameters: {type: int}}",
        "      validation:",
        "        - {field: score, op: not_null, action: drop}",
        "        - {field: status, op: not_null}");

    DependencyGraph graph = build(pipeline, "t");

    assertNotNull(graph.getNode("score"));
    assertEquals(2, graph.getValidationInputs().size());
    assertEquals("score", graph.getValidationInputs().get(0).getProducer());
    assertEquals(InputRef.Namespace.SOURCE_FIELD,
        graph.getValidationInputs().get(1).getNamespace());
  }

  @Test void testUndeclaredSourceColumnIsRejected() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables: [{name: users, columns: [user_id, name]}]",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: id, op: copy, field: user_id}",
        "        - {name: email, op: copy, field: email}");

    ConfigException e = assertThrows(ConfigException.class, () -> build(pipeline, "t"));

    assertEquals("pipeline.target_tables[t].columns[email]", e.getPath());
    assertTrue(e.getReason().contains("'email'"), e.getReason());
  }

  @Test void testJoinTableMustBeDeclared() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables: [{name: orders}]",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - name: customer",
        "          op: join",
        "          field: customers.name",
        "          join: [{table: customers, on: {customer_id: id}}]");

    ConfigException e = assertThrows(ConfigException.class, () -> build(pipeline, "t"));
    assertEquals("pipeline.target_tables[t].columns[customer].join", e.getPath());
  }

  @Test void testUnknownOperationIsRejected() {
    PipelineConfig pipeline = pipeline(
        "pipeline:",
        "  name: p",
        "  source_tables: [{name: src}]",
        "  target_tables:",
        "    - table: t",
        "      columns:",
        "        - {name: id, op: explode, field: id}");

    UnknownOperationException e = assertThrows(UnknownOperationException.class,
        () -> build(pipeline, "t"));
    assertEquals("pipeline.target_tables[t].columns[id].op", e.getPath());
  }
}
