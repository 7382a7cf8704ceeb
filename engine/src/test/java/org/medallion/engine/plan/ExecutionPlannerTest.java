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
package org.medallion.engine.plan;

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.PipelineConfig;
import org.medallion.engine.config.PipelineConfigParser;
import org.medallion.engine.config.ValidationAction;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.registry.Registries;
import org.medallion.engine.registry.RegistrySealedException;
import org.medallion.engine.registry.UnknownValidationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ExecutionPlanner} and {@link PipelineCompiler}.
 */
@Tag("unit")
public class ExecutionPlannerTest {

  private Registries registries;
  private PipelineConfig questions;

  @BeforeEach void setUp() throws IOException {
    registries = Registries.withBuiltins();
    registries.registerValidation("valid_score", (value, params) -> true);
    try (InputStream in = getClass().getResourceAsStream("/pipelines/questions.yaml")) {
      assertNotNull(in);
      questions = PipelineConfigParser.parse(in);
    }
  }

  private static List<String> names(TablePlan table) {
    List<String> names = new ArrayList<>();
    for (PlanNode node : table.getNodes()) {
      names.add(node.getNode().getName());
    }
    return names;
  }

  @Test void testOrderFollowsDependenciesThenDeclaration() {
    ExecutionPlan plan = new PipelineCompiler(registries).compile(questions);

    TablePlan table = plan.getTable("silver.questions");
    assertNotNull(table);
    assertEquals(Arrays.asList("tags_struct", "question_id", "title", "tags", "owner_name"),
        names(table));
  }

  @Test void testScopesAndSteps() {
    ExecutionPlan plan = new PipelineCompiler(registries).compile(questions);

    TablePlan answers = plan.getTable("silver.answers");
    assertNotNull(answers);
    assertEquals(Arrays.asList("question_id", "answers_struct", "answer_id", "answer_score",
        "author"), names(answers));
    List<PlanNode> nodes = answers.getNodes();
    assertEquals(Scope.root(), nodes.get(0).getScope());
    assertEquals(PlanNode.Step.EVALUATE, nodes.get(0).getStep());
    assertEquals(PlanNode.Step.EXPAND, nodes.get(1).getStep());
    assertEquals("answers_struct", nodes.get(1).getScope().toString());
    for (PlanNode node : nodes.subList(2, nodes.size())) {
      assertEquals(Collections.singletonList("answers_struct"), node.getScope().getLineage());
      assertEquals(PlanNode.Step.EVALUATE, node.getStep());
    }

    TablePlan questionsPlan = plan.getTable("silver.questions");
    PlanNode tags = questionsPlan.getNodes().get(0);
    assertEquals(PlanNode.Step.MATERIALIZED, tags.getStep());
    assertTrue(tags.getScope().isRoot());
    PlanNode owner = questionsPlan.getNodes().get(4);
    assertTrue(owner.getNode().isExplode());
    assertEquals(1, owner.getScope().getDepth());
  }

  @Test void testSourcePlans() {
    ExecutionPlan plan = new PipelineCompiler(registries).compile(questions);

    assertEquals(2, plan.getSources().size());
    SourcePlan source = plan.getSource("bronze.questions");
    assertNotNull(source);
    List<String> transients = new ArrayList<>();
    for (DagNode node : source.getTransients()) {
      transients.add(node.getName());
    }
    assertEquals(Arrays.asList("tags_struct", "answers_struct"), transients);
    SourcePlan users = plan.getSource("bronze.users");
    assertNotNull(users);
    assertTrue(users.getTransients().isEmpty());
    assertEquals(Collections.singleton("bronze.users"),
        plan.getTable("silver.questions").getLookupTables());
  }

  @Test void testErrorActionFollowsValidation() {
    ExecutionPlan plan = new PipelineCompiler(registries).compile(questions);
    TablePlan answers = plan.getTable("silver.answers");

    DagNode score = answers.getGraph().getNode("answer_score");
    DagNode author = answers.getGraph().getNode("author");
    assertEquals(ValidationAction.DROP, answers.getErrorAction(score));
    assertNull(answers.getErrorAction(author));
  }

  @Test void testDescribe() {
    ExecutionPlan plan = new PipelineCompiler(registries).compile(questions);

    String description = plan.describe();
    assertTrue(description.startsWith("pipeline stack_questions\n"), description);
    assertTrue(description.contains(
        "target silver.answers <- bronze.questions (merge on answer_id)"), description);
    assertTrue(description.contains("2. expand answers_struct"), description);
    assertTrue(description.contains("validate valid_score(answer_score) -> DROP"), description);
  }

  @Test void testCompileSealsRegistries() {
    new PipelineCompiler(registries).compile(questions);

    assertTrue(registries.isSealed());
    assertThrows(RegistrySealedException.class,
        () -> registries.registerValidation("late", (value, params) -> true));
  }

  @Test void testCompileRejectsUnknownValidation() {
    Registries builtins = Registries.withBuiltins();

    UnknownValidationException e = assertThrows(UnknownValidationException.class,
        () -> new PipelineCompiler(builtins).compile(questions));
    assertEquals("pipeline.target_tables[silver.answers].validation[0].validation", e.getPath());
    assertTrue(ConfigException.class.isInstance(e));
  }
}
