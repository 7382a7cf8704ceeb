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

import org.medallion.engine.config.PipelineConfig;
import org.medallion.engine.config.TargetTableConfig;
import org.medallion.engine.config.ValidationConfig;
import org.medallion.engine.graph.DependencyGraph;
import org.medallion.engine.graph.DependencyGraphBuilder;
import org.medallion.engine.registry.Registries;
import org.medallion.engine.validation.BoundValidation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a pipeline configuration into an {@link ExecutionPlan}.
 *
 * <p>Compilation binds every operation, parser and validation against the
 * registries, builds and orders each target's dependency graph, and seals
 * the registries once it succeeds. It reads no data; any error aborts the
 * whole pipeline.
 */
public class PipelineCompiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineCompiler.class);

  private final Registries registries;
  private final ExecutionPlanner planner = new ExecutionPlanner();

  public PipelineCompiler(Registries registries) {
    this.registries = registries;
  }

  /**
   * Compiles a pipeline.
   *
   * @param pipeline Parsed configuration
   * @return Execution plan
   * @throws org.medallion.engine.config.ConfigException If the pipeline is invalid,
   *     references unknown registry names, or contains a cycle
   */
  public ExecutionPlan compile(PipelineConfig pipeline) {
    long startTime = System.currentTimeMillis();
    DependencyGraphBuilder builder = new DependencyGraphBuilder(pipeline, registries);
    builder.bindAll();

    List<TablePlan> tables = new ArrayList<>();
    for (TargetTableConfig target : pipeline.getTargetTables()) {
      List<BoundValidation> validations = new ArrayList<>();
      for (ValidationConfig validation : target.getValidations()) {
        validations.add(registries.getValidations().bind(validation));
      }
      DependencyGraph graph = builder.build(target);
      tables.add(planner.plan(graph, validations));
    }
    ExecutionPlan plan = new ExecutionPlan(pipeline, planner.planSources(pipeline, tables),
        tables);

    registries.seal();
    LOGGER.info("Compiled pipeline '{}' in {}ms: {} source tables, {} target tables",
        pipeline.getName(), System.currentTimeMillis() - startTime, plan.getSources().size(),
        tables.size());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Execution plan:\n{}", plan.describe());
    }
    return plan;
  }
}
