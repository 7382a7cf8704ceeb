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
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.validation.BoundValidation;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * A compiled pipeline: what to materialize per source table, and the plan
 * of every target table in declaration order.
 */
public class ExecutionPlan {

  private final PipelineConfig pipeline;
  private final List<SourcePlan> sources;
  private final List<TablePlan> tables;

  ExecutionPlan(PipelineConfig pipeline, List<SourcePlan> sources, List<TablePlan> tables) {
    this.pipeline = pipeline;
    this.sources = ImmutableList.copyOf(sources);
    this.tables = ImmutableList.copyOf(tables);
  }

  public PipelineConfig getPipeline() {
    return pipeline;
  }

  /**
   * Returns the source tables read by the run, in declaration order.
   */
  public List<SourcePlan> getSources() {
    return sources;
  }

  public List<TablePlan> getTables() {
    return tables;
  }

  public @Nullable SourcePlan getSource(String table) {
    for (SourcePlan source : sources) {
      if (source.getTable().equals(table)) {
        return source;
      }
    }
    return null;
  }

  public @Nullable TablePlan getTable(String table) {
    for (TablePlan plan : tables) {
      if (plan.getTable().equals(table)) {
        return plan;
      }
    }
    return null;
  }

  /**
   * Renders the plan as text. Identical configurations render identically.
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("pipeline ").append(pipeline.getName()).append('\n');
    for (SourcePlan source : sources) {
      sb.append("source ").append(source.getTable()).append('\n');
      for (DagNode node : source.getTransients()) {
        sb.append("  ").append(node.isExplode() ? "cache " : "materialize ")
            .append(node).append('\n');
      }
    }
    for (TablePlan table : tables) {
      sb.append("target ").append(table.getTable())
          .append(" <- ").append(table.getSource().getName())
          .append(" (").append(table.getTarget().getMode().name().toLowerCase(Locale.ROOT));
      if (!table.getTarget().getMergeKey().isEmpty()) {
        sb.append(" on ").append(String.join(", ", table.getTarget().getMergeKey()));
      }
      sb.append(")\n");
      int step = 1;
      for (PlanNode node : table.getNodes()) {
        sb.append("  ").append(step++).append(". ").append(node).append('\n');
      }
      for (BoundValidation validation : table.getValidations()) {
        sb.append("  validate ").append(validation).append('\n');
      }
    }
    return sb.toString();
  }

  @Override public String toString() {
    return "ExecutionPlan{pipeline='" + pipeline.getName() + "', sources=" + sources.size()
        + ", tables=" + tables.size() + "}";
  }
}
