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

import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.SourceTableConfig;
import org.medallion.engine.config.TargetTableConfig;
import org.medallion.engine.config.ValidationAction;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.graph.DependencyGraph;
import org.medallion.engine.graph.InputRef;
import org.medallion.engine.validation.BoundValidation;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Set;

/**
 * The ordered evaluation plan of one target table.
 */
public class TablePlan {

  private final DependencyGraph graph;
  private final List<PlanNode> nodes;
  private final List<BoundValidation> validations;

  TablePlan(DependencyGraph graph, List<PlanNode> nodes, List<BoundValidation> validations) {
    this.graph = graph;
    this.nodes = ImmutableList.copyOf(nodes);
    this.validations = ImmutableList.copyOf(validations);
  }

  public String getTable() {
    return graph.getTarget().getTable();
  }

  public TargetTableConfig getTarget() {
    return graph.getTarget();
  }

  public SourceTableConfig getSource() {
    return graph.getSource();
  }

  public DependencyGraph getGraph() {
    return graph;
  }

  /**
   * Returns the nodes in evaluation order.
   */
  public List<PlanNode> getNodes() {
    return nodes;
  }

  /**
   * Returns the persisted columns in output order.
   */
  public List<FieldConfig> getColumns() {
    return graph.getTarget().getColumns();
  }

  public List<BoundValidation> getValidations() {
    return validations;
  }

  /**
   * Returns the resolved field of each validation, aligned with
   * {@link #getValidations()}.
   */
  public List<InputRef> getValidationInputs() {
    return graph.getValidationInputs();
  }

  /**
   * Returns the source tables read by joins.
   */
  public Set<String> getLookupTables() {
    return graph.getLookupTables();
  }

  /**
   * Returns the action for rows whose derivation of a node fails: the
   * node's {@code on_error}, else the action of the first validation of
   * that field, else null to use the engine default.
   */
  public @Nullable ValidationAction getErrorAction(DagNode node) {
    if (node.getConfig().getOnError() != null) {
      return node.getConfig().getOnError();
    }
    List<InputRef> inputs = graph.getValidationInputs();
    for (int i = 0; i < inputs.size(); i++) {
      if (node.getId().equals(inputs.get(i).getProducer())) {
        return validations.get(i).getAction();
      }
    }
    return null;
  }

  @Override public String toString() {
    return "TablePlan{table='" + getTable() + "', nodes=" + nodes.size() + "}";
  }
}
