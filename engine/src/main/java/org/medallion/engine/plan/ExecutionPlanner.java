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
import org.medallion.engine.config.SourceTableConfig;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.graph.DependencyGraph;
import org.medallion.engine.graph.InputRef;
import org.medallion.engine.validation.BoundValidation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders dependency graphs into evaluation plans.
 *
 * <p>Each target graph is ordered topologically with Kahn's algorithm. Among
 * nodes ready at the same time the planner picks the shallowest scope
 * first, then the earliest declared, so plans are deterministic and every
 * node of a scope is evaluated before rows are exploded into a deeper one.
 *
 * <p>Source-level transients outside any explode scope are computed once
 * per run for all targets. An exploding one is cached with its unexploded
 * value and expanded in each target plan that uses it. Source-level
 * transients below an explode are evaluated per target.
 */
public class ExecutionPlanner {

  private static final Comparator<DagNode> DECLARATION_ORDER =
      Comparator.comparingInt(DagNode::getDeclarationIndex);

  /**
   * Plans one target table.
   *
   * @param graph Dependency graph of the target
   * @param validations Bound validations of the target, in declaration order
   */
  public TablePlan plan(DependencyGraph graph, List<BoundValidation> validations) {
    Map<String, Scope> scopes = new HashMap<>();
    for (DagNode node : graph.getNodes()) {
      scopeOf(graph, node, scopes);
    }

    Map<String, Integer> pending = new HashMap<>();
    PriorityQueue<DagNode> ready = new PriorityQueue<>(
        Comparator.<DagNode>comparingInt(node -> scopes.get(node.getId()).getDepth())
            .thenComparing(DECLARATION_ORDER));
    for (DagNode node : graph.getNodes()) {
      int producers = graph.getProducers(node).size();
      pending.put(node.getId(), producers);
      if (producers == 0) {
        ready.add(node);
      }
    }

    List<PlanNode> ordered = new ArrayList<>();
    while (!ready.isEmpty()) {
      DagNode node = ready.poll();
      Scope scope = scopes.get(node.getId());
      ordered.add(new PlanNode(node, scope, stepOf(node, scope)));
      for (DagNode consumer : graph.getConsumers(node)) {
        int remaining = pending.merge(consumer.getId(), -1, Integer::sum);
        if (remaining == 0) {
          ready.add(consumer);
        }
      }
    }
    if (ordered.size() != graph.getNodes().size()) {
      throw new IllegalStateException("Dependency graph of '" + graph.getTarget().getTable()
          + "' is not acyclic");
    }
    return new TablePlan(graph, ordered, validations);
  }

  /**
   * Collects, per source table the targets read, the source-level
   * transients to compute before any target runs.
   *
   * @param pipeline Pipeline configuration, for declaration order
   * @param tables Target plans
   * @return Plans of the source tables read by the run, in declaration order
   */
  public List<SourcePlan> planSources(PipelineConfig pipeline, List<TablePlan> tables) {
    Map<String, Map<String, DagNode>> cached = new LinkedHashMap<>();
    Set<String> read = new LinkedHashSet<>();
    for (TablePlan table : tables) {
      String source = table.getSource().getName();
      read.add(source);
      read.addAll(table.getLookupTables());
      for (PlanNode node : table.getNodes()) {
        if (node.getStep() != PlanNode.Step.EVALUATE) {
          cached.computeIfAbsent(source, k -> new LinkedHashMap<>())
              .putIfAbsent(node.getNode().getId(), node.getNode());
        }
      }
    }

    List<SourcePlan> plans = new ArrayList<>();
    for (SourceTableConfig source : pipeline.getSourceTables()) {
      if (read.contains(source.getName())) {
        Map<String, DagNode> nodes = cached.get(source.getName());
        plans.add(new SourcePlan(source,
            nodes == null ? new ArrayList<>() : dependencyOrder(nodes)));
      }
    }
    return plans;
  }

  private static Scope scopeOf(DependencyGraph graph, DagNode node, Map<String, Scope> scopes) {
    Scope scope = scopes.get(node.getId());
    if (scope != null) {
      return scope;
    }
    Set<String> lineage = new LinkedHashSet<>();
    for (DagNode producer : graph.getProducers(node)) {
      lineage.addAll(scopeOf(graph, producer, scopes).getLineage());
    }
    if (node.isExplode()) {
      lineage.add(node.getName());
    }
    scope = Scope.of(new ArrayList<>(lineage));
    scopes.put(node.getId(), scope);
    return scope;
  }

  private static PlanNode.Step stepOf(DagNode node, Scope scope) {
    if (node.getKind() != DagNode.Kind.SOURCE_TRANSIENT) {
      return PlanNode.Step.EVALUATE;
    }
    if (scope.isRoot()) {
      return PlanNode.Step.MATERIALIZED;
    }
    if (node.isExplode() && scope.getDepth() == 1) {
      return PlanNode.Step.EXPAND;
    }
    return PlanNode.Step.EVALUATE;
  }

  private static List<DagNode> dependencyOrder(Map<String, DagNode> nodes) {
    List<DagNode> remaining = new ArrayList<>(nodes.values());
    remaining.sort(DECLARATION_ORDER);
    List<DagNode> ordered = new ArrayList<>();
    Set<String> done = new LinkedHashSet<>();
    while (!remaining.isEmpty()) {
      DagNode next = null;
      for (DagNode node : remaining) {
        boolean satisfied = true;
        for (InputRef input : node.getInputs()) {
          if (input.getProducer() != null && !done.contains(input.getProducer())) {
            satisfied = false;
            break;
          }
        }
        if (satisfied) {
          next = node;
          break;
        }
      }
      if (next == null) {
        throw new IllegalStateException("Source transients " + remaining + " are not acyclic");
      }
      remaining.remove(next);
      done.add(next.getId());
      ordered.add(next);
    }
    return ordered;
  }
}
