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

import org.medallion.engine.config.SourceTableConfig;
import org.medallion.engine.config.TargetTableConfig;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of the field derivations one target table needs.
 *
 * <p>Holds only nodes required by the target's persisted columns or
 * validated fields. Edges run from producer to consumer along resolved
 * references.
 */
public class DependencyGraph {

  private final TargetTableConfig target;
  private final SourceTableConfig source;
  private final Map<String, DagNode> nodes;
  private final List<InputRef> validationInputs;
  private final Map<String, List<DagNode>> consumers;

  DependencyGraph(TargetTableConfig target, SourceTableConfig source,
      Map<String, DagNode> nodes, List<InputRef> validationInputs) {
    this.target = target;
    this.source = source;
    this.nodes = ImmutableMap.copyOf(nodes);
    this.validationInputs = ImmutableList.copyOf(validationInputs);
    Map<String, List<DagNode>> edges = new LinkedHashMap<>();
    for (DagNode node : nodes.values()) {
      for (String producer : producerIds(node)) {
        edges.computeIfAbsent(producer, k -> new ArrayList<>()).add(node);
      }
    }
    this.consumers = edges;
  }

  public TargetTableConfig getTarget() {
    return target;
  }

  /**
   * Returns the target's default source table.
   */
  public SourceTableConfig getSource() {
    return source;
  }

  /**
   * Returns the nodes in discovery order.
   */
  public List<DagNode> getNodes() {
    return ImmutableList.copyOf(nodes.values());
  }

  public @Nullable DagNode getNode(String id) {
    return nodes.get(id);
  }

  /**
   * Returns the distinct nodes a node reads from.
   */
  public List<DagNode> getProducers(DagNode node) {
    List<DagNode> producers = new ArrayList<>();
    for (String id : producerIds(node)) {
      producers.add(nodes.get(id));
    }
    return producers;
  }

  /**
   * Returns the nodes reading from a node.
   */
  public List<DagNode> getConsumers(DagNode node) {
    List<DagNode> list = consumers.get(node.getId());
    return list != null ? ImmutableList.copyOf(list) : ImmutableList.of();
  }

  /**
   * Returns the resolved field reference of each validation, in declaration order.
   */
  public List<InputRef> getValidationInputs() {
    return validationInputs;
  }

  /**
   * Returns the source tables read by join operations in this graph.
   */
  public Set<String> getLookupTables() {
    Set<String> tables = new LinkedHashSet<>();
    for (DagNode node : nodes.values()) {
      tables.addAll(node.getOperation().getLookupTables());
    }
    return ImmutableSet.copyOf(tables);
  }

  private static Set<String> producerIds(DagNode node) {
    Set<String> ids = new LinkedHashSet<>();
    for (InputRef input : node.getInputs()) {
      if (input.getProducer() != null) {
        ids.add(input.getProducer());
      }
    }
    return ids;
  }

  @Override public String toString() {
    return "DependencyGraph{target='" + target.getTable() + "', nodes=" + nodes.keySet() + "}";
  }
}
