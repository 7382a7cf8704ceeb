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

import org.medallion.engine.graph.DagNode;

import java.util.Locale;

/**
 * A node of a target table's plan, with its scope and how the evaluator
 * obtains its value.
 */
public class PlanNode {

  /**
   * How the value of a node is obtained in a target plan.
   */
  public enum Step {
    /** Computed row by row in the target plan. */
    EVALUATE,
    /** Read from the source transient cache, computed once per run. */
    MATERIALIZED,
    /** Read from the source transient cache and exploded in the target plan. */
    EXPAND
  }

  private final DagNode node;
  private final Scope scope;
  private final Step step;

  PlanNode(DagNode node, Scope scope, Step step) {
    this.node = node;
    this.scope = scope;
    this.step = step;
  }

  public DagNode getNode() {
    return node;
  }

  public Scope getScope() {
    return scope;
  }

  public Step getStep() {
    return step;
  }

  @Override public String toString() {
    return step.name().toLowerCase(Locale.ROOT) + " " + node + " [scope " + scope + "]";
  }
}
