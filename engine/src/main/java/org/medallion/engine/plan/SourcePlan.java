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

import org.medallion.engine.config.SourceTableConfig;
import org.medallion.engine.graph.DagNode;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * What to compute for one source table before any target runs: the
 * source-level transients needed at root scope, in dependency order.
 */
public class SourcePlan {

  private final SourceTableConfig source;
  private final List<DagNode> transients;

  SourcePlan(SourceTableConfig source, List<DagNode> transients) {
    this.source = source;
    this.transients = ImmutableList.copyOf(transients);
  }

  public SourceTableConfig getSource() {
    return source;
  }

  public String getTable() {
    return source.getName();
  }

  /**
   * Returns the transients to materialize. Exploding transients are cached
   * with their unexploded list value.
   */
  public List<DagNode> getTransients() {
    return transients;
  }
}
