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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Raised at compile time when field references form a cycle.
 */
public class CyclicDependencyException extends ConfigException {

  private final List<String> cycle;

  public CyclicDependencyException(List<String> cycle, String path) {
    super("cyclic dependency: " + String.join(" -> ", cycle) + " -> " + cycle.get(0), path);
    this.cycle = ImmutableList.copyOf(cycle);
  }

  /**
   * Returns the names of the fields on the cycle, in the order they were
   * reached.
   */
  public List<String> getCycle() {
    return cycle;
  }
}
