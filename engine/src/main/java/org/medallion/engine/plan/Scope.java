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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The row cardinality a node evaluates in, identified by its explode
 * lineage: the ordered explode nodes above it, itself included if it
 * explodes. Nodes with an empty lineage see one row per source row.
 */
public final class Scope {

  private static final Scope ROOT = new Scope(ImmutableList.of());

  private final List<String> lineage;

  private Scope(List<String> lineage) {
    this.lineage = lineage;
  }

  public static Scope root() {
    return ROOT;
  }

  public static Scope of(List<String> lineage) {
    return lineage.isEmpty() ? ROOT : new Scope(ImmutableList.copyOf(lineage));
  }

  public List<String> getLineage() {
    return lineage;
  }

  public int getDepth() {
    return lineage.size();
  }

  public boolean isRoot() {
    return lineage.isEmpty();
  }

  @Override public boolean equals(Object o) {
    return o == this || (o instanceof Scope && lineage.equals(((Scope) o).lineage));
  }

  @Override public int hashCode() {
    return lineage.hashCode();
  }

  @Override public String toString() {
    return lineage.isEmpty() ? "root" : String.join(">", lineage);
  }
}
