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

import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.op.BoundOperation;
import org.medallion.engine.op.Cardinality;
import org.medallion.engine.op.Parser;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * One field derivation in a target table's dependency graph.
 */
public class DagNode {

  /**
   * What kind of field a node derives.
   */
  public enum Kind {
    SOURCE_TRANSIENT,
    TARGET_TRANSIENT,
    COLUMN
  }

  private final String id;
  private final Kind kind;
  private final String table;
  private final FieldConfig config;
  private final BoundOperation operation;
  private final @Nullable Parser parser;
  private final List<InputRef> inputs;
  private final int declarationIndex;

  DagNode(Kind kind, String table, FieldConfig config, BoundOperation operation,
      @Nullable Parser parser, List<InputRef> inputs, int declarationIndex) {
    this.id = idOf(kind, table, config.getName());
    this.kind = kind;
    this.table = table;
    this.config = config;
    this.operation = operation;
    this.parser = parser;
    this.inputs = ImmutableList.copyOf(inputs);
    this.declarationIndex = declarationIndex;
  }

  /**
   * Returns the id of a node. Target-level nodes are identified by name,
   * source-level transients by {@code <source table>::<name>}.
   */
  public static String idOf(Kind kind, String table, String name) {
    return kind == Kind.SOURCE_TRANSIENT ? table + "::" + name : name;
  }

  public String getId() {
    return id;
  }

  /**
   * Returns the produced field name.
   */
  public String getName() {
    return config.getName();
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the owning table: the source table of a source-level transient,
   * otherwise the target table.
   */
  public String getTable() {
    return table;
  }

  public FieldConfig getConfig() {
    return config;
  }

  public BoundOperation getOperation() {
    return operation;
  }

  public @Nullable Parser getParser() {
    return parser;
  }

  /**
   * Returns the resolved inputs, aligned with the operation's input references.
   */
  public List<InputRef> getInputs() {
    return inputs;
  }

  /**
   * Returns whether evaluating the node can multiply the rows of its scope.
   */
  public boolean isExplode() {
    return operation.getCardinality() == Cardinality.ONE_TO_MANY;
  }

  /**
   * Returns whether the node is a target column written to the output.
   */
  public boolean isPersistent() {
    return kind == Kind.COLUMN;
  }

  /**
   * Returns the node's position in the pipeline document: source transients
   * first, then the target's fields. Used to break ties when ordering.
   */
  public int getDeclarationIndex() {
    return declarationIndex;
  }

  public InputRef.Namespace getNamespace() {
    return kind == Kind.SOURCE_TRANSIENT
        ? InputRef.Namespace.SOURCE_TRANSIENT : InputRef.Namespace.TARGET;
  }

  @Override public String toString() {
    return getName() + " = " + operation + (isExplode() ? " [explode]" : "");
  }
}
