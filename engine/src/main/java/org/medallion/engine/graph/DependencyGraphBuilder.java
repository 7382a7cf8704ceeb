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
import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.PipelineConfig;
import org.medallion.engine.config.SourceTableConfig;
import org.medallion.engine.config.TargetTableConfig;
import org.medallion.engine.config.ValidationConfig;
import org.medallion.engine.op.BoundOperation;
import org.medallion.engine.op.Parser;
import org.medallion.engine.path.FieldPath;
import org.medallion.engine.registry.Registries;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency graph of each target table of a pipeline.
 *
 * <p>A field reference resolves, by its first segment, to the first match of:
 * <ol>
 *   <li>a target-level transient or column of the same target, other than
 *       the referencing field itself</li>
 *   <li>a source-level transient of the target's default source, other than
 *       the referencing transient itself</li>
 *   <li>a field of the default source, optionally written with the source
 *       table's name as prefix</li>
 * </ol>
 * A source-level transient resolves only the last two. References to
 * undeclared fields fail when the source declares its {@code columns}.
 *
 * <p>Only nodes reachable from persisted columns and validated fields join
 * the graph. Cycles are detected by depth-first traversal with a recursion
 * stack.
 *
 * <p>Every operation in the document is bound once, whether or not any
 * target needs it, so that unknown operations and bad parameters fail the
 * compile. Bindings of source-level transients are shared by all targets.
 */
public class DependencyGraphBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraphBuilder.class);

  private final PipelineConfig pipeline;
  private final Registries registries;
  private final Map<FieldConfig, Binding> bindings = new IdentityHashMap<>();

  public DependencyGraphBuilder(PipelineConfig pipeline, Registries registries) {
    this.pipeline = pipeline;
    this.registries = registries;
  }

  /**
   * Binds every field of the pipeline and checks the references of
   * source-level transients, which do not depend on any target.
   *
   * @throws ConfigException On the first invalid field
   */
  public void bindAll() {
    for (SourceTableConfig source : pipeline.getSourceTables()) {
      Traversal traversal = new Traversal(null, source);
      for (FieldConfig field : source.getTransients()) {
        traversal.visit(DagNode.Kind.SOURCE_TRANSIENT, field.getName());
      }
    }
    for (TargetTableConfig target : pipeline.getTargetTables()) {
      for (FieldConfig field : target.getFields()) {
        bind(field);
      }
    }
  }

  /**
   * Builds the graph of one target table.
   *
   * @throws ConfigException If a reference dangles or a field is invalid
   * @throws CyclicDependencyException If references form a cycle
   */
  public DependencyGraph build(TargetTableConfig target) {
    SourceTableConfig source = pipeline.resolveDefaultSource(target);
    Traversal traversal = new Traversal(target, source);
    for (FieldConfig column : target.getColumns()) {
      traversal.visit(DagNode.Kind.COLUMN, column.getName());
    }

    List<InputRef> validationInputs = new ArrayList<>();
    Resolver resolver = new Resolver(source, target, null, null);
    for (ValidationConfig validation : target.getValidations()) {
      InputRef input = resolver.resolve(validation.getField(), validation.getLocation() + ".field");
      if (input.getProducer() != null) {
        traversal.visit(producerKind(input, target), input.getKey());
      }
      validationInputs.add(input);
    }

    // Unreachable transients are never evaluated, but must still resolve without cycles
    Traversal everything = new Traversal(target, source);
    for (FieldConfig field : target.getTransients()) {
      everything.visit(DagNode.Kind.TARGET_TRANSIENT, field.getName());
    }

    DependencyGraph graph = new DependencyGraph(target, source, traversal.nodes,
        validationInputs);
    LOGGER.debug("Built dependency graph for '{}': {} nodes", target.getTable(),
        traversal.nodes.size());
    return graph;
  }

  private static DagNode.Kind producerKind(InputRef input, TargetTableConfig target) {
    if (input.getNamespace() == InputRef.Namespace.SOURCE_TRANSIENT) {
      return DagNode.Kind.SOURCE_TRANSIENT;
    }
    for (FieldConfig field : target.getFields()) {
      if (field.getName().equals(input.getKey())) {
        return field.isTransient() ? DagNode.Kind.TARGET_TRANSIENT : DagNode.Kind.COLUMN;
      }
    }
    throw new IllegalStateException("No target field " + input.getKey());
  }

  private Binding bind(FieldConfig field) {
    Binding binding = bindings.get(field);
    if (binding != null) {
      return binding;
    }
    BoundOperation operation = registries.getOperations()
        .resolve(field.getOp(), field.getLocation() + ".op")
        .bind(field, (name, location) -> registries.getOperations().resolve(name, location));
    if (!field.getJoins().isEmpty() && operation.getLookupTables().isEmpty()) {
      throw new ConfigException("join is only valid with op 'join'",
          field.getLocation() + ".join");
    }
    for (String table : operation.getLookupTables()) {
      if (pipeline.getSourceTable(table) == null) {
        throw new ConfigException("join table '" + table + "' is not a declared source table",
            field.getLocation() + ".join");
      }
    }
    Parser parser = null;
    String parserName = operation.getParserName();
    if (parserName != null) {
      parser = registries.getParsers().resolve(parserName, field.getLocation() + ".parser");
    }
    binding = new Binding(operation, parser);
    bindings.put(field, binding);
    return binding;
  }

  /** Operation and parser bound to one field. */
  private static class Binding {
    final BoundOperation operation;
    final @Nullable Parser parser;

    Binding(BoundOperation operation, @Nullable Parser parser) {
      this.operation = operation;
      this.parser = parser;
    }
  }

  /** Resolves references of one consumer. */
  private static class Resolver {
    private final SourceTableConfig source;
    private final @Nullable TargetTableConfig target;
    private final DagNode.@Nullable Kind consumerKind;
    private final @Nullable String consumerName;

    Resolver(SourceTableConfig source, @Nullable TargetTableConfig target,
        DagNode.@Nullable Kind consumerKind, @Nullable String consumerName) {
      this.source = source;
      this.target = target;
      this.consumerKind = consumerKind;
      this.consumerName = consumerName;
    }

    InputRef resolve(String reference, String location) {
      String prefix = source.getName() + ".";
      if (reference.startsWith(prefix)) {
        FieldPath path = parse(reference.substring(prefix.length()), reference, location);
        return sourceField(reference, path, location);
      }
      FieldPath path = parse(reference, reference, location);
      String root = path.getRoot();
      boolean targetLevel = consumerKind != DagNode.Kind.SOURCE_TRANSIENT;

      if (targetLevel && target != null) {
        for (FieldConfig field : target.getFields()) {
          if (field.getName().equals(root) && !root.equals(consumerName)) {
            return new InputRef(reference, InputRef.Namespace.TARGET, root, path.tail(), root);
          }
        }
      }
      for (FieldConfig field : source.getTransients()) {
        if (field.getName().equals(root)
            && !(consumerKind == DagNode.Kind.SOURCE_TRANSIENT && root.equals(consumerName))) {
          return new InputRef(reference, InputRef.Namespace.SOURCE_TRANSIENT, root, path.tail(),
              DagNode.idOf(DagNode.Kind.SOURCE_TRANSIENT, source.getName(), root));
        }
      }
      return sourceField(reference, path, location);
    }

    private InputRef sourceField(String reference, FieldPath path, String location) {
      String root = path.getRoot();
      if (source.isUndeclaredColumn(root)) {
        throw new ConfigException("unresolved reference '" + reference + "': '" + root
            + "' is not a field, transient or column of source '" + source.getName() + "'",
            location);
      }
      return new InputRef(reference, InputRef.Namespace.SOURCE_FIELD, root, path.tail(), null);
    }

    private static FieldPath parse(String text, String reference, String location) {
      FieldPath path;
      try {
        path = FieldPath.parse(text);
      } catch (IllegalArgumentException e) {
        throw new ConfigException("invalid reference '" + reference + "': " + e.getMessage(),
            location, e);
      }
      if (path.getRoot() == null) {
        throw new ConfigException("reference '" + reference + "' must start with a field name",
            location);
      }
      return path;
    }
  }

  /** Depth-first construction of one target's graph. */
  private class Traversal {
    private final @Nullable TargetTableConfig target;
    private final SourceTableConfig source;
    private final Map<String, DagNode> nodes = new LinkedHashMap<>();
    private final List<String> stack = new ArrayList<>();
    private final Set<String> onStack = new HashSet<>();
    private final Map<String, FieldConfig> targetFields = new LinkedHashMap<>();
    private final Map<String, Integer> targetIndexes = new LinkedHashMap<>();

    Traversal(@Nullable TargetTableConfig target, SourceTableConfig source) {
      this.target = target;
      this.source = source;
      List<FieldConfig> fields = target != null ? target.getFields() : new ArrayList<>();
      for (int i = 0; i < fields.size(); i++) {
        targetFields.put(fields.get(i).getName(), fields.get(i));
        targetIndexes.put(fields.get(i).getName(), source.getTransients().size() + i);
      }
    }

    void visit(DagNode.Kind kind, String name) {
      String id = DagNode.idOf(kind, source.getName(), name);
      if (nodes.containsKey(id)) {
        return;
      }
      FieldConfig field;
      int declarationIndex;
      if (kind == DagNode.Kind.SOURCE_TRANSIENT) {
        List<FieldConfig> transients = source.getTransients();
        declarationIndex = 0;
        while (!transients.get(declarationIndex).getName().equals(name)) {
          declarationIndex++;
        }
        field = transients.get(declarationIndex);
      } else {
        field = targetFields.get(name);
        declarationIndex = targetIndexes.get(name);
      }
      if (onStack.contains(id)) {
        List<String> cycle = new ArrayList<>();
        for (String member : stack.subList(stack.indexOf(id), stack.size())) {
          cycle.add(member.contains("::") ? member.substring(member.indexOf("::") + 2) : member);
        }
        throw new CyclicDependencyException(cycle, field.getLocation());
      }
      stack.add(id);
      onStack.add(id);

      Binding binding = bind(field);
      String table = kind == DagNode.Kind.SOURCE_TRANSIENT || target == null
          ? source.getName() : target.getTable();
      Resolver resolver = new Resolver(source, target, kind, name);
      List<InputRef> inputs = new ArrayList<>();
      for (String reference : binding.operation.getInputs()) {
        InputRef input = resolver.resolve(reference, field.getLocation());
        if (input.getProducer() != null) {
          visit(input.getNamespace() == InputRef.Namespace.SOURCE_TRANSIENT
              ? DagNode.Kind.SOURCE_TRANSIENT : producerKind(input, target), input.getKey());
        }
        inputs.add(input);
      }

      stack.remove(stack.size() - 1);
      onStack.remove(id);
      nodes.put(id, new DagNode(kind, table, field, binding.operation, binding.parser, inputs,
          declarationIndex));
    }
  }
}
