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
package org.medallion.engine.config;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for a complete transformation pipeline.
 *
 * <p>PipelineConfig is the single owner of the source table, target table,
 * column, transient and validation configurations parsed from one pipeline
 * document. It is immutable once built.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * pipeline:
 *   name: stackoverflow
 *   source_tables:
 *     - name: bronze.questions
 *       transients:
 *         - name: answers_struct
 *           op: parse_and_flatten
 *           path: "answers[]"
 *           transient: true
 *   target_tables:
 *     - table: silver.answers
 *       default_source: bronze.questions
 *       columns:
 *         - {name: question_id, op: copy, field: question_id}
 *         - {name: author, op: copy, field: answers_struct.author}
 *       mode: append
 * }</pre>
 *
 * @see PipelineConfigParser
 */
public class PipelineConfig {

  private final String name;
  private final List<SourceTableConfig> sourceTables;
  private final List<TargetTableConfig> targetTables;
  private final Map<String, Object> settings;

  private PipelineConfig(Builder builder) {
    this.name = builder.name;
    this.sourceTables = ImmutableList.copyOf(builder.sourceTables);
    this.targetTables = ImmutableList.copyOf(builder.targetTables);
    this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
  }

  public String getName() {
    return name;
  }

  public List<SourceTableConfig> getSourceTables() {
    return sourceTables;
  }

  public List<TargetTableConfig> getTargetTables() {
    return targetTables;
  }

  /**
   * Returns the raw {@code settings} block, empty if the document has none.
   */
  public Map<String, Object> getSettings() {
    return settings;
  }

  public @Nullable SourceTableConfig getSourceTable(String name) {
    for (SourceTableConfig source : sourceTables) {
      if (source.getName().equals(name)) {
        return source;
      }
    }
    return null;
  }

  public @Nullable TargetTableConfig getTargetTable(String table) {
    for (TargetTableConfig target : targetTables) {
      if (target.getTable().equals(table)) {
        return target;
      }
    }
    return null;
  }

  /**
   * Returns the source table a target reads by default: its declared
   * {@code default_source}, or the pipeline's only source table.
   *
   * @throws ConfigException if the default source is missing or unknown
   */
  public SourceTableConfig resolveDefaultSource(TargetTableConfig target) {
    String declared = target.getDefaultSource();
    if (declared == null) {
      if (sourceTables.size() == 1) {
        return sourceTables.get(0);
      }
      throw new ConfigException("missing required key 'default_source' (pipeline declares "
          + sourceTables.size() + " source tables)", target.getLocation() + ".default_source");
    }
    SourceTableConfig source = getSourceTable(declared);
    if (source == null) {
      throw new ConfigException("unknown source table '" + declared + "'",
          target.getLocation() + ".default_source");
    }
    return source;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a PipelineConfig from the {@code pipeline} mapping of a document.
   */
  static PipelineConfig fromMap(Object raw, String path) {
    ConfigReader reader = ConfigReader.of(raw, path);
    reader.allowKeys("name", "source_tables", "target_tables", "settings");
    Builder builder = builder()
        .name(reader.requireString("name"))
        .settings(reader.optMap("settings"));

    List<Object> sources = reader.optList("source_tables");
    if (sources.isEmpty()) {
      throw new ConfigException("missing required key 'source_tables'",
          reader.path("source_tables"));
    }
    for (int i = 0; i < sources.size(); i++) {
      builder.sourceTable(
          SourceTableConfig.fromMap(sources.get(i), reader.path("source_tables"), i));
    }

    List<Object> targets = reader.optList("target_tables");
    if (targets.isEmpty()) {
      throw new ConfigException("missing required key 'target_tables'",
          reader.path("target_tables"));
    }
    for (int i = 0; i < targets.size(); i++) {
      builder.targetTable(
          TargetTableConfig.fromMap(targets.get(i), reader.path("target_tables"), i));
    }
    return builder.build();
  }

  @Override public String toString() {
    return "PipelineConfig{name='" + name + "', sources=" + sourceTables.size()
        + ", targets=" + targetTables.size() + "}";
  }

  /**
   * Builder for PipelineConfig.
   */
  public static class Builder {
    private String name;
    private final List<SourceTableConfig> sourceTables = new ArrayList<>();
    private final List<TargetTableConfig> targetTables = new ArrayList<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder sourceTable(SourceTableConfig sourceTable) {
      this.sourceTables.add(sourceTable);
      return this;
    }

    public Builder targetTable(TargetTableConfig targetTable) {
      this.targetTables.add(targetTable);
      return this;
    }

    public Builder settings(Map<String, Object> settings) {
      this.settings.putAll(settings);
      return this;
    }

    public PipelineConfig build() {
      if (name == null || name.isEmpty()) {
        throw new ConfigException("missing required key 'name'", "pipeline.name");
      }
      Set<String> tables = new HashSet<>();
      for (SourceTableConfig source : sourceTables) {
        if (!tables.add(source.getName())) {
          throw new ConfigException("duplicate table name '" + source.getName() + "'",
              "pipeline.source_tables[" + source.getName() + "]");
        }
      }
      for (TargetTableConfig target : targetTables) {
        if (!tables.add(target.getTable())) {
          throw new ConfigException("duplicate table name '" + target.getTable() + "'",
              target.getLocation());
        }
      }
      PipelineConfig config = new PipelineConfig(this);
      for (TargetTableConfig target : targetTables) {
        config.resolveDefaultSource(target);
      }
      return config;
    }
  }
}
