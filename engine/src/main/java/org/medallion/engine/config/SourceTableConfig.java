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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of a source table and its source-level transients.
 *
 * <p>Source-level transients are computed at most once per pipeline run and
 * may be referenced by every target table that reads this source.
 *
 * <pre>{@code
 * source_tables:
 *   - name: bronze.questions
 *     columns: [question_id, title, answers, tags]
 *     transients:
 *       - {name: tags_struct, op: parse_json, field: tags, transient: true}
 * }</pre>
 *
 * <p>{@code columns} is optional. When present, field references into this
 * table are checked at compile time; otherwise they are checked when rows are read.
 */
public class SourceTableConfig {

  /** Provenance columns every ingested table carries. */
  public static final Set<String> PROVENANCE_COLUMNS = Collections.unmodifiableSet(
      new LinkedHashSet<>(
          List.of("filename", "path", "ingestion_timestamp", "file_format", "compression_type")));

  private final String name;
  private final List<FieldConfig> transients;
  private final Set<String> columns;

  private SourceTableConfig(Builder builder) {
    this.name = builder.name;
    this.transients = ImmutableList.copyOf(builder.transients);
    this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.columns));
  }

  public String getName() {
    return name;
  }

  public List<FieldConfig> getTransients() {
    return transients;
  }

  /**
   * Returns the declared column set, empty when the table's columns are not declared.
   */
  public Set<String> getColumns() {
    return columns;
  }

  /**
   * Returns whether the table's columns are declared and the given field is not one of them.
   */
  public boolean isUndeclaredColumn(String field) {
    return !columns.isEmpty() && !columns.contains(field) && !PROVENANCE_COLUMNS.contains(field);
  }

  public static Builder builder() {
    return new Builder();
  }

  static SourceTableConfig fromMap(Object raw, String parentPath, int index) {
    ConfigReader reader = ConfigReader.of(raw, parentPath + "[" + index + "]");
    String name = reader.requireString("name");
    reader = ConfigReader.of(raw, parentPath + "[" + name + "]");
    reader.allowKeys("name", "transients", "columns");
    Builder builder = builder().name(name).columns(reader.optStringList("columns"));
    List<Object> transients = reader.optList("transients");
    String transientsPath = reader.path("transients");
    for (int i = 0; i < transients.size(); i++) {
      Object entry = transients.get(i);
      if (entry instanceof Map
          && Boolean.FALSE.equals(((Map<?, ?>) entry).get("transient"))) {
        throw new ConfigException("source-level transients cannot be persisted",
            transientsPath + "[" + i + "].transient");
      }
      FieldConfig field = FieldConfig.fromMap(entry, transientsPath, i);
      builder.transientField(field);
    }
    return builder.build();
  }

  @Override public String toString() {
    return "SourceTableConfig{name='" + name + "', transients=" + transients.size() + "}";
  }

  /**
   * Builder for SourceTableConfig.
   */
  public static class Builder {
    private String name;
    private final List<FieldConfig> transients = new ArrayList<>();
    private final List<String> columns = new ArrayList<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Adds a source-level transient. The entry is always treated as transient.
     */
    public Builder transientField(FieldConfig field) {
      this.transients.add(field);
      return this;
    }

    public Builder columns(List<String> columns) {
      this.columns.addAll(columns);
      return this;
    }

    public SourceTableConfig build() {
      if (name == null || name.isEmpty()) {
        throw new ConfigException("source table name is required", "pipeline.source_tables");
      }
      Set<String> seen = new HashSet<>();
      for (FieldConfig field : transients) {
        if (!seen.add(field.getName())) {
          throw new ConfigException("duplicate transient '" + field.getName() + "'",
              field.getLocation());
        }
      }
      return new SourceTableConfig(this);
    }
  }
}
