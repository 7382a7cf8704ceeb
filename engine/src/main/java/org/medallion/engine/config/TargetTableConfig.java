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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration of a target table: its columns, target-level transients,
 * validations and write mode.
 *
 * <pre>{@code
 * target_tables:
 *   - table: silver.answers
 *     description: One row per answer
 *     default_source: bronze.questions
 *     columns:
 *       - {name: question_id, op: copy, field: question_id}
 *       - {name: author, op: copy, field: answers_struct.author}
 *     validation:
 *       - {field: author, op: not_null, action: quarantine}
 *     mode: merge
 *     merge_key: [question_id, author]
 * }</pre>
 *
 * <p>Entries of {@code columns} flagged {@code transient: true} are
 * target-level transients: they can be referenced by other entries of the
 * same table but are never written.
 */
public class TargetTableConfig {

  private final String table;
  private final @Nullable String description;
  private final @Nullable String defaultSource;
  private final List<FieldConfig> fields;
  private final List<ValidationConfig> validations;
  private final WriteMode mode;
  private final List<String> mergeKey;
  private final String location;

  private TargetTableConfig(Builder builder) {
    this.table = builder.table;
    this.description = builder.description;
    this.defaultSource = builder.defaultSource;
    this.fields = ImmutableList.copyOf(builder.fields);
    this.validations = ImmutableList.copyOf(builder.validations);
    this.mode = builder.mode != null ? builder.mode : WriteMode.OVERWRITE;
    this.mergeKey = ImmutableList.copyOf(builder.mergeKey);
    this.location = builder.location != null
        ? builder.location : "pipeline.target_tables[" + builder.table + "]";
  }

  public String getTable() {
    return table;
  }

  public @Nullable String getDescription() {
    return description;
  }

  /**
   * Returns the declared default source table, or null to use the pipeline's
   * only source table.
   */
  public @Nullable String getDefaultSource() {
    return defaultSource;
  }

  /**
   * Returns all column entries, persisted and transient, in declaration order.
   */
  public List<FieldConfig> getFields() {
    return fields;
  }

  /**
   * Returns the persisted columns in declaration order. This is the column
   * order of the written table.
   */
  public List<FieldConfig> getColumns() {
    List<FieldConfig> columns = new ArrayList<>();
    for (FieldConfig field : fields) {
      if (!field.isTransient()) {
        columns.add(field);
      }
    }
    return columns;
  }

  /**
   * Returns the target-level transients in declaration order.
   */
  public List<FieldConfig> getTransients() {
    List<FieldConfig> transients = new ArrayList<>();
    for (FieldConfig field : fields) {
      if (field.isTransient()) {
        transients.add(field);
      }
    }
    return transients;
  }

  public List<ValidationConfig> getValidations() {
    return validations;
  }

  public WriteMode getMode() {
    return mode;
  }

  /**
   * Returns the merge key columns; non-empty exactly when the mode is {@link WriteMode#MERGE}.
   */
  public List<String> getMergeKey() {
    return mergeKey;
  }

  public String getLocation() {
    return location;
  }

  public static Builder builder() {
    return new Builder();
  }

  static TargetTableConfig fromMap(Object raw, String parentPath, int index) {
    ConfigReader reader = ConfigReader.of(raw, parentPath + "[" + index + "]");
    String table = reader.requireString("table");
    reader = ConfigReader.of(raw, parentPath + "[" + table + "]");
    reader.allowKeys("table", "description", "default_source", "columns", "validation",
        "validations", "mode", "merge_key");

    Builder builder = builder()
        .location(reader.path())
        .table(table)
        .description(reader.optString("description"))
        .defaultSource(reader.optString("default_source"))
        .mergeKey(reader.optStringList("merge_key"));

    List<Object> columns = reader.optList("columns");
    if (columns.isEmpty()) {
      throw new ConfigException("missing required key 'columns'", reader.path("columns"));
    }
    for (int i = 0; i < columns.size(); i++) {
      builder.field(FieldConfig.fromMap(columns.get(i), reader.path("columns"), i));
    }

    String validationKey = reader.has("validations") ? "validations" : "validation";
    List<Object> validations = reader.optList(validationKey);
    for (int i = 0; i < validations.size(); i++) {
      builder.validation(
          ValidationConfig.fromMap(validations.get(i), reader.path(validationKey), i));
    }

    String mode = reader.optString("mode");
    if (mode != null) {
      try {
        builder.mode(WriteMode.parse(mode));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("unknown mode '" + mode
            + "'; expected overwrite, append or merge", reader.path("mode"), e);
      }
    }
    return builder.build();
  }

  @Override public String toString() {
    return "TargetTableConfig{table='" + table + "', fields=" + fields.size()
        + ", validations=" + validations.size() + ", mode=" + mode
        + (mergeKey.isEmpty() ? "" : ", mergeKey=" + mergeKey) + "}";
  }

  /**
   * Builder for TargetTableConfig.
   */
  public static class Builder {
    private String table;
    private String description;
    private String defaultSource;
    private final List<FieldConfig> fields = new ArrayList<>();
    private final List<ValidationConfig> validations = new ArrayList<>();
    private WriteMode mode;
    private final List<String> mergeKey = new ArrayList<>();
    private String location;

    public Builder table(String table) {
      this.table = table;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder defaultSource(String defaultSource) {
      this.defaultSource = defaultSource;
      return this;
    }

    public Builder field(FieldConfig field) {
      this.fields.add(field);
      return this;
    }

    public Builder validation(ValidationConfig validation) {
      this.validations.add(validation);
      return this;
    }

    public Builder mode(WriteMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder mergeKey(List<String> mergeKey) {
      this.mergeKey.addAll(mergeKey);
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public TargetTableConfig build() {
      String path = location != null ? location : "pipeline.target_tables[" + table + "]";
      if (table == null || table.isEmpty()) {
        throw new ConfigException("missing required key 'table'", path);
      }
      Set<String> names = new HashSet<>();
      Set<String> persisted = new HashSet<>();
      for (FieldConfig field : fields) {
        if (!names.add(field.getName())) {
          throw new ConfigException("duplicate column '" + field.getName() + "'",
              field.getLocation());
        }
        if (!field.isTransient()) {
          persisted.add(field.getName());
        }
      }
      if (persisted.isEmpty()) {
        throw new ConfigException("target table declares no persisted column", path + ".columns");
      }
      if (mode == WriteMode.MERGE && mergeKey.isEmpty()) {
        throw new ConfigException("mode merge requires 'merge_key'", path + ".merge_key");
      }
      if (mode != WriteMode.MERGE && !mergeKey.isEmpty()) {
        throw new ConfigException("'merge_key' is only allowed with mode merge",
            path + ".merge_key");
      }
      for (String key : mergeKey) {
        if (!persisted.contains(key)) {
          throw new ConfigException("merge key '" + key + "' is not a persisted column",
              path + ".merge_key");
        }
      }
      return new TargetTableConfig(this);
    }
  }
}
