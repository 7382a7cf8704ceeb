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

import org.medallion.engine.path.FieldPath;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of one derived field: a target column, a target-level
 * transient, or a source-level transient.
 *
 * <p>Every derived field names an operation and one or more input field
 * references. A reference is a dotted path whose first segment is a source
 * field, a transient, or another column.
 *
 * <h3>Direct copy</h3>
 * <pre>{@code
 * - name: question_id
 *   op: copy
 *   field: question_id
 * }</pre>
 *
 * <h3>Cast with parameters</h3>
 * <pre>{@code
 * - name: answer_score
 *   op: cast
 *   field: answers_struct.score
 *   parameters: {type: integer, strict: true}
 * }</pre>
 *
 * <h3>Exploding transient</h3>
 * <pre>{@code
 * - name: answers_struct
 *   op: parse_and_flatten
 *   path: "answers[]"
 *   parser: json
 *   schema:
 *     - {name: author, type: string}
 *     - {name: score, type: integer}
 *   transient: true
 * }</pre>
 *
 * <p>When only {@code path} is given, its first segment is the input field
 * and the remaining steps are the structural path applied to that field.
 */
public class FieldConfig {

  private final String name;
  private final String op;
  private final List<String> fields;
  private final FieldPath path;
  private final @Nullable String parser;
  private final List<SchemaField> schema;
  private final Map<String, Object> parameters;
  private final List<JoinConfig> joins;
  private final boolean transientField;
  private final @Nullable ValidationAction onError;
  private final @Nullable String description;
  private final String location;

  private FieldConfig(Builder builder) {
    this.name = builder.name;
    this.op = builder.op;
    this.fields = ImmutableList.copyOf(builder.fields);
    this.path = builder.path != null ? builder.path : FieldPath.empty();
    this.parser = builder.parser;
    this.schema = ImmutableList.copyOf(builder.schema);
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    this.joins = ImmutableList.copyOf(builder.joins);
    this.transientField = builder.transientField;
    this.onError = builder.onError;
    this.description = builder.description;
    this.location = builder.location != null ? builder.location : builder.name;
  }

  /**
   * Returns the produced field name.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the operation name, resolved against the operation registry at compile time.
   */
  public String getOp() {
    return op;
  }

  /**
   * Returns the input field references in declaration order.
   */
  public List<String> getFields() {
    return fields;
  }

  /**
   * Returns the first input field reference.
   */
  public String getField() {
    return fields.get(0);
  }

  /**
   * Returns the structural path applied to the first input, empty if none.
   */
  public FieldPath getPath() {
    return path;
  }

  public @Nullable String getParser() {
    return parser;
  }

  public List<SchemaField> getSchema() {
    return schema;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public @Nullable Object getParameter(String key) {
    return parameters.get(key);
  }

  public List<JoinConfig> getJoins() {
    return joins;
  }

  /**
   * Returns whether the field is intermediate and never persisted.
   */
  public boolean isTransient() {
    return transientField;
  }

  /**
   * Returns the action for rows whose derivation of this field fails, or null
   * to fall back to the field's validation action or the engine default.
   */
  public @Nullable ValidationAction getOnError() {
    return onError;
  }

  public @Nullable String getDescription() {
    return description;
  }

  /**
   * Returns the document path of this entry, used in error messages.
   */
  public String getLocation() {
    return location;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a FieldConfig from a YAML/JSON map.
   *
   * @param raw Entry with keys: name, op, field/fields, path, parser,
   *     parameters (alias params), schema, join, transient, on_error, description
   * @param parentPath Document path of the enclosing list
   * @param index Position of the entry in that list
   * @return FieldConfig instance
   */
  static FieldConfig fromMap(Object raw, String parentPath, int index) {
    ConfigReader reader = ConfigReader.of(raw, parentPath + "[" + index + "]");
    String name = reader.requireString("name");
    reader = ConfigReader.of(raw, parentPath + "[" + name + "]");
    reader.allowKeys("name", "op", "field", "fields", "path", "parser", "parameters", "params",
        "schema", "join", "transient", "on_error", "description");

    Builder builder = builder()
        .location(reader.path())
        .name(name)
        .op(reader.requireString("op"))
        .parser(reader.optString("parser"))
        .description(reader.optString("description"))
        .transientField(reader.optBoolean("transient", false));

    List<String> fields = new ArrayList<>(reader.optStringList("field"));
    fields.addAll(reader.optStringList("fields"));
    FieldPath path = FieldPath.empty();
    String pathText = reader.optString("path");
    if (pathText != null) {
      try {
        path = FieldPath.parse(pathText);
      } catch (IllegalArgumentException e) {
        throw new ConfigException(e.getMessage(), reader.path("path"), e);
      }
    }
    if (fields.isEmpty()) {
      if (pathText == null) {
        throw new ConfigException("missing required key 'field' or 'path'", reader.path());
      }
      String root = path.getRoot();
      if (root == null) {
        throw new ConfigException("path without 'field' must start with a field name",
            reader.path("path"));
      }
      fields.add(root);
      path = path.tail();
    }
    builder.fields(fields).path(path);

    if (reader.has("parameters") && reader.has("params")) {
      throw new ConfigException("use either 'parameters' or 'params', not both",
          reader.path("params"));
    }
    builder.parameters(reader.has("params")
        ? reader.optMap("params") : reader.optMap("parameters"));

    builder.schema(parseSchema(reader));

    Object join = reader.get("join");
    if (join instanceof List) {
      List<Object> items = reader.optList("join");
      for (int i = 0; i < items.size(); i++) {
        builder.join(JoinConfig.fromMap(items.get(i), reader.path("join") + "[" + i + "]"));
      }
    } else if (join != null) {
      builder.join(JoinConfig.fromMap(join, reader.path("join")));
    }

    String onError = reader.optString("on_error");
    if (onError != null) {
      try {
        builder.onError(ValidationAction.parse(onError));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("unknown action '" + onError
            + "'; expected drop, quarantine or fail", reader.path("on_error"), e);
      }
    }
    return builder.build();
  }

  private static List<SchemaField> parseSchema(ConfigReader reader) {
    Object raw = reader.get("schema");
    List<SchemaField> schema = new ArrayList<>();
    if (raw == null) {
      return schema;
    }
    String schemaPath = reader.path("schema");
    if (raw instanceof Map) {
      for (Map.Entry<String, Object> entry : reader.optMap("schema").entrySet()) {
        schema.add(schemaField(entry.getKey(), entry.getValue(),
            schemaPath + "." + entry.getKey()));
      }
      return schema;
    }
    List<Object> items = reader.optList("schema");
    for (int i = 0; i < items.size(); i++) {
      ConfigReader item = ConfigReader.of(items.get(i), schemaPath + "[" + i + "]");
      item.allowKeys("name", "type");
      schema.add(schemaField(item.requireString("name"), item.requireString("type"),
          item.path()));
    }
    return schema;
  }

  private static SchemaField schemaField(String name, @Nullable Object type, String path) {
    if (!(type instanceof String)) {
      throw new ConfigException("expected a type name but found " + ConfigReader.describe(type),
          path);
    }
    try {
      return new SchemaField(name, FieldType.parse((String) type));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), path, e);
    }
  }

  @Override public String toString() {
    return "FieldConfig{name='" + name + "', op='" + op + "', fields=" + fields
        + (path.isEmpty() ? "" : ", path=" + path)
        + (transientField ? ", transient" : "") + "}";
  }

  /**
   * Builder for FieldConfig.
   */
  public static class Builder {
    private String name;
    private String op;
    private final List<String> fields = new ArrayList<>();
    private FieldPath path;
    private String parser;
    private final List<SchemaField> schema = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final List<JoinConfig> joins = new ArrayList<>();
    private boolean transientField;
    private ValidationAction onError;
    private String description;
    private String location;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder op(String op) {
      this.op = op;
      return this;
    }

    public Builder field(String field) {
      this.fields.add(field);
      return this;
    }

    public Builder fields(List<String> fields) {
      this.fields.addAll(fields);
      return this;
    }

    public Builder path(FieldPath path) {
      this.path = path;
      return this;
    }

    public Builder path(String path) {
      this.path = FieldPath.parse(path);
      return this;
    }

    public Builder parser(String parser) {
      this.parser = parser;
      return this;
    }

    public Builder schema(List<SchemaField> schema) {
      this.schema.addAll(schema);
      return this;
    }

    public Builder schemaField(String name, String type) {
      this.schema.add(new SchemaField(name, FieldType.parse(type)));
      return this;
    }

    public Builder parameters(Map<String, Object> parameters) {
      this.parameters.putAll(parameters);
      return this;
    }

    public Builder parameter(String key, Object value) {
      this.parameters.put(key, value);
      return this;
    }

    public Builder join(JoinConfig join) {
      this.joins.add(join);
      return this;
    }

    public Builder transientField(boolean transientField) {
      this.transientField = transientField;
      return this;
    }

    public Builder onError(ValidationAction onError) {
      this.onError = onError;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public FieldConfig build() {
      if (name == null || name.isEmpty()) {
        throw new ConfigException("field name is required", location);
      }
      if (op == null || op.isEmpty()) {
        throw new ConfigException("missing required key 'op'", location);
      }
      if (fields.isEmpty()) {
        throw new ConfigException("missing required key 'field' or 'path'", location);
      }
      return new FieldConfig(this);
    }
  }
}
