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
package org.medallion.engine.op;

import org.medallion.engine.InvocationGuard;
import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.JoinConfig;
import org.medallion.engine.path.FieldPath;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Context passed to a {@link BoundOperation} while it evaluates the rows of
 * one table.
 *
 * <p>The context knows which table and field are being derived, runs the
 * field's parser under the invocation timeout, and gives join operations
 * indexed access to source tables. A context is confined to the thread
 * evaluating the table, so lookup indexes built through it are not shared.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * OperationContext context = OperationContext.builder()
 *     .tableName("silver.answers")
 *     .field(fieldConfig)
 *     .parser("json", parser)
 *     .guard(guard)
 *     .build();
 * Object value = context.parse("{\"a\": 1}");
 * }</pre>
 */
public class OperationContext {

  private final String tableName;
  private final FieldConfig field;
  private final @Nullable String parserName;
  private final @Nullable Parser parser;
  private final TableLookup tables;
  private final InvocationGuard guard;
  private final Map<JoinConfig, Map<List<Object>, List<Map<String, Object>>>> indexes =
      new HashMap<>();

  private OperationContext(Builder builder) {
    this.tableName = builder.tableName;
    this.field = builder.field;
    this.parserName = builder.parserName;
    this.parser = builder.parser;
    this.tables = builder.tables != null
        ? builder.tables
        : table -> {
          throw new IllegalStateException("No source tables available");
        };
    this.guard = builder.guard != null ? builder.guard : InvocationGuard.unbounded();
  }

  /**
   * Returns the name of the table whose rows are being evaluated: the target
   * table, or the source table for source-level transients.
   */
  public String getTableName() {
    return tableName;
  }

  public FieldConfig getField() {
    return field;
  }

  /**
   * Parses text with the field's parser, under the invocation timeout.
   *
   * @throws IllegalStateException If the field has no parser
   * @throws Exception If parsing fails or times out
   */
  public @Nullable Object parse(String text) throws Exception {
    if (parser == null) {
      throw new IllegalStateException("Field '" + field.getName() + "' has no parser");
    }
    Parser p = parser;
    return guard.call("parser '" + parserName + "' for field '" + field.getName() + "'",
        () -> p.parse(text));
  }

  /**
   * Returns the rows of a source table.
   */
  public List<Map<String, Object>> rows(String table) {
    return tables.rows(table);
  }

  /**
   * Returns the rows of a join's table whose {@code on} columns equal the
   * given key values. Rows with a null key never match. The index over the
   * table is built on first use.
   *
   * @param join Join definition
   * @param key Left-hand key values, in the order of {@link JoinConfig#getOn()}
   */
  public List<Map<String, Object>> match(JoinConfig join, List<@Nullable Object> key) {
    List<Object> normalized = JoinKeys.normalize(key);
    if (normalized == null) {
      return Collections.emptyList();
    }
    Map<List<Object>, List<Map<String, Object>>> index =
        indexes.computeIfAbsent(join, this::buildIndex);
    List<Map<String, Object>> matches = index.get(normalized);
    return matches != null ? matches : Collections.emptyList();
  }

  private Map<List<Object>, List<Map<String, Object>>> buildIndex(JoinConfig join) {
    List<FieldPath> rightColumns = new ArrayList<>();
    String prefix = join.getTable() + ".";
    for (String right : join.getOn().values()) {
      rightColumns.add(FieldPath.parse(right.startsWith(prefix)
          ? right.substring(prefix.length()) : right));
    }
    Map<List<Object>, List<Map<String, Object>>> index = new HashMap<>();
    for (Map<String, Object> row : rows(join.getTable())) {
      List<Object> key = new ArrayList<>(rightColumns.size());
      for (FieldPath column : rightColumns) {
        key.add(column.resolve(row));
      }
      List<Object> normalized = JoinKeys.normalize(key);
      if (normalized != null) {
        index.computeIfAbsent(normalized, k -> new ArrayList<>()).add(row);
      }
    }
    return index;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "OperationContext{table='" + tableName + "', field='" + field.getName() + "'}";
  }

  /**
   * Builder for OperationContext.
   */
  public static class Builder {
    private String tableName;
    private FieldConfig field;
    private @Nullable String parserName;
    private @Nullable Parser parser;
    private @Nullable TableLookup tables;
    private @Nullable InvocationGuard guard;

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder field(FieldConfig field) {
      this.field = field;
      return this;
    }

    /**
     * Sets the parser resolved for the field.
     *
     * @param parserName Registered name, used in timeout messages
     * @param parser Parser implementation
     * @return This builder
     */
    public Builder parser(@Nullable String parserName, @Nullable Parser parser) {
      this.parserName = parserName;
      this.parser = parser;
      return this;
    }

    public Builder tables(TableLookup tables) {
      this.tables = tables;
      return this;
    }

    public Builder guard(InvocationGuard guard) {
      this.guard = guard;
      return this;
    }

    public OperationContext build() {
      if (tableName == null || field == null) {
        throw new IllegalArgumentException("tableName and field are required");
      }
      return new OperationContext(this);
    }
  }
}
