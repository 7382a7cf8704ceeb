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
package org.medallion.engine.io;

import org.medallion.engine.config.WriteMode;
import org.medallion.engine.validation.QuarantineRecord;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The validated output of one target table: the rows to persist and the
 * rows removed under the {@code quarantine} action.
 */
public class WriteRequest {

  private final String table;
  private final WriteMode mode;
  private final List<String> mergeKey;
  private final List<String> columns;
  private final List<Map<String, Object>> rows;
  private final List<QuarantineRecord> quarantine;

  public WriteRequest(String table, WriteMode mode, List<String> mergeKey, List<String> columns,
      List<Map<String, Object>> rows) {
    this(table, mode, mergeKey, columns, rows, Collections.emptyList());
  }

  public WriteRequest(String table, WriteMode mode, List<String> mergeKey, List<String> columns,
      List<Map<String, Object>> rows, List<QuarantineRecord> quarantine) {
    this.table = table;
    this.mode = mode;
    this.mergeKey = ImmutableList.copyOf(mergeKey);
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
    this.quarantine = ImmutableList.copyOf(quarantine);
  }

  public String getTable() {
    return table;
  }

  public WriteMode getMode() {
    return mode;
  }

  /**
   * Returns the upsert key; empty unless the mode is {@link WriteMode#MERGE}.
   */
  public List<String> getMergeKey() {
    return mergeKey;
  }

  /**
   * Returns the persisted column names in output order.
   */
  public List<String> getColumns() {
    return columns;
  }

  /**
   * Returns the rows, each keyed by {@link #getColumns()} in that order.
   */
  public List<Map<String, Object>> getRows() {
    return rows;
  }

  /**
   * Returns the quarantined rows with their causes, possibly none.
   */
  public List<QuarantineRecord> getQuarantine() {
    return quarantine;
  }

  @Override public String toString() {
    return "WriteRequest{table='" + table + "', mode=" + mode + ", rows=" + rows.size()
        + ", quarantine=" + quarantine.size() + "}";
  }
}
