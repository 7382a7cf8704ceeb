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

import org.medallion.engine.validation.QuarantineRecord;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table store held in memory, serving as both reader and writer.
 *
 * <p>Useful for tests and for embedding the engine over data that is
 * already loaded. Writes honour the write modes:
 * <ul>
 *   <li>{@code overwrite} replaces the table</li>
 *   <li>{@code append} adds rows after the existing ones</li>
 *   <li>{@code merge} upserts by the merge key: matching rows take the new
 *       values, new keys are added at the end</li>
 * </ul>
 *
 * <p>A write computes the table's new rows and quarantine output before
 * replacing both under the store's lock.
 */
public class InMemoryTableStore implements TableReader, TableWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTableStore.class);

  private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
  private final Map<String, List<QuarantineRecord>> quarantine = new HashMap<>();

  /**
   * Replaces the rows of a table, typically a source table before a run.
   */
  public synchronized InMemoryTableStore put(String table, List<Map<String, Object>> rows) {
    List<Map<String, Object>> copy = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      copy.add(new LinkedHashMap<>(row));
    }
    tables.put(table, copy);
    return this;
  }

  /**
   * Returns a snapshot of a table's rows, empty if the table does not exist.
   */
  public synchronized List<Map<String, Object>> rows(String table) {
    List<Map<String, Object>> rows = tables.get(table);
    if (rows == null) {
      return Collections.emptyList();
    }
    List<Map<String, Object>> snapshot = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      snapshot.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    return snapshot;
  }

  public synchronized boolean contains(String table) {
    return tables.containsKey(table);
  }

  /**
   * Returns the quarantine output of a target table.
   */
  public synchronized List<QuarantineRecord> quarantine(String table) {
    List<QuarantineRecord> records = quarantine.get(table);
    return records != null ? ImmutableList.copyOf(records) : ImmutableList.of();
  }

  @Override public Iterator<Map<String, Object>> read(String table) throws IOException {
    synchronized (this) {
      if (!tables.containsKey(table)) {
        throw new IOException("Table '" + table + "' does not exist");
      }
    }
    return rows(table).iterator();
  }

  @Override public synchronized long write(WriteRequest request) {
    List<Map<String, Object>> existing = tables.get(request.getTable());
    List<Map<String, Object>> result;
    switch (request.getMode()) {
      case APPEND:
        result = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
        for (Map<String, Object> row : request.getRows()) {
          result.add(new LinkedHashMap<>(row));
        }
        break;
      case MERGE:
        result = merge(existing, request);
        break;
      default:
        result = new ArrayList<>();
        for (Map<String, Object> row : request.getRows()) {
          result.add(new LinkedHashMap<>(row));
        }
    }
    List<QuarantineRecord> quarantined =
        nextQuarantine(quarantine.get(request.getTable()), request);
    tables.put(request.getTable(), result);
    quarantine.put(request.getTable(), quarantined);
    LOGGER.debug("Wrote {} rows and {} quarantine records to '{}' ({}), table now has {} rows",
        request.getRows().size(), request.getQuarantine().size(), request.getTable(),
        request.getMode(), result.size());
    return request.getRows().size();
  }

  private static List<Map<String, Object>> merge(List<Map<String, Object>> existing,
      WriteRequest request) {
    Map<List<Object>, Map<String, Object>> byKey = new LinkedHashMap<>();
    if (existing != null) {
      for (Map<String, Object> row : existing) {
        byKey.put(key(row, request.getMergeKey()), new LinkedHashMap<>(row));
      }
    }
    for (Map<String, Object> row : request.getRows()) {
      List<Object> key = key(row, request.getMergeKey());
      Map<String, Object> current = byKey.get(key);
      if (current != null) {
        current.putAll(row);
      } else {
        byKey.put(key, new LinkedHashMap<>(row));
      }
    }
    return new ArrayList<>(byKey.values());
  }

  private static List<Object> key(Map<String, Object> row, List<String> columns) {
    List<Object> key = new ArrayList<>(columns.size());
    for (String column : columns) {
      key.add(row.get(column));
    }
    return key;
  }

  private static List<QuarantineRecord> nextQuarantine(List<QuarantineRecord> current,
      WriteRequest request) {
    List<QuarantineRecord> result = new ArrayList<>();
    switch (request.getMode()) {
      case APPEND:
        if (current != null) {
          result.addAll(current);
        }
        result.addAll(request.getQuarantine());
        break;
      case MERGE:
        if (current != null) {
          result.addAll(current);
        }
        for (QuarantineRecord record : request.getQuarantine()) {
          if (!result.contains(record)) {
            result.add(record);
          }
        }
        break;
      default:
        result.addAll(request.getQuarantine());
    }
    return result;
  }
}
