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
package org.medallion.engine.eval;

import org.medallion.engine.InvocationGuard;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.graph.InputRef;
import org.medallion.engine.io.TableReader;
import org.medallion.engine.op.OperationContext;
import org.medallion.engine.plan.SourcePlan;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the source tables of a run and computes their root-scope transients.
 *
 * <p>Each source table is read exactly once. Transients are computed per
 * source row in dependency order and stored in a {@link TransientCache}.
 * A row whose transient fails to compute caches the failure instead of a
 * value; each target reading it applies its own error action.
 *
 * <p>Sources are materialized one after another. Nothing else runs until
 * materialization completes, so targets only ever read a finished cache.
 */
public class SourceMaterializer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceMaterializer.class);

  private final TableReader reader;
  private final InvocationGuard guard;

  public SourceMaterializer(TableReader reader, InvocationGuard guard) {
    this.reader = reader;
    this.guard = guard;
  }

  /**
   * Reads and materializes source tables. A source that cannot be read is
   * reported in {@code failures} and left out of the result.
   *
   * @param sources Source plans, in declaration order
   * @param failures Receives read failures by source table name
   * @return Materialized sources
   */
  public MaterializedSources materialize(List<SourcePlan> sources,
      Map<String, SourceReadException> failures) {
    Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    TransientCache cache = new TransientCache();
    for (SourcePlan source : sources) {
      List<Map<String, Object>> rows;
      try {
        rows = read(source.getTable());
      } catch (SourceReadException e) {
        LOGGER.error("Cannot read source table '{}'", source.getTable(), e);
        failures.put(source.getTable(), e);
        continue;
      }
      tables.put(source.getTable(), rows);
    }

    MaterializedSources materialized = new MaterializedSources(tables, cache);
    for (SourcePlan source : sources) {
      List<Map<String, Object>> rows = tables.get(source.getTable());
      if (rows == null) {
        continue;
      }
      long startTime = System.currentTimeMillis();
      List<Row> current = new ArrayList<>(rows.size());
      for (int i = 0; i < rows.size(); i++) {
        current.add(new Row(i, rows.get(i)));
      }
      int failed = 0;
      for (DagNode node : source.getTransients()) {
        failed += materialize(node, source.getTable(), current, materialized, cache);
      }
      LOGGER.info("Materialized source '{}': {} rows, {} transients in {}ms",
          source.getTable(), rows.size(), source.getTransients().size(),
          System.currentTimeMillis() - startTime);
      if (failed > 0) {
        LOGGER.warn("Source '{}': {} transient values could not be computed", source.getTable(),
            failed);
      }
    }
    return materialized;
  }

  private List<Map<String, Object>> read(String table) {
    List<Map<String, Object>> rows = new ArrayList<>();
    try {
      Iterator<Map<String, Object>> iterator = reader.read(table);
      while (iterator.hasNext()) {
        rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(iterator.next())));
      }
    } catch (IOException | RuntimeException e) {
      throw new SourceReadException(table, e);
    }
    LOGGER.debug("Read {} rows from source table '{}'", rows.size(), table);
    return rows;
  }

  private int materialize(DagNode node, String table, List<Row> rows,
      MaterializedSources sources, TransientCache cache) {
    OperationContext context = Evaluations.context(node, table, sources, guard);
    List<Object> values = new ArrayList<>(rows.size());
    int failed = 0;
    for (Row row : rows) {
      Object value;
      Object input = firstFailedInput(node, row);
      if (input != null) {
        value = input;
      } else {
        try {
          value = Evaluations.invoke(node, context, row, guard);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while materializing " + table, e);
        } catch (Exception e) {
          LOGGER.debug("Transient '{}' of '{}' failed for row {}", node.getName(), table,
              row.getSourceIndex(), e);
          value = new NodeError(e);
        }
      }
      if (value instanceof NodeError) {
        failed++;
      }
      row.put(node.getNamespace(), node.getName(), value);
      values.add(value);
    }
    cache.put(table, node.getName(), values);
    return failed;
  }

  // A transient reading a failed transient fails with the same cause
  private static @Nullable Object firstFailedInput(DagNode node, Row row) {
    for (InputRef input : node.getInputs()) {
      Object value = row.get(input.getNamespace(), input.getKey());
      if (value instanceof NodeError) {
        return value;
      }
    }
    return null;
  }
}
