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
package org.medallion.engine;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a pipeline run: one {@link TableResult} per target table, in
 * declaration order.
 */
public class PipelineResult {

  private final String pipelineName;
  private final List<TableResult> tables;
  private final long elapsedMs;

  PipelineResult(String pipelineName, List<TableResult> tables, long elapsedMs) {
    this.pipelineName = pipelineName;
    this.tables = ImmutableList.copyOf(tables);
    this.elapsedMs = elapsedMs;
  }

  public String getPipelineName() {
    return pipelineName;
  }

  public List<TableResult> getTables() {
    return tables;
  }

  public @Nullable TableResult getTable(String table) {
    for (TableResult result : tables) {
      if (result.getTable().equals(table)) {
        return result;
      }
    }
    return null;
  }

  /**
   * Returns whether every target table succeeded.
   */
  public boolean isSuccessful() {
    for (TableResult result : tables) {
      if (!result.isSuccessful()) {
        return false;
      }
    }
    return true;
  }

  public List<TableResult> getTables(TableResult.Status status) {
    List<TableResult> matching = new ArrayList<>();
    for (TableResult result : tables) {
      if (result.getStatus() == status) {
        matching.add(result);
      }
    }
    return matching;
  }

  public long getRowsWritten() {
    long rows = 0;
    for (TableResult result : tables) {
      rows += result.getRowsWritten();
    }
    return rows;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "PipelineResult{pipeline='" + pipelineName + "', tables=" + tables.size()
        + ", succeeded=" + getTables(TableResult.Status.SUCCEEDED).size()
        + ", failed=" + getTables(TableResult.Status.FAILED).size()
        + ", cancelled=" + getTables(TableResult.Status.CANCELLED).size()
        + ", rows=" + getRowsWritten() + ", elapsed=" + elapsedMs + "ms}";
  }
}
