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

import org.medallion.engine.validation.QuarantineRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Outcome of one target table within a pipeline run.
 *
 * <p>Rows removed from the table are accounted separately: dropped rows
 * (by field errors or validations under {@code drop}) are only counted,
 * quarantined rows are kept in {@link #getQuarantine()}. A failed or
 * cancelled table wrote nothing.
 */
public class TableResult {

  /**
   * Final state of a target table.
   */
  public enum Status {
    /** Rows were validated and written. */
    SUCCEEDED,
    /** Evaluation, validation, source read or write failed; see the cause. */
    FAILED,
    /** The table was cancelled before it was written. */
    CANCELLED
  }

  private final String table;
  private final Status status;
  private final long rowsWritten;
  private final long droppedRows;
  private final long rowErrors;
  private final List<QuarantineRecord> quarantine;
  private final @Nullable PipelineException cause;
  private final long elapsedMs;

  private TableResult(Builder builder) {
    this.table = builder.table;
    this.status = builder.status;
    this.rowsWritten = builder.rowsWritten;
    this.droppedRows = builder.droppedRows;
    this.rowErrors = builder.rowErrors;
    this.quarantine = ImmutableList.copyOf(builder.quarantine);
    this.cause = builder.cause;
    this.elapsedMs = builder.elapsedMs;
  }

  public String getTable() {
    return table;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isSuccessful() {
    return status == Status.SUCCEEDED;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  /**
   * Returns the number of rows removed under the {@code drop} action.
   */
  public long getDroppedRows() {
    return droppedRows;
  }

  public long getQuarantinedRows() {
    return quarantine.size();
  }

  /**
   * Returns the number of rows removed because a field could not be
   * derived, whether dropped or quarantined.
   */
  public long getRowErrors() {
    return rowErrors;
  }

  public List<QuarantineRecord> getQuarantine() {
    return quarantine;
  }

  /**
   * Returns why the table failed or was cancelled, or null if it succeeded.
   */
  public @Nullable PipelineException getCause() {
    return cause;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("TableResult{table='").append(table).append("', ").append(status);
    if (status == Status.SUCCEEDED) {
      sb.append(", written=").append(rowsWritten);
      sb.append(", dropped=").append(droppedRows);
      sb.append(", quarantined=").append(quarantine.size());
    } else if (cause != null) {
      sb.append(": ").append(cause.getMessage());
    }
    sb.append(", elapsed=").append(elapsedMs).append("ms}");
    return sb.toString();
  }

  public static Builder builder(String table) {
    return new Builder(table);
  }

  static TableResult failed(String table, PipelineException cause, long elapsedMs) {
    return builder(table).status(Status.FAILED).cause(cause).elapsedMs(elapsedMs).build();
  }

  static TableResult cancelled(String table, long elapsedMs) {
    return builder(table)
        .status(Status.CANCELLED)
        .cause(new TableCancelledException(table))
        .elapsedMs(elapsedMs)
        .build();
  }

  /**
   * Builder for TableResult.
   */
  public static class Builder {
    private final String table;
    private Status status = Status.SUCCEEDED;
    private long rowsWritten;
    private long droppedRows;
    private long rowErrors;
    private List<QuarantineRecord> quarantine = ImmutableList.of();
    private @Nullable PipelineException cause;
    private long elapsedMs;

    private Builder(String table) {
      this.table = table;
    }

    public Builder status(Status status) {
      this.status = status;
      return this;
    }

    public Builder rowsWritten(long rowsWritten) {
      this.rowsWritten = rowsWritten;
      return this;
    }

    public Builder droppedRows(long droppedRows) {
      this.droppedRows = droppedRows;
      return this;
    }

    public Builder rowErrors(long rowErrors) {
      this.rowErrors = rowErrors;
      return this;
    }

    public Builder quarantine(List<QuarantineRecord> quarantine) {
      this.quarantine = quarantine;
      return this;
    }

    public Builder cause(PipelineException cause) {
      this.cause = cause;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public TableResult build() {
      if (status != Status.SUCCEEDED && cause == null) {
        throw new IllegalStateException("a " + status + " table result needs a cause");
      }
      return new TableResult(this);
    }
  }
}
