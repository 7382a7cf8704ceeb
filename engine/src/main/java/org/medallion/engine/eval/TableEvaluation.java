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

import org.medallion.engine.validation.CandidateRow;
import org.medallion.engine.validation.QuarantineRecord;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Derived rows of one target table, ready for validation, plus the rows
 * removed by field-level errors.
 */
public class TableEvaluation {

  private final List<CandidateRow> rows;
  private final List<QuarantineRecord> quarantine;
  private final long droppedRows;
  private final long rowErrors;

  TableEvaluation(List<CandidateRow> rows, List<QuarantineRecord> quarantine, long droppedRows,
      long rowErrors) {
    this.rows = ImmutableList.copyOf(rows);
    this.quarantine = ImmutableList.copyOf(quarantine);
    this.droppedRows = droppedRows;
    this.rowErrors = rowErrors;
  }

  public List<CandidateRow> getRows() {
    return rows;
  }

  public List<QuarantineRecord> getQuarantine() {
    return quarantine;
  }

  /**
   * Returns the number of rows dropped because a field could not be derived.
   */
  public long getDroppedRows() {
    return droppedRows;
  }

  /**
   * Returns the number of rows removed by field errors, dropped or quarantined.
   */
  public long getRowErrors() {
    return rowErrors;
  }
}
