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
package org.medallion.engine.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row removed from a target table under the {@code quarantine} action,
 * with the cause of its removal.
 */
public class QuarantineRecord {

  private final String table;
  private final String validation;
  private final String field;
  private final String reason;
  private final Map<String, Object> row;

  public QuarantineRecord(String table, String validation, String field, String reason,
      Map<String, Object> row) {
    this.table = table;
    this.validation = validation;
    this.field = field;
    this.reason = reason;
    this.row = Collections.unmodifiableMap(new LinkedHashMap<>(row));
  }

  public String getTable() {
    return table;
  }

  /**
   * Returns the validation that rejected the row, or the operation of the
   * field whose derivation failed.
   */
  public String getValidation() {
    return validation;
  }

  public String getField() {
    return field;
  }

  public String getReason() {
    return reason;
  }

  /**
   * Returns the row's persisted columns as derived before removal.
   */
  public Map<String, Object> getRow() {
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuarantineRecord)) {
      return false;
    }
    QuarantineRecord that = (QuarantineRecord) o;
    return table.equals(that.table) && validation.equals(that.validation)
        && field.equals(that.field) && reason.equals(that.reason) && row.equals(that.row);
  }

  @Override public int hashCode() {
    return Objects.hash(table, validation, field, reason, row);
  }

  @Override public String toString() {
    return "QuarantineRecord{table='" + table + "', validation='" + validation
        + "', field='" + field + "', reason='" + reason + "', row=" + row + "}";
  }
}
