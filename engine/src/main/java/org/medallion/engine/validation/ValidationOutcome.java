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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * Rows that survived validation, plus what was removed.
 */
public class ValidationOutcome {

  private final List<Map<String, Object>> rows;
  private final List<QuarantineRecord> quarantine;
  private final long droppedRows;

  public ValidationOutcome(List<Map<String, Object>> rows, List<QuarantineRecord> quarantine,
      long droppedRows) {
    this.rows = ImmutableList.copyOf(rows);
    this.quarantine = ImmutableList.copyOf(quarantine);
    this.droppedRows = droppedRows;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public List<QuarantineRecord> getQuarantine() {
    return quarantine;
  }

  public long getDroppedRows() {
    return droppedRows;
  }
}
