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

import org.medallion.engine.PipelineException;

/**
 * Raised when deriving a field fails for a row and the field's error action
 * is {@code fail}. Aborts the target table; nothing is written for it.
 */
public class FieldEvaluationException extends PipelineException {

  private final String table;
  private final String field;

  public FieldEvaluationException(String table, String field, Throwable cause) {
    super("failed to derive field '" + field + "' of table '" + table + "': "
        + Evaluations.describe(cause), null, cause);
    this.table = table;
    this.field = field;
  }

  public String getTable() {
    return table;
  }

  public String getField() {
    return field;
  }
}
