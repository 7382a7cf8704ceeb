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

import java.io.IOException;

/**
 * Interface for committing target tables.
 *
 * <p>The engine calls {@link #write} once per successful target table.
 * Failed or cancelled tables are not written at all. Implementations must
 * be thread-safe; distinct target tables are written concurrently.
 */
public interface TableWriter {

  /**
   * Commits the rows and the quarantine output of a target table as one
   * unit: either both are applied or neither is.
   *
   * <p>Quarantine records follow the write mode too. Under
   * {@link WriteMode#OVERWRITE} they replace the table's previous quarantine
   * output, under {@link WriteMode#APPEND} they are added to it, and under
   * {@link WriteMode#MERGE} only records not already present are added.
   *
   * @param request Table, mode, columns, rows and quarantine records
   * @return Number of rows written
   * @throws IOException If the commit fails; nothing has been applied
   */
  long write(WriteRequest request) throws IOException;
}
