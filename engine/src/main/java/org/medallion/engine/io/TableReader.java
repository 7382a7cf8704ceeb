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

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Functional interface for reading source tables into the engine.
 *
 * <p>Implementations front whatever ingests and decodes the data: object
 * storage, a lakehouse catalog, a database. Each row is a map of column name
 * to value, using {@code Map} and {@code List} for nested values. Rows
 * normally carry the provenance columns ({@code filename}, {@code path},
 * {@code ingestion_timestamp}, {@code file_format}, {@code compression_type}),
 * which pass through untouched unless referenced.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TableReader reader = table -> catalog.scan(table).iterator();
 * PipelineEngine engine = new PipelineEngine(registries, EngineConfig.defaults(), reader, writer);
 * }</pre>
 */
@FunctionalInterface
public interface TableReader {

  /**
   * Reads all rows of a source table. Called at most once per table per run.
   *
   * @param table Source table name
   * @return Iterator of rows, in the table's order
   * @throws IOException If the table cannot be read
   */
  Iterator<Map<String, Object>> read(String table) throws IOException;
}
