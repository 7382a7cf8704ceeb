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

import org.medallion.engine.op.TableLookup;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Source tables read for a run together with their materialized transients.
 * Read-only once built; shared by all target evaluations.
 */
public class MaterializedSources implements TableLookup {

  private final Map<String, List<Map<String, Object>>> tables;
  private final TransientCache cache;

  MaterializedSources(Map<String, List<Map<String, Object>>> tables, TransientCache cache) {
    this.tables = ImmutableMap.copyOf(tables);
    this.cache = cache;
  }

  @Override public List<Map<String, Object>> rows(String table) {
    List<Map<String, Object>> rows = tables.get(table);
    if (rows == null) {
      throw new IllegalStateException("Source table '" + table + "' was not read");
    }
    return rows;
  }

  public boolean contains(String table) {
    return tables.containsKey(table);
  }

  public TransientCache getCache() {
    return cache;
  }
}
