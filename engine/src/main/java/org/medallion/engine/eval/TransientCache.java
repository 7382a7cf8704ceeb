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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Values of source-level transients computed once per run, keyed by
 * (source table, transient name), one value per source row.
 *
 * <p>Each entry is written exactly once, during source materialization,
 * and only read afterwards by concurrent target evaluations.
 */
public class TransientCache {

  private final Map<String, List<Object>> values = new ConcurrentHashMap<>();

  /**
   * Stores the values of a transient.
   *
   * @throws IllegalStateException If the transient was already stored
   */
  void put(String table, String transientName, List<Object> rowValues) {
    List<Object> previous = values.putIfAbsent(key(table, transientName),
        Collections.unmodifiableList(new ArrayList<>(rowValues)));
    if (previous != null) {
      throw new IllegalStateException("Transient '" + transientName + "' of '" + table
          + "' was already materialized");
    }
  }

  /**
   * Returns the per-row values of a transient.
   *
   * @throws IllegalStateException If the transient was not materialized
   */
  List<Object> get(String table, String transientName) {
    List<Object> rowValues = values.get(key(table, transientName));
    if (rowValues == null) {
      throw new IllegalStateException("Transient '" + transientName + "' of '" + table
          + "' was not materialized");
    }
    return rowValues;
  }

  public boolean contains(String table, String transientName) {
    return values.containsKey(key(table, transientName));
  }

  public int size() {
    return values.size();
  }

  private static String key(String table, String transientName) {
    return table + "::" + transientName;
  }
}
