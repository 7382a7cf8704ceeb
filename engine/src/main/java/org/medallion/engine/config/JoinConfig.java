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
package org.medallion.engine.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One join step of a {@code join} column: the source table to join with and
 * the key pairs (left field of the current row, right field of the joined table).
 *
 * <pre>{@code
 * join:
 *   - table: bronze.users
 *     on: {author_id: user_id}
 * }</pre>
 */
public class JoinConfig {

  private final String table;
  private final Map<String, String> on;

  public JoinConfig(String table, Map<String, String> on) {
    this.table = table;
    this.on = Collections.unmodifiableMap(new LinkedHashMap<>(on));
  }

  /**
   * Returns the joined source table.
   */
  public String getTable() {
    return table;
  }

  /**
   * Returns the join keys, left field to right field, in declaration order.
   */
  public Map<String, String> getOn() {
    return on;
  }

  static JoinConfig fromMap(Object raw, String path) {
    ConfigReader reader = ConfigReader.of(raw, path);
    reader.allowKeys("table", "on");
    String table = reader.requireString("table");
    Map<String, Object> keys = reader.optMap("on");
    if (keys.isEmpty()) {
      throw new ConfigException("join requires at least one key pair", reader.path("on"));
    }
    Map<String, String> on = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : keys.entrySet()) {
      if (!(entry.getValue() instanceof String)) {
        throw new ConfigException("join key must name a field of " + table,
            reader.path("on") + "." + entry.getKey());
      }
      on.put(entry.getKey(), (String) entry.getValue());
    }
    return new JoinConfig(table, on);
  }

  @Override public String toString() {
    return "JoinConfig{table='" + table + "', on=" + on + "}";
  }
}
