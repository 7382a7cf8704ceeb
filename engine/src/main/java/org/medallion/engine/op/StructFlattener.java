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
package org.medallion.engine.op;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens nested objects into a single level.
 * Nested keys are joined with a separator; arrays and scalars are kept as values.
 */
public class StructFlattener {
  public static final String DEFAULT_SEPARATOR = "__";
  public static final int DEFAULT_MAX_DEPTH = 32;

  private final String separator;
  private final int maxDepth;

  public StructFlattener() {
    this(DEFAULT_SEPARATOR, DEFAULT_MAX_DEPTH);
  }

  public StructFlattener(String separator, int maxDepth) {
    this.separator = separator;
    this.maxDepth = maxDepth;
  }

  /**
   * Flattens a nested map structure.
   *
   * @param input The map to flatten
   * @return A new map with flattened keys, in encounter order
   */
  public Map<String, Object> flatten(Map<String, Object> input) {
    Map<String, Object> output = new LinkedHashMap<>();
    flattenObject("", input, output, 0);
    return output;
  }

  private void flattenObject(String prefix, Map<String, Object> obj,
                            Map<String, Object> output, int depth) {
    for (Map.Entry<String, Object> entry : obj.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + separator + entry.getKey();
      Object value = entry.getValue();

      if (value instanceof Map && depth < maxDepth) {
        @SuppressWarnings("unchecked")
        Map<String, Object> mapValue = (Map<String, Object>) value;
        if (mapValue.isEmpty()) {
          // Empty objects contribute no columns
          continue;
        }
        flattenObject(key, mapValue, output, depth + 1);
      } else {
        output.put(key, value);
      }
    }
  }
}
