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

import org.medallion.engine.graph.InputRef;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * One in-flight row of a table being evaluated.
 *
 * <p>Source fields, source-level transients and target-level fields live in
 * separate namespaces, so a field may share its name with what it derives
 * from. The source row itself is shared and never modified; copies made
 * when a row explodes duplicate only the derived values.
 */
final class Row {

  private final int sourceIndex;
  private final Map<String, Object> fields;
  private final Map<String, Object> sourceTransients;
  private final Map<String, Object> derived;

  Row(int sourceIndex, Map<String, Object> fields) {
    this(sourceIndex, fields, new HashMap<>(), new HashMap<>());
  }

  private Row(int sourceIndex, Map<String, Object> fields, Map<String, Object> sourceTransients,
      Map<String, Object> derived) {
    this.sourceIndex = sourceIndex;
    this.fields = fields;
    this.sourceTransients = sourceTransients;
    this.derived = derived;
  }

  /**
   * Returns the position of the source row this row descends from.
   */
  int getSourceIndex() {
    return sourceIndex;
  }

  @Nullable Object get(InputRef.Namespace namespace, String key) {
    return values(namespace).get(key);
  }

  boolean has(InputRef.Namespace namespace, String key) {
    return values(namespace).containsKey(key);
  }

  void put(InputRef.Namespace namespace, String key, @Nullable Object value) {
    if (namespace == InputRef.Namespace.SOURCE_FIELD) {
      throw new IllegalArgumentException("Source fields are read-only");
    }
    values(namespace).put(key, value);
  }

  /**
   * Resolves a reference against this row.
   *
   * @throws IllegalArgumentException If the reference's path expects an
   *     array where the row holds another value
   */
  @Nullable Object resolve(InputRef input) {
    return input.getPath().resolve(get(input.getNamespace(), input.getKey()));
  }

  Row copy() {
    return new Row(sourceIndex, fields, new HashMap<>(sourceTransients), new HashMap<>(derived));
  }

  private Map<String, Object> values(InputRef.Namespace namespace) {
    switch (namespace) {
      case SOURCE_FIELD:
        return fields;
      case SOURCE_TRANSIENT:
        return sourceTransients;
      default:
        return derived;
    }
  }
}
