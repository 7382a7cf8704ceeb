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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed, path-aware access to one mapping of a parsed pipeline document.
 *
 * <p>Every accessor reports failures as {@link ConfigException}s that name
 * the document path of the offending key.
 */
final class ConfigReader {

  private final Map<String, Object> map;
  private final String path;

  private ConfigReader(Map<String, Object> map, String path) {
    this.map = map;
    this.path = path;
  }

  @SuppressWarnings("unchecked")
  static ConfigReader of(@Nullable Object value, String path) {
    if (!(value instanceof Map)) {
      throw new ConfigException("expected a mapping but found " + describe(value), path);
    }
    for (Object key : ((Map<?, ?>) value).keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException("mapping key " + key + " is not a string", path);
      }
    }
    return new ConfigReader((Map<String, Object>) value, path);
  }

  String path() {
    return path;
  }

  String path(String key) {
    return path + "." + key;
  }

  /**
   * Rejects keys that are not in the given set, so that typos fail loudly
   * instead of being ignored.
   */
  void allowKeys(String... keys) {
    Set<String> allowed = new LinkedHashSet<>(Arrays.asList(keys));
    for (String key : map.keySet()) {
      if (!allowed.contains(key)) {
        throw new ConfigException("unknown key '" + key + "'; expected one of " + allowed,
            path(key));
      }
    }
  }

  boolean has(String key) {
    return map.get(key) != null;
  }

  @Nullable Object get(String key) {
    return map.get(key);
  }

  String requireString(String key) {
    String value = optString(key);
    if (value == null || value.isEmpty()) {
      throw new ConfigException("missing required key '" + key + "'", path(key));
    }
    return value;
  }

  @Nullable String optString(String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw new ConfigException("expected a string but found " + describe(value), path(key));
    }
    return (String) value;
  }

  boolean optBoolean(String key, boolean defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Boolean)) {
      throw new ConfigException("expected true or false but found " + describe(value),
          path(key));
    }
    return (Boolean) value;
  }

  @Nullable Long optLong(String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Integer || value instanceof Long)) {
      throw new ConfigException("expected an integer but found " + describe(value), path(key));
    }
    return ((Number) value).longValue();
  }

  List<Object> optList(String key) {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      throw new ConfigException("expected a list but found " + describe(value), path(key));
    }
    return new ArrayList<>((List<?>) value);
  }

  Map<String, Object> optMap(String key) {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyMap();
    }
    return new LinkedHashMap<>(of(value, path(key)).map);
  }

  /**
   * Reads a key that may hold either a single string or a list of strings.
   */
  List<String> optStringList(String key) {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (value instanceof String) {
      return Collections.singletonList((String) value);
    }
    if (!(value instanceof List)) {
      throw new ConfigException("expected a string or a list of strings but found "
          + describe(value), path(key));
    }
    List<String> result = new ArrayList<>();
    List<?> list = (List<?>) value;
    for (int i = 0; i < list.size(); i++) {
      Object item = list.get(i);
      if (!(item instanceof String) || ((String) item).isEmpty()) {
        throw new ConfigException("expected a non-empty string but found " + describe(item),
            path(key) + "[" + i + "]");
      }
      result.add((String) item);
    }
    return result;
  }

  static String describe(@Nullable Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Map) {
      return "a mapping";
    }
    if (value instanceof List) {
      return "a list";
    }
    return value.getClass().getSimpleName() + " '" + value + "'";
  }
}
