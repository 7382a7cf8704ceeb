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

import java.util.Locale;

/**
 * How a target table's validated rows are committed.
 */
public enum WriteMode {
  /** Replace the whole table. */
  OVERWRITE,
  /** Insert rows after the existing ones. */
  APPEND,
  /** Upsert by merge key: insert new keys, overwrite the fields of matching keys. */
  MERGE;

  /**
   * Parses a mode name as written in a pipeline document.
   *
   * @throws IllegalArgumentException if the name is not a known mode
   */
  public static WriteMode parse(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
