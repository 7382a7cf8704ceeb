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
package org.medallion.engine.validation;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * A row predicate registered by name in the validation registry.
 *
 * <p>Implementations must be thread-safe; target tables are validated
 * concurrently. A predicate that throws or overruns the invocation timeout
 * counts as a failed check.
 *
 * <pre>{@code
 * registries.registerValidation("valid_score",
 *     (value, params) -> value != null && ((Number) value).intValue() >= 0);
 * }</pre>
 */
@FunctionalInterface
public interface ValidationFunction {

  /**
   * Tests the value of the validated field for one row.
   *
   * @param value Field value
   * @param parameters The validation's parameters block, never null
   * @return true if the row passes
   * @throws Exception On failure to evaluate the predicate
   */
  boolean test(@Nullable Object value, Map<String, Object> parameters) throws Exception;

  /**
   * Checks the parameters block at compile time.
   *
   * @throws IllegalArgumentException If the parameters are invalid
   */
  default void checkParameters(Map<String, Object> parameters) {
  }
}
