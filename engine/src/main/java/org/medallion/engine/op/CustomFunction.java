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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A user-supplied row-level function, registered under a name in the
 * operation registry.
 *
 * <p>Custom functions always map one input row to one output value. They
 * are invoked with the resolved values of the field's input references and
 * its {@code parameters} block, and run under the engine's invocation
 * timeout. Exceptions they throw are row errors, handled by the field's
 * {@code on_error} action.
 *
 * <pre>{@code
 * registries.registerOperation("normalize_tag", (values, params) ->
 *     values.get(0) == null ? null : values.get(0).toString().trim().toLowerCase());
 * }</pre>
 */
@FunctionalInterface
public interface CustomFunction {

  /**
   * Computes the field value for one row.
   *
   * @param values Resolved input values, in the order of the field's references
   * @param parameters The field's parameters block, never null
   * @return The derived value
   * @throws Exception On any row-level failure
   */
  @Nullable Object apply(List<@Nullable Object> values, Map<String, Object> parameters)
      throws Exception;
}
