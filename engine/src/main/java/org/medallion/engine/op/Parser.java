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

/**
 * Turns the text of a source field into a structured value: a
 * {@code Map<String, Object>} for objects, a {@code List<Object>} for
 * arrays, or a scalar.
 *
 * <p>Parsers are registered by name in the parser registry and referenced
 * from the {@code parser} key of parse operations. Implementations must be
 * thread-safe; the engine invokes them concurrently and under the
 * invocation timeout.
 */
@FunctionalInterface
public interface Parser {

  /**
   * Parses text into a structured value.
   *
   * @param text Raw field text
   * @return Parsed value, may be null for an explicit null literal
   * @throws Exception If the text is malformed
   */
  @Nullable Object parse(String text) throws Exception;
}
