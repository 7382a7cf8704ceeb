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

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.FieldConfig;

/**
 * A named transformation registered in the operation registry.
 *
 * <p>An operation is bound once per field at compile time. Binding checks
 * the field's parameters and returns a {@link BoundOperation} that the
 * engine evaluates row by row. Parameter errors surface as
 * {@link ConfigException}s before any data is read.
 */
@FunctionalInterface
public interface Operation {

  /**
   * Binds this operation to a field.
   *
   * @param field Field configuration naming this operation
   * @param lookup Resolves other registered operations by name
   * @return Bound operation for the field
   * @throws ConfigException If the field's inputs or parameters are invalid
   */
  BoundOperation bind(FieldConfig field, OperationLookup lookup);
}
