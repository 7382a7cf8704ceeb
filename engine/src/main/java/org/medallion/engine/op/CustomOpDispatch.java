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
 * The {@code custom_op} operation: binds the field to the registered custom
 * operation named by its {@code operation} parameter.
 *
 * <pre>{@code
 * - name: tag_count
 *   op: custom_op
 *   field: tags_struct
 *   parameters: {operation: count_items}
 * }</pre>
 */
public class CustomOpDispatch implements Operation {

  public static final String NAME = "custom_op";
  public static final String OPERATION_PARAMETER = "operation";

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    Object target = field.getParameter(OPERATION_PARAMETER);
    String location = field.getLocation() + ".parameters." + OPERATION_PARAMETER;
    if (!(target instanceof String)) {
      throw new ConfigException("custom_op requires the name of a registered operation in '"
          + OPERATION_PARAMETER + "'", location);
    }
    Operation operation = lookup.lookup((String) target, location);
    if (!(operation instanceof CustomOperation)) {
      throw new ConfigException("'" + target + "' is a built-in operation; custom_op dispatches"
          + " only to registered custom operations", location);
    }
    return operation.bind(field, lookup);
  }
}
