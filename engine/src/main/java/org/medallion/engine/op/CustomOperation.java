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

import org.medallion.engine.config.FieldConfig;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts a user-registered {@link CustomFunction} to an operation.
 * Custom operations are always one-to-one and run as user code.
 */
public class CustomOperation implements Operation {

  private final String name;
  private final CustomFunction function;

  public CustomOperation(String name, CustomFunction function) {
    this.name = name;
    this.function = function;
  }

  public String getName() {
    return name;
  }

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    Map<String, Object> parameters = new LinkedHashMap<>(field.getParameters());
    if (CustomOpDispatch.NAME.equals(field.getOp())) {
      parameters.remove(CustomOpDispatch.OPERATION_PARAMETER);
    }
    return new Bound(field, name, function, parameters);
  }

  private static class Bound extends BoundOperation {
    private final String name;
    private final CustomFunction function;
    private final Map<String, Object> parameters;

    Bound(FieldConfig field, String name, CustomFunction function,
        Map<String, Object> parameters) {
      super(field, Cardinality.ONE_TO_ONE);
      this.name = name;
      this.function = function;
      this.parameters = Collections.unmodifiableMap(parameters);
    }

    @Override public boolean isUserCode() {
      return true;
    }

    @Override public @Nullable Object apply(OperationContext context,
        List<@Nullable Object> inputs) throws Exception {
      return function.apply(inputs, parameters);
    }

    @Override public String toString() {
      return name + "(" + String.join(", ", getInputs()) + ")";
    }
  }
}
