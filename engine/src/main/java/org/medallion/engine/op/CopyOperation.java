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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The {@code copy} and {@code rename} operations: the output is the input
 * value unchanged. A rename must produce a name different from its input.
 */
public class CopyOperation implements Operation {

  private final boolean rename;

  public CopyOperation(boolean rename) {
    this.rename = rename;
  }

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    OperationParameters.requireSingleInput(field);
    OperationParameters.of(field);
    if (rename && field.getName().equals(field.getField())) {
      throw new ConfigException("rename must produce a name different from its field '"
          + field.getField() + "'", field.getLocation() + ".name");
    }
    return new ElementwiseOperation(field) {
      @Override protected @Nullable Object convert(OperationContext context,
          @Nullable Object value) {
        return value;
      }
    };
  }
}
