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

import java.util.ArrayList;
import java.util.List;

/**
 * Base of single-input operations that transform one value.
 *
 * <p>The field's structural path is applied to the input first. When the
 * path contains an {@code []} step the operation explodes: each element is
 * transformed and becomes its own row.
 */
abstract class ElementwiseOperation extends BoundOperation {

  ElementwiseOperation(FieldConfig field) {
    super(field, field.getPath().hasElements() ? Cardinality.ONE_TO_MANY : Cardinality.ONE_TO_ONE);
  }

  @Override public @Nullable Object apply(OperationContext context,
      List<@Nullable Object> inputs) throws Exception {
    Object value = field.getPath().resolve(inputs.get(0));
    if (getCardinality() == Cardinality.ONE_TO_ONE) {
      return convert(context, value);
    }
    List<?> elements = (List<?>) value;
    List<@Nullable Object> converted = new ArrayList<>(elements.size());
    for (Object element : elements) {
      converted.add(convert(context, element));
    }
    return converted;
  }

  /**
   * Transforms one value.
   */
  protected abstract @Nullable Object convert(OperationContext context, @Nullable Object value)
      throws Exception;
}
