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
import org.medallion.engine.config.FieldType;
import org.medallion.engine.config.SchemaField;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code parse_json} and {@code parse_and_flatten} operations decode a
 * semi-structured field and address a value inside it.
 *
 * <p>Text input is decoded with the field's parser ({@code json} unless
 * {@code parser} names another); input that is already a map or list passes
 * through. The structural path is then resolved against the decoded value.
 * A path with an {@code []} step makes the field an explode: every element
 * becomes its own row, and an empty or missing array yields no rows.
 *
 * <p>With a {@code schema}, objects are projected to the schema's fields in
 * schema order, each cast to its declared type. {@code parse_and_flatten}
 * additionally flattens nested objects, joining keys with {@code __} (or the
 * {@code separator} parameter) before projection.
 */
public class ParseOperation implements Operation {

  public static final String DEFAULT_PARSER = "json";

  private final boolean flatten;

  public ParseOperation(boolean flatten) {
    this.flatten = flatten;
  }

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    OperationParameters.requireSingleInput(field);
    StructFlattener flattener = null;
    if (flatten) {
      OperationParameters params = OperationParameters.of(field, "separator", "max_depth");
      String separator = params.optString("separator");
      BigDecimal maxDepth = params.optNumber("max_depth");
      if (maxDepth != null && maxDepth.signum() < 0) {
        throw params.error("max_depth", "max_depth must not be negative");
      }
      flattener = new StructFlattener(
          separator != null ? separator : StructFlattener.DEFAULT_SEPARATOR,
          maxDepth != null ? maxDepth.intValue() : StructFlattener.DEFAULT_MAX_DEPTH);
    } else {
      OperationParameters.of(field);
    }
    return new Bound(field, flattener);
  }

  private static class Bound extends BoundOperation {
    private final @Nullable StructFlattener flattener;
    private final List<SchemaField> schema;

    Bound(FieldConfig field, @Nullable StructFlattener flattener) {
      super(field, field.getPath().hasElements()
          ? Cardinality.ONE_TO_MANY : Cardinality.ONE_TO_ONE);
      this.flattener = flattener;
      this.schema = ImmutableList.copyOf(field.getSchema());
    }

    @Override public String getParserName() {
      return field.getParser() != null ? field.getParser() : DEFAULT_PARSER;
    }

    @Override public @Nullable Object apply(OperationContext context,
        List<@Nullable Object> inputs) throws Exception {
      Object raw = inputs.get(0);
      Object decoded = raw instanceof String ? context.parse((String) raw) : raw;
      Object value = field.getPath().resolve(decoded);
      if (getCardinality() == Cardinality.ONE_TO_ONE) {
        return shape(value);
      }
      List<?> elements = (List<?>) value;
      List<@Nullable Object> shaped = new ArrayList<>(elements.size());
      for (Object element : elements) {
        shaped.add(shape(element));
      }
      return shaped;
    }

    @SuppressWarnings("unchecked")
    private @Nullable Object shape(@Nullable Object value) {
      if (!(value instanceof Map)) {
        if (value != null && !schema.isEmpty()) {
          throw new CastException(value, FieldType.of(FieldType.Kind.OBJECT),
              "schema requires an object");
        }
        return value;
      }
      Map<String, Object> object = (Map<String, Object>) value;
      if (flattener != null) {
        object = flattener.flatten(object);
      }
      if (schema.isEmpty()) {
        return object;
      }
      Map<String, Object> projected = new LinkedHashMap<>();
      for (SchemaField column : schema) {
        projected.put(column.getName(),
            ValueCasts.cast(object.get(column.getName()), column.getType(), false));
      }
      return projected;
    }
  }
}
