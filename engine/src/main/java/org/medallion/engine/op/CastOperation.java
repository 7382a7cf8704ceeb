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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.format.DateTimeFormatter;

/**
 * The {@code cast} operation converts its input to the {@code type}
 * parameter, and the {@code date} operation converts it to a date.
 *
 * <pre>{@code
 * - name: answer_score
 *   op: cast
 *   field: answers_struct.score
 *   parameters: {type: integer, strict: true}
 *
 * - name: asked_on
 *   op: date
 *   field: created
 *   parameters: {format: "dd/MM/yyyy"}
 * }</pre>
 *
 * @see ValueCasts
 */
public class CastOperation implements Operation {

  private final boolean date;

  public CastOperation(boolean date) {
    this.date = date;
  }

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    OperationParameters.requireSingleInput(field);
    if (date) {
      OperationParameters params = OperationParameters.of(field, "format", "strict");
      boolean strict = params.optBoolean("strict", false);
      String pattern = params.optString("format");
      DateTimeFormatter format;
      try {
        format = pattern != null ? DateTimeFormatter.ofPattern(pattern) : null;
      } catch (IllegalArgumentException e) {
        throw params.error("format", "invalid date pattern '" + pattern + "': " + e.getMessage());
      }
      FieldType type = FieldType.of(FieldType.Kind.DATE);
      return new ElementwiseOperation(field) {
        @Override protected @Nullable Object convert(OperationContext context,
            @Nullable Object value) {
          return ValueCasts.toDate(value, type, format, strict);
        }
      };
    }

    OperationParameters params = OperationParameters.of(field, "type", "strict");
    boolean strict = params.optBoolean("strict", false);
    String typeName = params.requireString("type");
    FieldType type;
    try {
      type = FieldType.parse(typeName);
    } catch (IllegalArgumentException e) {
      throw params.error("type", e.getMessage());
    }
    return new ElementwiseOperation(field) {
      @Override protected @Nullable Object convert(OperationContext context,
          @Nullable Object value) {
        return ValueCasts.cast(value, type, strict);
      }

      @Override public String toString() {
        return "cast(" + field.getField() + " as " + type + (strict ? ", strict" : "") + ")";
      }
    };
  }
}
