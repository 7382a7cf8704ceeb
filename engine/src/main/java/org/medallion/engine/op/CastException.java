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

import org.medallion.engine.PipelineException;
import org.medallion.engine.config.FieldType;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Raised when a value cannot be converted to a type, or when a strict cast
 * would lose precision. A row-level failure.
 */
public class CastException extends PipelineException {

  private final @Nullable Object value;
  private final FieldType type;

  public CastException(@Nullable Object value, FieldType type, String reason) {
    this(value, type, reason, null);
  }

  public CastException(@Nullable Object value, FieldType type, String reason,
      @Nullable Throwable cause) {
    super("cannot cast " + describe(value) + " to " + type + ": " + reason, null, cause);
    this.value = value;
    this.type = type;
  }

  public @Nullable Object getValue() {
    return value;
  }

  public FieldType getType() {
    return type;
  }

  private static String describe(@Nullable Object value) {
    if (value == null) {
      return "null";
    }
    String text = String.valueOf(value);
    if (text.length() > 64) {
      text = text.substring(0, 61) + "...";
    }
    return value.getClass().getSimpleName() + " '" + text + "'";
  }
}
