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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * An operation bound to one field, ready to evaluate rows.
 *
 * <p>Implementations hold the field's parsed parameters and are shared by
 * every row and every thread evaluating the field; they must be stateless
 * beyond that.
 */
public abstract class BoundOperation {

  protected final FieldConfig field;
  private final Cardinality cardinality;

  protected BoundOperation(FieldConfig field, Cardinality cardinality) {
    this.field = field;
    this.cardinality = cardinality;
  }

  public FieldConfig getField() {
    return field;
  }

  public Cardinality getCardinality() {
    return cardinality;
  }

  /**
   * Returns the references resolved against the current row and passed to
   * {@link #apply} in this order. Defaults to the field's input references.
   */
  public List<String> getInputs() {
    return field.getFields();
  }

  /**
   * Returns the source tables, other than the default source, that the
   * operation reads through {@link OperationContext#rows(String)}.
   */
  public List<String> getLookupTables() {
    return ImmutableList.of();
  }

  /**
   * Returns the name of the parser the operation needs, or null if it parses
   * nothing. Resolved against the parser registry at compile time.
   */
  public @Nullable String getParserName() {
    return field.getParser();
  }

  /**
   * Returns whether the operation runs user code and must be invoked under
   * the invocation timeout.
   */
  public boolean isUserCode() {
    return false;
  }

  /**
   * Computes the value for one row.
   *
   * @param context Evaluation context of the field
   * @param inputs Resolved values of {@link #getInputs()}
   * @return The value, or a {@code List} of values for
   *     {@link Cardinality#ONE_TO_MANY} operations
   * @throws Exception On a row-level failure
   */
  public abstract @Nullable Object apply(OperationContext context, List<@Nullable Object> inputs)
      throws Exception;

  @Override public String toString() {
    return field.getOp() + "(" + String.join(", ", getInputs()) + ")";
  }
}
