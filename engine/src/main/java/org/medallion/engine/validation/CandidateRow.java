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
package org.medallion.engine.validation;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A fully derived row awaiting validation: the persisted columns to be
 * written, and the value of each validated field in validation order.
 *
 * <p>A validated field whose path cannot be resolved against the row (an
 * array step over a scalar, say) has no value; its validation fails the row
 * with the recorded reason.
 */
public class CandidateRow {

  private final Map<String, Object> output;
  private final List<@Nullable Object> validatedValues;
  private final Map<Integer, String> unresolved;

  public CandidateRow(Map<String, Object> output, List<@Nullable Object> validatedValues) {
    this(output, validatedValues, Collections.emptyMap());
  }

  public CandidateRow(Map<String, Object> output, List<@Nullable Object> validatedValues,
      Map<Integer, String> unresolved) {
    this.output = output;
    this.validatedValues = validatedValues;
    this.unresolved = unresolved;
  }

  public Map<String, Object> getOutput() {
    return output;
  }

  /**
   * Returns the value checked by the validation at {@code index}.
   */
  public @Nullable Object getValidatedValue(int index) {
    return validatedValues.get(index);
  }

  /**
   * Returns why the field checked by the validation at {@code index} could
   * not be resolved, or null if it has a value.
   */
  public @Nullable String getUnresolvedReason(int index) {
    return unresolved.get(index);
  }
}
