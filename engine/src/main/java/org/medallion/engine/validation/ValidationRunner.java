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

import org.medallion.engine.InvocationGuard;
import org.medallion.engine.InvocationTimeoutException;
import org.medallion.engine.PipelineException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a target table's validations to its derived rows.
 *
 * <p>Validations run strictly in declaration order and cumulatively: a row
 * removed by one validation is not seen by the next. A failing row is
 * handled by the validation's action:
 * <ul>
 *   <li>{@code drop} removes the row and counts it</li>
 *   <li>{@code quarantine} removes the row and records it with the cause</li>
 *   <li>{@code fail} throws {@link ValidationFailureException}</li>
 * </ul>
 * A predicate that throws or times out counts as a failing row, and so does
 * a row whose validated field cannot be resolved.
 */
public class ValidationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ValidationRunner.class);

  private final InvocationGuard guard;

  public ValidationRunner(InvocationGuard guard) {
    this.guard = guard;
  }

  /**
   * Validates rows of one target table.
   *
   * @param table Target table name
   * @param rows Derived rows, with validated values aligned to {@code validations}
   * @param validations Validations in declaration order
   * @return Surviving rows and removal accounting
   * @throws ValidationFailureException If a row fails a validation whose action is fail
   */
  public ValidationOutcome run(String table, List<CandidateRow> rows,
      List<BoundValidation> validations) {
    List<CandidateRow> remaining = rows;
    List<QuarantineRecord> quarantine = new ArrayList<>();
    long dropped = 0;

    for (int v = 0; v < validations.size(); v++) {
      BoundValidation validation = validations.get(v);
      List<CandidateRow> kept = new ArrayList<>(remaining.size());
      long droppedBefore = dropped;
      int quarantinedBefore = quarantine.size();
      for (CandidateRow row : remaining) {
        String unresolved = row.getUnresolvedReason(v);
        ValidationResult result = unresolved != null
            ? ValidationResult.of(validation.getAction(), "field '" + validation.getField()
                + "' could not be resolved: " + unresolved)
            : check(validation, row.getValidatedValue(v));
        switch (result.getAction()) {
          case VALID:
            kept.add(row);
            break;
          case DROP:
            dropped++;
            break;
          case QUARANTINE:
            quarantine.add(new QuarantineRecord(table, validation.getName(),
                validation.getField(), String.valueOf(result.getMessage()), row.getOutput()));
            break;
          default:
            throw new ValidationFailureException(table, validation.getName(),
                validation.getField(), String.valueOf(result.getMessage()));
        }
      }
      if (dropped > droppedBefore || quarantine.size() > quarantinedBefore) {
        LOGGER.debug("{}: {} removed {} rows ({} dropped, {} quarantined)", table, validation,
            remaining.size() - kept.size(), dropped - droppedBefore,
            quarantine.size() - quarantinedBefore);
      }
      remaining = kept;
    }

    List<Map<String, Object>> output = new ArrayList<>(remaining.size());
    for (CandidateRow row : remaining) {
      output.add(row.getOutput());
    }
    return new ValidationOutcome(output, quarantine, dropped);
  }

  private ValidationResult check(BoundValidation validation, @Nullable Object value) {
    String description = "validation '" + validation.getName() + "' on field '"
        + validation.getField() + "'";
    try {
      boolean passed = guard.call(description,
          () -> validation.getFunction().test(value, validation.getParameters()));
      if (passed) {
        return ValidationResult.valid();
      }
      return ValidationResult.of(validation.getAction(),
          "value " + value + " failed " + validation.getName());
    } catch (InvocationTimeoutException e) {
      return ValidationResult.of(validation.getAction(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineException("interrupted while running " + description, null, e);
    } catch (Exception e) {
      LOGGER.debug("{} threw for value {}", description, value, e);
      return ValidationResult.of(validation.getAction(),
          validation.getName() + " raised " + e.getClass().getSimpleName() + ": "
              + e.getMessage());
    }
  }
}
