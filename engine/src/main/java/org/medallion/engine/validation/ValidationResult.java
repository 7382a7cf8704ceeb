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

import org.medallion.engine.config.ValidationAction;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of checking one row, by a validation or by the error handling of
 * a field whose derivation failed.
 *
 * <p>The action types are:
 * <ul>
 *   <li>{@link Action#VALID} - Row passes, include in output</li>
 *   <li>{@link Action#DROP} - Row fails, exclude from output and count it</li>
 *   <li>{@link Action#QUARANTINE} - Row fails, move it to the table's quarantine output</li>
 *   <li>{@link Action#FAIL} - Row fails, abort the target table without writing</li>
 * </ul>
 */
public class ValidationResult {

  /**
   * Actions that can be taken for a row.
   */
  public enum Action {
    /** Row is valid, include in output. */
    VALID,
    /** Row is invalid, drop it from output. */
    DROP,
    /** Row is invalid, divert it to the quarantine output. */
    QUARANTINE,
    /** Row is invalid, fail the entire target table. */
    FAIL
  }

  private static final ValidationResult VALID_RESULT =
      new ValidationResult(Action.VALID, null);

  private final Action action;
  private final @Nullable String message;

  private ValidationResult(Action action, @Nullable String message) {
    this.action = action;
    this.message = message;
  }

  /**
   * Returns a valid result indicating the row passes validation.
   */
  public static ValidationResult valid() {
    return VALID_RESULT;
  }

  public static ValidationResult drop(String message) {
    return new ValidationResult(Action.DROP, message);
  }

  public static ValidationResult quarantine(String message) {
    return new ValidationResult(Action.QUARANTINE, message);
  }

  public static ValidationResult fail(String message) {
    return new ValidationResult(Action.FAIL, message);
  }

  /**
   * Returns the failed result for a configured action.
   *
   * @param action Action configured for the validation or field
   * @param message Description of why the row is invalid
   * @return A failed ValidationResult
   */
  public static ValidationResult of(ValidationAction action, String message) {
    switch (action) {
      case DROP:
        return drop(message);
      case QUARANTINE:
        return quarantine(message);
      default:
        return fail(message);
    }
  }

  public Action getAction() {
    return action;
  }

  /**
   * Returns the validation message.
   *
   * @return The message, or null for valid results
   */
  public @Nullable String getMessage() {
    return message;
  }

  @Override public String toString() {
    if (action == Action.VALID) {
      return "ValidationResult{VALID}";
    }
    return "ValidationResult{" + action + ", message='" + message + "'}";
  }
}
