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
import org.medallion.engine.config.ValidationAction;
import org.medallion.engine.config.ValidationConfig;
import org.medallion.engine.registry.Registries;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ValidationRunner} and the built-in validations.
 */
@Tag("unit")
public class ValidationRunnerTest {

  private final Registries registries = Registries.withBuiltins();
  private final ValidationRunner runner = new ValidationRunner(InvocationGuard.unbounded());

  private BoundValidation bind(ValidationConfig.Builder builder) {
    return registries.getValidations().bind(builder.build());
  }

  private static List<CandidateRow> rows(Object... scores) {
    List<CandidateRow> rows = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      Map<String, Object> output = ImmutableMap.of("id", i);
      rows.add(new CandidateRow(output, Collections.singletonList(scores[i])));
    }
    return rows;
  }

  @Test void testDropRemovesFailingRows() {
    BoundValidation range = bind(ValidationConfig.builder().field("score").op("range")
        .parameter("min", 0).action(ValidationAction.DROP));

    ValidationOutcome outcome = runner.run("t", rows(5, -1, 0), Collections.singletonList(range));

    assertEquals(2, outcome.getRows().size());
    assertEquals(0, outcome.getRows().get(0).get("id"));
    assertEquals(2, outcome.getRows().get(1).get("id"));
    assertEquals(1, outcome.getDroppedRows());
    assertTrue(outcome.getQuarantine().isEmpty());
  }

  @Test void testQuarantineKeepsRecord() {
    BoundValidation allowed = bind(ValidationConfig.builder().field("status")
        .op("allowed_values").parameter("values", Arrays.asList("open", "closed"))
        .action(ValidationAction.QUARANTINE));

    ValidationOutcome outcome = runner.run("silver.orders", rows("open", "lost"),
        Collections.singletonList(allowed));

    assertEquals(1, outcome.getRows().size());
    assertEquals(0, outcome.getDroppedRows());
    QuarantineRecord record = outcome.getQuarantine().get(0);
    assertEquals("silver.orders", record.getTable());
    assertEquals("allowed_values", record.getValidation());
    assertEquals("status", record.getField());
    assertEquals(ImmutableMap.of("id", 1), record.getRow());
    assertTrue(record.getReason().contains("lost"), record.getReason());
  }

  @Test void testFailRaises() {
    BoundValidation notNull = bind(ValidationConfig.builder().field("score").op("not_null"));

    ValidationFailureException e = assertThrows(ValidationFailureException.class,
        () -> runner.run("t", rows(1, null), Collections.singletonList(notNull)));
    assertEquals("t", e.getTable());
    assertEquals("not_null", e.getValidation());
    assertEquals("score", e.getField());
  }

  @Test void testThrowingValidationCountsAsFailure() {
    registries.registerValidation("explodes", (value, params) -> {
      throw new IllegalStateException("boom");
    });
    BoundValidation explodes = bind(ValidationConfig.builder().field("score")
        .op("custom_validation").validation("explodes").action(ValidationAction.QUARANTINE));

    ValidationOutcome outcome = runner.run("t", rows(1), Collections.singletonList(explodes));

    assertTrue(outcome.getRows().isEmpty());
    String reason = outcome.getQuarantine().get(0).getReason();
    assertTrue(reason.contains("IllegalStateException: boom"), reason);
  }

  @Test void testUnresolvedFieldFailsRow() {
    BoundValidation range = bind(ValidationConfig.builder().field("tags[]").op("range")
        .parameter("max", 0).action(ValidationAction.QUARANTINE));
    List<CandidateRow> rows = Arrays.asList(
        new CandidateRow(ImmutableMap.of("id", 0), Collections.singletonList(null),
            ImmutableMap.of(0, "Path tags[] expects an array but found 5")),
        new CandidateRow(ImmutableMap.of("id", 1), Collections.singletonList(null)));

    ValidationOutcome outcome = runner.run("t", rows, Collections.singletonList(range));

    assertEquals(Collections.singletonList(ImmutableMap.of("id", 1)), outcome.getRows());
    QuarantineRecord record = outcome.getQuarantine().get(0);
    assertEquals(ImmutableMap.of("id", 0), record.getRow());
    assertTrue(record.getReason().contains("'tags[]' could not be resolved"),
        record.getReason());
  }

  @Test void testValidationsApplyInOrder() {
    BoundValidation notNull = bind(ValidationConfig.builder().field("a").op("not_null")
        .action(ValidationAction.DROP));
    BoundValidation regex = bind(ValidationConfig.builder().field("b").op("regex")
        .parameter("pattern", "[a-z]+").action(ValidationAction.QUARANTINE));
    List<CandidateRow> rows = Arrays.asList(
        new CandidateRow(ImmutableMap.of("id", 0), Arrays.<Object>asList(null, "x")),
        new CandidateRow(ImmutableMap.of("id", 1), Arrays.<Object>asList(1, "X1")),
        new CandidateRow(ImmutableMap.of("id", 2), Arrays.<Object>asList(2, "ok")));

    ValidationOutcome outcome = runner.run("t", rows, Arrays.asList(notNull, regex));

    assertEquals(Collections.singletonList(ImmutableMap.of("id", 2)), outcome.getRows());
    assertEquals(1, outcome.getDroppedRows());
    assertEquals(1, outcome.getQuarantine().size());
    assertEquals(ImmutableMap.of("id", 1), outcome.getQuarantine().get(0).getRow());
  }

  @Test void testRange() throws Exception {
    ValidationFunction range = BuiltinValidations.all().get("range");
    Map<String, Object> bounds = ImmutableMap.of("min", 0, "max", "10");
    Map<String, Object> exclusive = ImmutableMap.of("min", 0, "exclusive", true);

    assertTrue(range.test(0, bounds));
    assertTrue(range.test(10.0, bounds));
    assertTrue(range.test("7", bounds));
    assertTrue(range.test(null, bounds));
    assertFalse(range.test(11, bounds));
    assertFalse(range.test("seven", bounds));
    assertFalse(range.test(0, exclusive));
    assertThrows(IllegalArgumentException.class,
        () -> range.checkParameters(ImmutableMap.of("min", "low")));
    assertThrows(IllegalArgumentException.class,
        () -> range.checkParameters(ImmutableMap.of("min", 1, "step", 2)));
  }

  @Test void testRegexAndAllowedValues() throws Exception {
    ValidationFunction regex = BuiltinValidations.all().get("regex");
    ValidationFunction allowed = BuiltinValidations.all().get("allowed_values");
    Map<String, Object> values = ImmutableMap.of("values", Arrays.asList(1, "two"));

    assertTrue(regex.test("abc", ImmutableMap.of("pattern", "a.c")));
    assertFalse(regex.test("abcd", ImmutableMap.of("pattern", "a.c")));
    assertThrows(IllegalArgumentException.class,
        () -> regex.checkParameters(ImmutableMap.of("pattern", "(")));
    assertTrue(allowed.test(1L, values));
    assertTrue(allowed.test("two", values));
    assertFalse(allowed.test("three", values));
    assertThrows(IllegalArgumentException.class,
        () -> allowed.checkParameters(ImmutableMap.of("values", "one")));
  }
}
