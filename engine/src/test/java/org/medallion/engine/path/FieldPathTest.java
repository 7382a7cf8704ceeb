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
package org.medallion.engine.path;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FieldPath.
 */
@Tag("unit")
public class FieldPathTest {

  private static final Map<String, Object> QUESTION = ImmutableMap.of(
      "title", "How?",
      "owner", ImmutableMap.of("name", "ann", "id", 7),
      "answers", Arrays.asList(
          ImmutableMap.of("id", 1, "comments", Arrays.asList("a", "b")),
          ImmutableMap.of("id", 2, "comments", Collections.singletonList("c")),
          ImmutableMap.of("id", 3)));

  @Test void testParseSteps() {
    FieldPath path = FieldPath.parse("a.b[0].c[]");

    assertEquals(Arrays.asList(PathStep.field("a"), PathStep.field("b"), PathStep.index(0),
        PathStep.field("c"), PathStep.elements()), path.getSteps());
    assertEquals("a.b[0].c[]", path.toString());
    assertEquals("a", path.getRoot());
    assertEquals("b[0].c[]", path.tail().toString());
    assertTrue(path.hasElements());
  }

  @Test void testParseLeadingElements() {
    FieldPath path = FieldPath.parse("[].id");

    assertNull(path.getRoot());
    assertEquals(PathStep.elements(), path.getSteps().get(0));
  }

  @Test void testEmptyPath() {
    assertTrue(FieldPath.parse("  ").isEmpty());
    assertTrue(FieldPath.parse("a").tail().isEmpty());
    assertEquals("x", FieldPath.empty().resolve("x"));
  }

  @Test void testInvalidPaths() {
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a..b"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a["));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[x]"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[-1]"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a]"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a."));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[0]b"));
  }

  @Test void testResolveFields() {
    assertEquals("ann", FieldPath.parse("owner.name").resolve(QUESTION));
    assertNull(FieldPath.parse("owner.email").resolve(QUESTION));
    assertNull(FieldPath.parse("title.length").resolve(QUESTION));
    assertNull(FieldPath.parse("owner.name").resolve(null));
  }

  @Test void testResolveIndex() {
    assertEquals(2, FieldPath.parse("answers[1].id").resolve(QUESTION));
    assertNull(FieldPath.parse("answers[5].id").resolve(QUESTION));
  }

  @Test void testResolveElements() {
    Object ids = FieldPath.parse("answers[].id").resolve(QUESTION);

    assertEquals(Arrays.asList(1, 2, 3), ids);
  }

  @Test void testResolveNestedElementsFlattens() {
    Object comments = FieldPath.parse("answers[].comments[]").resolve(QUESTION);

    assertEquals(Arrays.asList("a", "b", "c"), comments);
  }

  @Test void testResolveElementsOfMissingArray() {
    Object values = FieldPath.parse("missing[]").resolve(QUESTION);

    assertEquals(Collections.emptyList(), values);
  }

  @Test void testResolveElementsOfScalarFails() {
    FieldPath path = FieldPath.parse("title[]");

    assertThrows(IllegalArgumentException.class, () -> path.resolve(QUESTION));
  }

  @Test void testEquality() {
    assertEquals(FieldPath.parse("a.b[]"), FieldPath.parse(" a.b[] "));
    assertFalse(FieldPath.parse("a.b").equals(FieldPath.parse("a[0]")));
    List<PathStep> steps = Arrays.asList(PathStep.field("a"), PathStep.index(2));
    assertEquals(FieldPath.parse("a[2]"), FieldPath.of(steps));
  }
}
