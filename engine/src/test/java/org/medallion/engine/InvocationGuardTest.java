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
package org.medallion.engine;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link InvocationGuard}.
 */
@Tag("unit")
public class InvocationGuardTest {

  @Test void testInlineGuardReturnsValue() throws Exception {
    try (InvocationGuard guard = InvocationGuard.unbounded()) {
      assertEquals("ok", guard.call("operation 'noop'", () -> "ok"));
    }
  }

  @Test void testErrorBecomesInvocationFailure() {
    AssertionError error = new AssertionError("invariant violated");
    for (long timeoutMs : new long[] {0, 1000}) {
      try (InvocationGuard guard = new InvocationGuard(timeoutMs)) {
        InvocationFailedException e = assertThrows(InvocationFailedException.class,
            () -> guard.call("operation 'check'", () -> {
              throw error;
            }));
        assertSame(error, e.getCause());
        assertTrue(e.getMessage().startsWith("operation 'check' failed"), e.getMessage());
      }
    }
  }

  @Test void testExceptionPassesThrough() {
    try (InvocationGuard guard = new InvocationGuard(1000)) {
      IllegalStateException e = assertThrows(IllegalStateException.class,
          () -> guard.call("operation 'check'", () -> {
            throw new IllegalStateException("bad row");
          }));
      assertEquals("bad row", e.getMessage());
    }
  }

  @Test void testTimeout() {
    try (InvocationGuard guard = new InvocationGuard(20)) {
      InvocationTimeoutException e = assertThrows(InvocationTimeoutException.class,
          () -> guard.call("parser 'slow'", () -> {
            Thread.sleep(10_000);
            return null;
          }));
      assertEquals(20, e.getTimeoutMs());
    }
  }
}
