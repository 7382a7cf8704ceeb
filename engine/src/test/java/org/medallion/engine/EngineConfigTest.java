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

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.ValidationAction;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link EngineConfig}.
 */
@Tag("unit")
public class EngineConfigTest {

  @Test void testDefaults() {
    EngineConfig config = EngineConfig.defaults();

    assertEquals(Runtime.getRuntime().availableProcessors(), config.getMaxConcurrency());
    assertEquals(EngineConfig.DEFAULT_INVOCATION_TIMEOUT_MS, config.getInvocationTimeoutMs());
    assertEquals(ValidationAction.FAIL, config.getDefaultErrorAction());
  }

  @Test void testPipelineSettingsOverrideEngineConfig() {
    EngineConfig base = EngineConfig.builder().maxConcurrency(8).invocationTimeoutMs(100).build();

    EngineConfig config = base.withSettings(ImmutableMap.of(
        "max_concurrency", 2,
        "default_error_action", "quarantine"));

    assertEquals(2, config.getMaxConcurrency());
    assertEquals(100, config.getInvocationTimeoutMs());
    assertEquals(ValidationAction.QUARANTINE, config.getDefaultErrorAction());
    assertEquals(8, base.getMaxConcurrency());
  }

  @Test void testInvalidSettings() {
    EngineConfig base = EngineConfig.defaults();

    ConfigException zero = assertThrows(ConfigException.class,
        () -> base.withSettings(ImmutableMap.of("max_concurrency", 0)));
    assertEquals("pipeline.settings.max_concurrency", zero.getPath());
    assertThrows(ConfigException.class,
        () -> base.withSettings(ImmutableMap.of("invocation_timeout_ms", -1)));
    assertThrows(ConfigException.class,
        () -> base.withSettings(ImmutableMap.of("default_error_action", "ignore")));
    ConfigException unknown = assertThrows(ConfigException.class,
        () -> base.withSettings(ImmutableMap.of("threads", 4)));
    assertEquals("pipeline.settings.threads", unknown.getPath());
  }

  @Test void testBuilderRejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.builder().maxConcurrency(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.builder().invocationTimeoutMs(-5).build());
  }
}
