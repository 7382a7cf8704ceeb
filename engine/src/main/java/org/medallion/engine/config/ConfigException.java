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
package org.medallion.engine.config;

import org.medallion.engine.PipelineException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Raised when a pipeline document is malformed or incomplete: a required key
 * is missing, a key is unknown, a value has the wrong type, or a reference
 * cannot be resolved. A pipeline with a configuration error never runs.
 */
public class ConfigException extends PipelineException {

  public ConfigException(String reason, @Nullable String path) {
    super(reason, path);
  }

  public ConfigException(String reason, @Nullable String path, @Nullable Throwable cause) {
    super(reason, path, cause);
  }
}
