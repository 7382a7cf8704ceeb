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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class of all errors raised by the transformation engine.
 *
 * <p>Compile-time errors carry the document path of the offending entry
 * (for example {@code pipeline.target_tables[silver.answers].columns[score].op})
 * so that a failing pipeline can be fixed without guessing.
 */
public class PipelineException extends RuntimeException {

  private final String reason;
  private final @Nullable String path;

  public PipelineException(String reason) {
    this(reason, null, null);
  }

  public PipelineException(String reason, @Nullable String path) {
    this(reason, path, null);
  }

  public PipelineException(String reason, @Nullable String path, @Nullable Throwable cause) {
    super(path == null ? reason : reason + " (at " + path + ")", cause);
    this.reason = reason;
    this.path = path;
  }

  /**
   * Returns the message without the document path.
   */
  public String getReason() {
    return reason;
  }

  /**
   * Returns the document path at fault, or null if the error is not tied to
   * a single entry of the pipeline document.
   */
  public @Nullable String getPath() {
    return path;
  }
}
