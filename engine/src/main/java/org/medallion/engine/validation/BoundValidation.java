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
import org.medallion.engine.config.ValidationConfig;

import java.util.Map;

/**
 * A validation entry resolved against the validation registry.
 */
public class BoundValidation {

  private final ValidationConfig config;
  private final String name;
  private final ValidationFunction function;

  public BoundValidation(ValidationConfig config, String name, ValidationFunction function) {
    this.config = config;
    this.name = name;
    this.function = function;
  }

  public ValidationConfig getConfig() {
    return config;
  }

  /**
   * Returns the registered name of the predicate: the op, or for
   * {@code custom_validation} the validation it names.
   */
  public String getName() {
    return name;
  }

  public String getField() {
    return config.getField();
  }

  public ValidationAction getAction() {
    return config.getAction();
  }

  public Map<String, Object> getParameters() {
    return config.getParameters();
  }

  public ValidationFunction getFunction() {
    return function;
  }

  @Override public String toString() {
    return name + "(" + config.getField() + ") -> " + config.getAction();
  }
}
