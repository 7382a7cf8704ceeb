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
package org.medallion.engine.registry;

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.ValidationConfig;
import org.medallion.engine.validation.BoundValidation;
import org.medallion.engine.validation.BuiltinValidations;
import org.medallion.engine.validation.ValidationFunction;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

/**
 * Registry of validation predicates.
 */
public class ValidationRegistry extends Registry<ValidationFunction> {

  public ValidationRegistry() {
    super("validation");
  }

  public void register(String name, ValidationFunction function) {
    register(name, function, false);
  }

  public void register(String name, ValidationFunction function, boolean override) {
    put(name, function, override);
  }

  /**
   * Resolves a validation entry. {@code custom_validation} entries resolve to
   * the predicate named by their {@code validation} key; others to their op.
   * Parameters are checked against the predicate.
   *
   * @throws UnknownValidationException If the predicate is not registered
   * @throws ConfigException If the parameters are invalid
   */
  public BoundValidation bind(ValidationConfig config) {
    String name = config.getOp();
    String path = config.getLocation() + ".op";
    if (BuiltinValidations.CUSTOM_VALIDATION.equals(name)) {
      name = config.getValidation();
      path = config.getLocation() + ".validation";
      if (name == null || BuiltinValidations.CUSTOM_VALIDATION.equals(name)) {
        throw new ConfigException("custom_validation requires 'validation' naming a registered"
            + " validation", path);
      }
    }
    ValidationFunction function = resolve(name, path);
    try {
      function.checkParameters(config.getParameters());
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), config.getLocation() + ".parameters", e);
    }
    return new BoundValidation(config, name, function);
  }

  @Override protected UnknownNameException unknown(String name, Set<String> known,
      @Nullable String path) {
    return new UnknownValidationException(name, known, path);
  }
}
