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

import org.medallion.engine.op.BuiltinOperations;
import org.medallion.engine.op.CustomFunction;
import org.medallion.engine.op.Operation;
import org.medallion.engine.op.Parser;
import org.medallion.engine.op.StructuredTextParsers;
import org.medallion.engine.validation.BuiltinValidations;
import org.medallion.engine.validation.ValidationFunction;

import java.util.Map;

/**
 * The operation, parser and validation registries of one engine.
 *
 * <p>Registries are passed explicitly to the compiler and evaluator; there
 * is no process-wide instance. Extensions are registered before the first
 * compile, which seals all three.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Registries registries = Registries.withBuiltins();
 * registries.registerParser("csv_line", text -> Arrays.asList(text.split(",")));
 * registries.registerOperation("upper", (values, params) ->
 *     values.get(0) == null ? null : values.get(0).toString().toUpperCase(Locale.ROOT));
 * registries.registerValidation("valid_score",
 *     (value, params) -> value != null && ((Number) value).intValue() >= 0);
 * }</pre>
 */
public class Registries {

  private final OperationRegistry operations = new OperationRegistry();
  private final ParserRegistry parsers = new ParserRegistry();
  private final ValidationRegistry validations = new ValidationRegistry();

  /**
   * Returns registries holding nothing.
   */
  public static Registries empty() {
    return new Registries();
  }

  /**
   * Returns registries holding the built-in operations, the {@code json}
   * and {@code yaml} parsers, and the built-in validations.
   */
  public static Registries withBuiltins() {
    Registries registries = new Registries();
    for (Map.Entry<String, Operation> entry : BuiltinOperations.all().entrySet()) {
      registries.operations.registerBuiltin(entry.getKey(), entry.getValue());
    }
    registries.parsers.register("json", StructuredTextParsers.json());
    registries.parsers.register("yaml", StructuredTextParsers.yaml());
    for (Map.Entry<String, ValidationFunction> entry : BuiltinValidations.all().entrySet()) {
      registries.validations.register(entry.getKey(), entry.getValue());
    }
    return registries;
  }

  public OperationRegistry getOperations() {
    return operations;
  }

  public ParserRegistry getParsers() {
    return parsers;
  }

  public ValidationRegistry getValidations() {
    return validations;
  }

  public void registerOperation(String name, CustomFunction function) {
    operations.register(name, function);
  }

  public void registerOperation(String name, CustomFunction function, boolean override) {
    operations.register(name, function, override);
  }

  public void registerParser(String name, Parser parser) {
    parsers.register(name, parser);
  }

  public void registerParser(String name, Parser parser, boolean override) {
    parsers.register(name, parser, override);
  }

  public void registerValidation(String name, ValidationFunction function) {
    validations.register(name, function);
  }

  public void registerValidation(String name, ValidationFunction function, boolean override) {
    validations.register(name, function, override);
  }

  /**
   * Seals all three registries.
   */
  public void seal() {
    operations.seal();
    parsers.seal();
    validations.seal();
  }

  public boolean isSealed() {
    return operations.isSealed() && parsers.isSealed() && validations.isSealed();
  }

  @Override public String toString() {
    return "Registries{operations=" + operations.names() + ", parsers=" + parsers.names()
        + ", validations=" + validations.names() + "}";
  }
}
