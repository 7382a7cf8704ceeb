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

import org.medallion.engine.op.CustomFunction;
import org.medallion.engine.op.CustomOperation;
import org.medallion.engine.op.Operation;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

/**
 * Registry of operations.
 *
 * <p>Users register {@link CustomFunction}s, which are always one-to-one;
 * operations that change cardinality are reserved for the built-ins.
 */
public class OperationRegistry extends Registry<Operation> {

  public OperationRegistry() {
    super("operation");
  }

  public void register(String name, CustomFunction function) {
    register(name, function, false);
  }

  public void register(String name, CustomFunction function, boolean override) {
    put(name, new CustomOperation(name, function), override);
  }

  void registerBuiltin(String name, Operation operation) {
    put(name, operation, false);
  }

  @Override protected UnknownNameException unknown(String name, Set<String> known,
      @Nullable String path) {
    return new UnknownOperationException(name, known, path);
  }
}
