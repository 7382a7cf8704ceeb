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
package org.medallion.engine.eval;

import org.medallion.engine.InvocationGuard;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.graph.InputRef;
import org.medallion.engine.op.BoundOperation;
import org.medallion.engine.op.OperationContext;
import org.medallion.engine.op.TableLookup;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Invocation of a node's operation for a row, shared by source
 * materialization and target evaluation.
 */
final class Evaluations {

  private Evaluations() {
  }

  static OperationContext context(DagNode node, String table, TableLookup tables,
      InvocationGuard guard) {
    return OperationContext.builder()
        .tableName(table)
        .field(node.getConfig())
        .parser(node.getOperation().getParserName(), node.getParser())
        .tables(tables)
        .guard(guard)
        .build();
  }

  /**
   * Computes a node's value for a row. User code runs under the invocation timeout.
   */
  static @Nullable Object invoke(DagNode node, OperationContext context, Row row,
      InvocationGuard guard) throws Exception {
    List<@Nullable Object> inputs = new ArrayList<>(node.getInputs().size());
    for (InputRef input : node.getInputs()) {
      inputs.add(row.resolve(input));
    }
    BoundOperation operation = node.getOperation();
    if (operation.isUserCode()) {
      return guard.call("operation '" + node.getConfig().getOp() + "' for field '"
          + node.getName() + "'", () -> operation.apply(context, inputs));
    }
    return operation.apply(context, inputs);
  }

  static String describe(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getSimpleName();
  }
}
