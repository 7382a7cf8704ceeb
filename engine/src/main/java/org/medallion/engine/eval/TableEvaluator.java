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
import org.medallion.engine.TableCancelledException;
import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.ValidationAction;
import org.medallion.engine.graph.DagNode;
import org.medallion.engine.graph.InputRef;
import org.medallion.engine.op.OperationContext;
import org.medallion.engine.plan.PlanNode;
import org.medallion.engine.plan.TablePlan;
import org.medallion.engine.validation.CandidateRow;
import org.medallion.engine.validation.QuarantineRecord;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Derives the rows of one target table from its execution plan.
 *
 * <p>Every source row starts as one in-flight row. Plan nodes run in order
 * over all in-flight rows. An exploding node replaces each row by one copy
 * per element of its value; an empty or null value removes the row. A row
 * whose field fails to derive is removed under the field's error action,
 * or the table is aborted if that action is {@code fail}.
 *
 * <p>Source-level transients are read from the run's {@link TransientCache}
 * rather than recomputed. Cancellation is checked before each plan node.
 */
public class TableEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TableEvaluator.class);

  private final InvocationGuard guard;
  private final ValidationAction defaultErrorAction;

  public TableEvaluator(InvocationGuard guard, ValidationAction defaultErrorAction) {
    this.guard = guard;
    this.defaultErrorAction = defaultErrorAction;
  }

  /**
   * Evaluates a target table.
   *
   * @param plan Plan of the target table
   * @param sources Materialized sources of the run
   * @param cancelled Returns true once the table has been cancelled
   * @return Candidate rows for validation
   * @throws FieldEvaluationException If a field fails under the {@code fail} action
   * @throws TableCancelledException If the table is cancelled
   */
  public TableEvaluation evaluate(TablePlan plan, MaterializedSources sources,
      BooleanSupplier cancelled) {
    String table = plan.getTable();
    String source = plan.getSource().getName();
    List<Map<String, Object>> sourceRows = sources.rows(source);

    List<Row> rows = new ArrayList<>(sourceRows.size());
    for (int i = 0; i < sourceRows.size(); i++) {
      rows.add(new Row(i, sourceRows.get(i)));
    }

    Errors errors = new Errors(plan);
    for (PlanNode step : plan.getNodes()) {
      if (cancelled.getAsBoolean()) {
        throw new TableCancelledException(table);
      }
      DagNode node = step.getNode();
      ValidationAction action = plan.getErrorAction(node);
      if (action == null) {
        action = defaultErrorAction;
      }
      int before = rows.size();
      rows = evaluate(step, node, plan, sources, rows, errors, action);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("{}: {} {} rows -> {}", table, step, before, rows.size());
      }
    }

    List<CandidateRow> candidates = new ArrayList<>(rows.size());
    for (Row row : rows) {
      candidates.add(candidate(plan, row));
    }
    if (errors.dropped > 0 || !errors.quarantine.isEmpty()) {
      LOGGER.warn("{}: {} rows removed by field errors ({} dropped, {} quarantined)", table,
          errors.dropped + errors.quarantine.size(), errors.dropped, errors.quarantine.size());
    }
    return new TableEvaluation(candidates, errors.quarantine, errors.dropped,
        errors.dropped + errors.quarantine.size());
  }

  private List<Row> evaluate(PlanNode step, DagNode node, TablePlan plan,
      MaterializedSources sources, List<Row> rows, Errors errors, ValidationAction action) {
    String source = plan.getSource().getName();
    @Nullable List<Object> cached = step.getStep() == PlanNode.Step.EVALUATE
        ? null : sources.getCache().get(source, node.getName());
    OperationContext context = Evaluations.context(node, plan.getTable(), sources, guard);

    List<Row> next = new ArrayList<>(rows.size());
    for (Row row : rows) {
      Object value;
      if (cached != null) {
        value = cached.get(row.getSourceIndex());
      } else {
        value = failedInput(node, row);
        if (value == null) {
          value = invoke(node, context, row, plan.getTable());
        }
      }
      if (value instanceof NodeError) {
        errors.handle(node, row, ((NodeError) value).getCause(), action);
        continue;
      }
      if (!node.isExplode()) {
        row.put(node.getNamespace(), node.getName(), value);
        next.add(row);
      } else if (value == null) {
        // null explodes to nothing
        continue;
      } else if (value instanceof Collection) {
        for (Object element : (Collection<?>) value) {
          Row copy = row.copy();
          copy.put(node.getNamespace(), node.getName(), element);
          next.add(copy);
        }
      } else {
        errors.handle(node, row, new IllegalArgumentException("field '" + node.getName()
            + "' explodes but its value is not an array: " + value), action);
      }
    }
    return next;
  }

  private @Nullable Object invoke(DagNode node, OperationContext context, Row row,
      String table) {
    try {
      return Evaluations.invoke(node, context, row, guard);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TableCancelledException(table);
    } catch (Exception e) {
      return new NodeError(e);
    }
  }

  // A field reading a failed source transient fails with the same cause
  private static @Nullable Object failedInput(DagNode node, Row row) {
    for (InputRef input : node.getInputs()) {
      if (input.getNamespace() == InputRef.Namespace.SOURCE_TRANSIENT) {
        Object value = row.get(input.getNamespace(), input.getKey());
        if (value instanceof NodeError) {
          return value;
        }
      }
    }
    return null;
  }

  private static CandidateRow candidate(TablePlan plan, Row row) {
    Map<String, Object> output = new LinkedHashMap<>();
    for (FieldConfig column : plan.getColumns()) {
      output.put(column.getName(), row.get(InputRef.Namespace.TARGET, column.getName()));
    }
    List<@Nullable Object> validated = new ArrayList<>();
    Map<Integer, String> unresolved = new HashMap<>();
    for (InputRef input : plan.getValidationInputs()) {
      Object value = null;
      try {
        value = row.resolve(input);
      } catch (IllegalArgumentException e) {
        unresolved.put(validated.size(), Evaluations.describe(e));
      }
      validated.add(value);
    }
    return new CandidateRow(output, validated, unresolved);
  }

  /**
   * Field errors of one table evaluation.
   */
  private static class Errors {
    private final TablePlan plan;
    private final List<QuarantineRecord> quarantine = new ArrayList<>();
    private long dropped;

    Errors(TablePlan plan) {
      this.plan = plan;
    }

    void handle(DagNode node, Row row, Exception cause, ValidationAction action) {
      String table = plan.getTable();
      switch (action) {
        case DROP:
          LOGGER.debug("{}: dropping row {}, field '{}' failed: {}", table,
              row.getSourceIndex(), node.getName(), Evaluations.describe(cause));
          dropped++;
          break;
        case QUARANTINE:
          quarantine.add(new QuarantineRecord(table, node.getConfig().getOp(), node.getName(),
              Evaluations.describe(cause), persisted(row)));
          break;
        default:
          throw new FieldEvaluationException(table, node.getName(), cause);
      }
    }

    private Map<String, Object> persisted(Row row) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (FieldConfig column : plan.getColumns()) {
        if (row.has(InputRef.Namespace.TARGET, column.getName())) {
          values.put(column.getName(), row.get(InputRef.Namespace.TARGET, column.getName()));
        }
      }
      return values;
    }
  }
}
