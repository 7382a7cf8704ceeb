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

import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.PipelineConfig;
import org.medallion.engine.eval.MaterializedSources;
import org.medallion.engine.eval.SourceMaterializer;
import org.medallion.engine.eval.SourceReadException;
import org.medallion.engine.eval.TableEvaluation;
import org.medallion.engine.eval.TableEvaluator;
import org.medallion.engine.io.TableReader;
import org.medallion.engine.io.TableWriter;
import org.medallion.engine.io.WriteException;
import org.medallion.engine.io.WriteRequest;
import org.medallion.engine.plan.ExecutionPlan;
import org.medallion.engine.plan.PipelineCompiler;
import org.medallion.engine.plan.TablePlan;
import org.medallion.engine.registry.Registries;
import org.medallion.engine.validation.QuarantineRecord;
import org.medallion.engine.validation.ValidationOutcome;
import org.medallion.engine.validation.ValidationRunner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 * Runs declarative pipelines: compiles a pipeline document into an
 * execution plan, then derives, validates and writes its target tables.
 *
 * <p>A run proceeds in phases:
 * <ol>
 *   <li>compile: any configuration error fails the run before a row is read</li>
 *   <li>materialize: every needed source table is read once and its shared
 *       transients are computed; nothing else starts until this completes</li>
 *   <li>tables: target tables are evaluated, validated and written as
 *       independent tasks, at most {@link EngineConfig#getMaxConcurrency()}
 *       at a time</li>
 * </ol>
 * A target table that fails or is cancelled writes nothing and does not
 * affect the others.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Registries registries = Registries.withBuiltins();
 * registries.registerOperation("upper", (values, params) ->
 *     values.get(0) == null ? null : values.get(0).toString().toUpperCase());
 *
 * PipelineEngine engine = new PipelineEngine(registries, EngineConfig.defaults(),
 *     store, store);
 * PipelineResult result = engine.run(PipelineConfigParser.parse(path));
 * }</pre>
 */
public class PipelineEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineEngine.class);

  private static final ThreadFactory RUN_THREADS = new ThreadFactoryBuilder()
      .setNameFormat("medallion-run-%d")
      .setDaemon(true)
      .build();

  private final Registries registries;
  private final EngineConfig config;
  private final TableReader reader;
  private final TableWriter writer;
  private final PipelineListener listener;

  public PipelineEngine(Registries registries, EngineConfig config, TableReader reader,
      TableWriter writer) {
    this(registries, config, reader, writer, new LoggingPipelineListener());
  }

  public PipelineEngine(Registries registries, EngineConfig config, TableReader reader,
      TableWriter writer, PipelineListener listener) {
    this.registries = registries;
    this.config = config;
    this.reader = reader;
    this.writer = writer;
    this.listener = listener;
  }

  public Registries getRegistries() {
    return registries;
  }

  public EngineConfig getConfig() {
    return config;
  }

  /**
   * Compiles a pipeline without running it. The first successful compile
   * seals the registries.
   *
   * @throws org.medallion.engine.config.ConfigException If the pipeline is invalid
   */
  public ExecutionPlan compile(PipelineConfig pipeline) {
    return new PipelineCompiler(registries).compile(pipeline);
  }

  /**
   * Runs a pipeline and waits for it to finish.
   *
   * @throws org.medallion.engine.config.ConfigException If the pipeline is invalid
   * @throws InterruptedException If interrupted while waiting
   */
  public PipelineResult run(PipelineConfig pipeline) throws InterruptedException {
    return start(pipeline).await();
  }

  /**
   * Compiles a pipeline and starts running it in the background.
   *
   * @return Handle to cancel target tables and await the result
   * @throws org.medallion.engine.config.ConfigException If the pipeline is invalid
   */
  public PipelineRun start(PipelineConfig pipeline) {
    listener.onPhaseStart("compile", pipeline.getTargetTables().size());
    ExecutionPlan plan = compile(pipeline);
    EngineConfig effective = config.withSettings(pipeline.getSettings());
    listener.onPhaseComplete("compile", plan.getTables().size());

    PipelineRun run = new PipelineRun(plan);
    Thread thread = RUN_THREADS.newThread(() -> {
      try {
        run.complete(execute(run, effective));
      } catch (Throwable e) {
        LOGGER.error("Pipeline '{}' aborted", pipeline.getName(), e);
        run.fail(e);
      }
    });
    thread.start();
    return run;
  }

  private PipelineResult execute(PipelineRun run, EngineConfig effective)
      throws InterruptedException {
    ExecutionPlan plan = run.getPlan();
    String name = plan.getPipeline().getName();
    long startTime = System.currentTimeMillis();
    LOGGER.info("Starting pipeline '{}' with {}", name, effective);

    try (InvocationGuard guard = new InvocationGuard(effective.getInvocationTimeoutMs())) {
      listener.onPhaseStart("materialize", plan.getSources().size());
      Map<String, SourceReadException> unreadable = new HashMap<>();
      MaterializedSources sources = new SourceMaterializer(reader, guard)
          .materialize(plan.getSources(), unreadable);
      listener.onPhaseComplete("materialize", plan.getSources().size() - unreadable.size());

      TableTask task = new TableTask(run, sources, unreadable, guard, effective);
      int threads = Math.max(1, Math.min(effective.getMaxConcurrency(), plan.getTables().size()));
      ExecutorService pool = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
          .setNameFormat("medallion-table-%d")
          .setDaemon(true)
          .build());
      listener.onPhaseStart("tables", plan.getTables().size());
      List<TableResult> results = new ArrayList<>();
      try {
        List<Future<TableResult>> futures = new ArrayList<>();
        for (TablePlan table : plan.getTables()) {
          futures.add(pool.submit(() -> task.execute(table)));
        }
        for (Future<TableResult> future : futures) {
          results.add(future.get());
        }
      } catch (ExecutionException e) {
        throw new PipelineException("target table task failed", null, e.getCause());
      } finally {
        pool.shutdownNow();
      }
      listener.onPhaseComplete("tables", results.size());

      PipelineResult result =
          new PipelineResult(name, results, System.currentTimeMillis() - startTime);
      LOGGER.info("Finished pipeline '{}': {}", name, result);
      return result;
    }
  }

  /**
   * Evaluates, validates and writes one target table.
   */
  private class TableTask {
    private final PipelineRun run;
    private final MaterializedSources sources;
    private final Map<String, SourceReadException> unreadable;
    private final TableEvaluator evaluator;
    private final ValidationRunner validator;

    TableTask(PipelineRun run, MaterializedSources sources,
        Map<String, SourceReadException> unreadable, InvocationGuard guard,
        EngineConfig effective) {
      this.run = run;
      this.sources = sources;
      this.unreadable = unreadable;
      this.evaluator = new TableEvaluator(guard, effective.getDefaultErrorAction());
      this.validator = new ValidationRunner(guard);
    }

    TableResult execute(TablePlan plan) {
      String table = plan.getTable();
      long startTime = System.currentTimeMillis();
      listener.onTableStart(table);
      TableResult result;
      try {
        result = evaluate(plan, startTime);
      } catch (TableCancelledException e) {
        result = TableResult.cancelled(table, System.currentTimeMillis() - startTime);
      } catch (PipelineException e) {
        result = TableResult.failed(table, e, System.currentTimeMillis() - startTime);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (RuntimeException | Error e) {
        result = TableResult.failed(table,
            new PipelineException("unexpected error in target table '" + table + "': " + e,
                null, e),
            System.currentTimeMillis() - startTime);
      }
      listener.onTableComplete(result);
      return result;
    }

    private TableResult evaluate(TablePlan plan, long startTime) {
      String table = plan.getTable();
      SourceReadException unread = unreadSource(plan);
      if (unread != null) {
        throw unread;
      }
      if (run.isCancelled(table)) {
        throw new TableCancelledException(table);
      }

      TableEvaluation evaluation = evaluator.evaluate(plan, sources, () -> run.isCancelled(table));
      ValidationOutcome outcome =
          validator.run(table, evaluation.getRows(), plan.getValidations());
      List<QuarantineRecord> quarantine = new ArrayList<>(evaluation.getQuarantine());
      quarantine.addAll(outcome.getQuarantine());

      if (!run.beginWrite(table)) {
        throw new TableCancelledException(table);
      }
      List<String> columns = new ArrayList<>();
      for (FieldConfig column : plan.getColumns()) {
        columns.add(column.getName());
      }
      long written;
      try {
        written = writer.write(new WriteRequest(table, plan.getTarget().getMode(),
            plan.getTarget().getMergeKey(), columns, outcome.getRows(), quarantine));
      } catch (IOException | RuntimeException e) {
        throw new WriteException(table, e);
      }

      return TableResult.builder(table)
          .rowsWritten(written)
          .droppedRows(evaluation.getDroppedRows() + outcome.getDroppedRows())
          .rowErrors(evaluation.getRowErrors())
          .quarantine(quarantine)
          .elapsedMs(System.currentTimeMillis() - startTime)
          .build();
    }

    private @Nullable SourceReadException unreadSource(TablePlan plan) {
      SourceReadException unread = unreadable.get(plan.getSource().getName());
      if (unread != null) {
        return unread;
      }
      for (String lookup : plan.getLookupTables()) {
        unread = unreadable.get(lookup);
        if (unread != null) {
          return unread;
        }
      }
      return null;
    }
  }

  /**
   * Callback notified as a pipeline run progresses. Invoked from the run's
   * threads; target table callbacks may arrive concurrently.
   */
  public interface PipelineListener {
    /**
     * Called when a phase starts.
     *
     * @param phase Phase name: compile, materialize or tables
     * @param totalItems Number of items the phase handles
     */
    void onPhaseStart(String phase, int totalItems);

    /**
     * Called when a phase completes.
     *
     * @param phase Phase name
     * @param processedItems Number of items processed successfully
     */
    void onPhaseComplete(String phase, int processedItems);

    void onTableStart(String table);

    void onTableComplete(TableResult result);
  }

  /**
   * Default listener that logs to SLF4J.
   */
  public static class LoggingPipelineListener implements PipelineListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingPipelineListener.class);

    @Override public void onPhaseStart(String phase, int totalItems) {
      LOG.info("Starting phase '{}' with {} items", phase, totalItems);
    }

    @Override public void onPhaseComplete(String phase, int processedItems) {
      LOG.info("Completed phase '{}': {} items processed", phase, processedItems);
    }

    @Override public void onTableStart(String table) {
      LOG.debug("Starting target table '{}'", table);
    }

    @Override public void onTableComplete(TableResult result) {
      switch (result.getStatus()) {
        case SUCCEEDED:
          LOG.info("Target table '{}' written: {} rows, {} dropped, {} quarantined in {}ms",
              result.getTable(), result.getRowsWritten(), result.getDroppedRows(),
              result.getQuarantinedRows(), result.getElapsedMs());
          break;
        case CANCELLED:
          LOG.warn("Target table '{}' cancelled", result.getTable());
          break;
        default:
          LOG.error("Target table '{}' failed", result.getTable(), result.getCause());
          break;
      }
    }
  }
}
