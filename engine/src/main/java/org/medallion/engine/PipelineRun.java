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

import org.medallion.engine.plan.ExecutionPlan;
import org.medallion.engine.plan.TablePlan;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a pipeline run started with {@link PipelineEngine#start}.
 *
 * <p>Cancellation applies to whole target tables. A cancelled table stops
 * at its next plan node boundary, or before it starts if it is still
 * queued, and writes nothing. A table whose write has begun completes.
 */
public class PipelineRun {

  private final ExecutionPlan plan;
  private final Map<String, AtomicBoolean> cancelled;
  private final Map<String, AtomicBoolean> writing;
  private final CompletableFuture<PipelineResult> result = new CompletableFuture<>();

  PipelineRun(ExecutionPlan plan) {
    this.plan = plan;
    Map<String, AtomicBoolean> cancelled = new LinkedHashMap<>();
    Map<String, AtomicBoolean> writing = new LinkedHashMap<>();
    for (TablePlan table : plan.getTables()) {
      cancelled.put(table.getTable(), new AtomicBoolean());
      writing.put(table.getTable(), new AtomicBoolean());
    }
    this.cancelled = ImmutableMap.copyOf(cancelled);
    this.writing = ImmutableMap.copyOf(writing);
  }

  public ExecutionPlan getPlan() {
    return plan;
  }

  public String getPipelineName() {
    return plan.getPipeline().getName();
  }

  /**
   * Requests cancellation of a target table.
   *
   * @param table Target table name
   * @return false if the table had already started writing or the run is over
   * @throws IllegalArgumentException If the pipeline has no such target table
   */
  public boolean cancel(String table) {
    AtomicBoolean flag = cancelled.get(table);
    if (flag == null) {
      throw new IllegalArgumentException("Pipeline '" + getPipelineName()
          + "' has no target table '" + table + "'");
    }
    AtomicBoolean started = writing.get(table);
    synchronized (started) {
      if (result.isDone() || started.get()) {
        return false;
      }
      flag.set(true);
      return true;
    }
  }

  /**
   * Requests cancellation of every target table not yet written.
   */
  public void cancelAll() {
    for (String table : cancelled.keySet()) {
      cancel(table);
    }
  }

  public boolean isDone() {
    return result.isDone();
  }

  /**
   * Waits for the run to finish.
   *
   * @return Results of every target table
   * @throws InterruptedException If the calling thread is interrupted while waiting
   */
  public PipelineResult await() throws InterruptedException {
    try {
      return result.get();
    } catch (ExecutionException e) {
      throw propagate(e);
    }
  }

  /**
   * Waits at most the given time for the run to finish.
   *
   * @throws TimeoutException If the run is still going
   */
  public PipelineResult await(long timeout, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    try {
      return result.get(timeout, unit);
    } catch (ExecutionException e) {
      throw propagate(e);
    }
  }

  boolean isCancelled(String table) {
    return cancelled.get(table).get();
  }

  /**
   * Marks a table as writing unless it was cancelled first.
   *
   * @return false if the table was cancelled
   */
  boolean beginWrite(String table) {
    AtomicBoolean started = writing.get(table);
    synchronized (started) {
      if (isCancelled(table)) {
        return false;
      }
      started.set(true);
      return true;
    }
  }

  void complete(PipelineResult pipelineResult) {
    result.complete(pipelineResult);
  }

  void fail(Throwable error) {
    result.completeExceptionally(error);
  }

  private static RuntimeException propagate(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new PipelineException("pipeline run failed", null, cause);
  }
}
