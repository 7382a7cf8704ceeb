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

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs user-supplied code (custom operations, parsers, validations) with a
 * best-effort timeout.
 *
 * <p>An invocation that overruns is abandoned: its thread is interrupted and
 * the caller receives an {@link InvocationTimeoutException}. Code that
 * ignores interruption keeps running on a daemon thread until it returns.
 * A timeout of zero disables the guard and runs invocations on the calling thread.
 *
 * <p>An {@link Error} thrown by the invocation is reported as an
 * {@link InvocationFailedException}, except for a {@link VirtualMachineError},
 * which is rethrown as is.
 */
public final class InvocationGuard implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(InvocationGuard.class);

  private final long timeoutMs;
  private final @Nullable ExecutorService executor;

  public InvocationGuard(long timeoutMs) {
    this.timeoutMs = timeoutMs;
    this.executor = timeoutMs > 0
        ? Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("medallion-invocation-%d")
            .setDaemon(true)
            .build())
        : null;
  }

  /**
   * Returns a guard that runs every invocation inline without a timeout.
   */
  public static InvocationGuard unbounded() {
    return new InvocationGuard(0);
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  /**
   * Invokes the callable, waiting at most the configured timeout.
   *
   * @param invocation Description used in the timeout message, e.g. "parser 'json'"
   * @param callable Code to run
   * @return The callable's result
   * @throws InvocationTimeoutException If the callable overruns
   * @throws InvocationFailedException If the callable throws an {@link Error}
   * @throws Exception Whatever the callable throws
   */
  public <T> T call(String invocation, Callable<T> callable) throws Exception {
    if (executor == null) {
      try {
        return callable.call();
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Error e) {
        throw new InvocationFailedException(invocation, e);
      }
    }
    Future<T> future = executor.submit(callable);
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.debug("{} timed out after {}ms", invocation, timeoutMs);
      throw new InvocationTimeoutException(invocation, timeoutMs);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof VirtualMachineError) {
        throw (VirtualMachineError) cause;
      }
      if (cause instanceof Error) {
        throw new InvocationFailedException(invocation, (Error) cause);
      }
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  @Override public void close() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }
}
