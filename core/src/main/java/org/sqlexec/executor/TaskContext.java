/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.exception.QueryCancelledException;

/**
 * Per-query runtime state shared by every partition of one execution: configuration, the worker
 * executor, the cancellation flag, the first recorded failure and the shared state of plan nodes
 * (exchange buffers, CollectLeft builds). A compiled plan holds no runtime state, so the same plan
 * can be executed again with a fresh context.
 */
@Log4j2
public class TaskContext implements AutoCloseable {

  @Getter private final String queryId;

  @Getter private final ExecutionConfig config;

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  private final AtomicReference<Throwable> failure = new AtomicReference<>();

  private final Map<Object, Object> sharedState = new IdentityHashMap<>();

  private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();

  private final boolean ownsExecutor;

  private ExecutorService executor;

  /**
   * Creates a context running its tasks on the given executor. The executor must be able to run
   * every task of the query at once (exchange producers block on back-pressure), e.g. a cached
   * pool.
   */
  public TaskContext(String queryId, ExecutionConfig config, ExecutorService executor) {
    this.queryId = queryId;
    this.config = config;
    this.executor = executor;
    this.ownsExecutor = false;
  }

  private TaskContext(String queryId, ExecutionConfig config) {
    this.queryId = queryId;
    this.config = config;
    this.ownsExecutor = true;
  }

  /** Creates a context with a random query id and its own thread pool, shut down by close(). */
  public static TaskContext create(ExecutionConfig config) {
    return new TaskContext(UUID.randomUUID().toString(), config);
  }

  /** Returns the executor for partition and producer tasks. */
  public synchronized ExecutorService getExecutor() {
    if (executor == null) {
      executor = newWorkerPool(queryId);
    }
    return executor;
  }

  static ExecutorService newWorkerPool(String name) {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder()
            .setNameFormat("sqlexec-" + name + "-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Returns the state registered for {@code key}, creating it on first use. Keys are compared by
   * identity; plan nodes use themselves as key.
   */
  @SuppressWarnings("unchecked")
  public <T> T getOrCreateState(Object key, Supplier<T> factory) {
    synchronized (sharedState) {
      return (T) sharedState.computeIfAbsent(key, k -> factory.get());
    }
  }

  /** Registers a callback run once when the query is cancelled or fails. */
  public void addCancelListener(Runnable listener) {
    cancelListeners.add(listener);
    if (cancelled.get() && cancelListeners.remove(listener)) {
      runListener(listener);
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Throws {@link QueryCancelledException} once the query has been cancelled or has failed. */
  public void checkCancelled() {
    if (cancelled.get()) {
      throw new QueryCancelledException(queryId);
    }
  }

  /** Records a partition failure. The first one wins; every failure cancels the siblings. */
  public void fail(Throwable error) {
    if (failure.compareAndSet(null, error)) {
      log.error("Query {} failed", queryId, error);
    }
    cancel();
  }

  /** Returns the first recorded failure, or null. */
  public Throwable getFailure() {
    return failure.get();
  }

  /** Cancels the query. Further pulls throw and registered cleanups run. Idempotent. */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    log.info("Cancelling query {}", queryId);
    for (Runnable listener : cancelListeners) {
      if (cancelListeners.remove(listener)) {
        runListener(listener);
      }
    }
  }

  private void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException e) {
      log.warn("Cancel listener of query {} failed", queryId, e);
    }
  }

  @Override
  public synchronized void close() {
    if (ownsExecutor && executor != null) {
      executor.shutdownNow();
    }
  }
}
