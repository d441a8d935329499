/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.exception.QueryEngineException;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.stream.PageStream;
import org.sqlexec.planner.physical.stream.PageStreams;

/** Runs every output partition of a plan as a task on the query's executor. */
@Log4j2
class LocalQueryExecution implements QueryExecution {

  @Getter private final ExecutionPlan plan;

  private final TaskContext taskContext;

  private final CompletableFuture<QueryResult> completion = new CompletableFuture<>();

  private final long startNanos = System.nanoTime();

  private volatile long endNanos;

  private volatile State state = State.RUNNING;

  LocalQueryExecution(ExecutionPlan plan, TaskContext taskContext) {
    this.plan = plan;
    this.taskContext = taskContext;
  }

  void start(List<PageStream> streams) {
    List<CompletableFuture<List<Page>>> tasks = new ArrayList<>(streams.size());
    for (PageStream stream : streams) {
      tasks.add(
          CompletableFuture.supplyAsync(
              () -> PageStreams.drain(stream), taskContext.getExecutor()));
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
        .whenComplete((ignored, error) -> finish(tasks, error));
  }

  private void finish(List<CompletableFuture<List<Page>>> tasks, Throwable error) {
    endNanos = System.nanoTime();
    try {
      if (error == null) {
        List<List<Page>> partitions = new ArrayList<>(tasks.size());
        tasks.forEach(task -> partitions.add(task.join()));
        QueryResult result = new QueryResult(plan.getSchema(), partitions);
        state = State.FINISHED;
        log.info(
            "Query {} finished with {} rows in {} ms",
            getQueryId(),
            result.getRowCount(),
            getElapsedTimeMillis());
        completion.complete(result);
        return;
      }
      Throwable cause = error instanceof CompletionException ? error.getCause() : error;
      if (taskContext.getFailure() == null && !(cause instanceof QueryCancelledException)) {
        taskContext.fail(cause);
      }
      Throwable failure = taskContext.getFailure();
      if (failure != null) {
        state = State.FAILED;
        log.info("Query {} failed after {} ms", getQueryId(), getElapsedTimeMillis());
        completion.completeExceptionally(failure);
      } else {
        state = State.CANCELLED;
        log.info("Query {} cancelled after {} ms", getQueryId(), getElapsedTimeMillis());
        completion.completeExceptionally(cause);
      }
    } finally {
      taskContext.close();
    }
  }

  @Override
  public String getQueryId() {
    return taskContext.getQueryId();
  }

  @Override
  public State getState() {
    return state;
  }

  @Override
  public void cancel() {
    if (state == State.RUNNING) {
      taskContext.cancel();
    }
  }

  @Override
  public QueryResult getResult() {
    try {
      return completion.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
      throw new QueryCancelledException(getQueryId());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new QueryEngineException("Query " + getQueryId() + " failed", cause);
    }
  }

  @Override
  public long getElapsedTimeMillis() {
    long end = state == State.RUNNING ? System.nanoTime() : endNanos;
    return TimeUnit.NANOSECONDS.toMillis(end - startNanos);
  }
}
