/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import org.sqlexec.planner.physical.plan.ExecutionPlan;

/**
 * Handle of a query submitted to the {@link ExecutionDriver}. Every output partition runs as its
 * own task; the handle tracks them as one query.
 */
public interface QueryExecution {

  /** Query execution states. */
  enum State {
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  /** Returns the unique query identifier. */
  String getQueryId();

  /** Returns the plan being executed. */
  ExecutionPlan getPlan();

  /** Returns the current execution state. */
  State getState();

  /** Cancels all tasks of the query. Has no effect once the query is done. */
  void cancel();

  /**
   * Waits for the query to finish and returns its output.
   *
   * @throws org.sqlexec.exception.QueryEngineException the first error of a failed query, or
   *     {@link org.sqlexec.exception.QueryCancelledException} if it was cancelled
   */
  QueryResult getResult();

  /** Returns the elapsed execution time in milliseconds, up to now if still running. */
  long getElapsedTimeMillis();
}
