/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.pipeline;

import lombok.Getter;
import lombok.ToString;
import org.sqlexec.planner.physical.page.Page;

/**
 * Progress and outcome of one pipeline driver. The first terminal status sticks: a pipeline that
 * failed is not later reported as cancelled by its own close.
 */
@Getter
@ToString
public class PipelineContext {

  /** Pipeline execution status. */
  public enum Status {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  private volatile Status status = Status.CREATED;
  private volatile Throwable failure;
  private long outputPages;
  private long outputRows;

  void start() {
    if (status == Status.CREATED) {
      status = Status.RUNNING;
    }
  }

  void recordOutput(Page page) {
    outputPages++;
    outputRows += page.getPositionCount();
  }

  void finish() {
    complete(Status.FINISHED);
  }

  void fail(Throwable cause) {
    if (complete(Status.FAILED)) {
      failure = cause;
    }
  }

  void cancel() {
    complete(Status.CANCELLED);
  }

  /** Returns true once the pipeline reached FINISHED, FAILED or CANCELLED. */
  public boolean isDone() {
    return status != Status.CREATED && status != Status.RUNNING;
  }

  private boolean complete(Status terminal) {
    if (isDone()) {
      return false;
    }
    status = terminal;
    return true;
  }
}
