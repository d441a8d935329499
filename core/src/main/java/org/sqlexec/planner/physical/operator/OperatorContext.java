/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import lombok.Getter;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.exception.ResourceExhaustedException;
import org.sqlexec.executor.TaskContext;

/**
 * Runtime context available to operators during execution. Provides access to memory limits,
 * cancellation, and operator identity.
 */
@Getter
public class OperatorContext {

  private final String operatorId;
  private final int partition;
  private final long memoryLimitBytes;
  private final TaskContext taskContext;

  public OperatorContext(
      String operatorId, int partition, long memoryLimitBytes, TaskContext taskContext) {
    this.operatorId = operatorId;
    this.partition = partition;
    this.memoryLimitBytes = memoryLimitBytes;
    this.taskContext = taskContext;
  }

  /** Creates the context of an operator running partition {@code partition} of a query. */
  public static OperatorContext create(String operatorId, int partition, TaskContext taskContext) {
    return new OperatorContext(
        operatorId, partition, taskContext.getConfig().getOperatorMemoryLimitBytes(), taskContext);
  }

  /** Creates a default context for testing. */
  public static OperatorContext createDefault(String operatorId) {
    return create(operatorId, 0, TaskContext.create(ExecutionConfig.defaults()));
  }

  /** Throws if the query has been cancelled. */
  public void checkCancelled() {
    taskContext.checkCancelled();
  }

  /**
   * Checks that the operator may retain {@code retainedBytes} in total.
   *
   * @throws ResourceExhaustedException if the amount exceeds the operator memory limit
   */
  public void checkMemory(long retainedBytes) {
    if (retainedBytes > memoryLimitBytes) {
      throw new ResourceExhaustedException(operatorId, retainedBytes, memoryLimitBytes);
    }
  }

  @Override
  public String toString() {
    return operatorId + "[" + partition + "]";
  }
}
