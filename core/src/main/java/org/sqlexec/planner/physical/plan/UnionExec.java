/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Concatenates the partitions of its inputs: the first input's partitions come first, then the
 * second's and so on. Duplicates are kept.
 */
public class UnionExec extends AbstractExecutionPlan {

  public UnionExec(List<ExecutionPlan> inputs) {
    super(inputs.get(0).getSchema(), inputs);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.UNION;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new UnionExec(children);
  }

  @Override
  public Partitioning getOutputPartitioning() {
    int partitions = 0;
    for (ExecutionPlan child : getChildren()) {
      partitions += child.getOutputPartitioning().getPartitionCount();
    }
    return Partitioning.unknown(partitions);
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    int remaining = partition;
    for (ExecutionPlan child : getChildren()) {
      int count = child.getOutputPartitioning().getPartitionCount();
      if (remaining < count) {
        return child.execute(remaining, taskContext);
      }
      remaining -= count;
    }
    throw new IllegalStateException("Unreachable partition " + partition);
  }

  @Override
  public String describe() {
    return "UnionExec";
  }
}
