/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.exchange.LocalExchange;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/** Merges all input partitions into one, in no particular order. */
public class CoalescePartitionsExec extends AbstractExecutionPlan {

  public CoalescePartitionsExec(ExecutionPlan input) {
    super(input.getSchema(), List.of(input));
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.COALESCE_PARTITIONS;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new CoalescePartitionsExec(children.get(0));
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return Partitioning.single();
  }

  @Override
  public List<SortKey> getOutputOrdering() {
    return inputPartitions() == 1 ? child(0).getOutputOrdering() : List.of();
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    return child(0).getEquivalenceProperties();
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    if (inputPartitions() == 1) {
      return child(0).execute(0, taskContext);
    }
    LocalExchange exchange =
        taskContext.getOrCreateState(
            this,
            () ->
                new LocalExchange(
                    getOperatorType().name(), child(0), Partitioning.single(), taskContext));
    return exchange.openOutput(0);
  }

  private int inputPartitions() {
    return child(0).getOutputPartitioning().getPartitionCount();
  }

  @Override
  public String describe() {
    return "CoalescePartitionsExec";
  }
}
