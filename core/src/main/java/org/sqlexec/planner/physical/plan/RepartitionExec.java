/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.exchange.LocalExchange;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Redistributes the rows of all input partitions by a hash or round-robin partitioning. All output
 * partitions of one execution share a single {@link LocalExchange}.
 */
public class RepartitionExec extends AbstractExecutionPlan {

  @Getter private final Partitioning partitioning;

  public RepartitionExec(ExecutionPlan input, Partitioning partitioning) {
    super(input.getSchema(), List.of(input));
    this.partitioning = partitioning;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.REPARTITION;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new RepartitionExec(children.get(0), partitioning);
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return partitioning;
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    return child(0).getEquivalenceProperties();
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    LocalExchange exchange =
        taskContext.getOrCreateState(
            this,
            () -> new LocalExchange(getOperatorType().name(), child(0), partitioning, taskContext));
    return exchange.openOutput(partition);
  }

  @Override
  public String describe() {
    return String.format(
        "RepartitionExec: partitioning=%s, input_partitions=%d",
        partitioning, child(0).getOutputPartitioning().getPartitionCount());
  }
}
