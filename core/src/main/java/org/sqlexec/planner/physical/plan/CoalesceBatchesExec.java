/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.CoalesceBatchesOperator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/** Re-chunks the pages of every partition into pages of the target batch size. */
public class CoalesceBatchesExec extends AbstractExecutionPlan {

  @Getter private final int targetBatchSize;

  public CoalesceBatchesExec(ExecutionPlan input, int targetBatchSize) {
    super(input.getSchema(), List.of(input));
    this.targetBatchSize = targetBatchSize;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.COALESCE_BATCHES;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new CoalesceBatchesExec(children.get(0), targetBatchSize);
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return child(0).getOutputPartitioning();
  }

  @Override
  public List<SortKey> getOutputOrdering() {
    return child(0).getOutputOrdering();
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    return child(0).getEquivalenceProperties();
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    OperatorContext context = operatorContext(partition, taskContext);
    return executeOverChild(
        partition,
        taskContext,
        context,
        new CoalesceBatchesOperator(getSchema(), targetBatchSize, context));
  }

  @Override
  public String describe() {
    return "CoalesceBatchesExec: target_batch_size=" + targetBatchSize;
  }
}
