/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.LimitOperator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/** Skips {@code skip} rows of its single input partition and keeps at most {@code fetch}. */
public class GlobalLimitExec extends AbstractExecutionPlan {

  @Getter private final long skip;
  /** Null when only rows are skipped. */
  @Getter private final Long fetch;

  public GlobalLimitExec(ExecutionPlan input, long skip, Long fetch) {
    super(input.getSchema(), List.of(input));
    this.skip = skip;
    this.fetch = fetch;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.GLOBAL_LIMIT;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new GlobalLimitExec(children.get(0), skip, fetch);
  }

  @Override
  public List<Distribution> getRequiredInputDistribution() {
    return List.of(Distribution.singlePartition());
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return Partitioning.single();
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
        new LimitOperator(skip, fetch == null ? Long.MAX_VALUE : fetch, context));
  }

  @Override
  public String describe() {
    return "GlobalLimitExec: skip=" + skip + ", fetch=" + (fetch == null ? "None" : fetch);
  }
}
