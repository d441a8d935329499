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
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/** Keeps the first {@code fetch} rows of every partition. */
public class LocalLimitExec extends AbstractExecutionPlan {

  @Getter private final long fetch;

  public LocalLimitExec(ExecutionPlan input, long fetch) {
    super(input.getSchema(), List.of(input));
    this.fetch = fetch;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.LOCAL_LIMIT;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new LocalLimitExec(children.get(0), fetch);
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
    return executeOverChild(partition, taskContext, context, new LimitOperator(0, fetch, context));
  }

  @Override
  public String describe() {
    return "LocalLimitExec: fetch=" + fetch;
  }
}
