/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.operator.SortOperator;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Sorts its input. With {@code preservePartitioning} every partition is sorted on its own;
 * otherwise the input must be a single partition.
 */
public class SortExec extends AbstractExecutionPlan {

  @Getter private final List<SortKey> sortKeys;
  /** Rows to keep per partition, null for all. */
  @Getter private final Long fetch;

  @Getter private final boolean preservePartitioning;

  public SortExec(
      ExecutionPlan input, List<SortKey> sortKeys, Long fetch, boolean preservePartitioning) {
    super(input.getSchema(), List.of(input));
    this.sortKeys = ImmutableList.copyOf(sortKeys);
    this.fetch = fetch;
    this.preservePartitioning = preservePartitioning;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SORT;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new SortExec(children.get(0), sortKeys, fetch, preservePartitioning);
  }

  @Override
  public List<Distribution> getRequiredInputDistribution() {
    return List.of(
        preservePartitioning ? Distribution.unspecified() : Distribution.singlePartition());
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return child(0).getOutputPartitioning();
  }

  @Override
  public List<SortKey> getOutputOrdering() {
    return sortKeys;
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
        new SortOperator(
            getSchema(),
            sortKeys,
            fetch == null ? Long.MAX_VALUE : fetch,
            taskContext.getConfig().getBatchSize(),
            context));
  }

  @Override
  public String describe() {
    return String.format(
        "SortExec: %sexpr=[%s], preserve_partitioning=%s",
        fetch == null ? "" : "fetch=" + fetch + ", ",
        sortKeys.stream().map(Object::toString).collect(Collectors.joining(", ")),
        preservePartitioning);
  }
}
