/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.operator.WindowOperator;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Window functions. Every window partition must sit whole in one input partition, sorted by the
 * partition keys and then the window order. Appends one column per window function to the input
 * columns, so the input partitioning and ordering carry over.
 */
public class WindowAggExec extends AbstractExecutionPlan {

  @Getter private final List<ReferenceExpression> partitionKeys;
  @Getter private final List<SortKey> orderBy;
  @Getter private final List<WindowCall> windows;

  public WindowAggExec(
      ExecutionPlan input,
      List<ReferenceExpression> partitionKeys,
      List<SortKey> orderBy,
      List<WindowCall> windows,
      Schema schema) {
    super(schema, List.of(input));
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    this.orderBy = ImmutableList.copyOf(orderBy);
    this.windows = ImmutableList.copyOf(windows);
  }

  /** Returns the order the input must follow: partition keys ascending, then the window order. */
  public static List<SortKey> inputOrdering(
      List<ReferenceExpression> partitionKeys, List<SortKey> orderBy) {
    List<SortKey> ordering = new ArrayList<>(partitionKeys.size() + orderBy.size());
    partitionKeys.forEach(key -> ordering.add(SortKey.asc(key.getName(), key.getIndex())));
    ordering.addAll(orderBy);
    return ordering;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.WINDOW;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new WindowAggExec(children.get(0), partitionKeys, orderBy, windows, getSchema());
  }

  /** A single input partition holds every window partition. */
  @Override
  public List<Distribution> getRequiredInputDistribution() {
    if (partitionKeys.isEmpty() || child(0).getOutputPartitioning().getPartitionCount() == 1) {
      return List.of(Distribution.singlePartition());
    }
    return List.of(Distribution.hash(partitionKeys));
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
        new WindowOperator(
            child(0).getSchema(),
            getSchema(),
            partitionKeys,
            orderBy,
            windows,
            taskContext.getConfig().getBatchSize(),
            context));
  }

  @Override
  public String describe() {
    return String.format(
        "WindowAggExec: partition_by=[%s], order_by=[%s], wdw=[%s]",
        partitionKeys.stream().map(Object::toString).collect(Collectors.joining(", ")),
        orderBy.stream().map(Object::toString).collect(Collectors.joining(", ")),
        windows.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}
