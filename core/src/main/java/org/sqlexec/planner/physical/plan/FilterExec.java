/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.operator.FilterOperator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/** Keeps the rows for which the predicate is TRUE. */
public class FilterExec extends AbstractExecutionPlan {

  @Getter private final Expression predicate;

  public FilterExec(ExecutionPlan input, Expression predicate) {
    super(input.getSchema(), List.of(input));
    this.predicate = predicate;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.FILTER;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new FilterExec(children.get(0), predicate);
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
        partition, taskContext, context, new FilterOperator(predicate, context));
  }

  @Override
  public String describe() {
    return "FilterExec: predicate=" + predicate;
  }
}
