/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.ProjectionOperator;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Evaluates named expressions over every row. Partitioning, ordering and equivalences survive on
 * the columns passed through as plain references.
 */
public class ProjectionExec extends AbstractExecutionPlan {

  @Getter private final List<NamedExpression> projections;
  private final int[] newIndexes;

  public ProjectionExec(ExecutionPlan input, List<NamedExpression> projections, Schema schema) {
    super(schema, List.of(input));
    this.projections = ImmutableList.copyOf(projections);
    this.newIndexes = new int[input.getSchema().size()];
    Arrays.fill(newIndexes, -1);
    for (int i = 0; i < projections.size(); i++) {
      if (projections.get(i).getDelegated() instanceof ReferenceExpression) {
        int index = ((ReferenceExpression) projections.get(i).getDelegated()).getIndex();
        if (newIndexes[index] < 0) {
          newIndexes[index] = i;
        }
      }
    }
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.PROJECTION;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new ProjectionExec(children.get(0), projections, getSchema());
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return child(0).getOutputPartitioning().remap(newIndexes, getSchema());
  }

  @Override
  public List<SortKey> getOutputOrdering() {
    List<SortKey> ordering = new ArrayList<>();
    for (SortKey key : child(0).getOutputOrdering()) {
      int index = newIndexes[key.fieldIndex()];
      if (index < 0) {
        break;
      }
      ordering.add(
          new SortKey(
              getSchema().getField(index).getName(), index, key.descending(), key.nullsLast()));
    }
    return ordering;
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    return child(0).getEquivalenceProperties().remap(newIndexes);
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    OperatorContext context = operatorContext(partition, taskContext);
    return executeOverChild(
        partition, taskContext, context, new ProjectionOperator(projections, getSchema(), context));
  }

  @Override
  public String describe() {
    return "ProjectionExec: expr=["
        + projections.stream().map(Object::toString).collect(Collectors.joining(", "))
        + "]";
  }
}
