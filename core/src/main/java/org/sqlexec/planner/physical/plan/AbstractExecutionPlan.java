/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.Operator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.PageStreamSourceOperator;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.pipeline.PipelineDriver;
import org.sqlexec.planner.physical.stream.PageStream;

/** Base class holding the schema and children of a plan node. */
public abstract class AbstractExecutionPlan implements ExecutionPlan {

  @Getter private final Schema schema;

  @Getter private final List<ExecutionPlan> children;

  protected AbstractExecutionPlan(Schema schema, List<ExecutionPlan> children) {
    this.schema = schema;
    this.children = ImmutableList.copyOf(children);
  }

  protected ExecutionPlan child(int index) {
    return children.get(index);
  }

  /** Throws unless {@code partition} is one of this node's output partitions. */
  protected void checkPartition(int partition) {
    int count = getOutputPartitioning().getPartitionCount();
    if (partition < 0 || partition >= count) {
      throw new IllegalArgumentException(
          String.format(
              "Partition %d out of range [0, %d) for %s", partition, count, getOperatorType()));
    }
  }

  /** Returns an operator context named after this node. */
  protected OperatorContext operatorContext(int partition, TaskContext taskContext) {
    return OperatorContext.create(getOperatorType().name(), partition, taskContext);
  }

  /** Runs {@code operator} over the same partition of the only child. */
  protected PageStream executeOverChild(
      int partition, TaskContext taskContext, OperatorContext context, Operator operator) {
    PageStream input = child(0).execute(partition, taskContext);
    return new PipelineDriver(
            taskContext, new PageStreamSourceOperator(input, context), List.of(operator))
        .asStream(getSchema());
  }

  @Override
  public String toString() {
    return describe();
  }
}
