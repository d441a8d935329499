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
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.planner.physical.operator.AggregationMode;
import org.sqlexec.planner.physical.operator.HashAggregationOperator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Hash aggregation in one of its phases. A partial aggregate emits the group columns followed by
 * the state columns of every aggregate; a final aggregate reads that layout and emits the group
 * columns followed by one result per aggregate. In final modes the group expressions are
 * references to the leading group columns of the input.
 */
public class AggregateExec extends AbstractExecutionPlan {

  @Getter private final AggregationMode mode;
  @Getter private final List<NamedExpression> groupBy;
  @Getter private final List<AggregateCall> aggregates;

  public AggregateExec(
      AggregationMode mode,
      ExecutionPlan input,
      List<NamedExpression> groupBy,
      List<AggregateCall> aggregates,
      Schema schema) {
    super(schema, List.of(input));
    this.mode = mode;
    this.groupBy = ImmutableList.copyOf(groupBy);
    this.aggregates = ImmutableList.copyOf(aggregates);
  }

  /** Returns the schema a partial aggregate produces for the given groups and aggregates. */
  public static Schema partialSchema(
      List<NamedExpression> groupBy, List<AggregateCall> aggregates) {
    List<Schema.Field> fields = new ArrayList<>();
    groupBy.forEach(group -> fields.add(Schema.Field.of(group.getName(), group.type())));
    aggregates.forEach(aggregate -> fields.addAll(aggregate.getStateFields()));
    return new Schema(fields);
  }

  /** Returns the schema a final aggregate produces for the given groups and aggregates. */
  public static Schema finalSchema(List<NamedExpression> groupBy, List<AggregateCall> aggregates) {
    List<Schema.Field> fields = new ArrayList<>();
    groupBy.forEach(group -> fields.add(Schema.Field.of(group.getName(), group.type())));
    aggregates.forEach(aggregate -> fields.add(aggregate.getOutputField()));
    return new Schema(fields);
  }

  /** Returns references to the first {@code count} columns of {@code schema}. */
  public static List<ReferenceExpression> leadingColumns(Schema schema, int count) {
    List<ReferenceExpression> references = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      references.add(new ReferenceExpression(schema.getField(i).getName(), i, schema.getType(i)));
    }
    return references;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.AGGREGATE;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new AggregateExec(mode, children.get(0), groupBy, aggregates, getSchema());
  }

  @Override
  public List<Distribution> getRequiredInputDistribution() {
    switch (mode) {
      case FINAL:
        return List.of(Distribution.singlePartition());
      case FINAL_PARTITIONED:
        return List.of(
            Distribution.hash(leadingColumns(child(0).getSchema(), groupBy.size())));
      default:
        return List.of(Distribution.unspecified());
    }
  }

  @Override
  public Partitioning getOutputPartitioning() {
    int partitions = child(0).getOutputPartitioning().getPartitionCount();
    switch (mode) {
      case FINAL:
        return Partitioning.single();
      case FINAL_PARTITIONED:
        return Partitioning.hash(leadingColumns(getSchema(), groupBy.size()), partitions);
      default:
        return Partitioning.unknown(partitions);
    }
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    OperatorContext context = operatorContext(partition, taskContext);
    List<Expression> groupKeys = new ArrayList<>(groupBy);
    return executeOverChild(
        partition,
        taskContext,
        context,
        new HashAggregationOperator(
            mode,
            groupKeys,
            aggregates,
            getSchema(),
            taskContext.getConfig().getBatchSize(),
            context));
  }

  @Override
  public String describe() {
    return String.format(
        "AggregateExec: mode=%s, gby=[%s], aggr=[%s]",
        mode,
        groupBy.stream().map(Object::toString).collect(Collectors.joining(", ")),
        aggregates.stream().map(Object::toString).collect(Collectors.joining(", ")));
  }
}
