/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Logical Aggregation. Output columns are the group expressions followed by one column per
 * aggregate call.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalAggregation extends LogicalPlan {

  @Getter private final List<NamedExpression> groupByList;

  @Getter private final List<AggregateCall> aggregatorList;

  public LogicalAggregation(
      LogicalPlan child, List<NamedExpression> groupByList, List<AggregateCall> aggregatorList) {
    super(ImmutableList.of(child), schemaOf(groupByList, aggregatorList));
    this.groupByList = ImmutableList.copyOf(groupByList);
    this.aggregatorList = ImmutableList.copyOf(aggregatorList);
  }

  private static Schema schemaOf(
      List<NamedExpression> groupByList, List<AggregateCall> aggregatorList) {
    List<Schema.Field> fields = new ArrayList<>();
    groupByList.forEach(group -> fields.add(Schema.Field.of(group.getName(), group.type())));
    aggregatorList.forEach(aggregate -> fields.add(aggregate.getOutputField()));
    return new Schema(fields);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAggregation(this, context);
  }
}
