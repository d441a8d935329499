/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.planner.physical.join.JoinType;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.storage.Table;

/** Logical plan DSL. */
public final class LogicalPlanDSL {

  private LogicalPlanDSL() {}

  /** Scans the given columns of a table, or all of them when none are given. */
  public static LogicalPlan scan(Table table, String... columns) {
    Schema tableSchema = table.getSchema();
    List<String> names =
        columns.length == 0 ? tableSchema.getFieldNames() : Arrays.asList(columns);
    List<Schema.Field> fields = new ArrayList<>(names.size());
    for (String name : names) {
      int index = tableSchema.indexOf(name);
      if (index < 0) {
        throw new IllegalArgumentException(
            "No column " + name + " in table " + table.getName());
      }
      fields.add(tableSchema.getField(index));
    }
    return new LogicalScan(table.getName(), names, new Schema(fields));
  }

  public static LogicalPlan filter(LogicalPlan input, Expression expression) {
    return new LogicalFilter(input, expression);
  }

  public static LogicalPlan project(LogicalPlan input, NamedExpression... fields) {
    return new LogicalProject(input, Arrays.asList(fields));
  }

  public static LogicalPlan aggregation(
      LogicalPlan input, List<AggregateCall> aggregatorList, List<NamedExpression> groupByList) {
    return new LogicalAggregation(input, groupByList, aggregatorList);
  }

  public static LogicalPlan join(
      LogicalPlan left,
      LogicalPlan right,
      JoinType joinType,
      List<? extends Expression> leftKeys,
      List<? extends Expression> rightKeys) {
    return new LogicalJoin(left, right, joinType, leftKeys, rightKeys);
  }

  public static LogicalPlan sort(LogicalPlan input, SortKey... sorts) {
    return new LogicalSort(input, Arrays.asList(sorts));
  }

  public static LogicalPlan limit(LogicalPlan input, long limit, long offset) {
    return new LogicalLimit(input, limit, offset);
  }

  public static LogicalPlan offset(LogicalPlan input, long offset) {
    return new LogicalLimit(input, null, offset);
  }

  public static LogicalPlan window(
      LogicalPlan input,
      List<ReferenceExpression> partitionByList,
      List<SortKey> sortList,
      WindowCall... windows) {
    return new LogicalWindow(input, partitionByList, sortList, Arrays.asList(windows));
  }

  public static LogicalPlan union(LogicalPlan... inputs) {
    return new LogicalUnion(Arrays.asList(inputs));
  }
}
