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
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Logical Window. All window functions share one PARTITION BY and ORDER BY; each has its own
 * frame. Output columns are the input columns followed by one column per window function.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalWindow extends LogicalPlan {

  @Getter private final List<ReferenceExpression> partitionByList;

  @Getter private final List<SortKey> sortList;

  @Getter private final List<WindowCall> windowList;

  public LogicalWindow(
      LogicalPlan child,
      List<ReferenceExpression> partitionByList,
      List<SortKey> sortList,
      List<WindowCall> windowList) {
    super(ImmutableList.of(child), schemaOf(child.getSchema(), windowList));
    this.partitionByList = ImmutableList.copyOf(partitionByList);
    this.sortList = ImmutableList.copyOf(sortList);
    this.windowList = ImmutableList.copyOf(windowList);
  }

  private static Schema schemaOf(Schema input, List<WindowCall> windowList) {
    List<Schema.Field> fields = new ArrayList<>();
    windowList.forEach(window -> fields.add(window.getOutputField()));
    return input.concat(new Schema(fields));
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitWindow(this, context);
  }
}
