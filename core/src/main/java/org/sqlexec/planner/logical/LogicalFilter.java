/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.expression.Expression;

/** Logical filter represent the filter relation. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalFilter extends LogicalPlan {

  @Getter private final Expression condition;

  public LogicalFilter(LogicalPlan child, Expression condition) {
    super(ImmutableList.of(child), child.getSchema());
    this.condition = condition;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
