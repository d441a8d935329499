/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.join.JoinType;

/**
 * Equi-join of two inputs on pairs of key expressions. {@code leftKeys} are bound to the left
 * schema and {@code rightKeys} to the right schema. Output is the left columns followed by the
 * right columns, or the left columns only for semi and anti joins.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalJoin extends LogicalPlan {

  @Getter private final JoinType joinType;

  @Getter private final List<Expression> leftKeys;

  @Getter private final List<Expression> rightKeys;

  public LogicalJoin(
      LogicalPlan left,
      LogicalPlan right,
      JoinType joinType,
      List<? extends Expression> leftKeys,
      List<? extends Expression> rightKeys) {
    super(
        ImmutableList.of(left, right),
        joinType.outputsProbeColumns()
            ? left.getSchema().concat(right.getSchema())
            : left.getSchema());
    this.joinType = joinType;
    this.leftKeys = ImmutableList.copyOf(leftKeys);
    this.rightKeys = ImmutableList.copyOf(rightKeys);
  }

  public LogicalPlan getLeft() {
    return getChild().get(0);
  }

  public LogicalPlan getRight() {
    return getChild().get(1);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
