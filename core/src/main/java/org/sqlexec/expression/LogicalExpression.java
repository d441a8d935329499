/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;

/** AND / OR with three-valued logic. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class LogicalExpression implements Expression {

  /** Boolean connectives. */
  public enum Operator {
    AND,
    OR
  }

  private final Operator operator;

  private final Expression left;

  private final Expression right;

  @Override
  public Object valueOf(Page page, int position) {
    Boolean leftValue = (Boolean) left.valueOf(page, position);
    if (operator == Operator.AND && Boolean.FALSE.equals(leftValue)) {
      return false;
    }
    if (operator == Operator.OR && Boolean.TRUE.equals(leftValue)) {
      return true;
    }
    Boolean rightValue = (Boolean) right.valueOf(page, position);
    if (operator == Operator.AND) {
      if (Boolean.FALSE.equals(rightValue)) {
        return false;
      }
      return leftValue == null || rightValue == null ? null : Boolean.TRUE;
    }
    if (Boolean.TRUE.equals(rightValue)) {
      return true;
    }
    return leftValue == null || rightValue == null ? null : Boolean.FALSE;
  }

  @Override
  public BlockType type() {
    return BlockType.BOOLEAN;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitLogical(this, context);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator + " " + right + ")";
  }
}
