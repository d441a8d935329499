/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;

/** Binary comparison with SQL null semantics: a null operand yields null. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ComparisonExpression implements Expression {

  /** Comparison operators. */
  public enum Operator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    boolean test(int comparison) {
      switch (this) {
        case EQUAL:
          return comparison == 0;
        case NOT_EQUAL:
          return comparison != 0;
        case LESS:
          return comparison < 0;
        case LESS_OR_EQUAL:
          return comparison <= 0;
        case GREATER:
          return comparison > 0;
        default:
          return comparison >= 0;
      }
    }
  }

  private final Operator operator;

  private final Expression left;

  private final Expression right;

  @Override
  public Object valueOf(Page page, int position) {
    Object leftValue = left.valueOf(page, position);
    Object rightValue = right.valueOf(page, position);
    if (leftValue == null || rightValue == null) {
      return null;
    }
    try {
      return operator.test(ValueUtils.compare(leftValue, rightValue));
    } catch (IllegalArgumentException e) {
      throw new UpstreamDataException("Cannot evaluate " + this + ": " + e.getMessage(), e);
    }
  }

  @Override
  public BlockType type() {
    return BlockType.BOOLEAN;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitComparison(this, context);
  }

  @Override
  public String toString() {
    return left + " " + operator.getSymbol() + " " + right;
  }
}
