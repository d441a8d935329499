/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import java.math.BigDecimal;
import java.math.MathContext;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;

/**
 * Binary arithmetic over numeric operands. Integral operands compute in LONG, any floating point
 * operand promotes to DOUBLE, otherwise any DECIMAL operand promotes to DECIMAL.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ArithmeticExpression implements Expression {

  /** Arithmetic operators. */
  public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  private final Operator operator;

  private final Expression left;

  private final Expression right;

  /** Returns the result type for the given operand types, or null if they are not numeric. */
  public static BlockType resultType(BlockType leftType, BlockType rightType) {
    if (!isNumericOrNull(leftType) || !isNumericOrNull(rightType)) {
      return null;
    }
    if (leftType.isFloatingPoint() || rightType.isFloatingPoint()) {
      return BlockType.DOUBLE;
    }
    if (leftType == BlockType.DECIMAL || rightType == BlockType.DECIMAL) {
      return BlockType.DECIMAL;
    }
    return BlockType.LONG;
  }

  private static boolean isNumericOrNull(BlockType type) {
    return type.isNumeric() || type == BlockType.NULL;
  }

  @Override
  public Object valueOf(Page page, int position) {
    Object leftValue = left.valueOf(page, position);
    Object rightValue = right.valueOf(page, position);
    if (leftValue == null || rightValue == null) {
      return null;
    }
    if (!(leftValue instanceof Number) || !(rightValue instanceof Number)) {
      throw new UpstreamDataException("Non-numeric operand while evaluating " + this);
    }
    Number l = (Number) leftValue;
    Number r = (Number) rightValue;
    switch (type()) {
      case DOUBLE:
        return applyDouble(l.doubleValue(), r.doubleValue());
      case DECIMAL:
        return applyDecimal(ValueUtils.toBigDecimal(l), ValueUtils.toBigDecimal(r));
      default:
        return applyLong(l.longValue(), r.longValue());
    }
  }

  private Object applyLong(long l, long r) {
    try {
      switch (operator) {
        case ADD:
          return Math.addExact(l, r);
        case SUBTRACT:
          return Math.subtractExact(l, r);
        case MULTIPLY:
          return Math.multiplyExact(l, r);
        default:
          if (r == 0) {
            throw new UpstreamDataException("Division by zero in " + this);
          }
          return l / r;
      }
    } catch (ArithmeticException e) {
      throw new UpstreamDataException("Overflow while evaluating " + this, e);
    }
  }

  private Object applyDouble(double l, double r) {
    switch (operator) {
      case ADD:
        return l + r;
      case SUBTRACT:
        return l - r;
      case MULTIPLY:
        return l * r;
      default:
        return l / r;
    }
  }

  private Object applyDecimal(BigDecimal l, BigDecimal r) {
    switch (operator) {
      case ADD:
        return l.add(r);
      case SUBTRACT:
        return l.subtract(r);
      case MULTIPLY:
        return l.multiply(r);
      default:
        if (r.signum() == 0) {
          throw new UpstreamDataException("Division by zero in " + this);
        }
        return l.divide(r, MathContext.DECIMAL128);
    }
  }

  @Override
  public BlockType type() {
    BlockType type = resultType(left.type(), right.type());
    if (type == null) {
      throw new IllegalStateException("Arithmetic over non-numeric operands: " + this);
    }
    return type;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitArithmetic(this, context);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
