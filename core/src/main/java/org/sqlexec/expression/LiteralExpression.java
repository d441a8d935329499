/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;

/** A constant value. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class LiteralExpression implements Expression {

  private final Object value;

  private final BlockType type;

  /** Creates a literal, inferring the type from the Java class of the value. */
  public static LiteralExpression of(Object value) {
    if (value == null) {
      return new LiteralExpression(null, BlockType.NULL);
    }
    for (BlockType type : BlockType.values()) {
      if (type != BlockType.UNKNOWN && type != BlockType.NULL && type.accepts(value)) {
        return new LiteralExpression(value, type);
      }
    }
    throw new IllegalArgumentException(
        "Unsupported literal class: " + value.getClass().getSimpleName());
  }

  @Override
  public Object valueOf(Page page, int position) {
    return value;
  }

  @Override
  public BlockType type() {
    return type;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitLiteral(this, context);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof String) {
      return "'" + value + "'";
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (value instanceof LocalDate) {
      return "DATE '" + value + "'";
    }
    return String.valueOf(value);
  }
}
