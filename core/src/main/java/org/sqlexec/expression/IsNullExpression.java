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

/** IS NULL / IS NOT NULL. Never returns null. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class IsNullExpression implements Expression {

  private final Expression child;

  private final boolean negated;

  @Override
  public Object valueOf(Page page, int position) {
    boolean isNull = child.valueOf(page, position) == null;
    return negated != isNull;
  }

  @Override
  public BlockType type() {
    return BlockType.BOOLEAN;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitIsNull(this, context);
  }

  @Override
  public String toString() {
    return child + (negated ? " IS NOT NULL" : " IS NULL");
  }
}
