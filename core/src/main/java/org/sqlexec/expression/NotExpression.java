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

/** Boolean negation; NOT NULL is NULL. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class NotExpression implements Expression {

  private final Expression child;

  @Override
  public Object valueOf(Page page, int position) {
    Boolean value = (Boolean) child.valueOf(page, position);
    return value == null ? null : !value;
  }

  @Override
  public BlockType type() {
    return BlockType.BOOLEAN;
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitNot(this, context);
  }

  @Override
  public String toString() {
    return "NOT " + child;
  }
}
