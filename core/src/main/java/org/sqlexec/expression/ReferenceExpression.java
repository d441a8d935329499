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

/** Reference to an input column, bound by index to the child's schema. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ReferenceExpression implements Expression {

  private final String name;

  private final int index;

  private final BlockType type;

  @Override
  public Object valueOf(Page page, int position) {
    return page.getValue(position, index);
  }

  @Override
  public BlockType type() {
    return type;
  }

  /** Returns the same column shifted by {@code offset} positions. */
  public ReferenceExpression shift(int offset) {
    return new ReferenceExpression(name, index + offset, type);
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitReference(this, context);
  }

  @Override
  public String toString() {
    return name + "@" + index;
  }
}
