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

/** An expression with an output column name, used by projections and grouping keys. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class NamedExpression implements Expression {

  /** Output column name. */
  private final String name;

  /** Expression being named. */
  private final Expression delegated;

  @Override
  public Object valueOf(Page page, int position) {
    return delegated.valueOf(page, position);
  }

  @Override
  public BlockType type() {
    return delegated.type();
  }

  @Override
  public <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context) {
    return visitor.visitNamed(this, context);
  }

  @Override
  public String toString() {
    if (delegated instanceof ReferenceExpression
        && ((ReferenceExpression) delegated).getName().equals(name)) {
      return delegated.toString();
    }
    return delegated + " AS " + name;
  }
}
