/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;

/** A scalar expression evaluated against one row of a {@link Page}. */
public interface Expression {

  /**
   * Evaluates the expression on a row.
   *
   * @param page the input page
   * @param position the row index within the page
   * @return the value, or null
   */
  Object valueOf(Page page, int position);

  /** Returns the result type. Only meaningful once the expression passed type checking. */
  BlockType type();

  /** Accepts a visitor. */
  <T, C> T accept(ExpressionNodeVisitor<T, C> visitor, C context);
}
