/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

import org.sqlexec.expression.aggregation.AggregateFunction;
import org.sqlexec.planner.physical.page.Block.BlockType;

/**
 * Functions evaluated over a window. Ranking functions number the rows of a partition and ignore
 * the frame; aggregate functions fold the rows of the current row's frame.
 */
public enum WindowFunction {
  ROW_NUMBER(null),
  RANK(null),
  DENSE_RANK(null),
  SUM(AggregateFunction.SUM),
  COUNT(AggregateFunction.COUNT),
  MIN(AggregateFunction.MIN),
  MAX(AggregateFunction.MAX),
  AVG(AggregateFunction.AVG);

  private final AggregateFunction aggregate;

  WindowFunction(AggregateFunction aggregate) {
    this.aggregate = aggregate;
  }

  public boolean isRanking() {
    return aggregate == null;
  }

  /** Returns the aggregate folded over the frame, null for ranking functions. */
  public AggregateFunction getAggregate() {
    return aggregate;
  }

  /** Returns the result type for the given argument type, or null if it is not accepted. */
  public BlockType returnType(BlockType inputType) {
    return isRanking() ? BlockType.LONG : aggregate.returnType(inputType);
  }
}
