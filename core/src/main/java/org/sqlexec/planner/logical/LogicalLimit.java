/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Skips {@code offset} rows and keeps {@code limit} rows; a null limit keeps the rest. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalLimit extends LogicalPlan {

  private final Long limit;
  private final long offset;

  public LogicalLimit(LogicalPlan child, Long limit, long offset) {
    super(ImmutableList.of(child), child.getSchema());
    this.limit = limit;
    this.offset = offset;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
