/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.planner.physical.operator.SortKey;

/** Sort Plan. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalSort extends LogicalPlan {

  @Getter private final List<SortKey> sortList;

  public LogicalSort(LogicalPlan child, List<SortKey> sortList) {
    super(ImmutableList.of(child), child.getSchema());
    this.sortList = ImmutableList.copyOf(sortList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
