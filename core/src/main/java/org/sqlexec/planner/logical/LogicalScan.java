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
import org.sqlexec.planner.physical.page.Schema;

/**
 * Reads the named table. {@code columns} are the projected table columns in output order; the
 * schema holds their resolved types.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalScan extends LogicalPlan {

  @Getter private final String tableName;

  @Getter private final List<String> columns;

  public LogicalScan(String tableName, List<String> columns, Schema schema) {
    super(ImmutableList.of(), schema);
    this.tableName = tableName;
    this.columns = ImmutableList.copyOf(columns);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
