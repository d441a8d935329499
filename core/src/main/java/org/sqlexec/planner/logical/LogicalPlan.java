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

/** The base class for all logical plan nodes. Every node carries its resolved output schema. */
@EqualsAndHashCode
@ToString
public abstract class LogicalPlan {

  /** Input plans. */
  @Getter private final List<LogicalPlan> child;

  @Getter private final Schema schema;

  protected LogicalPlan(List<LogicalPlan> child, Schema schema) {
    this.child = ImmutableList.copyOf(child);
    this.schema = schema;
  }

  /**
   * Dispatches to the visitor method for this node type.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> return type
   * @param <C> context type
   * @return the visitor's result
   */
  public abstract <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context);
}
