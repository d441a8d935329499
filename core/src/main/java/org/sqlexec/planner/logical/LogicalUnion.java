/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** UNION ALL of inputs with type-compatible schemas. Takes the first input's column names. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalUnion extends LogicalPlan {

  public LogicalUnion(List<LogicalPlan> inputs) {
    super(inputs, inputs.get(0).getSchema());
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnion(this, context);
  }
}
