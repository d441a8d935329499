/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

/** Renders a physical plan as indented text, one node per line, children below their parent. */
public final class PlanFormatter {

  private static final String INDENT = "  ";

  private PlanFormatter() {}

  public static String format(ExecutionPlan plan) {
    StringBuilder builder = new StringBuilder();
    append(plan, 0, builder);
    return builder.toString();
  }

  private static void append(ExecutionPlan plan, int depth, StringBuilder builder) {
    builder.append(INDENT.repeat(depth)).append(plan.describe()).append('\n');
    for (ExecutionPlan child : plan.getChildren()) {
      append(child, depth + 1, builder);
    }
  }
}
