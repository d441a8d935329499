/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.physical.plan.ExecutionPlan;

/** Lowers logical plans into executable physical plans. */
public interface PhysicalPlanner {

  /**
   * Compiles a logical plan.
   *
   * @throws org.sqlexec.exception.CompileException if the plan cannot be compiled
   */
  ExecutionPlan plan(LogicalPlan plan);
}
