/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import org.sqlexec.planner.logical.LogicalPlan;

/** Estimates the output size of a logical plan, used to choose join strategies. */
public interface CostEstimator {

  /** Returns the estimated number of output rows. */
  long estimateRows(LogicalPlan plan);

  /** Returns the estimated output size in bytes. */
  long estimateBytes(LogicalPlan plan);
}
