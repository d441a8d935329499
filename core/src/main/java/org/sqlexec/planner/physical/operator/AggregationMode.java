/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

/** Phase of a two-phase aggregation. */
public enum AggregationMode {
  /** Folds raw rows into intermediate states per partition. */
  PARTIAL("Partial"),
  /** Merges intermediate states of inputs already hash-partitioned on the group keys. */
  FINAL_PARTITIONED("FinalPartitioned"),
  /** Merges intermediate states of a single partition. */
  FINAL("Final");

  private final String displayName;

  AggregationMode(String displayName) {
    this.displayName = displayName;
  }

  public boolean isFinal() {
    return this != PARTIAL;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
