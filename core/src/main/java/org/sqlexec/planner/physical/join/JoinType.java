/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.join;

/** Join types. The left input is the build side, the right input the probe side. */
public enum JoinType {
  INNER("Inner"),
  LEFT("Left"),
  RIGHT("Right"),
  FULL("Full"),
  /** Left rows with at least one match. */
  SEMI("LeftSemi"),
  /** Left rows without a match. */
  ANTI("LeftAnti");

  private final String displayName;

  JoinType(String displayName) {
    this.displayName = displayName;
  }

  /** Returns true if the result depends on which build rows found a match. */
  public boolean tracksBuildMatches() {
    return this == LEFT || this == FULL || this == SEMI || this == ANTI;
  }

  /** Returns true if the output carries the probe (right) columns. */
  public boolean outputsProbeColumns() {
    return this != SEMI && this != ANTI;
  }

  /** Returns true if probe rows without a match are emitted with null build columns. */
  public boolean emitsUnmatchedProbe() {
    return this == RIGHT || this == FULL;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
