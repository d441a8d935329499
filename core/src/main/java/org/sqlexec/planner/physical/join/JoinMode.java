/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.join;

/** How the build side of a hash join is distributed. */
public enum JoinMode {
  /** The whole build side is collected once and shared by every probe partition. */
  COLLECT_LEFT("CollectLeft"),
  /** Both sides are hash-partitioned on the keys; every partition builds its own table. */
  PARTITIONED("Partitioned");

  private final String displayName;

  JoinMode(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
