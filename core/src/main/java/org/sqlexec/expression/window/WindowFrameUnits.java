/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

/** How the bounds of a window frame are measured. */
public enum WindowFrameUnits {
  /** Bounds count individual rows from the current row. */
  ROWS,
  /** Bounds are offsets from the current row's value of the single ORDER BY column. */
  RANGE,
  /** Bounds count peer groups, rows equal on every ORDER BY column, from the current group. */
  GROUPS
}
