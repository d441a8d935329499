/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.expression.window.WindowFrameBound.Type;

/**
 * The rows an aggregate window function reads for each row of a window partition. The frame is
 * measured in {@link WindowFrameUnits} and runs from {@code start} to {@code end}, both
 * inclusive. For RANGE and GROUPS, CURRENT ROW covers the peers of the current row too.
 */
@Getter
@EqualsAndHashCode
public final class WindowFrame {

  /** Frame used when none is given: the partition up to the last peer of the current row. */
  public static final WindowFrame DEFAULT =
      new WindowFrame(
          WindowFrameUnits.RANGE,
          WindowFrameBound.unboundedPreceding(),
          WindowFrameBound.currentRow());

  private final WindowFrameUnits units;
  private final WindowFrameBound start;
  private final WindowFrameBound end;

  /**
   * Creates a frame.
   *
   * @throws IllegalArgumentException if the start is UNBOUNDED FOLLOWING, the end is UNBOUNDED
   *     PRECEDING, or a ROWS or GROUPS offset is not an integer
   */
  public WindowFrame(WindowFrameUnits units, WindowFrameBound start, WindowFrameBound end) {
    if (start.getType() == Type.FOLLOWING && start.isUnbounded()) {
      throw new IllegalArgumentException(
          "Invalid window frame: start bound cannot be UNBOUNDED FOLLOWING");
    }
    if (end.getType() == Type.PRECEDING && end.isUnbounded()) {
      throw new IllegalArgumentException(
          "Invalid window frame: end bound cannot be UNBOUNDED PRECEDING");
    }
    if (units != WindowFrameUnits.RANGE && !(isInteger(start) && isInteger(end))) {
      throw new IllegalArgumentException(
          "Invalid window frame: frame offsets for ROWS / GROUPS must be non negative integers");
    }
    this.units = units;
    this.start = start;
    this.end = end;
  }

  public static WindowFrame rows(WindowFrameBound start, WindowFrameBound end) {
    return new WindowFrame(WindowFrameUnits.ROWS, start, end);
  }

  public static WindowFrame range(WindowFrameBound start, WindowFrameBound end) {
    return new WindowFrame(WindowFrameUnits.RANGE, start, end);
  }

  public static WindowFrame groups(WindowFrameBound start, WindowFrameBound end) {
    return new WindowFrame(WindowFrameUnits.GROUPS, start, end);
  }

  private static boolean isInteger(WindowFrameBound bound) {
    Number offset = bound.getOffset();
    return offset == null
        || offset instanceof Long
        || offset instanceof Integer
        || offset instanceof Short
        || offset instanceof Byte;
  }

  /** Returns true if both bounds are UNBOUNDED or CURRENT ROW, so no offset is measured. */
  public boolean isFreeRange() {
    return (start.isUnbounded() || start.getType() == Type.CURRENT_ROW)
        && (end.isUnbounded() || end.getType() == Type.CURRENT_ROW);
  }

  /** Returns true if the frame always starts at the first row of the partition. */
  public boolean isEverExpanding() {
    return start.isUnbounded();
  }

  @Override
  public String toString() {
    return units + " BETWEEN " + start + " AND " + end;
  }
}
