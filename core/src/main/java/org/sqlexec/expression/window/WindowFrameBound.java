/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.data.ValueUtils;

/**
 * One end of a window frame: UNBOUNDED PRECEDING, {@code n} PRECEDING, CURRENT ROW, {@code n}
 * FOLLOWING or UNBOUNDED FOLLOWING. A null offset means unbounded.
 */
@Getter
@EqualsAndHashCode
public final class WindowFrameBound {

  /** Bound direction. */
  public enum Type {
    PRECEDING,
    CURRENT_ROW,
    FOLLOWING
  }

  private static final WindowFrameBound UNBOUNDED_PRECEDING =
      new WindowFrameBound(Type.PRECEDING, null);
  private static final WindowFrameBound CURRENT_ROW = new WindowFrameBound(Type.CURRENT_ROW, null);
  private static final WindowFrameBound UNBOUNDED_FOLLOWING =
      new WindowFrameBound(Type.FOLLOWING, null);

  private final Type type;

  /** Non-negative distance from the current row, null when unbounded. */
  private final Number offset;

  private WindowFrameBound(Type type, Number offset) {
    if (offset != null && ValueUtils.compare(offset, 0L) < 0) {
      throw new IllegalArgumentException("Window frame offset must not be negative: " + offset);
    }
    this.type = type;
    this.offset = offset;
  }

  public static WindowFrameBound unboundedPreceding() {
    return UNBOUNDED_PRECEDING;
  }

  public static WindowFrameBound preceding(Number offset) {
    return new WindowFrameBound(Type.PRECEDING, requireOffset(offset));
  }

  public static WindowFrameBound currentRow() {
    return CURRENT_ROW;
  }

  public static WindowFrameBound following(Number offset) {
    return new WindowFrameBound(Type.FOLLOWING, requireOffset(offset));
  }

  public static WindowFrameBound unboundedFollowing() {
    return UNBOUNDED_FOLLOWING;
  }

  private static Number requireOffset(Number offset) {
    if (offset == null) {
      throw new IllegalArgumentException("Window frame offset is required");
    }
    return offset;
  }

  public boolean isUnbounded() {
    return type != Type.CURRENT_ROW && offset == null;
  }

  @Override
  public String toString() {
    switch (type) {
      case PRECEDING:
        return offset == null ? "UNBOUNDED PRECEDING" : offset + " PRECEDING";
      case FOLLOWING:
        return offset == null ? "UNBOUNDED FOLLOWING" : offset + " FOLLOWING";
      default:
        return "CURRENT ROW";
    }
  }
}
