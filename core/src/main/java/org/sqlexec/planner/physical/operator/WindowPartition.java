/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.math.LongMath;
import java.math.BigDecimal;
import java.util.List;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.expression.window.WindowFrame;
import org.sqlexec.expression.window.WindowFrameBound;
import org.sqlexec.planner.physical.page.Page;

/**
 * The rows of one window partition: positions [start, end) of a page sorted by the window order.
 * Splits them into peer groups and resolves frame bounds to positions. Frame starts are inclusive
 * and frame ends exclusive; a frame whose end is not after its start is empty.
 */
final class WindowPartition {

  private final Page page;
  private final int start;
  private final int end;
  private final List<SortKey> orderBy;

  /** Peer group of each row, indexed by position - start. */
  private final int[] groupOf;
  private final int[] groupStarts;
  private final int[] groupEnds;
  private final int groupCount;

  /** Rows whose single ORDER BY value is not null, used by RANGE offsets. */
  private int valuesStart;
  private int valuesEnd;

  WindowPartition(Page page, int start, int end, List<SortKey> orderBy) {
    this.page = page;
    this.start = start;
    this.end = end;
    this.orderBy = orderBy;
    int rows = end - start;
    RowComparator comparator = new RowComparator(orderBy);
    groupOf = new int[rows];
    int[] starts = new int[rows];
    int[] ends = new int[rows];
    int group = -1;
    for (int position = start; position < end; position++) {
      if (position == start || comparator.compare(page, position - 1, page, position) != 0) {
        group++;
        starts[group] = position;
      }
      groupOf[position - start] = group;
      ends[group] = position + 1;
    }
    groupStarts = starts;
    groupEnds = ends;
    groupCount = group + 1;
    if (orderBy.size() == 1) {
      valuesStart = start;
      while (valuesStart < end && orderValue(valuesStart) == null) {
        valuesStart++;
      }
      valuesEnd = end;
      while (valuesEnd > valuesStart && orderValue(valuesEnd - 1) == null) {
        valuesEnd--;
      }
    }
  }

  int getStart() {
    return start;
  }

  int getEnd() {
    return end;
  }

  /** Returns the 0-based peer group of the row within the partition. */
  int group(int position) {
    return groupOf[position - start];
  }

  /** Returns the first position of the row's peer group. */
  int peerStart(int position) {
    return groupStarts[group(position)];
  }

  /** Returns the first position of the frame of the row at {@code position}. */
  int frameStart(WindowFrame frame, int position) {
    return resolve(frame, frame.getStart(), position, true);
  }

  /** Returns the position after the last row of the frame of the row at {@code position}. */
  int frameEnd(WindowFrame frame, int position) {
    return resolve(frame, frame.getEnd(), position, false);
  }

  private int resolve(WindowFrame frame, WindowFrameBound bound, int position, boolean isStart) {
    if (bound.isUnbounded()) {
      return bound.getType() == WindowFrameBound.Type.PRECEDING ? start : end;
    }
    switch (frame.getUnits()) {
      case ROWS:
        return resolveRows(bound, position, isStart);
      case GROUPS:
        return resolveGroups(bound, group(position), isStart);
      default:
        return resolveRange(bound, position, isStart);
    }
  }

  private int resolveRows(WindowFrameBound bound, int position, boolean isStart) {
    long target;
    switch (bound.getType()) {
      case PRECEDING:
        target = position - bound.getOffset().longValue();
        break;
      case FOLLOWING:
        target = LongMath.saturatedAdd(position, bound.getOffset().longValue());
        break;
      default:
        target = position;
    }
    return clamp(isStart ? target : LongMath.saturatedAdd(target, 1L));
  }

  private int resolveGroups(WindowFrameBound bound, int group, boolean isStart) {
    long target;
    switch (bound.getType()) {
      case PRECEDING:
        target = group - bound.getOffset().longValue();
        break;
      case FOLLOWING:
        target = LongMath.saturatedAdd(group, bound.getOffset().longValue());
        break;
      default:
        target = group;
    }
    if (target < 0) {
      return start;
    }
    if (target >= groupCount) {
      return end;
    }
    return isStart ? groupStarts[(int) target] : groupEnds[(int) target];
  }

  /**
   * RANGE offsets frame the rows whose ORDER BY value lies within the offset of the current
   * row's value. A null current value frames its null peers only.
   */
  private int resolveRange(WindowFrameBound bound, int position, boolean isStart) {
    Object value = orderValue(position);
    if (bound.getType() == WindowFrameBound.Type.CURRENT_ROW || value == null) {
      int group = group(position);
      return isStart ? groupStarts[group] : groupEnds[group];
    }
    SortKey key = orderBy.get(0);
    BigDecimal current = ValueUtils.toBigDecimal((Number) value);
    BigDecimal offset = ValueUtils.toBigDecimal(bound.getOffset());
    boolean towardsLower = (bound.getType() == WindowFrameBound.Type.PRECEDING) != key.descending();
    BigDecimal target = towardsLower ? current.subtract(offset) : current.add(offset);
    // first row at or past the target in sort order; for an end, first row strictly past it
    int low = valuesStart;
    int high = valuesEnd;
    while (low < high) {
      int middle = (low + high) >>> 1;
      int comparison = ValueUtils.compare(orderValue(middle), target);
      if (key.descending()) {
        comparison = -comparison;
      }
      if (comparison < 0 || (!isStart && comparison == 0)) {
        low = middle + 1;
      } else {
        high = middle;
      }
    }
    return low;
  }

  private Object orderValue(int position) {
    return page.getValue(position, orderBy.get(0).fieldIndex());
  }

  private int clamp(long position) {
    return (int) Math.max(start, Math.min(end, position));
  }
}
