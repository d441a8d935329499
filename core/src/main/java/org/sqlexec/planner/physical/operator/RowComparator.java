/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.planner.physical.page.Page;

/** Compares rows, possibly of different pages, by a list of {@link SortKey}s. */
public class RowComparator {

  private final List<SortKey> sortKeys;

  public RowComparator(List<SortKey> sortKeys) {
    this.sortKeys = ImmutableList.copyOf(sortKeys);
  }

  public int compare(Page left, int leftPosition, Page right, int rightPosition) {
    for (SortKey key : sortKeys) {
      Object l = left.getValue(leftPosition, key.fieldIndex());
      Object r = right.getValue(rightPosition, key.fieldIndex());
      int result;
      if (l == null || r == null) {
        if (l == r) {
          continue;
        }
        // null placement does not flip with the direction
        result = (l == null) == key.nullsLast() ? 1 : -1;
        return result;
      }
      result = ValueUtils.compare(l, r);
      if (result != 0) {
        return key.descending() ? -result : result;
      }
    }
    return 0;
  }
}
