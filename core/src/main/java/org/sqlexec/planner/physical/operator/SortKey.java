/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

/** One key of a sort order: the input column, its direction and where nulls go. */
public record SortKey(String fieldName, int fieldIndex, boolean descending, boolean nullsLast) {

  /** Ascending with nulls last. */
  public static SortKey asc(String fieldName, int fieldIndex) {
    return new SortKey(fieldName, fieldIndex, false, true);
  }

  /** Descending with nulls first. */
  public static SortKey desc(String fieldName, int fieldIndex) {
    return new SortKey(fieldName, fieldIndex, true, false);
  }

  @Override
  public String toString() {
    return fieldName
        + "@"
        + fieldIndex
        + (descending ? " DESC" : " ASC")
        + (nullsLast ? " NULLS LAST" : " NULLS FIRST");
  }
}
