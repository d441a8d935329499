/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage;

import java.util.List;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Scan metadata and data access for one table, supplied by the data source. The engine reads a
 * table split by split; splits are distributed over scan partitions.
 */
public interface Table {

  String getName();

  Schema getSchema();

  /** Returns the estimated number of rows, used for join strategy selection. */
  long getEstimatedRowCount();

  /** Returns the estimated size in bytes. */
  long getEstimatedSizeBytes();

  /** Returns the splits of this table in a stable order. */
  List<Split> getSplits();

  /**
   * Opens a reader over one split. Pages returned by the reader must match {@link #getSchema()}.
   */
  PageSource createPageSource(Split split);
}
