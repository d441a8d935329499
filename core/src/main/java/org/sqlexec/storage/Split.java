/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A unit of scan work: one portion of a table (a file, a file range, an in-memory chunk). Includes
 * estimated size for balancing splits over scan partitions.
 */
@Getter
@EqualsAndHashCode
public class Split {

  private final String tableName;
  private final int splitId;
  private final long estimatedRows;

  public Split(String tableName, int splitId, long estimatedRows) {
    this.tableName = tableName;
    this.splitId = splitId;
    this.estimatedRows = estimatedRows;
  }

  @Override
  public String toString() {
    return "Split{" + "table='" + tableName + "', id=" + splitId + ", ~rows=" + estimatedRows + '}';
  }
}
