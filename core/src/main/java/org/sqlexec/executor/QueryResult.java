/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/** The materialized output of a query: the pages of every output partition, in order. */
@ToString
public class QueryResult {

  @Getter private final Schema schema;

  /** Pages per output partition. */
  @Getter private final List<List<Page>> partitions;

  public QueryResult(Schema schema, List<List<Page>> partitions) {
    this.schema = schema;
    ImmutableList.Builder<List<Page>> builder = ImmutableList.builder();
    partitions.forEach(pages -> builder.add(ImmutableList.copyOf(pages)));
    this.partitions = builder.build();
  }

  public long getRowCount() {
    long rows = 0;
    for (List<Page> pages : partitions) {
      for (Page page : pages) {
        rows += page.getPositionCount();
      }
    }
    return rows;
  }

  /** Returns every row of every partition, partition 0 first. */
  public List<List<Object>> getRows() {
    List<List<Object>> rows = new ArrayList<>();
    for (int partition = 0; partition < partitions.size(); partition++) {
      rows.addAll(getRows(partition));
    }
    return rows;
  }

  /** Returns the rows of one output partition in stream order. */
  public List<List<Object>> getRows(int partition) {
    List<List<Object>> rows = new ArrayList<>();
    for (Page page : partitions.get(partition)) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        Object[] row = new Object[page.getChannelCount()];
        for (int channel = 0; channel < row.length; channel++) {
          row[channel] = page.getValue(position, channel);
        }
        rows.add(Arrays.asList(row));
      }
    }
    return rows;
  }
}
