/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage.memory;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.PageBuilder;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.storage.PageSource;
import org.sqlexec.storage.Split;
import org.sqlexec.storage.Table;

/** A {@link Table} whose splits are lists of pages held in memory. */
public class InMemoryTable implements Table {

  @Getter private final String name;
  @Getter private final Schema schema;
  private final List<List<Page>> splitPages;
  private final long estimatedRowCount;

  /**
   * Creates a table.
   *
   * @param name table name
   * @param schema table schema
   * @param splitPages pages per split
   * @param estimatedRowCount row estimate to report, or -1 to report the actual row count
   */
  public InMemoryTable(
      String name, Schema schema, List<List<Page>> splitPages, long estimatedRowCount) {
    this.name = name;
    this.schema = schema;
    this.splitPages = ImmutableList.copyOf(splitPages);
    this.estimatedRowCount = estimatedRowCount >= 0 ? estimatedRowCount : countRows(splitPages);
  }

  /**
   * Distributes rows over {@code splitCount} splits of consecutive rows, cutting each split into
   * pages of at most {@code pageSize} rows.
   */
  public static InMemoryTable fromRows(
      String name, Schema schema, List<Object[]> rows, int splitCount, int pageSize) {
    List<List<Page>> splits = new ArrayList<>(splitCount);
    int rowsPerSplit = (rows.size() + splitCount - 1) / Math.max(1, splitCount);
    for (int split = 0; split < splitCount; split++) {
      int from = Math.min(rows.size(), split * rowsPerSplit);
      int to = Math.min(rows.size(), from + rowsPerSplit);
      List<Page> pages = new ArrayList<>();
      PageBuilder builder = new PageBuilder(schema);
      for (int row = from; row < to; row++) {
        builder.appendRow(rows.get(row));
        if (builder.getRowCount() == pageSize) {
          pages.add(builder.build());
        }
      }
      if (!builder.isEmpty()) {
        pages.add(builder.build());
      }
      splits.add(pages);
    }
    return new InMemoryTable(name, schema, splits, -1);
  }

  /** Returns a copy of this table reporting a different row estimate. */
  public InMemoryTable withEstimatedRowCount(long rows) {
    return new InMemoryTable(name, schema, splitPages, rows);
  }

  @Override
  public long getEstimatedRowCount() {
    return estimatedRowCount;
  }

  @Override
  public long getEstimatedSizeBytes() {
    long bytes = 0;
    for (List<Page> pages : splitPages) {
      for (Page page : pages) {
        bytes += page.getRetainedSizeBytes();
      }
    }
    return bytes;
  }

  @Override
  public List<Split> getSplits() {
    List<Split> splits = new ArrayList<>(splitPages.size());
    for (int i = 0; i < splitPages.size(); i++) {
      splits.add(new Split(name, i, countRows(List.of(splitPages.get(i)))));
    }
    return splits;
  }

  @Override
  public PageSource createPageSource(Split split) {
    List<Page> pages = splitPages.get(split.getSplitId());
    return new PageSource() {
      private int next;

      @Override
      public Page getNextPage() {
        return next < pages.size() ? pages.get(next++) : null;
      }

      @Override
      public void close() {
        next = pages.size();
      }
    };
  }

  private static long countRows(List<List<Page>> splitPages) {
    long rows = 0;
    for (List<Page> pages : splitPages) {
      for (Page page : pages) {
        rows += page.getPositionCount();
      }
    }
    return rows;
  }
}
