/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Page} row by row. Call {@link #beginRow()}, set values via {@link #setValue(int,
 * Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the final Page.
 * Values are collected per column so the built page is columnar.
 */
public class PageBuilder {

  private final Schema schema;
  private final int channelCount;
  private final List<List<Object>> columns;
  private Object[] currentRow;
  private int rowCount;

  public PageBuilder(Schema schema) {
    this.schema = schema;
    this.channelCount = schema.size();
    this.columns = new ArrayList<>(channelCount);
    for (int channel = 0; channel < channelCount; channel++) {
      columns.add(new ArrayList<>());
    }
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[channelCount];
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    currentRow[channel] = value;
  }

  /** Commits the current row to the page. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    for (int channel = 0; channel < channelCount; channel++) {
      columns.get(channel).add(currentRow[channel]);
    }
    rowCount++;
    currentRow = null;
  }

  /** Appends a complete row. */
  public void appendRow(Object... values) {
    beginRow();
    for (int channel = 0; channel < values.length; channel++) {
      setValue(channel, values[channel]);
    }
    endRow();
  }

  /** Appends the row at {@code position} of {@code page}, which must share this schema's width. */
  public void appendRow(Page page, int position) {
    beginRow();
    for (int channel = 0; channel < channelCount; channel++) {
      currentRow[channel] = page.getValue(position, channel);
    }
    endRow();
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rowCount;
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rowCount == 0;
  }

  /** Builds the final Page from all committed rows and resets the builder. */
  public Page build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    Page page;
    if (channelCount == 0) {
      page = new ColumnarPage(schema, rowCount);
    } else {
      Block[] blocks = new Block[channelCount];
      for (int channel = 0; channel < channelCount; channel++) {
        List<Object> column = columns.get(channel);
        blocks[channel] = new ArrayBlock(schema.getType(channel), column.toArray());
        column.clear();
      }
      page = new ColumnarPage(schema, blocks);
    }
    rowCount = 0;
    return page;
  }
}
