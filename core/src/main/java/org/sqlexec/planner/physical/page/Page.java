/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import java.util.List;

/**
 * A batch of rows flowing through the operator pipeline: a schema reference plus one equal-length
 * {@link Block} per column. Pages are immutable; a page handed to a consumer is owned by it.
 */
public interface Page {

  /** Returns the schema shared by all pages of the stream that produced this page. */
  Schema getSchema();

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns the columnar block for the given channel.
   *
   * @param channel the column index (0-based)
   * @return the block for the channel
   */
  Block getBlock(int channel);

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /**
   * Returns a page holding the rows at the given positions, in the given order.
   *
   * @param positions row indexes into this page
   * @param offset first entry of {@code positions} to use
   * @param length number of entries of {@code positions} to use
   */
  Page getPositions(int[] positions, int offset, int length);

  /** Returns the estimated memory retained by this page in bytes. */
  default long getRetainedSizeBytes() {
    long size = 0;
    for (int channel = 0; channel < getChannelCount(); channel++) {
      size += getBlock(channel).getRetainedSizeBytes();
    }
    return size;
  }

  /** Returns an empty page with zero rows and the given schema. */
  static Page empty(Schema schema) {
    Block[] blocks = new Block[schema.size()];
    for (int channel = 0; channel < blocks.length; channel++) {
      blocks[channel] = new ArrayBlock(schema.getType(channel), new Object[0]);
    }
    return new ColumnarPage(schema, blocks);
  }

  /** Concatenates pages sharing one schema into a single page, keeping row order. */
  static Page concat(Schema schema, List<Page> pages) {
    if (pages.size() == 1) {
      return pages.get(0);
    }
    int total = 0;
    for (Page page : pages) {
      total += page.getPositionCount();
    }
    if (schema.size() == 0) {
      return new ColumnarPage(schema, total);
    }
    Block[] blocks = new Block[schema.size()];
    for (int channel = 0; channel < blocks.length; channel++) {
      Object[] values = new Object[total];
      int offset = 0;
      for (Page page : pages) {
        Block block = page.getBlock(channel);
        for (int position = 0; position < block.getPositionCount(); position++) {
          values[offset++] = block.getValue(position);
        }
      }
      blocks[channel] = new ArrayBlock(schema.getType(channel), values);
    }
    return new ColumnarPage(schema, blocks);
  }
}
