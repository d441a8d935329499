/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

/** {@link Page} implementation holding one {@link Block} per schema field. */
public class ColumnarPage implements Page {

  private final Schema schema;
  private final Block[] blocks;
  private final int positionCount;

  /**
   * Creates a page from pre-built blocks.
   *
   * @param schema the schema describing the blocks
   * @param blocks one block per schema field, all with the same position count
   */
  public ColumnarPage(Schema schema, Block[] blocks) {
    if (blocks.length != schema.size()) {
      throw new IllegalArgumentException(
          "Schema has " + schema.size() + " fields but " + blocks.length + " blocks were given");
    }
    int count = blocks.length == 0 ? 0 : blocks[0].getPositionCount();
    for (Block block : blocks) {
      if (block.getPositionCount() != count) {
        throw new IllegalArgumentException(
            "Blocks must have equal position counts: "
                + block.getPositionCount()
                + " != "
                + count);
      }
    }
    this.schema = schema;
    this.blocks = blocks;
    this.positionCount = count;
  }

  /** Creates a page without columns that still carries a row count (e.g. COUNT(*) input). */
  public ColumnarPage(Schema schema, int positionCount) {
    if (schema.size() != 0) {
      throw new IllegalArgumentException("Column-less pages need an empty schema");
    }
    this.schema = schema;
    this.blocks = new Block[0];
    this.positionCount = positionCount;
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public int getPositionCount() {
    return positionCount;
  }

  @Override
  public int getChannelCount() {
    return blocks.length;
  }

  @Override
  public Object getValue(int position, int channel) {
    return getBlock(channel).getValue(position);
  }

  @Override
  public Block getBlock(int channel) {
    if (channel < 0 || channel >= blocks.length) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + blocks.length + ")");
    }
    return blocks[channel];
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > positionCount) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + positionCount
              + ")");
    }
    if (blocks.length == 0) {
      return new ColumnarPage(schema, length);
    }
    Block[] region = new Block[blocks.length];
    for (int channel = 0; channel < blocks.length; channel++) {
      region[channel] = blocks[channel].getRegion(positionOffset, length);
    }
    return new ColumnarPage(schema, region);
  }

  @Override
  public Page getPositions(int[] positions, int offset, int length) {
    if (blocks.length == 0) {
      return new ColumnarPage(schema, length);
    }
    Block[] selected = new Block[blocks.length];
    for (int channel = 0; channel < blocks.length; channel++) {
      selected[channel] = blocks[channel].getPositions(positions, offset, length);
    }
    return new ColumnarPage(schema, selected);
  }

  @Override
  public String toString() {
    return "ColumnarPage{rows=" + positionCount + ", schema=" + schema + '}';
  }
}
