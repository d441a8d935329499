/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import java.math.BigDecimal;
import java.util.Arrays;

/** {@link Block} backed by an object array. The array is owned by the block and never exposed. */
public class ArrayBlock implements Block {

  private final BlockType type;
  private final Object[] values;

  /**
   * Creates a block over the given values. The caller hands the array over and must not modify it
   * afterwards.
   */
  public ArrayBlock(BlockType type, Object[] values) {
    this.type = type;
    this.values = values;
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    checkPosition(position);
    return values[position];
  }

  @Override
  public boolean isNull(int position) {
    return getValue(position) == null;
  }

  @Override
  public long getRetainedSizeBytes() {
    long size = 16L + 8L * values.length;
    if (type == BlockType.STRING || type == BlockType.DECIMAL || type == BlockType.BYTES) {
      for (Object value : values) {
        size += estimateVariableWidth(value);
      }
    } else {
      size += 16L * values.length;
    }
    return size;
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > values.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + values.length
              + ")");
    }
    return new ArrayBlock(
        type, Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public Block getPositions(int[] positions, int offset, int length) {
    Object[] selected = new Object[length];
    for (int i = 0; i < length; i++) {
      selected[i] = getValue(positions[offset + i]);
    }
    return new ArrayBlock(type, selected);
  }

  @Override
  public BlockType getType() {
    return type;
  }

  private void checkPosition(int position) {
    if (position < 0 || position >= values.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + values.length + ")");
    }
  }

  private static long estimateVariableWidth(Object value) {
    if (value instanceof String) {
      return 40L + 2L * ((String) value).length();
    }
    if (value instanceof BigDecimal) {
      return 48L + ((BigDecimal) value).unscaledValue().bitLength() / 8;
    }
    if (value instanceof byte[]) {
      return 16L + ((byte[]) value).length;
    }
    return 0L;
  }
}
