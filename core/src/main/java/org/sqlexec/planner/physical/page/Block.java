/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A column of data within a {@link Page}. Each Block holds values for a single column across all
 * rows in the page and is immutable once built.
 */
public interface Block {

  /** Returns the number of values (rows) in this block. */
  int getPositionCount();

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the value, or null if the position is null
   */
  Object getValue(int position);

  /**
   * Returns true if the value at the given position is null.
   *
   * @param position the row index (0-based)
   * @return true if null
   */
  boolean isNull(int position);

  /** Returns the estimated memory retained by this block in bytes. */
  long getRetainedSizeBytes();

  /**
   * Returns a sub-region of this block.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Block representing the sub-region
   */
  Block getRegion(int positionOffset, int length);

  /**
   * Returns a block holding the values at the given positions, in the given order.
   *
   * @param positions row indexes into this block
   * @param offset first entry of {@code positions} to use
   * @param length number of entries of {@code positions} to use
   */
  Block getPositions(int[] positions, int offset, int length);

  /** Returns the data type of this block's values. */
  BlockType getType();

  /** Supported block data types and the Java class carrying each of them. */
  enum BlockType {
    BOOLEAN(Boolean.class),
    INT(Integer.class),
    LONG(Long.class),
    FLOAT(Float.class),
    DOUBLE(Double.class),
    DECIMAL(BigDecimal.class),
    STRING(String.class),
    BYTES(byte[].class),
    TIMESTAMP(Instant.class),
    DATE(LocalDate.class),
    NULL(Void.class),
    UNKNOWN(Object.class);

    private final Class<?> javaType;

    BlockType(Class<?> javaType) {
      this.javaType = javaType;
    }

    /** Returns true if a non-null value may be stored in a block of this type. */
    public boolean accepts(Object value) {
      if (value == null || this == UNKNOWN) {
        return true;
      }
      return javaType.isInstance(value);
    }

    public boolean isNumeric() {
      return this == INT || this == LONG || this == FLOAT || this == DOUBLE || this == DECIMAL;
    }

    public boolean isIntegral() {
      return this == INT || this == LONG;
    }

    public boolean isFloatingPoint() {
      return this == FLOAT || this == DOUBLE;
    }

    /** Returns the type used to compare and hash values of this type against others. */
    public BlockType widen() {
      switch (this) {
        case INT:
          return LONG;
        case FLOAT:
          return DOUBLE;
        default:
          return this;
      }
    }
  }
}
