/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.data;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Value semantics shared by every operator: comparison across numeric classes and the key
 * normalization used for grouping, joining and hash partitioning.
 */
public final class ValueUtils {

  private ValueUtils() {}

  /**
   * Normalizes a key value for consistent hash/equals behavior. Converts all integer numeric types
   * to Long, Float to Double and strips trailing zeros from decimals so that 1.0 and 1.00 compare
   * equal.
   */
  public static Object normalize(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float || value instanceof Double) {
      double d = ((Number) value).doubleValue();
      return d == 0.0 ? 0.0 : d;
    }
    if (value instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) value;
      return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    }
    if (value instanceof byte[]) {
      return ByteBuffer.wrap((byte[]) value).asReadOnlyBuffer();
    }
    return value;
  }

  /**
   * Compares two non-null values. Numbers of different classes compare by numeric value; other
   * values must be mutually comparable.
   *
   * @throws IllegalArgumentException if the values cannot be compared
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      return compareNumbers((Number) left, (Number) right);
    }
    if (left instanceof byte[] && right instanceof byte[]) {
      return Arrays.compareUnsigned((byte[]) left, (byte[]) right);
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable) left).compareTo(right);
    }
    throw new IllegalArgumentException(
        "Cannot compare "
            + left.getClass().getSimpleName()
            + " with "
            + right.getClass().getSimpleName());
  }

  private static int compareNumbers(Number left, Number right) {
    if (left instanceof BigDecimal || right instanceof BigDecimal) {
      return toBigDecimal(left).compareTo(toBigDecimal(right));
    }
    if (isFloatingPoint(left) || isFloatingPoint(right)) {
      return Double.compare(left.doubleValue(), right.doubleValue());
    }
    return Long.compare(left.longValue(), right.longValue());
  }

  public static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (isFloatingPoint(number)) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }

  private static boolean isFloatingPoint(Number number) {
    return number instanceof Double || number instanceof Float;
  }
}
