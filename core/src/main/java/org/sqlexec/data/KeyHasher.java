/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.data;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Page;

/**
 * The one hash function used for key columns everywhere: hash repartitioning, partial and final
 * aggregation, join build and probe. Values are normalized with {@link ValueUtils#normalize}
 * before hashing so INT and LONG keys with the same value hash alike. Rows with equal keys must
 * always hash equally or co-partitioned operators silently lose matches.
 */
public final class KeyHasher {

  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed(0x5eed);

  private KeyHasher() {}

  /** Hashes the key formed by evaluating {@code keys} on the given row. */
  public static int hashRow(List<Expression> keys, Page page, int position) {
    Hasher hasher = HASH_FUNCTION.newHasher();
    for (Expression key : keys) {
      putValue(hasher, ValueUtils.normalize(key.valueOf(page, position)));
    }
    return hasher.hash().asInt();
  }

  /** Returns the output partition for a hash: non-negative {@code hash mod partitionCount}. */
  public static int partition(int hash, int partitionCount) {
    return Math.floorMod(hash, partitionCount);
  }

  /**
   * Evaluates and normalizes the key of a row. Returns null when any key column is null, since
   * such keys never match in a join.
   */
  public static List<Object> extractJoinKey(List<Expression> keys, Page page, int position) {
    List<Object> key = new ArrayList<>(keys.size());
    for (Expression expression : keys) {
      Object value = expression.valueOf(page, position);
      if (value == null) {
        return null;
      }
      key.add(ValueUtils.normalize(value));
    }
    return key;
  }

  /** Evaluates and normalizes a grouping key. Null values form their own group. */
  public static List<Object> extractGroupKey(List<Expression> keys, Page page, int position) {
    List<Object> key = new ArrayList<>(keys.size());
    for (Expression expression : keys) {
      key.add(ValueUtils.normalize(expression.valueOf(page, position)));
    }
    return key;
  }

  private static void putValue(Hasher hasher, Object value) {
    if (value == null) {
      hasher.putByte((byte) 0);
    } else if (value instanceof Long) {
      hasher.putByte((byte) 1).putLong((Long) value);
    } else if (value instanceof Double) {
      hasher.putByte((byte) 2).putDouble((Double) value);
    } else if (value instanceof String) {
      hasher.putByte((byte) 3).putString((String) value, StandardCharsets.UTF_8);
    } else if (value instanceof Boolean) {
      hasher.putByte((byte) 4).putBoolean((Boolean) value);
    } else if (value instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) value;
      hasher
          .putByte((byte) 5)
          .putInt(decimal.scale())
          .putBytes(decimal.unscaledValue().toByteArray());
    } else if (value instanceof LocalDate) {
      hasher.putByte((byte) 6).putLong(((LocalDate) value).toEpochDay());
    } else if (value instanceof Instant) {
      Instant instant = (Instant) value;
      hasher.putByte((byte) 7).putLong(instant.getEpochSecond()).putInt(instant.getNano());
    } else if (value instanceof ByteBuffer) {
      hasher.putByte((byte) 8).putBytes(((ByteBuffer) value).duplicate());
    } else {
      hasher.putByte((byte) 9).putInt(value.hashCode());
    }
  }
}
