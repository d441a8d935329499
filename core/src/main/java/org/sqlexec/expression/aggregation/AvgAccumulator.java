/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

import java.math.BigDecimal;
import java.math.MathContext;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.planner.physical.page.Block.BlockType;

/** AVG carried as (sum, count) between phases and divided only in {@link #evaluate()}. */
class AvgAccumulator implements Accumulator {

  private final BlockType resultType;
  private double doubleSum;
  private BigDecimal decimalSum = BigDecimal.ZERO;
  private long count;

  AvgAccumulator(BlockType resultType) {
    this.resultType = resultType;
  }

  @Override
  public void update(Object value) {
    if (value != null) {
      add((Number) value, 1L);
    }
  }

  @Override
  public Object[] state() {
    if (count == 0) {
      return new Object[] {null, 0L};
    }
    return new Object[] {resultType == BlockType.DECIMAL ? decimalSum : doubleSum, count};
  }

  @Override
  public void merge(Object[] state) {
    if (state[0] != null) {
      add((Number) state[0], (Long) state[1]);
    }
  }

  @Override
  public Object evaluate() {
    if (count == 0) {
      return null;
    }
    if (resultType == BlockType.DECIMAL) {
      return decimalSum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
    }
    return doubleSum / count;
  }

  private void add(Number sum, long rows) {
    if (resultType == BlockType.DECIMAL) {
      decimalSum = decimalSum.add(ValueUtils.toBigDecimal(sum));
    } else {
      doubleSum += sum.doubleValue();
    }
    count += rows;
  }
}
