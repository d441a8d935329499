/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

import java.math.BigDecimal;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.planner.physical.page.Block.BlockType;

/** SUM in LONG, DOUBLE or DECIMAL. The sum of no non-null values is null. */
class SumAccumulator implements Accumulator {

  private final BlockType sumType;
  private Object sum;

  SumAccumulator(BlockType sumType) {
    this.sumType = sumType;
  }

  @Override
  public void update(Object value) {
    if (value != null) {
      add((Number) value);
    }
  }

  @Override
  public Object[] state() {
    return new Object[] {sum};
  }

  @Override
  public void merge(Object[] state) {
    if (state[0] != null) {
      add((Number) state[0]);
    }
  }

  @Override
  public Object evaluate() {
    return sum;
  }

  private void add(Number value) {
    switch (sumType) {
      case LONG:
        long current = sum == null ? 0L : (Long) sum;
        try {
          sum = Math.addExact(current, value.longValue());
        } catch (ArithmeticException e) {
          throw new UpstreamDataException("SUM overflowed the LONG range", e);
        }
        break;
      case DOUBLE:
        sum = (sum == null ? 0.0 : (Double) sum) + value.doubleValue();
        break;
      default:
        BigDecimal decimal = ValueUtils.toBigDecimal(value);
        sum = sum == null ? decimal : ((BigDecimal) sum).add(decimal);
    }
  }
}
