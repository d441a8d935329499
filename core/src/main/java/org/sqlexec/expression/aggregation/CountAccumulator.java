/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

/** COUNT of non-null values; COUNT(*) is fed a non-null marker per row. */
class CountAccumulator implements Accumulator {

  private long count;

  @Override
  public void update(Object value) {
    if (value != null) {
      count++;
    }
  }

  @Override
  public Object[] state() {
    return new Object[] {count};
  }

  @Override
  public void merge(Object[] state) {
    count += (Long) state[0];
  }

  @Override
  public Object evaluate() {
    return count;
  }

  @Override
  public long getEstimatedSize() {
    return 16L;
  }
}
