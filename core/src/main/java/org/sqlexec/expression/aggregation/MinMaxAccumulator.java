/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

import org.sqlexec.data.ValueUtils;

/** MIN or MAX over comparable values. */
class MinMaxAccumulator implements Accumulator {

  private final boolean max;
  private Object current;

  MinMaxAccumulator(boolean max) {
    this.max = max;
  }

  @Override
  public void update(Object value) {
    if (value == null) {
      return;
    }
    if (current == null) {
      current = value;
      return;
    }
    int comparison = ValueUtils.compare(value, current);
    if (max ? comparison > 0 : comparison < 0) {
      current = value;
    }
  }

  @Override
  public Object[] state() {
    return new Object[] {current};
  }

  @Override
  public void merge(Object[] state) {
    update(state[0]);
  }

  @Override
  public Object evaluate() {
    return current;
  }
}
