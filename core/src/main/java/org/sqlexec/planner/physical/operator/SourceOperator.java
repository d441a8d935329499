/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.planner.physical.page.Page;

/** Head of an operator chain: reads table splits or another plan node's stream. */
public interface SourceOperator extends Operator {

  @Override
  default boolean needsInput() {
    return false;
  }

  @Override
  default void addInput(Page page) {
    throw new UnsupportedOperationException(
        getClass().getSimpleName() + " is a source and takes no input");
  }

  /** A source ends when its data runs out, so there is nothing to flush. */
  @Override
  default void finish() {}
}
