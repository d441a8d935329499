/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.SinkOperator;
import org.sqlexec.planner.physical.page.Page;

/**
 * A sink operator that routes pages into an {@link OutputBuffer}. Adding input blocks while the
 * target output is full.
 */
public class ExchangeSinkOperator implements SinkOperator {

  private final OutputBuffer buffer;
  private final PartitionFunction partitionFunction;
  private final OperatorContext context;
  private boolean finished;

  public ExchangeSinkOperator(
      OutputBuffer buffer, PartitionFunction partitionFunction, OperatorContext context) {
    this.buffer = buffer;
    this.partitionFunction = partitionFunction;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return !finished;
  }

  @Override
  public void addInput(Page page) {
    partitionFunction.partition(page, (piece, target) -> buffer.enqueue(target, piece));
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public void finish() {
    finished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
