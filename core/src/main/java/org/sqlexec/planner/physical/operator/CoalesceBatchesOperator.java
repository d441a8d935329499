/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Re-chunks small pages into pages of exactly {@code targetRows} rows, keeping row order. The last
 * page of the input may be shorter.
 */
public class CoalesceBatchesOperator implements Operator {

  private final Schema schema;
  private final int targetRows;
  private final OperatorContext context;

  private final List<Page> buffered = new ArrayList<>();
  private final Deque<Page> outputs = new ArrayDeque<>();
  private int bufferedRows;
  private boolean inputFinished;

  public CoalesceBatchesOperator(Schema schema, int targetRows, OperatorContext context) {
    if (targetRows <= 0) {
      throw new IllegalArgumentException("Target batch size must be positive: " + targetRows);
    }
    this.schema = schema;
    this.targetRows = targetRows;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return outputs.isEmpty() && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (!needsInput()) {
      throw new IllegalStateException("Operator does not need input");
    }
    if (bufferedRows == 0 && page.getPositionCount() == targetRows) {
      outputs.add(page);
      return;
    }
    buffered.add(page);
    bufferedRows += page.getPositionCount();
    if (bufferedRows >= targetRows) {
      Page combined = Page.concat(schema, buffered);
      buffered.clear();
      int offset = 0;
      while (combined.getPositionCount() - offset >= targetRows) {
        outputs.add(combined.getRegion(offset, targetRows));
        offset += targetRows;
      }
      bufferedRows = combined.getPositionCount() - offset;
      if (bufferedRows > 0) {
        buffered.add(combined.getRegion(offset, bufferedRows));
      }
    }
  }

  @Override
  public Page getOutput() {
    return outputs.poll();
  }

  @Override
  public boolean isFinished() {
    return inputFinished && outputs.isEmpty();
  }

  @Override
  public void finish() {
    if (inputFinished) {
      return;
    }
    inputFinished = true;
    if (bufferedRows > 0) {
      outputs.add(Page.concat(schema, buffered));
      buffered.clear();
      bufferedRows = 0;
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
