/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.planner.physical.page.Page;

/**
 * Operator that skips the first {@code skip} rows and passes at most {@code fetch} rows after
 * them. Truncates pages at both bounds and finishes as soon as the fetch is satisfied, without
 * waiting for the end of its input.
 */
public class LimitOperator implements Operator {

  private final long fetch;
  private final OperatorContext context;

  private long remainingSkip;
  private long accumulatedRows;
  private Page pendingOutput;
  private boolean inputFinished;

  /**
   * Creates a LimitOperator.
   *
   * @param skip rows to drop first
   * @param fetch rows to pass, {@link Long#MAX_VALUE} for no bound
   * @param context operator context
   */
  public LimitOperator(long skip, long fetch, OperatorContext context) {
    this.remainingSkip = skip;
    this.fetch = fetch;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && accumulatedRows < fetch && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (page == null || accumulatedRows >= fetch) {
      return;
    }
    int offset = 0;
    int pageRows = page.getPositionCount();
    if (remainingSkip > 0) {
      int skipped = (int) Math.min(remainingSkip, pageRows);
      remainingSkip -= skipped;
      offset = skipped;
    }
    int available = pageRows - offset;
    if (available == 0) {
      return;
    }
    int rows = (int) Math.min(available, fetch - accumulatedRows);
    accumulatedRows += rows;
    pendingOutput = offset == 0 && rows == pageRows ? page : page.getRegion(offset, rows);
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return pendingOutput == null && (accumulatedRows >= fetch || inputFinished);
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
