/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Page;

/** Keeps the rows for which the predicate is TRUE; NULL and FALSE drop the row. */
public class FilterOperator implements Operator {

  private final Expression predicate;
  private final OperatorContext context;

  private Page pendingOutput;
  private boolean inputFinished;

  public FilterOperator(Expression predicate, OperatorContext context) {
    this.predicate = predicate;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (!needsInput()) {
      throw new IllegalStateException("Operator does not need input");
    }
    int[] selected = new int[page.getPositionCount()];
    int count = 0;
    for (int position = 0; position < page.getPositionCount(); position++) {
      Object result = predicate.valueOf(page, position);
      if (Boolean.TRUE.equals(result)) {
        selected[count++] = position;
      } else if (result != null && !(result instanceof Boolean)) {
        throw new UpstreamDataException(
            "Filter predicate " + predicate + " returned a non-boolean value: " + result);
      }
    }
    if (count == page.getPositionCount()) {
      pendingOutput = page;
    } else if (count > 0) {
      pendingOutput = page.getPositions(selected, 0, count);
    }
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return inputFinished && pendingOutput == null;
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
