/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.planner.physical.page.ArrayBlock;
import org.sqlexec.planner.physical.page.Block;
import org.sqlexec.planner.physical.page.ColumnarPage;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Operator that evaluates a list of named expressions over every input row. Plain column
 * references reuse the input block; computed columns are evaluated row by row.
 */
@Log4j2
public class ProjectionOperator implements Operator {

  private final List<NamedExpression> projections;
  private final Schema outputSchema;
  private final OperatorContext context;

  private Page pendingOutput;
  private boolean inputFinished;

  /**
   * Creates a ProjectionOperator.
   *
   * @param projections the expressions to evaluate, in output order
   * @param outputSchema the schema of the produced pages
   * @param context operator context
   */
  public ProjectionOperator(
      List<NamedExpression> projections, Schema outputSchema, OperatorContext context) {
    this.projections = ImmutableList.copyOf(projections);
    this.outputSchema = outputSchema;
    this.context = context;

    log.debug("Created ProjectionOperator {}: projections={}", context, projections);
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (pendingOutput != null) {
      throw new IllegalStateException("Cannot add input when output is pending");
    }
    pendingOutput = projectPage(page);
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

  private Page projectPage(Page inputPage) {
    int positionCount = inputPage.getPositionCount();
    if (projections.isEmpty()) {
      return new ColumnarPage(outputSchema, positionCount);
    }
    Block[] blocks = new Block[projections.size()];
    for (int channel = 0; channel < blocks.length; channel++) {
      NamedExpression projection = projections.get(channel);
      if (projection.getDelegated() instanceof ReferenceExpression) {
        blocks[channel] =
            inputPage.getBlock(((ReferenceExpression) projection.getDelegated()).getIndex());
        continue;
      }
      Object[] values = new Object[positionCount];
      for (int position = 0; position < positionCount; position++) {
        values[position] = projection.valueOf(inputPage, position);
      }
      blocks[channel] = new ArrayBlock(outputSchema.getType(channel), values);
    }
    return new ColumnarPage(outputSchema, blocks);
  }
}
