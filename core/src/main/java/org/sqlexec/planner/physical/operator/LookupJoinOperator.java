/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.sqlexec.data.KeyHasher;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.join.JoinType;
import org.sqlexec.planner.physical.join.LookupSource;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.PageBuilder;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Probes a {@link LookupSource} with the rows of the probe side. Output rows hold the build
 * columns followed by the probe columns, or the build columns only for semi and anti joins. Build
 * rows that depend on the match outcome (outer, semi, anti) are emitted once the probe input ends.
 *
 * <p>NULL keys never match: a probe row with a null key only appears as unmatched probe row, a
 * build row with a null key only as unmatched build row.
 */
public class LookupJoinOperator implements Operator {

  private final JoinType joinType;
  private final LookupSource lookupSource;
  private final List<Expression> probeKeys;
  private final int buildChannels;
  private final int probeChannels;
  private final int batchSize;
  private final OperatorContext context;
  private final PageBuilder builder;
  private final Deque<Page> outputs = new ArrayDeque<>();
  private boolean inputFinished;

  /**
   * Creates a LookupJoinOperator.
   *
   * @param joinType join type
   * @param lookupSource built table of the left input
   * @param probeKeys key expressions over the probe (right) input
   * @param probeSchema schema of the probe input
   * @param outputSchema schema of the produced pages
   * @param batchSize maximum rows per output page
   * @param context operator context
   */
  public LookupJoinOperator(
      JoinType joinType,
      LookupSource lookupSource,
      List<Expression> probeKeys,
      Schema probeSchema,
      Schema outputSchema,
      int batchSize,
      OperatorContext context) {
    this.joinType = joinType;
    this.lookupSource = lookupSource;
    this.probeKeys = ImmutableList.copyOf(probeKeys);
    this.buildChannels = lookupSource.getBuildPage().getChannelCount();
    this.probeChannels = probeSchema.size();
    this.batchSize = batchSize;
    this.context = context;
    this.builder = new PageBuilder(outputSchema);
  }

  @Override
  public boolean needsInput() {
    return outputs.isEmpty() && !inputFinished;
  }

  @Override
  public void addInput(Page probe) {
    if (!needsInput()) {
      throw new IllegalStateException("Operator does not need input");
    }
    Page build = lookupSource.getBuildPage();
    for (int position = 0; position < probe.getPositionCount(); position++) {
      List<Object> key = KeyHasher.extractJoinKey(probeKeys, probe, position);
      int buildPosition = key == null ? -1 : lookupSource.getFirstPosition(key);
      if (buildPosition < 0) {
        if (joinType.emitsUnmatchedProbe()) {
          appendRow(null, -1, probe, position);
        }
        continue;
      }
      for (; buildPosition >= 0; buildPosition = lookupSource.getNextPosition(buildPosition)) {
        if (joinType.tracksBuildMatches()) {
          lookupSource.markMatched(buildPosition);
        }
        if (joinType.outputsProbeColumns()) {
          appendRow(build, buildPosition, probe, position);
        }
      }
    }
    flush();
  }

  private void appendRow(Page build, int buildPosition, Page probe, int probePosition) {
    builder.beginRow();
    int channel = 0;
    for (int i = 0; i < buildChannels; i++, channel++) {
      builder.setValue(channel, build == null ? null : build.getValue(buildPosition, i));
    }
    if (joinType.outputsProbeColumns()) {
      for (int i = 0; i < probeChannels; i++, channel++) {
        builder.setValue(channel, probe == null ? null : probe.getValue(probePosition, i));
      }
    }
    builder.endRow();
    if (builder.getRowCount() >= batchSize) {
      outputs.add(builder.build());
    }
  }

  private void flush() {
    if (!builder.isEmpty()) {
      outputs.add(builder.build());
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
    if (!joinType.tracksBuildMatches()) {
      return;
    }
    Page build = lookupSource.getBuildPage();
    for (int position = 0; position < lookupSource.getPositionCount(); position++) {
      boolean matched = lookupSource.isMatched(position);
      if (joinType == JoinType.SEMI ? matched : !matched) {
        appendRow(build, position, null, -1);
      }
    }
    flush();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
