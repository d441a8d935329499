/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Buffers all input of a partition and emits it fully sorted in pages of the batch size. The sort
 * is stable. With a fetch only the first {@code fetch} rows are emitted.
 */
@Log4j2
public class SortOperator implements Operator {

  private final Schema schema;
  private final RowComparator comparator;
  private final long fetch;
  private final int batchSize;
  private final OperatorContext context;

  private final List<Page> buffered = new ArrayList<>();
  private final Deque<Page> outputs = new ArrayDeque<>();
  private long retainedBytes;
  private boolean inputFinished;

  /**
   * Creates a SortOperator.
   *
   * @param schema input and output schema
   * @param sortKeys the sort order
   * @param fetch rows to emit, {@link Long#MAX_VALUE} for all
   * @param batchSize rows per output page
   * @param context operator context
   */
  public SortOperator(
      Schema schema, List<SortKey> sortKeys, long fetch, int batchSize, OperatorContext context) {
    this.schema = schema;
    this.comparator = new RowComparator(sortKeys);
    this.fetch = fetch;
    this.batchSize = batchSize;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (inputFinished) {
      throw new IllegalStateException("Operator does not need input");
    }
    retainedBytes += page.getRetainedSizeBytes();
    context.checkMemory(retainedBytes);
    buffered.add(page);
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
    if (buffered.isEmpty()) {
      return;
    }
    Page all = Page.concat(schema, buffered);
    buffered.clear();
    Integer[] order = new Integer[all.getPositionCount()];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    // TimSort over boxed positions keeps equal rows in input order
    Arrays.sort(order, (a, b) -> comparator.compare(all, a, all, b));
    int rows = (int) Math.min(order.length, fetch);
    int[] positions = new int[rows];
    for (int i = 0; i < rows; i++) {
      positions[i] = order[i];
    }
    for (int offset = 0; offset < rows; offset += batchSize) {
      outputs.add(all.getPositions(positions, offset, Math.min(batchSize, rows - offset)));
    }
    log.debug("{} sorted {} rows, emitting {}", context, order.length, rows);
    retainedBytes = 0;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    buffered.clear();
    outputs.clear();
  }
}
