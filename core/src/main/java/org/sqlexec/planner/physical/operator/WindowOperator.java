/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.data.ValueUtils;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.aggregation.Accumulator;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.expression.window.WindowFrame;
import org.sqlexec.planner.physical.page.ArrayBlock;
import org.sqlexec.planner.physical.page.Block;
import org.sqlexec.planner.physical.page.ColumnarPage;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Evaluates window functions over input sorted by the partition keys and then the window order.
 * Buffers its whole input, then emits every input row in input order followed by one column per
 * window function, in pages of the batch size.
 */
@Log4j2
public class WindowOperator implements Operator {

  private final Schema inputSchema;
  private final Schema outputSchema;
  private final List<Expression> partitionKeys;
  private final List<SortKey> orderBy;
  private final List<WindowCall> windows;
  private final int batchSize;
  private final OperatorContext context;

  private final List<Page> buffered = new ArrayList<>();
  private final Deque<Page> outputs = new ArrayDeque<>();
  private long retainedBytes;
  private boolean inputFinished;

  /**
   * Creates a WindowOperator.
   *
   * @param inputSchema schema of the input pages
   * @param outputSchema input columns followed by one column per window function
   * @param partitionKeys expressions whose values delimit window partitions
   * @param orderBy the window order within a partition, defining peers and frames
   * @param windows the window functions
   * @param batchSize rows per output page
   * @param context operator context
   */
  public WindowOperator(
      Schema inputSchema,
      Schema outputSchema,
      List<? extends Expression> partitionKeys,
      List<SortKey> orderBy,
      List<WindowCall> windows,
      int batchSize,
      OperatorContext context) {
    this.inputSchema = inputSchema;
    this.outputSchema = outputSchema;
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    this.orderBy = ImmutableList.copyOf(orderBy);
    this.windows = ImmutableList.copyOf(windows);
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
    Page all = Page.concat(inputSchema, buffered);
    buffered.clear();
    int rows = all.getPositionCount();
    Object[][] results = new Object[windows.size()][rows];
    int partitions = 0;
    int partitionStart = 0;
    for (int position = 1; position <= rows; position++) {
      if (position == rows || !samePartition(all, position - 1, position)) {
        context.checkCancelled();
        WindowPartition partition = new WindowPartition(all, partitionStart, position, orderBy);
        for (int i = 0; i < windows.size(); i++) {
          evaluate(windows.get(i), all, partition, results[i]);
        }
        partitions++;
        partitionStart = position;
      }
    }

    Block[] blocks = new Block[outputSchema.size()];
    for (int channel = 0; channel < inputSchema.size(); channel++) {
      blocks[channel] = all.getBlock(channel);
    }
    for (int i = 0; i < windows.size(); i++) {
      int channel = inputSchema.size() + i;
      blocks[channel] = new ArrayBlock(outputSchema.getType(channel), results[i]);
    }
    Page output = new ColumnarPage(outputSchema, blocks);
    for (int offset = 0; offset < rows; offset += batchSize) {
      outputs.add(output.getRegion(offset, Math.min(batchSize, rows - offset)));
    }
    log.debug(
        "{} evaluated {} windows over {} rows in {} window partitions",
        context,
        windows.size(),
        rows,
        partitions);
    retainedBytes = 0;
  }

  private boolean samePartition(Page page, int left, int right) {
    for (Expression key : partitionKeys) {
      Object l = ValueUtils.normalize(key.valueOf(page, left));
      Object r = ValueUtils.normalize(key.valueOf(page, right));
      if (!Objects.equals(l, r)) {
        return false;
      }
    }
    return true;
  }

  private void evaluate(WindowCall window, Page page, WindowPartition partition, Object[] out) {
    int start = partition.getStart();
    int end = partition.getEnd();
    switch (window.getFunction()) {
      case ROW_NUMBER:
        for (int position = start; position < end; position++) {
          out[position] = (long) (position - start + 1);
        }
        return;
      case RANK:
        for (int position = start; position < end; position++) {
          out[position] = (long) (partition.peerStart(position) - start + 1);
        }
        return;
      case DENSE_RANK:
        for (int position = start; position < end; position++) {
          out[position] = (long) (partition.group(position) + 1);
        }
        return;
      default:
        aggregate(window, page, partition, out);
    }
  }

  /**
   * Folds each row's frame. Frames that always start at the partition start share one
   * accumulator that only ever takes rows in; other frames are folded afresh per row.
   */
  private void aggregate(WindowCall window, Page page, WindowPartition partition, Object[] out) {
    WindowFrame frame = window.getFrame();
    Accumulator running = null;
    int fed = partition.getStart();
    for (int position = partition.getStart(); position < partition.getEnd(); position++) {
      int frameStart = partition.frameStart(frame, position);
      int frameEnd = partition.frameEnd(frame, position);
      if (frame.isEverExpanding() && frameEnd >= fed) {
        if (running == null) {
          running = window.createAccumulator();
        }
        for (; fed < frameEnd; fed++) {
          running.update(argument(window, page, fed));
        }
        out[position] = running.evaluate();
        continue;
      }
      Accumulator accumulator = window.createAccumulator();
      for (int row = frameStart; row < frameEnd; row++) {
        accumulator.update(argument(window, page, row));
      }
      out[position] = accumulator.evaluate();
    }
  }

  private static Object argument(WindowCall window, Page page, int position) {
    return window.getArgument() == null
        ? Boolean.TRUE
        : window.getArgument().valueOf(page, position);
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
