/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import java.util.ArrayDeque;
import java.util.Deque;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.planner.physical.page.Block;
import org.sqlexec.planner.physical.page.ColumnarPage;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.storage.PageSource;
import org.sqlexec.storage.Split;
import org.sqlexec.storage.Table;

/**
 * Reads the splits assigned to one scan partition in order, validates every page against the table
 * schema and keeps the projected columns.
 */
@Log4j2
public class TableScanOperator implements SourceOperator {

  private final Table table;
  private final int[] projection;
  private final Schema outputSchema;
  private final OperatorContext context;
  private final Deque<Split> splits = new ArrayDeque<>();

  private boolean noMoreSplits;
  private PageSource currentSource;
  private boolean finished;

  /**
   * Creates a scan.
   *
   * @param table the table to read
   * @param projection table column indexes to output, in output order
   * @param outputSchema the schema of the projected columns
   * @param context operator context
   */
  public TableScanOperator(
      Table table, int[] projection, Schema outputSchema, OperatorContext context) {
    this.table = table;
    this.projection = projection;
    this.outputSchema = outputSchema;
    this.context = context;
  }

  /** Assigns a split to read. Splits are read in assignment order. */
  public void addSplit(Split split) {
    if (noMoreSplits) {
      throw new IllegalStateException("No more splits expected");
    }
    splits.add(split);
  }

  /** Signals that no more splits will be assigned. */
  public void noMoreSplits() {
    noMoreSplits = true;
  }

  @Override
  public Page getOutput() {
    while (!finished) {
      if (currentSource == null) {
        Split split = splits.poll();
        if (split == null) {
          finished = noMoreSplits;
          return null;
        }
        log.debug("{} reading {}", context, split);
        currentSource = table.createPageSource(split);
      }
      Page page = currentSource.getNextPage();
      if (page == null) {
        closeCurrentSource();
      } else if (page.getPositionCount() > 0) {
        return project(validate(page));
      }
    }
    return null;
  }

  private Page validate(Page page) {
    Schema expected = table.getSchema();
    if (page.getChannelCount() != expected.size()) {
      throw new UpstreamDataException(
          String.format(
              "Table %s returned a page with %d columns, expected %d",
              table.getName(), page.getChannelCount(), expected.size()));
    }
    for (int channel = 0; channel < expected.size(); channel++) {
      Block block = page.getBlock(channel);
      Block.BlockType type = expected.getType(channel);
      if (block.getPositionCount() != page.getPositionCount()) {
        throw new UpstreamDataException(
            "Table " + table.getName() + " returned a page with ragged columns");
      }
      for (int position = 0; position < block.getPositionCount(); position++) {
        Object value = block.getValue(position);
        if (!type.accepts(value)) {
          throw new UpstreamDataException(
              String.format(
                  "Table %s column %s holds %s, expected %s",
                  table.getName(),
                  expected.getField(channel).getName(),
                  value.getClass().getSimpleName(),
                  type));
        }
      }
    }
    return page;
  }

  private Page project(Page page) {
    if (outputSchema.size() == 0) {
      return new ColumnarPage(outputSchema, page.getPositionCount());
    }
    Block[] blocks = new Block[projection.length];
    for (int i = 0; i < projection.length; i++) {
      blocks[i] = page.getBlock(projection[i]);
    }
    return new ColumnarPage(outputSchema, blocks);
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    splits.clear();
    finished = true;
    closeCurrentSource();
  }

  private void closeCurrentSource() {
    if (currentSource != null) {
      PageSource source = currentSource;
      currentSource = null;
      source.close();
    }
  }
}
