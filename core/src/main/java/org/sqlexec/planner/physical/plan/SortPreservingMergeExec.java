/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.RowComparator;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.PageBuilder;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.AbstractPageStream;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Merges input partitions that are each sorted on the sort keys into one sorted partition. Rows
 * that compare equal are taken from the lower input partition first. The inputs are pulled on the
 * consuming thread, one page at a time from whichever input runs out of buffered rows.
 */
@Log4j2
public class SortPreservingMergeExec extends AbstractExecutionPlan {

  @Getter private final List<SortKey> sortKeys;
  @Getter private final Long fetch;

  public SortPreservingMergeExec(ExecutionPlan input, List<SortKey> sortKeys, Long fetch) {
    super(input.getSchema(), List.of(input));
    this.sortKeys = ImmutableList.copyOf(sortKeys);
    this.fetch = fetch;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SORT_PRESERVING_MERGE;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new SortPreservingMergeExec(children.get(0), sortKeys, fetch);
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return Partitioning.single();
  }

  @Override
  public List<SortKey> getOutputOrdering() {
    return sortKeys;
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    return child(0).getEquivalenceProperties();
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    int inputs = child(0).getOutputPartitioning().getPartitionCount();
    List<PageStream> streams = new ArrayList<>(inputs);
    for (int i = 0; i < inputs; i++) {
      streams.add(child(0).execute(i, taskContext));
    }
    return new MergeStream(taskContext, streams);
  }

  private class MergeStream extends AbstractPageStream {
    private final List<PageStream> inputs;
    private final Page[] heads;
    private final int[] positions;
    private final boolean[] exhausted;
    private final RowComparator comparator = new RowComparator(sortKeys);
    private final int batchSize;
    private long remaining;

    MergeStream(TaskContext taskContext, List<PageStream> inputs) {
      super(SortPreservingMergeExec.this.getSchema(), taskContext);
      this.inputs = inputs;
      this.heads = new Page[inputs.size()];
      this.positions = new int[inputs.size()];
      this.exhausted = new boolean[inputs.size()];
      this.batchSize = taskContext.getConfig().getBatchSize();
      this.remaining = fetch == null ? Long.MAX_VALUE : fetch;
    }

    /** Makes sure input i has a current row unless it is exhausted. */
    private void fill(int i) {
      while (!exhausted[i] && (heads[i] == null || positions[i] >= heads[i].getPositionCount())) {
        Page page = inputs.get(i).next();
        if (page == null) {
          exhausted[i] = true;
          heads[i] = null;
          inputs.get(i).close();
        } else {
          heads[i] = page;
          positions[i] = 0;
        }
      }
    }

    @Override
    protected Page computeNext() {
      PageBuilder builder = new PageBuilder(getSchema());
      while (remaining > 0 && builder.getRowCount() < batchSize) {
        int smallest = -1;
        for (int i = 0; i < inputs.size(); i++) {
          fill(i);
          if (exhausted[i]) {
            continue;
          }
          if (smallest < 0
              || comparator.compare(heads[i], positions[i], heads[smallest], positions[smallest])
                  < 0) {
            smallest = i;
          }
        }
        if (smallest < 0) {
          break;
        }
        builder.appendRow(heads[smallest], positions[smallest]++);
        remaining--;
      }
      if (builder.isEmpty()) {
        return null;
      }
      return builder.build();
    }

    @Override
    protected void doClose() {
      for (PageStream input : inputs) {
        try {
          input.close();
        } catch (RuntimeException e) {
          log.warn("Error closing merge input of {}", getOperatorType(), e);
        }
      }
    }
  }

  @Override
  public String describe() {
    return "SortPreservingMergeExec: ["
        + sortKeys.stream().map(Object::toString).collect(Collectors.joining(", "))
        + "]"
        + (fetch == null ? "" : ", fetch=" + fetch);
  }
}
