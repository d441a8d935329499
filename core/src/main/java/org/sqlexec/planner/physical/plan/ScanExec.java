/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.TableScanOperator;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.pipeline.PipelineDriver;
import org.sqlexec.planner.physical.stream.PageStream;
import org.sqlexec.storage.Split;
import org.sqlexec.storage.Table;

/** Reads a table. Every output partition reads its own group of splits. */
public class ScanExec extends AbstractExecutionPlan {

  @Getter private final Table table;
  private final int[] projection;
  @Getter private final List<List<Split>> splitGroups;

  public ScanExec(Table table, int[] projection, Schema schema, List<List<Split>> splitGroups) {
    super(schema, List.of());
    this.table = table;
    this.projection = projection.clone();
    this.splitGroups = ImmutableList.copyOf(splitGroups);
  }

  /**
   * Spreads splits over at most {@code maxPartitions} groups, balancing estimated rows: splits
   * are taken largest first and each goes to the lightest group. Each group keeps split id order.
   * Always returns at least one (possibly empty) group.
   */
  public static List<List<Split>> groupSplits(List<Split> splits, int maxPartitions) {
    int groups = Math.max(1, Math.min(maxPartitions, splits.size()));
    List<List<Split>> result = new ArrayList<>(groups);
    long[] load = new long[groups];
    for (int i = 0; i < groups; i++) {
      result.add(new ArrayList<>());
    }
    List<Split> ordered = new ArrayList<>(splits);
    ordered.sort(
        Comparator.comparingLong(Split::getEstimatedRows)
            .reversed()
            .thenComparingInt(Split::getSplitId));
    for (Split split : ordered) {
      int lightest = 0;
      for (int i = 1; i < groups; i++) {
        if (load[i] < load[lightest]) {
          lightest = i;
        }
      }
      result.get(lightest).add(split);
      load[lightest] += Math.max(1, split.getEstimatedRows());
    }
    result.forEach(group -> group.sort(Comparator.comparingInt(Split::getSplitId)));
    return result;
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SCAN;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return this;
  }

  @Override
  public Partitioning getOutputPartitioning() {
    return Partitioning.unknown(splitGroups.size());
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    OperatorContext context = operatorContext(partition, taskContext);
    TableScanOperator scan = new TableScanOperator(table, projection, getSchema(), context);
    splitGroups.get(partition).forEach(scan::addSplit);
    scan.noMoreSplits();
    return new PipelineDriver(taskContext, scan, List.of()).asStream(getSchema());
  }

  @Override
  public String describe() {
    return String.format(
        "ScanExec: table=%s, partitions=%d, projection=%s",
        table.getName(), splitGroups.size(), getSchema().getFieldNames());
  }
}
