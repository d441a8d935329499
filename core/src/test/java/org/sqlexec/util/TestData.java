/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.PageBuilder;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.plan.ScanExec;
import org.sqlexec.planner.physical.stream.PageStream;
import org.sqlexec.planner.physical.stream.PageStreams;
import org.sqlexec.storage.memory.InMemoryTable;

/** Builders and extractors shared by the tests. */
public final class TestData {

  private TestData() {}

  public static Object[] row(Object... values) {
    return values;
  }

  public static Page page(Schema schema, Object[]... rows) {
    PageBuilder builder = new PageBuilder(schema);
    for (Object[] row : rows) {
      builder.appendRow(row);
    }
    return builder.build();
  }

  /** Returns the rows of the pages as lists, in page order. */
  public static List<List<Object>> rows(List<Page> pages) {
    List<List<Object>> rows = new ArrayList<>();
    for (Page page : pages) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        Object[] row = new Object[page.getChannelCount()];
        for (int channel = 0; channel < row.length; channel++) {
          row[channel] = page.getValue(position, channel);
        }
        rows.add(Arrays.asList(row));
      }
    }
    return rows;
  }

  public static List<List<Object>> rows(Object[]... rows) {
    List<List<Object>> result = new ArrayList<>();
    for (Object[] row : rows) {
      result.add(Arrays.asList(row));
    }
    return result;
  }

  /** Drains the stream and returns its rows. */
  public static List<List<Object>> drainRows(PageStream stream) {
    return rows(PageStreams.drain(stream));
  }

  /** Sorts rows by their string form so that multisets can be compared with equals. */
  public static List<List<Object>> sorted(List<List<Object>> rows) {
    List<List<Object>> copy = new ArrayList<>(rows);
    copy.sort(Comparator.comparing(Object::toString));
    return copy;
  }

  /** Creates a table of {@code splits} splits with pages of at most 2 rows. */
  public static InMemoryTable table(String name, Schema schema, int splits, Object[]... rows) {
    return InMemoryTable.fromRows(name, schema, Arrays.asList(rows), splits, 2);
  }

  /** Scans every column of the table into at most {@code partitions} partitions. */
  public static ScanExec scan(InMemoryTable table, int partitions) {
    int[] projection = new int[table.getSchema().size()];
    for (int i = 0; i < projection.length; i++) {
      projection[i] = i;
    }
    return new ScanExec(
        table, projection, table.getSchema(), ScanExec.groupSplits(table.getSplits(), partitions));
  }

  /** Executes every output partition in turn and returns the rows of each. */
  public static List<List<List<Object>>> executePartitions(
      ExecutionPlan plan, TaskContext taskContext) {
    List<List<List<Object>>> partitions = new ArrayList<>();
    for (int p = 0; p < plan.getOutputPartitioning().getPartitionCount(); p++) {
      partitions.add(drainRows(plan.execute(p, taskContext)));
    }
    return partitions;
  }

  /** Executes every output partition and returns all rows, partition after partition. */
  public static List<List<Object>> executeAll(ExecutionPlan plan, TaskContext taskContext) {
    List<List<Object>> all = new ArrayList<>();
    executePartitions(plan, taskContext).forEach(all::addAll);
    return all;
  }

  public static ExecutionConfig config(int targetPartitions) {
    return ExecutionConfig.builder().targetPartitions(targetPartitions).build().validate();
  }

  /** Creates a task context on a fresh cached pool that the caller shuts down. */
  public static TaskContext taskContext(ExecutionConfig config, ExecutorService executor) {
    return new TaskContext("test-query", config, executor);
  }

  public static ExecutorService newExecutor() {
    return Executors.newCachedThreadPool();
  }
}
