/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sqlexec.util.TestData.config;
import static org.sqlexec.util.TestData.executeAll;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.rows;
import static org.sqlexec.util.TestData.scan;
import static org.sqlexec.util.TestData.table;

import java.util.List;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.storage.memory.InMemoryTable;
import org.sqlexec.util.TestData;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortPreservingMergeExecTest {

  private static final Schema SCHEMA =
      Schema.of(Field.of("k", BlockType.LONG), Field.of("tag", BlockType.STRING));

  private static final List<SortKey> BY_K_DESC = List.of(SortKey.desc("k", 0));

  private final InMemoryTable table =
      table(
          "t",
          SCHEMA,
          3,
          row(4L, "d"),
          row(9L, "i"),
          row(null, "n"),
          row(1L, "a"),
          row(7L, "g"),
          row(3L, "c"),
          row(8L, "h"),
          row(2L, "b"));

  private ExecutorService executor;
  private TaskContext taskContext;

  @BeforeEach
  void setUp() {
    executor = TestData.newExecutor();
    taskContext = TestData.taskContext(config(3), executor);
  }

  @AfterEach
  void tearDown() {
    taskContext.close();
    executor.shutdownNow();
  }

  @Test
  void should_merge_sorted_partitions_into_global_order() {
    // Given: each of 3 partitions sorted on its own
    SortExec localSort = new SortExec(scan(table, 3), BY_K_DESC, null, true);
    SortPreservingMergeExec merge = new SortPreservingMergeExec(localSort, BY_K_DESC, null);

    // When
    List<List<Object>> result = executeAll(merge, taskContext);

    // Then
    assertEquals(1, merge.getOutputPartitioning().getPartitionCount());
    assertEquals(
        rows(
            row(null, "n"),
            row(9L, "i"),
            row(8L, "h"),
            row(7L, "g"),
            row(4L, "d"),
            row(3L, "c"),
            row(2L, "b"),
            row(1L, "a")),
        result);
  }

  @Test
  void should_stop_after_fetch_rows() {
    SortExec localSort = new SortExec(scan(table, 3), BY_K_DESC, 2L, true);
    SortPreservingMergeExec merge = new SortPreservingMergeExec(localSort, BY_K_DESC, 2L);

    List<List<Object>> result = executeAll(merge, taskContext);

    assertEquals(rows(row(null, "n"), row(9L, "i")), result);
    assertEquals("SortPreservingMergeExec: [k@0 DESC NULLS FIRST], fetch=2", merge.describe());
  }
}
