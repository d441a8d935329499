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
import static org.sqlexec.util.TestData.sorted;
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
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.storage.memory.InMemoryTable;
import org.sqlexec.util.TestData;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CoalescePartitionsExecTest {

  private static final Schema SCHEMA = Schema.of(Field.of("v", BlockType.LONG));

  private static final Object[][] ROWS = {
    row(5L), row(3L), row(8L), row(1L), row(9L), row(2L), row(7L)
  };

  private final InMemoryTable numbers = table("numbers", SCHEMA, 4, ROWS);

  private ExecutorService executor;
  private TaskContext taskContext;

  @BeforeEach
  void setUp() {
    executor = TestData.newExecutor();
    taskContext = TestData.taskContext(config(4), executor);
  }

  @AfterEach
  void tearDown() {
    taskContext.close();
    executor.shutdownNow();
  }

  @Test
  void should_merge_all_partitions_into_one() {
    // Given
    CoalescePartitionsExec coalesce = new CoalescePartitionsExec(scan(numbers, 4));

    // When
    List<List<Object>> result = executeAll(coalesce, taskContext);

    // Then
    assertEquals(Partitioning.single().toString(), coalesce.getOutputPartitioning().toString());
    assertEquals(sorted(rows(ROWS)), sorted(result));
  }

  @Test
  void should_keep_order_of_single_input_partition() {
    SortExec sort = new SortExec(scan(numbers, 1), List.of(SortKey.asc("v", 0)), null, false);
    CoalescePartitionsExec coalesce = new CoalescePartitionsExec(sort);

    List<List<Object>> result = executeAll(coalesce, taskContext);

    assertEquals(List.of(SortKey.asc("v", 0)), coalesce.getOutputOrdering());
    assertEquals(
        rows(row(1L), row(2L), row(3L), row(5L), row(7L), row(8L), row(9L)), result);
  }
}
