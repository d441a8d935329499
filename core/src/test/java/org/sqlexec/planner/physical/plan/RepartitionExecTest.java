/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sqlexec.expression.DSL.ref;
import static org.sqlexec.util.TestData.config;
import static org.sqlexec.util.TestData.executeAll;
import static org.sqlexec.util.TestData.executePartitions;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.rows;
import static org.sqlexec.util.TestData.scan;
import static org.sqlexec.util.TestData.sorted;
import static org.sqlexec.util.TestData.table;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;
import org.sqlexec.storage.memory.InMemoryTable;
import org.sqlexec.util.TestData;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RepartitionExecTest {

  private static final Schema SCHEMA =
      Schema.of(Field.of("customer", BlockType.STRING), Field.of("amount", BlockType.LONG));

  private static final Object[][] ROWS = {
    row("alice", 1L),
    row("bob", 2L),
    row("carol", 3L),
    row("alice", 4L),
    row(null, 5L),
    row("bob", 6L),
    row("dave", 7L),
    row("alice", 8L),
    row(null, 9L),
    row("erin", 10L)
  };

  private final InMemoryTable orders = table("orders", SCHEMA, 4, ROWS);

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
  void should_place_equal_keys_in_the_same_partition() {
    // Given
    RepartitionExec repartition =
        new RepartitionExec(
            scan(orders, 4),
            Partitioning.hash(List.of(ref("customer", 0, BlockType.STRING)), 3));

    // When
    List<List<List<Object>>> partitions = executePartitions(repartition, taskContext);

    // Then: every key lives in one partition and no row is lost or duplicated
    assertEquals(3, partitions.size());
    Map<Object, Integer> home = new HashMap<>();
    List<List<Object>> all = new ArrayList<>();
    for (int p = 0; p < partitions.size(); p++) {
      for (List<Object> row : partitions.get(p)) {
        Integer previous = home.put(String.valueOf(row.get(0)), p);
        assertTrue(previous == null || previous == p, "key split across partitions: " + row);
        all.add(row);
      }
    }
    assertEquals(sorted(rows(ROWS)), sorted(all));
  }

  @Test
  void should_spread_rows_round_robin_without_loss() {
    RepartitionExec repartition = new RepartitionExec(scan(orders, 1), Partitioning.roundRobin(3));

    List<List<List<Object>>> partitions = executePartitions(repartition, taskContext);

    assertEquals(3, partitions.size());
    partitions.forEach(partition -> assertTrue(!partition.isEmpty()));
    assertEquals(sorted(rows(ROWS)), sorted(executeAll(repartition, freshContext())));
  }

  @Test
  void should_stop_producers_when_consumers_close_early() {
    // Given
    RepartitionExec repartition =
        new RepartitionExec(scan(orders, 4), Partitioning.roundRobin(3));
    List<PageStream> outputs = new ArrayList<>();
    for (int p = 0; p < 3; p++) {
      outputs.add(repartition.execute(p, taskContext));
    }

    // When: read one page then walk away
    assertNotNull(outputs.get(0).next());
    outputs.forEach(PageStream::close);

    // Then: the same plan executes again in a new context
    assertEquals(ROWS.length, executeAll(repartition, freshContext()).size());
  }

  @Test
  void should_describe_partitioning() {
    RepartitionExec repartition =
        new RepartitionExec(
            scan(orders, 4),
            Partitioning.hash(List.of(ref("customer", 0, BlockType.STRING)), 3));

    assertEquals(
        "RepartitionExec: partitioning=Hash([customer@0], 3), input_partitions=4",
        repartition.describe());
  }

  private TaskContext freshContext() {
    return TestData.taskContext(config(3), executor);
  }
}
