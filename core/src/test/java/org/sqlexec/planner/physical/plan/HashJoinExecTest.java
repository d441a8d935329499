/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sqlexec.expression.DSL.ref;
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
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.planner.physical.join.JoinMode;
import org.sqlexec.planner.physical.join.JoinType;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.storage.memory.InMemoryTable;
import org.sqlexec.util.TestData;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashJoinExecTest {

  private static final Schema CUSTOMERS =
      Schema.of(Field.of("id", BlockType.LONG), Field.of("name", BlockType.STRING));

  private static final Schema ORDERS =
      Schema.of(Field.of("cust_id", BlockType.LONG), Field.of("amount", BlockType.LONG));

  private static final ReferenceExpression CUSTOMER_ID = ref("id", 0, BlockType.LONG);

  private static final ReferenceExpression ORDER_CUSTOMER = ref("cust_id", 0, BlockType.LONG);

  private final InMemoryTable customers =
      table(
          "customers",
          CUSTOMERS,
          2,
          row(1L, "alice"),
          row(2L, "bob"),
          row(3L, "carol"),
          row(null, "nobody"));

  private final InMemoryTable orders =
      table(
          "orders",
          ORDERS,
          3,
          row(1L, 10L),
          row(2L, 20L),
          row(1L, 11L),
          row(4L, 40L),
          row(null, 50L),
          row(2L, 21L));

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
  void should_produce_same_inner_join_rows_in_both_modes() {
    // Given
    List<List<Object>> expected =
        rows(
            row(1L, "alice", 1L, 10L),
            row(1L, "alice", 1L, 11L),
            row(2L, "bob", 2L, 20L),
            row(2L, "bob", 2L, 21L));

    // When
    List<List<Object>> collectLeft = executeAll(collectLeft(JoinType.INNER), taskContext);
    List<List<Object>> partitioned =
        executeAll(partitioned(JoinType.INNER), TestData.taskContext(config(3), executor));

    // Then
    assertEquals(sorted(expected), sorted(collectLeft));
    assertEquals(sorted(expected), sorted(partitioned));
  }

  @Test
  void should_emit_each_unmatched_left_row_once_when_partitioned() {
    List<List<Object>> result = executeAll(partitioned(JoinType.LEFT), taskContext);

    assertEquals(
        sorted(
            rows(
                row(1L, "alice", 1L, 10L),
                row(1L, "alice", 1L, 11L),
                row(2L, "bob", 2L, 20L),
                row(2L, "bob", 2L, 21L),
                row(3L, "carol", null, null),
                row(null, "nobody", null, null))),
        sorted(result));
  }

  @Test
  void should_emit_unmatched_right_rows_with_null_left_columns() {
    List<List<Object>> result = executeAll(collectLeft(JoinType.RIGHT), taskContext);

    assertEquals(
        sorted(
            rows(
                row(1L, "alice", 1L, 10L),
                row(1L, "alice", 1L, 11L),
                row(2L, "bob", 2L, 20L),
                row(2L, "bob", 2L, 21L),
                row(null, null, 4L, 40L),
                row(null, null, null, 50L))),
        sorted(result));
  }

  @Test
  void should_keep_left_rows_by_match_for_semi_and_anti_joins() {
    List<List<Object>> semi = executeAll(partitioned(JoinType.SEMI), taskContext);
    List<List<Object>> anti =
        executeAll(partitioned(JoinType.ANTI), TestData.taskContext(config(3), executor));

    assertEquals(sorted(rows(row(1L, "alice"), row(2L, "bob"))), sorted(semi));
    assertEquals(sorted(rows(row(3L, "carol"), row(null, "nobody"))), sorted(anti));
  }

  @Test
  void should_describe_mode_type_and_keys() {
    assertEquals(
        "HashJoinExec: mode=CollectLeft, join_type=Inner, on=[(id@0, cust_id@0)]",
        collectLeft(JoinType.INNER).describe());
  }

  private HashJoinExec collectLeft(JoinType joinType) {
    return new HashJoinExec(
        new CoalescePartitionsExec(scan(customers, 2)),
        scan(orders, 3),
        joinType,
        JoinMode.COLLECT_LEFT,
        List.of(CUSTOMER_ID),
        List.of(ORDER_CUSTOMER));
  }

  private HashJoinExec partitioned(JoinType joinType) {
    return new HashJoinExec(
        new RepartitionExec(scan(customers, 2), Partitioning.hash(List.of(CUSTOMER_ID), 3)),
        new RepartitionExec(scan(orders, 3), Partitioning.hash(List.of(ORDER_CUSTOMER), 3)),
        joinType,
        JoinMode.PARTITIONED,
        List.of(CUSTOMER_ID),
        List.of(ORDER_CUSTOMER));
  }
}
