/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sqlexec.expression.DSL.greater;
import static org.sqlexec.expression.DSL.literal;
import static org.sqlexec.expression.DSL.ref;
import static org.sqlexec.planner.logical.LogicalPlanDSL.filter;
import static org.sqlexec.planner.logical.LogicalPlanDSL.limit;
import static org.sqlexec.planner.logical.LogicalPlanDSL.scan;
import static org.sqlexec.planner.logical.LogicalPlanDSL.sort;
import static org.sqlexec.planner.logical.LogicalPlanDSL.union;
import static org.sqlexec.planner.logical.LogicalPlanDSL.window;
import static org.sqlexec.util.TestData.config;
import static org.sqlexec.util.TestData.page;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.rows;
import static org.sqlexec.util.TestData.sorted;
import static org.sqlexec.util.TestData.table;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.config.SessionContext;
import org.sqlexec.exception.CompileException;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.exception.ResourceExhaustedException;
import org.sqlexec.exception.UpstreamDataException;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.expression.window.WindowFrame;
import org.sqlexec.expression.window.WindowFrameBound;
import org.sqlexec.expression.window.WindowFunction;
import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.stream.PageStream;
import org.sqlexec.storage.PageSource;
import org.sqlexec.storage.Split;
import org.sqlexec.storage.Table;
import org.sqlexec.storage.memory.InMemoryStorageEngine;
import org.sqlexec.storage.memory.InMemoryTable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionDriverTest {

  private static final Schema ORDERS =
      Schema.of(Field.of("id", BlockType.LONG), Field.of("amount", BlockType.LONG));

  private final InMemoryTable orders =
      table(
          "orders",
          ORDERS,
          3,
          row(1L, 50L),
          row(2L, 5L),
          row(3L, 70L),
          row(4L, 10L),
          row(5L, 90L));

  @Test
  void should_run_query_and_collect_all_partitions() {
    // Given
    ExecutionDriver driver = driver(config(3), orders);
    LogicalPlan plan =
        filter(scan(orders), greater(ref("amount", 1, BlockType.LONG), literal(20L)));

    // When
    QueryExecution execution = driver.submit(driver.compile(plan));
    QueryResult result = execution.getResult();

    // Then
    assertEquals(QueryExecution.State.FINISHED, execution.getState());
    assertEquals(3, result.getPartitions().size());
    assertEquals(3, result.getRowCount());
    assertEquals(
        sorted(rows(row(1L, 50L), row(3L, 70L), row(5L, 90L))), sorted(result.getRows()));
  }

  @Test
  void should_return_sorted_rows_from_single_partition() {
    ExecutionDriver driver = driver(config(2), orders);

    QueryResult result = driver.run(sort(scan(orders), SortKey.desc("amount", 1)));

    assertEquals(1, result.getPartitions().size());
    assertEquals(
        rows(row(5L, 90L), row(3L, 70L), row(1L, 50L), row(4L, 10L), row(2L, 5L)),
        result.getRows());
  }

  @Test
  void should_report_first_error_and_cancel_sibling_partitions() {
    // Given: split 0 never ends, split 1 fails on its first page
    ScriptedTable events = new ScriptedTable(1);
    ExecutionDriver driver = driver(config(2), events);

    // When
    QueryExecution execution = driver.submit(driver.compile(scan(events)));

    // Then
    UpstreamDataException error =
        assertThrows(UpstreamDataException.class, execution::getResult);
    assertEquals("corrupt page in split 1", error.getMessage());
    assertEquals(QueryExecution.State.FAILED, execution.getState());
    assertEquals(events.opened.get(), events.closed.get());
  }

  @Test
  void should_cancel_running_query_and_release_sources() throws Exception {
    // Given
    ScriptedTable events = new ScriptedTable(-1);
    ExecutionDriver driver = driver(config(2), events);
    QueryExecution execution =
        driver.submit(
            driver.compile(
                filter(scan(events), greater(ref("v", 0, BlockType.LONG), literal(-1L)))));
    assertTrue(events.started.await(10, TimeUnit.SECONDS));

    // When
    execution.cancel();

    // Then
    assertThrows(QueryCancelledException.class, execution::getResult);
    assertEquals(QueryExecution.State.CANCELLED, execution.getState());
    assertEquals(events.opened.get(), events.closed.get());
  }

  @Test
  void should_stop_reading_once_limit_is_satisfied() {
    ScriptedTable events = new ScriptedTable(-1);
    ExecutionDriver driver = driver(config(2), events);

    QueryExecution execution = driver.submit(driver.compile(limit(scan(events), 5, 0)));
    QueryResult result = execution.getResult();

    assertEquals(5, result.getRowCount());
    assertEquals(QueryExecution.State.FINISHED, execution.getState());
    assertEquals(events.opened.get(), events.closed.get());
  }

  @Test
  void should_fail_when_operator_exceeds_memory_limit() {
    ExecutionConfig config =
        ExecutionConfig.builder().targetPartitions(2).operatorMemoryLimitBytes(64L).build();
    ExecutionDriver driver = driver(config, orders);
    QueryExecution execution =
        driver.submit(driver.compile(sort(scan(orders), SortKey.asc("id", 0))));

    assertThrows(ResourceExhaustedException.class, execution::getResult);
    assertEquals(QueryExecution.State.FAILED, execution.getState());
  }

  @Test
  void should_fail_on_values_not_matching_table_schema() {
    InMemoryTable broken =
        table("broken", ORDERS, 1, row(1L, 10L), row(2L, "twenty"), row(3L, 30L));
    ExecutionDriver driver = driver(config(1), broken);

    UpstreamDataException error =
        assertThrows(UpstreamDataException.class, () -> driver.run(scan(broken)));
    assertTrue(error.getMessage().contains("amount"));
  }

  @Test
  void should_explain_plan_after_failed_run() {
    InMemoryTable broken = table("broken", ORDERS, 1, row("one", 10L));
    ExecutionDriver driver = driver(config(1), broken);
    LogicalPlan plan = scan(broken);

    assertThrows(UpstreamDataException.class, () -> driver.run(plan));

    assertEquals(
        "ScanExec: table=broken, partitions=1, projection=[id, amount]\n", driver.explain(plan));
  }

  @Test
  void should_execute_same_plan_twice() {
    ExecutionDriver driver = driver(config(3), orders);
    ExecutionPlan plan = driver.compile(limit(sort(scan(orders), SortKey.asc("id", 0)), 2, 1));

    QueryResult first = driver.submit(plan).getResult();
    QueryResult second = driver.submit(plan).getResult();

    assertEquals(rows(row(2L, 5L), row(3L, 70L)), first.getRows());
    assertEquals(first.getRows(), second.getRows());
  }

  @Test
  void should_return_every_row_after_offset_for_unbounded_limit() {
    // Given
    ExecutionDriver driver = driver(config(3), orders);
    LogicalPlan plan = limit(scan(orders), Long.MAX_VALUE, 1);

    // When
    QueryResult result = driver.run(plan);

    // Then
    assertTrue(driver.explain(plan).contains("LocalLimitExec: fetch=" + Long.MAX_VALUE));
    assertEquals(4, result.getRowCount());
  }

  @Test
  void should_compute_running_window_per_hash_partition() {
    // Given
    Schema salesSchema =
        Schema.of(
            Field.of("region", BlockType.STRING),
            Field.of("day", BlockType.LONG),
            Field.of("amount", BlockType.LONG));
    InMemoryTable sales =
        table(
            "sales",
            salesSchema,
            3,
            row("west", 2L, 7L),
            row("east", 3L, 30L),
            row("west", 1L, 5L),
            row("east", 1L, 10L),
            row("west", 3L, null),
            row("east", 2L, 20L));
    ExecutionDriver driver = driver(config(2), sales);
    LogicalPlan plan =
        window(
            scan(sales),
            List.of(ref("region", 0, BlockType.STRING)),
            List.of(SortKey.asc("day", 1)),
            WindowCall.of(
                WindowFunction.SUM,
                ref("amount", 2, BlockType.LONG),
                WindowFrame.rows(
                    WindowFrameBound.unboundedPreceding(), WindowFrameBound.currentRow()),
                "running"),
            WindowCall.ranking(WindowFunction.ROW_NUMBER, "rn"));

    // When
    QueryResult result = driver.run(plan);

    // Then
    assertEquals(
        sorted(
            rows(
                row("east", 1L, 10L, 10L, 1L),
                row("east", 2L, 20L, 30L, 2L),
                row("east", 3L, 30L, 60L, 3L),
                row("west", 1L, 5L, 5L, 1L),
                row("west", 2L, 7L, 12L, 2L),
                row("west", 3L, null, 12L, 3L))),
        sorted(result.getRows()));
  }

  @Test
  void should_expose_lazy_streams_per_partition() {
    ExecutionDriver driver = driver(config(3), orders);
    ExecutionPlan plan = driver.compile(scan(orders));
    TaskContext taskContext = TaskContext.create(driver.getSession().getConfig());

    List<Page> pages = new ArrayList<>();
    for (PageStream stream : driver.execute(plan, taskContext)) {
      Page page;
      while ((page = stream.next()) != null) {
        pages.add(page);
      }
      stream.close();
    }
    taskContext.close();

    assertEquals(5, rows(pages).size());
  }

  @Test
  void should_union_inputs_keeping_duplicates() {
    ExecutionDriver driver = driver(config(2), orders);
    LogicalPlan plan = union(scan(orders), scan(orders));

    assertEquals(
        String.join(
            "\n",
            "UnionExec",
            "  ScanExec: table=orders, partitions=2, projection=[id, amount]",
            "  ScanExec: table=orders, partitions=2, projection=[id, amount]",
            ""),
        driver.explain(plan));
    QueryResult result = driver.run(plan);
    assertEquals(4, result.getPartitions().size());
    assertEquals(10L, result.getRowCount());
  }

  @Test
  void should_reject_union_of_incompatible_inputs() {
    InMemoryTable names =
        table(
            "names",
            Schema.of(Field.of("id", BlockType.LONG), Field.of("name", BlockType.STRING)),
            1,
            row(1L, "a"));
    ExecutionDriver driver = driver(config(2), orders, names);

    assertThrows(
        CompileException.class, () -> driver.compile(union(scan(orders), scan(names))));
  }

  private static ExecutionDriver driver(ExecutionConfig config, Table... tables) {
    InMemoryStorageEngine storage = new InMemoryStorageEngine();
    for (Table table : tables) {
      storage.register(table);
    }
    return new ExecutionDriver(new SessionContext(config, storage));
  }

  /** Two endless splits of increasing numbers; one of them may fail instead. */
  private static class ScriptedTable implements Table {
    private static final Schema SCHEMA = Schema.of(Field.of("v", BlockType.LONG));

    private final int failingSplit;
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private final CountDownLatch started = new CountDownLatch(1);

    ScriptedTable(int failingSplit) {
      this.failingSplit = failingSplit;
    }

    @Override
    public String getName() {
      return "events";
    }

    @Override
    public Schema getSchema() {
      return SCHEMA;
    }

    @Override
    public long getEstimatedRowCount() {
      return 1_000_000L;
    }

    @Override
    public long getEstimatedSizeBytes() {
      return 8_000_000L;
    }

    @Override
    public List<Split> getSplits() {
      return List.of(new Split("events", 0, 500_000L), new Split("events", 1, 500_000L));
    }

    @Override
    public PageSource createPageSource(Split split) {
      opened.incrementAndGet();
      started.countDown();
      return new PageSource() {
        private long next;

        @Override
        public Page getNextPage() {
          if (split.getSplitId() == failingSplit) {
            throw new UpstreamDataException("corrupt page in split " + failingSplit);
          }
          return page(SCHEMA, row(next++), row(next++));
        }

        @Override
        public void close() {
          closed.incrementAndGet();
        }
      };
    }
  }
}
