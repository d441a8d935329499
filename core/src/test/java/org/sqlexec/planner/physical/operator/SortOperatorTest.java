/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.sqlexec.util.TestData.page;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.rows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.exception.ResourceExhaustedException;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.util.OperatorHarness;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortOperatorTest {

  private static final Schema SCHEMA =
      Schema.of(Field.of("k", BlockType.LONG), Field.of("tag", BlockType.STRING));

  @Test
  void should_sort_ascending_with_nulls_last_across_pages() {
    // Given
    SortOperator sort =
        new SortOperator(
            SCHEMA,
            List.of(SortKey.asc("k", 0)),
            Long.MAX_VALUE,
            2,
            OperatorContext.createDefault("sort"));

    // When
    List<Page> output =
        OperatorHarness.run(
            sort,
            page(SCHEMA, row(3L, "c"), row(null, "n")),
            page(SCHEMA, row(1L, "a"), row(2L, "b")));

    // Then: batches of 2
    assertEquals(2, output.size());
    assertEquals(
        rows(row(1L, "a"), row(2L, "b"), row(3L, "c"), row(null, "n")), rows(output));
  }

  @Test
  void should_sort_descending_with_nulls_first() {
    SortOperator sort =
        new SortOperator(
            SCHEMA,
            List.of(SortKey.desc("k", 0)),
            Long.MAX_VALUE,
            100,
            OperatorContext.createDefault("sort"));

    List<Page> output =
        OperatorHarness.run(sort, page(SCHEMA, row(1L, "a"), row(null, "n"), row(2L, "b")));

    assertEquals(rows(row(null, "n"), row(2L, "b"), row(1L, "a")), rows(output));
  }

  @Test
  void should_keep_input_order_of_equal_keys() {
    SortOperator sort =
        new SortOperator(
            SCHEMA,
            List.of(SortKey.asc("k", 0)),
            Long.MAX_VALUE,
            100,
            OperatorContext.createDefault("sort"));

    List<Page> output =
        OperatorHarness.run(
            sort, page(SCHEMA, row(1L, "first"), row(0L, "zero"), row(1L, "second")));

    assertEquals(rows(row(0L, "zero"), row(1L, "first"), row(1L, "second")), rows(output));
  }

  @Test
  void should_emit_only_fetch_rows() {
    SortOperator sort =
        new SortOperator(
            SCHEMA, List.of(SortKey.asc("k", 0)), 2, 100, OperatorContext.createDefault("sort"));

    List<Page> output =
        OperatorHarness.run(sort, page(SCHEMA, row(5L, "e"), row(4L, "d"), row(3L, "c")));

    assertEquals(rows(row(3L, "c"), row(4L, "d")), rows(output));
  }

  @Test
  void should_fail_when_buffered_input_exceeds_memory_limit() {
    // Given: a 16 byte budget
    TaskContext taskContext = TaskContext.create(ExecutionConfig.defaults());
    SortOperator sort =
        new SortOperator(
            SCHEMA,
            List.of(SortKey.asc("k", 0)),
            Long.MAX_VALUE,
            100,
            new OperatorContext("sort", 0, 16L, taskContext));

    // When / Then
    assertThrows(
        ResourceExhaustedException.class,
        () -> sort.addInput(page(SCHEMA, row(1L, "a"), row(2L, "b"), row(3L, "c"))));
    taskContext.close();
  }
}
