/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sqlexec.util.TestData.page;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.rows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.util.OperatorHarness;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LimitOperatorTest {

  private static final Schema SCHEMA = Schema.of(Field.of("v", BlockType.LONG));

  @Test
  void should_skip_and_fetch_across_pages() {
    // Given: skip 2, fetch 3 over two pages of 3 rows
    LimitOperator limit = new LimitOperator(2, 3, OperatorContext.createDefault("limit"));
    Page first = page(SCHEMA, row(1L), row(2L), row(3L));
    Page second = page(SCHEMA, row(4L), row(5L), row(6L));

    // When
    List<Page> output = OperatorHarness.run(limit, first, second);

    // Then
    assertEquals(rows(row(3L), row(4L), row(5L)), rows(output));
  }

  @Test
  void should_finish_as_soon_as_fetch_is_reached() {
    LimitOperator limit = new LimitOperator(0, 2, OperatorContext.createDefault("limit"));

    limit.addInput(page(SCHEMA, row(1L), row(2L), row(3L)));

    assertFalse(limit.needsInput());
    assertFalse(limit.isFinished());
    assertEquals(2, limit.getOutput().getPositionCount());
    assertTrue(limit.isFinished());
  }

  @Test
  void should_emit_nothing_when_skip_exceeds_input() {
    LimitOperator limit = new LimitOperator(10, 5, OperatorContext.createDefault("limit"));

    List<Page> output = OperatorHarness.run(limit, page(SCHEMA, row(1L), row(2L)));

    assertTrue(output.isEmpty());
  }
}
