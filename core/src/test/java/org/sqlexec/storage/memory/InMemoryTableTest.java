/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.sqlexec.util.TestData.row;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.storage.PageSource;
import org.sqlexec.storage.Split;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryTableTest {

  private static final Schema SCHEMA = Schema.of(Field.of("id", BlockType.LONG));

  private final InMemoryTable table =
      InMemoryTable.fromRows(
          "numbers",
          SCHEMA,
          List.of(row(1L), row(2L), row(3L), row(4L), row(5L)),
          2,
          2);

  @Test
  void rows_are_spread_over_splits_of_consecutive_rows() {
    List<Split> splits = table.getSplits();

    assertEquals(2, splits.size());
    assertEquals(3L, splits.get(0).getEstimatedRows());
    assertEquals(2L, splits.get(1).getEstimatedRows());
    assertEquals(List.of(2, 1), pageSizes(table.createPageSource(splits.get(0))));
    assertEquals(List.of(2), pageSizes(table.createPageSource(splits.get(1))));
    assertEquals(5L, table.getEstimatedRowCount());
  }

  @Test
  void closed_source_returns_no_more_pages() {
    PageSource source = table.createPageSource(table.getSplits().get(0));
    source.getNextPage();

    source.close();

    assertNull(source.getNextPage());
  }

  @Test
  void estimate_override_keeps_the_data() {
    InMemoryTable large = table.withEstimatedRowCount(1_000_000L);

    assertEquals(1_000_000L, large.getEstimatedRowCount());
    assertEquals(table.getSplits().size(), large.getSplits().size());
  }

  @Test
  void storage_engine_resolves_registered_tables_by_name() {
    InMemoryStorageEngine engine = new InMemoryStorageEngine().register(table);

    assertSame(table, engine.getTable("numbers"));
    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> engine.getTable("missing"));
    assertEquals("Table not found: missing", error.getMessage());
  }

  private static List<Integer> pageSizes(PageSource source) {
    List<Integer> sizes = new ArrayList<>();
    Page page;
    while ((page = source.getNextPage()) != null) {
      sizes.add(page.getPositionCount());
    }
    return sizes;
  }
}
