/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema.Field;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PageBuilderTest {

  private final Schema schema =
      Schema.of(Field.of("id", BlockType.LONG), Field.of("name", BlockType.STRING));

  @Test
  void should_build_page_with_rows() {
    // Given
    PageBuilder builder = new PageBuilder(schema);

    // When
    builder.beginRow();
    builder.setValue(0, 1L);
    builder.setValue(1, "a");
    builder.endRow();
    builder.appendRow(2L, null);
    Page page = builder.build();

    // Then
    assertEquals(2, page.getPositionCount());
    assertEquals(2, page.getChannelCount());
    assertSame(schema, page.getSchema());
    assertEquals(1L, page.getValue(0, 0));
    assertEquals("a", page.getValue(0, 1));
    assertNull(page.getValue(1, 1));
    assertEquals(BlockType.STRING, page.getBlock(1).getType());
  }

  @Test
  void should_reset_after_build() {
    PageBuilder builder = new PageBuilder(schema);
    builder.appendRow(1L, "a");
    builder.build();

    assertTrue(builder.isEmpty());
    assertEquals(0, builder.build().getPositionCount());
  }

  @Test
  void should_reject_set_value_without_begin_row() {
    PageBuilder builder = new PageBuilder(schema);

    assertThrows(IllegalStateException.class, () -> builder.setValue(0, 1L));
  }

  @Test
  void should_reject_out_of_range_channel() {
    PageBuilder builder = new PageBuilder(schema);
    builder.beginRow();

    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(2, 1L));
  }

  @Test
  void should_copy_row_from_another_page() {
    PageBuilder source = new PageBuilder(schema);
    source.appendRow(1L, "a");
    source.appendRow(2L, "b");
    Page page = source.build();

    PageBuilder builder = new PageBuilder(schema);
    builder.appendRow(page, 1);
    Page copy = builder.build();

    assertEquals(1, copy.getPositionCount());
    assertEquals(2L, copy.getValue(0, 0));
    assertEquals("b", copy.getValue(0, 1));
  }
}
