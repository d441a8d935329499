/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sqlexec.expression.DSL.ref;
import static org.sqlexec.util.TestData.page;
import static org.sqlexec.util.TestData.row;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class KeyHasherTest {

  @Test
  void should_hash_int_and_long_keys_identically() {
    // Given
    Schema ints = Schema.of(Field.of("k", BlockType.INT));
    Schema longs = Schema.of(Field.of("k", BlockType.LONG));
    Page intPage = page(ints, row(42));
    Page longPage = page(longs, row(42L));

    // When
    int intHash = KeyHasher.hashRow(List.of(ref("k", 0, BlockType.INT)), intPage, 0);
    int longHash = KeyHasher.hashRow(List.of(ref("k", 0, BlockType.LONG)), longPage, 0);

    // Then
    assertEquals(intHash, longHash);
  }

  @Test
  void should_hash_equal_decimals_with_different_scale_identically() {
    Schema decimals = Schema.of(Field.of("d", BlockType.DECIMAL));
    Page page = page(decimals, row(new BigDecimal("1.50")), row(new BigDecimal("1.5")));
    List<Expression> keys = List.of(ref("d", 0, BlockType.DECIMAL));

    assertEquals(KeyHasher.hashRow(keys, page, 0), KeyHasher.hashRow(keys, page, 1));
    assertEquals(
        KeyHasher.extractGroupKey(keys, page, 0), KeyHasher.extractGroupKey(keys, page, 1));
  }

  @Test
  void should_not_extract_join_key_with_null_column() {
    Schema schema = Schema.of(Field.of("a", BlockType.LONG), Field.of("b", BlockType.STRING));
    Page page = page(schema, row(1L, null), row(1L, "x"));
    List<Expression> keys = List.of(ref("a", 0, BlockType.LONG), ref("b", 1, BlockType.STRING));

    assertNull(KeyHasher.extractJoinKey(keys, page, 0));
    assertNotNull(KeyHasher.extractJoinKey(keys, page, 1));
  }

  @Test
  void should_keep_null_as_group_key() {
    Schema schema = Schema.of(Field.of("a", BlockType.LONG));
    Page page = page(schema, row((Object) null));

    List<Object> key = KeyHasher.extractGroupKey(List.of(ref("a", 0, BlockType.LONG)), page, 0);

    assertEquals(1, key.size());
    assertNull(key.get(0));
  }

  @Test
  void should_map_hash_into_partition_range() {
    for (int hash : new int[] {Integer.MIN_VALUE, -7, 0, 7, Integer.MAX_VALUE}) {
      int partition = KeyHasher.partition(hash, 4);
      assertTrue(partition >= 0 && partition < 4);
    }
  }
}
