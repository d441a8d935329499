/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.storage.memory.InMemoryStorageEngine;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionConfigTest {

  @Test
  void defaults_follow_the_documented_values() {
    ExecutionConfig config = ExecutionConfig.defaults();

    assertEquals(Runtime.getRuntime().availableProcessors(), config.getTargetPartitions());
    assertEquals(8192, config.getBatchSize());
    assertTrue(config.isCoalesceBatches());
    assertEquals(4, config.getExchangeBufferPages());
    assertEquals(Long.MAX_VALUE, config.getOperatorMemoryLimitBytes());
    assertEquals(30_000L, config.getCancellationTimeoutMillis());
    assertTrue(config.isRepartitionScans());
    assertEquals(131_072L, config.getHashJoinSinglePartitionThresholdRows());
    assertEquals(1024L * 1024L, config.getHashJoinSinglePartitionThresholdBytes());
    assertEquals(0.2, config.getDefaultFilterSelectivity());
  }

  @Test
  void from_settings_parses_known_keys_and_ignores_unknown_ones() {
    ExecutionConfig config =
        ExecutionConfig.fromSettings(
            Map.of(
                ExecutionConfig.TARGET_PARTITIONS, " 3 ",
                ExecutionConfig.BATCH_SIZE, "100",
                ExecutionConfig.COALESCE_BATCHES, "FALSE",
                ExecutionConfig.REPARTITION_SCANS, "false",
                ExecutionConfig.HASH_JOIN_THRESHOLD_ROWS, "10",
                ExecutionConfig.DEFAULT_FILTER_SELECTIVITY, "0.5",
                "sqlexec.unknown.key", "whatever"));

    assertEquals(3, config.getTargetPartitions());
    assertEquals(100, config.getBatchSize());
    assertFalse(config.isCoalesceBatches());
    assertFalse(config.isRepartitionScans());
    assertEquals(10L, config.getHashJoinSinglePartitionThresholdRows());
    assertEquals(0.5, config.getDefaultFilterSelectivity());
    assertEquals(4, config.getExchangeBufferPages());
  }

  @Test
  void from_settings_rejects_unparsable_values() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () -> ExecutionConfig.fromSettings(Map.of(ExecutionConfig.BATCH_SIZE, "lots")));
    assertEquals(
        "Invalid integer for sqlexec.execution.batch_size: lots", exception.getMessage());

    assertThrows(
        IllegalArgumentException.class,
        () -> ExecutionConfig.fromSettings(Map.of(ExecutionConfig.COALESCE_BATCHES, "yes")));
  }

  @Test
  void validate_rejects_out_of_range_values() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExecutionConfig.fromSettings(Map.of(ExecutionConfig.TARGET_PARTITIONS, "0")));
    assertThrows(
        IllegalArgumentException.class,
        () -> ExecutionConfig.builder().batchSize(-1).build().validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> ExecutionConfig.builder().defaultFilterSelectivity(1.5).build().validate());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ExecutionConfig.builder()
                .hashJoinSinglePartitionThresholdBytes(-1L)
                .build()
                .validate());
  }

  @Test
  void session_with_config_keeps_the_catalog() {
    InMemoryStorageEngine storage = new InMemoryStorageEngine();
    SessionContext session = new SessionContext(ExecutionConfig.defaults(), storage);

    SessionContext narrowed =
        session.withConfig(session.getConfig().toBuilder().targetPartitions(1).build());

    assertSame(storage, narrowed.getStorageEngine());
    assertEquals(1, narrowed.getConfig().getTargetPartitions());
  }

  @Test
  void to_builder_keeps_other_values() {
    ExecutionConfig base = ExecutionConfig.builder().targetPartitions(2).batchSize(16).build();

    ExecutionConfig changed = base.toBuilder().batchSize(32).build();

    assertEquals(2, changed.getTargetPartitions());
    assertEquals(32, changed.getBatchSize());
  }
}
