/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.config;

import com.google.common.base.Preconditions;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Execution and planning knobs consumed by the compiler and the operators. Loading the values is
 * the caller's job; {@link #fromSettings(Map)} only parses an already loaded key/value view.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ExecutionConfig {

  public static final String TARGET_PARTITIONS = "sqlexec.execution.target_partitions";
  public static final String BATCH_SIZE = "sqlexec.execution.batch_size";
  public static final String COALESCE_BATCHES = "sqlexec.execution.coalesce_batches";
  public static final String EXCHANGE_BUFFER_PAGES = "sqlexec.execution.exchange_buffer_pages";
  public static final String OPERATOR_MEMORY_LIMIT_BYTES =
      "sqlexec.execution.operator_memory_limit_bytes";
  public static final String CANCELLATION_TIMEOUT_MILLIS =
      "sqlexec.execution.cancellation_timeout_millis";
  public static final String REPARTITION_SCANS = "sqlexec.optimizer.repartition_scans";
  public static final String HASH_JOIN_THRESHOLD_ROWS =
      "sqlexec.optimizer.hash_join_single_partition_threshold_rows";
  public static final String HASH_JOIN_THRESHOLD_BYTES =
      "sqlexec.optimizer.hash_join_single_partition_threshold_bytes";
  public static final String DEFAULT_FILTER_SELECTIVITY =
      "sqlexec.optimizer.default_filter_selectivity";

  /** Number of output partitions the compiler aims for. */
  @Builder.Default
  private final int targetPartitions = Runtime.getRuntime().availableProcessors();

  /** Row count target for pages produced by buffering operators and CoalesceBatches. */
  @Builder.Default private final int batchSize = 8192;

  @Builder.Default private final boolean coalesceBatches = true;

  /** Pages an exchange output may hold before its producers block. */
  @Builder.Default private final int exchangeBufferPages = 4;

  @Builder.Default private final long operatorMemoryLimitBytes = Long.MAX_VALUE;

  /** How long closing an exchange waits for its producer tasks to stop. */
  @Builder.Default private final long cancellationTimeoutMillis = 30_000L;

  /** Add round-robin repartitions above scans that have fewer partitions than the target. */
  @Builder.Default private final boolean repartitionScans = true;

  @Builder.Default private final long hashJoinSinglePartitionThresholdRows = 131_072L;

  @Builder.Default private final long hashJoinSinglePartitionThresholdBytes = 1024L * 1024L;

  @Builder.Default private final double defaultFilterSelectivity = 0.2;

  /** Returns the configuration with every value at its default. */
  public static ExecutionConfig defaults() {
    return ExecutionConfig.builder().build().validate();
  }

  /**
   * Parses the recognised keys from the given settings; unknown keys are ignored and missing keys
   * keep their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   */
  public static ExecutionConfig fromSettings(Map<String, String> settings) {
    ExecutionConfigBuilder builder = ExecutionConfig.builder();
    if (settings.containsKey(TARGET_PARTITIONS)) {
      builder.targetPartitions(parseInt(settings, TARGET_PARTITIONS));
    }
    if (settings.containsKey(BATCH_SIZE)) {
      builder.batchSize(parseInt(settings, BATCH_SIZE));
    }
    if (settings.containsKey(COALESCE_BATCHES)) {
      builder.coalesceBatches(parseBoolean(settings, COALESCE_BATCHES));
    }
    if (settings.containsKey(EXCHANGE_BUFFER_PAGES)) {
      builder.exchangeBufferPages(parseInt(settings, EXCHANGE_BUFFER_PAGES));
    }
    if (settings.containsKey(OPERATOR_MEMORY_LIMIT_BYTES)) {
      builder.operatorMemoryLimitBytes(parseLong(settings, OPERATOR_MEMORY_LIMIT_BYTES));
    }
    if (settings.containsKey(CANCELLATION_TIMEOUT_MILLIS)) {
      builder.cancellationTimeoutMillis(parseLong(settings, CANCELLATION_TIMEOUT_MILLIS));
    }
    if (settings.containsKey(REPARTITION_SCANS)) {
      builder.repartitionScans(parseBoolean(settings, REPARTITION_SCANS));
    }
    if (settings.containsKey(HASH_JOIN_THRESHOLD_ROWS)) {
      builder.hashJoinSinglePartitionThresholdRows(parseLong(settings, HASH_JOIN_THRESHOLD_ROWS));
    }
    if (settings.containsKey(HASH_JOIN_THRESHOLD_BYTES)) {
      builder.hashJoinSinglePartitionThresholdBytes(
          parseLong(settings, HASH_JOIN_THRESHOLD_BYTES));
    }
    if (settings.containsKey(DEFAULT_FILTER_SELECTIVITY)) {
      builder.defaultFilterSelectivity(parseDouble(settings, DEFAULT_FILTER_SELECTIVITY));
    }
    return builder.build().validate();
  }

  /** Checks value ranges and returns this instance. */
  public ExecutionConfig validate() {
    Preconditions.checkArgument(
        targetPartitions > 0, "%s must be positive: %s", TARGET_PARTITIONS, targetPartitions);
    Preconditions.checkArgument(batchSize > 0, "%s must be positive: %s", BATCH_SIZE, batchSize);
    Preconditions.checkArgument(
        exchangeBufferPages > 0,
        "%s must be positive: %s",
        EXCHANGE_BUFFER_PAGES,
        exchangeBufferPages);
    Preconditions.checkArgument(
        operatorMemoryLimitBytes > 0,
        "%s must be positive: %s",
        OPERATOR_MEMORY_LIMIT_BYTES,
        operatorMemoryLimitBytes);
    Preconditions.checkArgument(
        cancellationTimeoutMillis >= 0,
        "%s must not be negative: %s",
        CANCELLATION_TIMEOUT_MILLIS,
        cancellationTimeoutMillis);
    Preconditions.checkArgument(
        hashJoinSinglePartitionThresholdRows >= 0 && hashJoinSinglePartitionThresholdBytes >= 0,
        "hash join thresholds must not be negative");
    Preconditions.checkArgument(
        defaultFilterSelectivity >= 0.0 && defaultFilterSelectivity <= 1.0,
        "%s must be within [0, 1]: %s",
        DEFAULT_FILTER_SELECTIVITY,
        defaultFilterSelectivity);
    return this;
  }

  private static int parseInt(Map<String, String> settings, String key) {
    try {
      return Integer.parseInt(settings.get(key).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + settings.get(key));
    }
  }

  private static long parseLong(Map<String, String> settings, String key) {
    try {
      return Long.parseLong(settings.get(key).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid long for " + key + ": " + settings.get(key));
    }
  }

  private static double parseDouble(Map<String, String> settings, String key) {
    try {
      return Double.parseDouble(settings.get(key).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + settings.get(key));
    }
  }

  private static boolean parseBoolean(Map<String, String> settings, String key) {
    String value = settings.get(key).trim();
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
  }
}
