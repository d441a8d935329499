/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import com.google.common.math.LongMath;
import lombok.RequiredArgsConstructor;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.planner.logical.LogicalAggregation;
import org.sqlexec.planner.logical.LogicalFilter;
import org.sqlexec.planner.logical.LogicalJoin;
import org.sqlexec.planner.logical.LogicalLimit;
import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.logical.LogicalPlanNodeVisitor;
import org.sqlexec.planner.logical.LogicalScan;
import org.sqlexec.planner.logical.LogicalUnion;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.storage.StorageEngine;
import org.sqlexec.storage.Table;

/**
 * Row estimates from table statistics and fixed factors: filters keep the configured selectivity,
 * grouped aggregation keeps a tenth of its input, joins keep the larger input. Byte estimates are
 * rows times a fixed width per column type.
 */
@RequiredArgsConstructor
public class DefaultCostEstimator extends LogicalPlanNodeVisitor<Long, Void>
    implements CostEstimator {

  private static final double GROUPING_FACTOR = 0.1;

  private final StorageEngine storageEngine;

  private final ExecutionConfig config;

  @Override
  public long estimateRows(LogicalPlan plan) {
    return plan.accept(this, null);
  }

  @Override
  public long estimateBytes(LogicalPlan plan) {
    return LongMath.saturatedMultiply(estimateRows(plan), rowWidth(plan.getSchema()));
  }

  @Override
  public Long visitNode(LogicalPlan plan, Void context) {
    return estimateRows(plan.getChild().get(0));
  }

  @Override
  public Long visitScan(LogicalScan plan, Void context) {
    Table table = storageEngine.getTable(plan.getTableName());
    return Math.max(0L, table.getEstimatedRowCount());
  }

  @Override
  public Long visitFilter(LogicalFilter plan, Void context) {
    long input = estimateRows(plan.getChild().get(0));
    return (long) Math.ceil(input * config.getDefaultFilterSelectivity());
  }

  @Override
  public Long visitAggregation(LogicalAggregation plan, Void context) {
    if (plan.getGroupByList().isEmpty()) {
      return 1L;
    }
    long input = estimateRows(plan.getChild().get(0));
    return Math.max(1L, (long) Math.ceil(input * GROUPING_FACTOR));
  }

  @Override
  public Long visitJoin(LogicalJoin plan, Void context) {
    long left = estimateRows(plan.getLeft());
    if (!plan.getJoinType().outputsProbeColumns()) {
      return left;
    }
    return Math.max(left, estimateRows(plan.getRight()));
  }

  @Override
  public Long visitLimit(LogicalLimit plan, Void context) {
    long input = Math.max(0L, estimateRows(plan.getChild().get(0)) - plan.getOffset());
    return plan.getLimit() == null ? input : Math.min(input, plan.getLimit());
  }

  @Override
  public Long visitUnion(LogicalUnion plan, Void context) {
    long total = 0;
    for (LogicalPlan input : plan.getChild()) {
      total = LongMath.saturatedAdd(total, estimateRows(input));
    }
    return total;
  }

  static long rowWidth(Schema schema) {
    long width = 0;
    for (int i = 0; i < schema.size(); i++) {
      width += typeWidth(schema.getType(i));
    }
    return Math.max(1L, width);
  }

  private static long typeWidth(BlockType type) {
    switch (type) {
      case BOOLEAN:
        return 1;
      case INT:
      case FLOAT:
      case DATE:
        return 4;
      case TIMESTAMP:
        return 12;
      case DECIMAL:
        return 16;
      case STRING:
      case BYTES:
        return 32;
      default:
        return 8;
    }
  }
}
