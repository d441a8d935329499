/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

import java.util.List;
import org.sqlexec.planner.physical.page.Block.BlockType;

/**
 * Supported aggregate functions. Only decomposable functions can run as Partial followed by a
 * final phase; the compiler rejects the others.
 */
public enum AggregateFunction {
  SUM(true, List.of("sum")),
  COUNT(true, List.of("count")),
  MIN(true, List.of("min")),
  MAX(true, List.of("max")),
  AVG(true, List.of("sum", "count")),
  MEDIAN(false, List.of());

  private final boolean decomposable;
  private final List<String> stateNames;

  AggregateFunction(boolean decomposable, List<String> stateNames) {
    this.decomposable = decomposable;
    this.stateNames = stateNames;
  }

  public boolean isDecomposable() {
    return decomposable;
  }

  /** Returns the names of the intermediate state columns. */
  public List<String> getStateNames() {
    return stateNames;
  }

  /**
   * Returns the final result type for the given input type, or null if the function does not
   * accept that input type.
   */
  public BlockType returnType(BlockType inputType) {
    switch (this) {
      case COUNT:
        return BlockType.LONG;
      case MIN:
      case MAX:
        return inputType == BlockType.BYTES || inputType == BlockType.UNKNOWN ? null : inputType;
      case SUM:
        return sumType(inputType);
      case AVG:
      case MEDIAN:
        if (!inputType.isNumeric()) {
          return null;
        }
        return inputType == BlockType.DECIMAL ? BlockType.DECIMAL : BlockType.DOUBLE;
      default:
        return null;
    }
  }

  /** Returns the types of the intermediate state columns for the given input type. */
  public List<BlockType> stateTypes(BlockType inputType) {
    switch (this) {
      case COUNT:
        return List.of(BlockType.LONG);
      case MIN:
      case MAX:
        return List.of(inputType);
      case SUM:
        return List.of(sumType(inputType));
      case AVG:
        return List.of(returnType(inputType), BlockType.LONG);
      default:
        throw new UnsupportedOperationException(name() + " has no intermediate state");
    }
  }

  /** Creates a fresh accumulator for the given input type. */
  public Accumulator createAccumulator(BlockType inputType) {
    switch (this) {
      case SUM:
        return new SumAccumulator(sumType(inputType));
      case COUNT:
        return new CountAccumulator();
      case MIN:
        return new MinMaxAccumulator(false);
      case MAX:
        return new MinMaxAccumulator(true);
      case AVG:
        return new AvgAccumulator(returnType(inputType));
      default:
        throw new UnsupportedOperationException(name() + " cannot be computed incrementally");
    }
  }

  private static BlockType sumType(BlockType inputType) {
    if (inputType.isIntegral()) {
      return BlockType.LONG;
    }
    if (inputType.isFloatingPoint()) {
      return BlockType.DOUBLE;
    }
    if (inputType == BlockType.DECIMAL) {
      return BlockType.DECIMAL;
    }
    return null;
  }
}
