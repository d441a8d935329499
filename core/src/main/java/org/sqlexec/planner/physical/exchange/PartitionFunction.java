/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import java.util.function.ObjIntConsumer;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.partitioning.Partitioning;

/** Routes the rows of an input page to output partitions. */
public interface PartitionFunction {

  /**
   * Splits a page by output partition.
   *
   * @param page the input page
   * @param output receives each non-empty piece with its output partition
   */
  void partition(Page page, ObjIntConsumer<Page> output);

  /**
   * Creates the function of one producer.
   *
   * @param partitioning the target partitioning
   * @param producerIndex the producer's input partition, used as round-robin start
   */
  static PartitionFunction create(Partitioning partitioning, int producerIndex) {
    switch (partitioning.getKind()) {
      case HASH:
        return new HashPartitionFunction(
            partitioning.getHashExpressions(), partitioning.getPartitionCount());
      case ROUND_ROBIN:
        return new RoundRobinPartitionFunction(partitioning.getPartitionCount(), producerIndex);
      case SINGLE:
        return (page, output) -> output.accept(page, 0);
      default:
        throw new IllegalArgumentException("Cannot repartition to " + partitioning);
    }
  }
}
