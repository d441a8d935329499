/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import java.util.function.ObjIntConsumer;
import org.sqlexec.planner.physical.page.Page;

/** Deals whole pages to the outputs in strict rotation. */
public class RoundRobinPartitionFunction implements PartitionFunction {

  private final int partitionCount;
  private int next;

  public RoundRobinPartitionFunction(int partitionCount, int start) {
    this.partitionCount = partitionCount;
    this.next = Math.floorMod(start, partitionCount);
  }

  @Override
  public void partition(Page page, ObjIntConsumer<Page> output) {
    int target = next;
    next = (next + 1) % partitionCount;
    output.accept(page, target);
  }
}
