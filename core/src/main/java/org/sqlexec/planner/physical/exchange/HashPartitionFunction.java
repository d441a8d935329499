/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.ObjIntConsumer;
import org.sqlexec.data.KeyHasher;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Page;

/**
 * Routes every row to {@code floorMod(hash(key), n)}. Uses {@link KeyHasher}, the hash shared with
 * aggregation and join, so rows with equal keys always meet in the same partition. Rows keep their
 * relative order within each output.
 */
public class HashPartitionFunction implements PartitionFunction {

  private final List<Expression> keys;
  private final int partitionCount;

  public HashPartitionFunction(List<Expression> keys, int partitionCount) {
    this.keys = ImmutableList.copyOf(keys);
    this.partitionCount = partitionCount;
  }

  @Override
  public void partition(Page page, ObjIntConsumer<Page> output) {
    int rows = page.getPositionCount();
    int[] targets = new int[rows];
    int[] counts = new int[partitionCount];
    for (int position = 0; position < rows; position++) {
      int target = KeyHasher.partition(KeyHasher.hashRow(keys, page, position), partitionCount);
      targets[position] = target;
      counts[target]++;
    }
    for (int target = 0; target < partitionCount; target++) {
      if (counts[target] == rows) {
        output.accept(page, target);
        return;
      }
    }
    int[] offsets = new int[partitionCount];
    for (int target = 1; target < partitionCount; target++) {
      offsets[target] = offsets[target - 1] + counts[target - 1];
    }
    int[] positions = new int[rows];
    int[] cursor = offsets.clone();
    for (int position = 0; position < rows; position++) {
      positions[cursor[targets[position]]++] = position;
    }
    for (int target = 0; target < partitionCount; target++) {
      if (counts[target] > 0) {
        output.accept(page.getPositions(positions, offsets[target], counts[target]), target);
      }
    }
  }
}
