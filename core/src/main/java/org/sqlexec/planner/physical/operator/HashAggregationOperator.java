/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.data.KeyHasher;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.aggregation.Accumulator;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.PageBuilder;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Hash aggregation of one partition.
 *
 * <p>In {@link AggregationMode#PARTIAL} mode the group expressions and aggregate arguments are
 * evaluated on raw input rows and the output holds the group columns followed by the intermediate
 * state columns of every aggregate. In the final modes the input is such a partial output: group
 * columns are read from the first channels, states after them, and the output holds the group
 * columns followed by one final value per aggregate.
 *
 * <p>Groups are emitted in first-seen order. Without group expressions exactly one row is emitted,
 * also for empty input.
 */
@Log4j2
public class HashAggregationOperator implements Operator {

  private static final long GROUP_OVERHEAD_BYTES = 64L;

  private final AggregationMode mode;
  private final List<Expression> groupKeys;
  private final List<AggregateCall> aggregates;
  private final Schema outputSchema;
  private final int batchSize;
  private final OperatorContext context;
  private final int[] stateOffsets;

  private final Map<List<Object>, GroupState> groups = new LinkedHashMap<>();
  private final Deque<Page> outputs = new ArrayDeque<>();
  private long retainedBytes;
  private boolean inputFinished;

  /**
   * Creates a HashAggregationOperator.
   *
   * @param mode aggregation phase
   * @param groupKeys group expressions over the input; in final modes references to the leading
   *     group channels
   * @param aggregates aggregate calls, in output order
   * @param outputSchema schema of the produced pages
   * @param batchSize rows per output page
   * @param context operator context
   */
  public HashAggregationOperator(
      AggregationMode mode,
      List<Expression> groupKeys,
      List<AggregateCall> aggregates,
      Schema outputSchema,
      int batchSize,
      OperatorContext context) {
    this.mode = mode;
    this.groupKeys = ImmutableList.copyOf(groupKeys);
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.outputSchema = outputSchema;
    this.batchSize = batchSize;
    this.context = context;
    this.stateOffsets = new int[aggregates.size()];
    int offset = groupKeys.size();
    for (int i = 0; i < aggregates.size(); i++) {
      stateOffsets[i] = offset;
      offset += aggregates.get(i).getStateFields().size();
    }
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (inputFinished) {
      throw new IllegalStateException("Operator does not need input");
    }
    for (int position = 0; position < page.getPositionCount(); position++) {
      GroupState group = findOrCreateGroup(page, position);
      for (int i = 0; i < aggregates.size(); i++) {
        if (mode.isFinal()) {
          group.accumulators[i].merge(readState(page, position, i));
        } else {
          Expression argument = aggregates.get(i).getArgument();
          group.accumulators[i].update(
              argument == null ? Boolean.TRUE : argument.valueOf(page, position));
        }
      }
    }
  }

  private GroupState findOrCreateGroup(Page page, int position) {
    List<Object> key = KeyHasher.extractGroupKey(groupKeys, page, position);
    GroupState group = groups.get(key);
    if (group == null) {
      Object[] values = new Object[groupKeys.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = groupKeys.get(i).valueOf(page, position);
      }
      group = newGroup(values);
      groups.put(key, group);
    }
    return group;
  }

  private GroupState newGroup(Object[] keyValues) {
    Accumulator[] accumulators = new Accumulator[aggregates.size()];
    long bytes = GROUP_OVERHEAD_BYTES + 16L * keyValues.length;
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i] = aggregates.get(i).createAccumulator();
      bytes += accumulators[i].getEstimatedSize();
    }
    retainedBytes += bytes;
    context.checkMemory(retainedBytes);
    return new GroupState(keyValues, accumulators);
  }

  private Object[] readState(Page page, int position, int aggregate) {
    int width = aggregates.get(aggregate).getStateFields().size();
    Object[] state = new Object[width];
    for (int i = 0; i < width; i++) {
      state[i] = page.getValue(position, stateOffsets[aggregate] + i);
    }
    return state;
  }

  @Override
  public Page getOutput() {
    return outputs.poll();
  }

  @Override
  public boolean isFinished() {
    return inputFinished && outputs.isEmpty();
  }

  @Override
  public void finish() {
    if (inputFinished) {
      return;
    }
    inputFinished = true;
    if (groupKeys.isEmpty() && groups.isEmpty()) {
      groups.put(List.of(), newGroup(new Object[0]));
    }
    PageBuilder builder = new PageBuilder(outputSchema);
    for (GroupState group : groups.values()) {
      builder.beginRow();
      int channel = 0;
      for (Object keyValue : group.keyValues) {
        builder.setValue(channel++, keyValue);
      }
      for (Accumulator accumulator : group.accumulators) {
        if (mode.isFinal()) {
          builder.setValue(channel++, accumulator.evaluate());
        } else {
          for (Object stateValue : accumulator.state()) {
            builder.setValue(channel++, stateValue);
          }
        }
      }
      builder.endRow();
      if (builder.getRowCount() == batchSize) {
        outputs.add(builder.build());
      }
    }
    if (!builder.isEmpty()) {
      outputs.add(builder.build());
    }
    log.debug("{} {} aggregation produced {} groups", context, mode, groups.size());
    groups.clear();
    retainedBytes = 0;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    groups.clear();
    outputs.clear();
  }

  private static class GroupState {
    private final Object[] keyValues;
    private final Accumulator[] accumulators;

    private GroupState(Object[] keyValues, Accumulator[] accumulators) {
      this.keyValues = keyValues;
      this.accumulators = accumulators;
    }
  }
}
