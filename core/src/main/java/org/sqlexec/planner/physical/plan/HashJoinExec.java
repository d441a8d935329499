/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.planner.physical.join.JoinMode;
import org.sqlexec.planner.physical.join.JoinType;
import org.sqlexec.planner.physical.join.LookupSource;
import org.sqlexec.planner.physical.join.LookupSourceBuilder;
import org.sqlexec.planner.physical.join.SharedLookupSource;
import org.sqlexec.planner.physical.operator.LookupJoinOperator;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.PageStreamSourceOperator;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.pipeline.PipelineDriver;
import org.sqlexec.planner.physical.stream.AbstractPageStream;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Equi-join that builds a hash table from the left input and probes it with the right input.
 *
 * <p>In CollectLeft mode the whole left input is read once, from its single partition, and shared
 * by every probe partition. In Partitioned mode both inputs are hash partitioned on their keys and
 * partition i of the left input is joined with partition i of the right input.
 *
 * <p>The build starts when an output partition is first pulled, never in {@link #execute}.
 */
public class HashJoinExec extends AbstractExecutionPlan {

  @Getter private final JoinType joinType;
  @Getter private final JoinMode mode;
  @Getter private final List<Expression> leftKeys;
  @Getter private final List<Expression> rightKeys;

  public HashJoinExec(
      ExecutionPlan left,
      ExecutionPlan right,
      JoinType joinType,
      JoinMode mode,
      List<? extends Expression> leftKeys,
      List<? extends Expression> rightKeys) {
    super(outputSchema(left.getSchema(), right.getSchema(), joinType), List.of(left, right));
    this.joinType = joinType;
    this.mode = mode;
    this.leftKeys = ImmutableList.copyOf(leftKeys);
    this.rightKeys = ImmutableList.copyOf(rightKeys);
  }

  /** Left columns followed by right columns, or the left columns only for semi and anti joins. */
  public static Schema outputSchema(Schema left, Schema right, JoinType joinType) {
    return joinType.outputsProbeColumns() ? left.concat(right) : left;
  }

  private ExecutionPlan left() {
    return child(0);
  }

  private ExecutionPlan right() {
    return child(1);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.HASH_JOIN;
  }

  @Override
  public ExecutionPlan withNewChildren(List<ExecutionPlan> children) {
    return new HashJoinExec(
        children.get(0), children.get(1), joinType, mode, leftKeys, rightKeys);
  }

  @Override
  public List<Distribution> getRequiredInputDistribution() {
    if (mode == JoinMode.COLLECT_LEFT) {
      return List.of(Distribution.singlePartition(), Distribution.unspecified());
    }
    return List.of(Distribution.hash(leftKeys), Distribution.hash(rightKeys));
  }

  @Override
  public Partitioning getOutputPartitioning() {
    Partitioning probe = right().getOutputPartitioning();
    int partitions = probe.getPartitionCount();
    if (!joinType.outputsProbeColumns()) {
      return mode == JoinMode.PARTITIONED
          ? left().getOutputPartitioning()
          : Partitioning.unknown(partitions);
    }
    int offset = left().getSchema().size();
    if (mode == JoinMode.COLLECT_LEFT) {
      return joinType == JoinType.INNER || joinType == JoinType.RIGHT
          ? shift(probe, offset)
          : Partitioning.unknown(partitions);
    }
    switch (joinType) {
      case INNER:
      case LEFT:
        return left().getOutputPartitioning();
      case RIGHT:
        return shift(probe, offset);
      default:
        return Partitioning.unknown(partitions);
    }
  }

  private Partitioning shift(Partitioning partitioning, int offset) {
    if (partitioning.getKind() != Partitioning.Kind.HASH) {
      return Partitioning.unknown(partitioning.getPartitionCount());
    }
    List<Expression> shifted = new ArrayList<>();
    for (Expression expression : partitioning.getHashExpressions()) {
      if (!(expression instanceof ReferenceExpression)) {
        return Partitioning.unknown(partitioning.getPartitionCount());
      }
      shifted.add(((ReferenceExpression) expression).shift(offset));
    }
    return Partitioning.hash(shifted, partitioning.getPartitionCount());
  }

  @Override
  public EquivalenceProperties getEquivalenceProperties() {
    EquivalenceProperties leftEquivalences = left().getEquivalenceProperties();
    if (!joinType.outputsProbeColumns()) {
      return leftEquivalences;
    }
    int offset = left().getSchema().size();
    EquivalenceProperties joined =
        leftEquivalences.join(right().getEquivalenceProperties(), offset);
    if (joinType != JoinType.INNER) {
      return joined;
    }
    for (int i = 0; i < leftKeys.size(); i++) {
      if (leftKeys.get(i) instanceof ReferenceExpression
          && rightKeys.get(i) instanceof ReferenceExpression) {
        joined =
            joined.withEquivalence(
                ((ReferenceExpression) leftKeys.get(i)).getIndex(),
                ((ReferenceExpression) rightKeys.get(i)).getIndex() + offset);
      }
    }
    return joined;
  }

  @Override
  public PageStream execute(int partition, TaskContext taskContext) {
    checkPartition(partition);
    OperatorContext context = operatorContext(partition, taskContext);
    if (mode == JoinMode.COLLECT_LEFT) {
      int probePartitions = right().getOutputPartitioning().getPartitionCount();
      SharedLookupSource shared =
          taskContext.getOrCreateState(
              this, () -> new SharedLookupSource(taskContext.getQueryId(), probePartitions));
      return new ProbeStream(taskContext, partition, context, shared);
    }
    return new ProbeStream(taskContext, partition, context, null);
  }

  private LookupSource buildLookupSource(
      int buildPartition, TaskContext taskContext, OperatorContext context) {
    return new LookupSourceBuilder(left().getSchema(), leftKeys, context)
        .buildFrom(left().execute(buildPartition, taskContext));
  }

  /** One output partition: builds or acquires the lookup source, then drives the probe. */
  private class ProbeStream extends AbstractPageStream {
    private final int partition;
    private final OperatorContext context;
    private final SharedLookupSource shared;
    private PipelineDriver driver;

    ProbeStream(
        TaskContext taskContext,
        int partition,
        OperatorContext context,
        SharedLookupSource shared) {
      super(HashJoinExec.this.getSchema(), taskContext);
      this.partition = partition;
      this.context = context;
      this.shared = shared;
    }

    @Override
    protected Page computeNext() {
      if (driver == null) {
        LookupSource lookupSource =
            shared == null
                ? buildLookupSource(partition, taskContext, context)
                : shared.acquire(() -> buildLookupSource(0, taskContext, context));
        PageStream probe = right().execute(partition, taskContext);
        driver =
            new PipelineDriver(
                taskContext,
                new PageStreamSourceOperator(probe, context),
                List.of(
                    new LookupJoinOperator(
                        joinType,
                        lookupSource,
                        rightKeys,
                        right().getSchema(),
                        getSchema(),
                        taskContext.getConfig().getBatchSize(),
                        context)));
      }
      Page page = driver.nextOutput();
      if (page == null) {
        driver.close();
      }
      return page;
    }

    @Override
    protected void doClose() {
      if (driver != null) {
        driver.close();
      }
      if (shared != null) {
        shared.release();
      }
    }
  }

  @Override
  public String describe() {
    List<String> pairs = new ArrayList<>();
    for (int i = 0; i < leftKeys.size(); i++) {
      pairs.add("(" + leftKeys.get(i) + ", " + rightKeys.get(i) + ")");
    }
    return String.format(
        "HashJoinExec: mode=%s, join_type=%s, on=[%s]",
        mode, joinType, String.join(", ", pairs));
  }
}
