/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.plan.CoalesceBatchesExec;
import org.sqlexec.planner.physical.plan.CoalescePartitionsExec;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.plan.RepartitionExec;
import org.sqlexec.planner.physical.plan.SortPreservingMergeExec;

/**
 * Interposes exchanges between a node and those children whose output partitioning does not meet
 * the node's required input distribution.
 *
 * <ul>
 *   <li>Hash: a hash {@link RepartitionExec} on the required expressions into the target number
 *       of partitions, unless the child is already hash partitioned on equivalent expressions
 *       into that many partitions.
 *   <li>Single partition: a {@link SortPreservingMergeExec} on the child's ordering when it has
 *       one, a {@link CoalescePartitionsExec} otherwise.
 * </ul>
 */
@Log4j2
@RequiredArgsConstructor
public class DistributionEnforcer {

  private final ExecutionConfig config;

  /** Returns {@code plan} with every child meeting its required distribution. */
  public ExecutionPlan enforce(ExecutionPlan plan) {
    List<Distribution> required = plan.getRequiredInputDistribution();
    List<ExecutionPlan> children = plan.getChildren();
    List<ExecutionPlan> enforced = new ArrayList<>(children.size());
    boolean changed = false;
    for (int i = 0; i < children.size(); i++) {
      ExecutionPlan child = children.get(i);
      ExecutionPlan satisfied = satisfy(child, required.get(i));
      changed |= satisfied != child;
      enforced.add(satisfied);
    }
    return changed ? plan.withNewChildren(enforced) : plan;
  }

  /** Returns {@code child}, with an exchange above it if it does not meet {@code required}. */
  public ExecutionPlan distribute(ExecutionPlan child, Distribution required) {
    return satisfy(child, required);
  }

  private ExecutionPlan satisfy(ExecutionPlan child, Distribution required) {
    Partitioning produced = child.getOutputPartitioning();
    switch (required.getKind()) {
      case SINGLE_PARTITION:
        if (produced.getPartitionCount() == 1) {
          return child;
        }
        List<SortKey> ordering = child.getOutputOrdering();
        log.debug("Collapsing {} partitions of {}", produced.getPartitionCount(), child.describe());
        return ordering.isEmpty()
            ? new CoalescePartitionsExec(child)
            : new SortPreservingMergeExec(child, ordering, null);
      case HASH:
        int target = config.getTargetPartitions();
        if (produced.getPartitionCount() == target
            && produced.satisfies(required, child.getEquivalenceProperties())) {
          return child;
        }
        log.debug("Hash repartitioning {} on {}", child.describe(), required.getExpressions());
        return coalesceBatches(
            new RepartitionExec(child, Partitioning.hash(required.getExpressions(), target)));
      default:
        return child;
    }
  }

  /** Adds a {@link CoalesceBatchesExec} above {@code plan} when batch coalescing is enabled. */
  public ExecutionPlan coalesceBatches(ExecutionPlan plan) {
    if (!config.isCoalesceBatches()) {
      return plan;
    }
    return new CoalesceBatchesExec(plan, config.getBatchSize());
  }
}
