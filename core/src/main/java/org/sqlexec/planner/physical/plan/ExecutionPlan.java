/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

import java.util.Collections;
import java.util.List;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.EquivalenceProperties;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * A node of a compiled physical plan. Nodes are immutable and hold no runtime state: everything
 * one execution shares between partitions lives in the {@link TaskContext}, so a plan can be
 * executed several times.
 */
public interface ExecutionPlan {

  /** Returns the type of this physical operator. */
  PhysicalOperatorType getOperatorType();

  /** Returns the schema of every page this node produces. */
  Schema getSchema();

  List<ExecutionPlan> getChildren();

  /** Returns a copy of this node over different children with the same schemas. */
  ExecutionPlan withNewChildren(List<ExecutionPlan> children);

  /** Returns how output rows are spread over output partitions. */
  Partitioning getOutputPartitioning();

  /** Returns the sort order every output partition follows, empty if none. */
  default List<SortKey> getOutputOrdering() {
    return List.of();
  }

  /** Returns one distribution requirement per child. */
  default List<Distribution> getRequiredInputDistribution() {
    return Collections.nCopies(getChildren().size(), Distribution.unspecified());
  }

  /** Returns the output columns known to be equal. */
  default EquivalenceProperties getEquivalenceProperties() {
    return EquivalenceProperties.empty();
  }

  /**
   * Starts one output partition. The returned stream is lazy: work happens as pages are pulled.
   *
   * @param partition output partition in [0, getOutputPartitioning().getPartitionCount())
   * @param taskContext the execution this partition belongs to
   */
  PageStream execute(int partition, TaskContext taskContext);

  /** Returns the one-line explain text of this node. */
  String describe();
}
