/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.plan;

/** The closed set of physical operator kinds. */
public enum PhysicalOperatorType {

  /** Table scan operator - reads splits from storage. */
  SCAN,

  /** Filter operator - applies predicates to rows. */
  FILTER,

  /** Projection operator - computes and selects columns. */
  PROJECTION,

  /** Re-chunks pages to the target batch size. */
  COALESCE_BATCHES,

  /** Merges all partitions into one. */
  COALESCE_PARTITIONS,

  /** Redistributes rows to a new partitioning. */
  REPARTITION,

  /** Partial or final hash aggregation. */
  AGGREGATE,

  /** Hash equi-join. */
  HASH_JOIN,

  /** Sort of each partition. */
  SORT,

  /** K-way merge of sorted partitions. */
  SORT_PRESERVING_MERGE,

  /** Per-partition limit. */
  LOCAL_LIMIT,

  /** Single-partition skip and fetch. */
  GLOBAL_LIMIT,

  /** Concatenation of the partitions of several inputs. */
  UNION,

  /** Window functions over sorted window partitions. */
  WINDOW
}
