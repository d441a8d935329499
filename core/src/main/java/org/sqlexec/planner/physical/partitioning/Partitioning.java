/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.partitioning;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.planner.physical.page.Schema;

/** Describes how an operator's output rows are spread over its output partitions. */
@Getter
@EqualsAndHashCode
public final class Partitioning {

  /** Partitioning kind. */
  public enum Kind {
    /** One partition. */
    SINGLE,
    /** Whole pages dealt to the partitions in rotation. */
    ROUND_ROBIN,
    /** Rows routed by the hash of key expressions. */
    HASH,
    /** No known relation between rows and partitions. */
    UNKNOWN
  }

  private final Kind kind;
  private final int partitionCount;
  private final List<Expression> hashExpressions;

  private Partitioning(Kind kind, int partitionCount, List<Expression> hashExpressions) {
    Preconditions.checkArgument(partitionCount > 0, "partition count must be positive");
    this.kind = kind;
    this.partitionCount = partitionCount;
    this.hashExpressions = ImmutableList.copyOf(hashExpressions);
  }

  public static Partitioning single() {
    return new Partitioning(Kind.SINGLE, 1, List.of());
  }

  public static Partitioning roundRobin(int partitionCount) {
    return new Partitioning(Kind.ROUND_ROBIN, partitionCount, List.of());
  }

  public static Partitioning hash(List<? extends Expression> expressions, int partitionCount) {
    return new Partitioning(Kind.HASH, partitionCount, ImmutableList.copyOf(expressions));
  }

  public static Partitioning unknown(int partitionCount) {
    return new Partitioning(Kind.UNKNOWN, partitionCount, List.of());
  }

  /** Returns true if this partitioning meets the requirement. */
  public boolean satisfies(Distribution required, EquivalenceProperties equivalences) {
    switch (required.getKind()) {
      case SINGLE_PARTITION:
        return partitionCount == 1;
      case HASH:
        return kind == Kind.HASH
            && equivalences.allEquivalent(hashExpressions, required.getExpressions());
      default:
        return true;
    }
  }

  /**
   * Maps the partitioning through a projection. {@code newIndexes[i]} is the output index of input
   * column i or -1 if the column is dropped. A hash partitioning on a dropped or computed column
   * becomes unknown.
   */
  public Partitioning remap(int[] newIndexes, Schema outputSchema) {
    if (kind != Kind.HASH) {
      return this;
    }
    List<Expression> mapped = new ArrayList<>(hashExpressions.size());
    for (Expression expression : hashExpressions) {
      if (!(expression instanceof ReferenceExpression)) {
        return unknown(partitionCount);
      }
      ReferenceExpression reference = (ReferenceExpression) expression;
      int index = reference.getIndex();
      if (index >= newIndexes.length || newIndexes[index] < 0) {
        return unknown(partitionCount);
      }
      int newIndex = newIndexes[index];
      mapped.add(
          new ReferenceExpression(
              outputSchema.getField(newIndex).getName(), newIndex, reference.getType()));
    }
    return hash(mapped, partitionCount);
  }

  @Override
  public String toString() {
    switch (kind) {
      case SINGLE:
        return "SinglePartition";
      case ROUND_ROBIN:
        return "RoundRobinBatch(" + partitionCount + ")";
      case HASH:
        return "Hash(["
            + hashExpressions.stream().map(Object::toString).collect(Collectors.joining(", "))
            + "], "
            + partitionCount
            + ")";
      default:
        return "UnknownPartitioning(" + partitionCount + ")";
    }
  }
}
