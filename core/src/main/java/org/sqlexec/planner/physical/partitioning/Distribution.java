/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.partitioning;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.expression.Expression;

/** What an operator requires of the partitioning of one of its children. */
@Getter
@EqualsAndHashCode
public final class Distribution {

  /** Requirement kind. */
  public enum Kind {
    UNSPECIFIED,
    SINGLE_PARTITION,
    HASH
  }

  private static final Distribution UNSPECIFIED = new Distribution(Kind.UNSPECIFIED, List.of());
  private static final Distribution SINGLE = new Distribution(Kind.SINGLE_PARTITION, List.of());

  private final Kind kind;
  private final List<Expression> expressions;

  private Distribution(Kind kind, List<Expression> expressions) {
    this.kind = kind;
    this.expressions = ImmutableList.copyOf(expressions);
  }

  public static Distribution unspecified() {
    return UNSPECIFIED;
  }

  public static Distribution singlePartition() {
    return SINGLE;
  }

  /** Rows with equal values of {@code expressions} must be in the same partition. */
  public static Distribution hash(List<? extends Expression> expressions) {
    return new Distribution(Kind.HASH, ImmutableList.copyOf(expressions));
  }

  @Override
  public String toString() {
    switch (kind) {
      case SINGLE_PARTITION:
        return "SinglePartition";
      case HASH:
        return "HashPartitioned(" + expressions + ")";
      default:
        return "Unspecified";
    }
  }
}
