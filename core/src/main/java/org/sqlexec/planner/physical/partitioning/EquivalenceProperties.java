/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.partitioning;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.EqualsAndHashCode;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.ReferenceExpression;

/**
 * Classes of output columns known to hold equal values in every row, e.g. the two key columns of
 * an inner equi-join. Used to decide that a hash partitioning on one column also satisfies a
 * requirement on an equivalent column.
 */
@EqualsAndHashCode
public final class EquivalenceProperties {

  private static final EquivalenceProperties EMPTY = new EquivalenceProperties(List.of());

  private final List<Set<Integer>> classes;

  private EquivalenceProperties(List<Set<Integer>> classes) {
    this.classes = ImmutableList.copyOf(classes);
  }

  public static EquivalenceProperties empty() {
    return EMPTY;
  }

  /** Returns the equivalence classes as sets of column indexes. */
  public List<Set<Integer>> getClasses() {
    return classes;
  }

  /** Returns these properties with columns {@code a} and {@code b} declared equal. */
  public EquivalenceProperties withEquivalence(int a, int b) {
    if (a == b) {
      return this;
    }
    Set<Integer> merged = new LinkedHashSet<>();
    merged.add(a);
    merged.add(b);
    List<Set<Integer>> result = new ArrayList<>();
    for (Set<Integer> equivalenceClass : classes) {
      if (equivalenceClass.contains(a) || equivalenceClass.contains(b)) {
        merged.addAll(equivalenceClass);
      } else {
        result.add(equivalenceClass);
      }
    }
    result.add(ImmutableSet.copyOf(merged));
    return new EquivalenceProperties(result);
  }

  /** Returns the union with another input's properties whose columns start at {@code offset}. */
  public EquivalenceProperties join(EquivalenceProperties right, int offset) {
    List<Set<Integer>> result = new ArrayList<>(classes);
    for (Set<Integer> equivalenceClass : right.classes) {
      ImmutableSet.Builder<Integer> shifted = ImmutableSet.builder();
      equivalenceClass.forEach(index -> shifted.add(index + offset));
      result.add(shifted.build());
    }
    return new EquivalenceProperties(result);
  }

  /**
   * Maps the properties through a projection. {@code newIndexes[i]} is the output index of input
   * column i or -1 if the column is dropped. Classes left with fewer than two columns vanish.
   */
  public EquivalenceProperties remap(int[] newIndexes) {
    List<Set<Integer>> result = new ArrayList<>();
    for (Set<Integer> equivalenceClass : classes) {
      ImmutableSet.Builder<Integer> mapped = ImmutableSet.builder();
      for (int index : equivalenceClass) {
        if (index < newIndexes.length && newIndexes[index] >= 0) {
          mapped.add(newIndexes[index]);
        }
      }
      Set<Integer> remapped = mapped.build();
      if (remapped.size() > 1) {
        result.add(remapped);
      }
    }
    return new EquivalenceProperties(result);
  }

  /** Returns true if both expressions are known to evaluate to the same value in every row. */
  public boolean areEquivalent(Expression a, Expression b) {
    if (a instanceof ReferenceExpression && b instanceof ReferenceExpression) {
      int left = ((ReferenceExpression) a).getIndex();
      int right = ((ReferenceExpression) b).getIndex();
      if (left == right) {
        return true;
      }
      for (Set<Integer> equivalenceClass : classes) {
        if (equivalenceClass.contains(left) && equivalenceClass.contains(right)) {
          return true;
        }
      }
      return false;
    }
    return a.equals(b);
  }

  /** Returns true if both lists have the same length and are pairwise equivalent. */
  public boolean allEquivalent(List<Expression> produced, List<Expression> required) {
    if (produced.size() != required.size()) {
      return false;
    }
    for (int i = 0; i < produced.size(); i++) {
      if (!areEquivalent(produced.get(i), required.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return classes.toString();
  }
}
