/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

/**
 * Per-group aggregate state. A partial phase calls {@link #update(Object)} per input row and emits
 * {@link #state()}; a final phase {@link #merge(Object[])}s those intermediate states and emits
 * {@link #evaluate()}. For every decomposable function, merging the states of two disjoint inputs
 * equals the state of their union.
 */
public interface Accumulator {

  /** Folds one input value in. Null values are ignored except by COUNT(*). */
  void update(Object value);

  /** Returns the intermediate representation, one value per state column. */
  Object[] state();

  /** Folds an intermediate representation produced by {@link #state()} in. */
  void merge(Object[] state);

  /** Returns the final scalar. */
  Object evaluate();

  /** Returns the estimated retained size in bytes, used for memory accounting. */
  default long getEstimatedSize() {
    return 32L;
  }
}
