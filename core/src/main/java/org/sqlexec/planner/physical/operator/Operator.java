/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.planner.physical.page.Page;

/**
 * A step of a partition's operator chain. The {@link
 * org.sqlexec.planner.physical.pipeline.PipelineDriver} moves pages between neighbouring
 * operators: it offers a page to an operator that {@link #needsInput()}, pulls whatever the
 * operator has ready through {@link #getOutput()} and calls {@link #finish()} once the upstream
 * operator is done.
 *
 * <p>Only a source may wait on other partitions, through the stream it reads (exchange outputs,
 * CollectLeft builds). State that grows with the input is charged to {@link
 * OperatorContext#checkMemory(long)}.
 */
public interface Operator extends AutoCloseable {

  /** Returns true if the driver may call {@link #addInput(Page)} now. */
  boolean needsInput();

  /**
   * Hands a non-empty input page to the operator.
   *
   * @throws IllegalStateException if the operator does not need input
   */
  void addInput(Page page);

  /** Returns a ready output page, or null if there is none right now. */
  Page getOutput();

  /** Returns true once the operator will produce no further output. */
  boolean isFinished();

  /** Tells the operator its input is complete; buffered rows become available as output. */
  void finish();

  OperatorContext getContext();

  /** Releases held pages and state. May be called before the operator finished. */
  @Override
  default void close() {}
}
