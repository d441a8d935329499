/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.partitioning.Partitioning;

/**
 * Buffers pages between the producers of an exchange and the consumers of its output partitions.
 * Provides back-pressure to prevent producers from overwhelming consumers.
 */
public interface OutputBuffer {

  /**
   * Enqueues a page for delivery to one output partition. Blocks while the output is full.
   *
   * @param partition the output partition
   * @param page the page to send
   */
  void enqueue(int partition, Page page);

  /** Signals that one producer will enqueue no more pages. */
  void setNoMorePages();

  /** Returns true if the producer should wait before adding to the given output (back-pressure). */
  boolean isFull(int partition);

  /** Returns the total size of buffered data in bytes. */
  long getBufferedBytes();

  /** Aborts the buffer, discarding any buffered pages and releasing blocked producers. */
  void abort();

  /** Returns true if all pages have been consumed and no more will be produced. */
  boolean isFinished();

  /** Returns the partitioning scheme for this buffer's output. */
  Partitioning getPartitioning();
}
