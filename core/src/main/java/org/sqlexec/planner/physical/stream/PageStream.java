/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.stream;

import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * The output of one partition: an ordered, lazy, finite sequence of pages that can be consumed
 * once.
 *
 * <p>Usage:
 *
 * <ol>
 *   <li>Call {@link #next()} until it returns null (end of stream) or throws
 *   <li>Call {@link #close()} to release the stream and everything upstream of it, also when the
 *       stream was not read to the end
 * </ol>
 */
public interface PageStream extends AutoCloseable {

  /** Returns the schema of every page of this stream. */
  Schema getSchema();

  /**
   * Returns the next page, or null at the end of the stream. Pages are never empty.
   *
   * @throws IllegalStateException if called after the end, after a failure or after close
   */
  Page next();

  /** Releases the stream. Idempotent. */
  @Override
  void close();
}
