/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage;

import org.sqlexec.planner.physical.page.Page;

/** Reader over one {@link Split}. */
public interface PageSource extends AutoCloseable {

  /** Returns the next page, or null when the split is exhausted. */
  Page getNextPage();

  /** Releases the reader. Called exactly once, also when the split was not read to the end. */
  @Override
  void close();
}
