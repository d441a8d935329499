/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage;

/** Catalog collaborator giving the engine access to tables. */
public interface StorageEngine {

  /**
   * Get {@link Table} from storage engine.
   *
   * @throws IllegalArgumentException if no table has that name
   */
  Table getTable(String name);
}
