/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.storage.memory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.sqlexec.storage.StorageEngine;
import org.sqlexec.storage.Table;

/** {@link StorageEngine} over registered in-memory tables. */
public class InMemoryStorageEngine implements StorageEngine {

  private final Map<String, Table> tables = new ConcurrentHashMap<>();

  /** Registers a table under its own name, replacing any previous table of that name. */
  public InMemoryStorageEngine register(Table table) {
    tables.put(table.getName(), table);
    return this;
  }

  @Override
  public Table getTable(String name) {
    Table table = tables.get(name);
    if (table == null) {
      throw new IllegalArgumentException("Table not found: " + name);
    }
    return table;
  }
}
