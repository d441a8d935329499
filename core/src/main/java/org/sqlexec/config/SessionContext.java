/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.sqlexec.storage.StorageEngine;

/**
 * Immutable per-session state handed explicitly to the compiler and the executor: configuration
 * and catalog. Nothing in the engine reads global session state.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class SessionContext {

  private final ExecutionConfig config;

  private final StorageEngine storageEngine;

  /** Returns a copy of this context with a different configuration. */
  public SessionContext withConfig(ExecutionConfig newConfig) {
    return new SessionContext(newConfig, storageEngine);
  }
}
