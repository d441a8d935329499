/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.exception;

import lombok.Getter;

/**
 * Raised when an operator's retained state (lookup source, aggregation groups, sort buffer)
 * exceeds its memory limit. No spill is attempted.
 */
@Getter
public class ResourceExhaustedException extends QueryEngineException {

  private final String operatorId;
  private final long requestedBytes;
  private final long limitBytes;

  public ResourceExhaustedException(String operatorId, long requestedBytes, long limitBytes) {
    super(
        String.format(
            "Operator %s exceeded its memory limit: %d bytes requested, limit is %d bytes",
            operatorId, requestedBytes, limitBytes));
    this.operatorId = operatorId;
    this.requestedBytes = requestedBytes;
    this.limitBytes = limitBytes;
  }
}
