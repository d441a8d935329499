/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.exception;

/** Signals a driver-initiated stop. Distinguished from real failures in the completion state. */
public class QueryCancelledException extends QueryEngineException {

  public QueryCancelledException(String queryId) {
    super("Query " + queryId + " was cancelled");
  }
}
