/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.exception;

/**
 * Raised when a page read from upstream is malformed (schema mismatch, value of the wrong class)
 * or a row cannot be evaluated. The partition halts; rows are never skipped.
 */
public class UpstreamDataException extends QueryEngineException {

  public UpstreamDataException(String message) {
    super(message);
  }

  public UpstreamDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
