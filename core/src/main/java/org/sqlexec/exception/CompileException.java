/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.exception;

/**
 * Raised when a logical plan cannot be lowered into a physical plan: unsupported expression,
 * non-decomposable aggregate, type mismatch. Always surfaces before any execution starts.
 */
public class CompileException extends QueryEngineException {

  public CompileException(String message) {
    super(message);
  }
}
