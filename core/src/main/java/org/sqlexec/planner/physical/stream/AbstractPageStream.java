/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.stream;

import lombok.Getter;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Base class enforcing the single-consumption contract of {@link PageStream}: a cancellation check
 * on every pull and {@link IllegalStateException} on use after end, failure or close.
 */
public abstract class AbstractPageStream implements PageStream {

  private enum State {
    READY,
    DONE,
    FAILED,
    CLOSED
  }

  @Getter private final Schema schema;

  protected final TaskContext taskContext;

  private volatile State state = State.READY;

  protected AbstractPageStream(Schema schema, TaskContext taskContext) {
    this.schema = schema;
    this.taskContext = taskContext;
  }

  @Override
  public final Page next() {
    if (state != State.READY) {
      throw new IllegalStateException("Page stream is " + state.name().toLowerCase());
    }
    try {
      taskContext.checkCancelled();
      Page page = computeNext();
      if (page == null) {
        state = State.DONE;
      }
      return page;
    } catch (RuntimeException e) {
      state = State.FAILED;
      throw e;
    }
  }

  @Override
  public final void close() {
    if (state == State.CLOSED) {
      return;
    }
    state = State.CLOSED;
    doClose();
  }

  /** Produces the next non-empty page, or null at the end. */
  protected abstract Page computeNext();

  /** Releases held resources and upstream streams. Called at most once. */
  protected void doClose() {}
}
