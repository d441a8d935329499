/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.pipeline;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.Operator;
import org.sqlexec.planner.physical.operator.SourceOperator;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.stream.AbstractPageStream;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Executes a pipeline by driving data through a chain of operators. The driver implements a
 * pull/push loop: it pulls output from upstream operators and pushes it as input to downstream
 * operators.
 *
 * <p>Execution model:
 *
 * <ol>
 *   <li>Source operator produces pages from storage or a child stream
 *   <li>Each intermediate operator transforms pages
 *   <li>The last operator either is a sink, driven to completion by {@link #run()}, or produces the
 *       pipeline output, pulled page by page via {@link #nextOutput()}
 *   <li>When the last operator is finished, the pipeline is complete
 * </ol>
 *
 * <p>The loop is resumable at every output page, so a partition's operator chain runs on the
 * thread that pulls its stream.
 */
@Log4j2
public class PipelineDriver {

  private final TaskContext taskContext;
  private final SourceOperator sourceOperator;
  private final List<Operator> operators;
  private final boolean[] finishSignalled;
  private final PipelineContext context;
  private boolean closed;

  /**
   * Creates a PipelineDriver from pre-built operators.
   *
   * @param taskContext the query the pipeline belongs to
   * @param sourceOperator the source operator
   * @param operators the intermediate operators, possibly ending with a sink
   */
  public PipelineDriver(
      TaskContext taskContext, SourceOperator sourceOperator, List<Operator> operators) {
    this.taskContext = taskContext;
    this.context = new PipelineContext();
    this.sourceOperator = sourceOperator;
    this.operators = new ArrayList<>(operators);
    this.finishSignalled = new boolean[operators.size()];
  }

  /** Runs the pipeline to completion. Used for pipelines ending with a sink. */
  public void run() {
    context.start();
    try {
      while (!isFinished()) {
        taskContext.checkCancelled();
        if (!processOnce() && !isFinished()) {
          throw new IllegalStateException("Pipeline made no progress");
        }
      }
      context.finish();
    } catch (QueryCancelledException e) {
      context.cancel();
      throw e;
    } catch (RuntimeException e) {
      context.fail(e);
      throw e;
    } finally {
      close();
    }
  }

  /**
   * Drives the pipeline until the last operator emits a non-empty page.
   *
   * @return the next output page, or null once the pipeline is finished
   */
  public Page nextOutput() {
    context.start();
    try {
      while (true) {
        Operator last = lastOperator();
        Page output = last.getOutput();
        if (output != null && output.getPositionCount() > 0) {
          context.recordOutput(output);
          return output;
        }
        if (last.isFinished()) {
          context.finish();
          return null;
        }
        if (operators.isEmpty()) {
          if (output == null) {
            throw new IllegalStateException("Source produced no page and did not finish");
          }
          continue;
        }
        taskContext.checkCancelled();
        if (!processOnce() && output == null) {
          throw new IllegalStateException("Pipeline made no progress");
        }
      }
    } catch (QueryCancelledException e) {
      context.cancel();
      throw e;
    } catch (RuntimeException e) {
      context.fail(e);
      throw e;
    }
  }

  /**
   * Processes one iteration of the pipeline loop: moves at most one page into every operator that
   * asks for input and propagates end of input. Returns true if any progress was made.
   */
  boolean processOnce() {
    boolean madeProgress = false;
    for (int i = 0; i < operators.size(); i++) {
      Operator current = operators.get(i);
      if (current.isFinished()) {
        continue;
      }
      Operator upstream = i == 0 ? sourceOperator : operators.get(i - 1);
      if (current.needsInput() && !upstream.isFinished()) {
        Page page = upstream.getOutput();
        if (page != null) {
          if (page.getPositionCount() > 0) {
            current.addInput(page);
          }
          madeProgress = true;
        }
      }
      if (upstream.isFinished() && !finishSignalled[i]) {
        finishSignalled[i] = true;
        current.finish();
        madeProgress = true;
      }
    }
    return madeProgress;
  }

  /** Returns true if the last operator has finished processing. */
  public boolean isFinished() {
    return lastOperator().isFinished();
  }

  /** Returns the pipeline execution context. */
  public PipelineContext getContext() {
    return context;
  }

  /**
   * Wraps this driver into the stream of its output pages. Operators are closed as soon as the
   * last one finishes, so an early finish (a satisfied limit) releases upstream work at once.
   */
  public PageStream asStream(Schema schema) {
    return new AbstractPageStream(schema, taskContext) {
      @Override
      protected Page computeNext() {
        Page page = nextOutput();
        if (page == null || isFinished()) {
          PipelineDriver.this.close();
        }
        return page;
      }

      @Override
      protected void doClose() {
        PipelineDriver.this.close();
      }
    };
  }

  private Operator lastOperator() {
    return operators.isEmpty() ? sourceOperator : operators.get(operators.size() - 1);
  }

  /** Closes all operators, releasing resources. Idempotent. */
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("Closing pipeline {}: {}", sourceOperator.getContext(), context);
    try {
      sourceOperator.close();
    } catch (RuntimeException e) {
      log.warn("Error closing source operator {}", sourceOperator.getContext(), e);
    }
    for (Operator op : operators) {
      try {
        op.close();
      } catch (RuntimeException e) {
        log.warn("Error closing operator {}", op.getContext(), e);
      }
    }
  }
}
