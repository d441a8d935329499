/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.config.SessionContext;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.plan.PlanFormatter;
import org.sqlexec.planner.physical.planner.DefaultPhysicalPlanner;
import org.sqlexec.planner.physical.planner.PhysicalPlanner;
import org.sqlexec.planner.physical.stream.AbstractPageStream;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * Entry point of the engine: compiles logical plans within a {@link SessionContext} and runs the
 * resulting physical plans.
 */
@Log4j2
public class ExecutionDriver {

  @Getter private final SessionContext session;

  private final PhysicalPlanner planner;

  public ExecutionDriver(SessionContext session) {
    this(session, new DefaultPhysicalPlanner(session));
  }

  public ExecutionDriver(SessionContext session, PhysicalPlanner planner) {
    this.session = session;
    this.planner = planner;
  }

  /**
   * Compiles a logical plan.
   *
   * @throws org.sqlexec.exception.CompileException if the plan cannot be compiled
   */
  public ExecutionPlan compile(LogicalPlan plan) {
    return planner.plan(plan);
  }

  /** Compiles a logical plan and returns its explain text. */
  public String explain(LogicalPlan plan) {
    return PlanFormatter.format(compile(plan));
  }

  /**
   * Starts every output partition of the plan. The streams are lazy and may be pulled from
   * different threads; a failure in any of them is recorded in {@code taskContext} and cancels
   * the others.
   */
  public List<PageStream> execute(ExecutionPlan plan, TaskContext taskContext) {
    int partitions = plan.getOutputPartitioning().getPartitionCount();
    log.info(
        "Executing query {} with {} output partitions", taskContext.getQueryId(), partitions);
    List<PageStream> streams = new ArrayList<>(partitions);
    for (int partition = 0; partition < partitions; partition++) {
      streams.add(new FailureRecordingStream(plan.execute(partition, taskContext), taskContext));
    }
    return streams;
  }

  /** Runs the plan in a new {@link TaskContext}, one task per output partition. */
  public QueryExecution submit(ExecutionPlan plan) {
    TaskContext taskContext = TaskContext.create(session.getConfig());
    LocalQueryExecution execution = new LocalQueryExecution(plan, taskContext);
    execution.start(execute(plan, taskContext));
    return execution;
  }

  /** Compiles and runs a logical plan and waits for its result. */
  public QueryResult run(LogicalPlan plan) {
    return submit(compile(plan)).getResult();
  }

  /** Forwards the pages of one output partition and records its failure in the query. */
  private static class FailureRecordingStream extends AbstractPageStream {
    private final PageStream delegate;

    FailureRecordingStream(PageStream delegate, TaskContext taskContext) {
      super(delegate.getSchema(), taskContext);
      this.delegate = delegate;
    }

    @Override
    protected Page computeNext() {
      try {
        return delegate.next();
      } catch (QueryCancelledException e) {
        throw e;
      } catch (RuntimeException | Error e) {
        taskContext.fail(e);
        throw e;
      }
    }

    @Override
    protected void doClose() {
      delegate.close();
    }
  }
}
