/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.operator.PageStreamSourceOperator;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.pipeline.PipelineDriver;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.stream.AbstractPageStream;
import org.sqlexec.planner.physical.stream.PageStream;

/**
 * One execution of an exchange: a producer task per input partition drives the input through an
 * {@link ExchangeSinkOperator} into a {@link LocalExchangeBuffer}, and each output partition reads
 * its queue.
 *
 * <p>Producers start when the first output is opened. Closing the last output aborts the buffer,
 * interrupts the producers and waits up to the cancellation timeout for them to close their inputs.
 * Query cancellation aborts the buffer without waiting; the outputs' consumers wait when they
 * close.
 */
@Log4j2
public class LocalExchange {

  private final String operatorId;
  private final ExecutionPlan input;
  private final Partitioning partitioning;
  private final TaskContext taskContext;
  private final LocalExchangeBuffer buffer;
  private final CountDownLatch producersDone;
  private final Set<Thread> producerThreads = new HashSet<>();
  private final boolean[] outputOpened;

  private boolean started;
  private boolean shutdown;

  public LocalExchange(
      String operatorId, ExecutionPlan input, Partitioning partitioning, TaskContext taskContext) {
    this.operatorId = operatorId;
    this.input = input;
    this.partitioning = partitioning;
    this.taskContext = taskContext;
    int producers = input.getOutputPartitioning().getPartitionCount();
    this.buffer =
        new LocalExchangeBuffer(
            taskContext.getQueryId(),
            partitioning,
            taskContext.getConfig().getExchangeBufferPages(),
            producers);
    this.producersDone = new CountDownLatch(producers);
    this.outputOpened = new boolean[partitioning.getPartitionCount()];
    taskContext.addCancelListener(buffer::abort);
  }

  /** Opens an output partition, starting the producers on first use. Each output opens once. */
  public PageStream openOutput(int partition) {
    synchronized (this) {
      if (outputOpened[partition]) {
        throw new IllegalStateException(
            "Output " + partition + " of " + operatorId + " is already open");
      }
      outputOpened[partition] = true;
      start();
    }
    return new AbstractPageStream(input.getSchema(), taskContext) {
      @Override
      protected Page computeNext() {
        return buffer.poll(partition);
      }

      @Override
      protected void doClose() {
        if (buffer.closeOutput(partition)) {
          shutdown();
        }
      }
    };
  }

  private void start() {
    if (started || shutdown) {
      return;
    }
    started = true;
    int producers = input.getOutputPartitioning().getPartitionCount();
    log.debug("Starting {} producers of {} into {}", producers, operatorId, partitioning);
    for (int i = 0; i < producers; i++) {
      int inputPartition = i;
      taskContext.getExecutor().execute(() -> runProducer(inputPartition));
    }
  }

  private void runProducer(int inputPartition) {
    Thread current = Thread.currentThread();
    synchronized (producerThreads) {
      producerThreads.add(current);
    }
    try {
      if (buffer.isAborted()) {
        return;
      }
      OperatorContext context = OperatorContext.create(operatorId, inputPartition, taskContext);
      PageStream stream = input.execute(inputPartition, taskContext);
      PipelineDriver driver =
          new PipelineDriver(
              taskContext,
              new PageStreamSourceOperator(stream, context),
              List.of(
                  new ExchangeSinkOperator(
                      buffer, PartitionFunction.create(partitioning, inputPartition), context)));
      driver.run();
    } catch (QueryCancelledException e) {
      log.debug("Producer {} of {} stopped: {}", inputPartition, operatorId, e.getMessage());
    } catch (RuntimeException | Error e) {
      buffer.fail(e);
      taskContext.fail(e);
    } finally {
      synchronized (producerThreads) {
        producerThreads.remove(current);
      }
      // drop an interrupt aimed at this producer before the pool reuses the thread
      Thread.interrupted();
      buffer.setNoMorePages();
      producersDone.countDown();
    }
  }

  /** Aborts the exchange and waits for its producers to release their inputs. */
  public void shutdown() {
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
    }
    buffer.abort();
    synchronized (producerThreads) {
      producerThreads.forEach(Thread::interrupt);
    }
    if (!started) {
      return;
    }
    long timeout = taskContext.getConfig().getCancellationTimeoutMillis();
    try {
      if (!producersDone.await(timeout, TimeUnit.MILLISECONDS)) {
        log.warn(
            "Producers of {} did not stop within {} ms in query {}",
            operatorId,
            timeout,
            taskContext.getQueryId());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for producers of {} to stop", operatorId);
    }
  }
}
