/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.exchange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.exception.QueryEngineException;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.partitioning.Partitioning;

/**
 * In-process {@link OutputBuffer} with one bounded queue per output partition.
 *
 * <p>A producer waits while its target queue holds {@code capacityPages} pages, unless some open
 * output queue is empty: the consumer of that output may be the one everything else waits on (a
 * merge reading all outputs from one thread), so stalling producers then would deadlock.
 *
 * <p>A producer failure is delivered to every consumer on its next poll. Closing an output drops
 * its pages; pages later routed to it are discarded.
 */
public class LocalExchangeBuffer implements OutputBuffer {

  private final String queryId;
  private final Partitioning partitioning;
  private final int capacityPages;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final List<Deque<Page>> queues;
  private final boolean[] outputClosed;

  private int openOutputs;
  private int activeProducers;
  private long bufferedBytes;
  private Throwable failure;
  private boolean aborted;

  /**
   * Creates a buffer.
   *
   * @param queryId owning query, for cancellation errors
   * @param partitioning output partitioning
   * @param capacityPages pages per output queue before producers wait
   * @param producerCount number of producers that will call {@link #setNoMorePages()}
   */
  public LocalExchangeBuffer(
      String queryId, Partitioning partitioning, int capacityPages, int producerCount) {
    this.queryId = queryId;
    this.partitioning = partitioning;
    this.capacityPages = capacityPages;
    int outputs = partitioning.getPartitionCount();
    this.queues = new ArrayList<>(outputs);
    for (int i = 0; i < outputs; i++) {
      queues.add(new ArrayDeque<>());
    }
    this.outputClosed = new boolean[outputs];
    this.openOutputs = outputs;
    this.activeProducers = producerCount;
  }

  @Override
  public void enqueue(int partition, Page page) {
    lock.lock();
    try {
      while (!aborted && !outputClosed[partition] && isFullLocked(partition)) {
        notFull.await();
      }
      if (aborted) {
        throw new QueryCancelledException(queryId);
      }
      if (outputClosed[partition]) {
        return;
      }
      queues.get(partition).add(page);
      bufferedBytes += page.getRetainedSizeBytes();
      notEmpty.signalAll();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(queryId);
    } finally {
      lock.unlock();
    }
  }

  private boolean isFullLocked(int partition) {
    if (queues.get(partition).size() < capacityPages) {
      return false;
    }
    for (int i = 0; i < queues.size(); i++) {
      if (!outputClosed[i] && queues.get(i).isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Takes the next page of an output, waiting for producers.
   *
   * @return the next page, or null once every producer finished and the queue is drained
   */
  public Page poll(int partition) {
    lock.lock();
    try {
      while (true) {
        if (failure != null) {
          throw propagate(failure);
        }
        if (aborted) {
          throw new QueryCancelledException(queryId);
        }
        Page page = queues.get(partition).poll();
        if (page != null) {
          bufferedBytes -= page.getRetainedSizeBytes();
          notFull.signalAll();
          return page;
        }
        if (activeProducers == 0) {
          return null;
        }
        notEmpty.await();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(queryId);
    } finally {
      lock.unlock();
    }
  }

  private static RuntimeException propagate(Throwable error) {
    if (error instanceof RuntimeException) {
      return (RuntimeException) error;
    }
    if (error instanceof Error) {
      throw (Error) error;
    }
    return new QueryEngineException("Exchange producer failed", error);
  }

  @Override
  public void setNoMorePages() {
    lock.lock();
    try {
      activeProducers--;
      if (activeProducers <= 0) {
        notEmpty.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Records a producer failure; consumers rethrow it on their next poll. */
  public void fail(Throwable error) {
    lock.lock();
    try {
      if (failure == null) {
        failure = error;
      }
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes one output and drops its pages.
   *
   * @return true if this was the last open output
   */
  public boolean closeOutput(int partition) {
    lock.lock();
    try {
      if (outputClosed[partition]) {
        return false;
      }
      outputClosed[partition] = true;
      for (Page page : queues.get(partition)) {
        bufferedBytes -= page.getRetainedSizeBytes();
      }
      queues.get(partition).clear();
      openOutputs--;
      notFull.signalAll();
      return openOutputs == 0;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isFull(int partition) {
    lock.lock();
    try {
      return isFullLocked(partition);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long getBufferedBytes() {
    lock.lock();
    try {
      return bufferedBytes;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void abort() {
    lock.lock();
    try {
      aborted = true;
      queues.forEach(Deque::clear);
      bufferedBytes = 0;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isAborted() {
    lock.lock();
    try {
      return aborted;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isFinished() {
    lock.lock();
    try {
      return activeProducers <= 0 && queues.stream().allMatch(Deque::isEmpty);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Partitioning getPartitioning() {
    return partitioning;
  }
}
