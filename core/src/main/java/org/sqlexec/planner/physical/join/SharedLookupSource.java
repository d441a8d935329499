/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.join;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.exception.QueryCancelledException;
import org.sqlexec.exception.QueryEngineException;

/**
 * The build side of a CollectLeft join, shared by all probe partitions of one execution. The first
 * partition to ask builds it on its own thread; the others wait on the same future and then read
 * it concurrently. The reference is dropped when the last probe partition releases it.
 */
@Log4j2
public class SharedLookupSource {

  private final String queryId;
  private final AtomicReference<CompletableFuture<LookupSource>> future = new AtomicReference<>();
  private final AtomicInteger remainingProbes;

  public SharedLookupSource(String queryId, int probePartitions) {
    this.queryId = queryId;
    this.remainingProbes = new AtomicInteger(probePartitions);
  }

  /**
   * Returns the lookup source, building it with {@code builder} if no partition did so yet.
   * A build failure is rethrown to every waiting partition.
   */
  public LookupSource acquire(Supplier<LookupSource> builder) {
    CompletableFuture<LookupSource> candidate = new CompletableFuture<>();
    if (future.compareAndSet(null, candidate)) {
      try {
        candidate.complete(builder.get());
      } catch (RuntimeException | Error e) {
        candidate.completeExceptionally(e);
        throw e;
      }
    }
    try {
      LookupSource source = future.get().get();
      if (source == null) {
        throw new IllegalStateException("Lookup source was already released");
      }
      return source;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(queryId);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new QueryEngineException("Building the join lookup source failed", cause);
    }
  }

  /** Called once by every probe partition when it closes. */
  public void release() {
    if (remainingProbes.decrementAndGet() == 0) {
      future.set(CompletableFuture.completedFuture(null));
      log.debug("Released shared lookup source of query {}", queryId);
    }
  }
}
