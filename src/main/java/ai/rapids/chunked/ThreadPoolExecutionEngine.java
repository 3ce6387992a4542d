/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task graph on a fixed pool of daemon threads. Every node is started as soon as all
 * of its dependencies completed, so independent chunks and cohorts run concurrently.
 * <p>
 * If a task fails, nodes depending on it are never run and the first failure is thrown from
 * {@link #execute(TaskGraph, int[])}.
 */
public final class ThreadPoolExecutionEngine implements ExecutionEngine, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ThreadPoolExecutionEngine.class);
  private static final AtomicInteger POOL_ID = new AtomicInteger();

  private final ExecutorService executor;
  private final int threadCount;

  public ThreadPoolExecutionEngine() {
    this(Runtime.getRuntime().availableProcessors());
  }

  public ThreadPoolExecutionEngine(int threadCount) {
    Preconditions.checkConfig(threadCount > 0,
        () -> "thread count must be positive, got " + threadCount);
    this.threadCount = threadCount;
    int poolId = POOL_ID.getAndIncrement();
    AtomicInteger threadId = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(threadCount, runnable -> {
      Thread t = new Thread(runnable,
          "chunked-groupby-" + poolId + "-" + threadId.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  public int getThreadCount() {
    return threadCount;
  }

  @Override
  public Map<Integer, Object> execute(TaskGraph graph, int[] outputs) {
    boolean[] needed = graph.needed(outputs);
    List<CompletableFuture<Object>> futures = new ArrayList<>(graph.size());
    for (TaskGraph.Node node : graph.nodes()) {
      if (!needed[node.getId()]) {
        futures.add(null);
        continue;
      }
      int[] deps = node.getDependencies();
      CompletableFuture<?>[] depFutures = new CompletableFuture<?>[deps.length];
      for (int i = 0; i < deps.length; i++) {
        depFutures[i] = futures.get(deps[i]);
      }
      CompletableFuture<Object> f = CompletableFuture.allOf(depFutures).thenApplyAsync(v -> {
        List<Object> inputs = new ArrayList<>(deps.length);
        for (CompletableFuture<?> dep : depFutures) {
          inputs.add(dep.join());
        }
        try {
          return node.run(inputs);
        } catch (RuntimeException e) {
          throw new ExecutionEngineException("task " + node.getLabel() + " failed",
              node.getId(), e);
        }
      }, executor);
      futures.add(f);
    }

    Map<Integer, Object> ret = new HashMap<>();
    try {
      for (int out : outputs) {
        ret.put(out, futures.get(out).get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(futures);
      throw new ExecutionEngineException("interrupted while waiting for tasks", -1, e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      throw unwrap(e.getCause());
    }
    return ret;
  }

  private static ExecutionEngineException unwrap(Throwable t) {
    while (t instanceof CompletionException && t.getCause() != null) {
      t = t.getCause();
    }
    if (t instanceof ExecutionEngineException) {
      return (ExecutionEngineException) t;
    }
    return new ExecutionEngineException("task failed", -1, t);
  }

  private static void cancelAll(List<CompletableFuture<Object>> futures) {
    for (CompletableFuture<Object> f : futures) {
      if (f != null) {
        f.cancel(false);
      }
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Thread pool did not terminate within 10 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while shutting down the thread pool", e);
    }
  }
}
