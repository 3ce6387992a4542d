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

/**
 * Runs a task graph on the calling thread in node id order. Intermediate results are
 * dropped as soon as their last consumer ran.
 */
public final class SerialExecutionEngine implements ExecutionEngine {
  private static final Logger log = LoggerFactory.getLogger(SerialExecutionEngine.class);

  public static final SerialExecutionEngine INSTANCE = new SerialExecutionEngine();

  @Override
  public Map<Integer, Object> execute(TaskGraph graph, int[] outputs) {
    boolean[] needed = graph.needed(outputs);
    boolean[] isOutput = new boolean[graph.size()];
    for (int out : outputs) {
      isOutput[out] = true;
    }
    int[] pendingConsumers = new int[graph.size()];
    for (TaskGraph.Node node : graph.nodes()) {
      if (needed[node.getId()]) {
        for (int dep : node.getDependencies()) {
          pendingConsumers[dep]++;
        }
      }
    }
    Object[] results = new Object[graph.size()];
    int ran = 0;
    for (TaskGraph.Node node : graph.nodes()) {
      int id = node.getId();
      if (!needed[id]) {
        continue;
      }
      int[] deps = node.getDependencies();
      List<Object> inputs = new ArrayList<>(deps.length);
      for (int dep : deps) {
        inputs.add(results[dep]);
      }
      try {
        results[id] = node.run(inputs);
      } catch (RuntimeException e) {
        throw new ExecutionEngineException("task " + node.getLabel() + " failed", id, e);
      }
      ran++;
      for (int dep : deps) {
        if (--pendingConsumers[dep] == 0 && !isOutput[dep]) {
          results[dep] = null;
        }
      }
    }
    log.trace("Ran {} of {} tasks", ran, graph.size());
    Map<Integer, Object> ret = new HashMap<>();
    for (int out : outputs) {
      ret.put(out, results[out]);
    }
    return ret;
  }
}
