/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Map;

/**
 * Runs the tasks of a {@link TaskGraph}. A node may only run once all of its dependencies
 * finished; otherwise implementations are free to order and interleave nodes. Failures are
 * not retried here.
 */
public interface ExecutionEngine {
  /**
   * Run every node the outputs depend on.
   * @param outputs ids of the nodes whose results are wanted.
   * @return the result of every output node, by id.
   * @throws ExecutionEngineException if a task failed.
   */
  Map<Integer, Object> execute(TaskGraph graph, int[] outputs);
}
