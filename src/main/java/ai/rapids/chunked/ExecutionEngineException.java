/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * A task failed while an {@link ExecutionEngine} was running a {@link TaskGraph}. The original
 * failure is available as the cause.
 */
public class ExecutionEngineException extends GroupByException {
  private final int failedNode;

  public ExecutionEngineException(String message, int failedNode, Throwable cause) {
    super(message, cause);
    this.failedNode = failedNode;
  }

  /**
   * The id of the node whose task threw, or -1 if it is not known.
   */
  public final int getFailedNode() {
    return failedNode;
  }
}
