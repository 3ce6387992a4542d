/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Thrown when a reduction is set up in a way that cannot work: a malformed blueprint, an
 * infeasible explicit method, key and data lengths that do not line up, or a dtype an
 * operation does not support. Raised before any partition work is scheduled.
 */
public class GroupByConfigurationException extends GroupByException {
  public GroupByConfigurationException(String message) {
    super(message);
  }

  public GroupByConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
