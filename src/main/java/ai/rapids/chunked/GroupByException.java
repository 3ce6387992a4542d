/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Base class of every exception thrown by the chunked groupby library itself.
 */
public class GroupByException extends RuntimeException {
  GroupByException(String message) {
    super(message);
  }

  GroupByException(String message, Throwable cause) {
    super(message, cause);
  }
}
