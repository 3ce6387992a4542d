/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Thrown when the input data itself makes a reduction impossible, for example keys that are
 * all missing with no expected groups to size the output, or bin edges that are not finite.
 * These are fatal for the call and are never retried.
 */
public class GroupByDataException extends GroupByException {
  public GroupByDataException(String message) {
    super(message);
  }
}
