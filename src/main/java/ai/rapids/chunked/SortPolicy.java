/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * How codes are assigned to key values found in the data when no expected groups are given.
 */
public enum SortPolicy {
  /**
   * Codes follow the natural ordering of the values, so the group order is deterministic.
   */
  SORTED,
  /**
   * Codes follow the order in which values first appear along the reduced axis.
   */
  FIRST_SEEN
}
