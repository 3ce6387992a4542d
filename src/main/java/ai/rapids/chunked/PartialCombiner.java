/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Merges the intermediate tuples of one output cell from two partial results. Used when the
 * slots of a blueprint cannot be combined independently of each other.
 * <p>
 * Implementations must be associative and commutative and must not modify their inputs.
 * A side with a count of zero had no contributing elements and its slots hold fill values.
 */
@FunctionalInterface
public interface PartialCombiner {
  double[] combine(double[] left, long leftCount, double[] right, long rightCount);
}
