/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * A primitive grouped reduction over one chunk of one row.
 * <p>
 * {@code codes[i]} is the group of {@code values[i]}, in {@code [0, groupCount)}, or negative
 * if the value belongs to no group. The result has exactly {@code groupCount} entries and a
 * group without contributing values gets {@code fillValue}. {@code dtype} is the type of the
 * values being produced. Implementations must not keep or modify the arrays passed in.
 */
@FunctionalInterface
public interface GroupedKernel {
  double[] apply(int[] codes, double[] values, int groupCount, double fillValue, DType dtype);
}
