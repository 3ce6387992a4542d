/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.EnumSet;

/**
 * The named primitive kernels available to chunk operations. The NAN prefixed variants skip
 * NaN values, the others let NaN propagate. The ARG prefixed kernels return the position of
 * the selected value inside the values passed to the kernel.
 */
public enum KernelOp {
  SUM,
  NANSUM,
  PROD,
  NANPROD,
  /** Number of elements, NaN included. */
  COUNT,
  /** Number of non-NaN elements. */
  NANCOUNT,
  MIN,
  NANMIN,
  MAX,
  NANMAX,
  MEAN,
  NANMEAN,
  /** Sum of squared differences from the group mean. */
  M2,
  NANM2,
  ARGMIN,
  NANARGMIN,
  ARGMAX,
  NANARGMAX,
  FIRST,
  NANFIRST,
  LAST,
  NANLAST,
  ARGFIRST,
  NANARGFIRST,
  ARGLAST,
  NANARGLAST,
  ANY,
  NANANY,
  ALL,
  NANALL,
  MEDIAN,
  NANMEDIAN,
  MODE,
  NANMODE;

  private static final EnumSet<KernelOp> POSITIONAL = EnumSet.of(ARGMIN, NANARGMIN, ARGMAX,
      NANARGMAX, ARGFIRST, NANARGFIRST, ARGLAST, NANARGLAST);

  // boolean values only make sense for ops that do not do arithmetic on them
  private static final EnumSet<KernelOp> NO_BOOLEAN = EnumSet.of(PROD, NANPROD, M2, NANM2,
      MEDIAN, NANMEDIAN);

  /**
   * True if the kernel returns positions instead of values.
   */
  public boolean isPositional() {
    return POSITIONAL.contains(this);
  }

  public boolean supports(DType type) {
    return !(type.isBoolean() && NO_BOOLEAN.contains(this));
  }

  /**
   * The kernel that implements this op.
   */
  public GroupedKernel kernel() {
    return GroupedKernels.forOp(this);
  }
}
