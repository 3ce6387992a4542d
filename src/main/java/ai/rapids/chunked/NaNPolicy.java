/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Specify whether to include NaN values in a reduction or skip them. EXCLUDE gives the
 * nan-skipping variants (nansum, nanmean, ...).
 */
public enum NaNPolicy {
  /**
   * NaN values take part in the reduction and usually make the result NaN.
   */
  INCLUDE(true),
  /**
   * NaN values are ignored, as if the element did not exist.
   */
  EXCLUDE(false);

  NaNPolicy(boolean includeNaNs) {
    this.includeNaNs = includeNaNs;
  }

  final boolean includeNaNs;

  /**
   * True if an element with the given value contributes to a group under this policy.
   */
  boolean contributes(double value) {
    return includeNaNs || !Double.isNaN(value);
  }
}
