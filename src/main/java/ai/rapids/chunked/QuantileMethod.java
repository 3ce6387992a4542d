/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Interpolation method to use when the desired quantile lies between
 * two data points i and j.
 */
public enum QuantileMethod {

  /**
   * Linear interpolation between i and j
   */
  LINEAR {
    @Override
    double interpolate(double lower, double upper, double fraction, double position) {
      return lower + (upper - lower) * fraction;
    }
  },
  /**
   * Lower data point (i)
   */
  LOWER {
    @Override
    double interpolate(double lower, double upper, double fraction, double position) {
      return lower;
    }
  },
  /**
   * Higher data point (j)
   */
  HIGHER {
    @Override
    double interpolate(double lower, double upper, double fraction, double position) {
      return fraction == 0 ? lower : upper;
    }
  },
  /**
   * (i + j)/2
   */
  MIDPOINT {
    @Override
    double interpolate(double lower, double upper, double fraction, double position) {
      return fraction == 0 ? lower : (lower + upper) / 2;
    }
  },
  /**
   * i or j, whichever is nearest. Halfway cases round to the even position.
   */
  NEAREST {
    @Override
    double interpolate(double lower, double upper, double fraction, double position) {
      return Math.rint(position) == Math.floor(position) ? lower : upper;
    }
  };

  abstract double interpolate(double lower, double upper, double fraction, double position);

  /**
   * Compute the quantile {@code q} of {@code length} sorted values starting at {@code from}.
   */
  double select(double[] sorted, int from, int length, double q) {
    assert length > 0;
    double position = (length - 1) * q;
    int lo = (int) Math.floor(position);
    int hi = Math.min(lo + 1, length - 1);
    return interpolate(sorted[from + lo], sorted[from + hi], position - lo, position);
  }
}
