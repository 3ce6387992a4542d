/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Arrays;

/**
 * The library of primitive grouped reductions that chunk operations call by name.
 * <p>
 * Every kernel makes a single pass (two for M2, a grouped sort for the order statistics)
 * over the values it is given and allocates its own result, so the same kernel can run on
 * many chunks at once.
 */
public final class GroupedKernels {
  private GroupedKernels() {
  }

  /**
   * Run the named kernel {@code op}.
   */
  public static double[] apply(KernelOp op, int[] codes, double[] values, int groupCount,
                               double fillValue, DType dtype) {
    return forOp(op).apply(codes, values, groupCount, fillValue, dtype);
  }

  static GroupedKernel forOp(KernelOp op) {
    switch (op) {
      case SUM: return (c, v, n, f, t) -> sum(c, v, n, f, false);
      case NANSUM: return (c, v, n, f, t) -> sum(c, v, n, f, true);
      case PROD: return (c, v, n, f, t) -> prod(c, v, n, f, false);
      case NANPROD: return (c, v, n, f, t) -> prod(c, v, n, f, true);
      case COUNT: return (c, v, n, f, t) -> count(c, v, n, f, false);
      case NANCOUNT: return (c, v, n, f, t) -> count(c, v, n, f, true);
      case MIN: return (c, v, n, f, t) -> extreme(c, v, n, f, true, false);
      case NANMIN: return (c, v, n, f, t) -> extreme(c, v, n, f, true, true);
      case MAX: return (c, v, n, f, t) -> extreme(c, v, n, f, false, false);
      case NANMAX: return (c, v, n, f, t) -> extreme(c, v, n, f, false, true);
      case MEAN: return (c, v, n, f, t) -> mean(c, v, n, f, false);
      case NANMEAN: return (c, v, n, f, t) -> mean(c, v, n, f, true);
      case M2: return (c, v, n, f, t) -> m2(c, v, n, f, false);
      case NANM2: return (c, v, n, f, t) -> m2(c, v, n, f, true);
      case ARGMIN: return (c, v, n, f, t) -> argExtreme(c, v, n, f, true, false);
      case NANARGMIN: return (c, v, n, f, t) -> argExtreme(c, v, n, f, true, true);
      case ARGMAX: return (c, v, n, f, t) -> argExtreme(c, v, n, f, false, false);
      case NANARGMAX: return (c, v, n, f, t) -> argExtreme(c, v, n, f, false, true);
      case FIRST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, true, false, false);
      case NANFIRST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, true, false, true);
      case LAST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, false, false, false);
      case NANLAST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, false, false, true);
      case ARGFIRST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, true, true, false);
      case NANARGFIRST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, true, true, true);
      case ARGLAST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, false, true, false);
      case NANARGLAST: return (c, v, n, f, t) -> firstOrLast(c, v, n, f, false, true, true);
      case ANY: return (c, v, n, f, t) -> anyOrAll(c, v, n, f, true, false);
      case NANANY: return (c, v, n, f, t) -> anyOrAll(c, v, n, f, true, true);
      case ALL: return (c, v, n, f, t) -> anyOrAll(c, v, n, f, false, false);
      case NANALL: return (c, v, n, f, t) -> anyOrAll(c, v, n, f, false, true);
      case MEDIAN: return quantile(0.5, QuantileMethod.LINEAR, NaNPolicy.INCLUDE);
      case NANMEDIAN: return quantile(0.5, QuantileMethod.LINEAR, NaNPolicy.EXCLUDE);
      case MODE: return (c, v, n, f, t) -> mode(c, v, n, f, false);
      case NANMODE: return (c, v, n, f, t) -> mode(c, v, n, f, true);
      default:
        throw new IllegalArgumentException("Unsupported kernel " + op);
    }
  }

  /**
   * A kernel computing the quantile {@code q} of each group.
   * @param q the quantile, in [0, 1].
   * @param method how to interpolate between data points.
   * @param nanPolicy EXCLUDE to skip NaN values, INCLUDE to return NaN for groups holding one.
   */
  public static GroupedKernel quantile(double q, QuantileMethod method, NaNPolicy nanPolicy) {
    Preconditions.checkConfig(q >= 0 && q <= 1, () -> "quantile must be in [0, 1], got " + q);
    return (codes, values, groupCount, fill, dtype) -> {
      SortedGroups sg = SortedGroups.of(codes, values, groupCount, nanPolicy);
      double[] ret = new double[groupCount];
      for (int g = 0; g < groupCount; g++) {
        if (sg.counts[g] == 0) {
          ret[g] = sg.sawNaN[g] ? Double.NaN : fill;
        } else if (sg.sawNaN[g]) {
          ret[g] = Double.NaN;
        } else {
          ret[g] = method.select(sg.values, sg.offsets[g], sg.counts[g], q);
        }
      }
      return ret;
    };
  }

  private static boolean skip(int code, double value, boolean skipNaN) {
    return code < 0 || (skipNaN && Double.isNaN(value));
  }

  private static double[] finish(double[] acc, boolean[] seen, double fill) {
    for (int g = 0; g < acc.length; g++) {
      if (!seen[g]) {
        acc[g] = fill;
      }
    }
    return acc;
  }

  private static double[] sum(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    double[] acc = new double[n];
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      if (!skip(codes[i], values[i], skipNaN)) {
        acc[codes[i]] += values[i];
        seen[codes[i]] = true;
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] prod(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    double[] acc = new double[n];
    Arrays.fill(acc, 1.0);
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      if (!skip(codes[i], values[i], skipNaN)) {
        acc[codes[i]] *= values[i];
        seen[codes[i]] = true;
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] count(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    double[] acc = new double[n];
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      if (!skip(codes[i], values[i], skipNaN)) {
        acc[codes[i]]++;
        seen[codes[i]] = true;
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] extreme(int[] codes, double[] values, int n, double fill,
                                  boolean isMin, boolean skipNaN) {
    double[] acc = new double[n];
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      int g = codes[i];
      if (skip(g, values[i], skipNaN)) {
        continue;
      }
      if (!seen[g]) {
        acc[g] = values[i];
        seen[g] = true;
      } else {
        // Math.min and Math.max propagate NaN
        acc[g] = isMin ? Math.min(acc[g], values[i]) : Math.max(acc[g], values[i]);
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] mean(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    double[] sums = new double[n];
    long[] counts = new long[n];
    for (int i = 0; i < codes.length; i++) {
      if (!skip(codes[i], values[i], skipNaN)) {
        sums[codes[i]] += values[i];
        counts[codes[i]]++;
      }
    }
    for (int g = 0; g < n; g++) {
      sums[g] = counts[g] == 0 ? fill : sums[g] / counts[g];
    }
    return sums;
  }

  private static double[] m2(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    double[] means = mean(codes, values, n, Double.NaN, skipNaN);
    double[] acc = new double[n];
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      int g = codes[i];
      if (!skip(g, values[i], skipNaN)) {
        double d = values[i] - means[g];
        acc[g] += d * d;
        seen[g] = true;
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] argExtreme(int[] codes, double[] values, int n, double fill,
                                     boolean isMin, boolean skipNaN) {
    double[] best = new double[n];
    int[] pos = new int[n];
    Arrays.fill(pos, -1);
    for (int i = 0; i < codes.length; i++) {
      int g = codes[i];
      double v = values[i];
      if (skip(g, v, skipNaN)) {
        continue;
      }
      if (pos[g] < 0) {
        best[g] = v;
        pos[g] = i;
      } else if (Double.isNaN(best[g])) {
        // the first NaN wins and nothing replaces it
        continue;
      } else if (Double.isNaN(v) || (isMin ? v < best[g] : v > best[g])) {
        best[g] = v;
        pos[g] = i;
      }
    }
    double[] ret = new double[n];
    for (int g = 0; g < n; g++) {
      ret[g] = pos[g] < 0 ? fill : pos[g];
    }
    return ret;
  }

  private static double[] firstOrLast(int[] codes, double[] values, int n, double fill,
                                      boolean first, boolean positional, boolean skipNaN) {
    int[] pos = new int[n];
    Arrays.fill(pos, -1);
    for (int i = 0; i < codes.length; i++) {
      int g = codes[i];
      if (skip(g, values[i], skipNaN)) {
        continue;
      }
      if (!first || pos[g] < 0) {
        pos[g] = i;
      }
    }
    double[] ret = new double[n];
    for (int g = 0; g < n; g++) {
      if (pos[g] < 0) {
        ret[g] = fill;
      } else {
        ret[g] = positional ? pos[g] : values[pos[g]];
      }
    }
    return ret;
  }

  private static double[] anyOrAll(int[] codes, double[] values, int n, double fill,
                                   boolean any, boolean skipNaN) {
    double[] acc = new double[n];
    Arrays.fill(acc, any ? 0 : 1);
    boolean[] seen = new boolean[n];
    for (int i = 0; i < codes.length; i++) {
      int g = codes[i];
      if (skip(g, values[i], skipNaN)) {
        continue;
      }
      seen[g] = true;
      // NaN is truthy
      boolean truthy = values[i] != 0;
      if (any && truthy) {
        acc[g] = 1;
      } else if (!any && !truthy) {
        acc[g] = 0;
      }
    }
    return finish(acc, seen, fill);
  }

  private static double[] mode(int[] codes, double[] values, int n, double fill, boolean skipNaN) {
    SortedGroups sg = SortedGroups.of(codes, values, n,
        skipNaN ? NaNPolicy.EXCLUDE : NaNPolicy.INCLUDE);
    double[] ret = new double[n];
    for (int g = 0; g < n; g++) {
      if (sg.sawNaN[g]) {
        ret[g] = Double.NaN;
        continue;
      }
      if (sg.counts[g] == 0) {
        ret[g] = fill;
        continue;
      }
      int from = sg.offsets[g];
      int end = from + sg.counts[g];
      double bestValue = sg.values[from];
      int bestRun = 0;
      int i = from;
      while (i < end) {
        int j = i;
        while (j < end && sg.values[j] == sg.values[i]) {
          j++;
        }
        // ties keep the smaller value, which comes first
        if (j - i > bestRun) {
          bestRun = j - i;
          bestValue = sg.values[i];
        }
        i = j;
      }
      ret[g] = bestValue;
    }
    return ret;
  }

  /**
   * The non-NaN values of every group, sorted, laid out one group after the other.
   */
  private static final class SortedGroups {
    final double[] values;
    final int[] offsets;
    final int[] counts;
    // only tracked when NaN values are included, a group holding one has a NaN result
    final boolean[] sawNaN;

    private SortedGroups(double[] values, int[] offsets, int[] counts, boolean[] sawNaN) {
      this.values = values;
      this.offsets = offsets;
      this.counts = counts;
      this.sawNaN = sawNaN;
    }

    static SortedGroups of(int[] codes, double[] values, int n, NaNPolicy nanPolicy) {
      int[] counts = new int[n];
      boolean[] sawNaN = new boolean[n];
      int total = 0;
      for (int i = 0; i < codes.length; i++) {
        int g = codes[i];
        if (g < 0) {
          continue;
        }
        if (Double.isNaN(values[i])) {
          if (nanPolicy.includeNaNs) {
            sawNaN[g] = true;
          }
        } else {
          counts[g]++;
          total++;
        }
      }
      int[] offsets = new int[n];
      for (int g = 1; g < n; g++) {
        offsets[g] = offsets[g - 1] + counts[g - 1];
      }
      double[] buffer = new double[total];
      int[] fillPos = offsets.clone();
      for (int i = 0; i < codes.length; i++) {
        int g = codes[i];
        if (g >= 0 && !Double.isNaN(values[i])) {
          buffer[fillPos[g]++] = values[i];
        }
      }
      for (int g = 0; g < n; g++) {
        Arrays.sort(buffer, offsets[g], offsets[g] + counts[g]);
      }
      return new SortedGroups(buffer, offsets, counts, sawNaN);
    }
  }
}
