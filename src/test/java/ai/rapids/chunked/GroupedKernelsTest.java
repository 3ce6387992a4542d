/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertThrows;

class GroupedKernelsTest extends GroupByTestBase {
  private static final double NAN = Double.NaN;
  private static final double FILL = -7;
  // group 2 has no elements, position 4 belongs to no group
  private static final int[] CODES = {0, 1, 0, 1, Factorizer.MISSING, 0};
  private static final double[] VALUES = {1, NAN, 3, 4, 100, 2};

  static Stream<Arguments> kernels() {
    return Stream.of(
        Arguments.of(KernelOp.SUM, new double[]{6, NAN, FILL}),
        Arguments.of(KernelOp.NANSUM, new double[]{6, 4, FILL}),
        Arguments.of(KernelOp.PROD, new double[]{6, NAN, FILL}),
        Arguments.of(KernelOp.NANPROD, new double[]{6, 4, FILL}),
        Arguments.of(KernelOp.COUNT, new double[]{3, 2, FILL}),
        Arguments.of(KernelOp.NANCOUNT, new double[]{3, 1, FILL}),
        Arguments.of(KernelOp.MIN, new double[]{1, NAN, FILL}),
        Arguments.of(KernelOp.NANMIN, new double[]{1, 4, FILL}),
        Arguments.of(KernelOp.MAX, new double[]{3, NAN, FILL}),
        Arguments.of(KernelOp.NANMAX, new double[]{3, 4, FILL}),
        Arguments.of(KernelOp.MEAN, new double[]{2, NAN, FILL}),
        Arguments.of(KernelOp.NANMEAN, new double[]{2, 4, FILL}),
        Arguments.of(KernelOp.M2, new double[]{2, NAN, FILL}),
        Arguments.of(KernelOp.NANM2, new double[]{2, 0, FILL}),
        Arguments.of(KernelOp.ARGMIN, new double[]{0, 1, FILL}),
        Arguments.of(KernelOp.NANARGMIN, new double[]{0, 3, FILL}),
        Arguments.of(KernelOp.ARGMAX, new double[]{2, 1, FILL}),
        Arguments.of(KernelOp.NANARGMAX, new double[]{2, 3, FILL}),
        Arguments.of(KernelOp.FIRST, new double[]{1, NAN, FILL}),
        Arguments.of(KernelOp.NANFIRST, new double[]{1, 4, FILL}),
        Arguments.of(KernelOp.LAST, new double[]{2, 4, FILL}),
        Arguments.of(KernelOp.NANLAST, new double[]{2, 4, FILL}),
        Arguments.of(KernelOp.ARGFIRST, new double[]{0, 1, FILL}),
        Arguments.of(KernelOp.NANARGFIRST, new double[]{0, 3, FILL}),
        Arguments.of(KernelOp.ARGLAST, new double[]{5, 3, FILL}),
        Arguments.of(KernelOp.NANARGLAST, new double[]{5, 3, FILL}),
        Arguments.of(KernelOp.MEDIAN, new double[]{2, NAN, FILL}),
        Arguments.of(KernelOp.NANMEDIAN, new double[]{2, 4, FILL}),
        Arguments.of(KernelOp.MODE, new double[]{1, NAN, FILL}),
        Arguments.of(KernelOp.NANMODE, new double[]{1, 4, FILL}));
  }

  @ParameterizedTest
  @MethodSource("kernels")
  void testKernel(KernelOp op, double[] expected) {
    double[] result = GroupedKernels.apply(op, CODES, VALUES, 3, FILL, DType.FLOAT64);
    assertArrayEqualsWithinPercentage(expected, result, op.name());
  }

  @Test
  void testAnyAll() {
    int[] codes = {0, 0, 1, 1, 2};
    double[] values = {0, 0, 0, NAN, 5};
    assertArrayEqualsWithinPercentage(new double[]{0, 1, 1, FILL},
        GroupedKernels.apply(KernelOp.ANY, codes, values, 4, FILL, DType.FLOAT64));
    assertArrayEqualsWithinPercentage(new double[]{0, 0, 1, FILL},
        GroupedKernels.apply(KernelOp.NANANY, codes, values, 4, FILL, DType.FLOAT64));
    assertArrayEqualsWithinPercentage(new double[]{0, 0, 1, FILL},
        GroupedKernels.apply(KernelOp.ALL, codes, values, 4, FILL, DType.FLOAT64));
    assertArrayEqualsWithinPercentage(new double[]{0, 0, 1, FILL},
        GroupedKernels.apply(KernelOp.NANALL, codes, values, 4, FILL, DType.FLOAT64));
  }

  @Test
  void testModeTiesPickTheSmallest() {
    int[] codes = {0, 0, 0, 0, 0};
    double[] values = {5, 2, 5, 2, 9};
    assertArrayEqualsWithinPercentage(new double[]{2},
        GroupedKernels.apply(KernelOp.MODE, codes, values, 1, FILL, DType.FLOAT64));
  }

  static Stream<Arguments> quantiles() {
    return Stream.of(
        Arguments.of(QuantileMethod.LINEAR, 0.5, 2.5),
        Arguments.of(QuantileMethod.LOWER, 0.5, 2.0),
        Arguments.of(QuantileMethod.HIGHER, 0.5, 3.0),
        Arguments.of(QuantileMethod.MIDPOINT, 0.5, 2.5),
        Arguments.of(QuantileMethod.NEAREST, 0.5, 3.0),
        Arguments.of(QuantileMethod.LINEAR, 0.25, 1.75),
        Arguments.of(QuantileMethod.LOWER, 0.25, 1.0),
        Arguments.of(QuantileMethod.HIGHER, 0.25, 2.0),
        Arguments.of(QuantileMethod.MIDPOINT, 0.25, 1.5),
        Arguments.of(QuantileMethod.NEAREST, 0.25, 2.0),
        Arguments.of(QuantileMethod.LINEAR, 1.0, 4.0),
        Arguments.of(QuantileMethod.LINEAR, 0.0, 1.0));
  }

  @ParameterizedTest
  @MethodSource("quantiles")
  void testQuantile(QuantileMethod method, double q, double expected) {
    int[] codes = {0, 0, 0, 0};
    double[] values = {4, 1, 3, 2};
    double[] result = GroupedKernels.quantile(q, method, NaNPolicy.INCLUDE)
        .apply(codes, values, 1, FILL, DType.FLOAT64);
    assertEqualsWithinPercentage(expected, result[0], PERCENTAGE, method + " " + q);
  }

  @Test
  void testQuantileNaN() {
    int[] codes = {0, 0, 1, 1};
    double[] values = {1, NAN, 2, 4};
    assertArrayEqualsWithinPercentage(new double[]{NAN, 3},
        GroupedKernels.quantile(0.5, QuantileMethod.LINEAR, NaNPolicy.INCLUDE)
            .apply(codes, values, 2, FILL, DType.FLOAT64));
    assertArrayEqualsWithinPercentage(new double[]{1, 3},
        GroupedKernels.quantile(0.5, QuantileMethod.LINEAR, NaNPolicy.EXCLUDE)
            .apply(codes, values, 2, FILL, DType.FLOAT64));
    assertThrows(GroupByConfigurationException.class,
        () -> GroupedKernels.quantile(-0.1, QuantileMethod.LINEAR, NaNPolicy.INCLUDE));
  }
}
