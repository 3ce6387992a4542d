/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

public class GroupByTestBase {
  static final double PERCENTAGE = 0.0001;

  private static boolean doublesAreEqualWithinPercentage(double expected, double actual, double percentage) {
    // doubleToLongBits will take care of returning true when both operands have same long value
    // including +ve infinity, -ve infinity or NaNs
    if (Double.doubleToLongBits(expected) != Double.doubleToLongBits(actual)) {
      if (expected != 0) {
        return Math.abs((expected - actual) / expected) <= percentage;
      } else {
        return Math.abs(expected - actual) <= percentage;
      }
    } else {
      return true;
    }
  }

  /**
   * Fails if the absolute difference between expected and actual values as a percentage of the expected
   * value is greater than the threshold
   * i.e. Math.abs((expected - actual) / expected) > percentage, if expected != 0
   * else Math.abs(expected - actual) > percentage
   */
  static void assertEqualsWithinPercentage(double expected, double actual, double percentage) {
    assertEqualsWithinPercentage(expected, actual, percentage, "");
  }

  static void assertEqualsWithinPercentage(double expected, double actual, double percentage, String message) {
    if (!doublesAreEqualWithinPercentage(expected, actual, percentage)) {
      String msg = message + " Math.abs(expected - actual)";
      String eq = (expected != 0 ?
                      " / Math.abs(expected) = " + Math.abs((expected - actual) / expected)
                    : " = " + Math.abs(expected - actual));
      fail(msg + eq + " is not <= " + percentage + " expected(" + expected + ") actual(" + actual + ")");
    }
  }

  /**
   * Element wise {@link #assertEqualsWithinPercentage}, NaN only equals NaN.
   */
  static void assertArrayEqualsWithinPercentage(double[] expected, double[] actual, String message) {
    assertEquals(expected.length, actual.length, message + " length");
    for (int i = 0; i < expected.length; i++) {
      assertEqualsWithinPercentage(expected[i], actual[i], PERCENTAGE, message + " at " + i);
    }
  }

  static void assertArrayEqualsWithinPercentage(double[] expected, double[] actual) {
    assertArrayEqualsWithinPercentage(expected, actual, "");
  }

  /**
   * The same codes as a key column of pre-factorized codes.
   */
  static KeyColumn codes(int groupCount, int... codes) {
    return KeyColumn.ofCodes(groupCount, codes);
  }

  static int[] range(int n) {
    int[] ret = new int[n];
    for (int i = 0; i < n; i++) {
      ret[i] = i;
    }
    return ret;
  }
}
