/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.List;

/**
 * The result of {@link Factorizer#factorize}: one dense code per reduced position and the
 * metadata needed to size and label the output.
 * <p>
 * With several keys the code is a row-major mixed-radix combination of the per key codes,
 * {@code code = sum(code_k * stride_k)} where {@code stride_k} is the product of the group
 * counts of the keys after {@code k}. {@link #decode(int)} and {@link #encode(int...)} convert
 * between the two.
 */
public final class FactorizedKeys {
  private final int[] codes;
  private final int groupCount;
  private final boolean sorted;
  private final boolean[] nanMask;
  private final List<List<Object>> labels;
  private final int[] groupCounts;
  private final int[] strides;

  FactorizedKeys(int[] codes, int groupCount, boolean sorted, List<List<Object>> labels,
                 int[] groupCounts, int[] strides) {
    this.codes = codes;
    this.groupCount = groupCount;
    this.sorted = sorted;
    this.labels = labels;
    this.groupCounts = groupCounts;
    this.strides = strides;
    this.nanMask = new boolean[codes.length];
    for (int i = 0; i < codes.length; i++) {
      nanMask[i] = codes[i] == Factorizer.MISSING;
    }
  }

  /**
   * A copy of the combined codes.
   */
  public int[] getCodes() {
    return codes.clone();
  }

  int[] codes() {
    return codes;
  }

  /**
   * The number of groups of the output, the product of the per key group counts.
   */
  public int getGroupCount() {
    return groupCount;
  }

  /**
   * True if codes are monotonic with the natural ordering of the labels of every key.
   */
  public boolean isSorted() {
    return sorted;
  }

  /**
   * True for every position that is excluded from all groups.
   */
  public boolean[] getNaNMask() {
    return nanMask.clone();
  }

  public int getKeyCount() {
    return groupCounts.length;
  }

  public int getGroupCount(int key) {
    return groupCounts[key];
  }

  public int[] getStrides() {
    return strides.clone();
  }

  /**
   * The labels of one key in code order.
   */
  public List<Object> getLabels(int key) {
    return labels.get(key);
  }

  /**
   * Split a combined code into the code of each key.
   */
  public int[] decode(int code) {
    Preconditions.checkConfig(code >= 0 && code < groupCount,
        () -> "code " + code + " is outside of [0, " + groupCount + ")");
    int[] ret = new int[strides.length];
    int rest = code;
    for (int k = 0; k < strides.length; k++) {
      ret[k] = rest / strides[k];
      rest %= strides[k];
    }
    return ret;
  }

  /**
   * Combine one code per key into a single code.
   */
  public int encode(int... perKeyCodes) {
    Preconditions.checkConfig(perKeyCodes.length == strides.length,
        () -> "expected " + strides.length + " codes but got " + perKeyCodes.length);
    int code = 0;
    for (int k = 0; k < strides.length; k++) {
      final int key = k;
      Preconditions.checkConfig(perKeyCodes[k] >= 0 && perKeyCodes[k] < groupCounts[k],
          () -> "code " + perKeyCodes[key] + " of key " + key + " is outside of [0, "
              + groupCounts[key] + ")");
      code += perKeyCodes[k] * strides[k];
    }
    return code;
  }

  /**
   * The label of every key for a combined code.
   */
  public Object[] labelsOf(int code) {
    int[] perKey = decode(code);
    Object[] ret = new Object[perKey.length];
    for (int k = 0; k < perKey.length; k++) {
      ret[k] = labels.get(k).get(perKey[k]);
    }
    return ret;
  }
}
