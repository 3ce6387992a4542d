/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw group-by keys into a single array of dense integer codes.
 * <p>
 * Each key is factorized on its own, either against its {@link ExpectedGroups} or against
 * the distinct values found in the data, and the per key codes are then combined with a
 * row-major mixed-radix encoding. A position that is missing in any key gets
 * {@link #MISSING} and is excluded from every group.
 * <p>
 * <b>Usage pattern:</b>
 * <pre>{@code
 * FactorizedKeys keys = Factorizer.factorize(
 *     Arrays.asList(KeyColumn.ofObjects("a", "b", "a"), KeyColumn.ofInts(1, 1, 2)),
 *     Collections.emptyList(), SortPolicy.SORTED);
 * int[] codes = keys.getCodes();  // [0, 2, 1]
 * }</pre>
 */
public final class Factorizer {
  private static final Logger log = LoggerFactory.getLogger(Factorizer.class);

  /**
   * The code of a position that belongs to no group.
   */
  public static final int MISSING = -1;

  private Factorizer() {
  }

  /**
   * Factorize keys without checking them against a data length.
   * @param keys one or more key columns of the same length.
   * @param expected empty, or one entry per key.
   * @param sortPolicy how codes are assigned for keys without expected groups.
   */
  public static FactorizedKeys factorize(List<KeyColumn> keys, List<ExpectedGroups> expected,
                                         SortPolicy sortPolicy) {
    Preconditions.checkConfig(!keys.isEmpty(), () -> "at least one key is required");
    return factorize(keys, expected, sortPolicy, keys.get(0).getLength());
  }

  /**
   * Factorize keys that must each have {@code axisLength} values, the reduced length of the
   * data they group.
   */
  public static FactorizedKeys factorize(List<KeyColumn> keys, List<ExpectedGroups> expected,
                                         SortPolicy sortPolicy, int axisLength) {
    Preconditions.checkConfig(!keys.isEmpty(), () -> "at least one key is required");
    Preconditions.checkConfig(expected.isEmpty() || expected.size() == keys.size(),
        () -> "got " + expected.size() + " expected groups for " + keys.size() + " keys");
    for (int k = 0; k < keys.size(); k++) {
      final int key = k;
      Preconditions.checkConfig(keys.get(k).getLength() == axisLength,
          () -> "key " + key + " has " + keys.get(key).getLength()
              + " values but the reduced axis has " + axisLength);
    }

    int nkeys = keys.size();
    int[][] perKeyCodes = new int[nkeys][];
    List<List<Object>> labels = new ArrayList<>(nkeys);
    int[] groupCounts = new int[nkeys];
    boolean sorted = true;
    for (int k = 0; k < nkeys; k++) {
      ExpectedGroups eg = expected.isEmpty() ? ExpectedGroups.none() : expected.get(k);
      KeyFactors factors = factorizeKey(k, keys.get(k), eg, sortPolicy);
      perKeyCodes[k] = factors.codes;
      labels.add(factors.labels);
      groupCounts[k] = factors.labels.size();
      sorted &= factors.sorted;
    }

    int[] strides = new int[nkeys];
    int groupCount;
    try {
      int stride = 1;
      for (int k = nkeys - 1; k >= 0; k--) {
        strides[k] = stride;
        stride = Math.multiplyExact(stride, groupCounts[k]);
      }
      groupCount = stride;
    } catch (ArithmeticException e) {
      throw new GroupByConfigurationException("too many combined groups for group counts "
          + Arrays.toString(groupCounts), e);
    }

    int[] codes;
    if (nkeys == 1) {
      codes = perKeyCodes[0];
    } else {
      codes = new int[axisLength];
      for (int i = 0; i < axisLength; i++) {
        int code = 0;
        for (int k = 0; k < nkeys; k++) {
          int c = perKeyCodes[k][i];
          if (c == MISSING) {
            code = MISSING;
            break;
          }
          code += c * strides[k];
        }
        codes[i] = code;
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("factorized {} key(s) of length {} into {} groups (sorted={})", nkeys,
          axisLength, groupCount, sorted);
    }
    return new FactorizedKeys(codes, groupCount, sorted, Collections.unmodifiableList(labels),
        groupCounts, strides);
  }

  private static final class KeyFactors {
    final int[] codes;
    final List<Object> labels;
    final boolean sorted;

    KeyFactors(int[] codes, List<Object> labels, boolean sorted) {
      this.codes = codes;
      this.labels = labels;
      this.sorted = sorted;
    }
  }

  private static KeyFactors factorizeKey(int keyIndex, KeyColumn key, ExpectedGroups expected,
                                         SortPolicy sortPolicy) {
    int n = key.getLength();
    int[] codes = new int[n];
    if (key instanceof KeyColumn.CodeKeys) {
      Preconditions.checkConfig(expected.isNone(),
          () -> "key " + keyIndex + " is already made of codes and cannot take expected groups");
      KeyColumn.CodeKeys codeKeys = (KeyColumn.CodeKeys) key;
      for (int i = 0; i < n; i++) {
        codes[i] = codeKeys.code(i);
      }
      List<Object> labels = new ArrayList<>(codeKeys.getGroupCount());
      for (int g = 0; g < codeKeys.getGroupCount(); g++) {
        labels.add(g);
      }
      return new KeyFactors(codes, Collections.unmodifiableList(labels), true);
    }

    switch (expected.getKind()) {
      case BINS: {
        Preconditions.checkConfig(key.isNumeric(),
            () -> "key " + keyIndex + " is not numeric and cannot be binned");
        for (int i = 0; i < n; i++) {
          codes[i] = expected.binOf(key.getDouble(i));
        }
        return new KeyFactors(codes, expected.getLabels(), true);
      }
      case LABELS: {
        Map<Object, Integer> positions = new HashMap<>();
        List<Object> normalized = new ArrayList<>(expected.size());
        List<Object> labels = expected.getLabels();
        for (int p = 0; p < labels.size(); p++) {
          Object norm = key.normalize(labels.get(p));
          normalized.add(norm);
          if (norm != null) {
            final int pos = p;
            Integer prev = positions.put(norm, p);
            Preconditions.checkConfig(prev == null,
                () -> "expected label " + labels.get(pos) + " of key " + keyIndex
                    + " is a duplicate");
          }
        }
        for (int i = 0; i < n; i++) {
          if (key.isMissing(i)) {
            codes[i] = MISSING;
          } else {
            Integer pos = positions.get(key.get(i));
            codes[i] = pos == null ? MISSING : pos;
          }
        }
        return new KeyFactors(codes, labels, isMonotonic(normalized, key.ordering()));
      }
      default: {
        Map<Object, Integer> found;
        if (sortPolicy == SortPolicy.SORTED) {
          found = new TreeMap<>(key.ordering());
        } else {
          found = new LinkedHashMap<>();
        }
        for (int i = 0; i < n; i++) {
          if (!key.isMissing(i)) {
            found.putIfAbsent(key.get(i), 0);
          }
        }
        Preconditions.checkData(!found.isEmpty(),
            () -> "key " + keyIndex + " has no valid values and no expected groups were given,"
                + " so the number of groups is unknown");
        List<Object> labels = new ArrayList<>(found.size());
        int next = 0;
        for (Map.Entry<Object, Integer> e : found.entrySet()) {
          e.setValue(next++);
          labels.add(e.getKey());
        }
        for (int i = 0; i < n; i++) {
          codes[i] = key.isMissing(i) ? MISSING : found.get(key.get(i));
        }
        boolean sorted = sortPolicy == SortPolicy.SORTED || isMonotonic(labels, key.ordering());
        return new KeyFactors(codes, Collections.unmodifiableList(labels), sorted);
      }
    }
  }

  private static boolean isMonotonic(List<Object> labels, Comparator<Object> ordering) {
    try {
      for (int i = 1; i < labels.size(); i++) {
        Object prev = labels.get(i - 1);
        Object cur = labels.get(i);
        if (prev == null || cur == null || ordering.compare(prev, cur) > 0) {
          return false;
        }
      }
      return true;
    } catch (GroupByConfigurationException e) {
      // labels of mixed types have no natural ordering
      return false;
    }
  }
}
