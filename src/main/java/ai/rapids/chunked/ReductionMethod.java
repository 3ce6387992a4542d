/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Locale;

/**
 * The strategies a chunked groupby reduction can be executed with.
 */
public enum ReductionMethod {
  /**
   * Let the {@link StrategySelector} pick one of the other methods.
   */
  AUTO("auto"),
  /**
   * Every group lives in a single chunk, so each chunk is reduced and finalized on its own
   * with no combine step.
   */
  BLOCKWISE("blockwise"),
  /**
   * Every chunk is reduced over all groups and the partial results are tree-combined.
   */
  MAP_REDUCE("map-reduce"),
  /**
   * Groups are clustered by the chunks they appear in and each cluster is reduced
   * independently over only those chunks.
   */
  COHORTS("cohorts");

  private final String methodName;

  ReductionMethod(String methodName) {
    this.methodName = methodName;
  }

  public String getMethodName() {
    return methodName;
  }

  boolean needsCombine() {
    return this == MAP_REDUCE || this == COHORTS;
  }

  /**
   * Parse one of "auto", "blockwise", "map-reduce" or "cohorts".
   */
  public static ReductionMethod fromName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (ReductionMethod m : values()) {
      if (m.methodName.equals(lower)) {
        return m;
      }
    }
    throw new GroupByConfigurationException("unknown reduction method " + name);
  }

  @Override
  public String toString() {
    return methodName;
  }
}
