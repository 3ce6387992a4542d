/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Options for a {@link GroupBy} reduction.
 */
public final class ReductionOptions {

  public static final ReductionOptions DEFAULT = new ReductionOptions(new Builder());

  private final ReductionMethod method;
  private final List<ExpectedGroups> expectedGroups;
  private final Double fillValue;
  private final DType dtype;
  private final Integer minCount;
  private final int cohortMergeThreshold;
  private final SortPolicy sortPolicy;
  private final int combineFanIn;
  private final ExecutionEngine engine;
  private final CohortCache cohortCache;

  private ReductionOptions(Builder builder) {
    method = builder.method;
    expectedGroups = Collections.unmodifiableList(new ArrayList<>(builder.expectedGroups));
    fillValue = builder.fillValue;
    dtype = builder.dtype;
    minCount = builder.minCount;
    cohortMergeThreshold = builder.cohortMergeThreshold;
    sortPolicy = builder.sortPolicy;
    combineFanIn = builder.combineFanIn;
    engine = builder.engine;
    cohortCache = builder.cohortCache;
  }

  public ReductionMethod getMethod() {
    return method;
  }

  /**
   * Empty, or one entry per key.
   */
  public List<ExpectedGroups> getExpectedGroups() {
    return expectedGroups;
  }

  /**
   * The fill value for groups without enough contributions, or null to use the
   * aggregation's own.
   */
  public Double getFillValue() {
    return fillValue;
  }

  /**
   * The result type, or null to use the aggregation's own.
   */
  public DType getDType() {
    return dtype;
  }

  /**
   * The minimum number of contributing elements per group, or null to use the
   * aggregation's own.
   */
  public Integer getMinCount() {
    return minCount;
  }

  public int getCohortMergeThreshold() {
    return cohortMergeThreshold;
  }

  public SortPolicy getSortPolicy() {
    return sortPolicy;
  }

  public int getCombineFanIn() {
    return combineFanIn;
  }

  public ExecutionEngine getEngine() {
    return engine;
  }

  /**
   * The cache plans are looked up in, or null to plan every reduction from scratch.
   */
  public CohortCache getCohortCache() {
    return cohortCache;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.method = method;
    b.expectedGroups = new ArrayList<>(expectedGroups);
    b.fillValue = fillValue;
    b.dtype = dtype;
    b.minCount = minCount;
    b.cohortMergeThreshold = cohortMergeThreshold;
    b.sortPolicy = sortPolicy;
    b.combineFanIn = combineFanIn;
    b.engine = engine;
    b.cohortCache = cohortCache;
    return b;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "ReductionOptions{method=" + method + ", expectedGroups=" + expectedGroups
        + ", fillValue=" + fillValue + ", dtype=" + dtype + ", minCount=" + minCount
        + ", mergeThreshold=" + cohortMergeThreshold + ", sortPolicy=" + sortPolicy
        + ", fanIn=" + combineFanIn + "}";
  }

  public static final class Builder {
    private ReductionMethod method = ReductionMethod.AUTO;
    private List<ExpectedGroups> expectedGroups = new ArrayList<>();
    private Double fillValue = null;
    private DType dtype = null;
    private Integer minCount = null;
    private int cohortMergeThreshold = 0;
    private SortPolicy sortPolicy = SortPolicy.SORTED;
    private int combineFanIn = ReductionExecutor.DEFAULT_FAN_IN;
    private ExecutionEngine engine = SerialExecutionEngine.INSTANCE;
    private CohortCache cohortCache = null;

    /**
     * The reduction method. The default, AUTO, lets the {@link StrategySelector} choose.
     */
    public Builder withMethod(ReductionMethod method) {
      this.method = Objects.requireNonNull(method, "method");
      return this;
    }

    /**
     * One of "auto", "blockwise", "map-reduce" or "cohorts".
     */
    public Builder withMethod(String method) {
      return withMethod(ReductionMethod.fromName(method));
    }

    /**
     * The groups to expect for each key, in key order. Groups that do not occur in the
     * data still get an output slot, holding the fill value.
     */
    public Builder withExpectedGroups(ExpectedGroups... expectedGroups) {
      this.expectedGroups = new ArrayList<>(Arrays.asList(expectedGroups));
      return this;
    }

    /**
     * The value of groups without enough contributing elements.
     */
    public Builder withFillValue(double fillValue) {
      this.fillValue = fillValue;
      return this;
    }

    /**
     * Cast the results to this type. Integral types truncate toward zero.
     */
    public Builder withDType(DType dtype) {
      this.dtype = dtype;
      return this;
    }

    /**
     * Groups with fewer contributing elements get the fill value.
     */
    public Builder withMinCount(int minCount) {
      Preconditions.checkConfig(minCount >= 0,
          () -> "min count must not be negative, got " + minCount);
      this.minCount = minCount;
      return this;
    }

    /**
     * Merge cohorts whose chunk sets differ by at most this many chunks. The default, 0,
     * only groups identical chunk sets.
     */
    public Builder withCohortMergeThreshold(int threshold) {
      Preconditions.checkConfig(threshold >= 0,
          () -> "merge threshold must not be negative, got " + threshold);
      this.cohortMergeThreshold = threshold;
      return this;
    }

    public Builder withSortPolicy(SortPolicy sortPolicy) {
      this.sortPolicy = Objects.requireNonNull(sortPolicy, "sortPolicy");
      return this;
    }

    /**
     * How many partial results a combine task merges. Defaults to 4, or the
     * ai.rapids.chunked.combine.fanIn system property.
     */
    public Builder withCombineFanIn(int fanIn) {
      Preconditions.checkConfig(fanIn >= 2, () -> "combine fan-in must be at least 2, got "
          + fanIn);
      this.combineFanIn = fanIn;
      return this;
    }

    public Builder withEngine(ExecutionEngine engine) {
      this.engine = Objects.requireNonNull(engine, "engine");
      return this;
    }

    public Builder withCohortCache(CohortCache cohortCache) {
      this.cohortCache = cohortCache;
      return this;
    }

    public ReductionOptions build() {
      return new ReductionOptions(this);
    }
  }
}
