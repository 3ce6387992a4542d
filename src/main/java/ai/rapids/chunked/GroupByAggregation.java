/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * A built-in aggregation that can be used for a chunked groupby reduction.
 * <p>
 * Every factory that takes a {@link NaNPolicy} has a nan-skipping variant selected with
 * {@link NaNPolicy#EXCLUDE}; the overloads without one propagate NaN, except for count which
 * by default only counts non-NaN values.
 */
public final class GroupByAggregation {
  private final Aggregation wrapped;

  private GroupByAggregation(Aggregation wrapped) {
    this.wrapped = wrapped;
  }

  Aggregation getWrapped() {
    return wrapped;
  }

  /**
   * The blueprint that executes this aggregation.
   */
  public AggregationBlueprint getBlueprint() {
    return wrapped.createBlueprint();
  }

  @Override
  public int hashCode() {
    return wrapped.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof GroupByAggregation) {
      GroupByAggregation o = (GroupByAggregation) other;
      return wrapped.equals(o.wrapped);
    }
    return false;
  }

  /**
   * Count number of non-NaN elements.
   */
  public static GroupByAggregation count() {
    return count(NaNPolicy.EXCLUDE);
  }

  /**
   * Count number of elements.
   * @param nanPolicy INCLUDE if NaN values should be counted. EXCLUDE if only non-NaN values
   *                  should be counted.
   */
  public static GroupByAggregation count(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.COUNT, nanPolicy));
  }

  /**
   * Sum Aggregation
   */
  public static GroupByAggregation sum() {
    return sum(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation sum(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.SUM, nanPolicy));
  }

  /**
   * Product Aggregation.
   */
  public static GroupByAggregation product() {
    return product(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation product(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.PRODUCT, nanPolicy));
  }

  /**
   * Index of max element along the reduced axis. Ties resolve to the lowest index.
   */
  public static GroupByAggregation argMax() {
    return argMax(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation argMax(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.ARGMAX, nanPolicy));
  }

  /**
   * Index of min element along the reduced axis. Ties resolve to the lowest index.
   */
  public static GroupByAggregation argMin() {
    return argMin(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation argMin(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.ARGMIN, nanPolicy));
  }

  /**
   * Min Aggregation
   */
  public static GroupByAggregation min() {
    return min(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation min(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.MIN, nanPolicy));
  }

  /**
   * Max Aggregation
   */
  public static GroupByAggregation max() {
    return max(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation max(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.MAX, nanPolicy));
  }

  /**
   * Arithmetic mean reduction.
   */
  public static GroupByAggregation mean() {
    return mean(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation mean(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.MEAN, nanPolicy));
  }

  /**
   * Variance aggregation with 0 as the delta degrees of freedom.
   */
  public static GroupByAggregation variance() {
    return variance(0, NaNPolicy.INCLUDE);
  }

  /**
   * Variance aggregation.
   * @param ddof delta degrees of freedom. The divisor used in calculation of variance is
   *             <code>N - ddof</code>, where N is the population size.
   */
  public static GroupByAggregation variance(int ddof, NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.ddof(Aggregation.Kind.VARIANCE, ddof, nanPolicy));
  }

  /**
   * Standard deviation aggregation with 0 as the delta degrees of freedom.
   */
  public static GroupByAggregation standardDeviation() {
    return standardDeviation(0, NaNPolicy.INCLUDE);
  }

  /**
   * Standard deviation aggregation.
   * @param ddof delta degrees of freedom. The divisor used in calculation of std is
   *             <code>N - ddof</code>, where N is the population size.
   */
  public static GroupByAggregation standardDeviation(int ddof, NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.ddof(Aggregation.Kind.STD, ddof, nanPolicy));
  }

  /**
   * Median reduction. Not parallelizable, so groups must not span chunks.
   */
  public static GroupByAggregation median() {
    return median(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation median(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.MEDIAN, nanPolicy));
  }

  /**
   * Aggregate to compute a quantile. Uses linear interpolation. Not parallelizable.
   */
  public static GroupByAggregation quantile(double quantile) {
    return quantile(QuantileMethod.LINEAR, quantile, NaNPolicy.INCLUDE);
  }

  /**
   * Aggregate to compute a quantile. Not parallelizable.
   */
  public static GroupByAggregation quantile(QuantileMethod method, double quantile,
                                            NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.quantile(method, quantile, nanPolicy));
  }

  /**
   * The most common value, the smallest one on ties. Not parallelizable.
   */
  public static GroupByAggregation mode() {
    return mode(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation mode(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.MODE, nanPolicy));
  }

  /**
   * The value at the lowest index of each group.
   */
  public static GroupByAggregation first() {
    return first(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation first(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.FIRST, nanPolicy));
  }

  /**
   * The value at the highest index of each group.
   */
  public static GroupByAggregation last() {
    return last(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation last(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.LAST, nanPolicy));
  }

  /**
   * True if any element of the group is non-zero. NaN counts as non-zero.
   */
  public static GroupByAggregation any() {
    return any(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation any(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.ANY, nanPolicy));
  }

  /**
   * True if every element of the group is non-zero. An empty group is true.
   */
  public static GroupByAggregation all() {
    return all(NaNPolicy.INCLUDE);
  }

  public static GroupByAggregation all(NaNPolicy nanPolicy) {
    return new GroupByAggregation(Aggregation.of(Aggregation.Kind.ALL, nanPolicy));
  }
}
