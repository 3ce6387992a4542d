/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * An aggregation that can be used for a grouped scan along the reduced axis.
 */
public final class GroupByScanAggregation {

  enum Kind {
    CUMSUM,
    FFILL,
    BFILL
  }

  private final Kind kind;
  private final NaNPolicy nanPolicy;

  private GroupByScanAggregation(Kind kind, NaNPolicy nanPolicy) {
    this.kind = kind;
    this.nanPolicy = nanPolicy;
  }

  Kind getKind() {
    return kind;
  }

  NaNPolicy getNaNPolicy() {
    return nanPolicy;
  }

  /**
   * True if the scan runs from the end of the axis to its start.
   */
  boolean isReversed() {
    return kind == Kind.BFILL;
  }

  public String getName() {
    switch (kind) {
      case CUMSUM:
        return nanPolicy == NaNPolicy.EXCLUDE ? "nancumsum" : "cumsum";
      case FFILL:
        return "ffill";
      default:
        return "bfill";
    }
  }

  /**
   * The type of the scanned values for input of {@code inputType}.
   */
  DType getResultType(DType inputType) {
    if (kind == Kind.CUMSUM && !inputType.isFloatingPoint()) {
      return DType.INT64;
    }
    return inputType;
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + nanPolicy.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof GroupByScanAggregation) {
      GroupByScanAggregation o = (GroupByScanAggregation) other;
      return kind == o.kind && nanPolicy == o.nanPolicy;
    }
    return false;
  }

  @Override
  public String toString() {
    return getName();
  }

  /**
   * Cumulative sum, NaN propagates to every later element of the group.
   */
  public static GroupByScanAggregation sum() {
    return sum(NaNPolicy.INCLUDE);
  }

  /**
   * Cumulative sum.
   * @param nanPolicy EXCLUDE to treat NaN as zero.
   */
  public static GroupByScanAggregation sum(NaNPolicy nanPolicy) {
    return new GroupByScanAggregation(Kind.CUMSUM, nanPolicy);
  }

  /**
   * Replace NaN with the last earlier non-NaN value of the same group.
   */
  public static GroupByScanAggregation ffill() {
    return new GroupByScanAggregation(Kind.FFILL, NaNPolicy.EXCLUDE);
  }

  /**
   * Replace NaN with the next later non-NaN value of the same group.
   */
  public static GroupByScanAggregation bfill() {
    return new GroupByScanAggregation(Kind.BFILL, NaNPolicy.EXCLUDE);
  }
}
