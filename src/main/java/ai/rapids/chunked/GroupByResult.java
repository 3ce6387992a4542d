/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.List;

/**
 * The per group values of one aggregation, for every row of the batch.
 */
public final class GroupByResult {
  private final String aggregationName;
  private final double[] values;
  private final int batchSize;
  private final DType type;
  private final FactorizedKeys keys;
  private final ReductionMethod method;
  private final CohortPlan plan;

  GroupByResult(String aggregationName, double[] values, int batchSize, DType type,
                FactorizedKeys keys, ReductionMethod method, CohortPlan plan) {
    this.aggregationName = aggregationName;
    this.values = values;
    this.batchSize = batchSize;
    this.type = type;
    this.keys = keys;
    this.method = method;
    this.plan = plan;
  }

  public String getAggregationName() {
    return aggregationName;
  }

  /**
   * All values, row major: the value of group {@code g} in row {@code r} is at
   * {@code r * groupCount + g}.
   */
  public double[] getValues() {
    return values.clone();
  }

  public double get(int row, int group) {
    return values[row * keys.getGroupCount() + group];
  }

  /**
   * The values of one row, indexed by group.
   */
  public double[] getRow(int row) {
    int g = keys.getGroupCount();
    double[] ret = new double[g];
    System.arraycopy(values, row * g, ret, 0, g);
    return ret;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getGroupCount() {
    return keys.getGroupCount();
  }

  public DType getType() {
    return type;
  }

  public FactorizedKeys getKeys() {
    return keys;
  }

  /**
   * The labels of one key, in code order.
   */
  public List<Object> getLabels(int key) {
    return keys.getLabels(key);
  }

  /**
   * The label of every key for a group.
   */
  public Object[] getGroupLabels(int group) {
    return keys.labelsOf(group);
  }

  /**
   * The method the reduction actually ran with.
   */
  public ReductionMethod getMethod() {
    return method;
  }

  public CohortPlan getPlan() {
    return plan;
  }

  @Override
  public String toString() {
    return "GroupByResult{" + aggregationName + ", " + type + ", groups=" + getGroupCount()
        + ", batch=" + batchSize + ", method=" + method + "}";
  }
}
