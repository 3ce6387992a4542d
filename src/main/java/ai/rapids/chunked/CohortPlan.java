/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.Collections;
import java.util.List;

/**
 * The result of cohort detection for one set of codes and one chunk layout. Immutable and
 * safe to share between reductions.
 */
public final class CohortPlan {
  private final List<Cohort> cohorts;
  private final int groupCount;
  private final int chunkCount;
  private final int[][] chunkMembers;
  private final int[][] groupChunks;
  private final boolean blockwiseFeasible;
  private final ReductionMethod preferred;

  CohortPlan(List<Cohort> cohorts, int groupCount, int chunkCount, int[][] chunkMembers,
             int[][] groupChunks, boolean blockwiseFeasible, ReductionMethod preferred) {
    this.cohorts = Collections.unmodifiableList(cohorts);
    this.groupCount = groupCount;
    this.chunkCount = chunkCount;
    this.chunkMembers = chunkMembers;
    this.groupChunks = groupChunks;
    this.blockwiseFeasible = blockwiseFeasible;
    this.preferred = preferred;
  }

  /**
   * The cohorts, ordered by their smallest group code.
   */
  public List<Cohort> getCohorts() {
    return cohorts;
  }

  public int getCohortCount() {
    return cohorts.size();
  }

  public int getGroupCount() {
    return groupCount;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  /**
   * The distinct groups present in a chunk, in increasing order.
   */
  public int[] getChunkMembers(int chunkId) {
    return chunkMembers[chunkId].clone();
  }

  /**
   * The chunks holding an element of a group, in increasing order. Empty for a group that
   * never occurs.
   */
  public int[] getGroupChunks(int group) {
    return groupChunks[group].clone();
  }

  /**
   * The number of groups with at least one element.
   */
  public int getNonEmptyGroupCount() {
    int ret = 0;
    for (int[] chunks : groupChunks) {
      if (chunks.length > 0) {
        ret++;
      }
    }
    return ret;
  }

  public double getAverageChunksPerCohort() {
    if (cohorts.isEmpty()) {
      return 0;
    }
    long total = 0;
    for (Cohort c : cohorts) {
      total += c.getChunkCount();
    }
    return (double) total / cohorts.size();
  }

  /**
   * The fraction of (group, chunk) pairs, over non-empty groups, where the group occurs in
   * the chunk.
   */
  public double getDensity() {
    int nonEmpty = getNonEmptyGroupCount();
    if (nonEmpty == 0 || chunkCount == 0) {
      return 0;
    }
    long total = 0;
    for (int[] chunks : groupChunks) {
      total += chunks.length;
    }
    return (double) total / ((double) nonEmpty * chunkCount);
  }

  /**
   * True if every non-empty chunk belongs to exactly one cohort and every cohort lives in
   * exactly one chunk, so no group needs a combine step.
   */
  public boolean isBlockwiseFeasible() {
    return blockwiseFeasible;
  }

  /**
   * The method the planner would pick: BLOCKWISE, COHORTS or MAP_REDUCE.
   */
  public ReductionMethod getPreferredMethod() {
    return preferred;
  }

  @Override
  public String toString() {
    return "CohortPlan{groups=" + groupCount + ", chunks=" + chunkCount
        + ", preferred=" + preferred + ", cohorts=" + cohorts + "}";
  }
}
